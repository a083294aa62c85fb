/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Laue project.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.laue.symmetry;

import static java.lang.Math.PI;
import static java.lang.Math.cbrt;
import static java.lang.Math.sin;

import java.util.List;
import java.util.Random;

import javax.vecmath.Matrix3d;
import javax.vecmath.Matrix3f;

import com.hellblazer.laue.orientation.AxisAngle;
import com.hellblazer.laue.orientation.BatchConfig;
import com.hellblazer.laue.orientation.Euler;
import com.hellblazer.laue.orientation.OrientationArray;
import com.hellblazer.laue.orientation.OrientationException;
import com.hellblazer.laue.orientation.OrientationTransforms;
import com.hellblazer.laue.orientation.Quaternion;
import com.hellblazer.laue.orientation.QuaternionLayout;
import com.hellblazer.laue.orientation.Rodrigues;

/**
 * The eleven Laue classes. Each carries the rotation operators of its proper point group in three synchronized forms
 * (quaternion, matrix and Rodrigues vector, indexed identically) and the constants of its ODF and MDF histograms,
 * which are binned on a regular grid in homochoric space.
 * <p>
 * Constants are declared in the conventional crystal structure order, so {@link #ordinal()} is the crystal structure
 * index used by EBSD file formats.
 * <p>
 * All tables are built once and never mutated. Every operation is a pure function of its arguments and the tables, so
 * instances are safe to share across threads.
 *
 * @author hal.hildebrand
 */
public enum LaueClass {
    HEXAGONAL("Hexagonal 6/mmm", SymmetryTables.HEXAGONAL, new int[] { 36, 36, 12 },
              new double[] { PI / 2, PI / 2, PI / 6 }, 36, SymmetryTables.HEXAGONAL_POLES),
    CUBIC("Cubic m3m", SymmetryTables.CUBIC, new int[] { 18, 18, 18 }, new double[] { PI / 4, PI / 4, PI / 4 }, 13,
          SymmetryTables.CUBIC_POLES),
    HEXAGONAL_LOW("Hexagonal 6/m", SymmetryTables.HEXAGONAL_LOW, new int[] { 36, 36, 12 },
                  new double[] { PI / 2, PI / 2, PI / 6 }, 36, SymmetryTables.HEXAGONAL_POLES),
    CUBIC_LOW("Cubic m3 (Tetrahedral)", SymmetryTables.CUBIC_LOW, new int[] { 36, 36, 36 },
              new double[] { PI / 2, PI / 2, PI / 2 }, 18, SymmetryTables.CUBIC_POLES),
    TRICLINIC("Triclinic -1", SymmetryTables.TRICLINIC, new int[] { 72, 72, 72 }, new double[] { PI, PI, PI }, 36,
              SymmetryTables.AXIS_POLES),
    MONOCLINIC("Monoclinic 2/m", SymmetryTables.MONOCLINIC, new int[] { 72, 36, 72 },
               new double[] { PI, PI / 2, PI }, 36, SymmetryTables.AXIS_POLES),
    ORTHORHOMBIC("OrthoRhombic mmm", SymmetryTables.ORTHORHOMBIC, new int[] { 36, 36, 36 },
                 new double[] { PI / 2, PI / 2, PI / 2 }, 36, SymmetryTables.AXIS_POLES),
    TETRAGONAL_LOW("Tetragonal 4/m", SymmetryTables.TETRAGONAL_LOW, new int[] { 36, 36, 18 },
                   new double[] { PI / 2, PI / 2, PI / 4 }, 20, SymmetryTables.TETRAGONAL_POLES),
    TETRAGONAL("Tetragonal 4/mmm", SymmetryTables.TETRAGONAL, new int[] { 36, 36, 18 },
               new double[] { PI / 2, PI / 2, PI / 4 }, 20, SymmetryTables.TETRAGONAL_POLES),
    TRIGONAL_LOW("Trigonal -3", SymmetryTables.TRIGONAL_LOW, new int[] { 72, 72, 24 },
                 new double[] { PI, PI, PI / 3 }, 36, SymmetryTables.HEXAGONAL_POLES),
    TRIGONAL("Trigonal -3m", SymmetryTables.TRIGONAL, new int[] { 72, 72, 24 }, new double[] { PI, PI, PI / 3 }, 36,
             SymmetryTables.HEXAGONAL_POLES);

    /** Finite stand in for the infinite Rodrigues length of a half turn */
    static final double INFINITE_ROD_LENGTH = 1.0e10;

    private static final double HALF_TURN_TOLERANCE = 1.0e-12;

    /**
     * Half width of the homochoric cube that holds the fundamental zone of the given rotation angle
     */
    private static double homochoricHalfWidth(double angle) {
        return cbrt(0.75 * (angle - sin(angle)));
    }

    private static double[] rodriguesOperator(double[] q) {
        var w = q[3];
        if (Math.abs(w) < HALF_TURN_TOLERANCE) {
            var n = Math.sqrt(q[0] * q[0] + q[1] * q[1] + q[2] * q[2]);
            return new double[] { INFINITE_ROD_LENGTH * q[0] / n, INFINITE_ROD_LENGTH * q[1] / n,
                                  INFINITE_ROD_LENGTH * q[2] / n };
        }
        return new double[] { q[0] / w, q[1] / w, q[2] / w };
    }

    private final String             symmetryName;
    private final Quaternion[]       quatOps;
    private final Matrix3d[]         matOps;
    private final double[][]         rodOps;
    private final int[]              odfNumBins;
    private final double[]           odfDimInitValue;
    private final double[]           odfDimStepValue;
    private final int                mdfPlotBins;
    private final List<PoleFamily>   poleFamilies;

    LaueClass(String symmetryName, double[][] quaternions, int[] odfNumBins, double[] binAngles, int mdfPlotBins,
              PoleFamily[] poleFamilies) {
        this.symmetryName = symmetryName;
        this.quatOps = new Quaternion[quaternions.length];
        this.matOps = new Matrix3d[quaternions.length];
        this.rodOps = new double[quaternions.length][];
        for (int i = 0; i < quaternions.length; i++) {
            var q = quaternions[i];
            quatOps[i] = new Quaternion(q[0], q[1], q[2], q[3]);
            matOps[i] = new Matrix3d(OrientationTransforms.DOUBLE.qu2om(q, QuaternionLayout.VECTOR_SCALAR));
            rodOps[i] = rodriguesOperator(q);
        }
        this.odfNumBins = odfNumBins;
        this.odfDimInitValue = new double[3];
        this.odfDimStepValue = new double[3];
        for (int i = 0; i < 3; i++) {
            odfDimInitValue[i] = homochoricHalfWidth(binAngles[i]);
            odfDimStepValue[i] = odfDimInitValue[i] / (odfNumBins[i] / 2.0);
        }
        this.mdfPlotBins = mdfPlotBins;
        this.poleFamilies = List.of(poleFamilies);
    }

    /**
     * Disorientation between two orientations: the smallest rotation over the symmetric equivalents of q1 * q2^-1,
     * as axis-angle with the angle in [0, pi].
     */
    public AxisAngle calculateMisorientation(Quaternion q1, Quaternion q2) {
        return Misorientations.misorientation(this, q1, q2);
    }

    /**
     * Double precision disorientation of two packed quaternions
     *
     * @return the axis-angle tuple (x, y, z, angle)
     */
    public double[] calculateMisorientation(double[] q1, double[] q2, QuaternionLayout layout) {
        return calculateMisorientation(Quaternion.of(q1, layout), Quaternion.of(q2, layout)).toArray();
    }

    /**
     * Single precision disorientation of two packed quaternions. The computation is carried out in double precision
     * and rounded once.
     *
     * @return the axis-angle tuple (x, y, z, angle)
     */
    public float[] calculateMisorientation(float[] q1, float[] q2, QuaternionLayout layout) {
        var ax = calculateMisorientation(Quaternion.of(q1, layout), Quaternion.of(q2, layout));
        return new float[] { (float) ax.x(), (float) ax.y(), (float) ax.z(), (float) ax.angle() };
    }

    /**
     * Draw an orientation from ODF bin {@code choose}, at the relative position {@code random} inside the bin, reduced
     * into the fundamental zone
     *
     * @param random three values in [0, 1)
     * @param choose the bin index, in [0, {@link #getOdfSize()})
     */
    public Euler determineEulerAngles(double[] random, int choose) {
        return OdfBinning.determineEulerAngles(this, random, choose);
    }

    /**
     * Draw a misorientation from MDF bin {@code choose}, at the relative position {@code random} inside the bin,
     * reduced into the misorientation fundamental zone
     */
    public Rodrigues determineRodriguesVector(double[] random, int choose) {
        return OdfBinning.determineRodriguesVector(this, random, choose);
    }

    /**
     * Pole sphere coordinates of every orientation, with the default batch configuration
     *
     * @see #generateSphereCoordsFromEulers(OrientationArray, BatchConfig)
     */
    public float[][] generateSphereCoordsFromEulers(OrientationArray eulers) throws OrientationException {
        return generateSphereCoordsFromEulers(eulers, new BatchConfig());
    }

    /**
     * Compute, for every orientation g and every direction d of every pole family, the sample frame pole g^T d and its
     * antipode. The result has one array per {@link #getPoleFamilies() pole family}; orientation i occupies the slots
     * [i * 6n, (i + 1) * 6n) of a family with n directions.
     *
     * @param eulers Bunge Euler angles in radians
     * @throws OrientationException if the array does not hold Euler angles
     */
    public float[][] generateSphereCoordsFromEulers(OrientationArray eulers, BatchConfig config)
    throws OrientationException {
        return SphereCoordinates.generate(this, eulers, config);
    }

    /**
     * Reduce a misorientation into the MDF fundamental zone of this class
     */
    public Rodrigues getMDFFZRod(Rodrigues rod) {
        return FundamentalZones.mdfFundamentalZone(this, rod);
    }

    /**
     * @return the operator as a 3x3 matrix, a fresh copy
     */
    public Matrix3d getMatSymOp(int i) {
        checkIndex(i);
        return new Matrix3d(matOps[i]);
    }

    /**
     * @return the operator as a single precision 3x3 matrix
     */
    public Matrix3f getMatSymOpF(int i) {
        checkIndex(i);
        return new Matrix3f(matOps[i]);
    }

    public int getMdfPlotBins() {
        return mdfPlotBins;
    }

    public int getMdfSize() {
        return getOdfSize();
    }

    /**
     * Homochoric bin of a misorientation, which should already lie in the MDF fundamental zone
     *
     * @return the bin index, in [0, {@link #getMdfSize()})
     */
    public int getMisoBin(Rodrigues rod) {
        return OdfBinning.bin(this, rod);
    }

    /**
     * Single precision variant of {@link #getNearestQuat(Quaternion, Quaternion)} for packed quaternions
     */
    public float[] getNearestQuat(float[] q1, float[] q2, QuaternionLayout layout) {
        var nearest = getNearestQuat(Quaternion.of(q1, layout), Quaternion.of(q2, layout)).toArray(layout);
        var result = new float[4];
        for (int i = 0; i < 4; i++) {
            result[i] = (float) nearest[i];
        }
        return result;
    }

    /**
     * @return the symmetric equivalent of q2, with non-negative scalar part, closest to q1
     */
    public Quaternion getNearestQuat(Quaternion q1, Quaternion q2) {
        return Misorientations.nearestQuaternion(this, q1, q2);
    }

    /**
     * @return the symmetric equivalent of q with the largest non-negative scalar part
     */
    public Quaternion getFZQuat(Quaternion q) {
        return Misorientations.fundamentalZoneQuaternion(this, q);
    }

    public int getNumSymOps() {
        return quatOps.length;
    }

    /**
     * Slip transmission factor m' between two grains of the cubic {111}&lt;110&gt; slip systems, each grain using its
     * system with the highest Schmid factor for the load direction
     *
     * @throws UnsupportedSymmetryOperationException for every class but {@link #CUBIC}
     */
    public double getmPrime(Quaternion q1, Quaternion q2, double[] loadDirection) {
        requireCubic("mPrime");
        return SlipSystems.mPrime(q1, q2, loadDirection);
    }

    /**
     * Homochoric bin of an orientation, which should already lie in the ODF fundamental zone
     *
     * @return the bin index, in [0, {@link #getOdfSize()})
     */
    public int getOdfBin(Rodrigues rod) {
        return OdfBinning.bin(this, rod);
    }

    /**
     * @return the half widths of the homochoric binning cube, per axis
     */
    public double[] getOdfDimInitValue() {
        return odfDimInitValue.clone();
    }

    /**
     * @return the edge lengths of one homochoric bin, per axis
     */
    public double[] getOdfDimStepValue() {
        return odfDimStepValue.clone();
    }

    public int[] getOdfNumBins() {
        return odfNumBins.clone();
    }

    public int getOdfSize() {
        return odfNumBins[0] * odfNumBins[1] * odfNumBins[2];
    }

    /**
     * Reduce an orientation into the ODF fundamental zone of this class: the symmetric equivalent whose Rodrigues
     * vector lies closest to the origin
     */
    public Rodrigues getODFFZRod(Rodrigues rod) {
        return FundamentalZones.odfFundamentalZone(this, rod);
    }

    public List<PoleFamily> getPoleFamilies() {
        return poleFamilies;
    }

    public Quaternion getQuatSymOp(int i) {
        checkIndex(i);
        return quatOps[i];
    }

    /**
     * @return the operator as a Rodrigues vector, axis times tan(angle / 2). Half turns carry the finite stand in
     *         length {@value #INFINITE_ROD_LENGTH}.
     */
    public double[] getRodSymOp(int i) {
        checkIndex(i);
        return rodOps[i].clone();
    }

    /**
     * Schmid factor of the cubic {111}&lt;110&gt; slip system most favourably oriented for the load direction, given
     * in the crystal frame. The plane and direction components of the result are the absolute cosines between the
     * load and the slip plane normal and slip direction.
     *
     * @throws UnsupportedSymmetryOperationException for every class but {@link #CUBIC}
     */
    public SchmidFactor getSchmidFactorAndSS(double[] load) {
        requireCubic("Load only Schmid factor");
        return SlipSystems.cubicSchmidFactor(load);
    }

    /**
     * Schmid factor of one slip system over its symmetric equivalents. Equivalents whose plane normal points into the
     * lower hemisphere are skipped. The plane and direction components of the result are the angles, in radians,
     * between the load and the equivalent plane normal and slip direction; the slip system is the operator index.
     */
    public SchmidFactor getSchmidFactorAndSS(double[] load, double[] plane, double[] direction) {
        return SlipSystems.schmidFactor(this, load, plane, direction);
    }

    public String getSymmetryName() {
        return symmetryName;
    }

    /**
     * @return true, as every Laue group contains the inversion
     */
    public boolean hasInversion() {
        return true;
    }

    /**
     * Replace the orientation with a randomly chosen symmetric equivalent
     */
    public Euler randomizeEulerAngles(Euler eu, Random random) {
        return OdfBinning.randomizeEulerAngles(this, eu, random);
    }

    @Override
    public String toString() {
        return symmetryName;
    }

    double[] dimInit() {
        return odfDimInitValue;
    }

    double[] dimStep() {
        return odfDimStepValue;
    }

    int[] numBins() {
        return odfNumBins;
    }

    Quaternion quatOp(int i) {
        return quatOps[i];
    }

    Matrix3d matOp(int i) {
        return matOps[i];
    }

    double[] rodOp(int i) {
        return rodOps[i];
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= quatOps.length) {
            throw new IllegalArgumentException(
            "Symmetry operator " + i + " out of range [0, " + quatOps.length + ") for " + symmetryName);
        }
    }

    private void requireCubic(String operation) {
        if (this != CUBIC) {
            throw new UnsupportedSymmetryOperationException(this, operation);
        }
    }
}
