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

import java.util.Objects;
import java.util.Random;

import com.hellblazer.laue.orientation.Euler;
import com.hellblazer.laue.orientation.OrientationTransforms;
import com.hellblazer.laue.orientation.Quaternion;
import com.hellblazer.laue.orientation.QuaternionLayout;
import com.hellblazer.laue.orientation.Rodrigues;

/**
 * ODF and MDF histogram bins. A bin is a cell of the regular grid over the homochoric cube [-dim, dim]^3 of a Laue
 * class, indexed x fastest.
 *
 * @author hal.hildebrand
 */
final class OdfBinning {
    private static final OrientationTransforms TRANSFORMS = OrientationTransforms.DOUBLE;

    static int bin(LaueClass laue, Rodrigues rod) {
        Objects.requireNonNull(rod, "rod");
        var ho = TRANSFORMS.ro2ho(rod.toArray());
        var dim = laue.dimInit();
        var step = laue.dimStep();
        var bins = laue.numBins();
        var index = new int[3];
        for (int i = 0; i < 3; i++) {
            var b = (int) Math.floor((ho[i] + dim[i]) / step[i]);
            index[i] = Math.max(0, Math.min(bins[i] - 1, b));
        }
        return index[0] + index[1] * bins[0] + index[2] * bins[0] * bins[1];
    }

    static Euler determineEulerAngles(LaueClass laue, double[] random, int choose) {
        var ro = TRANSFORMS.ho2ro(homochoricSample(laue, random, choose));
        return Euler.of(TRANSFORMS.ro2eu(laue.getODFFZRod(Rodrigues.of(ro)).toArray()));
    }

    static Rodrigues determineRodriguesVector(LaueClass laue, double[] random, int choose) {
        var ro = TRANSFORMS.ho2ro(homochoricSample(laue, random, choose));
        return laue.getMDFFZRod(Rodrigues.of(ro));
    }

    static Euler randomizeEulerAngles(LaueClass laue, Euler eu, Random random) {
        Objects.requireNonNull(eu, "eu");
        var op = laue.quatOp(random.nextInt(laue.getNumSymOps()));
        var q = Quaternion.of(TRANSFORMS.eu2qu(eu.toArray()), QuaternionLayout.VECTOR_SCALAR);
        var rotated = op.multiply(q);
        return Euler.of(TRANSFORMS.qu2eu(rotated.positive().toArray()));
    }

    /**
     * The homochoric point at relative position random inside bin choose
     */
    private static double[] homochoricSample(LaueClass laue, double[] random, int choose) {
        Objects.requireNonNull(random, "random");
        if (random.length != 3) {
            throw new IllegalArgumentException("Expected 3 random values, got " + random.length);
        }
        if (choose < 0 || choose >= laue.getOdfSize()) {
            throw new IllegalArgumentException(
            "Bin " + choose + " out of range [0, " + laue.getOdfSize() + ") for " + laue.getSymmetryName());
        }
        var bins = laue.numBins();
        var init = laue.dimInit();
        var step = laue.dimStep();
        var cell = new int[] { choose % bins[0], (choose / bins[0]) % bins[1], choose / (bins[0] * bins[1]) };
        var h = new double[3];
        for (int i = 0; i < 3; i++) {
            h[i] = step[i] * cell[i] + step[i] * random[i] - init[i];
        }
        return h;
    }

    private OdfBinning() {
    }
}
