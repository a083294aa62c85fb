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
package com.hellblazer.laue.orientation;

import java.util.Arrays;

import javax.vecmath.Matrix3d;
import javax.vecmath.Matrix3f;

/**
 * Row major 3x3 orientation matrix. A valid matrix is orthogonal with determinant +1.
 *
 * @author hal.hildebrand
 */
public final class OrientationMatrix implements Orientation {
    public static final OrientationMatrix IDENTITY = new OrientationMatrix(new double[] { 1, 0, 0, 0, 1, 0, 0, 0, 1 });

    public static OrientationMatrix of(Matrix3d m) {
        return new OrientationMatrix(new double[] { m.m00, m.m01, m.m02, m.m10, m.m11, m.m12, m.m20, m.m21, m.m22 });
    }

    private final double[] values;

    public OrientationMatrix(double[] values) {
        Tuples.requireLength(values, 9);
        this.values = values.clone();
    }

    @Override
    public ValidityResult check() {
        return ValidityChecks.omCheck(values);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        return Arrays.equals(values, ((OrientationMatrix) obj).values);
    }

    public double get(int row, int column) {
        return values[row * 3 + column];
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public OrientationRepresentation representation() {
        return OrientationRepresentation.ORIENTATION_MATRIX;
    }

    @Override
    public double[] toArray() {
        return values.clone();
    }

    public Matrix3d toMatrix3d() {
        return new Matrix3d(values);
    }

    public Matrix3f toMatrix3f() {
        return new Matrix3f(Tuples.toFloats(values));
    }

    @Override
    public String toString() {
        return "OrientationMatrix" + Arrays.toString(values);
    }
}
