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

import static java.lang.Math.abs;
import static java.lang.Math.sqrt;

import javax.vecmath.Matrix3d;

/**
 * Advisory validity checks, one per representation. The checks report the first failed test and never throw; the
 * conversion engine accepts invalid input regardless.
 *
 * @author hal.hildebrand
 */
public final class ValidityChecks {
    public static final double OM_THRESHOLD = 1.0e-5;
    public static final double RO_THRESHOLD = 1.0e-6;

    /**
     * Run the check of the given representation
     */
    public static ValidityResult check(OrientationRepresentation representation, double[] values,
                                       QuaternionLayout layout, Precision precision) {
        return switch (representation) {
        case EULER -> euCheck(values);
        case ORIENTATION_MATRIX -> omCheck(values);
        case QUATERNION -> quCheck(values, layout, precision);
        case AXIS_ANGLE -> axCheck(values, precision);
        case RODRIGUES -> roCheck(values);
        case HOMOCHORIC -> hoCheck(values);
        case CUBOCHORIC -> cuCheck(values);
        };
    }

    public static ValidityResult axCheck(double[] ax, Precision precision) {
        if (ax[3] < 0.0 || ax[3] > Math.PI) {
            return ValidityResult.failure(-1, "ax_check: angle must be in range [0,pi]");
        }
        var r = sqrt(ax[0] * ax[0] + ax[1] * ax[1] + ax[2] * ax[2]);
        if (abs(r - 1.0) > precision.machineEpsilon()) {
            return ValidityResult.failure(-2, "ax_check: axis-angle axis vector must have unit norm");
        }
        return ValidityResult.VALID;
    }

    public static ValidityResult cuCheck(double[] cu) {
        var r = Math.max(abs(cu[0]), Math.max(abs(cu[1]), abs(cu[2])));
        if (r > LambertProjection.AP * 0.5) {
            return ValidityResult.failure(-1, "cu_check: cubochoric vector outside cube: " + r);
        }
        return ValidityResult.VALID;
    }

    public static ValidityResult euCheck(double[] eu) {
        if (eu[0] < 0.0 || eu[0] > Rotations.TWO_PI) {
            return ValidityResult.failure(-1, "eu_check: phi1 Euler angle outside of valid range [0,2pi]");
        }
        if (eu[1] < 0.0 || eu[1] > Math.PI) {
            return ValidityResult.failure(-2, "eu_check: Phi Euler angle outside of valid range [0,pi]");
        }
        if (eu[2] < 0.0 || eu[2] > Rotations.TWO_PI) {
            return ValidityResult.failure(-3, "eu_check: phi2 Euler angle outside of valid range [0,2pi]");
        }
        return ValidityResult.VALID;
    }

    public static ValidityResult hoCheck(double[] ho) {
        var r = Tuples.magnitude3(ho);
        if (r > LambertProjection.R1) {
            return ValidityResult.failure(-1, "ho_check: homochoric vector outside homochoric ball: " + r);
        }
        return ValidityResult.VALID;
    }

    /**
     * Determinant must be positive and unity, and |om * om^T| must be the identity over all nine entries.
     */
    public static ValidityResult omCheck(double[] om) {
        var m = new Matrix3d(om);
        var det = m.determinant();
        if (det < 0.0) {
            return ValidityResult.failure(-1,
                                          "om_check: Determinant of rotation matrix must be positive: " + det);
        }
        if (abs(det - 1.0) > OM_THRESHOLD) {
            return ValidityResult.failure(-2, "om_check: Determinant (" + det
            + ") of rotation matrix must be unity (1.0)");
        }
        var transpose = new Matrix3d(m);
        transpose.transpose();
        var product = new Matrix3d();
        product.mul(m, transpose);
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                var expected = i == j ? 1.0 : 0.0;
                var actual = abs(product.getElement(i, j));
                if (abs(actual - expected) > OM_THRESHOLD) {
                    return ValidityResult.failure(-3, "om_check: rotation matrix times transpose must be identity "
                    + "matrix: (" + i + ", " + j + ") = " + actual);
                }
            }
        }
        return ValidityResult.VALID;
    }

    public static ValidityResult quCheck(double[] qu, QuaternionLayout layout, Precision precision) {
        if (qu[layout.w()] < 0.0) {
            return ValidityResult.failure(-1, "qu_check: quaternion must have positive scalar part");
        }
        var r = sqrt(qu[0] * qu[0] + qu[1] * qu[1] + qu[2] * qu[2] + qu[3] * qu[3]);
        if (abs(r - 1.0) > precision.machineEpsilon()) {
            return ValidityResult.failure(-2, "qu_check: quaternion must have unit norm");
        }
        return ValidityResult.VALID;
    }

    public static ValidityResult roCheck(double[] ro) {
        if (ro[3] < 0.0) {
            return ValidityResult.failure(-1, "ro_check: Rodrigues-Frank vector has negative length");
        }
        var ttl = Tuples.magnitude3(ro);
        if (abs(ttl - 1.0) > RO_THRESHOLD) {
            return ValidityResult.failure(-2, "ro_check: Rodrigues-Frank axis vector not normalized");
        }
        return ValidityResult.VALID;
    }

    private ValidityChecks() {
    }
}
