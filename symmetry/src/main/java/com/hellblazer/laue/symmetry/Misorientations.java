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

import static com.hellblazer.laue.orientation.Rotations.INV_SQRT2;
import static java.lang.Math.abs;
import static java.lang.Math.acos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

import java.util.Arrays;
import java.util.Objects;

import com.hellblazer.laue.orientation.AxisAngle;
import com.hellblazer.laue.orientation.Quaternion;

/**
 * Misorientation and symmetric equivalent selection over the operators of a Laue class. Ties between equivalents
 * resolve to the lowest operator index.
 *
 * @author hal.hildebrand
 */
final class Misorientations {

    /**
     * Closed form disorientation for the 432 group. The 24 equivalents of a quaternion have scalar parts drawn from
     * its sorted absolute components: the largest, the largest pair over sqrt 2, or the sum over 2.
     */
    static AxisAngle cubicMisorientation(Quaternion q1, Quaternion q2) {
        var qc = q1.multiply(q2.conjugate()).elementWiseAbs();
        var sorted = new double[] { qc.x(), qc.y(), qc.z(), qc.w() };
        Arrays.sort(sorted);
        double x = sorted[0], y = sorted[1], z = sorted[2], w = sorted[3];

        var wmin = w;
        var type = 1;
        if ((z + w) * INV_SQRT2 > wmin) {
            wmin = (z + w) * INV_SQRT2;
            type = 2;
        }
        if ((x + y + z + w) * 0.5 > wmin) {
            wmin = (x + y + z + w) * 0.5;
            type = 3;
        }
        wmin = acos(Math.max(-1.0, Math.min(1.0, wmin)));
        if (wmin == 0.0) {
            return AxisAngle.IDENTITY;
        }
        var s = sin(wmin);
        double n1, n2, n3;
        if (type == 1) {
            n1 = x / s;
            n2 = y / s;
            n3 = z / s;
        } else if (type == 2) {
            n1 = (x - y) * INV_SQRT2 / s;
            n2 = (x + y) * INV_SQRT2 / s;
            n3 = (z - w) * INV_SQRT2 / s;
        } else {
            n1 = (x - y + z - w) * 0.5 / s;
            n2 = (x + y - z - w) * 0.5 / s;
            n3 = (-x + y + z - w) * 0.5 / s;
        }
        var denom = sqrt(n1 * n1 + n2 * n2 + n3 * n3);
        if (denom == 0.0 || !Double.isFinite(denom)) {
            return new AxisAngle(0, 0, 1, 2.0 * wmin);
        }
        return new AxisAngle(n1 / denom, n2 / denom, n3 / denom, 2.0 * wmin);
    }

    /**
     * Equivalent of q with the largest non-negative scalar part
     */
    static Quaternion fundamentalZoneQuaternion(LaueClass laue, Quaternion q) {
        Objects.requireNonNull(q, "q");
        Quaternion best = null;
        for (int i = 0; i < laue.getNumSymOps(); i++) {
            var candidate = laue.quatOp(i).multiply(q).positive();
            if (best == null || candidate.w() > best.w()) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Smallest rotation among S_i * q1 * q2^-1 over the operators S_i
     */
    static AxisAngle genericMisorientation(LaueClass laue, Quaternion q1, Quaternion q2) {
        var qr = q1.multiply(q2.conjugate());
        Quaternion best = null;
        var bestW = -1.0;
        for (int i = 0; i < laue.getNumSymOps(); i++) {
            var qc = laue.quatOp(i).multiply(qr);
            if (abs(qc.w()) > bestW) {
                bestW = abs(qc.w());
                best = qc;
            }
        }
        best = best.positive();
        var angle = 2.0 * acos(Math.min(1.0, best.w()));
        var n = sqrt(best.x() * best.x() + best.y() * best.y() + best.z() * best.z());
        if (angle == 0.0 || n == 0.0) {
            return new AxisAngle(0, 0, 1, angle);
        }
        return new AxisAngle(best.x() / n, best.y() / n, best.z() / n, angle);
    }

    static AxisAngle misorientation(LaueClass laue, Quaternion q1, Quaternion q2) {
        Objects.requireNonNull(q1, "q1");
        Objects.requireNonNull(q2, "q2");
        if (laue == LaueClass.CUBIC) {
            return cubicMisorientation(q1, q2);
        }
        return genericMisorientation(laue, q1, q2);
    }

    /**
     * Equivalent of q2, with non-negative scalar part, having the largest dot product with q1
     */
    static Quaternion nearestQuaternion(LaueClass laue, Quaternion q1, Quaternion q2) {
        Objects.requireNonNull(q1, "q1");
        Objects.requireNonNull(q2, "q2");
        Quaternion best = null;
        var bestDot = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < laue.getNumSymOps(); i++) {
            var candidate = laue.quatOp(i).multiply(q2).positive();
            var dot = q1.dot(candidate);
            if (dot > bestDot) {
                bestDot = dot;
                best = candidate;
            }
        }
        return best;
    }

    private Misorientations() {
    }
}
