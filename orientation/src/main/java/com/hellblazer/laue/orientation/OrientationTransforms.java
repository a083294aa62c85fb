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

import static com.hellblazer.laue.orientation.Rotations.EPSIJK;
import static java.lang.Math.abs;
import static java.lang.Math.acos;
import static java.lang.Math.atan;
import static java.lang.Math.atan2;
import static java.lang.Math.cbrt;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;
import static java.lang.Math.tan;

/**
 * The conversion engine between the seven rotation representations. All conversions are pure functions over fixed
 * size tuples. Inputs are not validated; invalid inputs convert on a best effort basis.
 * <p>
 * Pairs without a direct closed form are routed through intermediate representations: every cubochoric conversion
 * passes through homochoric, axis-angle to Euler through the orientation matrix, orientation matrix to Rodrigues
 * through Euler, Rodrigues to quaternion through axis-angle, and homochoric to anything but cubochoric through
 * axis-angle.
 * <p>
 * Each quaternion conversion takes the {@link QuaternionLayout} of its quaternion argument or result; the overloads
 * without a layout use {@link QuaternionLayout#VECTOR_SCALAR}.
 *
 * @author hal.hildebrand
 */
public final class OrientationTransforms {
    public static final OrientationTransforms DOUBLE = new OrientationTransforms(Precision.DOUBLE);
    public static final OrientationTransforms FLOAT  = new OrientationTransforms(Precision.FLOAT);

    private static final QuaternionLayout DEFAULT_LAYOUT = QuaternionLayout.VECTOR_SCALAR;

    private static final double EU2OM_ZERO    = 1.0e-7;
    private static final double EULER_CLOSE   = 1.0e-6;
    private static final double AX_PI_CLOSE   = 1.0e-7;
    private static final double EU_PI_CLOSE   = 1.0e-6;
    private static final double HO_PI_CLOSE   = 1.0e-8;
    private static final double QU_AX_EPSILON = 1.0e-12;

    /** Polynomial fit of the inverse of the homochoric radius function, in powers of |h|^2 */
    private static final double[] TFIT = { 1.0000000000018852, -0.5000000002194847, -0.024999992127593126,
                                           -0.003928701544781374, -0.0008152701535450438, -0.0002009500426119712,
                                           -0.00002397986776071756, -0.00008202868926605841, 0.00012448715042090092,
                                           -0.0001749114214822577, 0.0001703481934140054, -0.00012062065004116828,
                                           0.000059719705868660826, -0.00001980756723965647,
                                           0.000003953714684212874, -0.00000036555001439719544 };

    public static OrientationTransforms forPrecision(Precision precision) {
        return precision == Precision.FLOAT ? FLOAT : DOUBLE;
    }

    private static double[] axisAngleIdentity() {
        return new double[] { 0.0, 0.0, 1.0, 0.0 };
    }

    /**
     * Shift a negative angle into [0, width) by adding a large multiple of pi before the modulo
     */
    private static double normalizeAngle(double angle, double width) {
        if (angle < 0.0) {
            return (angle + 100.0 * Math.PI) % width;
        }
        return angle;
    }

    private static double[] normalizeEuler(double phi1, double phi, double phi2) {
        return new double[] { normalizeAngle(phi1, Rotations.TWO_PI), normalizeAngle(phi, Math.PI),
                              normalizeAngle(phi2, Rotations.TWO_PI) };
    }

    private final Precision precision;

    private OrientationTransforms(Precision precision) {
        this.precision = precision;
    }

    // Axis-angle

    public double[] ax2cu(double[] ax) {
        return ho2cu(ax2ho(ax));
    }

    public double[] ax2eu(double[] ax) {
        return om2eu(ax2om(ax));
    }

    public double[] ax2ho(double[] ax) {
        var f = cbrt(0.75 * (ax[3] - sin(ax[3])));
        return new double[] { ax[0] * f, ax[1] * f, ax[2] * f };
    }

    public double[] ax2om(double[] ax) {
        var res = new double[9];
        var c = cos(ax[3]);
        var s = sin(ax[3]);
        var omc = 1.0 - c;
        for (int i = 0; i < 3; i++) {
            res[4 * i] = ax[i] * ax[i] * omc + c;
        }
        var q = omc * ax[0] * ax[1];
        res[3] = q + s * ax[2];
        res[1] = q - s * ax[2];
        q = omc * ax[1] * ax[2];
        res[7] = q + s * ax[0];
        res[5] = q - s * ax[0];
        q = omc * ax[2] * ax[0];
        res[6] = q - s * ax[1];
        res[2] = q + s * ax[1];
        if (EPSIJK != 1.0) {
            transpose(res);
        }
        return res;
    }

    public double[] ax2qu(double[] ax) {
        return ax2qu(ax, DEFAULT_LAYOUT);
    }

    public double[] ax2qu(double[] ax, QuaternionLayout layout) {
        if (ax[3] == 0.0) {
            return layout.pack(1.0, 0.0, 0.0, 0.0);
        }
        var c = cos(ax[3] * 0.5);
        var s = sin(ax[3] * 0.5);
        return layout.pack(c, ax[0] * s, ax[1] * s, ax[2] * s);
    }

    public double[] ax2ro(double[] ax) {
        if (ax[3] == 0.0) {
            return new double[4];
        }
        var length = abs(ax[3] - Math.PI) < AX_PI_CLOSE ? Double.POSITIVE_INFINITY : tan(ax[3] * 0.5);
        return new double[] { ax[0], ax[1], ax[2], length };
    }

    // Generic dispatch

    /**
     * Convert one tuple between the given representations. Same kind conversion returns a copy.
     */
    public double[] convert(OrientationRepresentation from, OrientationRepresentation to, double[] in,
                            QuaternionLayout layout) {
        Tuples.requireLength(in, from.componentCount());
        if (from == to) {
            return in.clone();
        }
        return switch (from) {
        case EULER -> switch (to) {
            case ORIENTATION_MATRIX -> eu2om(in);
            case QUATERNION -> eu2qu(in, layout);
            case AXIS_ANGLE -> eu2ax(in);
            case RODRIGUES -> eu2ro(in);
            case HOMOCHORIC -> eu2ho(in);
            case CUBOCHORIC -> eu2cu(in);
            default -> throw new IllegalStateException("Unreachable: " + to);
        };
        case ORIENTATION_MATRIX -> switch (to) {
            case EULER -> om2eu(in);
            case QUATERNION -> om2qu(in, layout);
            case AXIS_ANGLE -> om2ax(in);
            case RODRIGUES -> om2ro(in);
            case HOMOCHORIC -> om2ho(in);
            case CUBOCHORIC -> om2cu(in);
            default -> throw new IllegalStateException("Unreachable: " + to);
        };
        case QUATERNION -> switch (to) {
            case EULER -> qu2eu(in, layout);
            case ORIENTATION_MATRIX -> qu2om(in, layout);
            case AXIS_ANGLE -> qu2ax(in, layout);
            case RODRIGUES -> qu2ro(in, layout);
            case HOMOCHORIC -> qu2ho(in, layout);
            case CUBOCHORIC -> qu2cu(in, layout);
            default -> throw new IllegalStateException("Unreachable: " + to);
        };
        case AXIS_ANGLE -> switch (to) {
            case EULER -> ax2eu(in);
            case ORIENTATION_MATRIX -> ax2om(in);
            case QUATERNION -> ax2qu(in, layout);
            case RODRIGUES -> ax2ro(in);
            case HOMOCHORIC -> ax2ho(in);
            case CUBOCHORIC -> ax2cu(in);
            default -> throw new IllegalStateException("Unreachable: " + to);
        };
        case RODRIGUES -> switch (to) {
            case EULER -> ro2eu(in);
            case ORIENTATION_MATRIX -> ro2om(in);
            case QUATERNION -> ro2qu(in, layout);
            case AXIS_ANGLE -> ro2ax(in);
            case HOMOCHORIC -> ro2ho(in);
            case CUBOCHORIC -> ro2cu(in);
            default -> throw new IllegalStateException("Unreachable: " + to);
        };
        case HOMOCHORIC -> switch (to) {
            case EULER -> ho2eu(in);
            case ORIENTATION_MATRIX -> ho2om(in);
            case QUATERNION -> ho2qu(in, layout);
            case AXIS_ANGLE -> ho2ax(in);
            case RODRIGUES -> ho2ro(in);
            case CUBOCHORIC -> ho2cu(in);
            default -> throw new IllegalStateException("Unreachable: " + to);
        };
        case CUBOCHORIC -> switch (to) {
            case EULER -> cu2eu(in);
            case ORIENTATION_MATRIX -> cu2om(in);
            case QUATERNION -> cu2qu(in, layout);
            case AXIS_ANGLE -> cu2ax(in);
            case RODRIGUES -> cu2ro(in);
            case HOMOCHORIC -> cu2ho(in);
            default -> throw new IllegalStateException("Unreachable: " + to);
        };
        };
    }

    /**
     * Convert one single precision tuple. The values are widened for the computation and the result is rounded back
     * to single precision.
     */
    public float[] convert(OrientationRepresentation from, OrientationRepresentation to, float[] in,
                           QuaternionLayout layout) {
        if (in == null) {
            throw new IllegalArgumentException("Null tuple");
        }
        return Tuples.toFloats(convert(from, to, Tuples.toDoubles(in), layout));
    }

    /**
     * Convert a typed orientation. Quaternions are read and produced through their typed accessors, so no layout is
     * involved.
     */
    public Orientation convert(Orientation orientation, OrientationRepresentation to) {
        var from = orientation.representation();
        var values = orientation.toArray();
        var result = convert(from, to, values, DEFAULT_LAYOUT);
        return switch (to) {
        case EULER -> Euler.of(result);
        case ORIENTATION_MATRIX -> new OrientationMatrix(result);
        case QUATERNION -> Quaternion.of(result, DEFAULT_LAYOUT);
        case AXIS_ANGLE -> AxisAngle.of(result);
        case RODRIGUES -> Rodrigues.of(result);
        case HOMOCHORIC -> Homochoric.of(result);
        case CUBOCHORIC -> Cubochoric.of(result);
        };
    }

    // Cubochoric

    public double[] cu2ax(double[] cu) {
        return ho2ax(cu2ho(cu));
    }

    public double[] cu2eu(double[] cu) {
        return ho2eu(cu2ho(cu));
    }

    /**
     * Cube to ball. Points outside the cube map to the origin.
     */
    public double[] cu2ho(double[] cu) {
        return LambertProjection.cubeToBall(cu).xyz();
    }

    public double[] cu2om(double[] cu) {
        return ho2om(cu2ho(cu));
    }

    public double[] cu2qu(double[] cu) {
        return cu2qu(cu, DEFAULT_LAYOUT);
    }

    public double[] cu2qu(double[] cu, QuaternionLayout layout) {
        return ho2qu(cu2ho(cu), layout);
    }

    public double[] cu2ro(double[] cu) {
        return ho2ro(cu2ho(cu));
    }

    // Euler

    public double[] eu2ax(double[] eu) {
        var t = tan(eu[1] * 0.5);
        var sig = 0.5 * (eu[0] + eu[2]);
        var del = 0.5 * (eu[0] - eu[2]);
        var tau = sqrt(t * t + sin(sig) * sin(sig));
        double alpha;
        if (abs(sig - Rotations.HALF_PI) < EULER_CLOSE) {
            alpha = Math.PI;
        } else {
            alpha = 2.0 * atan(tau / cos(sig));
        }
        if (abs(alpha) < EULER_CLOSE) {
            return axisAngleIdentity();
        }
        var res = new double[] { -EPSIJK * t * cos(del) / tau, -EPSIJK * t * sin(del) / tau,
                                 -EPSIJK * sin(sig) / tau, alpha };
        if (alpha < 0.0) {
            for (int i = 0; i < 4; i++) {
                res[i] = -res[i];
            }
        }
        return res;
    }

    public double[] eu2cu(double[] eu) {
        return ho2cu(eu2ho(eu));
    }

    public double[] eu2ho(double[] eu) {
        return ax2ho(eu2ax(eu));
    }

    public double[] eu2om(double[] eu) {
        var c1 = cos(eu[0]);
        var c = cos(eu[1]);
        var c2 = cos(eu[2]);
        var s1 = sin(eu[0]);
        var s = sin(eu[1]);
        var s2 = sin(eu[2]);
        var om = new double[] { c1 * c2 - s1 * s2 * c, s1 * c2 + c1 * s2 * c, s2 * s, -c1 * s2 - s1 * c2 * c,
                                -s1 * s2 + c1 * c2 * c, c2 * s, s1 * s, -c1 * s, c };
        for (int i = 0; i < 9; i++) {
            if (abs(om[i]) < EU2OM_ZERO) {
                om[i] = 0.0;
            }
        }
        return om;
    }

    public double[] eu2qu(double[] eu) {
        return eu2qu(eu, DEFAULT_LAYOUT);
    }

    public double[] eu2qu(double[] eu, QuaternionLayout layout) {
        var ee0 = 0.5 * eu[0];
        var ee1 = 0.5 * eu[1];
        var ee2 = 0.5 * eu[2];
        var cPhi = cos(ee1);
        var sPhi = sin(ee1);
        var cm = cos(ee0 - ee2);
        var sm = sin(ee0 - ee2);
        var cp = cos(ee0 + ee2);
        var sp = sin(ee0 + ee2);
        var w = cPhi * cp;
        var x = -EPSIJK * sPhi * cm;
        var y = -EPSIJK * sPhi * sm;
        var z = -EPSIJK * cPhi * sp;
        if (w < 0.0) {
            return layout.pack(-w, -x, -y, -z);
        }
        return layout.pack(w, x, y, z);
    }

    public double[] eu2ro(double[] eu) {
        var res = eu2ax(eu);
        var t = res[3];
        if (abs(t - Math.PI) < EU_PI_CLOSE) {
            res[3] = Double.POSITIVE_INFINITY;
            return res;
        }
        if (t == 0.0) {
            return new double[4];
        }
        res[3] = tan(t * 0.5);
        return res;
    }

    // Homochoric

    /**
     * Homochoric to axis-angle through the polynomial fit of the inverse radius function. The fitted cosine of the
     * half angle is clamped to [-1, 1] so points just outside the ball do not produce NaN.
     */
    public double[] ho2ax(double[] ho) {
        var hmag = ho[0] * ho[0] + ho[1] * ho[1] + ho[2] * ho[2];
        if (hmag == 0.0) {
            return axisAngleIdentity();
        }
        var inv = 1.0 / sqrt(hmag);
        var hm = hmag;
        var s = TFIT[0] + TFIT[1] * hmag;
        for (int i = 2; i < TFIT.length; i++) {
            hm = hm * hmag;
            s = s + TFIT[i] * hm;
        }
        s = Math.max(-1.0, Math.min(1.0, s));
        var angle = 2.0 * acos(s);
        if (abs(angle - Math.PI) < HO_PI_CLOSE) {
            angle = Math.PI;
        }
        return new double[] { ho[0] * inv, ho[1] * inv, ho[2] * inv, angle };
    }

    /**
     * Ball to cube. Points outside the ball map to the origin.
     */
    public double[] ho2cu(double[] ho) {
        return LambertProjection.ballToCube(ho).xyz();
    }

    public double[] ho2eu(double[] ho) {
        return ax2eu(ho2ax(ho));
    }

    public double[] ho2om(double[] ho) {
        return ax2om(ho2ax(ho));
    }

    public double[] ho2qu(double[] ho) {
        return ho2qu(ho, DEFAULT_LAYOUT);
    }

    public double[] ho2qu(double[] ho, QuaternionLayout layout) {
        return ax2qu(ho2ax(ho), layout);
    }

    public double[] ho2ro(double[] ho) {
        return ax2ro(ho2ax(ho));
    }

    // Orientation matrix

    public double[] om2ax(double[] om) {
        return qu2ax(om2qu(om, DEFAULT_LAYOUT), DEFAULT_LAYOUT);
    }

    public double[] om2cu(double[] om) {
        return ho2cu(om2ho(om));
    }

    /**
     * Orientation matrix to Euler angles. When Phi is 0 or pi the matrix is gimbal locked: phi2 is set to 0 and phi1
     * carries the combined rotation.
     */
    public double[] om2eu(double[] om) {
        if (abs(abs(om[8]) - 1.0) > EULER_CLOSE) {
            var phi = acos(om[8]);
            var zeta = 1.0 / sqrt(1.0 - om[8] * om[8]);
            return normalizeEuler(atan2(om[6] * zeta, -om[7] * zeta), phi, atan2(om[2] * zeta, om[5] * zeta));
        }
        if (abs(om[8] - 1.0) <= EULER_CLOSE) {
            return normalizeEuler(atan2(om[1], om[0]), 0.0, 0.0);
        }
        return normalizeEuler(-atan2(-om[1], om[0]), Math.PI, 0.0);
    }

    public double[] om2ho(double[] om) {
        return ax2ho(om2ax(om));
    }

    public double[] om2qu(double[] om) {
        return om2qu(om, DEFAULT_LAYOUT);
    }

    /**
     * Orientation matrix to quaternion. Radicands within the width's threshold of zero are clamped to zero. The signs
     * of the vector part are reconciled with the axis of the same rotation obtained through Euler angles.
     */
    public double[] om2qu(double[] om, QuaternionLayout layout) {
        var thr = precision.omToQuThreshold();
        var w = 0.5 * root(om[0] + om[4] + om[8] + 1.0, thr);
        var x = 0.5 * root(om[0] - om[4] - om[8] + 1.0, thr);
        var y = 0.5 * root(-om[0] + om[4] - om[8] + 1.0, thr);
        var z = 0.5 * root(-om[0] - om[4] + om[8] + 1.0, thr);

        if (om[7] < om[5]) {
            x = -EPSIJK * x;
        }
        if (om[2] < om[6]) {
            y = -EPSIJK * y;
        }
        if (om[3] < om[1]) {
            z = -EPSIJK * z;
        }
        var n = sqrt(w * w + x * x + y * y + z * z);
        if (n != 0.0) {
            w /= n;
            x /= n;
            y /= n;
            z /= n;
        }

        var oax = eu2ax(om2eu(om));
        if (oax[0] * x < 0.0) {
            x = -x;
        }
        if (oax[1] * y < 0.0) {
            y = -y;
        }
        if (oax[2] * z < 0.0) {
            z = -z;
        }
        return layout.pack(w, x, y, z);
    }

    public double[] om2ro(double[] om) {
        return eu2ro(om2eu(om));
    }

    public Precision precision() {
        return precision;
    }

    // Quaternion

    public double[] qu2ax(double[] qu) {
        return qu2ax(qu, DEFAULT_LAYOUT);
    }

    public double[] qu2ax(double[] qu, QuaternionLayout layout) {
        var sign = qu[layout.w()] < 0.0 ? -1.0 : 1.0;
        var w = sign * qu[layout.w()];
        var x = sign * qu[layout.x()];
        var y = sign * qu[layout.y()];
        var z = sign * qu[layout.z()];
        var omega = 2.0 * acos(Math.min(1.0, w));
        if (omega < QU_AX_EPSILON) {
            return new double[] { 0.0, 0.0, EPSIJK, 0.0 };
        }
        var mag = sqrt(x * x + y * y + z * z);
        if (mag == 0.0) {
            return axisAngleIdentity();
        }
        return new double[] { x / mag, y / mag, z / mag, omega };
    }

    public double[] qu2cu(double[] qu) {
        return qu2cu(qu, DEFAULT_LAYOUT);
    }

    public double[] qu2cu(double[] qu, QuaternionLayout layout) {
        return ho2cu(qu2ho(qu, layout));
    }

    public double[] qu2eu(double[] qu) {
        return qu2eu(qu, DEFAULT_LAYOUT);
    }

    public double[] qu2eu(double[] qu, QuaternionLayout layout) {
        var w = qu[layout.w()];
        var x = qu[layout.x()];
        var y = qu[layout.y()];
        var z = qu[layout.z()];
        var q03 = w * w + z * z;
        var q12 = x * x + y * y;
        var chi = sqrt(q03 * q12);
        if (chi == 0.0) {
            if (q12 == 0.0) {
                return normalizeEuler(atan2(-2.0 * EPSIJK * w * z, w * w - z * z), 0.0, 0.0);
            }
            return normalizeEuler(atan2(2.0 * x * y, x * x - y * y), Math.PI, 0.0);
        }
        var phi = atan2(2.0 * chi, q03 - q12);
        chi = 1.0 / chi;
        var phi1 = atan2((-EPSIJK * w * y + x * z) * chi, (-EPSIJK * w * x - y * z) * chi);
        var phi2 = atan2((EPSIJK * w * y + x * z) * chi, (-EPSIJK * w * x + y * z) * chi);
        return normalizeEuler(phi1, phi, phi2);
    }

    public double[] qu2ho(double[] qu) {
        return qu2ho(qu, DEFAULT_LAYOUT);
    }

    /**
     * Quaternion to homochoric. The quaternion is taken with a non-negative scalar part.
     */
    public double[] qu2ho(double[] qu, QuaternionLayout layout) {
        var sign = qu[layout.w()] < 0.0 ? -1.0 : 1.0;
        var w = sign * qu[layout.w()];
        var omega = 2.0 * acos(Math.min(1.0, w));
        if (omega == 0.0) {
            return new double[3];
        }
        var res = new double[] { sign * qu[layout.x()], sign * qu[layout.y()], sign * qu[layout.z()] };
        var mag = Tuples.magnitude3(res);
        if (mag == 0.0) {
            return new double[3];
        }
        var f = cbrt(0.75 * (omega - sin(omega))) / mag;
        res[0] *= f;
        res[1] *= f;
        res[2] *= f;
        return res;
    }

    public double[] qu2om(double[] qu) {
        return qu2om(qu, DEFAULT_LAYOUT);
    }

    public double[] qu2om(double[] qu, QuaternionLayout layout) {
        var w = qu[layout.w()];
        var x = qu[layout.x()];
        var y = qu[layout.y()];
        var z = qu[layout.z()];
        var qq = w * w - (x * x + y * y + z * z);
        var res = new double[9];
        res[0] = qq + 2.0 * x * x;
        res[4] = qq + 2.0 * y * y;
        res[8] = qq + 2.0 * z * z;
        res[1] = 2.0 * (x * y - w * z);
        res[5] = 2.0 * (y * z - w * x);
        res[6] = 2.0 * (z * x - w * y);
        res[3] = 2.0 * (y * x + w * z);
        res[7] = 2.0 * (z * y + w * x);
        res[2] = 2.0 * (x * z + w * y);
        if (EPSIJK != 1.0) {
            transpose(res);
        }
        return res;
    }

    public double[] qu2ro(double[] qu) {
        return qu2ro(qu, DEFAULT_LAYOUT);
    }

    /**
     * Quaternion to Rodrigues through axis-angle, so a negative scalar part is folded into the upper hemisphere first
     */
    public double[] qu2ro(double[] qu, QuaternionLayout layout) {
        return ax2ro(qu2ax(qu, layout));
    }

    // Rodrigues

    /**
     * Rodrigues to axis-angle. An infinite length maps to an angle of pi about the stored axis.
     */
    public double[] ro2ax(double[] ro) {
        var ta = ro[3];
        if (ta == 0.0) {
            return axisAngleIdentity();
        }
        if (ta == Double.POSITIVE_INFINITY) {
            return new double[] { ro[0], ro[1], ro[2], Math.PI };
        }
        var angle = 2.0 * atan(ta);
        var mag = Tuples.magnitude3(ro);
        if (mag == 0.0) {
            return axisAngleIdentity();
        }
        return new double[] { ro[0] / mag, ro[1] / mag, ro[2] / mag, angle };
    }

    public double[] ro2cu(double[] ro) {
        return ho2cu(ro2ho(ro));
    }

    public double[] ro2eu(double[] ro) {
        return om2eu(ro2om(ro));
    }

    public double[] ro2ho(double[] ro) {
        var rv = ro[0] * ro[0] + ro[1] * ro[1] + ro[2] * ro[2] + ro[3] * ro[3];
        if (rv == 0.0) {
            return new double[3];
        }
        double f;
        if (ro[3] == Double.POSITIVE_INFINITY) {
            f = 0.75 * Math.PI;
        } else {
            var t = 2.0 * atan(ro[3]);
            f = 0.75 * (t - sin(t));
        }
        f = cbrt(f);
        return new double[] { ro[0] * f, ro[1] * f, ro[2] * f };
    }

    public double[] ro2om(double[] ro) {
        return ax2om(ro2ax(ro));
    }

    public double[] ro2qu(double[] ro) {
        return ro2qu(ro, DEFAULT_LAYOUT);
    }

    public double[] ro2qu(double[] ro, QuaternionLayout layout) {
        return ax2qu(ro2ax(ro), layout);
    }

    private double root(double radicand, double threshold) {
        if (abs(radicand) < threshold) {
            return 0.0;
        }
        return sqrt(radicand);
    }

    private void transpose(double[] m) {
        var t = m[1];
        m[1] = m[3];
        m[3] = t;
        t = m[2];
        m[2] = m[6];
        m[6] = t;
        t = m[5];
        m[5] = m[7];
        m[7] = t;
    }
}
