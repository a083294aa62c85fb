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
import static java.lang.Math.atan;
import static java.lang.Math.asin;
import static java.lang.Math.copySign;
import static java.lang.Math.cos;
import static java.lang.Math.max;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

/**
 * Equal volume mapping between the cube of edge {@link #AP} (cubochoric space) and the ball of radius {@link #R1}
 * (homochoric space). Both are split into six square pyramids with apex at the origin; each pyramid is rotated onto
 * the +/-z pyramid, mapped through the square to Lambert disk map, then rotated back.
 *
 * @author hal.hildebrand
 */
public final class LambertProjection {

    /**
     * Result of a projection. When {@code error} is set the point was outside the domain and the coordinates are
     * zero.
     */
    public record Result(double[] xyz, boolean error) {
    }

    /** Cube edge, pi^(2/3) */
    public static final double AP   = Math.pow(Math.PI, 2.0 / 3.0);
    /** Ball radius, (3 pi / 4)^(1/3) */
    public static final double R1   = Math.cbrt(0.75 * Math.PI);
    public static final double SC   = Math.pow(Math.PI / 6.0, 1.0 / 6.0);
    public static final double BETA = Math.pow(Math.PI, 5.0 / 6.0) / Math.pow(6.0, 1.0 / 6.0) / 2.0;
    public static final double PREK = R1 * Math.pow(2.0, 0.25) / BETA;
    public static final double PREF = sqrt(6.0 / Math.PI);

    private static final double R2         = sqrt(2.0);
    private static final double PI12       = Math.PI / 12.0;
    private static final double R24        = sqrt(24.0);
    private static final double SQRT_PI    = sqrt(Math.PI);
    private static final double CUBE_SLACK = 1.0e-8;

    /**
     * Map a homochoric point of the ball onto the cube
     */
    public static Result ballToCube(double[] xyz) {
        var rs = Tuples.magnitude3(xyz);
        if (rs > R1) {
            return new Result(new double[3], true);
        }
        if (rs == 0.0) {
            return new Result(new double[3], false);
        }
        var p = pyramid(xyz);
        var s = toPyramid(p, xyz);

        var q = sqrt(2.0 * rs / (rs + abs(s[2])));
        var t1 = s[0] * q;
        var t2 = s[1] * q;
        var z = copySign(rs, s[2]) / PREF;

        double x, y;
        if (t1 == 0.0 && t2 == 0.0) {
            x = 0.0;
            y = 0.0;
        } else {
            var swap = abs(t2) > abs(t1);
            var big = swap ? t2 : t1;
            var small = swap ? t1 : t2;
            var rho = small / big;
            var theta = atan(rho) - asin(rho / (R2 * sqrt(1.0 + rho * rho)));
            var c = cos(theta);
            var a = copySign(sqrt((t1 * t1 + t2 * t2) * (R2 - c) / (3.0 - 2.0 * R2 * c)) / PREK, big);
            var b = a * theta / PI12;
            x = swap ? b : a;
            y = swap ? a : b;
        }
        return new Result(fromPyramid(p, new double[] { x / SC, y / SC, z / SC }), false);
    }

    /**
     * Map a cubochoric point of the cube into the ball
     */
    public static Result cubeToBall(double[] xyz) {
        var m = max(abs(xyz[0]), max(abs(xyz[1]), abs(xyz[2])));
        if (m > AP / 2.0 + CUBE_SLACK) {
            return new Result(new double[3], true);
        }
        if (xyz[0] == 0.0 && xyz[1] == 0.0 && xyz[2] == 0.0) {
            return new Result(new double[3], false);
        }
        var p = pyramid(xyz);
        var s = toPyramid(p, xyz);
        var x = s[0] * SC;
        var y = s[1] * SC;
        var z = s[2] * SC;

        double[] l;
        if (x == 0.0 && y == 0.0) {
            l = new double[] { 0.0, 0.0, PREF * z };
        } else {
            double t1, t2;
            if (abs(y) <= abs(x)) {
                var q = PI12 * y / x;
                var c = cos(q);
                var sn = sin(q);
                q = PREK * x / sqrt(R2 - c);
                t1 = (R2 * c - 1.0) * q;
                t2 = R2 * sn * q;
            } else {
                var q = PI12 * x / y;
                var c = cos(q);
                var sn = sin(q);
                q = PREK * y / sqrt(R2 - c);
                t1 = R2 * sn * q;
                t2 = (R2 * c - 1.0) * q;
            }
            var c = t1 * t1 + t2 * t2;
            var sn = Math.PI * c / (24.0 * z * z);
            c = SQRT_PI * c / R24 / z;
            var q = sqrt(1.0 - sn);
            l = new double[] { t1 * q, t2 * q, PREF * z - c };
        }
        return new Result(fromPyramid(p, l), false);
    }

    /**
     * Index 1..6 of the pyramid holding the point: 1 and 2 are the +z and -z pyramids, 3 and 4 +x and -x, 5 and 6
     * +y and -y
     */
    static int pyramid(double[] xyz) {
        var x = xyz[0];
        var y = xyz[1];
        var z = xyz[2];
        if (abs(x) <= z && abs(y) <= z) {
            return 1;
        }
        if (abs(x) <= -z && abs(y) <= -z) {
            return 2;
        }
        if (abs(z) <= x && abs(y) <= x) {
            return 3;
        }
        if (abs(z) <= -x && abs(y) <= -x) {
            return 4;
        }
        if (abs(x) <= y && abs(z) <= y) {
            return 5;
        }
        return 6;
    }

    private static double[] fromPyramid(int p, double[] l) {
        return switch (p) {
        case 1, 2 -> l;
        case 3, 4 -> new double[] { l[2], l[0], l[1] };
        default -> new double[] { l[1], l[2], l[0] };
        };
    }

    private static double[] toPyramid(int p, double[] xyz) {
        return switch (p) {
        case 1, 2 -> new double[] { xyz[0], xyz[1], xyz[2] };
        case 3, 4 -> new double[] { xyz[1], xyz[2], xyz[0] };
        default -> new double[] { xyz[2], xyz[0], xyz[1] };
        };
    }

    private LambertProjection() {
    }
}
