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
import static java.lang.Math.abs;
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.floor;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;

import java.util.Objects;

import com.hellblazer.laue.orientation.OrientationTransforms;
import com.hellblazer.laue.orientation.Rodrigues;

/**
 * Fundamental zone reduction of orientations (ODF) and misorientations (MDF) in Rodrigues space.
 * <p>
 * The ODF zone is the set of equivalents nearest the origin. The MDF zone further folds the rotation axis of that
 * equivalent by the operators acting on the axis, together with the grain exchange symmetry which negates it. The
 * fold is carried out on the unit axis in axis-angle form, so the rotation angle is never changed.
 *
 * @author hal.hildebrand
 */
final class FundamentalZones {
    /** Lengths at or beyond this are the finite stand in for a half turn and map back to an infinite length */
    private static final double INFINITE_CUTOFF = 1.0e9;

    private static final OrientationTransforms TRANSFORMS = OrientationTransforms.DOUBLE;

    /**
     * Fold the unit axis of a misorientation in place
     */
    static void foldMisorientationAxis(LaueClass laue, double[] n) {
        switch (laue) {
            case CUBIC, CUBIC_LOW -> {
                var a = abs(n[0]);
                var b = abs(n[1]);
                var c = abs(n[2]);
                n[0] = Math.max(a, Math.max(b, c));
                n[2] = Math.min(a, Math.min(b, c));
                n[1] = a + b + c - n[0] - n[2];
            }
            case TETRAGONAL, ORTHORHOMBIC -> {
                n[0] = abs(n[0]);
                n[1] = abs(n[1]);
                n[2] = abs(n[2]);
            }
            case HEXAGONAL -> {
                n[2] = abs(n[2]);
                mirrorAzimuth(n, PI / 3.0);
            }
            case HEXAGONAL_LOW -> {
                n[2] = abs(n[2]);
                rotateAzimuth(n, PI / 3.0, 0.0);
            }
            case TETRAGONAL_LOW -> {
                n[2] = abs(n[2]);
                rotateAzimuth(n, PI / 2.0, 0.0);
            }
            case TRIGONAL -> {
                if (n[2] < 0.0) {
                    n[1] = -n[1];
                    n[2] = -n[2];
                }
                mirrorAzimuth(n, 2.0 * PI / 3.0);
            }
            case TRIGONAL_LOW -> {
                if (n[2] < 0.0) {
                    negate(n);
                }
                rotateAzimuth(n, 2.0 * PI / 3.0, 0.0);
            }
            case MONOCLINIC -> {
                n[1] = abs(n[1]);
                if (n[2] < 0.0) {
                    n[0] = -n[0];
                    n[2] = -n[2];
                }
            }
            case TRICLINIC -> {
                if (n[2] < 0.0) {
                    negate(n);
                }
            }
            default -> throw new UnsupportedSymmetryOperationException(laue, "MDF fundamental zone");
        }
    }

    static Rodrigues mdfFundamentalZone(LaueClass laue, Rodrigues rod) {
        var ax = TRANSFORMS.ro2ax(odfFundamentalZone(laue, rod).toArray());
        if (ax[3] == 0.0) {
            return Rodrigues.IDENTITY;
        }
        foldMisorientationAxis(laue, ax);
        return Rodrigues.of(TRANSFORMS.ax2ro(ax));
    }

    /**
     * Compose every operator with the orientation, r' = (s + r + s x r) / (1 - s . r), which is the quaternion
     * product S q, and keep the result nearest the origin
     */
    static Rodrigues odfFundamentalZone(LaueClass laue, Rodrigues rod) {
        Objects.requireNonNull(rod, "rod");
        var r = rod.vector(LaueClass.INFINITE_ROD_LENGTH);
        double[] best = null;
        var bestDist = Double.POSITIVE_INFINITY;
        for (int i = 0; i < laue.getNumSymOps(); i++) {
            var s = laue.rodOp(i);
            var denom = 1.0 - (r[0] * s[0] + r[1] * s[1] + r[2] * s[2]);
            var rc = new double[] { (r[0] + s[0] + s[1] * r[2] - s[2] * r[1]) / denom,
                                    (r[1] + s[1] + s[2] * r[0] - s[0] * r[2]) / denom,
                                    (r[2] + s[2] + s[0] * r[1] - s[1] * r[0]) / denom };
            var dist = rc[0] * rc[0] + rc[1] * rc[1] + rc[2] * rc[2];
            if (dist < bestDist) {
                bestDist = dist;
                best = rc;
            }
        }
        if (best == null) {
            // non-finite input
            return rod;
        }
        var length = sqrt(bestDist);
        if (length == 0.0) {
            return Rodrigues.IDENTITY;
        }
        return new Rodrigues(best[0] / length, best[1] / length, best[2] / length,
                             length >= INFINITE_CUTOFF ? Double.POSITIVE_INFINITY : length);
    }

    /**
     * Fold the azimuth of the axis across the vertical mirror planes. A period below pi is the hexagonal wedge
     * [0, period / 2]; otherwise the trigonal wedge [-period / 4, period / 4].
     */
    private static void mirrorAzimuth(double[] n, double period) {
        var rho = sqrt(n[0] * n[0] + n[1] * n[1]);
        if (rho == 0.0) {
            return;
        }
        var phi = atan2(n[1], n[0]);
        if (period < PI) {
            // hexagonal: mirrors every 30 degrees starting at the a axis
            phi = reduce(phi, period, 0.0);
            if (phi > period / 2.0) {
                phi = period - phi;
            }
        } else {
            // trigonal: mirrors at +-30 degrees
            phi = reduce(phi, period, -period / 2.0);
            var quarter = period / 4.0;
            if (phi > quarter) {
                phi = period / 2.0 - phi;
            } else if (phi < -quarter) {
                phi = -period / 2.0 - phi;
            }
        }
        n[0] = rho * cos(phi);
        n[1] = rho * sin(phi);
    }

    private static void negate(double[] n) {
        n[0] = -n[0];
        n[1] = -n[1];
        n[2] = -n[2];
    }

    /**
     * @return phi shifted by a whole number of periods into [start, start + period)
     */
    private static double reduce(double phi, double period, double start) {
        var reduced = phi - period * floor((phi - start) / period);
        return reduced >= start + period ? start : reduced;
    }

    private static void rotateAzimuth(double[] n, double period, double start) {
        var rho = sqrt(n[0] * n[0] + n[1] * n[1]);
        if (rho == 0.0) {
            return;
        }
        var phi = reduce(atan2(n[1], n[0]), period, start);
        n[0] = rho * cos(phi);
        n[1] = rho * sin(phi);
    }

    private FundamentalZones() {
    }
}
