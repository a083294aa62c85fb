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

import static java.lang.Math.abs;
import static java.lang.Math.acos;

import java.util.Objects;

import javax.vecmath.Matrix3d;
import javax.vecmath.Vector3d;

import com.hellblazer.laue.orientation.OrientationTransforms;
import com.hellblazer.laue.orientation.Quaternion;
import com.hellblazer.laue.orientation.QuaternionLayout;

/**
 * Schmid factors and slip transmission. The twelve {111}&lt;110&gt; systems of face centred cubic crystals are listed
 * plane by plane, three directions per plane.
 *
 * @author hal.hildebrand
 */
final class SlipSystems {
    static final double[][] CUBIC_SLIP_PLANES     = { { 1, 1, 1 }, { 1, 1, 1 }, { 1, 1, 1 }, { 1, 1, -1 },
                                                      { 1, 1, -1 }, { 1, 1, -1 }, { 1, -1, 1 }, { 1, -1, 1 },
                                                      { 1, -1, 1 }, { -1, 1, 1 }, { -1, 1, 1 }, { -1, 1, 1 } };
    static final double[][] CUBIC_SLIP_DIRECTIONS = { { 0, 1, -1 }, { 1, 0, -1 }, { 1, -1, 0 }, { 1, -1, 0 },
                                                      { 1, 0, 1 }, { 0, 1, 1 }, { 1, 1, 0 }, { 0, 1, 1 },
                                                      { 1, 0, -1 }, { 1, 1, 0 }, { 1, 0, 1 }, { 0, 1, -1 } };

    // single precision sqrt 3 and sqrt 2 of the closed form tables
    private static final double SQRT3 = 1.732f;
    private static final double SQRT2 = 1.414f;

    /**
     * Closed form search of the twelve cubic systems. Each system pairs one plane term |load . n| and one direction
     * term |load . d|, in table order.
     */
    static SchmidFactor cubicSchmidFactor(double[] load) {
        requireVector(load, "load");
        double x = load[0], y = load[1], z = load[2];
        var mag = Math.sqrt(x * x + y * y + z * z);
        var theta = new double[] { abs((x + y + z) / (mag * SQRT3)), abs((x + y - z) / (mag * SQRT3)),
                                   abs((x - y + z) / (mag * SQRT3)), abs((-x + y + z) / (mag * SQRT3)) };
        var lambda = new double[] { abs((x + y) / (mag * SQRT2)), abs((x + z) / (mag * SQRT2)),
                                    abs((x - y) / (mag * SQRT2)), abs((x - z) / (mag * SQRT2)),
                                    abs((y + z) / (mag * SQRT2)), abs((y - z) / (mag * SQRT2)) };
        // plane term, direction term for each system
        int[][] pairs = { { 0, 5 }, { 0, 3 }, { 0, 2 }, { 1, 2 }, { 1, 1 }, { 1, 4 }, { 2, 0 }, { 2, 4 }, { 2, 3 },
                          { 3, 0 }, { 3, 1 }, { 3, 5 } };
        var best = 0;
        var bestFactor = theta[pairs[0][0]] * lambda[pairs[0][1]];
        for (int i = 1; i < pairs.length; i++) {
            var factor = theta[pairs[i][0]] * lambda[pairs[i][1]];
            if (factor > bestFactor) {
                bestFactor = factor;
                best = i;
            }
        }
        return new SchmidFactor(bestFactor, best, theta[pairs[best][0]], lambda[pairs[best][1]]);
    }

    /**
     * m' = |cos(n1, n2)| |cos(d1, d2)| of the most highly stressed system of each grain, with plane normals n and slip
     * directions d carried into the sample frame
     */
    static double mPrime(Quaternion q1, Quaternion q2, double[] loadDirection) {
        Objects.requireNonNull(q1, "q1");
        Objects.requireNonNull(q2, "q2");
        requireVector(loadDirection, "loadDirection");
        var load = new Vector3d(loadDirection);
        var first = maxSchmidSystem(q1, load);
        var second = maxSchmidSystem(q2, load);
        return abs(cosine(first[0], second[0])) * abs(cosine(first[1], second[1]));
    }

    /**
     * Search the equivalents of one slip system. Equivalents whose plane normal has a negative z component are the
     * same physical system seen from below and are skipped.
     */
    static SchmidFactor schmidFactor(LaueClass laue, double[] load, double[] plane, double[] direction) {
        requireVector(load, "load");
        requireVector(plane, "plane");
        requireVector(direction, "direction");
        var loadVector = new Vector3d(load);
        var planeVector = new Vector3d(plane);
        var directionVector = new Vector3d(direction);
        var loadMag = loadVector.length();
        var planeMag = planeVector.length();
        var directionMag = directionVector.length();

        var factor = 0.0;
        var slipSystem = 0;
        var planeAngle = 0.0;
        var directionAngle = 0.0;
        var n = new Vector3d();
        var d = new Vector3d();
        for (int i = 0; i < laue.getNumSymOps(); i++) {
            var op = laue.matOp(i);
            op.transform(planeVector, n);
            if (n.z < 0.0) {
                continue;
            }
            op.transform(directionVector, d);
            var cosPhi = abs(loadVector.dot(n)) / (planeMag * loadMag);
            var cosLambda = abs(loadVector.dot(d)) / (directionMag * loadMag);
            var candidate = cosPhi * cosLambda;
            if (candidate > factor) {
                factor = candidate;
                slipSystem = i;
                planeAngle = acos(Math.min(1.0, cosPhi));
                directionAngle = acos(Math.min(1.0, cosLambda));
            }
        }
        return new SchmidFactor(factor, slipSystem, planeAngle, directionAngle);
    }

    private static double cosine(Vector3d a, Vector3d b) {
        var denom = a.length() * b.length();
        return denom == 0.0 ? 0.0 : a.dot(b) / denom;
    }

    /**
     * @return the sample frame plane normal and slip direction of the system with the highest Schmid factor
     */
    private static Vector3d[] maxSchmidSystem(Quaternion q, Vector3d load) {
        var g = new Matrix3d(OrientationTransforms.DOUBLE.qu2om(q.toArray(QuaternionLayout.VECTOR_SCALAR),
                                                                QuaternionLayout.VECTOR_SCALAR));
        g.transpose();
        Vector3d bestPlane = null;
        Vector3d bestDirection = null;
        var bestFactor = -1.0;
        for (int i = 0; i < CUBIC_SLIP_PLANES.length; i++) {
            var n = new Vector3d(CUBIC_SLIP_PLANES[i]);
            var d = new Vector3d(CUBIC_SLIP_DIRECTIONS[i]);
            g.transform(n);
            g.transform(d);
            n.normalize();
            d.normalize();
            var factor = abs(cosine(load, d)) * abs(cosine(load, n));
            if (factor > bestFactor) {
                bestFactor = factor;
                bestPlane = n;
                bestDirection = d;
            }
        }
        return new Vector3d[] { bestPlane, bestDirection };
    }

    private static void requireVector(double[] v, String name) {
        Objects.requireNonNull(v, name);
        if (v.length != 3) {
            throw new IllegalArgumentException(name + " must have 3 components, got " + v.length);
        }
        if (v[0] == 0.0 && v[1] == 0.0 && v[2] == 0.0) {
            throw new IllegalArgumentException(name + " must not be the zero vector");
        }
    }

    private SlipSystems() {
    }
}
