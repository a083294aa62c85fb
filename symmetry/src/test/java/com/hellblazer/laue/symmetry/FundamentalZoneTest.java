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

import com.hellblazer.laue.orientation.Quaternion;
import com.hellblazer.laue.orientation.Rodrigues;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.hellblazer.laue.symmetry.LaueClass.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class FundamentalZoneTest extends TestBase {
    private static final double SLACK = 1e-9;

    private static double azimuth(Rodrigues rod) {
        return Math.atan2(rod.y(), rod.x());
    }

    /**
     * The folded axis must lie in the wedge of its class
     */
    private static void assertInMisorientationZone(LaueClass laue, Rodrigues rod) {
        double x = rod.x(), y = rod.y(), z = rod.z();
        var message = laue + " " + rod;
        switch (laue) {
            case CUBIC, CUBIC_LOW -> {
                assertTrue(x >= y - SLACK && y >= z - SLACK && z >= -SLACK, message);
            }
            case TETRAGONAL, ORTHORHOMBIC -> {
                assertTrue(x >= -SLACK && y >= -SLACK && z >= -SLACK, message);
            }
            case HEXAGONAL -> {
                assertTrue(z >= -SLACK, message);
                assertTrue(azimuth(rod) >= -SLACK && azimuth(rod) <= Math.PI / 6 + SLACK, message);
            }
            case HEXAGONAL_LOW -> {
                assertTrue(z >= -SLACK, message);
                assertTrue(azimuth(rod) >= -SLACK && azimuth(rod) < Math.PI / 3 + SLACK, message);
            }
            case TETRAGONAL_LOW -> {
                assertTrue(z >= -SLACK, message);
                assertTrue(azimuth(rod) >= -SLACK && azimuth(rod) < Math.PI / 2 + SLACK, message);
            }
            case TRIGONAL -> {
                assertTrue(z >= -SLACK, message);
                assertTrue(Math.abs(azimuth(rod)) <= Math.PI / 6 + SLACK, message);
            }
            case TRIGONAL_LOW -> {
                assertTrue(z >= -SLACK, message);
                assertTrue(azimuth(rod) >= -SLACK && azimuth(rod) < 2 * Math.PI / 3 + SLACK, message);
            }
            case MONOCLINIC -> {
                assertTrue(y >= -SLACK && z >= -SLACK, message);
            }
            case TRICLINIC -> {
                assertTrue(z >= -SLACK, message);
            }
        }
    }

    private static double rotationAngle(Rodrigues rod) {
        return 2.0 * Math.atan(rod.length());
    }

    @ParameterizedTest
    @EnumSource(LaueClass.class)
    @DisplayName("ODF zone representative is the equivalent nearest the origin")
    void testOdfFundamentalZone(LaueClass laue) {
        for (int i = 0; i < 100; i++) {
            var q = randomQuaternion();
            var fz = laue.getODFFZRod(rodrigues(q));
            var fzQuat = quaternion(fz);

            var found = false;
            for (int s = 0; s < laue.getNumSymOps(); s++) {
                var equivalent = laue.getQuatSymOp(s).multiply(q);
                assertTrue(rotationAngle(fz) <= 2.0 * Math.acos(Math.min(1.0, Math.abs(equivalent.w()))) + 1e-9);
                found |= Math.abs(Math.abs(equivalent.dot(fzQuat)) - 1.0) < 1e-9;
            }
            assertTrue(found, laue + ": " + fz + " is not an equivalent of " + q);

            assertSameRotation(fz, laue.getODFFZRod(fz), 1e-9);
        }
    }

    @ParameterizedTest
    @EnumSource(LaueClass.class)
    @DisplayName("ODF zone and FZ quaternion reduce to the same crystal equivalent")
    void testOdfZoneMatchesFZQuat(LaueClass laue) {
        for (int i = 0; i < 200; i++) {
            var q = randomQuaternion();
            assertSameRotation(laue.getFZQuat(q), quaternion(laue.getODFFZRod(rodrigues(q))), 1e-9);
        }
    }

    @Test
    @DisplayName("ODF zone applies operators on the crystal side")
    void testOdfZoneOperatorSide() {
        // 30 degrees about x, then the four fold about z; the reduction removes the four fold
        var q = new Quaternion(Math.sin(Math.toRadians(15)), 0, 0, Math.cos(Math.toRadians(15)));
        var rotated = CUBIC.getQuatSymOp(6).multiply(q);
        assertSameRotation(q, quaternion(CUBIC.getODFFZRod(rodrigues(rotated))), 1e-12);
    }

    @Test
    @DisplayName("Cubic ODF zone is the truncated cube")
    void testCubicOdfZone() {
        for (int i = 0; i < 500; i++) {
            var fz = CUBIC.getODFFZRod(rodrigues(randomQuaternion()));
            var r = fz.vector(0.0);
            for (var c : r) {
                assertTrue(Math.abs(c) <= Math.sqrt(2) - 1 + SLACK, fz.toString());
            }
            assertTrue(Math.abs(r[0]) + Math.abs(r[1]) + Math.abs(r[2]) <= 1.0 + SLACK, fz.toString());
        }
    }

    @Test
    @DisplayName("Identity and half turns")
    void testDegenerateInputs() {
        for (var laue : LaueClass.values()) {
            assertEquals(Rodrigues.IDENTITY, laue.getODFFZRod(Rodrigues.IDENTITY));
            assertEquals(Rodrigues.IDENTITY, laue.getMDFFZRod(Rodrigues.IDENTITY));
        }
        var halfTurn = new Rodrigues(1, 0, 0, Double.POSITIVE_INFINITY);
        assertEquals(halfTurn, TRICLINIC.getODFFZRod(halfTurn));
        // a half turn about a two fold axis reduces to the identity
        assertTrue(CUBIC.getODFFZRod(halfTurn).length() < 1e-9);
        // a half turn about z is not an operator of the monoclinic class
        var zTurn = new Rodrigues(0, 0, 1, Double.POSITIVE_INFINITY);
        var mono = MONOCLINIC.getMDFFZRod(zTurn);
        assertTrue(mono.isInfinite());
        assertEquals(1.0, mono.z(), 1e-12);
    }

    @ParameterizedTest
    @EnumSource(LaueClass.class)
    @DisplayName("MDF zone keeps the rotation angle and folds the axis into the class wedge")
    void testMdfZoneWedge(LaueClass laue) {
        for (int i = 0; i < 200; i++) {
            var rod = rodrigues(randomQuaternion());
            var odf = laue.getODFFZRod(rod);
            var mdf = laue.getMDFFZRod(rod);
            assertEquals(rotationAngle(odf), rotationAngle(mdf), 1e-9);
            assertInMisorientationZone(laue, mdf);
            assertSameRotation(mdf, laue.getMDFFZRod(mdf), 1e-9);
        }
    }

    @ParameterizedTest
    @EnumSource(value = LaueClass.class, mode = EnumSource.Mode.EXCLUDE, names = { "TETRAGONAL" })
    @DisplayName("MDF zone is invariant under operators on either side and grain exchange")
    void testMdfZoneInvariance(LaueClass laue) {
        for (int i = 0; i < 100; i++) {
            var q = randomQuaternion();
            var expected = laue.getMDFFZRod(rodrigues(q));
            assertSameRotation(expected, laue.getMDFFZRod(rodrigues(q.conjugate())), 1e-6);
            for (int a = 0; a < laue.getNumSymOps(); a++) {
                var left = laue.getQuatSymOp(a).multiply(q);
                var right = q.multiply(laue.getQuatSymOp(laue.getNumSymOps() - 1 - a));
                assertSameRotation(expected, laue.getMDFFZRod(rodrigues(left)), 1e-6);
                assertSameRotation(expected, laue.getMDFFZRod(rodrigues(right)), 1e-6);
            }
        }
    }

    @Test
    @DisplayName("Orthorhombic misorientation axes fold into the positive octant")
    void testOrthorhombicFold() {
        var n = Math.sqrt(0.09 + 0.04 + 0.25);
        var rod = new Rodrigues(-0.3 / n, 0.2 / n, -0.5 / n, 0.3);
        var mdf = ORTHORHOMBIC.getMDFFZRod(rod);
        assertEquals(0.3, mdf.length(), 1e-12);
        assertArrayEquals(new double[] { 0.3 / n, 0.2 / n, 0.5 / n }, new double[] { mdf.x(), mdf.y(), mdf.z() },
                          1e-12);
    }

    @Test
    @DisplayName("Tetragonal misorientation axes keep their component order")
    void testTetragonalFold() {
        var n = Math.sqrt(0.01 + 0.04 + 0.25);
        var rod = new Rodrigues(0.1 / n, -0.2 / n, -0.5 / n, 0.2);
        var mdf = TETRAGONAL.getMDFFZRod(rod);
        assertArrayEquals(new double[] { 0.1 / n, 0.2 / n, 0.5 / n }, new double[] { mdf.x(), mdf.y(), mdf.z() },
                          1e-12);
    }

    @Test
    @DisplayName("Cubic misorientation axes are sorted")
    void testCubicFold() {
        var q = new Quaternion(-0.1, 0.05, 0.2, 0.97).normalize();
        var mdf = CUBIC.getMDFFZRod(rodrigues(q));
        assertTrue(mdf.x() >= mdf.y() && mdf.y() >= mdf.z() && mdf.z() >= 0.0);
        var expected = CUBIC.calculateMisorientation(q, Quaternion.IDENTITY);
        assertEquals(expected.angle(), rotationAngle(mdf), 1e-9);
    }
}
