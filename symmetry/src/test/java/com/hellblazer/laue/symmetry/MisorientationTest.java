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

import com.hellblazer.laue.orientation.AxisAngle;
import com.hellblazer.laue.orientation.Quaternion;
import com.hellblazer.laue.orientation.QuaternionLayout;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.hellblazer.laue.symmetry.LaueClass.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class MisorientationTest extends TestBase {

    private static void assertUnitAxis(AxisAngle ax) {
        assertEquals(1.0, Math.sqrt(ax.x() * ax.x() + ax.y() * ax.y() + ax.z() * ax.z()), 1e-9, ax.toString());
    }

    @ParameterizedTest
    @EnumSource(LaueClass.class)
    @DisplayName("An orientation is not misoriented from itself")
    void testIdentity(LaueClass laue) {
        for (int i = 0; i < 50; i++) {
            var q = randomQuaternion();
            var ax = laue.calculateMisorientation(q, q);
            assertEquals(0.0, ax.angle(), 1e-6);
            assertUnitAxis(ax);
        }
        var ax = laue.calculateMisorientation(Quaternion.IDENTITY, Quaternion.IDENTITY);
        assertEquals(AxisAngle.IDENTITY, ax);
    }

    @ParameterizedTest
    @EnumSource(LaueClass.class)
    @DisplayName("Symmetric equivalents of either grain give the same misorientation angle")
    void testSymmetryInvariance(LaueClass laue) {
        for (int i = 0; i < 50; i++) {
            var q1 = randomQuaternion();
            var q2 = randomQuaternion();
            var angle = laue.calculateMisorientation(q1, q2).angle();
            assertTrue(angle >= 0.0 && angle <= Math.PI + 1e-12);
            assertEquals(angle, laue.calculateMisorientation(q2, q1).angle(), 1e-9);
            for (int s = 0; s < laue.getNumSymOps(); s++) {
                var op = laue.getQuatSymOp(s);
                assertEquals(angle, laue.calculateMisorientation(op.multiply(q1), q2).angle(), 1e-9);
                assertEquals(angle, laue.calculateMisorientation(q1, op.multiply(q2)).angle(), 1e-9);
            }
        }
    }

    @Test
    @DisplayName("Cubic closed form agrees with the search over operators")
    void testCubicClosedForm() {
        var maxAngle = 0.0;
        for (int i = 0; i < 500; i++) {
            var q1 = randomQuaternion();
            var q2 = randomQuaternion();
            var closed = Misorientations.cubicMisorientation(q1, q2);
            var generic = Misorientations.genericMisorientation(CUBIC, q1, q2);
            assertEquals(generic.angle(), closed.angle(), 1e-9);
            assertUnitAxis(closed);
            maxAngle = Math.max(maxAngle, closed.angle());
        }
        // the cubic disorientation never exceeds 62.8 degrees
        assertTrue(maxAngle <= Math.toRadians(62.8), "max angle " + Math.toDegrees(maxAngle));
    }

    @Test
    @DisplayName("Cubic misorientation of a quarter turn about an axis is zero")
    void testCubicQuarterTurn() {
        var quarter = new Quaternion(0, 0, Math.sin(Math.PI / 4), Math.cos(Math.PI / 4));
        assertEquals(0.0, CUBIC.calculateMisorientation(quarter, Quaternion.IDENTITY).angle(), 1e-7);
        // a quarter turn is a true misorientation for the orthorhombic operators
        var ortho = ORTHORHOMBIC.calculateMisorientation(quarter, Quaternion.IDENTITY);
        assertEquals(Math.PI / 2, ortho.angle(), 1e-12);
        assertEquals(1.0, Math.abs(ortho.z()), 1e-12);
    }

    @Test
    @DisplayName("Triclinic misorientation is the plain relative rotation")
    void testTriclinic() {
        var q1 = randomQuaternion();
        var q2 = randomQuaternion();
        var relative = q1.multiply(q2.conjugate()).positive();
        var ax = TRICLINIC.calculateMisorientation(q1, q2);
        assertEquals(2.0 * Math.acos(Math.min(1.0, relative.w())), ax.angle(), 1e-12);
    }

    @ParameterizedTest
    @EnumSource(QuaternionLayout.class)
    @DisplayName("Packed quaternion overloads match the object form")
    void testPackedOverloads(QuaternionLayout layout) {
        var q1 = randomQuaternion();
        var q2 = randomQuaternion();
        var expected = HEXAGONAL.calculateMisorientation(q1, q2).toArray();
        var packed = HEXAGONAL.calculateMisorientation(q1.toArray(layout), q2.toArray(layout), layout);
        assertArrayEquals(expected, packed, 1e-15);

        var f1 = new float[4];
        var f2 = new float[4];
        for (int i = 0; i < 4; i++) {
            f1[i] = (float) q1.toArray(layout)[i];
            f2[i] = (float) q2.toArray(layout)[i];
        }
        var single = HEXAGONAL.calculateMisorientation(f1, f2, layout);
        for (int i = 0; i < 4; i++) {
            assertEquals(expected[i], single[i], 1e-5);
        }
    }

    @ParameterizedTest
    @EnumSource(LaueClass.class)
    @DisplayName("Nearest equivalent quaternion")
    void testNearestQuaternion(LaueClass laue) {
        for (int i = 0; i < 50; i++) {
            var q1 = randomQuaternion();
            var q2 = randomQuaternion();
            var nearest = laue.getNearestQuat(q1, q2);
            assertTrue(nearest.w() >= 0.0);
            assertEquals(0.0, laue.calculateMisorientation(nearest, q2).angle(), 1e-6);
            for (int s = 0; s < laue.getNumSymOps(); s++) {
                var candidate = laue.getQuatSymOp(s).multiply(q2).positive();
                assertTrue(q1.dot(nearest) >= q1.dot(candidate) - 1e-15);
            }
        }
        var q1 = randomQuaternion();
        var q2 = randomQuaternion();
        var layout = QuaternionLayout.SCALAR_VECTOR;
        var expected = laue.getNearestQuat(q1, q2).toArray(layout);
        var f1 = new float[4];
        var f2 = new float[4];
        for (int i = 0; i < 4; i++) {
            f1[i] = (float) q1.toArray(layout)[i];
            f2[i] = (float) q2.toArray(layout)[i];
        }
        var single = laue.getNearestQuat(f1, f2, layout);
        for (int i = 0; i < 4; i++) {
            assertEquals(expected[i], single[i], 1e-5);
        }
    }

    @ParameterizedTest
    @EnumSource(LaueClass.class)
    @DisplayName("Fundamental zone quaternion has the largest scalar part")
    void testFundamentalZoneQuaternion(LaueClass laue) {
        for (int i = 0; i < 50; i++) {
            var q = randomQuaternion();
            var fz = laue.getFZQuat(q);
            assertTrue(fz.w() >= 0.0);
            assertEquals(0.0, laue.calculateMisorientation(fz, q).angle(), 1e-6);
            for (int s = 0; s < laue.getNumSymOps(); s++) {
                assertTrue(fz.w() >= laue.getQuatSymOp(s).multiply(q).positive().w() - 1e-15);
            }
            if (laue == CUBIC) {
                assertTrue(fz.w() >= Math.cos(Math.toRadians(62.8) / 2));
            }
        }
    }

    @Test
    @DisplayName("Null quaternions are rejected")
    void testNulls() {
        assertThrows(NullPointerException.class, () -> CUBIC.calculateMisorientation(null, Quaternion.IDENTITY));
        assertThrows(NullPointerException.class, () -> HEXAGONAL.getNearestQuat(Quaternion.IDENTITY, null));
        assertThrows(NullPointerException.class, () -> TRICLINIC.getFZQuat(null));
    }
}
