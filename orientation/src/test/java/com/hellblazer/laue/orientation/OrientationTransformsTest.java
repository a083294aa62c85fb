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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.hellblazer.laue.orientation.OrientationRepresentation.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class OrientationTransformsTest extends TestBase {

    private final OrientationTransforms transforms = OrientationTransforms.DOUBLE;

    @Test
    @DisplayName("Zero Euler angles give the identity matrix")
    void testIdentityEulerToMatrix() {
        var om = transforms.eu2om(new double[] { 0, 0, 0 });
        assertTupleEquals(new double[] { 1, 0, 0, 0, 1, 0, 0, 0, 1 }, om, 1e-15);
    }

    @Test
    @DisplayName("Scalar first identity quaternion gives the identity axis-angle")
    void testIdentityQuaternionToAxisAngle() {
        var ax = transforms.qu2ax(new double[] { 1, 0, 0, 0 }, QuaternionLayout.SCALAR_VECTOR);
        assertArrayEquals(new double[] { 0, 0, 1, 0 }, ax);
    }

    @Test
    @DisplayName("Infinite Rodrigues vector is a rotation of pi")
    void testInfiniteRodrigues() {
        var ax = transforms.ro2ax(new double[] { 0, 0, 1, Double.POSITIVE_INFINITY });
        assertArrayEquals(new double[] { 0, 0, 1, Math.PI }, ax);
    }

    @Test
    @DisplayName("Rotations of pi become infinite Rodrigues vectors and back")
    void testPiRotations() {
        var ro = transforms.ax2ro(new double[] { 0, 0, 1, Math.PI });
        assertEquals(Double.POSITIVE_INFINITY, ro[3]);
        assertEquals(Math.PI, transforms.ro2ax(ro)[3]);

        ro = transforms.qu2ro(transforms.ax2qu(new double[] { 1, 0, 0, Math.PI }));
        assertEquals(Double.POSITIVE_INFINITY, ro[3]);
        assertArrayEquals(new double[] { 1, 0, 0 }, new double[] { ro[0], ro[1], ro[2] }, 1e-15);

        ro = transforms.eu2ro(new double[] { 0, Math.PI, 0 });
        assertEquals(Double.POSITIVE_INFINITY, ro[3]);
        assertEquals(Math.PI, transforms.ro2ax(ro)[3]);

        var ho = transforms.ro2ho(new double[] { 0, 1, 0, Double.POSITIVE_INFINITY });
        assertEquals(LambertProjection.R1, Tuples.magnitude3(ho), 1e-12);
    }

    @Test
    @DisplayName("Zero rotations give the identity sentinels")
    void testZeroRotations() {
        assertArrayEquals(new double[] { 0, 0, 1, 0 }, transforms.ro2ax(new double[] { 0, 0, 0, 0 }));
        assertArrayEquals(new double[] { 0, 0, 1, 0 }, transforms.ho2ax(new double[] { 0, 0, 0 }));
        assertArrayEquals(new double[] { 0, 0, 1, 0 }, transforms.eu2ax(new double[] { 0, 0, 0 }));
        assertArrayEquals(new double[] { 0, 0, 0, 0 }, transforms.ax2ro(new double[] { 0, 0, 1, 0 }));
        assertArrayEquals(new double[] { 0, 0, 0, 1 }, transforms.ax2qu(new double[] { 0, 0, 1, 0 }));
        assertArrayEquals(new double[] { 0, 0, 0 }, transforms.qu2ho(new double[] { 0, 0, 0, 1 }));
        assertArrayEquals(new double[] { 0, 0, 0 }, transforms.ho2cu(new double[] { 0, 0, 0 }));
        assertArrayEquals(new double[] { 0, 0, 0, 0 }, transforms.qu2ro(new double[] { 0, 0, 0, 1 }));
    }

    @Test
    @DisplayName("Quaternions with a negative scalar part give finite unit axis Rodrigues vectors")
    void testNegativeScalarQuaternionToRodrigues() {
        var half = Math.toRadians(25);
        var qu = new double[] { -Math.sin(half), 0, 0, -Math.cos(half) };
        var ro = transforms.qu2ro(qu);
        assertTupleEquals(new double[] { 1, 0, 0, Math.tan(half) }, ro, 1e-15);
        assertTupleEquals(new double[] { Math.sin(half), 0, 0, Math.cos(half) }, transforms.ro2qu(ro), 1e-15);

        var scalarFirst = transforms.qu2ro(new double[] { -Math.cos(half), -Math.sin(half), 0, 0 },
                                           QuaternionLayout.SCALAR_VECTOR);
        assertTupleEquals(ro, scalarFirst, 1e-15);

        for (int i = 0; i < 1000; i++) {
            var q = randomQuaternion();
            var negated = new double[] { -q[0], -q[1], -q[2], -q[3] };
            var expected = transforms.qu2ro(q);
            var actual = transforms.qu2ro(negated);
            assertEquals(1.0, Tuples.magnitude3(actual), 1e-12);
            assertTrue(Double.isFinite(actual[3]) && actual[3] >= 0.0);
            assertTupleEquals(expected, actual, 1e-12);
        }
    }

    @Test
    @DisplayName("Euler to matrix to Euler reproduces the input")
    void testEulerMatrixRoundTrip() {
        for (int i = 0; i < 1000; i++) {
            var eu = randomEuler();
            var back = transforms.om2eu(transforms.eu2om(eu));
            for (int j = 0; j < 3; j++) {
                assertEquals(0.0, angleDistance(eu[j], back[j]), 1e-6, "angle " + j + " of sample " + i);
            }
        }
    }

    @Test
    @DisplayName("Euler to quaternion to matrix agrees with Euler to matrix")
    void testCrossPathConsistency() {
        for (int i = 0; i < 1000; i++) {
            var eu = randomEuler();
            assertTupleEquals(transforms.eu2om(eu), transforms.qu2om(transforms.eu2qu(eu)), 1e-6);
        }
    }

    @Test
    @DisplayName("Euler to quaternion to Euler reproduces the input in both layouts")
    void testQuaternionRoundTrip() {
        for (var layout : QuaternionLayout.values()) {
            for (int i = 0; i < 500; i++) {
                var eu = randomEuler();
                var qu = transforms.eu2qu(eu, layout);
                assertTrue(qu[layout.w()] >= 0.0);
                var back = transforms.qu2eu(qu, layout);
                for (int j = 0; j < 3; j++) {
                    assertEquals(0.0, angleDistance(eu[j], back[j]), 1e-6);
                }
            }
        }
    }

    @Test
    @DisplayName("Quaternion layouts differ only in component order")
    void testLayouts() {
        var eu = randomEuler();
        var vs = transforms.eu2qu(eu, QuaternionLayout.VECTOR_SCALAR);
        var sv = transforms.eu2qu(eu, QuaternionLayout.SCALAR_VECTOR);
        assertArrayEquals(sv, QuaternionLayout.VECTOR_SCALAR.convert(vs, QuaternionLayout.SCALAR_VECTOR));
        assertArrayEquals(transforms.qu2om(vs, QuaternionLayout.VECTOR_SCALAR),
                          transforms.qu2om(sv, QuaternionLayout.SCALAR_VECTOR));
        assertArrayEquals(transforms.qu2ax(vs), transforms.qu2ax(sv, QuaternionLayout.SCALAR_VECTOR));
    }

    @ParameterizedTest
    @EnumSource(OrientationRepresentation.class)
    @DisplayName("Every conversion preserves the rotation")
    void testAllConversions(OrientationRepresentation from) {
        for (int i = 0; i < 50; i++) {
            var qu = randomQuaternion();
            if (qu[3] < 0.05 || qu[3] > 0.999) {
                continue;
            }
            var source = transforms.convert(QUATERNION, from, qu, QuaternionLayout.VECTOR_SCALAR);
            for (var to : OrientationRepresentation.values()) {
                var converted = transforms.convert(from, to, source, QuaternionLayout.VECTOR_SCALAR);
                assertEquals(to.componentCount(), converted.length);
                var back = transforms.convert(to, QUATERNION, converted, QuaternionLayout.VECTOR_SCALAR);
                assertSameRotation(qu, back, 1e-6);
            }
        }
    }

    @Test
    @DisplayName("Axis-angle and Rodrigues axes have unit norm")
    void testAxisNormalization() {
        for (int i = 0; i < 1000; i++) {
            var qu = randomQuaternion();
            var ax = transforms.qu2ax(qu);
            assertEquals(1.0, Tuples.magnitude3(ax), 1e-12);
            assertTrue(ax[3] >= 0.0 && ax[3] <= Math.PI);
            var ro = transforms.ax2ro(ax);
            assertEquals(1.0, Tuples.magnitude3(ro), 1e-12);
            assertTrue(ro[3] >= 0.0);
            assertEquals(1.0, Tuples.magnitude3(transforms.om2ax(transforms.qu2om(qu))), 1e-12);
        }
    }

    @Test
    @DisplayName("Returned Euler angles lie in their domain")
    void testEulerDomain() {
        for (int i = 0; i < 1000; i++) {
            var qu = randomQuaternion();
            assertTrue(ValidityChecks.euCheck(transforms.qu2eu(qu)).isValid());
            assertTrue(ValidityChecks.euCheck(transforms.om2eu(transforms.qu2om(qu))).isValid());
        }
    }

    @Test
    @DisplayName("Gimbal lock sets phi2 to zero")
    void testGimbalLock() {
        var eu = transforms.om2eu(transforms.eu2om(new double[] { 0.3, 0.0, 0.2 }));
        assertTupleEquals(new double[] { 0.5, 0.0, 0.0 }, eu, 1e-12);

        eu = transforms.om2eu(transforms.eu2om(new double[] { 0.3, Math.PI, 0.2 }));
        assertTupleEquals(new double[] { 0.1, Math.PI, 0.0 }, eu, 1e-12);

        eu = transforms.qu2eu(transforms.eu2qu(new double[] { 0.3, 0.0, 0.2 }));
        assertTupleEquals(new double[] { 0.5, 0.0, 0.0 }, eu, 1e-12);
    }

    @Test
    @DisplayName("Outputs satisfy the destination checks")
    void testOutputsAreValid() {
        for (int i = 0; i < 200; i++) {
            var eu = randomEuler();
            assertTrue(ValidityChecks.omCheck(transforms.eu2om(eu)).isValid());
            assertTrue(ValidityChecks.hoCheck(transforms.eu2ho(eu)).isValid());
            assertTrue(ValidityChecks.cuCheck(transforms.eu2cu(eu)).isValid());
            assertTrue(ValidityChecks.roCheck(transforms.eu2ro(eu)).isValid());
        }
    }

    @Test
    @DisplayName("Quaternions with negative scalar part give the same homochoric vector")
    void testNegativeScalarQuaternion() {
        var qu = randomQuaternion();
        var negated = new double[] { -qu[0], -qu[1], -qu[2], -qu[3] };
        assertTupleEquals(transforms.qu2ho(qu), transforms.qu2ho(negated), 1e-15);
        assertTupleEquals(transforms.qu2ax(qu), transforms.qu2ax(negated), 1e-15);
    }

    @Test
    @DisplayName("Single precision conversions agree with double precision")
    void testFloatWidth() {
        for (int i = 0; i < 200; i++) {
            var eu = randomEuler();
            var euF = Tuples.toFloats(eu);
            var quF = OrientationTransforms.FLOAT.convert(EULER, QUATERNION, euF, QuaternionLayout.VECTOR_SCALAR);
            var qu = transforms.eu2qu(Tuples.toDoubles(euF));
            assertSameRotation(qu, Tuples.toDoubles(quF), 1e-6);

            var omF = OrientationTransforms.FLOAT.convert(EULER, ORIENTATION_MATRIX, euF,
                                                          QuaternionLayout.VECTOR_SCALAR);
            var quFromOm = OrientationTransforms.FLOAT.convert(ORIENTATION_MATRIX, QUATERNION, omF,
                                                               QuaternionLayout.VECTOR_SCALAR);
            assertSameRotation(qu, Tuples.toDoubles(quFromOm), 1e-5);
        }
        assertSame(OrientationTransforms.FLOAT, OrientationTransforms.forPrecision(Precision.FLOAT));
        assertEquals(Precision.FLOAT, OrientationTransforms.FLOAT.precision());
    }

    @Test
    @DisplayName("Same kind conversion copies and bad tuples are rejected")
    void testDispatchContract() {
        var eu = randomEuler();
        var copy = transforms.convert(EULER, EULER, eu, QuaternionLayout.VECTOR_SCALAR);
        assertNotSame(eu, copy);
        assertArrayEquals(eu, copy);
        assertThrows(IllegalArgumentException.class,
                     () -> transforms.convert(QUATERNION, EULER, new double[3], QuaternionLayout.VECTOR_SCALAR));
        assertThrows(IllegalArgumentException.class,
                     () -> transforms.convert(EULER, QUATERNION, (double[]) null, QuaternionLayout.VECTOR_SCALAR));
    }

    @Test
    @DisplayName("Typed conversions produce typed orientations")
    void testTypedConversion() {
        var euler = new Euler(0.4, 0.7, 1.1);
        var q = (Quaternion) transforms.convert(euler, QUATERNION);
        assertSameRotation(transforms.eu2qu(euler.toArray()), q.toArray(), 1e-15);
        var back = (Euler) transforms.convert(q, EULER);
        assertEquals(0.4, back.phi1(), 1e-12);
        assertEquals(0.7, back.phi(), 1e-12);
        assertEquals(1.1, back.phi2(), 1e-12);
        var matrix = (OrientationMatrix) transforms.convert(euler, ORIENTATION_MATRIX);
        assertTrue(matrix.check().isValid());
        assertTrue(transforms.convert(euler, RODRIGUES) instanceof Rodrigues);
        assertTrue(transforms.convert(euler, CUBOCHORIC).check().isValid());
    }
}
