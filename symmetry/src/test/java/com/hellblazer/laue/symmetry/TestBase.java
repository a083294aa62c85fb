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

import com.hellblazer.laue.orientation.OrientationTransforms;
import com.hellblazer.laue.orientation.Quaternion;
import com.hellblazer.laue.orientation.QuaternionLayout;
import com.hellblazer.laue.orientation.Rodrigues;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Base class for symmetry tests providing a seeded random source and rotation comparisons.
 */
public abstract class TestBase {

    protected static final Logger                log         = LoggerFactory.getLogger(TestBase.class);
    protected static final long                  RANDOM_SEED = 42L;
    protected static final OrientationTransforms TRANSFORMS  = OrientationTransforms.DOUBLE;

    protected Random random;

    /**
     * q and -q are the same rotation; compare after aligning signs.
     */
    protected static void assertSameRotation(Quaternion expected, Quaternion actual, double tolerance) {
        var sign = expected.dot(actual) < 0.0 ? -1.0 : 1.0;
        var e = expected.toArray();
        var a = actual.toArray();
        for (int i = 0; i < 4; i++) {
            if (Math.abs(e[i] - sign * a[i]) > tolerance) {
                fail("Rotations differ: expected " + expected + " but was " + actual);
            }
        }
    }

    protected static void assertSameRotation(Rodrigues expected, Rodrigues actual, double tolerance) {
        assertSameRotation(quaternion(expected), quaternion(actual), tolerance);
    }

    protected static void assertTupleEquals(double[] expected, double[] actual, double tolerance) {
        for (int i = 0; i < expected.length; i++) {
            if (Math.abs(expected[i] - actual[i]) > tolerance) {
                fail("Component " + i + " differs: expected " + Arrays.toString(expected) + " but was "
                     + Arrays.toString(actual));
            }
        }
    }

    protected static Quaternion quaternion(Rodrigues rod) {
        return Quaternion.of(TRANSFORMS.ro2qu(rod.toArray()), QuaternionLayout.VECTOR_SCALAR);
    }

    protected static Rodrigues rodrigues(Quaternion q) {
        return Rodrigues.of(TRANSFORMS.qu2ro(q.toArray()));
    }

    @BeforeEach
    void setUp(TestInfo testInfo) {
        log.debug("Starting test: {}.{}", testInfo.getTestClass().map(Class::getSimpleName).orElse("Unknown"),
                  testInfo.getDisplayName());

        random = new Random(RANDOM_SEED);
    }

    /**
     * Uniformly distributed unit quaternion with non-negative scalar part
     */
    protected Quaternion randomQuaternion() {
        var u1 = random.nextDouble();
        var u2 = random.nextDouble() * 2.0 * Math.PI;
        var u3 = random.nextDouble() * 2.0 * Math.PI;
        var a = Math.sqrt(1.0 - u1);
        var b = Math.sqrt(u1);
        return new Quaternion(a * Math.sin(u2), a * Math.cos(u2), b * Math.sin(u3), b * Math.cos(u3)).positive();
    }
}
