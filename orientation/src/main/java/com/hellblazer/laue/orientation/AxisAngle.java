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

/**
 * Unit rotation axis and rotation angle in [0, pi].
 *
 * @author hal.hildebrand
 */
public record AxisAngle(double x, double y, double z, double angle) implements Orientation {
    public static final AxisAngle IDENTITY = new AxisAngle(0, 0, 1, 0);

    public static AxisAngle of(double[] values) {
        Tuples.requireLength(values, 4);
        return new AxisAngle(values[0], values[1], values[2], values[3]);
    }

    @Override
    public ValidityResult check() {
        return ValidityChecks.axCheck(toArray(), Precision.DOUBLE);
    }

    @Override
    public OrientationRepresentation representation() {
        return OrientationRepresentation.AXIS_ANGLE;
    }

    @Override
    public double[] toArray() {
        return new double[] { x, y, z, angle };
    }
}
