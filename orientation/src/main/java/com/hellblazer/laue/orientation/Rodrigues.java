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
 * Rodrigues-Frank vector stored as unit axis and length tan(angle / 2). The length is non-negative and is
 * {@link Double#POSITIVE_INFINITY} for a rotation of pi.
 *
 * @author hal.hildebrand
 */
public record Rodrigues(double x, double y, double z, double length) implements Orientation {
    public static final Rodrigues IDENTITY = new Rodrigues(0, 0, 0, 0);

    public static Rodrigues of(double[] values) {
        Tuples.requireLength(values, 4);
        return new Rodrigues(values[0], values[1], values[2], values[3]);
    }

    @Override
    public ValidityResult check() {
        return ValidityChecks.roCheck(toArray());
    }

    public boolean isInfinite() {
        return Double.isInfinite(length);
    }

    @Override
    public OrientationRepresentation representation() {
        return OrientationRepresentation.RODRIGUES;
    }

    @Override
    public double[] toArray() {
        return new double[] { x, y, z, length };
    }

    /**
     * @return the vector axis * length, with an infinite length replaced by the finite stand in
     */
    public double[] vector(double infiniteLength) {
        var l = isInfinite() ? infiniteLength : length;
        return new double[] { x * l, y * l, z * l };
    }
}
