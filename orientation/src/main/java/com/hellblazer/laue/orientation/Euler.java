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
 * Bunge Euler angles in radians. Domain: phi1 in [0, 2pi], phi in [0, pi], phi2 in [0, 2pi].
 *
 * @author hal.hildebrand
 */
public record Euler(double phi1, double phi, double phi2) implements Orientation {

    public static Euler of(double[] values) {
        Tuples.requireLength(values, 3);
        return new Euler(values[0], values[1], values[2]);
    }

    @Override
    public ValidityResult check() {
        return ValidityChecks.euCheck(toArray());
    }

    @Override
    public OrientationRepresentation representation() {
        return OrientationRepresentation.EULER;
    }

    @Override
    public double[] toArray() {
        return new double[] { phi1, phi, phi2 };
    }
}
