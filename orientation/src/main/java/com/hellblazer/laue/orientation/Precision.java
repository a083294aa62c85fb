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
 * Working width of the conversion engine, with the thresholds tuned for that width.
 *
 * @author hal.hildebrand
 */
public enum Precision {
    DOUBLE(1.0e-10, Math.ulp(1.0)), FLOAT(1.0e-6, Math.ulp(1.0f));

    private final double omToQuThreshold;
    private final double machineEpsilon;

    Precision(double omToQuThreshold, double machineEpsilon) {
        this.omToQuThreshold = omToQuThreshold;
        this.machineEpsilon = machineEpsilon;
    }

    /**
     * @return the machine epsilon of the width, the unit norm tolerance of the quaternion and axis-angle checks
     */
    public double machineEpsilon() {
        return machineEpsilon;
    }

    /**
     * @return radicands of the matrix to quaternion conversion smaller than this are treated as zero
     */
    public double omToQuThreshold() {
        return omToQuThreshold;
    }

    /**
     * Round a value to the width
     */
    public double round(double value) {
        return this == FLOAT ? (double) (float) value : value;
    }
}
