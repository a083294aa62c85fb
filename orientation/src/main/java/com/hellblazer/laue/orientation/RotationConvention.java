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
 * Sign convention of the rotation formulas. The passive convention rotates the reference frame and is the default.
 *
 * @author hal.hildebrand
 */
public enum RotationConvention {
    PASSIVE(1), ACTIVE(-1);

    private final int epsijk;

    RotationConvention(int epsijk) {
        this.epsijk = epsijk;
    }

    /**
     * @return the sign multiplied into every axis extraction, +1 for passive and -1 for active
     */
    public int epsijk() {
        return epsijk;
    }
}
