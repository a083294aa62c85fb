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
 * The seven rotation parameterizations, in canonical order.
 *
 * @author hal.hildebrand
 */
public enum OrientationRepresentation {
    EULER("Euler", "eu", 3), ORIENTATION_MATRIX("Orientation Matrix", "om", 9), QUATERNION("Quaternion", "qu", 4),
    AXIS_ANGLE("Axis-Angle", "ax", 4), RODRIGUES("Rodrigues", "ro", 4), HOMOCHORIC("Homochoric", "ho", 3),
    CUBOCHORIC("Cubochoric", "cu", 3);

    private final String displayName;
    private final String code;
    private final int    componentCount;

    OrientationRepresentation(String displayName, String code, int componentCount) {
        this.displayName = displayName;
        this.code = code;
        this.componentCount = componentCount;
    }

    public static OrientationRepresentation fromCode(String code) {
        for (var r : values()) {
            if (r.code.equals(code)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unknown representation code: " + code);
    }

    /**
     * @return the two letter code used in conversion names, e.g. "eu" for Euler angles
     */
    public String code() {
        return code;
    }

    /**
     * @return the number of values of one tuple
     */
    public int componentCount() {
        return componentCount;
    }

    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
