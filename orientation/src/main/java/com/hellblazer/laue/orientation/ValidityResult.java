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
 * Outcome of a validity check. A result of 1 is valid, zero or negative codes identify the failed test.
 *
 * @author hal.hildebrand
 */
public record ValidityResult(int result, String message) {
    public static final ValidityResult VALID = new ValidityResult(1, "");

    public static ValidityResult failure(int code, String message) {
        if (code > 0) {
            throw new IllegalArgumentException("Failure codes must not be positive: " + code);
        }
        return new ValidityResult(code, message);
    }

    public boolean isValid() {
        return result > 0;
    }
}
