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

/**
 * Thrown when an operation has no definition for a Laue class, such as the {111}&lt;110&gt; slip system factors for
 * anything but the full cubic class.
 *
 * @author hal.hildebrand
 */
public class UnsupportedSymmetryOperationException extends UnsupportedOperationException {
    private static final long serialVersionUID = 1L;

    private final LaueClass laueClass;

    public UnsupportedSymmetryOperationException(LaueClass laueClass, String operation) {
        super(operation + " is not defined for " + laueClass.getSymmetryName());
        this.laueClass = laueClass;
    }

    public LaueClass getLaueClass() {
        return laueClass;
    }
}
