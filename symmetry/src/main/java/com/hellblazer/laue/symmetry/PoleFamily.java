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
 * A family of crystal directions plotted together on a pole figure, such as the cubic &lt;111&gt;. Directions are unit
 * vectors in the crystal frame; only one of each antipodal pair is listed.
 *
 * @author hal.hildebrand
 */
public record PoleFamily(String label, double[][] directions) {

    public PoleFamily {
        directions = directions.clone();
        for (int i = 0; i < directions.length; i++) {
            if (directions[i].length != 3) {
                throw new IllegalArgumentException("Direction " + i + " of " + label + " is not a 3 vector");
            }
            directions[i] = directions[i].clone();
        }
    }

    /**
     * @return the direction at the index, as a copy
     */
    public double[] direction(int index) {
        return directions[index].clone();
    }

    /**
     * @return the number of floats one orientation occupies in the sphere coordinate output: a direction and its
     *         antipode per family member
     */
    public int floatsPerOrientation() {
        return directions.length * 6;
    }

    public int size() {
        return directions.length;
    }

    @Override
    public String toString() {
        return "PoleFamily[" + label + ", " + directions.length + " directions]";
    }
}
