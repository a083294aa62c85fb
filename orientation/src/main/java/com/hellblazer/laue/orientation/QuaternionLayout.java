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
 * Memory layout of a quaternion tuple.
 *
 * @author hal.hildebrand
 */
public enum QuaternionLayout {
    /**
     * (w, x, y, z)
     */
    SCALAR_VECTOR(0, 1, 2, 3),
    /**
     * (x, y, z, w)
     */
    VECTOR_SCALAR(3, 0, 1, 2);

    private final int w, x, y, z;

    QuaternionLayout(int w, int x, int y, int z) {
        this.w = w;
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public int w() {
        return w;
    }

    public int x() {
        return x;
    }

    public int y() {
        return y;
    }

    public int z() {
        return z;
    }

    /**
     * Lay out the components
     */
    public double[] pack(double w, double x, double y, double z) {
        var q = new double[4];
        q[this.w] = w;
        q[this.x] = x;
        q[this.y] = y;
        q[this.z] = z;
        return q;
    }

    /**
     * Reorder a tuple of this layout into the target layout
     */
    public double[] convert(double[] q, QuaternionLayout target) {
        return target.pack(q[w], q[x], q[y], q[z]);
    }
}
