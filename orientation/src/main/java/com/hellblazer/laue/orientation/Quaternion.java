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

import static java.lang.Math.abs;
import static java.lang.Math.sqrt;

import java.util.Objects;

/**
 * Immutable rotation quaternion with vector part (x, y, z) and scalar part w. Products are Hamilton products.
 *
 * @author hal.hildebrand
 */
public final class Quaternion implements Orientation {
    public static final Quaternion IDENTITY = new Quaternion(0, 0, 0, 1);

    public static Quaternion of(double[] values, QuaternionLayout layout) {
        Tuples.requireLength(values, 4);
        return new Quaternion(values[layout.x()], values[layout.y()], values[layout.z()], values[layout.w()]);
    }

    public static Quaternion of(float[] values, QuaternionLayout layout) {
        return of(Tuples.toDoubles(values), layout);
    }

    private final double x, y, z, w;

    public Quaternion(double x, double y, double z, double w) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.w = w;
    }

    @Override
    public ValidityResult check() {
        return ValidityChecks.quCheck(toArray(), QuaternionLayout.VECTOR_SCALAR, Precision.DOUBLE);
    }

    /**
     * @return the conjugate, the inverse rotation of a unit quaternion
     */
    public Quaternion conjugate() {
        return new Quaternion(-x, -y, -z, w);
    }

    public double dot(Quaternion q) {
        return x * q.x + y * q.y + z * q.z + w * q.w;
    }

    /**
     * @return the quaternion with every component replaced by its absolute value
     */
    public Quaternion elementWiseAbs() {
        return new Quaternion(abs(x), abs(y), abs(z), abs(w));
    }

    public boolean epsilonEquals(Quaternion q, double epsilon) {
        return abs(x - q.x) <= epsilon && abs(y - q.y) <= epsilon && abs(z - q.z) <= epsilon
        && abs(w - q.w) <= epsilon;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Quaternion other = (Quaternion) obj;
        return Double.doubleToLongBits(x) == Double.doubleToLongBits(other.x)
        && Double.doubleToLongBits(y) == Double.doubleToLongBits(other.y)
        && Double.doubleToLongBits(z) == Double.doubleToLongBits(other.z)
        && Double.doubleToLongBits(w) == Double.doubleToLongBits(other.w);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z, w);
    }

    public double magnitude() {
        return sqrt(x * x + y * y + z * z + w * w);
    }

    /**
     * Hamilton product this * rhs
     */
    public Quaternion multiply(Quaternion rhs) {
        return new Quaternion(w * rhs.x + x * rhs.w + y * rhs.z - z * rhs.y,
                              w * rhs.y - x * rhs.z + y * rhs.w + z * rhs.x,
                              w * rhs.z + x * rhs.y - y * rhs.x + z * rhs.w,
                              w * rhs.w - x * rhs.x - y * rhs.y - z * rhs.z);
    }

    public Quaternion negate() {
        return new Quaternion(-x, -y, -z, -w);
    }

    public Quaternion normalize() {
        var n = magnitude();
        if (n == 0.0) {
            return this;
        }
        return new Quaternion(x / n, y / n, z / n, w / n);
    }

    /**
     * @return this quaternion, or its negation when the scalar part is negative. Both code the same rotation.
     */
    public Quaternion positive() {
        return w < 0.0 ? negate() : this;
    }

    @Override
    public OrientationRepresentation representation() {
        return OrientationRepresentation.QUATERNION;
    }

    @Override
    public double[] toArray() {
        return toArray(QuaternionLayout.VECTOR_SCALAR);
    }

    public double[] toArray(QuaternionLayout layout) {
        return layout.pack(w, x, y, z);
    }

    @Override
    public String toString() {
        return "Quaternion[x=" + x + ", y=" + y + ", z=" + z + ", w=" + w + "]";
    }

    public double w() {
        return w;
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public double z() {
        return z;
    }
}
