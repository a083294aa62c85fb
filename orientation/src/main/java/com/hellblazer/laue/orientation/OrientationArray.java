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

import java.util.Arrays;

/**
 * A named flat array of orientation tuples of one representation, backed by either double or float storage. The
 * storage width is the working precision of every conversion of the array.
 *
 * @author hal.hildebrand
 */
public final class OrientationArray {

    public static OrientationArray allocate(String name, OrientationRepresentation representation, int tuples,
                                            Precision precision) {
        if (tuples < 0) {
            throw new IllegalArgumentException("Negative tuple count: " + tuples);
        }
        var length = tuples * representation.componentCount();
        return precision == Precision.FLOAT ? new OrientationArray(name, representation, null, new float[length])
                                            : new OrientationArray(name, representation, new double[length], null);
    }

    public static OrientationArray ofDoubles(String name, OrientationRepresentation representation, double[] values)
    throws OrientationException {
        return ofDoubles(name, representation, representation == null ? 0 : representation.componentCount(), values);
    }

    /**
     * Wrap the values as tuples of the representation. The declared component count must be the canonical count of
     * the representation and the array must hold a whole number of tuples.
     */
    public static OrientationArray ofDoubles(String name, OrientationRepresentation representation,
                                             int componentCount, double[] values) throws OrientationException {
        if (values == null) {
            throw new OrientationException("Missing input values for " + name);
        }
        validate(name, representation, componentCount, values.length);
        return new OrientationArray(name, representation, values, null);
    }

    public static OrientationArray ofFloats(String name, OrientationRepresentation representation, float[] values)
    throws OrientationException {
        return ofFloats(name, representation, representation == null ? 0 : representation.componentCount(), values);
    }

    public static OrientationArray ofFloats(String name, OrientationRepresentation representation, int componentCount,
                                            float[] values) throws OrientationException {
        if (values == null) {
            throw new OrientationException("Missing input values for " + name);
        }
        validate(name, representation, componentCount, values.length);
        return new OrientationArray(name, representation, null, values);
    }

    private static void validate(String name, OrientationRepresentation representation, int componentCount,
                                 int length) throws OrientationException {
        if (representation == null) {
            throw new OrientationException("Missing representation for " + name);
        }
        if (componentCount != representation.componentCount()) {
            throw new OrientationException(
            name + ": " + representation + " requires " + representation.componentCount() + " components, declared "
            + componentCount);
        }
        if (length % componentCount != 0) {
            throw new OrientationException(
            name + ": array length " + length + " is not a whole number of " + componentCount + " component tuples");
        }
    }

    private final String                    name;
    private final OrientationRepresentation representation;
    private final double[]                  doubles;
    private final float[]                   floats;

    private OrientationArray(String name, OrientationRepresentation representation, double[] doubles,
                             float[] floats) {
        this.name = name;
        this.representation = representation;
        this.doubles = doubles;
        this.floats = floats;
    }

    public int componentCount() {
        return representation.componentCount();
    }

    /**
     * @return a deep copy with the given name
     */
    public OrientationArray copy(String newName) {
        return new OrientationArray(newName, representation, doubles == null ? null : doubles.clone(),
                                    floats == null ? null : floats.clone());
    }

    public OrientationArray deepCopy() {
        return copy(name);
    }

    /**
     * @return the backing double storage
     * @throws IllegalStateException if the array is float backed
     */
    public double[] doubleValues() {
        if (doubles == null) {
            throw new IllegalStateException(name + " is float backed");
        }
        return doubles;
    }

    /**
     * @return the backing float storage
     * @throws IllegalStateException if the array is double backed
     */
    public float[] floatValues() {
        if (floats == null) {
            throw new IllegalStateException(name + " is double backed");
        }
        return floats;
    }

    public double get(int tuple, int component) {
        var index = tuple * componentCount() + component;
        return doubles != null ? doubles[index] : floats[index];
    }

    /**
     * @return a copy of the tuple widened to double
     */
    public double[] getTuple(int tuple) {
        checkTuple(tuple);
        var count = componentCount();
        var result = new double[count];
        var offset = tuple * count;
        if (doubles != null) {
            System.arraycopy(doubles, offset, result, 0, count);
        } else {
            for (int i = 0; i < count; i++) {
                result[i] = floats[offset + i];
            }
        }
        return result;
    }

    public boolean isFloat() {
        return floats != null;
    }

    public String name() {
        return name;
    }

    public int numTuples() {
        var length = doubles != null ? doubles.length : floats.length;
        return length / componentCount();
    }

    public Precision precision() {
        return floats != null ? Precision.FLOAT : Precision.DOUBLE;
    }

    public OrientationRepresentation representation() {
        return representation;
    }

    public void set(int tuple, int component, double value) {
        var index = tuple * componentCount() + component;
        if (doubles != null) {
            doubles[index] = value;
        } else {
            floats[index] = (float) value;
        }
    }

    /**
     * Store the tuple, rounding to single precision when the array is float backed.
     */
    public void setTuple(int tuple, double[] values) {
        checkTuple(tuple);
        var count = componentCount();
        Tuples.requireLength(values, count);
        var offset = tuple * count;
        if (doubles != null) {
            System.arraycopy(values, 0, doubles, offset, count);
        } else {
            for (int i = 0; i < count; i++) {
                floats[offset + i] = (float) values[i];
            }
        }
    }

    @Override
    public String toString() {
        var values = doubles != null ? Arrays.toString(Arrays.copyOf(doubles, Math.min(doubles.length, 9)))
                                     : Arrays.toString(Arrays.copyOf(floats, Math.min(floats.length, 9)));
        return "OrientationArray[" + name + ", " + representation + ", " + precision() + ", tuples=" + numTuples()
        + ", head=" + values + "]";
    }

    private void checkTuple(int tuple) {
        if (tuple < 0 || tuple >= numTuples()) {
            throw new IndexOutOfBoundsException("Tuple " + tuple + " out of range [0, " + numTuples() + ")");
        }
    }
}
