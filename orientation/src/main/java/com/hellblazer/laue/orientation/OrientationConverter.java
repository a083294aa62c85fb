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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Converts a whole array of orientations of one representation into another representation. The input is sanity
 * checked first: Euler angles are folded into their domain in place, every other representation is checked and only
 * reported. Conversion runs tuple by tuple, in parallel over contiguous chunks for large arrays.
 *
 * @author hal.hildebrand
 */
public class OrientationConverter {
    private static final Logger log = LoggerFactory.getLogger(OrientationConverter.class);

    /**
     * Convert the input with the default batch configuration.
     */
    public static OrientationArray convert(OrientationArray input, OrientationRepresentation to)
    throws OrientationException {
        var converter = new OrientationConverter();
        converter.setInput(input);
        converter.convertRepresentationTo(to);
        return converter.getOutput();
    }

    /**
     * Fold Euler angles into [0, 2pi] x [0, pi] x [0, 2pi]: each angle is reduced by its domain width and negative
     * results are replaced by their absolute value.
     */
    static void foldEulers(OrientationArray eulers, int from, int to) {
        for (int t = from; t < to; t++) {
            fold(eulers, t, 0, Rotations.TWO_PI);
            fold(eulers, t, 1, Math.PI);
            fold(eulers, t, 2, Rotations.TWO_PI);
        }
    }

    private static void fold(OrientationArray eulers, int tuple, int component, double width) {
        var value = eulers.get(tuple, component) % width;
        if (value < 0.0) {
            value = -value;
        }
        eulers.set(tuple, component, value);
    }

    private final BatchConfig config;
    private OrientationArray  input;
    private OrientationArray  output;

    public OrientationConverter() {
        this(new BatchConfig());
    }

    public OrientationConverter(BatchConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Batch configuration must not be null");
        }
        this.config = config;
    }

    /**
     * Convert the input to the given representation and store the result as the output. The output is named after
     * the destination representation; converting to the input's own representation produces a deep copy.
     */
    public void convertRepresentationTo(OrientationRepresentation to) throws OrientationException {
        if (input == null) {
            throw new OrientationException("No input orientations set");
        }
        if (to == null) {
            throw new OrientationException("No destination representation given");
        }
        var from = input.representation();
        if (from == to) {
            output = input.copy(to.toString());
            return;
        }
        if (config.isSanityCheck()) {
            sanityCheckInputData();
        }
        var tuples = input.numTuples();
        var result = OrientationArray.allocate(to.toString(), to, tuples, input.precision());
        var engine = OrientationTransforms.forPrecision(input.precision());
        var layout = config.getQuaternionLayout();
        var source = input;
        var parallel = ParallelBatchExecutor.execute(tuples, config, (start, end) -> {
            for (int t = start; t < end; t++) {
                result.setTuple(t, engine.convert(from, to, source.getTuple(t), layout));
            }
        });
        log.debug("Converted {} {} tuples to {} ({}, parallel: {})", tuples, from, to, input.precision(), parallel);
        output = result;
    }

    public BatchConfig getConfig() {
        return config;
    }

    public OrientationArray getInput() {
        return input;
    }

    public OrientationArray getOutput() {
        return output;
    }

    /**
     * Check the input data. Euler angles are folded into their domain in place. For every other representation the
     * tuples failing their validity check are reported; the data is left untouched.
     *
     * @return the number of tuples that failed their check, always 0 for Euler input
     */
    public int sanityCheckInputData() throws OrientationException {
        if (input == null) {
            throw new OrientationException("No input orientations set");
        }
        var tuples = input.numTuples();
        var representation = input.representation();
        if (representation == OrientationRepresentation.EULER) {
            var source = input;
            ParallelBatchExecutor.execute(tuples, config, (start, end) -> foldEulers(source, start, end));
            return 0;
        }
        var failures = new AtomicInteger();
        var first = new AtomicReference<String>();
        var layout = config.getQuaternionLayout();
        var precision = input.precision();
        var source = input;
        ParallelBatchExecutor.execute(tuples, config, (start, end) -> {
            for (int t = start; t < end; t++) {
                var result = ValidityChecks.check(representation, source.getTuple(t), layout, precision);
                if (!result.isValid()) {
                    failures.incrementAndGet();
                    first.compareAndSet(null, "tuple " + t + ": " + result.message());
                    log.debug("{} tuple {} failed check: {}", source.name(), t, result.message());
                }
            }
        });
        if (failures.get() > 0) {
            log.warn("{}: {} of {} {} tuples failed the validity check, first: {}", input.name(), failures.get(),
                     tuples, representation, first.get());
        }
        return failures.get();
    }

    public void setInput(OrientationArray input) throws OrientationException {
        if (input == null) {
            throw new OrientationException("Input orientations must not be null");
        }
        this.input = input;
        this.output = null;
    }

    public void toAxisAngle() throws OrientationException {
        convertRepresentationTo(OrientationRepresentation.AXIS_ANGLE);
    }

    public void toCubochoric() throws OrientationException {
        convertRepresentationTo(OrientationRepresentation.CUBOCHORIC);
    }

    public void toEulers() throws OrientationException {
        convertRepresentationTo(OrientationRepresentation.EULER);
    }

    public void toHomochoric() throws OrientationException {
        convertRepresentationTo(OrientationRepresentation.HOMOCHORIC);
    }

    public void toOrientationMatrix() throws OrientationException {
        convertRepresentationTo(OrientationRepresentation.ORIENTATION_MATRIX);
    }

    public void toQuaternion() throws OrientationException {
        convertRepresentationTo(OrientationRepresentation.QUATERNION);
    }

    public void toRodrigues() throws OrientationException {
        convertRepresentationTo(OrientationRepresentation.RODRIGUES);
    }
}
