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

import java.util.List;
import java.util.Objects;

import javax.vecmath.Matrix3d;
import javax.vecmath.Vector3d;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.laue.orientation.BatchConfig;
import com.hellblazer.laue.orientation.OrientationArray;
import com.hellblazer.laue.orientation.OrientationException;
import com.hellblazer.laue.orientation.OrientationRepresentation;
import com.hellblazer.laue.orientation.OrientationTransforms;
import com.hellblazer.laue.orientation.ParallelBatchExecutor;

/**
 * Pole figure coordinates on the unit sphere. Each orientation writes only its own slots of every family array, so
 * orientations are processed in parallel without locking.
 *
 * @author hal.hildebrand
 */
final class SphereCoordinates {
    private static final Logger log = LoggerFactory.getLogger(SphereCoordinates.class);

    static float[][] generate(LaueClass laue, OrientationArray eulers, BatchConfig config)
    throws OrientationException {
        if (eulers == null) {
            throw new OrientationException("Missing Euler angles for " + laue.getSymmetryName() + " pole figures");
        }
        if (eulers.representation() != OrientationRepresentation.EULER) {
            throw new OrientationException(
            "Pole figures need Euler angles, " + eulers.name() + " holds " + eulers.representation());
        }
        Objects.requireNonNull(config, "config");
        var families = laue.getPoleFamilies();
        var tuples = eulers.numTuples();
        var result = new float[families.size()][];
        for (int f = 0; f < families.size(); f++) {
            result[f] = new float[tuples * families.get(f).floatsPerOrientation()];
        }
        var parallel = ParallelBatchExecutor.execute(tuples, config, (from, to) -> {
            for (int i = from; i < to; i++) {
                project(eulers.getTuple(i), families, result, i);
            }
        });
        log.debug("{} pole figure coordinates for {} orientations, parallel: {}", laue.getSymmetryName(), tuples,
                  parallel);
        return result;
    }

    /**
     * Write g^T d and -g^T d for every direction d of every family into the slots of orientation i
     */
    private static void project(double[] euler, List<PoleFamily> families, float[][] result, int i) {
        var g = new Matrix3d(OrientationTransforms.DOUBLE.eu2om(euler));
        g.transpose();
        var pole = new Vector3d();
        for (int f = 0; f < families.size(); f++) {
            var family = families.get(f);
            var out = result[f];
            var offset = i * family.floatsPerOrientation();
            for (int k = 0; k < family.size(); k++) {
                pole.set(family.direction(k));
                g.transform(pole);
                var slot = offset + k * 6;
                out[slot] = (float) pole.x;
                out[slot + 1] = (float) pole.y;
                out[slot + 2] = (float) pole.z;
                out[slot + 3] = (float) -pole.x;
                out[slot + 4] = (float) -pole.y;
                out[slot + 5] = (float) -pole.z;
            }
        }
    }

    private SphereCoordinates() {
    }
}
