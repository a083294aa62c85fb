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

/**
 * Process wide rotation constants. The sign convention is resolved once, from the
 * {@value #CONVENTION_PROPERTY} system property, when the class initializes and is never changed afterwards.
 *
 * @author hal.hildebrand
 */
public final class Rotations {
    public static final String             CONVENTION_PROPERTY = "laue.rotation.convention";
    public static final RotationConvention CONVENTION;
    public static final double             EPSIJK;

    public static final double PI        = Math.PI;
    public static final double TWO_PI    = 2.0 * Math.PI;
    public static final double HALF_PI   = Math.PI / 2.0;
    public static final double SQRT_2    = Math.sqrt(2.0);
    public static final double INV_SQRT2 = 1.0 / Math.sqrt(2.0);
    public static final double INV_SQRT3 = 1.0 / Math.sqrt(3.0);
    public static final double SQRT3_2   = Math.sqrt(3.0) / 2.0;

    private static final Logger log = LoggerFactory.getLogger(Rotations.class);

    static {
        CONVENTION = resolve(System.getProperty(CONVENTION_PROPERTY));
        EPSIJK = CONVENTION.epsijk();
        log.info("Rotation convention: {} (epsijk = {})", CONVENTION, CONVENTION.epsijk());
    }

    static RotationConvention resolve(String value) {
        if (value == null || value.isBlank()) {
            return RotationConvention.PASSIVE;
        }
        try {
            return RotationConvention.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid value for " + CONVENTION_PROPERTY + ": " + value, e);
        }
    }

    private Rotations() {
    }
}
