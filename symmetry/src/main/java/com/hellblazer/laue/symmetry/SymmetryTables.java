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

import static com.hellblazer.laue.orientation.Rotations.INV_SQRT2;
import static com.hellblazer.laue.orientation.Rotations.INV_SQRT3;
import static com.hellblazer.laue.orientation.Rotations.SQRT3_2;

import java.util.Arrays;

/**
 * Compiled in rotation operators of the proper point groups, as quaternion rows (x, y, z, w), and the pole families
 * of each crystal system. Row order is the operator index of the owning {@link LaueClass}.
 *
 * @author hal.hildebrand
 */
final class SymmetryTables {
    private static final double R = INV_SQRT2;
    private static final double H = SQRT3_2;

    // 432
    static final double[][] CUBIC = { { 0, 0, 0, 1 }, { 1, 0, 0, 0 }, { 0, 1, 0, 0 }, { 0, 0, 1, 0 }, { R, 0, 0, R },
                                      { 0, R, 0, R }, { 0, 0, R, R }, { -R, 0, 0, R }, { 0, -R, 0, R },
                                      { 0, 0, -R, R }, { R, R, 0, 0 }, { -R, R, 0, 0 }, { 0, R, R, 0 },
                                      { 0, -R, R, 0 }, { R, 0, R, 0 }, { -R, 0, R, 0 }, { 0.5, 0.5, 0.5, 0.5 },
                                      { -0.5, -0.5, -0.5, 0.5 }, { 0.5, -0.5, 0.5, 0.5 }, { -0.5, 0.5, -0.5, 0.5 },
                                      { -0.5, 0.5, 0.5, 0.5 }, { 0.5, -0.5, -0.5, 0.5 }, { -0.5, -0.5, 0.5, 0.5 },
                                      { 0.5, 0.5, -0.5, 0.5 } };

    // 23
    static final double[][] CUBIC_LOW = { { 0, 0, 0, 1 }, { 1, 0, 0, 0 }, { 0, 1, 0, 0 }, { 0, 0, 1, 0 },
                                          { 0.5, 0.5, 0.5, 0.5 }, { -0.5, -0.5, -0.5, 0.5 }, { 0.5, -0.5, 0.5, 0.5 },
                                          { -0.5, 0.5, -0.5, 0.5 }, { -0.5, 0.5, 0.5, 0.5 },
                                          { 0.5, -0.5, -0.5, 0.5 }, { -0.5, -0.5, 0.5, 0.5 },
                                          { 0.5, 0.5, -0.5, 0.5 } };

    // 622
    static final double[][] HEXAGONAL = { { 0, 0, 0, 1 }, { 0, 0, 0.5, H }, { 0, 0, H, 0.5 }, { 0, 0, 1, 0 },
                                          { 0, 0, H, -0.5 }, { 0, 0, 0.5, -H }, { 1, 0, 0, 0 }, { H, 0.5, 0, 0 },
                                          { 0.5, H, 0, 0 }, { 0, 1, 0, 0 }, { -0.5, H, 0, 0 }, { -H, 0.5, 0, 0 } };

    // 6
    static final double[][] HEXAGONAL_LOW = Arrays.copyOf(HEXAGONAL, 6);

    // 32
    static final double[][] TRIGONAL = { { 0, 0, 0, 1 }, { 0, 0, H, 0.5 }, { 0, 0, H, -0.5 }, { 1, 0, 0, 0 },
                                         { -0.5, H, 0, 0 }, { -0.5, -H, 0, 0 } };

    // 3
    static final double[][] TRIGONAL_LOW = Arrays.copyOf(TRIGONAL, 3);

    // 422
    static final double[][] TETRAGONAL = { { 0, 0, 0, 1 }, { 1, 0, 0, 0 }, { 0, 1, 0, 0 }, { 0, 0, 1, 0 },
                                           { 0, 0, R, -R }, { 0, 0, R, R }, { R, R, 0, 0 }, { -R, R, 0, 0 } };

    // 4
    static final double[][] TETRAGONAL_LOW = { { 0, 0, 0, 1 }, { 0, 0, 1, 0 }, { 0, 0, R, -R }, { 0, 0, R, R } };

    // 222
    static final double[][] ORTHORHOMBIC = { { 0, 0, 0, 1 }, { 1, 0, 0, 0 }, { 0, 1, 0, 0 }, { 0, 0, 1, 0 } };

    // 2, unique axis b
    static final double[][] MONOCLINIC = { { 0, 0, 0, 1 }, { 0, 1, 0, 0 } };

    // 1
    static final double[][] TRICLINIC = { { 0, 0, 0, 1 } };

    private static final double[] X = { 1, 0, 0 };
    private static final double[] Y = { 0, 1, 0 };
    private static final double[] Z = { 0, 0, 1 };

    static final PoleFamily[] CUBIC_POLES = { new PoleFamily("<001>", new double[][] { X, Y, Z }),
                                              new PoleFamily("<011>",
                                                             new double[][] { { R, R, 0 }, { R, 0, R }, { 0, R, R },
                                                                              { -R, R, 0 }, { -R, 0, R },
                                                                              { 0, -R, R } }),
                                              new PoleFamily("<111>",
                                                             new double[][] { { INV_SQRT3, INV_SQRT3, INV_SQRT3 },
                                                                              { -INV_SQRT3, INV_SQRT3, INV_SQRT3 },
                                                                              { INV_SQRT3, -INV_SQRT3, INV_SQRT3 },
                                                                              { INV_SQRT3, INV_SQRT3,
                                                                                -INV_SQRT3 } }) };

    static final PoleFamily[] TETRAGONAL_POLES = { new PoleFamily("<001>", new double[][] { Z }),
                                                   new PoleFamily("<100>", new double[][] { X, Y }),
                                                   new PoleFamily("<110>",
                                                                  new double[][] { { R, R, 0 }, { -R, R, 0 } }) };

    static final PoleFamily[] HEXAGONAL_POLES = { new PoleFamily("<0001>", new double[][] { Z }),
                                                  new PoleFamily("<10-10>",
                                                                 new double[][] { { H, 0.5, 0 }, { 0, 1, 0 },
                                                                                  { -H, 0.5, 0 } }),
                                                  new PoleFamily("<2-1-10>",
                                                                 new double[][] { X, { -0.5, H, 0 },
                                                                                  { -0.5, -H, 0 } }) };

    static final PoleFamily[] AXIS_POLES = { new PoleFamily("[001]", new double[][] { Z }),
                                             new PoleFamily("[100]", new double[][] { X }),
                                             new PoleFamily("[010]", new double[][] { Y }) };

    private SymmetryTables() {
    }
}
