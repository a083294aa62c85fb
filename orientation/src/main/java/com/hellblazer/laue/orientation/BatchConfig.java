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
 * Configuration for batch conversions. Provides control over the parallel split of the tuple range, the quaternion
 * layout of quaternion valued arrays and the advisory input checks.
 *
 * @author hal.hildebrand
 */
public class BatchConfig {

    private boolean          enableParallel    = true;
    private int              parallelThreshold = 10000;
    private int              chunkSize         = 2048;
    private int              maxThreads        = Runtime.getRuntime().availableProcessors();
    private QuaternionLayout quaternionLayout  = QuaternionLayout.VECTOR_SCALAR;
    private boolean          sanityCheck       = true;

    /**
     * Create a configuration that always runs on the calling thread.
     */
    public static BatchConfig sequential() {
        return new BatchConfig().withParallelProcessing(false);
    }

    /**
     * Create a configuration that splits any batch larger than a single chunk.
     */
    public static BatchConfig highThroughput() {
        return new BatchConfig().withParallelProcessing(true).withParallelThreshold(1).withChunkSize(1024);
    }

    /**
     * Number of tuples handed to a single task of the parallel split.
     */
    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Maximum number of threads to use for parallel conversions.
     */
    public int getMaxThreads() {
        return maxThreads;
    }

    /**
     * Minimum number of tuples required to trigger parallel processing.
     */
    public int getParallelThreshold() {
        return parallelThreshold;
    }

    /**
     * Layout of the quaternion components in quaternion valued arrays.
     */
    public QuaternionLayout getQuaternionLayout() {
        return quaternionLayout;
    }

    /**
     * Whether parallel processing is enabled. Only activates when the tuple count reaches parallelThreshold.
     */
    public boolean isEnableParallel() {
        return enableParallel;
    }

    /**
     * Whether the input is checked before conversion. Euler input is normalized in place, every other kind only
     * reports diagnostics.
     */
    public boolean isSanityCheck() {
        return sanityCheck;
    }

    /**
     * @return true if a batch of the given size runs on the parallel path
     */
    public boolean runsParallel(int tuples) {
        return enableParallel && maxThreads > 1 && tuples >= parallelThreshold && tuples > chunkSize;
    }

    @Override
    public String toString() {
        return "BatchConfig[parallel=" + enableParallel + ", threshold=" + parallelThreshold + ", chunk=" + chunkSize
        + ", threads=" + maxThreads + ", layout=" + quaternionLayout + ", sanityCheck=" + sanityCheck + "]";
    }

    // Fluent API for configuration

    public BatchConfig withChunkSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        this.chunkSize = size;
        return this;
    }

    public BatchConfig withMaxThreads(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Max threads must be positive");
        }
        this.maxThreads = threads;
        return this;
    }

    public BatchConfig withParallelProcessing(boolean parallel) {
        this.enableParallel = parallel;
        return this;
    }

    public BatchConfig withParallelThreshold(int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("Parallel threshold must be positive");
        }
        this.parallelThreshold = threshold;
        return this;
    }

    public BatchConfig withQuaternionLayout(QuaternionLayout layout) {
        if (layout == null) {
            throw new IllegalArgumentException("Quaternion layout must not be null");
        }
        this.quaternionLayout = layout;
        return this;
    }

    public BatchConfig withSanityCheck(boolean check) {
        this.sanityCheck = check;
        return this;
    }
}
