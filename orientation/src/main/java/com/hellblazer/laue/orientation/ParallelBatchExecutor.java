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

import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;

/**
 * Runs per-tuple work over an index range. The range is split into contiguous chunks executed on a work stealing
 * pool; every index is visited exactly once and the work for index i must only write to output slot i, so no
 * synchronization beyond the final join is required.
 *
 * @author hal.hildebrand
 */
public final class ParallelBatchExecutor {

    /**
     * Work for a contiguous range [from, to) of tuple indices
     */
    @FunctionalInterface
    public interface RangeTask {
        void run(int from, int to);
    }

    private static final Logger       log = LoggerFactory.getLogger(ParallelBatchExecutor.class);
    private static final ForkJoinPool WORK_STEALING_POOL;

    static {
        int parallelism = Math.max(2, Runtime.getRuntime().availableProcessors());
        WORK_STEALING_POOL = new ForkJoinPool(parallelism, ForkJoinPool.defaultForkJoinWorkerThreadFactory, null,
                                              true);
    }

    /**
     * Execute the task over [0, tuples), in parallel when the configuration asks for it.
     *
     * @return true if the parallel path ran
     */
    public static boolean execute(int tuples, BatchConfig config, RangeTask task) {
        if (tuples <= 0) {
            return false;
        }
        if (!config.runsParallel(tuples)) {
            task.run(0, tuples);
            return false;
        }
        var chunk = Math.max(config.getChunkSize(), (tuples + config.getMaxThreads() * 4 - 1) / (config.getMaxThreads()
                                                                                                     * 4));
        log.trace("Splitting {} tuples into chunks of {}", tuples, chunk);
        if (config.getMaxThreads() >= WORK_STEALING_POOL.getParallelism()) {
            WORK_STEALING_POOL.invoke(new ChunkAction(0, tuples, chunk, task));
        } else {
            var pool = new ForkJoinPool(config.getMaxThreads(), ForkJoinPool.defaultForkJoinWorkerThreadFactory, null,
                                        true);
            try {
                pool.invoke(new ChunkAction(0, tuples, chunk, task));
            } finally {
                pool.shutdown();
            }
        }
        return true;
    }

    private static class ChunkAction extends RecursiveAction {
        private final int       from;
        private final int       to;
        private final int       chunk;
        private final RangeTask task;

        ChunkAction(int from, int to, int chunk, RangeTask task) {
            this.from = from;
            this.to = to;
            this.chunk = chunk;
            this.task = task;
        }

        @Override
        protected void compute() {
            if (to - from <= chunk) {
                task.run(from, to);
                return;
            }
            int mid = from + (to - from) / 2;
            invokeAll(new ChunkAction(from, mid, chunk, task), new ChunkAction(mid, to, chunk, task));
        }
    }

    private ParallelBatchExecutor() {
    }
}
