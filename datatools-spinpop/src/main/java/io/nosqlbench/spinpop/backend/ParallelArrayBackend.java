package io.nosqlbench.spinpop.backend;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.concurrent.ForkJoinPool;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/// Data-parallel [ArrayBackend] running on a fork/join pool.
///
/// ## Execution
///
/// ```text
///   index range [0, count)
///        │
///        ├── count < threshold ──► sequential loop on the caller thread
///        │
///        └── otherwise ──────────► IntStream.parallel() inside the pool
///                                   each index writes its own slot
/// ```
///
/// Small arrays stay on the calling thread because splitting them costs more
/// than it saves. Results are identical to [ScalarArrayBackend] since no
/// index reads another index's output.
public final class ParallelArrayBackend extends AbstractArrayBackend {

    /// Arrays shorter than this are processed sequentially.
    public static final int DEFAULT_PARALLEL_THRESHOLD = 4096;

    private final ForkJoinPool pool;
    private final boolean ownsPool;
    private final int threshold;

    /// Creates a backend on the common fork/join pool.
    public ParallelArrayBackend() {
        this(ForkJoinPool.commonPool(), false, DEFAULT_PARALLEL_THRESHOLD);
    }

    /// Creates a backend on a dedicated pool of the given size.
    /// The pool belongs to this backend and is released by [#shutdown()].
    ///
    /// @param parallelism number of worker threads; must be positive
    public ParallelArrayBackend(int parallelism) {
        this(new ForkJoinPool(requirePositive(parallelism)), true, DEFAULT_PARALLEL_THRESHOLD);
    }

    /// Creates a backend on an existing pool. The caller keeps ownership of the pool.
    ///
    /// @param pool the pool to run on
    /// @param threshold minimum array length for parallel execution
    public ParallelArrayBackend(ForkJoinPool pool, int threshold) {
        this(pool, false, threshold);
    }

    private ParallelArrayBackend(ForkJoinPool pool, boolean ownsPool, int threshold) {
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be positive, got: " + threshold);
        }
        this.pool = pool;
        this.ownsPool = ownsPool;
        this.threshold = threshold;
    }

    private static int requirePositive(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive, got: " + parallelism);
        }
        return parallelism;
    }

    @Override
    public BackendMode mode() {
        return BackendMode.PARALLEL;
    }

    /// Returns the pool's target parallelism.
    public int parallelism() {
        return pool.getParallelism();
    }

    public int threshold() {
        return threshold;
    }

    /// Shuts down the pool if this backend owns it. The common pool and
    /// caller-supplied pools are left running.
    public void shutdown() {
        if (ownsPool && !pool.isShutdown()) {
            pool.shutdown();
        }
    }

    /// Returns true once an owned pool has been shut down.
    public boolean isShutdown() {
        return pool.isShutdown();
    }

    @Override
    protected void forEachIndex(int count, IntConsumer body) {
        if (count < threshold) {
            for (int i = 0; i < count; i++) {
                body.accept(i);
            }
            return;
        }
        pool.submit(() -> IntStream.range(0, count).parallel().forEach(body)).join();
    }

    @Override
    protected void forEachRow(int rows, int columns, IntConsumer body) {
        // Rows are the unit of work, so a 250 x 500 mesh still spreads across the pool
        if ((long) rows * columns < threshold || rows < 2) {
            for (int j = 0; j < rows; j++) {
                body.accept(j);
            }
            return;
        }
        pool.submit(() -> IntStream.range(0, rows).parallel().forEach(body)).join();
    }
}
