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

package io.nosqlbench.relsynth;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

/// Runs batches of independent tasks and returns their results in task order.
///
/// With one thread every task runs on the calling thread. Otherwise the
/// tasks go to an owned [ForkJoinPool] and [#invokeAll(List)] blocks until
/// the whole batch has completed, which gives callers a barrier between
/// successive batches.
public final class WorkerPool implements AutoCloseable {

    private final int threads;
    private final ForkJoinPool pool;

    public WorkerPool(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive");
        }
        this.threads = threads;
        this.pool = threads > 1 ? new ForkJoinPool(threads) : null;
    }

    public int threads() {
        return threads;
    }

    public boolean isParallel() {
        return pool != null;
    }

    /// Runs the tasks and returns their results in order.
    ///
    /// A task's unchecked exception is rethrown as is; checked exceptions
    /// are wrapped in an [IllegalStateException].
    ///
    /// @param tasks the tasks to run
    /// @param <T> the result type
    /// @return one result per task, in task order
    public <T> List<T> invokeAll(List<? extends Callable<T>> tasks) {
        List<T> results = new ArrayList<>(tasks.size());
        if (pool == null || tasks.size() < 2) {
            for (Callable<T> task : tasks) {
                results.add(Attempt.of(task).get());
            }
            return results;
        }
        // joined tasks may be run by the waiting thread, nested batches included
        List<Callable<Attempt<T>>> batch = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            batch.add(() -> Attempt.of(task));
        }
        List<Future<Attempt<T>>> futures = pool.invokeAll(batch);
        for (Future<Attempt<T>> future : futures) {
            Attempt<T> attempt;
            try {
                attempt = future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for workers", e);
            } catch (ExecutionException e) {
                throw unwrap(e.getCause());
            }
            results.add(attempt.get());
        }
        return results;
    }

    /// Result of one task, carrying its exception to the caller's thread unchanged.
    private static final class Attempt<T> {
        private T value;
        private Exception failure;

        static <T> Attempt<T> of(Callable<T> task) {
            Attempt<T> attempt = new Attempt<>();
            try {
                attempt.value = task.call();
            } catch (Exception e) {
                attempt.failure = e;
            }
            return attempt;
        }

        T get() {
            if (failure == null) {
                return value;
            }
            throw unwrap(failure);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new IllegalStateException(cause.getMessage(), cause);
    }

    @Override
    public void close() {
        if (pool != null && !pool.isShutdown()) {
            pool.shutdown();
        }
    }
}
