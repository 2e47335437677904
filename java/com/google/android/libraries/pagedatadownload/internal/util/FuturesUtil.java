/*
 * Copyright 2022 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.android.libraries.pagedatadownload.internal.util;

import com.google.common.base.Function;
import com.google.common.util.concurrent.AsyncFunction;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/** Utilities for sequencing futures. */
public final class FuturesUtil {

  private final Executor executor;

  public FuturesUtil(Executor executor) {
    this.executor = executor;
  }

  /**
   * Returns a chain of asynchronous operations that run one after the other, each receiving the
   * result of the previous one, starting from {@code init}.
   *
   * <pre>{@code
   * ListenableFuture<Integer> failures =
   *     new FuturesUtil(executor)
   *         .newSequentialChain(0)
   *         .chainAsync(count -> download(first, count))
   *         .chainAsync(count -> download(second, count))
   *         .start();
   * }</pre>
   *
   * <p>An operation that fails, or returns a failed future, fails the chain and the remaining
   * operations are not started.
   */
  public <T> SequentialFutureChain<T> newSequentialChain(T init) {
    return new SequentialFutureChain<>(init);
  }

  /** Collects the operations of a chain until it is started. */
  public final class SequentialFutureChain<T> {
    private final List<AsyncFunction<T, T>> operations = new ArrayList<>();
    private final T init;

    private SequentialFutureChain(T init) {
      this.init = init;
    }

    public SequentialFutureChain<T> chainAsync(Function<T, ListenableFuture<T>> operation) {
      operations.add(operation::apply);
      return this;
    }

    /** Starts the chain; the returned future holds the result of the last operation. */
    public ListenableFuture<T> start() {
      ListenableFuture<T> result = Futures.immediateFuture(init);
      for (AsyncFunction<T, T> operation : operations) {
        result = Futures.transformAsync(result, operation, executor);
      }
      return result;
    }
  }
}
