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
package com.google.android.libraries.pagedatadownload.scheduler;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ListenableFuture;

/** A unit of background work run by a {@code TaskScheduler}. */
public interface Worker {

  /** Outcome of a run. A failed run stops the work chain it belongs to. */
  enum Result {
    SUCCESS,
    FAILURE,
  }

  /**
   * Performs the work.
   *
   * @param inputData input of the work request, empty for periodic tasks.
   */
  ListenableFuture<Result> doWork(ImmutableMap<String, String> inputData);
}
