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
package com.google.android.libraries.pagedatadownload;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import java.util.concurrent.TimeUnit;

/** Interface for task scheduling */
public interface TaskScheduler {

  /**
   * Tag for the audio update task, that *should* be run once a week.
   *
   * <p>By default, this task requires a connected network.
   */
  String AUDIO_UPDATE_PERIODIC_TASK = "PDD.AUDIO.UPDATE.PERIODIC.TASK";

  /**
   * Prefix of the unique work name of the partial page check and missing page download chain. The
   * page type is appended to it.
   */
  String CLEANUP_PREFIX = "PDD.CLEANUP.";

  /** Required network state of the device when to run the task. */
  enum NetworkState {
    // Metered or unmetered network available.
    NETWORK_STATE_CONNECTED,

    // Unmetered network available.
    NETWORK_STATE_UNMETERED,

    // Network not required.
    NETWORK_STATE_ANY,
  }

  /**
   * Schedule a periodic task. If a task with the same tag is already scheduled, the existing task
   * is kept and this call has no effect.
   *
   * @param tag tag of the scheduled task, also used to look up its worker.
   * @param period period with which the scheduled task should be run.
   * @param unit unit of {@code period}.
   * @param networkState network state when to run the task.
   */
  void schedulePeriodicTask(String tag, long period, TimeUnit unit, NetworkState networkState);

  /**
   * Enqueue a chain of one-time work requests under a unique name. Each request runs after the
   * previous one succeeded; a failed request stops the chain.
   *
   * <p>If work with the same unique name is still pending or running, the existing work is kept
   * and its future is returned.
   *
   * @return a future that completes when the chain has finished.
   */
  ListenableFuture<Void> enqueueUniqueWork(
      String uniqueWorkName, ImmutableList<WorkRequest> workChain);

  /**
   * Cancel future invocations of a previously-scheduled task. No guarantee is made whether the task
   * will be interrupted if it's currently running.
   *
   * @param tag tag of the scheduled task.
   */
  default void cancelPeriodicTask(String tag) {}
}
