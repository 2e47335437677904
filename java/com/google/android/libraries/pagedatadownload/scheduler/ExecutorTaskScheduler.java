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

import com.google.android.libraries.pagedatadownload.TaskScheduler;
import com.google.android.libraries.pagedatadownload.WorkRequest;
import com.google.android.libraries.pagedatadownload.internal.logging.LogUtil;
import com.google.android.libraries.pagedatadownload.scheduler.Worker.Result;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/**
 * {@link TaskScheduler} that runs work in-process on a {@link ScheduledExecutorService}.
 *
 * <p>Work is only started while the {@link NetworkStateProvider} reports the required network
 * state. A periodic run whose constraint is not met is skipped; a step of a work chain is checked
 * again after the constraint retry delay. Nothing is persisted: scheduled work does not survive the
 * process.
 */
public final class ExecutorTaskScheduler implements TaskScheduler {
  private static final String TAG = "ExecutorTaskScheduler";

  private final ScheduledExecutorService scheduledExecutor;
  private final WorkerFactory workerFactory;
  private final NetworkStateProvider networkStateProvider;
  private final long constraintRetryDelayMillis;

  // Guarded by this.
  private final Map<String, ScheduledFuture<?>> periodicTasks = new HashMap<>();
  // Guarded by this.
  private final Map<String, ListenableFuture<Void>> uniqueWork = new HashMap<>();

  public ExecutorTaskScheduler(
      ScheduledExecutorService scheduledExecutor,
      WorkerFactory workerFactory,
      NetworkStateProvider networkStateProvider,
      long constraintRetryDelayMillis) {
    this.scheduledExecutor = scheduledExecutor;
    this.workerFactory = workerFactory;
    this.networkStateProvider = networkStateProvider;
    this.constraintRetryDelayMillis = constraintRetryDelayMillis;
  }

  @Override
  public void schedulePeriodicTask(
      String tag, long period, TimeUnit unit, NetworkState networkState) {
    synchronized (this) {
      ScheduledFuture<?> existing = periodicTasks.get(tag);
      if (existing != null && !existing.isDone()) {
        LogUtil.d("%s: Keeping existing periodic task %s", TAG, tag);
        return;
      }
      LogUtil.d("%s: Scheduling periodic task %s every %d %s", TAG, tag, period, unit);
      periodicTasks.put(
          tag,
          scheduledExecutor.scheduleAtFixedRate(
              () -> runPeriodicTask(tag, networkState), 0, period, unit));
    }
  }

  @Override
  public void cancelPeriodicTask(String tag) {
    ScheduledFuture<?> task;
    synchronized (this) {
      task = periodicTasks.remove(tag);
    }
    if (task != null) {
      task.cancel(false);
    }
  }

  @Override
  public ListenableFuture<Void> enqueueUniqueWork(
      String uniqueWorkName, ImmutableList<WorkRequest> workChain) {
    SettableFuture<Void> chainFuture;
    synchronized (this) {
      ListenableFuture<Void> existing = uniqueWork.get(uniqueWorkName);
      if (existing != null) {
        LogUtil.d("%s: Keeping existing work %s", TAG, uniqueWorkName);
        return existing;
      }
      chainFuture = SettableFuture.create();
      uniqueWork.put(uniqueWorkName, chainFuture);
    }

    LogUtil.d("%s: Enqueuing work %s with %d steps", TAG, uniqueWorkName, workChain.size());
    scheduledExecutor.execute(() -> runStep(uniqueWorkName, workChain, 0, chainFuture));
    return chainFuture;
  }

  /** Returns whether {@code uniqueWorkName} is pending or running. */
  public synchronized boolean isWorkPending(String uniqueWorkName) {
    return uniqueWork.containsKey(uniqueWorkName);
  }

  private void runPeriodicTask(String tag, NetworkState networkState) {
    // An exception thrown here would cancel all later runs of the task.
    try {
      startPeriodicTask(tag, networkState);
    } catch (RuntimeException e) {
      LogUtil.e(e, "%s: Unable to start periodic task %s", TAG, tag);
    }
  }

  private void startPeriodicTask(String tag, NetworkState networkState) {
    if (!networkStateProvider.satisfies(networkState)) {
      LogUtil.d("%s: Skipping periodic task %s, network state not met", TAG, tag);
      return;
    }

    Optional<Worker> worker = workerFactory.createWorker(tag);
    if (!worker.isPresent()) {
      LogUtil.e("%s: No worker for periodic task %s", TAG, tag);
      return;
    }

    Futures.addCallback(
        startWorker(worker.get(), ImmutableMap.of()),
        new FutureCallback<Result>() {
          @Override
          public void onSuccess(Result result) {
            LogUtil.d("%s: Periodic task %s finished with %s", TAG, tag, result);
          }

          @Override
          public void onFailure(Throwable t) {
            LogUtil.e(t, "%s: Periodic task %s failed", TAG, tag);
          }
        },
        MoreExecutors.directExecutor());
  }

  private void runStep(
      String uniqueWorkName,
      ImmutableList<WorkRequest> workChain,
      int index,
      SettableFuture<Void> chainFuture) {
    if (index >= workChain.size()) {
      LogUtil.d("%s: Work %s finished", TAG, uniqueWorkName);
      finish(uniqueWorkName, chainFuture, /* failure= */ null);
      return;
    }

    WorkRequest request = workChain.get(index);
    if (!networkStateProvider.satisfies(request.networkState())) {
      LogUtil.d(
          "%s: Delaying %s of work %s, network state not met",
          TAG, request.workerTag(), uniqueWorkName);
      scheduledExecutor.schedule(
          () -> runStep(uniqueWorkName, workChain, index, chainFuture),
          constraintRetryDelayMillis,
          TimeUnit.MILLISECONDS);
      return;
    }

    Optional<Worker> worker = workerFactory.createWorker(request.workerTag());
    if (!worker.isPresent()) {
      finish(
          uniqueWorkName,
          chainFuture,
          new IllegalStateException("No worker for tag " + request.workerTag()));
      return;
    }

    Futures.addCallback(
        startWorker(worker.get(), request.inputData()),
        new FutureCallback<Result>() {
          @Override
          public void onSuccess(Result result) {
            if (result == Result.SUCCESS) {
              scheduledExecutor.execute(
                  () -> runStep(uniqueWorkName, workChain, index + 1, chainFuture));
            } else {
              finish(
                  uniqueWorkName,
                  chainFuture,
                  new IllegalStateException(
                      "Worker " + request.workerTag() + " of work " + uniqueWorkName + " failed"));
            }
          }

          @Override
          public void onFailure(Throwable t) {
            finish(uniqueWorkName, chainFuture, t);
          }
        },
        MoreExecutors.directExecutor());
  }

  private static ListenableFuture<Result> startWorker(
      Worker worker, ImmutableMap<String, String> inputData) {
    try {
      return worker.doWork(inputData);
    } catch (RuntimeException e) {
      return Futures.immediateFailedFuture(e);
    }
  }

  private void finish(
      String uniqueWorkName, SettableFuture<Void> chainFuture, @Nullable Throwable failure) {
    // Remove before completing so that a listener of the chain can enqueue it again.
    synchronized (this) {
      uniqueWork.remove(uniqueWorkName);
    }
    if (failure == null) {
      chainFuture.set(null);
    } else {
      LogUtil.e(failure, "%s: Work %s failed", TAG, uniqueWorkName);
      chainFuture.setException(failure);
    }
  }
}
