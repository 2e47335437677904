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

import com.google.android.libraries.pagedatadownload.internal.PageDataSettings;
import com.google.android.libraries.pagedatadownload.internal.logging.LogUtil;
import com.google.android.libraries.pagedatadownload.scheduler.Worker;
import com.google.android.libraries.pagedatadownload.scheduler.Worker.Result;
import com.google.android.libraries.pagedatadownload.scheduler.WorkerFactory;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

/**
 * Entry point of PDD, created by {@link PageDataDownloadBuilder}.
 *
 * <p>Clients that schedule work with their own {@link TaskScheduler} forward each scheduled task to
 * {@link #handleTask(String, ImmutableMap)}.
 */
public final class PageDataDownload {
  private static final String TAG = "PageDataDownload";

  private final PageDataPresenter presenter;
  private final PageDataSettings settings;
  private final WorkerFactory workerFactory;
  private final TaskScheduler taskScheduler;

  PageDataDownload(
      PageDataPresenter presenter,
      PageDataSettings settings,
      WorkerFactory workerFactory,
      TaskScheduler taskScheduler) {
    this.presenter = presenter;
    this.settings = settings;
    this.workerFactory = workerFactory;
    this.taskScheduler = taskScheduler;
  }

  public PageDataPresenter getPresenter() {
    return presenter;
  }

  public TaskScheduler getTaskScheduler() {
    return taskScheduler;
  }

  public String getPageType() {
    return settings.getPageType();
  }

  /**
   * Selects the page type whose images are checked. Takes effect with the next {@link
   * PageDataPresenter#checkPages()}.
   *
   * @return whether the setting was persisted
   */
  public boolean setPageType(String pageType) {
    return settings.setPageType(pageType);
  }

  /**
   * Runs the worker of a scheduled task.
   *
   * @param tag the task tag, {@link TaskScheduler#AUDIO_UPDATE_PERIODIC_TASK} or a worker tag from
   *     {@link Constants}
   * @param inputData the input data of the work request
   */
  public ListenableFuture<Result> handleTask(String tag, ImmutableMap<String, String> inputData) {
    Optional<Worker> worker = workerFactory.createWorker(tag);
    if (!worker.isPresent()) {
      LogUtil.e("%s: Unknown task tag sent to PDD %s", TAG, tag);
      return Futures.immediateFailedFuture(
          new IllegalArgumentException("Unknown task tag sent to PDD " + tag));
    }
    return worker.get().doWork(inputData);
  }
}
