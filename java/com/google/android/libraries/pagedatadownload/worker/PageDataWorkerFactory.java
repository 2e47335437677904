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
package com.google.android.libraries.pagedatadownload.worker;

import com.google.android.libraries.pagedatadownload.Constants;
import com.google.android.libraries.pagedatadownload.TaskScheduler;
import com.google.android.libraries.pagedatadownload.internal.logging.LogUtil;
import com.google.android.libraries.pagedatadownload.scheduler.Worker;
import com.google.android.libraries.pagedatadownload.scheduler.WorkerFactory;
import com.google.common.base.Optional;

/** {@link WorkerFactory} for the workers that keep the page data healthy. */
public final class PageDataWorkerFactory implements WorkerFactory {
  private static final String TAG = "PageDataWorkerFactory";

  private final PartialPageCheckingWorker partialPageCheckingWorker;
  private final MissingPageDownloadWorker missingPageDownloadWorker;
  private final AudioUpdateWorker audioUpdateWorker;

  public PageDataWorkerFactory(
      PartialPageCheckingWorker partialPageCheckingWorker,
      MissingPageDownloadWorker missingPageDownloadWorker,
      AudioUpdateWorker audioUpdateWorker) {
    this.partialPageCheckingWorker = partialPageCheckingWorker;
    this.missingPageDownloadWorker = missingPageDownloadWorker;
    this.audioUpdateWorker = audioUpdateWorker;
  }

  @Override
  public Optional<Worker> createWorker(String workerTag) {
    switch (workerTag) {
      case Constants.PARTIAL_PAGE_CHECK_WORKER:
        return Optional.of(partialPageCheckingWorker);
      case Constants.MISSING_PAGE_DOWNLOAD_WORKER:
        return Optional.of(missingPageDownloadWorker);
      case TaskScheduler.AUDIO_UPDATE_PERIODIC_TASK:
        return Optional.of(audioUpdateWorker);
      default:
        LogUtil.w("%s: Unknown worker tag %s", TAG, workerTag);
        return Optional.absent();
    }
  }
}
