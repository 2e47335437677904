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
package com.google.android.libraries.pagedatadownload.internal.logging;

import com.google.android.libraries.pagedatadownload.Constants;
import com.google.android.libraries.pagedatadownload.Logger;
import com.google.common.collect.ImmutableMap;

/** Assembles PDD events and forwards them to the client {@link Logger}. */
public final class PddEventLogger implements EventLogger {

  private final Logger logger;

  public PddEventLogger(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void logMissingPageDownloadFailure(int failed, int missingImages) {
    double percentageSuccess = 1.0 * (missingImages - failed) / missingImages;
    logger.logCustomEvent(
        Constants.MISSING_PAGE_WORKER_FAILURE_EVENT,
        ImmutableMap.<String, Object>of(
            "failed", failed,
            "percentageSuccess", percentageSuccess,
            "missingImages", missingImages));
  }

  @Override
  public void logMissingPageDownloadSuccess(int missingImages) {
    logger.logCustomEvent(
        Constants.MISSING_PAGE_WORKER_SUCCESS_EVENT,
        ImmutableMap.<String, Object>of("missingImages", missingImages));
  }
}
