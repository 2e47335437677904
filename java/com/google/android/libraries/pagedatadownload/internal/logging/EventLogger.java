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

/** Interface for remote logging. */
public interface EventLogger {

  /**
   * Log that some missing pages could not be downloaded.
   *
   * @param failed number of pages that failed to download
   * @param missingImages number of pages that were missing
   */
  void logMissingPageDownloadFailure(int failed, int missingImages);

  /** Log that all {@code missingImages} missing pages were downloaded. */
  void logMissingPageDownloadSuccess(int missingImages);
}
