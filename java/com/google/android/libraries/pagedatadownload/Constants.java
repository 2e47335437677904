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

/** Constants shared by PDD and its workers. */
public final class Constants {

  /** Tag of the worker that removes partially written page images. */
  public static final String PARTIAL_PAGE_CHECK_WORKER = "PDD.PARTIAL.PAGE.CHECK";

  /** Tag of the worker that downloads missing page images. */
  public static final String MISSING_PAGE_DOWNLOAD_WORKER = "PDD.MISSING.PAGE.DOWNLOAD";

  /** Input key holding the page type a worker operates on. */
  public static final String PAGE_TYPE = "pageType";

  /** Analytics event logged when some missing pages could not be downloaded. */
  public static final String MISSING_PAGE_WORKER_FAILURE_EVENT = "missingPageWorkerFailure";

  /** Analytics event logged when all missing pages were downloaded. */
  public static final String MISSING_PAGE_WORKER_SUCCESS_EVENT = "missingPageWorkerSuccess";

  private Constants() {}
}
