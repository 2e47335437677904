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

/**
 * Receives the results of {@link PageDataPresenter#checkPages()}.
 *
 * <p>All callbacks are delivered on the presenter's ui executor.
 */
public interface PageDataView {

  /** The storage root for page images could not be found or created. */
  void onStorageNotAvailable();

  /** The page check finished. */
  void onPagesChecked(PageDataStatus status);

  /** The page check failed unexpectedly. */
  default void onPagesCheckFailed(Throwable throwable) {}
}
