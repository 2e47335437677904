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
package com.google.android.libraries.pagedatadownload.downloader;

import com.google.android.libraries.pagedatadownload.DownloadException;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.errorprone.annotations.CheckReturnValue;

/**
 * Responsible for downloading files in PDD.
 *
 * <p>Implement this interface to replace the PDD networking stack.
 */
public interface FileDownloader {
  /**
   * Start downloading the file. The download result is provided asynchronously as a {@link
   * ListenableFuture} that resolves when the download is complete.
   *
   * <p>The destination file is only replaced once the download has completed, so readers never
   * see a partially written file.
   *
   * @param downloadRequest the download request.
   * @return - A ListenableFuture representing the download state of the file. The ListenableFuture
   *     fails with {@link DownloadException} if downloading fails.
   */
  @CheckReturnValue
  ListenableFuture<Void> startDownloading(DownloadRequest downloadRequest);
}
