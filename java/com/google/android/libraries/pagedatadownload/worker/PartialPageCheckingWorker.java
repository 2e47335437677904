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
import com.google.android.libraries.pagedatadownload.internal.PageDataSettings;
import com.google.android.libraries.pagedatadownload.internal.PageFileUtil;
import com.google.android.libraries.pagedatadownload.internal.PageImageValidator;
import com.google.android.libraries.pagedatadownload.internal.PageProviderSelector;
import com.google.android.libraries.pagedatadownload.internal.logging.LogUtil;
import com.google.android.libraries.pagedatadownload.scheduler.Worker;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import java.io.File;
import java.util.concurrent.Executor;

/**
 * Deletes page images of a page type that were only partially written, so that the missing page
 * download picks them up again.
 *
 * <p>Requires the {@link Constants#PAGE_TYPE} input. Once all width directories were checked the
 * page type is marked as checked and is not enqueued again.
 */
public final class PartialPageCheckingWorker implements Worker {
  private static final String TAG = "PartialPageCheckingWorker";

  private final PageFileUtil pageFileUtil;
  private final PageProviderSelector pageProviderSelector;
  private final PageDataSettings settings;
  private final Executor backgroundExecutor;

  public PartialPageCheckingWorker(
      PageFileUtil pageFileUtil,
      PageProviderSelector pageProviderSelector,
      PageDataSettings settings,
      Executor backgroundExecutor) {
    this.pageFileUtil = pageFileUtil;
    this.pageProviderSelector = pageProviderSelector;
    this.settings = settings;
    this.backgroundExecutor = backgroundExecutor;
  }

  @Override
  public ListenableFuture<Result> doWork(ImmutableMap<String, String> inputData) {
    String pageType = inputData.get(Constants.PAGE_TYPE);
    if (pageType == null) {
      LogUtil.e("%s: missing page type input", TAG);
      return Futures.immediateFuture(Result.FAILURE);
    }
    return Futures.submit(() -> checkPartialPages(pageType), backgroundExecutor);
  }

  private Result checkPartialPages(String pageType) {
    File imagesDirectory = pageFileUtil.getImagesBaseDirectory(pageType);
    if (imagesDirectory == null) {
      LogUtil.w("%s: storage not available for %s", TAG, pageType);
      return Result.FAILURE;
    }

    int numberOfPages = pageProviderSelector.getPageProvider(pageType).numberOfPages();
    File[] widthDirectories =
        imagesDirectory.listFiles(
            file ->
                file.isDirectory()
                    && file.getName().startsWith(PageFileUtil.IMAGES_DIRECTORY_PREFIX + "_"));
    int deleted = 0;
    if (widthDirectories != null) {
      for (File widthDirectory : widthDirectories) {
        deleted += deletePartialPages(widthDirectory, numberOfPages);
      }
    }

    LogUtil.d("%s: removed %d partial pages of %s", TAG, deleted, pageType);
    settings.setCheckedPartialImages(pageType);
    return Result.SUCCESS;
  }

  private static int deletePartialPages(File widthDirectory, int numberOfPages) {
    int deleted = 0;
    for (int page = 1; page <= numberOfPages; page++) {
      File pageFile = new File(widthDirectory, PageFileUtil.getPageFileName(page));
      if (pageFile.exists() && !PageImageValidator.isCompleteImage(pageFile)) {
        if (pageFile.delete()) {
          deleted++;
        } else {
          LogUtil.w("%s: unable to delete partial page %s", TAG, pageFile);
        }
      }
    }
    return deleted;
  }
}
