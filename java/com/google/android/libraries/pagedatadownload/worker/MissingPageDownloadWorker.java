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

import static com.google.common.util.concurrent.Futures.immediateFuture;

import com.google.android.libraries.pagedatadownload.Flags;
import com.google.android.libraries.pagedatadownload.downloader.DownloadRequest;
import com.google.android.libraries.pagedatadownload.downloader.FileDownloader;
import com.google.android.libraries.pagedatadownload.internal.PageFileUtil;
import com.google.android.libraries.pagedatadownload.internal.PageProviderSelector;
import com.google.android.libraries.pagedatadownload.internal.ScreenInfo;
import com.google.android.libraries.pagedatadownload.internal.logging.EventLogger;
import com.google.android.libraries.pagedatadownload.internal.logging.LogUtil;
import com.google.android.libraries.pagedatadownload.internal.util.FuturesUtil;
import com.google.android.libraries.pagedatadownload.internal.util.FuturesUtil.SequentialFutureChain;
import com.google.android.libraries.pagedatadownload.scheduler.Worker;
import com.google.auto.value.AutoValue;
import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import java.io.File;
import java.util.concurrent.Executor;

/**
 * Downloads the page images that are missing for the current width(s).
 *
 * <p>Pages are downloaded one after the other. Failed pages are counted but not retried; the worker
 * always succeeds.
 */
public final class MissingPageDownloadWorker implements Worker {
  private static final String TAG = "MissingPageDownloadWorker";

  private final PageFileUtil pageFileUtil;
  private final PageProviderSelector pageProviderSelector;
  private final ScreenInfo screenInfo;
  private final Supplier<FileDownloader> fileDownloaderSupplier;
  private final EventLogger eventLogger;
  private final Flags flags;
  private final Executor backgroundExecutor;

  public MissingPageDownloadWorker(
      PageFileUtil pageFileUtil,
      PageProviderSelector pageProviderSelector,
      ScreenInfo screenInfo,
      Supplier<FileDownloader> fileDownloaderSupplier,
      EventLogger eventLogger,
      Flags flags,
      Executor backgroundExecutor) {
    this.pageFileUtil = pageFileUtil;
    this.pageProviderSelector = pageProviderSelector;
    this.screenInfo = screenInfo;
    this.fileDownloaderSupplier = fileDownloaderSupplier;
    this.eventLogger = eventLogger;
    this.flags = flags;
    this.backgroundExecutor = backgroundExecutor;
  }

  @Override
  public ListenableFuture<Result> doWork(ImmutableMap<String, String> inputData) {
    LogUtil.d("%s: started", TAG);
    return Futures.transformAsync(
        Futures.submit(this::findMissingPagesToDownload, backgroundExecutor),
        this::downloadMissingPages,
        backgroundExecutor);
  }

  private ListenableFuture<Result> downloadMissingPages(ImmutableList<PageToDownload> pages) {
    int missingImages = pages.size();
    LogUtil.d("%s: found %d missing pages", TAG, missingImages);
    if (missingImages >= flags.missingPageLimit()) {
      LogUtil.d("%s: too many missing pages, not downloading", TAG);
      return immediateFuture(Result.SUCCESS);
    }

    // The chain carries the number of failed downloads.
    SequentialFutureChain<Integer> chain =
        new FuturesUtil(backgroundExecutor).newSequentialChain(0);
    for (PageToDownload page : pages) {
      chain.chainAsync(
          failures ->
              Futures.transform(
                  downloadPage(page),
                  success -> success ? failures : failures + 1,
                  MoreExecutors.directExecutor()));
    }

    return Futures.transform(
        chain.start(),
        failures -> {
          if (failures > 0) {
            LogUtil.d("%s: failed with %d from %d", TAG, failures, missingImages);
            eventLogger.logMissingPageDownloadFailure(failures, missingImages);
          } else {
            LogUtil.d("%s: success with %d", TAG, missingImages);
            eventLogger.logMissingPageDownloadSuccess(missingImages);
          }
          return Result.SUCCESS;
        },
        MoreExecutors.directExecutor());
  }

  private ImmutableList<PageToDownload> findMissingPagesToDownload() {
    String width = screenInfo.getWidthParam();
    ImmutableList<PageToDownload> result = findMissingPagesForWidth(width);

    String tabletWidth = screenInfo.getTabletWidthParam();
    if (width.equals(tabletWidth)) {
      return result;
    }
    return ImmutableList.<PageToDownload>builder()
        .addAll(result)
        .addAll(findMissingPagesForWidth(tabletWidth))
        .build();
  }

  private ImmutableList<PageToDownload> findMissingPagesForWidth(String width) {
    File pagesDirectory = pageFileUtil.getImagesDirectory(width);
    if (pagesDirectory == null) {
      LogUtil.w("%s: no images directory for %s", TAG, width);
      return ImmutableList.of();
    }

    ImmutableList.Builder<PageToDownload> result = ImmutableList.builder();
    int numberOfPages = pageProviderSelector.getPageProvider().numberOfPages();
    for (int page = 1; page <= numberOfPages; page++) {
      String pageFile = PageFileUtil.getPageFileName(page);
      if (!new File(pagesDirectory, pageFile).exists()) {
        result.add(PageToDownload.create(width, page));
      }
    }
    return result.build();
  }

  private ListenableFuture<Boolean> downloadPage(PageToDownload pageToDownload) {
    LogUtil.d(
        "%s: downloading %d for %s - thread: %s",
        TAG, pageToDownload.page(), pageToDownload.width(), Thread.currentThread().getName());
    String pageName = PageFileUtil.getPageFileName(pageToDownload.page());

    ListenableFuture<Void> downloadFuture;
    try {
      File pagesDirectory = pageFileUtil.getImagesDirectory(pageToDownload.width());
      if (pagesDirectory == null) {
        return immediateFuture(false);
      }
      DownloadRequest request =
          DownloadRequest.newBuilder()
              .setDestinationFile(new File(pagesDirectory, pageName))
              .setUrlToDownload(
                  pageFileUtil.getImageUrl(flags.imageBaseUrl(), pageToDownload.width(), pageName))
              .build();
      downloadFuture = fileDownloaderSupplier.get().startDownloading(request);
    } catch (RuntimeException e) {
      LogUtil.d(e, "%s: unable to start download of %s", TAG, pageName);
      return immediateFuture(false);
    }

    return Futures.catching(
        Futures.transform(downloadFuture, unused -> true, MoreExecutors.directExecutor()),
        Throwable.class,
        t -> {
          LogUtil.d(t, "%s: download of %s failed", TAG, pageName);
          return false;
        },
        MoreExecutors.directExecutor());
  }

  /** A page image missing for a width. */
  @AutoValue
  abstract static class PageToDownload {
    abstract String width();

    abstract int page();

    static PageToDownload create(String width, int page) {
      return new AutoValue_MissingPageDownloadWorker_PageToDownload(width, page);
    }
  }
}
