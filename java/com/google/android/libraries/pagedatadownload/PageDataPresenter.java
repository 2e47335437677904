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

import com.google.android.libraries.pagedatadownload.TaskScheduler.NetworkState;
import com.google.android.libraries.pagedatadownload.internal.DatabaseCopier;
import com.google.android.libraries.pagedatadownload.internal.DebugLogGenerator;
import com.google.android.libraries.pagedatadownload.internal.PageDataSettings;
import com.google.android.libraries.pagedatadownload.internal.PageFileUtil;
import com.google.android.libraries.pagedatadownload.internal.PageProviderSelector;
import com.google.android.libraries.pagedatadownload.internal.ScreenInfo;
import com.google.android.libraries.pagedatadownload.internal.logging.LogUtil;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/**
 * Checks whether the page images needed for the current screen are on device, and whether they
 * need a patch.
 *
 * <p>{@link #checkPages()}, {@link #bind} and {@link #unbind} must be called on the ui executor.
 * The check itself runs on the background executor and its result is delivered to the bound
 * {@link PageDataView} on the ui executor. While a check is running, further calls to {@link
 * #checkPages()} have no effect.
 */
public class PageDataPresenter implements Presenter<PageDataView> {
  private static final String TAG = "PageDataPresenter";

  private final PageFileUtil pageFileUtil;
  private final ScreenInfo screenInfo;
  private final PageProviderSelector pageProviderSelector;
  private final PageDataSettings settings;
  private final DatabaseCopier databaseCopier;
  private final DebugLogGenerator debugLogGenerator;
  private final TaskScheduler taskScheduler;
  private final Optional<SilentFeedback> silentFeedbackOptional;
  private final Flags flags;
  private final Executor backgroundExecutor;
  private final Executor uiExecutor;

  // Accessed on the ui executor only.
  @Nullable private PageDataView view;
  @Nullable private ListenableFuture<PageDataStatus> checkPagesFuture;
  @Nullable private String cachedPageType;
  @Nullable private PageDataStatus lastCachedResult;

  @Nullable private volatile String debugLog;

  public PageDataPresenter(
      PageFileUtil pageFileUtil,
      ScreenInfo screenInfo,
      PageProviderSelector pageProviderSelector,
      PageDataSettings settings,
      DatabaseCopier databaseCopier,
      DebugLogGenerator debugLogGenerator,
      TaskScheduler taskScheduler,
      Optional<SilentFeedback> silentFeedbackOptional,
      Flags flags,
      Executor backgroundExecutor,
      Executor uiExecutor) {
    this.pageFileUtil = pageFileUtil;
    this.screenInfo = screenInfo;
    this.pageProviderSelector = pageProviderSelector;
    this.settings = settings;
    this.databaseCopier = databaseCopier;
    this.debugLogGenerator = debugLogGenerator;
    this.taskScheduler = taskScheduler;
    this.silentFeedbackOptional = silentFeedbackOptional;
    this.flags = flags;
    this.backgroundExecutor = backgroundExecutor;
    this.uiExecutor = uiExecutor;
  }

  @Override
  public void bind(PageDataView view) {
    this.view = view;
  }

  @Override
  public void unbind(PageDataView view) {
    if (this.view == view) {
      this.view = null;
    }
  }

  /** Checks the page images and reports the result to the bound view. */
  public void checkPages() {
    if (pageFileUtil.getBaseDirectory() == null) {
      if (view != null) {
        view.onStorageNotAvailable();
      }
    } else if (lastCachedResult != null && settings.getPageType().equals(cachedPageType)) {
      if (view != null) {
        view.onPagesChecked(lastCachedResult);
      }
    } else if (checkPagesFuture == null) {
      String pageType = settings.getPageType();
      int totalPages = pageProviderSelector.getPageProvider().numberOfPages();

      ListenableFuture<PageDataStatus> future =
          Futures.submit(
              () -> {
                supportLegacyPages(totalPages);
                PageDataStatus status = checkPatchStatus(actuallyCheckPages(totalPages));
                if (status.havePages()) {
                  copyArabicDatabaseIfNecessary();
                } else {
                  generateDebugLogSafely();
                }
                return status;
              },
              backgroundExecutor);
      checkPagesFuture = future;
      Futures.addCallback(
          future,
          new FutureCallback<PageDataStatus>() {
            @Override
            public void onSuccess(PageDataStatus status) {
              // Results that need a download or a patch may be outdated once the user returns.
              if (status.havePages() && !status.patchParam().isPresent()) {
                cachedPageType = pageType;
                lastCachedResult = status;
              }
              checkPagesFuture = null;
              if (view != null) {
                view.onPagesChecked(status);
              }
            }

            @Override
            public void onFailure(Throwable t) {
              LogUtil.e(t, "%s: Failed to check pages", TAG);
              sendToSilentFeedback(t, "Failed to check pages");
              checkPagesFuture = null;
              if (view != null) {
                view.onPagesCheckFailed(t);
              }
            }
          },
          uiExecutor);
      scheduleAudioUpdater();
    }
  }

  /** Returns the debug log generated by the last check that found missing pages, or "". */
  public String getDebugLog() {
    String log = debugLog;
    return log == null ? "" : log;
  }

  private void scheduleAudioUpdater() {
    taskScheduler.schedulePeriodicTask(
        TaskScheduler.AUDIO_UPDATE_PERIODIC_TASK,
        flags.audioUpdatePeriodDays(),
        TimeUnit.DAYS,
        NetworkState.NETWORK_STATE_CONNECTED);
  }

  private void supportLegacyPages(int totalPages) {
    if (!settings.haveDefaultImagesDirectory()
        && PageProvider.MADANI_PAGE_TYPE.equals(settings.getPageType())) {
      // Devices that already have the complete legacy 1920 set keep using it instead of 1260.
      Optional<String> fallback = pageFileUtil.getPotentialFallbackDirectory(totalPages);
      if (fallback.isPresent()) {
        LogUtil.d("%s: Setting fallback pages to %s", TAG, fallback.get());
        settings.setDefaultImagesDirectory(fallback.get());
      } else {
        // An empty value stops this check from running on every launch.
        settings.setDefaultImagesDirectory("");
      }
    }

    String pageType = settings.getPageType();
    if (!settings.didCheckPartialImages(pageType)) {
      LogUtil.d("%s: Enqueuing cleanup work for %s", TAG, pageType);
      ImmutableList<WorkRequest> workChain =
          ImmutableList.of(
              WorkRequest.newBuilder()
                  .setWorkerTag(Constants.PARTIAL_PAGE_CHECK_WORKER)
                  .setInputData(ImmutableMap.of(Constants.PAGE_TYPE, pageType))
                  .build(),
              WorkRequest.newBuilder()
                  .setWorkerTag(Constants.MISSING_PAGE_DOWNLOAD_WORKER)
                  .setNetworkState(NetworkState.NETWORK_STATE_CONNECTED)
                  .build());
      Futures.addCallback(
          taskScheduler.enqueueUniqueWork(TaskScheduler.CLEANUP_PREFIX + pageType, workChain),
          new FutureCallback<Void>() {
            @Override
            public void onSuccess(Void unused) {
              LogUtil.d("%s: Cleanup work for %s finished", TAG, pageType);
            }

            @Override
            public void onFailure(Throwable t) {
              LogUtil.w(t, "%s: Cleanup work for %s failed", TAG, pageType);
            }
          },
          MoreExecutors.directExecutor());
    }
  }

  private PageDataStatus actuallyCheckPages(int totalPages) {
    String width = screenInfo.getWidthParam();
    boolean havePortrait = pageFileUtil.haveAllImages(width, totalPages, true);

    String tabletWidth = screenInfo.getTabletWidthParam();
    boolean haveLandscape;
    if (screenInfo.isDualPageMode() && !width.equals(tabletWidth)) {
      haveLandscape = pageFileUtil.haveAllImages(tabletWidth, totalPages, true);
      LogUtil.d(
          "%s: checkPages: have portrait images: %s, have landscape images: %s",
          TAG, havePortrait, haveLandscape);
    } else {
      // Either not in dual page mode or both widths are the same.
      haveLandscape = true;
      LogUtil.d("%s: checkPages: have all images: %s", TAG, havePortrait);
    }

    return PageDataStatus.builder()
        .setPortraitWidth(width)
        .setLandscapeWidth(tabletWidth)
        .setHavePortrait(havePortrait)
        .setHaveLandscape(haveLandscape)
        .build();
  }

  private PageDataStatus checkPatchStatus(PageDataStatus status) {
    // Patches only apply to complete image sets.
    if (!status.havePages()) {
      return status;
    }

    int latestImageVersion = pageProviderSelector.getPageProvider().imageVersion();
    String width = status.portraitWidth();
    String tabletWidth = status.landscapeWidth();
    if (!width.equals(tabletWidth) && !pageFileUtil.isVersion(tabletWidth, latestImageVersion)) {
      return status.withPatchParam(width + tabletWidth);
    }
    if (!pageFileUtil.isVersion(width, latestImageVersion)) {
      return status.withPatchParam(width);
    }
    return status;
  }

  private void copyArabicDatabaseIfNecessary() {
    // Only the madani flavor bundles the database. Full page downloads include it anyway.
    if (PageProvider.MADANI_PAGE_TYPE.equals(flags.appFlavor())
        && !pageFileUtil.hasArabicSearchDatabase()) {
      boolean success =
          databaseCopier.copyArabicDatabaseFromResources(flags.bundledArabicDatabaseResource());
      if (success) {
        LogUtil.d("%s: Copied Arabic database successfully", TAG);
      } else {
        LogUtil.d("%s: Failed to copy Arabic database", TAG);
      }
    }
  }

  private void generateDebugLogSafely() {
    try {
      debugLog = debugLogGenerator.generateDebugLog();
    } catch (Exception e) {
      LogUtil.w(e, "%s: Unable to generate debug log", TAG);
      sendToSilentFeedback(e, "Unable to generate debug log");
    }
  }

  private void sendToSilentFeedback(Throwable t, String description) {
    if (silentFeedbackOptional.isPresent()) {
      silentFeedbackOptional.get().send(t, description);
    }
  }
}
