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

import com.google.android.libraries.pagedatadownload.audio.AudioUpdateService;
import com.google.android.libraries.pagedatadownload.downloader.FileDownloader;
import com.google.android.libraries.pagedatadownload.downloader.OkHttpFileDownloader;
import com.google.android.libraries.pagedatadownload.internal.DatabaseCopier;
import com.google.android.libraries.pagedatadownload.internal.DebugLogGenerator;
import com.google.android.libraries.pagedatadownload.internal.PageDataSettings;
import com.google.android.libraries.pagedatadownload.internal.PageFileUtil;
import com.google.android.libraries.pagedatadownload.internal.PageProviderSelector;
import com.google.android.libraries.pagedatadownload.internal.ScreenInfo;
import com.google.android.libraries.pagedatadownload.internal.logging.EventLogger;
import com.google.android.libraries.pagedatadownload.internal.logging.NoOpEventLogger;
import com.google.android.libraries.pagedatadownload.internal.logging.PddEventLogger;
import com.google.android.libraries.pagedatadownload.scheduler.ExecutorTaskScheduler;
import com.google.android.libraries.pagedatadownload.scheduler.NetworkStateProvider;
import com.google.android.libraries.pagedatadownload.worker.AudioUpdateWorker;
import com.google.android.libraries.pagedatadownload.worker.MissingPageDownloadWorker;
import com.google.android.libraries.pagedatadownload.worker.PageDataWorkerFactory;
import com.google.android.libraries.pagedatadownload.worker.PartialPageCheckingWorker;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.gson.Gson;
import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

/**
 * A Builder for {@link PageDataDownload}.
 *
 * <p>The storage root, the screen size, the executors and (unless a task scheduler is set) the
 * scheduled executor are required. Everything else has a default.
 *
 * <p>Without a {@link TaskScheduler}, work runs in-process on the scheduled executor and does not
 * survive the process.
 */
public final class PageDataDownloadBuilder {
  static final String SETTINGS_FILE_NAME = "pdd_settings.properties";

  private File storageRoot;
  private Optional<File> settingsFileOptional = Optional.absent();
  private int screenWidth;
  private int screenHeight;
  private boolean dualPageMode;
  private final Map<String, PageProvider> pageProviders = new LinkedHashMap<>();
  private Optional<Flags> flagsOptional = Optional.absent();
  private Optional<Logger> loggerOptional = Optional.absent();
  private Optional<SilentFeedback> silentFeedbackOptional = Optional.absent();
  private Executor backgroundExecutor;
  private Executor uiExecutor;
  private Optional<ScheduledExecutorService> scheduledExecutorOptional = Optional.absent();
  private Optional<OkHttpClient> httpClientOptional = Optional.absent();
  private Optional<Supplier<FileDownloader>> fileDownloaderSupplierOptional = Optional.absent();
  private Optional<TaskScheduler> taskSchedulerOptional = Optional.absent();
  private NetworkStateProvider networkStateProvider = NetworkStateProvider.ALWAYS_CONNECTED;

  public static PageDataDownloadBuilder newBuilder() {
    return new PageDataDownloadBuilder();
  }

  private PageDataDownloadBuilder() {}

  /** Set the directory holding page images, databases and audio. */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setStorageRoot(File storageRoot) {
    this.storageRoot = storageRoot;
    return this;
  }

  /** Set the settings file. Defaults to {@value #SETTINGS_FILE_NAME} in the storage root. */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setSettingsFileOptional(Optional<File> settingsFileOptional) {
    this.settingsFileOptional = settingsFileOptional;
    return this;
  }

  /** Set the screen size in pixels, used to pick the image width buckets. */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setScreenSize(int screenWidth, int screenHeight) {
    this.screenWidth = screenWidth;
    this.screenHeight = screenHeight;
    return this;
  }

  /** Set whether two pages are shown side by side in landscape. */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setDualPageMode(boolean dualPageMode) {
    this.dualPageMode = dualPageMode;
    return this;
  }

  /**
   * Add a page type. {@link PageProvider#MADANI} is always available and is used for unknown page
   * types.
   */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder addPageProvider(PageProvider pageProvider) {
    this.pageProviders.put(pageProvider.pageType(), pageProvider);
    return this;
  }

  /** Set the flags otherwise default values will be used only. */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setFlagsOptional(Optional<Flags> flags) {
    this.flagsOptional = flags;
    return this;
  }

  /** Set the optional Logger which if present will be used by PDD to log events. */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setLoggerOptional(Optional<Logger> logger) {
    this.loggerOptional = logger;
    return this;
  }

  /**
   * Set the optional SilentFeedback which if present will be used by PDD to send silent feedbacks.
   */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setSilentFeedbackOptional(
      Optional<SilentFeedback> silentFeedbackOptional) {
    this.silentFeedbackOptional = silentFeedbackOptional;
    return this;
  }

  /** Set the executor for page checks, file work and downloads. */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setBackgroundExecutor(Executor backgroundExecutor) {
    Preconditions.checkNotNull(backgroundExecutor);
    this.backgroundExecutor = backgroundExecutor;
    return this;
  }

  /** Set the executor that {@link PageDataView} callbacks are delivered on. */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setUiExecutor(Executor uiExecutor) {
    Preconditions.checkNotNull(uiExecutor);
    this.uiExecutor = uiExecutor;
    return this;
  }

  /** Set the executor the default in-process task scheduler runs on. */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setScheduledExecutorOptional(
      Optional<ScheduledExecutorService> scheduledExecutorOptional) {
    this.scheduledExecutorOptional = scheduledExecutorOptional;
    return this;
  }

  /** Set the OkHttpClient shared by page and audio update downloads. */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setHttpClientOptional(Optional<OkHttpClient> httpClientOptional) {
    this.httpClientOptional = httpClientOptional;
    return this;
  }

  /**
   * Set the FileDownloader Supplier. PDD takes in a Supplier of FileDownloader to support lazy
   * instantiation of the FileDownloader. Defaults to an {@link OkHttpFileDownloader}.
   */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setFileDownloaderSupplierOptional(
      Optional<Supplier<FileDownloader>> fileDownloaderSupplierOptional) {
    this.fileDownloaderSupplierOptional = fileDownloaderSupplierOptional;
    return this;
  }

  /**
   * Set the task scheduler that will be used by PDD to schedule periodic and one-off work. Clients
   * with their own scheduler forward each task to {@link PageDataDownload#handleTask}.
   */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setTaskSchedulerOptional(
      Optional<TaskScheduler> taskSchedulerOptional) {
    this.taskSchedulerOptional = taskSchedulerOptional;
    return this;
  }

  /** Set the network state used by the default task scheduler. Defaults to always connected. */
  @CanIgnoreReturnValue
  public PageDataDownloadBuilder setNetworkStateProvider(
      NetworkStateProvider networkStateProvider) {
    this.networkStateProvider = networkStateProvider;
    return this;
  }

  /**
   * Builds PDD, loading the settings from disk.
   *
   * @throws IOException if the settings file exists but cannot be read
   */
  public PageDataDownload build() throws IOException {
    Preconditions.checkNotNull(storageRoot);
    Preconditions.checkNotNull(backgroundExecutor);
    Preconditions.checkNotNull(uiExecutor);
    Preconditions.checkState(
        taskSchedulerOptional.isPresent() || scheduledExecutorOptional.isPresent(),
        "Either a task scheduler or a scheduled executor is required");

    Flags flags = flagsOptional.or(new Flags() {});

    final EventLogger eventLogger;
    if (loggerOptional.isPresent()) {
      eventLogger = new PddEventLogger(loggerOptional.get());
    } else {
      eventLogger = new NoOpEventLogger();
    }

    PageDataSettings settings =
        PageDataSettings.load(settingsFileOptional.or(new File(storageRoot, SETTINGS_FILE_NAME)));
    ScreenInfo screenInfo = new ScreenInfo(screenWidth, screenHeight, dualPageMode, settings);

    ImmutableMap<String, PageProvider> providers =
        ImmutableMap.<String, PageProvider>builder()
            .put(PageProvider.MADANI_PAGE_TYPE, PageProvider.MADANI)
            .putAll(pageProviders)
            .buildKeepingLast();
    PageProviderSelector pageProviderSelector =
        new PageProviderSelector(providers, PageProvider.MADANI, settings);
    PageFileUtil pageFileUtil = new PageFileUtil(storageRoot, pageProviderSelector);

    OkHttpClient httpClient =
        httpClientOptional.isPresent()
            ? httpClientOptional.get()
            : new OkHttpClient.Builder()
                .connectTimeout(flags.downloaderConnectTimeoutSec(), TimeUnit.SECONDS)
                .readTimeout(flags.downloaderReadTimeoutSec(), TimeUnit.SECONDS)
                .build();
    Supplier<FileDownloader> fileDownloaderSupplier;
    if (fileDownloaderSupplierOptional.isPresent()) {
      fileDownloaderSupplier = fileDownloaderSupplierOptional.get();
    } else {
      Executor downloadExecutor = backgroundExecutor;
      fileDownloaderSupplier =
          Suppliers.memoize(() -> new OkHttpFileDownloader(httpClient, downloadExecutor));
    }

    PageDataWorkerFactory workerFactory =
        new PageDataWorkerFactory(
            new PartialPageCheckingWorker(
                pageFileUtil, pageProviderSelector, settings, backgroundExecutor),
            new MissingPageDownloadWorker(
                pageFileUtil,
                pageProviderSelector,
                screenInfo,
                fileDownloaderSupplier,
                eventLogger,
                flags,
                backgroundExecutor),
            new AudioUpdateWorker(
                new AudioUpdateService(
                    httpClient, new Gson(), flags.audioUpdateUrl(), backgroundExecutor),
                pageFileUtil,
                settings,
                backgroundExecutor));

    TaskScheduler taskScheduler;
    if (taskSchedulerOptional.isPresent()) {
      taskScheduler = taskSchedulerOptional.get();
    } else {
      taskScheduler =
          new ExecutorTaskScheduler(
              scheduledExecutorOptional.get(),
              workerFactory,
              networkStateProvider,
              flags.constraintRetryDelayMillis());
    }

    PageDataPresenter presenter =
        new PageDataPresenter(
            pageFileUtil,
            screenInfo,
            pageProviderSelector,
            settings,
            new DatabaseCopier(pageFileUtil),
            new DebugLogGenerator(pageFileUtil),
            taskScheduler,
            silentFeedbackOptional,
            flags,
            backgroundExecutor,
            uiExecutor);

    return new PageDataDownload(presenter, settings, workerFactory, taskScheduler);
  }
}
