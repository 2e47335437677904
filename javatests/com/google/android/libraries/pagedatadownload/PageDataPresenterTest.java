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

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.android.libraries.pagedatadownload.TaskScheduler.NetworkState;
import com.google.android.libraries.pagedatadownload.internal.DatabaseCopier;
import com.google.android.libraries.pagedatadownload.internal.DebugLogGenerator;
import com.google.android.libraries.pagedatadownload.internal.PageDataSettings;
import com.google.android.libraries.pagedatadownload.internal.PageFileUtil;
import com.google.android.libraries.pagedatadownload.internal.PageProviderSelector;
import com.google.android.libraries.pagedatadownload.internal.ScreenInfo;
import com.google.android.libraries.pagedatadownload.testing.TestFlags;
import com.google.android.libraries.pagedatadownload.testing.TestPageImages;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.MoreExecutors;
import java.io.File;
import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public final class PageDataPresenterTest {

  private static final int PAGES = 5;
  private static final int IMAGE_VERSION = 6;
  private static final PageProvider TEST_PAGES =
      PageProvider.MADANI.toBuilder().setNumberOfPages(PAGES).build();
  private static final PageProvider NASKH =
      PageProvider.builder()
          .setPageType("naskh")
          .setNumberOfPages(PAGES)
          .setImageVersion(2)
          .setImagesDirectoryName("naskh")
          .build();
  private static final String DATABASE_RESOURCE =
      "com/google/android/libraries/pagedatadownload/testdata/quran.ar.db";

  @Rule public final MockitoRule mocks = MockitoJUnit.rule();
  @Rule public final TemporaryFolder tmpFolder = new TemporaryFolder();

  @Mock private PageDataView mockView;
  @Mock private TaskScheduler mockTaskScheduler;
  @Mock private SilentFeedback mockSilentFeedback;
  @Captor private ArgumentCaptor<PageDataStatus> statusCaptor;
  @Captor private ArgumentCaptor<ImmutableList<WorkRequest>> workChainCaptor;

  private File storageRoot;
  private PageDataSettings settings;
  private PageProviderSelector pageProviderSelector;
  private PageFileUtil pageFileUtil;
  private TestFlags flags;

  @Before
  public void setUp() throws Exception {
    storageRoot = new File(tmpFolder.getRoot(), "quran_android");
    settings = PageDataSettings.load(new File(tmpFolder.getRoot(), "settings.properties"));
    pageProviderSelector =
        new PageProviderSelector(
            ImmutableMap.of(PageProvider.MADANI_PAGE_TYPE, TEST_PAGES, "naskh", NASKH),
            TEST_PAGES,
            settings);
    pageFileUtil = new PageFileUtil(storageRoot, pageProviderSelector);
    flags = new TestFlags();
    flags.bundledArabicDatabaseResource = Optional.of(DATABASE_RESOURCE);

    when(mockTaskScheduler.enqueueUniqueWork(anyString(), any()))
        .thenReturn(Futures.immediateVoidFuture());
  }

  private PageDataPresenter createPresenter(ScreenInfo screenInfo) {
    return createPresenter(
        screenInfo, new DebugLogGenerator(pageFileUtil), MoreExecutors.directExecutor());
  }

  private PageDataPresenter createPresenter(
      ScreenInfo screenInfo, DebugLogGenerator debugLogGenerator, Executor backgroundExecutor) {
    PageDataPresenter presenter =
        new PageDataPresenter(
            pageFileUtil,
            screenInfo,
            pageProviderSelector,
            settings,
            new DatabaseCopier(pageFileUtil),
            debugLogGenerator,
            mockTaskScheduler,
            Optional.of(mockSilentFeedback),
            flags,
            backgroundExecutor,
            MoreExecutors.directExecutor());
    presenter.bind(mockView);
    return presenter;
  }

  private ScreenInfo phone() {
    return new ScreenInfo(1080, 1920, /* dualPageMode= */ false, settings);
  }

  private ScreenInfo tablet() {
    return new ScreenInfo(800, 2600, /* dualPageMode= */ true, settings);
  }

  private File writeCompleteSet(File imagesBase, String widthParam, int version) throws Exception {
    File directory = TestPageImages.writePages(imagesBase, widthParam, PAGES);
    TestPageImages.writeVersion(directory, version);
    return directory;
  }

  private PageDataStatus lastStatus() {
    verify(mockView).onPagesChecked(statusCaptor.capture());
    return statusCaptor.getValue();
  }

  @Test
  public void checkPages_storageNotAvailable() throws Exception {
    Files.write(new byte[0], storageRoot);
    PageDataPresenter presenter = createPresenter(phone());

    presenter.checkPages();

    verify(mockView).onStorageNotAvailable();
    verify(mockView, never()).onPagesChecked(any());
    verifyNoInteractions(mockTaskScheduler);
  }

  @Test
  public void checkPages_allPagesPresent() throws Exception {
    writeCompleteSet(storageRoot, "_1024", IMAGE_VERSION);
    PageDataPresenter presenter = createPresenter(phone());

    presenter.checkPages();

    PageDataStatus status = lastStatus();
    assertThat(status.portraitWidth()).isEqualTo("_1024");
    assertThat(status.landscapeWidth()).isEqualTo("_1024");
    assertThat(status.havePages()).isTrue();
    assertThat(status.patchParam().isPresent()).isFalse();
    assertThat(presenter.getDebugLog()).isEmpty();
  }

  @Test
  public void checkPages_pagesPresent_copiesArabicDatabase() throws Exception {
    writeCompleteSet(storageRoot, "_1024", IMAGE_VERSION);

    createPresenter(phone()).checkPages();

    assertThat(pageFileUtil.hasArabicSearchDatabase()).isTrue();
  }

  @Test
  public void checkPages_otherFlavor_doesNotCopyArabicDatabase() throws Exception {
    flags.appFlavor = Optional.of("naskh");
    writeCompleteSet(storageRoot, "_1024", IMAGE_VERSION);

    createPresenter(phone()).checkPages();

    assertThat(pageFileUtil.hasArabicSearchDatabase()).isFalse();
  }

  @Test
  public void checkPages_missingPages_generatesDebugLog() throws Exception {
    TestPageImages.writePages(storageRoot, "_1024", PAGES - 1);
    PageDataPresenter presenter = createPresenter(phone());

    presenter.checkPages();

    PageDataStatus status = lastStatus();
    assertThat(status.havePortrait()).isFalse();
    assertThat(status.needPortrait()).isTrue();
    assertThat(status.patchParam().isPresent()).isFalse();
    assertThat(presenter.getDebugLog()).contains("image directory: width_1024 - 4");
    assertThat(pageFileUtil.hasArabicSearchDatabase()).isFalse();
  }

  @Test
  public void checkPages_cachesCompleteResult() throws Exception {
    File directory = writeCompleteSet(storageRoot, "_1024", IMAGE_VERSION);
    PageDataPresenter presenter = createPresenter(phone());
    presenter.checkPages();

    new File(directory, "page001.png").delete();
    presenter.checkPages();

    verify(mockView, times(2)).onPagesChecked(statusCaptor.capture());
    PageDataStatus first = statusCaptor.getAllValues().get(0);
    assertThat(statusCaptor.getAllValues().get(1)).isSameInstanceAs(first);
    assertThat(statusCaptor.getAllValues().get(1).havePages()).isTrue();
  }

  @Test
  public void checkPages_pageTypeChanged_checksAgain() throws Exception {
    writeCompleteSet(storageRoot, "_1024", IMAGE_VERSION);
    PageDataPresenter presenter = createPresenter(phone());
    presenter.checkPages();

    settings.setPageType("naskh");
    presenter.checkPages();

    verify(mockView, times(2)).onPagesChecked(statusCaptor.capture());
    assertThat(statusCaptor.getAllValues().get(1).havePages()).isFalse();
  }

  @Test
  public void checkPages_doesNotCacheIncompleteResult() throws Exception {
    TestPageImages.writePages(storageRoot, "_1024", PAGES - 1);
    PageDataPresenter presenter = createPresenter(phone());
    presenter.checkPages();

    writeCompleteSet(storageRoot, "_1024", IMAGE_VERSION);
    presenter.checkPages();

    verify(mockView, times(2)).onPagesChecked(statusCaptor.capture());
    assertThat(statusCaptor.getAllValues().get(0).havePages()).isFalse();
    assertThat(statusCaptor.getAllValues().get(1).havePages()).isTrue();
  }

  @Test
  public void checkPages_outdatedPortrait_needsPatch() throws Exception {
    writeCompleteSet(storageRoot, "_1024", IMAGE_VERSION - 1);
    PageDataPresenter presenter = createPresenter(phone());

    presenter.checkPages();
    assertThat(lastStatus().patchParam().get()).isEqualTo("_1024");

    // Results that need a patch are not cached.
    TestPageImages.writeVersion(new File(storageRoot, "width_1024"), IMAGE_VERSION);
    presenter.checkPages();
    verify(mockView, times(2)).onPagesChecked(statusCaptor.capture());
    assertThat(statusCaptor.getValue().patchParam().isPresent()).isFalse();
  }

  @Test
  public void checkPages_dualPage_checksBothWidths() throws Exception {
    writeCompleteSet(storageRoot, "_800", IMAGE_VERSION);
    PageDataPresenter presenter = createPresenter(tablet());

    presenter.checkPages();

    PageDataStatus status = lastStatus();
    assertThat(status.portraitWidth()).isEqualTo("_800");
    assertThat(status.landscapeWidth()).isEqualTo("_1260");
    assertThat(status.havePortrait()).isTrue();
    assertThat(status.haveLandscape()).isFalse();
    assertThat(status.needLandscape()).isTrue();
  }

  @Test
  public void checkPages_dualPage_outdatedLandscape_patchesBothWidths() throws Exception {
    writeCompleteSet(storageRoot, "_800", IMAGE_VERSION - 1);
    writeCompleteSet(storageRoot, "_1260", IMAGE_VERSION - 1);

    createPresenter(tablet()).checkPages();

    assertThat(lastStatus().patchParam().get()).isEqualTo("_800_1260");
  }

  @Test
  public void checkPages_dualPage_outdatedPortraitOnly_patchesPortrait() throws Exception {
    writeCompleteSet(storageRoot, "_800", IMAGE_VERSION - 1);
    writeCompleteSet(storageRoot, "_1260", IMAGE_VERSION);

    createPresenter(tablet()).checkPages();

    assertThat(lastStatus().patchParam().get()).isEqualTo("_800");
  }

  @Test
  public void checkPages_legacyFallbackFound_usesLegacyWidth() throws Exception {
    writeCompleteSet(storageRoot, "_1920", IMAGE_VERSION);
    ScreenInfo wideScreen = new ScreenInfo(1440, 2560, false, settings);

    createPresenter(wideScreen).checkPages();

    assertThat(settings.getDefaultImagesDirectory()).isEqualTo("1920");
    PageDataStatus status = lastStatus();
    assertThat(status.portraitWidth()).isEqualTo("_1920");
    assertThat(status.havePages()).isTrue();
  }

  @Test
  public void checkPages_noLegacyFallback_storesEmptyDefault() throws Exception {
    ScreenInfo wideScreen = new ScreenInfo(1440, 2560, false, settings);

    createPresenter(wideScreen).checkPages();

    assertThat(settings.haveDefaultImagesDirectory()).isTrue();
    assertThat(settings.getDefaultImagesDirectory()).isEmpty();
    assertThat(lastStatus().portraitWidth()).isEqualTo("_1260");
  }

  @Test
  public void checkPages_otherPageType_skipsLegacyFallback() throws Exception {
    settings.setPageType("naskh");

    createPresenter(phone()).checkPages();

    assertThat(settings.haveDefaultImagesDirectory()).isFalse();
  }

  @Test
  public void checkPages_enqueuesCleanupWork() throws Exception {
    createPresenter(phone()).checkPages();

    verify(mockTaskScheduler)
        .enqueueUniqueWork(eq("PDD.CLEANUP.madani"), workChainCaptor.capture());
    ImmutableList<WorkRequest> workChain = workChainCaptor.getValue();
    assertThat(workChain).hasSize(2);
    assertThat(workChain.get(0).workerTag()).isEqualTo(Constants.PARTIAL_PAGE_CHECK_WORKER);
    assertThat(workChain.get(0).inputData()).containsExactly(Constants.PAGE_TYPE, "madani");
    assertThat(workChain.get(1).workerTag()).isEqualTo(Constants.MISSING_PAGE_DOWNLOAD_WORKER);
    assertThat(workChain.get(1).networkState())
        .isEqualTo(NetworkState.NETWORK_STATE_CONNECTED);
  }

  @Test
  public void checkPages_partialImagesChecked_doesNotEnqueueCleanupWork() throws Exception {
    settings.setCheckedPartialImages(PageProvider.MADANI_PAGE_TYPE);

    createPresenter(phone()).checkPages();

    verify(mockTaskScheduler, never()).enqueueUniqueWork(anyString(), any());
  }

  @Test
  public void checkPages_schedulesAudioUpdates() throws Exception {
    createPresenter(phone()).checkPages();

    verify(mockTaskScheduler)
        .schedulePeriodicTask(
            TaskScheduler.AUDIO_UPDATE_PERIODIC_TASK,
            7,
            TimeUnit.DAYS,
            NetworkState.NETWORK_STATE_CONNECTED);
  }

  @Test
  public void checkPages_checkInFlight_isNotStartedAgain() throws Exception {
    writeCompleteSet(storageRoot, "_1024", IMAGE_VERSION);
    Queue<Runnable> pending = new ArrayDeque<>();
    PageDataPresenter presenter =
        createPresenter(phone(), new DebugLogGenerator(pageFileUtil), pending::add);

    presenter.checkPages();
    presenter.checkPages();

    assertThat(pending).hasSize(1);
    verify(mockView, never()).onPagesChecked(any());

    pending.remove().run();
    verify(mockView).onPagesChecked(any());

    // Finished and cached: answered without a new check.
    presenter.checkPages();
    assertThat(pending).isEmpty();
    verify(mockView, times(2)).onPagesChecked(any());
  }

  @Test
  public void checkPages_debugLogFailure_isReportedAndSwallowed() throws Exception {
    DebugLogGenerator failingGenerator =
        new DebugLogGenerator(pageFileUtil) {
          @Override
          public String generateDebugLog() {
            throw new IllegalStateException("listing failed");
          }
        };
    PageDataPresenter presenter =
        createPresenter(phone(), failingGenerator, MoreExecutors.directExecutor());

    presenter.checkPages();

    assertThat(lastStatus().havePages()).isFalse();
    assertThat(presenter.getDebugLog()).isEmpty();
    verify(mockSilentFeedback).send(any(IllegalStateException.class), anyString());
  }

  @Test
  public void checkPages_failure_isDeliveredAndCheckCanRun() throws Exception {
    RuntimeException failure = new RuntimeException("scheduler unavailable");
    when(mockTaskScheduler.enqueueUniqueWork(anyString(), any())).thenThrow(failure);
    PageDataPresenter presenter = createPresenter(phone());

    presenter.checkPages();

    verify(mockView).onPagesCheckFailed(failure);
    verify(mockSilentFeedback).send(eq(failure), anyString());
    verify(mockView, never()).onPagesChecked(any());

    presenter.checkPages();
    verify(mockView, times(2)).onPagesCheckFailed(failure);
  }

  @Test
  public void unbind_stopsCallbacks() throws Exception {
    PageDataPresenter presenter = createPresenter(phone());
    PageDataView otherView = mock(PageDataView.class);

    presenter.unbind(otherView);
    presenter.checkPages();
    verify(mockView).onPagesChecked(any());

    presenter.unbind(mockView);
    presenter.checkPages();
    verify(mockView).onPagesChecked(any());
  }
}
