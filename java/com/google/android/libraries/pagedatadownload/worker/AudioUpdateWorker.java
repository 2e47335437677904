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

import com.google.android.libraries.pagedatadownload.audio.AudioUpdateService;
import com.google.android.libraries.pagedatadownload.audio.AudioUpdates;
import com.google.android.libraries.pagedatadownload.audio.AudioUpdates.AudioFileUpdate;
import com.google.android.libraries.pagedatadownload.audio.AudioUpdates.AudioSetUpdate;
import com.google.android.libraries.pagedatadownload.internal.PageDataSettings;
import com.google.android.libraries.pagedatadownload.internal.PageFileUtil;
import com.google.android.libraries.pagedatadownload.internal.logging.LogUtil;
import com.google.android.libraries.pagedatadownload.scheduler.Worker;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.io.Files;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import java.io.File;
import java.io.IOException;
import java.util.concurrent.Executor;
import javax.annotation.Nullable;

/**
 * Removes downloaded audio files that changed on the server since the last update, so that they
 * are downloaded again when next played.
 */
public final class AudioUpdateWorker implements Worker {
  private static final String TAG = "AudioUpdateWorker";

  private final AudioUpdateService audioUpdateService;
  private final PageFileUtil pageFileUtil;
  private final PageDataSettings settings;
  private final Executor backgroundExecutor;

  public AudioUpdateWorker(
      AudioUpdateService audioUpdateService,
      PageFileUtil pageFileUtil,
      PageDataSettings settings,
      Executor backgroundExecutor) {
    this.audioUpdateService = audioUpdateService;
    this.pageFileUtil = pageFileUtil;
    this.settings = settings;
    this.backgroundExecutor = backgroundExecutor;
  }

  @Override
  public ListenableFuture<Result> doWork(ImmutableMap<String, String> inputData) {
    int revision = settings.getAudioUpdateRevision();
    LogUtil.d("%s: checking for audio updates since revision %d", TAG, revision);
    ListenableFuture<Result> result =
        Futures.transform(
            audioUpdateService.getUpdates(revision), this::applyUpdates, backgroundExecutor);
    return Futures.catching(
        result,
        Exception.class,
        e -> {
          LogUtil.e(e, "%s: unable to fetch audio updates", TAG);
          return Result.FAILURE;
        },
        backgroundExecutor);
  }

  private Result applyUpdates(AudioUpdates audioUpdates) {
    File audioDirectory = pageFileUtil.getAudioDirectory();
    if (audioDirectory == null) {
      LogUtil.w("%s: audio directory not available", TAG);
      return Result.FAILURE;
    }
    try {
      audioDirectory = audioDirectory.getCanonicalFile();
    } catch (IOException e) {
      LogUtil.e(e, "%s: unable to resolve audio directory %s", TAG, audioDirectory);
      return Result.FAILURE;
    }

    int deleted = 0;
    for (AudioSetUpdate update : audioUpdates.getUpdates()) {
      String path = update.getPath();
      if (path == null) {
        continue;
      }
      File reciterDirectory = resolveChild(audioDirectory, path);
      if (reciterDirectory == null || !reciterDirectory.isDirectory()) {
        continue;
      }

      if (update.getDatabaseVersion() != null) {
        deleted += deleteDatabases(reciterDirectory);
      }
      for (AudioFileUpdate fileUpdate : update.getFiles()) {
        if (fileUpdate.getFilename() == null || fileUpdate.getMd5() == null) {
          continue;
        }
        File audioFile = resolveChild(reciterDirectory, fileUpdate.getFilename());
        if (audioFile != null
            && audioFile.isFile() && !matchesMd5(audioFile, fileUpdate.getMd5())) {
          deleted += delete(audioFile);
        }
      }
    }

    Integer currentRevision = audioUpdates.getCurrentRevision();
    if (currentRevision == null) {
      LogUtil.w("%s: removed %d outdated files, no revision in response", TAG, deleted);
    } else {
      LogUtil.d(
          "%s: removed %d outdated files, now at revision %d", TAG, deleted, currentRevision);
      settings.setAudioUpdateRevision(currentRevision);
    }
    return Result.SUCCESS;
  }

  /**
   * Returns {@code name} resolved against {@code parent}, or null if it does not stay strictly
   * inside {@code parent}. {@code parent} must be canonical.
   */
  @Nullable
  private static File resolveChild(File parent, String name) {
    File child;
    try {
      child = new File(parent, name).getCanonicalFile();
    } catch (IOException e) {
      LogUtil.w(e, "%s: unable to resolve %s in %s", TAG, name, parent);
      return null;
    }
    if (!child.toPath().startsWith(parent.toPath()) || child.equals(parent)) {
      LogUtil.w("%s: ignoring %s, it is outside of %s", TAG, name, parent);
      return null;
    }
    return child;
  }

  private static int deleteDatabases(File reciterDirectory) {
    File[] databases =
        reciterDirectory.listFiles(
            file -> file.getName().endsWith(".db") || file.getName().endsWith(".zip"));
    int deleted = 0;
    if (databases != null) {
      for (File database : databases) {
        deleted += delete(database);
      }
    }
    return deleted;
  }

  private static int delete(File file) {
    if (file.delete()) {
      return 1;
    }
    LogUtil.w("%s: unable to delete %s", TAG, file);
    return 0;
  }

  // MD5 is what the server publishes.
  @SuppressWarnings("deprecation")
  private static boolean matchesMd5(File file, String expectedMd5) {
    try {
      HashCode hash = Files.asByteSource(file).hash(Hashing.md5());
      return hash.toString().equalsIgnoreCase(expectedMd5);
    } catch (IOException e) {
      LogUtil.w(e, "%s: unable to hash %s", TAG, file);
      return false;
    }
  }
}
