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
package com.google.android.libraries.pagedatadownload.internal;

import java.io.File;

/** Builds a short report of the image and audio directories, used when pages are missing. */
public class DebugLogGenerator {

  private final PageFileUtil pageFileUtil;

  public DebugLogGenerator(PageFileUtil pageFileUtil) {
    this.pageFileUtil = pageFileUtil;
  }

  public String generateDebugLog() {
    if (pageFileUtil.getBaseDirectory() == null) {
      return "can't find quranBaseDirectory";
    }

    StringBuilder log = new StringBuilder();
    File imagesDirectory = pageFileUtil.getImagesBaseDirectory();
    File[] imagesDirectoryFiles = imagesDirectory == null ? null : imagesDirectory.listFiles();
    if (imagesDirectoryFiles != null) {
      for (File directory : imagesDirectoryFiles) {
        if (!directory.getName().contains(PageFileUtil.IMAGES_DIRECTORY_PREFIX + "_")) {
          continue;
        }
        log.append("image directory: ").append(directory.getName()).append(" - ");
        File[] imageFiles = directory.listFiles();
        if (imageFiles != null) {
          log.append(imageFiles.length);
          if (imageFiles.length == 1) {
            log.append(" [").append(imageFiles[0].getName()).append("]");
          }
        }
        log.append("\n");

        if (imageFiles == null) {
          log.append("null image file list, ")
              .append(directory)
              .append(" - ")
              .append(directory.isDirectory());
        }
      }
    } else {
      log.append("null list of files in images directory: ")
          .append(imagesDirectory)
          .append(" - ")
          .append(imagesDirectory != null && imagesDirectory.isDirectory());
    }

    File audioDirectory = pageFileUtil.getAudioDirectory();
    if (audioDirectory != null) {
      File[] audioFiles = audioDirectory.listFiles();
      log.append("audio files in audio root: ")
          .append(audioFiles == null ? "null" : String.valueOf(audioFiles.length));
    } else {
      log.append("audio directory is null");
    }
    return log.toString();
  }
}
