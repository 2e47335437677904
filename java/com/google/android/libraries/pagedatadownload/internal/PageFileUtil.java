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

import com.google.android.libraries.pagedatadownload.PageProvider;
import com.google.android.libraries.pagedatadownload.internal.logging.LogUtil;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import java.io.File;
import java.util.Locale;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/** Utils to locate page images, databases and audio files in the storage root. */
public class PageFileUtil {

  private static final String TAG = "PageFileUtil";

  public static final String IMAGES_DIRECTORY_PREFIX = "width";
  public static final String DATABASE_DIRECTORY = "databases";
  public static final String AUDIO_DIRECTORY = "audio";
  public static final String ARABIC_SEARCH_DATABASE = "quran.ar.db";

  /** The legacy madani bucket that is used when a complete set of it is already on device. */
  @VisibleForTesting static final String LEGACY_FALLBACK_WIDTH = "1920";

  private static final Pattern PAGE_FILE_NAME = Pattern.compile("page\\d{3}\\.png");

  private final File storageRoot;
  private final PageProviderSelector pageProviderSelector;

  public PageFileUtil(File storageRoot, PageProviderSelector pageProviderSelector) {
    this.storageRoot = storageRoot;
    this.pageProviderSelector = pageProviderSelector;
  }

  /** Returns the file name of the image of {@code page}, for example {@code page001.png}. */
  public static String getPageFileName(int page) {
    return "page" + String.format(Locale.US, "%03d", page) + ".png";
  }

  /**
   * Returns the storage root, creating it if needed, or null if it is not a writable directory.
   */
  @Nullable
  public File getBaseDirectory() {
    if (!storageRoot.isDirectory() && !storageRoot.mkdirs()) {
      LogUtil.w("%s: Unable to create storage root %s", TAG, storageRoot);
      return null;
    }
    return storageRoot.canWrite() ? storageRoot : null;
  }

  /** Returns the directory holding the width directories of the current page type. */
  @Nullable
  public File getImagesBaseDirectory() {
    return getImagesBaseDirectory(pageProviderSelector.getPageProvider());
  }

  /** Returns the directory holding the width directories of {@code pageType}. */
  @Nullable
  public File getImagesBaseDirectory(String pageType) {
    return getImagesBaseDirectory(pageProviderSelector.getPageProvider(pageType));
  }

  @Nullable
  private File getImagesBaseDirectory(PageProvider pageProvider) {
    File base = getBaseDirectory();
    if (base == null) {
      return null;
    }
    String name = pageProvider.imagesDirectoryName();
    return name.isEmpty() ? base : new File(base, name);
  }

  /** Returns the directory of the images with width parameter {@code widthParam}. */
  @Nullable
  public File getImagesDirectory(String widthParam) {
    File imagesBase = getImagesBaseDirectory();
    return imagesBase == null ? null : new File(imagesBase, IMAGES_DIRECTORY_PREFIX + widthParam);
  }

  @Nullable
  public File getDatabaseDirectory() {
    File base = getBaseDirectory();
    return base == null ? null : new File(base, DATABASE_DIRECTORY);
  }

  @Nullable
  public File getAudioDirectory() {
    File base = getBaseDirectory();
    return base == null ? null : new File(base, AUDIO_DIRECTORY);
  }

  /**
   * Returns whether all {@code totalPages} images of the width exist.
   *
   * <p>This counts the page images in the directory rather than opening each of them. Hidden files,
   * such as the version marker, are not counted.
   *
   * @param makeDirectory create the width directory when it is missing
   */
  public boolean haveAllImages(String widthParam, int totalPages, boolean makeDirectory) {
    File directory = getImagesDirectory(widthParam);
    if (directory == null) {
      return false;
    }

    if (directory.isDirectory()) {
      String[] fileList = directory.list();
      if (fileList == null) {
        LogUtil.w("%s: Unable to list %s", TAG, directory);
        return false;
      }
      // Only complete page images count. Version markers and partial downloads do not.
      int files = 0;
      for (String fileName : fileList) {
        if (PAGE_FILE_NAME.matcher(fileName).matches()) {
          files++;
        }
      }
      return files >= totalPages;
    } else if (makeDirectory && !directory.mkdirs()) {
      LogUtil.w("%s: Unable to create %s", TAG, directory);
    }
    return false;
  }

  /**
   * Returns the legacy width bucket to use instead of the default one, if a complete set of it is
   * already on device.
   */
  public Optional<String> getPotentialFallbackDirectory(int totalPages) {
    if (haveAllImages("_" + LEGACY_FALLBACK_WIDTH, totalPages, false)) {
      return Optional.of(LEGACY_FALLBACK_WIDTH);
    }
    return Optional.absent();
  }

  /** Returns whether the images of the width are at {@code version}. */
  public boolean isVersion(String widthParam, int version) {
    File directory = getImagesDirectory(widthParam);
    return directory != null && new File(directory, ".v" + version).exists();
  }

  public boolean hasArabicSearchDatabase() {
    File databaseDirectory = getDatabaseDirectory();
    return databaseDirectory != null
        && new File(databaseDirectory, ARABIC_SEARCH_DATABASE).exists();
  }

  /** Returns the url to download the page image {@code pageFileName} of the width from. */
  public String getImageUrl(String imageBaseUrl, String widthParam, String pageFileName) {
    PageProvider provider = pageProviderSelector.getPageProvider();
    return imageBaseUrl
        + provider.imagesUrlPath()
        + IMAGES_DIRECTORY_PREFIX
        + widthParam
        + "/"
        + pageFileName;
  }
}
