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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

/**
 * Persistent settings of PDD, stored as a properties file.
 *
 * <p>Every update is written to disk before the setter returns. Failed writes are logged and
 * reported through the return value; the in-memory value is kept either way.
 */
public class PageDataSettings {
  private static final String TAG = "PageDataSettings";

  static final String PAGE_TYPE_KEY = "pageType";
  static final String DEFAULT_IMAGES_DIRECTORY_KEY = "defaultImagesDirectory";
  static final String DID_CHECK_PARTIAL_IMAGES_PREFIX = "didCheckPartialImages.";
  static final String AUDIO_UPDATE_REVISION_KEY = "audioUpdateRevision";

  private final File settingsFile;
  private final Properties properties;

  private PageDataSettings(File settingsFile, Properties properties) {
    this.settingsFile = settingsFile;
    this.properties = properties;
  }

  /** Loads the settings from {@code settingsFile}. A missing file yields empty settings. */
  public static PageDataSettings load(File settingsFile) throws IOException {
    Properties properties = new Properties();
    if (settingsFile.exists()) {
      try (InputStream in = new FileInputStream(settingsFile)) {
        properties.load(in);
      }
    }
    return new PageDataSettings(settingsFile, properties);
  }

  public synchronized String getPageType() {
    return properties.getProperty(PAGE_TYPE_KEY, PageProvider.MADANI_PAGE_TYPE);
  }

  @CanIgnoreReturnValue
  public synchronized boolean setPageType(String pageType) {
    properties.setProperty(PAGE_TYPE_KEY, pageType);
    return commit();
  }

  /**
   * Whether a default images directory was ever stored. An empty value counts as stored; it marks
   * that the legacy fallback check already ran and found nothing.
   */
  public synchronized boolean haveDefaultImagesDirectory() {
    return properties.containsKey(DEFAULT_IMAGES_DIRECTORY_KEY);
  }

  public synchronized String getDefaultImagesDirectory() {
    return properties.getProperty(DEFAULT_IMAGES_DIRECTORY_KEY, "");
  }

  @CanIgnoreReturnValue
  public synchronized boolean setDefaultImagesDirectory(String directory) {
    properties.setProperty(DEFAULT_IMAGES_DIRECTORY_KEY, directory);
    return commit();
  }

  public synchronized boolean didCheckPartialImages(String pageType) {
    return Boolean.parseBoolean(
        properties.getProperty(DID_CHECK_PARTIAL_IMAGES_PREFIX + pageType, "false"));
  }

  @CanIgnoreReturnValue
  public synchronized boolean setCheckedPartialImages(String pageType) {
    properties.setProperty(DID_CHECK_PARTIAL_IMAGES_PREFIX + pageType, "true");
    return commit();
  }

  public synchronized int getAudioUpdateRevision() {
    String value = properties.getProperty(AUDIO_UPDATE_REVISION_KEY);
    if (value == null) {
      return 0;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      LogUtil.w("%s: Ignoring malformed audio update revision %s", TAG, value);
      return 0;
    }
  }

  @CanIgnoreReturnValue
  public synchronized boolean setAudioUpdateRevision(int revision) {
    properties.setProperty(AUDIO_UPDATE_REVISION_KEY, Integer.toString(revision));
    return commit();
  }

  private boolean commit() {
    File parent = settingsFile.getAbsoluteFile().getParentFile();
    try {
      if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
        throw new IOException("Unable to create settings directory " + parent);
      }
      File tmpFile = new File(parent, settingsFile.getName() + ".tmp");
      try (OutputStream out = new FileOutputStream(tmpFile)) {
        properties.store(out, null);
      }
      Files.move(
          tmpFile.toPath(), settingsFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
      return true;
    } catch (IOException e) {
      LogUtil.e(e, "%s: Failed to write settings to %s", TAG, settingsFile);
      return false;
    }
  }
}
