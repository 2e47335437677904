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

import com.google.android.libraries.pagedatadownload.internal.logging.LogUtil;
import com.google.common.io.Files;
import com.google.common.io.Resources;
import java.io.File;
import java.io.IOException;
import java.net.URL;

/** Copies databases bundled as classpath resources into the databases directory. */
public class DatabaseCopier {
  private static final String TAG = "DatabaseCopier";

  private final PageFileUtil pageFileUtil;

  public DatabaseCopier(PageFileUtil pageFileUtil) {
    this.pageFileUtil = pageFileUtil;
  }

  /**
   * Copies the bundled Arabic search database to the databases directory.
   *
   * @param resourceName classpath resource holding the database
   * @return whether the database was copied
   */
  public boolean copyArabicDatabaseFromResources(String resourceName) {
    File databaseDirectory = pageFileUtil.getDatabaseDirectory();
    if (databaseDirectory == null) {
      LogUtil.w("%s: No database directory to copy %s to", TAG, resourceName);
      return false;
    }

    URL resource;
    try {
      resource = Resources.getResource(resourceName);
    } catch (IllegalArgumentException e) {
      LogUtil.w("%s: Bundled database %s not found", TAG, resourceName);
      return false;
    }

    File destination = new File(databaseDirectory, PageFileUtil.ARABIC_SEARCH_DATABASE);
    File tmpFile = new File(databaseDirectory, PageFileUtil.ARABIC_SEARCH_DATABASE + ".tmp");
    try {
      Files.createParentDirs(tmpFile);
      Resources.asByteSource(resource).copyTo(Files.asByteSink(tmpFile));
      Files.move(tmpFile, destination);
      return true;
    } catch (IOException e) {
      LogUtil.e(e, "%s: Failed to copy %s to %s", TAG, resourceName, destination);
      if (tmpFile.exists() && !tmpFile.delete()) {
        LogUtil.w("%s: Unable to delete %s", TAG, tmpFile);
      }
      return false;
    }
  }
}
