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

/**
 * Responsible for configuring PDD.
 *
 * <p>Clients override only the values they need; every other value keeps its default.
 */
public interface Flags {

  // Downloads
  /** Missing page downloads are only attempted when fewer pages than this are missing. */
  default int missingPageLimit() {
    return 50;
  }

  /** Base url for page images. The page type path and width directory are appended to it. */
  default String imageBaseUrl() {
    return "https://android.quran.com/data/";
  }

  default int downloaderConnectTimeoutSec() {
    return 30;
  }

  default int downloaderReadTimeoutSec() {
    return 60;
  }

  // Audio updates
  default String audioUpdateUrl() {
    return "https://quran.app/api/v1/audio_updates";
  }

  default long audioUpdatePeriodDays() {
    return 7;
  }

  // Background work
  /** Delay before a task whose network constraint was not met is checked again. */
  default long constraintRetryDelayMillis() {
    return 15 * 60 * 1000L;
  }

  // Application
  /** The application flavor. Only the "madani" flavor bundles the Arabic search database. */
  default String appFlavor() {
    return "madani";
  }

  /** Classpath resource holding the bundled Arabic search database. */
  default String bundledArabicDatabaseResource() {
    return "databases/quran.ar.db";
  }
}
