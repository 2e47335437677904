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

/**
 * Maps the screen size to the width buckets that page images are published in.
 *
 * <p>Width parameters have the form {@code "_" + bucket}, for example {@code "_1024"}, and name the
 * {@code width_1024} image directory.
 */
public class ScreenInfo {

  private final int minDimension;
  private final int maxDimension;
  private final boolean dualPageMode;
  private final PageDataSettings settings;

  public ScreenInfo(
      int screenWidth, int screenHeight, boolean dualPageMode, PageDataSettings settings) {
    if (screenWidth <= 0 || screenHeight <= 0) {
      throw new IllegalArgumentException(
          "Screen dimensions must be positive: " + screenWidth + "x" + screenHeight);
    }
    this.minDimension = Math.min(screenWidth, screenHeight);
    this.maxDimension = Math.max(screenWidth, screenHeight);
    this.dualPageMode = dualPageMode;
    this.settings = settings;
  }

  /** Width parameter of the images shown in portrait, one page across the screen. */
  public String getWidthParam() {
    return "_" + getBestWidth(minDimension);
  }

  /**
   * Width parameter of the images shown in dual page mode, two pages across the landscape screen.
   * Equals {@link #getWidthParam()} when dual page mode is off.
   */
  public String getTabletWidthParam() {
    if (!dualPageMode) {
      return getWidthParam();
    }
    return "_" + getBestWidth(maxDimension / 2);
  }

  public boolean isDualPageMode() {
    return dualPageMode;
  }

  private String getBestWidth(int width) {
    if (width <= 320) {
      return "320";
    } else if (width <= 480) {
      return "480";
    } else if (width <= 800) {
      return "800";
    } else if (width <= 1280) {
      return "1024";
    }

    // Anything wider falls back to 1260 unless a complete legacy set was found earlier.
    String override = settings.getDefaultImagesDirectory();
    return override.isEmpty() ? "1260" : override;
  }
}
