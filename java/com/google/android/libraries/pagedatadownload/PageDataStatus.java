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

import com.google.auto.value.AutoValue;
import com.google.common.base.Optional;
import javax.annotation.concurrent.Immutable;

/**
 * The result of checking the page images on device.
 *
 * <p>Widths are width parameters as returned by {@code ScreenInfo}, for example {@code "_1024"}.
 */
@Immutable
@AutoValue
public abstract class PageDataStatus {

  PageDataStatus() {}

  /** Width parameter of the portrait image set. */
  public abstract String portraitWidth();

  /** Width parameter of the landscape (dual page) image set. */
  public abstract String landscapeWidth();

  public abstract boolean havePortrait();

  public abstract boolean haveLandscape();

  /**
   * The width(s) whose images need a patch to reach the latest image version.
   *
   * <p>Holds the portrait width, or the portrait and landscape widths concatenated when the
   * landscape images need patching. Absent when no patch is needed.
   */
  public abstract Optional<String> patchParam();

  public boolean needPortrait() {
    return !havePortrait();
  }

  public boolean needLandscape() {
    return !haveLandscape();
  }

  public boolean havePages() {
    return havePortrait() && haveLandscape();
  }

  /** Returns a copy of this status with the given patch parameter. */
  public PageDataStatus withPatchParam(String patchParam) {
    return toBuilder().setPatchParam(patchParam).build();
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_PageDataStatus.Builder();
  }

  /** Builder for {@link PageDataStatus}. */
  @AutoValue.Builder
  public abstract static class Builder {
    Builder() {}

    public abstract Builder setPortraitWidth(String portraitWidth);

    public abstract Builder setLandscapeWidth(String landscapeWidth);

    public abstract Builder setHavePortrait(boolean havePortrait);

    public abstract Builder setHaveLandscape(boolean haveLandscape);

    public abstract Builder setPatchParam(String patchParam);

    public abstract PageDataStatus build();
  }
}
