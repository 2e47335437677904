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

/**
 * Describes one page type: a set of page images for a particular edition of the mushaf.
 *
 * <p>{@link #MADANI} is the default page type.
 */
@AutoValue
public abstract class PageProvider {

  public static final String MADANI_PAGE_TYPE = "madani";

  /** The legacy madani page set with 604 pages. */
  public static final PageProvider MADANI =
      PageProvider.builder()
          .setPageType(MADANI_PAGE_TYPE)
          .setNumberOfPages(604)
          .setImageVersion(6)
          .setImagesDirectoryName("")
          .setImagesUrlPath("")
          .build();

  PageProvider() {}

  /** The page type setting value that selects this provider. */
  public abstract String pageType();

  public abstract int numberOfPages();

  /** The latest version of the page images; older image sets need a patch. */
  public abstract int imageVersion();

  /**
   * Directory, relative to the storage root, holding the width directories of this page type. An
   * empty name means the storage root itself.
   */
  public abstract String imagesDirectoryName();

  /** Path appended to {@code Flags#imageBaseUrl()} for this page type, empty or ending in "/". */
  public abstract String imagesUrlPath();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_PageProvider.Builder().setImagesDirectoryName("").setImagesUrlPath("");
  }

  /** Builder for {@link PageProvider}. */
  @AutoValue.Builder
  public abstract static class Builder {
    Builder() {}

    public abstract Builder setPageType(String pageType);

    public abstract Builder setNumberOfPages(int numberOfPages);

    public abstract Builder setImageVersion(int imageVersion);

    public abstract Builder setImagesDirectoryName(String imagesDirectoryName);

    public abstract Builder setImagesUrlPath(String imagesUrlPath);

    abstract PageProvider autoBuild();

    public final PageProvider build() {
      PageProvider provider = autoBuild();
      if (provider.numberOfPages() <= 0) {
        throw new IllegalArgumentException(
            "numberOfPages must be positive: " + provider.numberOfPages());
      }
      return provider;
    }
  }
}
