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
import com.google.common.collect.ImmutableMap;

/** Returns the {@link PageProvider} for the page type currently selected in the settings. */
public class PageProviderSelector {
  private static final String TAG = "PageProviderSelector";

  private final ImmutableMap<String, PageProvider> pageProviders;
  private final PageProvider defaultPageProvider;
  private final PageDataSettings settings;

  public PageProviderSelector(
      ImmutableMap<String, PageProvider> pageProviders,
      PageProvider defaultPageProvider,
      PageDataSettings settings) {
    this.pageProviders = pageProviders;
    this.defaultPageProvider = defaultPageProvider;
    this.settings = settings;
  }

  public PageProvider getPageProvider() {
    return getPageProvider(settings.getPageType());
  }

  public PageProvider getPageProvider(String pageType) {
    PageProvider provider = pageProviders.get(pageType);
    if (provider == null) {
      LogUtil.w(
          "%s: Unknown page type %s, using %s", TAG, pageType, defaultPageProvider.pageType());
      return defaultPageProvider;
    }
    return provider;
  }
}
