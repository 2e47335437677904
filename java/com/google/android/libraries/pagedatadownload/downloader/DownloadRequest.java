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
package com.google.android.libraries.pagedatadownload.downloader;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import javax.annotation.concurrent.Immutable;

/** Request to download a file. */
@Immutable
@AutoValue
public abstract class DownloadRequest {

  DownloadRequest() {}

  /** The file to download to. */
  public abstract File destinationFile();

  /** The url to download the file from. */
  public abstract String urlToDownload();

  /** The extra HTTP headers for this request. */
  public abstract ImmutableMap<String, String> extraHttpHeaders();

  public static Builder newBuilder() {
    return new AutoValue_DownloadRequest.Builder().setExtraHttpHeaders(ImmutableMap.of());
  }

  /** Builder for {@link DownloadRequest}. */
  @AutoValue.Builder
  public abstract static class Builder {
    Builder() {}

    /** Sets the on-device destination of the file. */
    public abstract Builder setDestinationFile(File destinationFile);

    /** Sets the url from where file content should be downloaded. */
    public abstract Builder setUrlToDownload(String urlToDownload);

    /** Sets the extra HTTP headers for this request. */
    public abstract Builder setExtraHttpHeaders(ImmutableMap<String, String> extraHttpHeaders);

    public abstract DownloadRequest build();
  }
}
