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
package com.google.android.libraries.pagedatadownload.audio;

import com.google.android.libraries.pagedatadownload.DownloadException;
import com.google.android.libraries.pagedatadownload.DownloadException.DownloadResultCode;
import com.google.android.libraries.pagedatadownload.internal.logging.LogUtil;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.util.concurrent.Executor;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Fetches the list of audio updates from the server. */
public final class AudioUpdateService {
  private static final String TAG = "AudioUpdateService";

  static final String REVISION_PARAMETER = "revision";

  private final OkHttpClient httpClient;
  private final Gson gson;
  private final String audioUpdateUrl;
  private final Executor downloadExecutor;

  public AudioUpdateService(
      OkHttpClient httpClient, Gson gson, String audioUpdateUrl, Executor downloadExecutor) {
    this.httpClient = httpClient;
    this.gson = gson;
    this.audioUpdateUrl = audioUpdateUrl;
    this.downloadExecutor = downloadExecutor;
  }

  /**
   * Returns the updates since {@code revision}. The future fails with {@link DownloadException} if
   * the updates could not be fetched or parsed.
   */
  public ListenableFuture<AudioUpdates> getUpdates(int revision) {
    return Futures.submit(() -> fetchUpdates(revision), downloadExecutor);
  }

  private AudioUpdates fetchUpdates(int revision) throws DownloadException {
    HttpUrl baseUrl = HttpUrl.parse(audioUpdateUrl);
    if (baseUrl == null) {
      throw DownloadException.builder()
          .setDownloadResultCode(DownloadResultCode.MALFORMED_DOWNLOAD_URL)
          .setMessage("Malformed audio update url: " + audioUpdateUrl)
          .build();
    }
    HttpUrl url =
        baseUrl
            .newBuilder()
            .addQueryParameter(REVISION_PARAMETER, Integer.toString(revision))
            .build();

    LogUtil.d("%s: fetching %s", TAG, url);
    Request request = new Request.Builder().url(url).build();
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw DownloadException.builder()
            .setDownloadResultCode(DownloadResultCode.HTTP_ERROR)
            .setMessage("HTTP " + response.code() + " for " + url)
            .build();
      }

      AudioUpdates updates = gson.fromJson(body.charStream(), AudioUpdates.class);
      if (updates == null) {
        throw DownloadException.builder()
            .setDownloadResultCode(DownloadResultCode.AUDIO_UPDATE_PARSE_ERROR)
            .setMessage("Empty audio update response")
            .build();
      }
      return updates;
    } catch (IOException e) {
      throw DownloadException.builder()
          .setDownloadResultCode(DownloadResultCode.NETWORK_IO_ERROR)
          .setMessage("Request to " + url + " failed")
          .setCause(e)
          .build();
    } catch (JsonParseException e) {
      throw DownloadException.builder()
          .setDownloadResultCode(DownloadResultCode.AUDIO_UPDATE_PARSE_ERROR)
          .setMessage("Malformed audio update response")
          .setCause(e)
          .build();
    }
  }
}
