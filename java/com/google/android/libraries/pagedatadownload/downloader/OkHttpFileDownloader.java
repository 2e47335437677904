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

import com.google.android.libraries.pagedatadownload.DownloadException;
import com.google.android.libraries.pagedatadownload.DownloadException.DownloadResultCode;
import com.google.android.libraries.pagedatadownload.internal.logging.LogUtil;
import com.google.common.io.ByteStreams;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.Executor;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** {@link FileDownloader} that fetches files with a shared {@link OkHttpClient}. */
public final class OkHttpFileDownloader implements FileDownloader {
  private static final String TAG = "OkHttpFileDownloader";

  private static final String PARTIAL_FILE_SUFFIX = ".part";

  private final OkHttpClient httpClient;
  private final Executor downloadExecutor;

  public OkHttpFileDownloader(OkHttpClient httpClient, Executor downloadExecutor) {
    this.httpClient = httpClient;
    this.downloadExecutor = downloadExecutor;
  }

  @Override
  public ListenableFuture<Void> startDownloading(DownloadRequest downloadRequest) {
    return Futures.submit(
        () -> {
          download(downloadRequest);
          return null;
        },
        downloadExecutor);
  }

  private void download(DownloadRequest downloadRequest) throws DownloadException {
    HttpUrl url = HttpUrl.parse(downloadRequest.urlToDownload());
    if (url == null) {
      throw DownloadException.builder()
          .setDownloadResultCode(DownloadResultCode.MALFORMED_DOWNLOAD_URL)
          .setMessage("Malformed url: " + downloadRequest.urlToDownload())
          .build();
    }

    File destination = downloadRequest.destinationFile();
    File directory = destination.getAbsoluteFile().getParentFile();
    if (!directory.isDirectory() && !directory.mkdirs()) {
      throw DownloadException.builder()
          .setDownloadResultCode(DownloadResultCode.UNABLE_TO_CREATE_DIRECTORY_ERROR)
          .setMessage("Unable to create " + directory)
          .build();
    }

    Request.Builder requestBuilder = new Request.Builder().url(url);
    for (Map.Entry<String, String> header : downloadRequest.extraHttpHeaders().entrySet()) {
      requestBuilder.addHeader(header.getKey(), header.getValue());
    }

    LogUtil.d("%s: Downloading %s to %s", TAG, url, destination);
    Response response;
    try {
      response = httpClient.newCall(requestBuilder.build()).execute();
    } catch (IOException e) {
      throw DownloadException.builder()
          .setDownloadResultCode(DownloadResultCode.NETWORK_IO_ERROR)
          .setMessage("Request to " + url + " failed")
          .setCause(e)
          .build();
    }

    try (Response closeableResponse = response) {
      ResponseBody body = closeableResponse.body();
      if (!closeableResponse.isSuccessful() || body == null) {
        throw DownloadException.builder()
            .setDownloadResultCode(DownloadResultCode.HTTP_ERROR)
            .setMessage("HTTP " + closeableResponse.code() + " for " + url)
            .build();
      }
      writeBody(body, destination, directory);
    }
  }

  private static void writeBody(ResponseBody body, File destination, File directory)
      throws DownloadException {
    File partialFile = new File(directory, "." + destination.getName() + PARTIAL_FILE_SUFFIX);
    OutputStream out;
    try {
      out = new FileOutputStream(partialFile);
    } catch (IOException e) {
      throw diskError(partialFile, e);
    }

    try (InputStream in = body.byteStream();
        OutputStream closeableOut = out) {
      ByteStreams.copy(in, closeableOut);
    } catch (IOException e) {
      deleteQuietly(partialFile);
      throw DownloadException.builder()
          .setDownloadResultCode(DownloadResultCode.NETWORK_IO_ERROR)
          .setMessage("Failed reading response body for " + destination.getName())
          .setCause(e)
          .build();
    }

    try {
      Files.move(
          partialFile.toPath(), destination.toPath(), StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      deleteQuietly(partialFile);
      throw diskError(destination, e);
    }
  }

  private static DownloadException diskError(File file, IOException cause) {
    return DownloadException.builder()
        .setDownloadResultCode(DownloadResultCode.DISK_IO_ERROR)
        .setMessage("Unable to write " + file)
        .setCause(cause)
        .build();
  }

  private static void deleteQuietly(File file) {
    if (file.exists() && !file.delete()) {
      LogUtil.w("%s: Unable to delete %s", TAG, file);
    }
  }
}
