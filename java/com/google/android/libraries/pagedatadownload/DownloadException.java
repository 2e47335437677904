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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Thrown when there is a download failure. */
public final class DownloadException extends Exception {
  private final DownloadResultCode downloadResultCode;

  /** The reason a download failed. */
  public enum DownloadResultCode {
    // Errors from the http stack.
    HTTP_ERROR(103),
    NETWORK_IO_ERROR(107),
    DISK_IO_ERROR(108),

    // Errors from download preparation.
    UNABLE_TO_CREATE_DIRECTORY_ERROR(304),
    MALFORMED_DOWNLOAD_URL(325),

    // Errors from the audio update manifest.
    AUDIO_UPDATE_PARSE_ERROR(400);

    private final int code;

    DownloadResultCode(int code) {
      this.code = code;
    }

    /** Returns the int code corresponding to this enum value. */
    public int getCode() {
      return code;
    }
  }

  /** Builder for {@link DownloadException}. */
  public static final class Builder {
    private DownloadResultCode downloadResultCode;
    private String message;
    private Throwable cause;

    /** Sets the {@link DownloadResultCode}. */
    @CanIgnoreReturnValue
    public Builder setDownloadResultCode(DownloadResultCode downloadResultCode) {
      this.downloadResultCode = downloadResultCode;
      return this;
    }

    /** Sets the error message. */
    @CanIgnoreReturnValue
    public Builder setMessage(String message) {
      this.message = message;
      return this;
    }

    /** Sets the cause of the exception. */
    @CanIgnoreReturnValue
    public Builder setCause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    /** Returns a {@link DownloadException} instance. */
    public DownloadException build() {
      Preconditions.checkNotNull(downloadResultCode);
      if (message == null) {
        message = "Download result code: " + downloadResultCode.name();
      }
      return new DownloadException(this);
    }
  }

  /** Returns a Builder for {@link DownloadException}. */
  public static Builder builder() {
    return new Builder();
  }

  public DownloadResultCode getDownloadResultCode() {
    return downloadResultCode;
  }

  private DownloadException(Builder builder) {
    super(builder.message, builder.cause);
    this.downloadResultCode = builder.downloadResultCode;
  }
}
