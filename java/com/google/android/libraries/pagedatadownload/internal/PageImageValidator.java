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
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.Arrays;

/**
 * Detects page images that were only partially written.
 *
 * <p>A complete image starts with the PNG signature and ends with the IEND chunk.
 */
public final class PageImageValidator {
  private static final String TAG = "PageImageValidator";

  private static final byte[] PNG_SIGNATURE = {
    (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n'
  };

  // Zero length, "IEND", then the fixed CRC of an empty IEND chunk.
  private static final byte[] PNG_TRAILER = {
    0, 0, 0, 0, 'I', 'E', 'N', 'D', (byte) 0xae, 0x42, 0x60, (byte) 0x82
  };

  /** Returns whether {@code file} holds a complete PNG image. */
  public static boolean isCompleteImage(File file) {
    try (RandomAccessFile image = new RandomAccessFile(file, "r")) {
      long length = image.length();
      if (length < PNG_SIGNATURE.length + PNG_TRAILER.length) {
        return false;
      }

      byte[] signature = new byte[PNG_SIGNATURE.length];
      image.readFully(signature);
      if (!Arrays.equals(signature, PNG_SIGNATURE)) {
        return false;
      }

      byte[] trailer = new byte[PNG_TRAILER.length];
      image.seek(length - PNG_TRAILER.length);
      image.readFully(trailer);
      return Arrays.equals(trailer, PNG_TRAILER);
    } catch (IOException e) {
      LogUtil.d(e, "%s: Unable to read %s", TAG, file);
      return false;
    }
  }

  private PageImageValidator() {}
}
