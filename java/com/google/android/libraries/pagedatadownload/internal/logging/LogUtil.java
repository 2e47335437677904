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
package com.google.android.libraries.pagedatadownload.internal.logging;

import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import java.util.Locale;
import java.util.logging.Level;
import javax.annotation.Nullable;

/** Utility class for logging with the "PDD" tag. */
public class LogUtil {
  public static final String TAG = "PDD";

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static boolean isLoggable(Level level) {
    return logger.at(level).isEnabled();
  }

  public static void d(String msg) {
    if (isLoggable(Level.FINE)) {
      logger.atFine().log("%s: %s", TAG, msg);
    }
  }

  @FormatMethod
  public static void d(@FormatString String format, Object obj0) {
    if (isLoggable(Level.FINE)) {
      d(format(format, obj0));
    }
  }

  @FormatMethod
  public static void d(@FormatString String format, Object obj0, Object obj1) {
    if (isLoggable(Level.FINE)) {
      d(format(format, obj0, obj1));
    }
  }

  @FormatMethod
  public static void d(@FormatString String format, Object... params) {
    if (isLoggable(Level.FINE)) {
      d(format(format, params));
    }
  }

  @FormatMethod
  public static void d(@Nullable Throwable tr, @FormatString String format, Object... params) {
    if (isLoggable(Level.FINE)) {
      logger.atFine().withCause(tr).log("%s: %s", TAG, format(format, params));
    }
  }

  public static void w(String msg) {
    if (isLoggable(Level.WARNING)) {
      logger.atWarning().log("%s: %s", TAG, msg);
    }
  }

  @FormatMethod
  public static void w(@FormatString String format, Object obj0) {
    if (isLoggable(Level.WARNING)) {
      w(format(format, obj0));
    }
  }

  @FormatMethod
  public static void w(@FormatString String format, Object... params) {
    if (isLoggable(Level.WARNING)) {
      w(format(format, params));
    }
  }

  @FormatMethod
  public static void w(@Nullable Throwable tr, @FormatString String format, Object... params) {
    if (isLoggable(Level.WARNING)) {
      if (isLoggable(Level.FINE)) {
        logger.atWarning().withCause(tr).log("%s: %s", TAG, format(format, params));
      } else {
        // If not FINE level, only print the throwable type and message.
        logger.atWarning().log("%s: %s: %s", TAG, format(format, params), tr);
      }
    }
  }

  public static void e(String msg) {
    if (isLoggable(Level.SEVERE)) {
      logger.atSevere().log("%s: %s", TAG, msg);
    }
  }

  @FormatMethod
  public static void e(@FormatString String format, Object obj0) {
    if (isLoggable(Level.SEVERE)) {
      e(format(format, obj0));
    }
  }

  @FormatMethod
  public static void e(@FormatString String format, Object... params) {
    if (isLoggable(Level.SEVERE)) {
      e(format(format, params));
    }
  }

  public static void e(@Nullable Throwable tr, String msg) {
    if (isLoggable(Level.SEVERE)) {
      if (isLoggable(Level.FINE)) {
        logger.atSevere().withCause(tr).log("%s: %s", TAG, msg);
      } else {
        // If not FINE level, only print the throwable type and message.
        logger.atSevere().log("%s: %s: %s", TAG, msg, tr);
      }
    }
  }

  @FormatMethod
  public static void e(@Nullable Throwable tr, @FormatString String format, Object... params) {
    if (isLoggable(Level.SEVERE)) {
      e(tr, format(format, params));
    }
  }

  @FormatMethod
  private static String format(@FormatString String format, Object... args) {
    return String.format(Locale.US, format, args);
  }

  private LogUtil() {}
}
