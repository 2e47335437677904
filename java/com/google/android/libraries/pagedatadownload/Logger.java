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

import com.google.common.collect.ImmutableMap;

/**
 * Interface for an analytics sink.
 *
 * <p>PDD reports custom events (for example the outcome of a missing page download run) through
 * this interface. Attribute values are either {@link Number}s or {@link String}s.
 */
public interface Logger {

  /** Logs the custom event {@code eventName} with its attributes. */
  void logCustomEvent(String eventName, ImmutableMap<String, Object> attributes);
}
