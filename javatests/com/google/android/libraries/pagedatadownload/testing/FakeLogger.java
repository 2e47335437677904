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
package com.google.android.libraries.pagedatadownload.testing;

import com.google.android.libraries.pagedatadownload.Logger;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** Fake Logger implementation that saves the events sent to it. */
public final class FakeLogger implements Logger {

  private final ImmutableList.Builder<String> eventNames = ImmutableList.builder();
  private final ImmutableList.Builder<ImmutableMap<String, Object>> eventAttributes =
      ImmutableList.builder();

  @Override
  public synchronized void logCustomEvent(
      String eventName, ImmutableMap<String, Object> attributes) {
    eventNames.add(eventName);
    eventAttributes.add(attributes);
  }

  /** Returns the names of all events sent to this logger, in order. */
  public synchronized ImmutableList<String> getEventNames() {
    return eventNames.build();
  }

  /** Returns the attributes of all events sent to this logger, in order. */
  public synchronized ImmutableList<ImmutableMap<String, Object>> getEventAttributes() {
    return eventAttributes.build();
  }
}
