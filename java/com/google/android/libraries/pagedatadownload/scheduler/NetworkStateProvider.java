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
package com.google.android.libraries.pagedatadownload.scheduler;

import com.google.android.libraries.pagedatadownload.TaskScheduler.NetworkState;

/** Reports the network state of the device. */
public interface NetworkStateProvider {

  /** Provider for hosts that are always online over an unmetered network. */
  NetworkStateProvider ALWAYS_CONNECTED =
      new NetworkStateProvider() {
        @Override
        public boolean isConnected() {
          return true;
        }

        @Override
        public boolean isUnmetered() {
          return true;
        }
      };

  boolean isConnected();

  boolean isUnmetered();

  /** Returns whether the current network state satisfies {@code required}. */
  default boolean satisfies(NetworkState required) {
    switch (required) {
      case NETWORK_STATE_ANY:
        return true;
      case NETWORK_STATE_CONNECTED:
        return isConnected();
      case NETWORK_STATE_UNMETERED:
        return isConnected() && isUnmetered();
    }
    throw new AssertionError("Unknown network state: " + required);
  }
}
