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

import com.google.android.libraries.pagedatadownload.TaskScheduler.NetworkState;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import javax.annotation.concurrent.Immutable;

/** A one-time unit of background work, enqueued through {@link TaskScheduler}. */
@Immutable
@AutoValue
public abstract class WorkRequest {

  WorkRequest() {}

  /** Tag of the worker that performs this request. */
  public abstract String workerTag();

  /** Network state required before the worker is started. */
  public abstract NetworkState networkState();

  /** Input passed to the worker. */
  public abstract ImmutableMap<String, String> inputData();

  public static Builder newBuilder() {
    return new AutoValue_WorkRequest.Builder()
        .setNetworkState(NetworkState.NETWORK_STATE_ANY)
        .setInputData(ImmutableMap.of());
  }

  /** Builder for {@link WorkRequest}. */
  @AutoValue.Builder
  public abstract static class Builder {
    Builder() {}

    public abstract Builder setWorkerTag(String workerTag);

    public abstract Builder setNetworkState(NetworkState networkState);

    public abstract Builder setInputData(ImmutableMap<String, String> inputData);

    public abstract WorkRequest build();
  }
}
