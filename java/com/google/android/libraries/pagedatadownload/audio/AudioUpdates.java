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

import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.SerializedName;
import java.util.List;
import javax.annotation.Nullable;

/** Audio files that changed on the server since a given revision. */
public final class AudioUpdates {

  @Nullable
  @SerializedName("current_revision")
  private Integer currentRevision;

  @Nullable
  @SerializedName("updates")
  private List<AudioSetUpdate> updates;

  /** The revision to request next time, or null if the server did not send one. */
  @Nullable
  public Integer getCurrentRevision() {
    return currentRevision;
  }

  public ImmutableList<AudioSetUpdate> getUpdates() {
    return updates == null ? ImmutableList.of() : ImmutableList.copyOf(updates);
  }

  /** Changes to the audio of one reciter. */
  public static final class AudioSetUpdate {

    /** Directory of the reciter, relative to the audio root. */
    @Nullable
    @SerializedName("path")
    private String path;

    /** Version of the timing database, if the database changed. */
    @Nullable
    @SerializedName("database_version")
    private Integer databaseVersion;

    @Nullable
    @SerializedName("files")
    private List<AudioFileUpdate> files;

    @Nullable
    public String getPath() {
      return path;
    }

    @Nullable
    public Integer getDatabaseVersion() {
      return databaseVersion;
    }

    public ImmutableList<AudioFileUpdate> getFiles() {
      return files == null ? ImmutableList.of() : ImmutableList.copyOf(files);
    }
  }

  /** The current checksum of one audio file. */
  public static final class AudioFileUpdate {

    @Nullable
    @SerializedName("filename")
    private String filename;

    @Nullable
    @SerializedName("md5")
    private String md5;

    @Nullable
    public String getFilename() {
      return filename;
    }

    @Nullable
    public String getMd5() {
      return md5;
    }
  }
}
