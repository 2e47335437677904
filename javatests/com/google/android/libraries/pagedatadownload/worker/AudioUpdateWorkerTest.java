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
package com.google.android.libraries.pagedatadownload.worker;

import static com.google.common.truth.Truth.assertThat;

import com.google.android.libraries.pagedatadownload.PageProvider;
import com.google.android.libraries.pagedatadownload.audio.AudioUpdateService;
import com.google.android.libraries.pagedatadownload.internal.PageDataSettings;
import com.google.android.libraries.pagedatadownload.internal.PageFileUtil;
import com.google.android.libraries.pagedatadownload.internal.PageProviderSelector;
import com.google.android.libraries.pagedatadownload.scheduler.Worker.Result;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import com.google.common.io.Files;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.gson.Gson;
import java.io.File;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AudioUpdateWorkerTest {

  private static final byte[] CURRENT_AUDIO = {1, 2, 3, 4};
  private static final byte[] OUTDATED_AUDIO = {9, 9, 9};

  @Rule public final TemporaryFolder tmpFolder = new TemporaryFolder();

  private MockWebServer server;
  private File storageRoot;
  private File reciter;
  private PageDataSettings settings;
  private AudioUpdateWorker worker;

  @Before
  public void setUp() throws Exception {
    server = new MockWebServer();
    server.start();

    storageRoot = new File(tmpFolder.getRoot(), "quran_android");
    reciter = new File(storageRoot, "audio/minshawi_murattal");
    reciter.mkdirs();
    settings = PageDataSettings.load(new File(tmpFolder.getRoot(), "settings.properties"));
    PageFileUtil pageFileUtil =
        new PageFileUtil(
            storageRoot,
            new PageProviderSelector(ImmutableMap.of(), PageProvider.MADANI, settings));

    AudioUpdateService service =
        new AudioUpdateService(
            new OkHttpClient(),
            new Gson(),
            server.url("/api/audio_updates").toString(),
            MoreExecutors.directExecutor());
    worker =
        new AudioUpdateWorker(service, pageFileUtil, settings, MoreExecutors.directExecutor());
  }

  @After
  public void tearDown() throws Exception {
    server.shutdown();
  }

  @SuppressWarnings("deprecation")
  private static String md5(byte[] content) {
    return Hashing.md5().hashBytes(content).toString();
  }

  @Test
  public void doWork_deletesChangedFiles_andStoresRevision() throws Exception {
    settings.setAudioUpdateRevision(3);
    File current = new File(reciter, "001001.mp3");
    File outdated = new File(reciter, "001002.mp3");
    Files.write(CURRENT_AUDIO, current);
    Files.write(OUTDATED_AUDIO, outdated);
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"current_revision\": 5, \"updates\": [{\"path\": \"minshawi_murattal\","
                    + " \"files\": ["
                    + "{\"filename\": \"001001.mp3\", \"md5\": \""
                    + md5(CURRENT_AUDIO).toUpperCase()
                    + "\"},"
                    + "{\"filename\": \"001002.mp3\", \"md5\": \""
                    + md5(CURRENT_AUDIO)
                    + "\"},"
                    + "{\"filename\": \"001003.mp3\", \"md5\": \"abc\"}"
                    + "]}]}"));

    Result result = worker.doWork(ImmutableMap.of()).get();

    assertThat(result).isEqualTo(Result.SUCCESS);
    assertThat(current.exists()).isTrue();
    assertThat(outdated.exists()).isFalse();
    assertThat(settings.getAudioUpdateRevision()).isEqualTo(5);
    RecordedRequest request = server.takeRequest();
    assertThat(request.getRequestUrl().queryParameter("revision")).isEqualTo("3");
  }

  @Test
  public void doWork_databaseVersion_deletesDatabases() throws Exception {
    File database = new File(reciter, "minshawi_murattal.db");
    File zip = new File(reciter, "minshawi_murattal.zip");
    File audio = new File(reciter, "001001.mp3");
    Files.write(new byte[] {1}, database);
    Files.write(new byte[] {1}, zip);
    Files.write(CURRENT_AUDIO, audio);
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"current_revision\": 2, \"updates\": [{\"path\": \"minshawi_murattal\","
                    + " \"database_version\": 3, \"files\": []}]}"));

    assertThat(worker.doWork(ImmutableMap.of()).get()).isEqualTo(Result.SUCCESS);

    assertThat(database.exists()).isFalse();
    assertThat(zip.exists()).isFalse();
    assertThat(audio.exists()).isTrue();
  }

  @Test
  public void doWork_unknownReciter_isIgnored() throws Exception {
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"current_revision\": 7, \"updates\": [{\"path\": \"husary\","
                    + " \"database_version\": 1, \"files\": [{\"filename\": \"001001.mp3\","
                    + " \"md5\": \"abc\"}]}]}"));

    assertThat(worker.doWork(ImmutableMap.of()).get()).isEqualTo(Result.SUCCESS);
    assertThat(settings.getAudioUpdateRevision()).isEqualTo(7);
  }

  @Test
  public void doWork_pathOutsideAudioDirectory_isIgnored() throws Exception {
    File database = new File(storageRoot, "databases/quran.ar.db");
    Files.createParentDirs(database);
    Files.write(new byte[] {1}, database);
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"current_revision\": 2, \"updates\": ["
                    + "{\"path\": \"../databases\", \"database_version\": 3, \"files\": []},"
                    + "{\"path\": \"minshawi_murattal\", \"files\": [{\"filename\":"
                    + " \"../../databases/quran.ar.db\", \"md5\": \"abc\"}]}]}"));

    assertThat(worker.doWork(ImmutableMap.of()).get()).isEqualTo(Result.SUCCESS);

    assertThat(database.exists()).isTrue();
    assertThat(settings.getAudioUpdateRevision()).isEqualTo(2);
  }

  @Test
  public void doWork_missingRevision_keepsStoredRevision() throws Exception {
    settings.setAudioUpdateRevision(6);
    server.enqueue(new MockResponse().setBody("{\"updates\": []}"));

    assertThat(worker.doWork(ImmutableMap.of()).get()).isEqualTo(Result.SUCCESS);
    assertThat(settings.getAudioUpdateRevision()).isEqualTo(6);
  }

  @Test
  public void doWork_httpError_failsAndKeepsRevision() throws Exception {
    settings.setAudioUpdateRevision(4);
    server.enqueue(new MockResponse().setResponseCode(500));

    assertThat(worker.doWork(ImmutableMap.of()).get()).isEqualTo(Result.FAILURE);
    assertThat(settings.getAudioUpdateRevision()).isEqualTo(4);
  }

  @Test
  public void doWork_malformedResponse_fails() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"current_revision\": [}"));

    assertThat(worker.doWork(ImmutableMap.of()).get()).isEqualTo(Result.FAILURE);
  }
}
