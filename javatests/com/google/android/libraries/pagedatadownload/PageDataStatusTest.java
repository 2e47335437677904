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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PageDataStatusTest {

  private static PageDataStatus status(boolean havePortrait, boolean haveLandscape) {
    return PageDataStatus.builder()
        .setPortraitWidth("_1024")
        .setLandscapeWidth("_1260")
        .setHavePortrait(havePortrait)
        .setHaveLandscape(haveLandscape)
        .build();
  }

  @Test
  public void havePages_requiresBothSets() {
    assertThat(status(true, true).havePages()).isTrue();
    assertThat(status(true, false).havePages()).isFalse();
    assertThat(status(false, true).havePages()).isFalse();
  }

  @Test
  public void needFlags_areInverseOfHaveFlags() {
    PageDataStatus status = status(false, true);

    assertThat(status.needPortrait()).isTrue();
    assertThat(status.needLandscape()).isFalse();
  }

  @Test
  public void patchParam_absentByDefault() {
    assertThat(status(true, true).patchParam().isPresent()).isFalse();
  }

  @Test
  public void withPatchParam_returnsCopy() {
    PageDataStatus status = status(true, true);

    PageDataStatus patched = status.withPatchParam("_1024_1260");

    assertThat(patched.patchParam().get()).isEqualTo("_1024_1260");
    assertThat(patched.portraitWidth()).isEqualTo("_1024");
    assertThat(patched.landscapeWidth()).isEqualTo("_1260");
    assertThat(status.patchParam().isPresent()).isFalse();
  }
}
