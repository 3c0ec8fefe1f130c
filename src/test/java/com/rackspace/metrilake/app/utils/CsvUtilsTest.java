/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.metrilake.app.utils;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class CsvUtilsTest {

  @Test
  void writesHeaderFirst() {
    final byte[] csv = CsvUtils.write(List.of("a", "b"), List.of(List.of("1", "2"), Arrays.asList("3", null)));

    assertThat(new String(csv, StandardCharsets.UTF_8)).isEqualTo("a,b\n1,2\n3,\n");
  }

  @Test
  void headerOnlyWithoutRows() {
    assertThat(new String(CsvUtils.write(List.of("a", "b"), List.of()), StandardCharsets.UTF_8))
        .isEqualTo("a,b\n");
  }

  @Test
  void quotesOnlyWhenNeeded() {
    final byte[] csv = CsvUtils.write(List.of("v"), List.of(
        List.of("2024-03-01T00:00:00Z"), List.of("12.500"), List.of("line\nbreak")));

    assertThat(new String(csv, StandardCharsets.UTF_8))
        .isEqualTo("v\n2024-03-01T00:00:00Z\n12.500\n\"line\nbreak\"\n");
  }
}
