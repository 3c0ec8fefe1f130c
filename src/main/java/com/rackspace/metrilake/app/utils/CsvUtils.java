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

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Writes header-first, newline separated CSV where null cells are left empty and values are
 * only quoted when they contain a separator, quote or line break.
 */
public class CsvUtils {

  private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
      .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
      .build();

  private CsvUtils() {
  }

  public static byte[] write(List<String> header, List<? extends List<String>> rows) {
    // rows are written positionally, so the header goes out as the first row and is present
    // even when there are no data rows
    final CsvSchema schema = CsvSchema.emptySchema()
        .withLineSeparator("\n")
        .withNullValue("");

    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (SequenceWriter writer = CSV_MAPPER.writer(schema).writeValues(out)) {
      writer.write(header);
      for (List<String> row : rows) {
        writer.write(row);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode CSV", e);
    }
    return out.toByteArray();
  }
}
