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

package com.rackspace.metrilake.app.model;

import java.util.Locale;

public enum ColumnType {
  VARCHAR,
  BIGINT,
  DOUBLE,
  BOOLEAN,
  TIMESTAMP,
  DATE;

  /**
   * Maps an engine column type name. Parameterized names such as <code>decimal(10,2)</code>
   * are matched on their base name and anything unrecognized is treated as text.
   */
  public static ColumnType fromEngineType(String typeName) {
    if (typeName == null) {
      return VARCHAR;
    }
    String base = typeName.toLowerCase(Locale.ROOT).trim();
    final int paren = base.indexOf('(');
    if (paren >= 0) {
      base = base.substring(0, paren);
    }
    switch (base) {
      case "tinyint":
      case "smallint":
      case "integer":
      case "int":
      case "bigint":
        return BIGINT;
      case "float":
      case "real":
      case "double":
      case "decimal":
        return DOUBLE;
      case "boolean":
        return BOOLEAN;
      case "timestamp":
        return TIMESTAMP;
      case "date":
        return DATE;
      default:
        return VARCHAR;
    }
  }
}
