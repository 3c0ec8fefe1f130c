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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

/**
 * Either a payload, such as a query preview with the locator of the full result, or an error.
 * Never both.
 */
@Data
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({"data", "csv_url", "error"})
public class ApiResponse {
  Object data;

  @JsonProperty("csv_url")
  String csvUrl;

  ApiError error;

  public static ApiResponse success(Object data, String csvUrl) {
    return new ApiResponse().setData(data).setCsvUrl(csvUrl);
  }

  public static ApiResponse failure(ApiError error) {
    return new ApiResponse().setError(error);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return error == null;
  }
}
