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

package com.rackspace.metrilake.app.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("metrilake")
@Component
@Data
@Validated
public class AppProperties {

  /**
   * The monitored compute instance. Each invocation serves exactly this instance.
   */
  @NotBlank
  String instanceId;

  /**
   * Bucket that holds both the metric partitions and the latest query result. Only used to
   * build storage locators handed back to callers.
   */
  @NotBlank
  String bucket;

  @Valid
  @NotNull
  Storage storage = new Storage();

  @Valid
  @NotNull
  Endpoint monitoring = new Endpoint();

  @Valid
  @NotNull
  Endpoint engine = new Endpoint();

  @Data
  public static class Storage {

    /**
     * Local directory backing the object store.
     */
    @NotNull
    Path root = Paths.get("data");

    /**
     * Scheme of the locators returned to callers, such as <code>s3</code> or <code>file</code>.
     */
    @NotBlank
    String locatorScheme = "s3";
  }

  @Data
  public static class Endpoint {

    @NotBlank
    String baseUrl = "http://localhost:8090";

    @NotNull
    Duration requestTimeout = Duration.ofSeconds(10);
  }
}
