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

package com.rackspace.metrilake.app.clients;

import com.rackspace.metrilake.app.model.ExecutionStatus;
import com.rackspace.metrilake.app.model.ResultPage;

/**
 * An asynchronous SQL engine. Submitted queries are validated and executed remotely; callers
 * observe progress by polling.
 */
public interface QueryEngine {

  /**
   * @return the engine's execution id
   */
  String submit(String sql, String database, String outputLocation);

  ExecutionStatus getStatus(String executionId);

  /**
   * @param nextToken null for the first page, otherwise the token of the previous page
   */
  ResultPage getResults(String executionId, String nextToken);
}
