/*
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
package org.stepfunnel.report;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Client of the warehouse. Implementations submit the query and return immediately, the result is
 * delivered through {@link QueryExecution#getResult()}.
 */
public interface QueryExecutor {
    QueryExecution executeRawQuery(String sqlQuery, Map<String, String> sessionParameters);

    default QueryExecution executeRawQuery(String sqlQuery) {
        return executeRawQuery(sqlQuery, ImmutableMap.of());
    }
}
