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

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Records submitted queries and answers each of them with the configured result.
 */
public class TestingQueryExecutor
        implements QueryExecutor {
    private final List<String> queries = new ArrayList<>();
    private QueryResult result = QueryResult.empty();

    @Override
    public synchronized QueryExecution executeRawQuery(String sqlQuery, Map<String, String> sessionParameters) {
        queries.add(sqlQuery);
        return QueryExecution.completedQueryExecution(result);
    }

    public synchronized TestingQueryExecutor setResult(QueryResult result) {
        this.result = result;
        return this;
    }

    public synchronized List<String> getQueries() {
        return ImmutableList.copyOf(queries);
    }

    public synchronized void reset() {
        queries.clear();
        result = QueryResult.empty();
    }
}
