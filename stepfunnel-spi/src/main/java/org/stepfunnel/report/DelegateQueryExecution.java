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

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * An execution of a generated query whose result is transformed once the warehouse returns it.
 * The generated query text is kept so that callers can show what was run.
 */
public class DelegateQueryExecution implements QueryExecution {
    private final QueryExecution execution;
    private final String query;
    private final CompletableFuture<QueryResult> result;

    public DelegateQueryExecution(QueryExecution execution, String query, Function<QueryResult, QueryResult> function) {
        this.execution = requireNonNull(execution, "execution is null");
        this.query = requireNonNull(query, "query is null");
        this.result = execution.getResult().thenApply(function);
    }

    public String getQuery() {
        return query;
    }

    @Override
    public QueryStats currentStats() {
        QueryStats stats = execution.currentStats();
        // the transformation may still fail after the warehouse is done
        if (stats.state == QueryStats.State.FINISHED && result.isCompletedExceptionally()) {
            return new QueryStats(stats.percentage, QueryStats.State.FAILED);
        }
        return stats;
    }

    @Override
    public boolean isFinished() {
        return execution.isFinished();
    }

    @Override
    public CompletableFuture<QueryResult> getResult() {
        return result;
    }

    @Override
    public void kill() {
        execution.kill();
    }
}
