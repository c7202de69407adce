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

public interface QueryExecution {
    static QueryExecution completedQueryExecution(QueryResult result) {
        return new QueryExecution() {
            @Override
            public QueryStats currentStats() {
                return new QueryStats(100, result.isFailed() ? QueryStats.State.FAILED : QueryStats.State.FINISHED);
            }

            @Override
            public boolean isFinished() {
                return true;
            }

            @Override
            public CompletableFuture<QueryResult> getResult() {
                return CompletableFuture.completedFuture(result);
            }

            @Override
            public void kill() {
                // already finished
            }
        };
    }

    QueryStats currentStats();

    boolean isFinished();

    CompletableFuture<QueryResult> getResult();

    void kill();
}
