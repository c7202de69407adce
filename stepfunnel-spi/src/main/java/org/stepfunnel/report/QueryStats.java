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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class QueryStats {
    public final Integer percentage;
    public final State state;

    @JsonCreator
    public QueryStats(@JsonProperty("percentage") Integer percentage,
                      @JsonProperty("state") State state) {
        this.percentage = percentage;
        this.state = state;
    }

    public QueryStats(State state) {
        this(null, state);
    }

    public enum State {
        /**
         * Query has been accepted by the warehouse and is awaiting execution.
         */
        QUEUED(false),
        RUNNING(false),
        FINISHED(true),
        FAILED(true);

        private final boolean isDone;

        State(boolean isDone) {
            this.isDone = isDone;
        }

        public boolean isDone() {
            return isDone;
        }
    }
}
