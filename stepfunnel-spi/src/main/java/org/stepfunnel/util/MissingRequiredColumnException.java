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
package org.stepfunnel.util;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;

/**
 * Raised after execution when the warehouse reports that a grouping or filter column does not exist.
 */
public class MissingRequiredColumnException
        extends StepFunnelException {
    private final String column;

    public MissingRequiredColumnException(String column, String warehouseMessage) {
        super(String.format("Column '%s' does not exist in the event table: %s", column, warehouseMessage), BAD_REQUEST);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
