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

import javax.annotation.Nullable;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;

public final class ValidationUtil {
    private ValidationUtil()
            throws InstantiationException {
        throw new InstantiationException("The class is not created for instantiation");
    }

    public static <T> T checkNotNull(T value, String name) {
        checkArgument(value != null, name + " is null");
        return value;
    }

    public static void checkArgument(boolean expression, @Nullable String errorMessage) {
        if (!expression) {
            if (errorMessage == null) {
                throw new StepFunnelException(BAD_REQUEST);
            } else {
                throw new StepFunnelException(errorMessage, BAD_REQUEST);
            }
        }
    }

    /**
     * Checks a fully-qualified warehouse table identifier such as {@code project.dataset.table}.
     */
    public static String checkTableId(String tableId) {
        checkArgument(tableId != null, "table id is null");
        checkArgument(!tableId.isEmpty(), "table id is empty string");
        if (tableId.indexOf('`') > -1 || tableId.indexOf(' ') > -1) {
            throw new StepFunnelException("Table id must not contain backticks or spaces: " + tableId, BAD_REQUEST);
        }
        return tableId;
    }

    public static String checkColumn(String column, String type) {
        if (column == null) {
            throw new StepFunnelException(type + " is null", BAD_REQUEST);
        }
        if (column.trim().isEmpty()) {
            throw new StepFunnelException(type + " is empty", BAD_REQUEST);
        }
        return column;
    }
}
