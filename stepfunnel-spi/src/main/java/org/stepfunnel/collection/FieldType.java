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
package org.stepfunnel.collection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FieldType {
    STRING, LONG, DOUBLE, BOOLEAN, DATE, TIMESTAMP;

    @JsonCreator
    public static FieldType fromString(String key) {
        return key == null ? null : valueOf(key.toUpperCase(Locale.ENGLISH));
    }

    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }

    @JsonValue
    public String value() {
        return name();
    }
}
