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
import com.fasterxml.jackson.annotation.JsonProperty;
import org.stepfunnel.util.ValidationUtil;

import java.util.Objects;

/**
 * Name and type of one result column.
 */
public class SchemaField {
    private final String name;
    private final FieldType type;

    @JsonCreator
    public SchemaField(@JsonProperty("name") String name,
                       @JsonProperty("type") FieldType type) {
        this.name = ValidationUtil.checkColumn(name, "field name");
        this.type = ValidationUtil.checkNotNull(type, "type");
    }

    @JsonProperty
    public String getName() {
        return name;
    }

    @JsonProperty
    public FieldType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaField)) {
            return false;
        }
        SchemaField that = (SchemaField) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "SchemaField{" +
                "name='" + name + '\'' +
                ", type=" + type +
                '}';
    }
}
