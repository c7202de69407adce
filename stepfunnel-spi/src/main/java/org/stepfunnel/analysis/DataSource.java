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
package org.stepfunnel.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.stepfunnel.util.StepFunnelException;

import java.util.Locale;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;

/**
 * Layout of the event table a funnel is computed over.
 */
public enum DataSource {
    STANDARD(SchemaDescriptor.STANDARD),
    GA4(SchemaDescriptor.GA4);

    private final SchemaDescriptor schema;

    DataSource(SchemaDescriptor schema) {
        this.schema = schema;
    }

    @JsonCreator
    public static DataSource get(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ENGLISH));
        } catch (IllegalArgumentException e) {
            throw new StepFunnelException("Unknown data source: " + name + ". Use 'standard' or 'ga4'.", BAD_REQUEST, e);
        }
    }

    public SchemaDescriptor getSchema() {
        return schema;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
