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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.stepfunnel.collection.SchemaField;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tabular result of a warehouse query, or the error the warehouse reported.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResult {
    public static final String EXECUTION_TIME = "executionTimeInMillis";
    public static final String QUERY = "query";

    private final List<SchemaField> metadata;
    private final List<List<Object>> result;
    private final QueryError error;
    private Map<String, Object> properties;

    @JsonCreator
    private QueryResult(
            @JsonProperty("metadata") List<SchemaField> metadata,
            @JsonProperty("result") List<List<Object>> result,
            @JsonProperty("error") QueryError error,
            @JsonProperty("properties") Map<String, Object> properties) {
        this.metadata = metadata;
        this.result = result;
        this.error = error;
        this.properties = properties;
    }

    public QueryResult(List<SchemaField> metadata, List<List<Object>> result) {
        this(metadata, result, null, null);
    }

    public static QueryResult errorResult(QueryError error) {
        return new QueryResult(null, null, error, null);
    }

    public static QueryResult errorResult(QueryError error, String query) {
        return new QueryResult(null, null, error, ImmutableMap.of(QUERY, query));
    }

    public static QueryResult empty() {
        return new QueryResult(ImmutableList.of(), ImmutableList.of());
    }

    @JsonProperty
    public QueryError getError() {
        return error;
    }

    @JsonProperty
    public Map<String, Object> getProperties() {
        return properties == null ? ImmutableMap.of() : properties;
    }

    public synchronized void setProperty(String key, Object value) {
        ConcurrentHashMap<String, Object> map = new ConcurrentHashMap<>();
        if (properties != null) {
            map.putAll(properties);
        }
        map.put(key, value);
        properties = map;
    }

    public boolean isFailed() {
        return error != null;
    }

    /**
     * Each row holds the values of the columns described by {@link #getMetadata()}, in the same order.
     */
    @JsonProperty
    public List<List<Object>> getResult() {
        return result;
    }

    @JsonProperty
    public List<SchemaField> getMetadata() {
        return metadata;
    }

    /**
     * Position of the column with the given name in each row.
     */
    public Optional<Integer> getColumnIndex(String column) {
        if (metadata == null) {
            return Optional.empty();
        }
        for (int i = 0; i < metadata.size(); i++) {
            if (metadata.get(i).getName().equals(column)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "QueryResult{" +
                (error == null ? "" : "error=" + error) +
                ", result=" + (result == null ? "" : Joiner.on(", ").join(result)) +
                ", metadata=" + (metadata == null ? "" : metadata) +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryResult)) {
            return false;
        }
        QueryResult that = (QueryResult) o;
        return Objects.equals(metadata, that.metadata) &&
                Objects.equals(result, that.result) &&
                Objects.equals(error, that.error) &&
                Objects.equals(properties, that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, result, error, properties);
    }
}
