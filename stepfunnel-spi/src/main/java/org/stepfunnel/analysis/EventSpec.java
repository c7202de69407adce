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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.stepfunnel.util.InvalidEventSpecException;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.lang.String.format;

/**
 * One funnel step: the event name and the parameter filters a matching event row must satisfy.
 *
 * <p>A parameter value is a scalar ({@link String}, {@link Number} or {@link Boolean}) tested for equality,
 * a list of scalars tested for membership, or a string containing {@code %} matched as a pattern.
 */
public final class EventSpec {
    private final String name;
    private final Map<String, Object> params;

    private EventSpec(String name, Map<String, Object> params) {
        this.name = name;
        this.params = params;
    }

    public static EventSpec of(String name) {
        return of(name, ImmutableMap.of());
    }

    public static EventSpec of(String name, Map<String, ?> params) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidEventSpecException("Event name is required");
        }
        if (params == null) {
            return new EventSpec(name, ImmutableMap.of());
        }

        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        for (Map.Entry<String, ?> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getKey().trim().isEmpty()) {
                throw new InvalidEventSpecException(format("Parameter name of event '%s' is empty", name));
            }
            builder.put(entry.getKey(), checkParameterValue(name, entry.getKey(), entry.getValue()));
        }
        return new EventSpec(name, builder.build());
    }

    /**
     * Accepts a bare event name, a map with a {@code name} and optional {@code params} entry, or an
     * already normalized {@link EventSpec}.
     */
    public static EventSpec normalize(Object event) {
        if (event instanceof EventSpec) {
            return (EventSpec) event;
        }
        if (event instanceof String) {
            return of((String) event);
        }
        if (event instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) event;
            Object name = map.get("name");
            if (!(name instanceof String)) {
                throw new InvalidEventSpecException("Event must have a 'name' field of type string: " + event);
            }
            Object params = map.get("params");
            if (params != null && !(params instanceof Map)) {
                throw new InvalidEventSpecException(format("'params' of event '%s' must be an object", name));
            }
            return of((String) name, checkParams((String) name, (Map<?, ?>) params));
        }
        throw new InvalidEventSpecException("Event must be a string or an object with a 'name' field: " + event);
    }

    public static List<EventSpec> normalize(List<?> events) {
        if (events == null) {
            throw new InvalidEventSpecException("Events are required");
        }
        ImmutableList.Builder<EventSpec> builder = ImmutableList.builder();
        for (Object event : events) {
            builder.add(normalize(event));
        }
        return builder.build();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EventSpec fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new InvalidEventSpecException("Event is null");
        }
        if (node.isTextual()) {
            return of(node.textValue());
        }
        if (!node.isObject()) {
            throw new InvalidEventSpecException("Event must be a string or an object with a 'name' field: " + node);
        }

        JsonNode name = node.get("name");
        if (name == null || !name.isTextual()) {
            throw new InvalidEventSpecException("Event must have a 'name' field of type string: " + node);
        }

        JsonNode params = node.get("params");
        if (params == null || params.isNull()) {
            return of(name.textValue());
        }
        if (!params.isObject()) {
            throw new InvalidEventSpecException(format("'params' of event '%s' must be an object", name.textValue()));
        }

        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = params.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.put(field.getKey(), toValue(name.textValue(), field.getKey(), field.getValue()));
        }
        return of(name.textValue(), builder.build());
    }

    @JsonProperty
    public String getName() {
        return name;
    }

    @JsonProperty
    public Map<String, Object> getParams() {
        return params;
    }

    private static Object toValue(String event, String param, JsonNode value) {
        if (value.isArray()) {
            ImmutableList.Builder<Object> builder = ImmutableList.builder();
            for (JsonNode item : value) {
                if (!item.isValueNode() || item.isNull()) {
                    throw new InvalidEventSpecException(format("List value of parameter '%s' of event '%s' may only contain scalars", param, event));
                }
                builder.add(toScalar(item));
            }
            return builder.build();
        }
        if (!value.isValueNode() || value.isNull()) {
            throw new InvalidEventSpecException(format("Parameter '%s' of event '%s' must be a scalar or a list of scalars", param, event));
        }
        return toScalar(value);
    }

    private static Object toScalar(JsonNode value) {
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.asText();
    }

    private static Object checkParameterValue(String event, String param, Object value) {
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            if (list.isEmpty()) {
                throw new InvalidEventSpecException(format("List value of parameter '%s' of event '%s' is empty", param, event));
            }
            for (Object item : list) {
                if (!isScalar(item)) {
                    throw new InvalidEventSpecException(format("List value of parameter '%s' of event '%s' may only contain scalars", param, event));
                }
            }
            return ImmutableList.copyOf(list);
        }
        if (!isScalar(value)) {
            throw new InvalidEventSpecException(format("Parameter '%s' of event '%s' must be a scalar or a list of scalars", param, event));
        }
        return value;
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static Map<String, ?> checkParams(String event, Map<?, ?> params) {
        if (params == null) {
            return null;
        }
        Map<String, Object> checked = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : params.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new InvalidEventSpecException(format("Parameter name of event '%s' must be a string: %s", event, entry.getKey()));
            }
            checked.put((String) entry.getKey(), entry.getValue());
        }
        return checked;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventSpec)) {
            return false;
        }
        EventSpec that = (EventSpec) o;
        return name.equals(that.name) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, params);
    }

    @Override
    public String toString() {
        return "EventSpec{" +
                "name='" + name + '\'' +
                ", params=" + params +
                '}';
    }
}
