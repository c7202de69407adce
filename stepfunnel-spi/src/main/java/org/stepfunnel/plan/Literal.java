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
package org.stepfunnel.plan;

import java.time.LocalDate;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A constant value. Supported value types are {@link String}, {@link Long}, {@link Double}, {@link Boolean}
 * and {@link LocalDate}; other integral and floating point numbers are widened on construction.
 */
public final class Literal
        extends Expression {
    private final Object value;

    private Literal(Object value) {
        this.value = value;
    }

    public static Literal of(Object value) {
        requireNonNull(value, "value is null");
        if (value instanceof String || value instanceof Boolean || value instanceof LocalDate
                || value instanceof Long || value instanceof Double) {
            return new Literal(value);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new Literal(((Number) value).longValue());
        }
        if (value instanceof Float) {
            return new Literal(((Float) value).doubleValue());
        }
        throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
    }

    public Object getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Literal)) {
            return false;
        }
        return value.equals(((Literal) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value instanceof String ? "'" + value + "'" : value.toString();
    }
}
