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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

public final class OrderItem {
    public enum Ordering {
        ASCENDING, DESCENDING
    }

    private final Expression expression;
    private final Ordering ordering;

    public OrderItem(Expression expression, Ordering ordering) {
        this.expression = requireNonNull(expression, "expression is null");
        this.ordering = requireNonNull(ordering, "ordering is null");
    }

    public static OrderItem ascending(Expression expression) {
        return new OrderItem(expression, Ordering.ASCENDING);
    }

    public Expression getExpression() {
        return expression;
    }

    public Ordering getOrdering() {
        return ordering;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OrderItem)) {
            return false;
        }
        OrderItem that = (OrderItem) o;
        return expression.equals(that.expression) && ordering == that.ordering;
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, ordering);
    }

    @Override
    public String toString() {
        return expression + " " + ordering;
    }
}
