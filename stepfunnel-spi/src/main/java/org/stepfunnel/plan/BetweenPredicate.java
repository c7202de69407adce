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

/**
 * Inclusive range check, {@code value BETWEEN min AND max}.
 */
public final class BetweenPredicate
        extends Expression {
    private final Expression value;
    private final Expression min;
    private final Expression max;

    public BetweenPredicate(Expression value, Expression min, Expression max) {
        this.value = requireNonNull(value, "value is null");
        this.min = requireNonNull(min, "min is null");
        this.max = requireNonNull(max, "max is null");
    }

    public Expression getValue() {
        return value;
    }

    public Expression getMin() {
        return min;
    }

    public Expression getMax() {
        return max;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitBetweenPredicate(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BetweenPredicate)) {
            return false;
        }
        BetweenPredicate that = (BetweenPredicate) o;
        return value.equals(that.value) && min.equals(that.min) && max.equals(that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, min, max);
    }

    @Override
    public String toString() {
        return value + " BETWEEN " + min + " AND " + max;
    }
}
