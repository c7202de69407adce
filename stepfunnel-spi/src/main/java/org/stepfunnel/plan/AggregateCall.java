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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public final class AggregateCall
        extends Expression {
    public enum Aggregate {
        COUNT,
        ANY_VALUE
    }

    private final Aggregate aggregate;
    private final Expression argument;
    private final boolean distinct;

    public AggregateCall(Aggregate aggregate, Expression argument, boolean distinct) {
        this.aggregate = requireNonNull(aggregate, "aggregate is null");
        this.argument = requireNonNull(argument, "argument is null");
        checkArgument(!distinct || aggregate == Aggregate.COUNT, "DISTINCT is only supported for COUNT");
        this.distinct = distinct;
    }

    public static AggregateCall countDistinct(Expression argument) {
        return new AggregateCall(Aggregate.COUNT, argument, true);
    }

    public static AggregateCall anyValue(Expression argument) {
        return new AggregateCall(Aggregate.ANY_VALUE, argument, false);
    }

    public Aggregate getAggregate() {
        return aggregate;
    }

    public Expression getArgument() {
        return argument;
    }

    public boolean isDistinct() {
        return distinct;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitAggregateCall(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregateCall)) {
            return false;
        }
        AggregateCall that = (AggregateCall) o;
        return aggregate == that.aggregate && distinct == that.distinct && argument.equals(that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregate, argument, distinct);
    }

    @Override
    public String toString() {
        return aggregate.name() + "(" + (distinct ? "DISTINCT " : "") + argument + ")";
    }
}
