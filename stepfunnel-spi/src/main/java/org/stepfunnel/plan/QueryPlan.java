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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * A funnel query: the base filtered event set, one candidate subset per step and the final aggregate
 * that chains the subsets together.
 *
 * <p>The plan is a value. It is built once per request and rendered by a dialect specific
 * {@link PlanFormatter}.
 */
public final class QueryPlan
        extends Node {
    private final WithQuery base;
    private final List<WithQuery> steps;
    private final Select body;

    public QueryPlan(WithQuery base, List<WithQuery> steps, Select body) {
        this.base = requireNonNull(base, "base is null");
        requireNonNull(steps, "steps is null");
        checkArgument(!steps.isEmpty(), "a plan needs at least one step");
        this.steps = ImmutableList.copyOf(steps);
        this.body = requireNonNull(body, "body is null");
    }

    public WithQuery getBase() {
        return base;
    }

    public List<WithQuery> getSteps() {
        return steps;
    }

    /**
     * All common table expressions in declaration order, the base set first.
     */
    public List<WithQuery> getWithQueries() {
        return ImmutableList.<WithQuery>builder().add(base).addAll(steps).build();
    }

    public Select getBody() {
        return body;
    }

    public List<Join> getJoins() {
        return body.getJoins();
    }

    public List<String> getOutputColumns() {
        return body.getItems().stream()
                .map(SelectItem::getOutputName)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(toImmutableList());
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitQueryPlan(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryPlan)) {
            return false;
        }
        QueryPlan that = (QueryPlan) o;
        return base.equals(that.base) && steps.equals(that.steps) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, steps, body);
    }

    @Override
    public String toString() {
        return "QueryPlan{" +
                "with=" + getWithQueries() +
                ", body=" + body +
                '}';
    }
}
