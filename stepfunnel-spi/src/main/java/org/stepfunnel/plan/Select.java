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
import static java.util.Objects.requireNonNull;

/**
 * A single SELECT block: projection, one driving relation with an optional chain of joins, filter,
 * grouping and ordering.
 */
public final class Select
        extends Node {
    private final List<SelectItem> items;
    private final Relation from;
    private final List<Join> joins;
    private final Optional<Expression> where;
    private final GroupBy groupBy;
    private final List<OrderItem> orderBy;

    public Select(List<SelectItem> items, Relation from, List<Join> joins, Optional<Expression> where, GroupBy groupBy, List<OrderItem> orderBy) {
        requireNonNull(items, "items is null");
        checkArgument(!items.isEmpty(), "select list is empty");
        this.items = ImmutableList.copyOf(items);
        this.from = requireNonNull(from, "from is null");
        this.joins = ImmutableList.copyOf(requireNonNull(joins, "joins is null"));
        this.where = requireNonNull(where, "where is null");
        this.groupBy = requireNonNull(groupBy, "groupBy is null");
        this.orderBy = ImmutableList.copyOf(requireNonNull(orderBy, "orderBy is null"));
    }

    public static Select select(List<SelectItem> items, Relation from, Optional<Expression> where) {
        return new Select(items, from, ImmutableList.of(), where, GroupBy.none(), ImmutableList.of());
    }

    public List<SelectItem> getItems() {
        return items;
    }

    public Relation getFrom() {
        return from;
    }

    public List<Join> getJoins() {
        return joins;
    }

    public Optional<Expression> getWhere() {
        return where;
    }

    public GroupBy getGroupBy() {
        return groupBy;
    }

    public List<OrderItem> getOrderBy() {
        return orderBy;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitSelect(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Select)) {
            return false;
        }
        Select that = (Select) o;
        return items.equals(that.items) && from.equals(that.from) && joins.equals(that.joins)
                && where.equals(that.where) && groupBy.equals(that.groupBy) && orderBy.equals(that.orderBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items, from, joins, where, groupBy, orderBy);
    }

    @Override
    public String toString() {
        return "Select{" +
                "items=" + items +
                ", from=" + from +
                ", joins=" + joins +
                ", where=" + where +
                ", groupBy=" + groupBy +
                ", orderBy=" + orderBy +
                '}';
    }
}
