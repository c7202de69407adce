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
 * One stage of a left-deep join chain: the rows accumulated so far are joined with {@code right}.
 * Only left outer joins are needed, rows without a match on the right keep null columns for it.
 */
public final class Join
        extends Node {
    public enum Type {
        LEFT
    }

    private final Type type;
    private final Relation right;
    private final Expression criteria;

    public Join(Type type, Relation right, Expression criteria) {
        this.type = requireNonNull(type, "type is null");
        this.right = requireNonNull(right, "right is null");
        this.criteria = requireNonNull(criteria, "criteria is null");
    }

    public static Join leftJoin(Relation right, Expression criteria) {
        return new Join(Type.LEFT, right, criteria);
    }

    public Type getType() {
        return type;
    }

    public Relation getRight() {
        return right;
    }

    public Expression getCriteria() {
        return criteria;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitJoin(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Join)) {
            return false;
        }
        Join that = (Join) o;
        return type == that.type && right.equals(that.right) && criteria.equals(that.criteria);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, right, criteria);
    }

    @Override
    public String toString() {
        return type + " JOIN " + right + " ON " + criteria;
    }
}
