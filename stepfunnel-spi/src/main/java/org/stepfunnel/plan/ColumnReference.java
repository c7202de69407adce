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
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A column of the current relation, optionally qualified by a relation alias. The name is kept opaque and
 * may be a dotted path or any expression text accepted by the warehouse.
 */
public final class ColumnReference
        extends Expression {
    private final Optional<String> relation;
    private final String name;

    public ColumnReference(Optional<String> relation, String name) {
        this.relation = requireNonNull(relation, "relation is null");
        this.name = requireNonNull(name, "name is null");
    }

    public static ColumnReference column(String name) {
        return new ColumnReference(Optional.empty(), name);
    }

    public static ColumnReference column(String relation, String name) {
        return new ColumnReference(Optional.of(relation), name);
    }

    public Optional<String> getRelation() {
        return relation;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitColumnReference(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnReference)) {
            return false;
        }
        ColumnReference that = (ColumnReference) o;
        return relation.equals(that.relation) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(relation, name);
    }

    @Override
    public String toString() {
        return relation.map(r -> r + "." + name).orElse(name);
    }
}
