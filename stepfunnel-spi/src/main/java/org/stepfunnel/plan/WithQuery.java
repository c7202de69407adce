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

public final class WithQuery
        extends Node {
    private final String name;
    private final Select query;

    public WithQuery(String name, Select query) {
        this.name = requireNonNull(name, "name is null");
        this.query = requireNonNull(query, "query is null");
    }

    public String getName() {
        return name;
    }

    public Select getQuery() {
        return query;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitWithQuery(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WithQuery)) {
            return false;
        }
        WithQuery that = (WithQuery) o;
        return name.equals(that.name) && query.equals(that.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, query);
    }

    @Override
    public String toString() {
        return name + " AS (" + query + ")";
    }
}
