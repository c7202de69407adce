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

import static java.util.Objects.requireNonNull;

/**
 * The warehouse event table, identified by its fully-qualified id.
 */
public final class SourceTable
        extends Relation {
    private final String tableId;

    public SourceTable(String tableId) {
        this.tableId = requireNonNull(tableId, "tableId is null");
    }

    public String getTableId() {
        return tableId;
    }

    @Override
    public String getAlias() {
        return tableId;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitSourceTable(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof SourceTable && tableId.equals(((SourceTable) o).tableId));
    }

    @Override
    public int hashCode() {
        return tableId.hashCode();
    }

    @Override
    public String toString() {
        return tableId;
    }
}
