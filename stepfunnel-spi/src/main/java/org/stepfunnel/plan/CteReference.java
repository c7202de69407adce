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

public final class CteReference
        extends Relation {
    private final String name;

    public CteReference(String name) {
        this.name = requireNonNull(name, "name is null");
    }

    public String getName() {
        return name;
    }

    @Override
    public String getAlias() {
        return name;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitCteReference(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof CteReference && name.equals(((CteReference) o).name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
