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

public final class SelectItem
        extends Node {
    private final Expression expression;
    private final Optional<String> alias;

    public SelectItem(Expression expression, Optional<String> alias) {
        this.expression = requireNonNull(expression, "expression is null");
        this.alias = requireNonNull(alias, "alias is null");
    }

    public static SelectItem item(Expression expression) {
        return new SelectItem(expression, Optional.empty());
    }

    public static SelectItem item(Expression expression, String alias) {
        return new SelectItem(expression, Optional.of(alias));
    }

    public Expression getExpression() {
        return expression;
    }

    public Optional<String> getAlias() {
        return alias;
    }

    /**
     * Name of the output column, the alias or the referenced column name.
     */
    public Optional<String> getOutputName() {
        if (alias.isPresent()) {
            return alias;
        }
        if (expression instanceof ColumnReference) {
            return Optional.of(((ColumnReference) expression).getName());
        }
        return Optional.empty();
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitSelectItem(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SelectItem)) {
            return false;
        }
        SelectItem that = (SelectItem) o;
        return expression.equals(that.expression) && alias.equals(that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }

    @Override
    public String toString() {
        return expression + alias.map(a -> " AS " + a).orElse("");
    }
}
