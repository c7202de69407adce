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
 * {@code CASE WHEN condition THEN result END}; evaluates to null when the condition does not hold.
 */
public final class CaseWhen
        extends Expression {
    private final Expression condition;
    private final Expression result;

    public CaseWhen(Expression condition, Expression result) {
        this.condition = requireNonNull(condition, "condition is null");
        this.result = requireNonNull(result, "result is null");
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getResult() {
        return result;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitCaseWhen(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CaseWhen)) {
            return false;
        }
        CaseWhen that = (CaseWhen) o;
        return condition.equals(that.condition) && result.equals(that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, result);
    }

    @Override
    public String toString() {
        return "CASE WHEN " + condition + " THEN " + result + " END";
    }
}
