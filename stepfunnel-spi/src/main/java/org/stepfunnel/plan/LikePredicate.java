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

public final class LikePredicate
        extends Expression {
    private final Expression value;
    private final Expression pattern;

    public LikePredicate(Expression value, Expression pattern) {
        this.value = requireNonNull(value, "value is null");
        this.pattern = requireNonNull(pattern, "pattern is null");
    }

    public Expression getValue() {
        return value;
    }

    public Expression getPattern() {
        return pattern;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLikePredicate(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LikePredicate)) {
            return false;
        }
        LikePredicate that = (LikePredicate) o;
        return value.equals(that.value) && pattern.equals(that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, pattern);
    }

    @Override
    public String toString() {
        return value + " LIKE " + pattern;
    }
}
