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
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public final class InListExpression
        extends Expression {
    private final Expression value;
    private final List<Expression> valueList;

    public InListExpression(Expression value, List<? extends Expression> valueList) {
        this.value = requireNonNull(value, "value is null");
        requireNonNull(valueList, "valueList is null");
        checkArgument(!valueList.isEmpty(), "valueList is empty");
        this.valueList = ImmutableList.copyOf(valueList);
    }

    public Expression getValue() {
        return value;
    }

    public List<Expression> getValueList() {
        return valueList;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitInListExpression(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InListExpression)) {
            return false;
        }
        InListExpression that = (InListExpression) o;
        return value.equals(that.value) && valueList.equals(that.valueList);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, valueList);
    }

    @Override
    public String toString() {
        return value + " IN " + valueList.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
