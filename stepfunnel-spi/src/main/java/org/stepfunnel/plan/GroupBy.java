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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Grouping of an aggregate query. {@link Kind#ALL} groups by every non-aggregated select item, which some
 * warehouses require even when that set is empty.
 */
public final class GroupBy {
    public enum Kind {
        NONE, ALL, EXPRESSIONS
    }

    private static final GroupBy NONE = new GroupBy(Kind.NONE, ImmutableList.of());
    private static final GroupBy ALL = new GroupBy(Kind.ALL, ImmutableList.of());

    private final Kind kind;
    private final List<Expression> expressions;

    private GroupBy(Kind kind, List<Expression> expressions) {
        this.kind = kind;
        this.expressions = ImmutableList.copyOf(expressions);
    }

    public static GroupBy none() {
        return NONE;
    }

    public static GroupBy all() {
        return ALL;
    }

    public static GroupBy of(List<? extends Expression> expressions) {
        checkArgument(!expressions.isEmpty(), "grouping expressions are empty");
        return new GroupBy(Kind.EXPRESSIONS, ImmutableList.copyOf(expressions));
    }

    public Kind getKind() {
        return kind;
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupBy)) {
            return false;
        }
        GroupBy that = (GroupBy) o;
        return kind == that.kind && expressions.equals(that.expressions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, expressions);
    }

    @Override
    public String toString() {
        return kind == Kind.EXPRESSIONS ? expressions.toString() : kind.name();
    }
}
