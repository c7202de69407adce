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
import java.util.Optional;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Conjunction of two or more terms. Nested conjunctions are flattened so that the term list reads in the
 * order the terms were added.
 */
public final class LogicalAnd
        extends Expression {
    private final List<Expression> terms;

    private LogicalAnd(List<Expression> terms) {
        checkArgument(terms.size() >= 2, "conjunction needs at least two terms");
        this.terms = ImmutableList.copyOf(terms);
    }

    /**
     * Returns the conjunction of the given terms, the single term itself, or empty when there is nothing to
     * conjoin.
     */
    public static Optional<Expression> and(List<Expression> terms) {
        ImmutableList.Builder<Expression> flattened = ImmutableList.builder();
        for (Expression term : terms) {
            if (term instanceof LogicalAnd) {
                flattened.addAll(((LogicalAnd) term).getTerms());
            } else {
                flattened.add(term);
            }
        }
        List<Expression> list = flattened.build();
        if (list.isEmpty()) {
            return Optional.empty();
        }
        if (list.size() == 1) {
            return Optional.of(list.get(0));
        }
        return Optional.of(new LogicalAnd(list));
    }

    public static Expression and(Expression first, Expression... rest) {
        return and(ImmutableList.<Expression>builder().add(first).add(rest).build()).get();
    }

    public List<Expression> getTerms() {
        return terms;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitLogicalAnd(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogicalAnd)) {
            return false;
        }
        return terms.equals(((LogicalAnd) o).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return terms.stream().map(Object::toString).collect(Collectors.joining(" AND ", "(", ")"));
    }
}
