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
import org.testng.annotations.Test;

import java.util.Optional;

import static org.stepfunnel.plan.ColumnReference.column;
import static org.testng.Assert.assertEquals;

public class TestLogicalAnd {
    private static final Expression A = ComparisonExpression.equal(column("a"), Literal.of(1));
    private static final Expression B = ComparisonExpression.equal(column("b"), Literal.of(2));
    private static final Expression C = ComparisonExpression.equal(column("c"), Literal.of(3));

    @Test
    public void testEmpty() {
        assertEquals(LogicalAnd.and(ImmutableList.of()), Optional.empty());
    }

    @Test
    public void testSingleTerm() {
        assertEquals(LogicalAnd.and(ImmutableList.of(A)), Optional.of(A));
        assertEquals(LogicalAnd.and(A), A);
    }

    @Test
    public void testNestedConjunctionsAreFlattened() {
        Expression expression = LogicalAnd.and(LogicalAnd.and(A, B), C);
        assertEquals(((LogicalAnd) expression).getTerms(), ImmutableList.of(A, B, C));
    }
}
