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
package org.stepfunnel.bigquery;

import com.google.common.base.Joiner;
import org.stepfunnel.plan.AggregateCall;
import org.stepfunnel.plan.AllColumns;
import org.stepfunnel.plan.BetweenPredicate;
import org.stepfunnel.plan.CaseWhen;
import org.stepfunnel.plan.ColumnReference;
import org.stepfunnel.plan.ComparisonExpression;
import org.stepfunnel.plan.Expression;
import org.stepfunnel.plan.FunctionCall;
import org.stepfunnel.plan.InListExpression;
import org.stepfunnel.plan.IsNotNullPredicate;
import org.stepfunnel.plan.LikePredicate;
import org.stepfunnel.plan.Literal;
import org.stepfunnel.plan.LogicalAnd;
import org.stepfunnel.plan.PlanVisitor;

import java.time.LocalDate;
import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.lang.String.format;

/**
 * Renders plan expressions in BigQuery Standard SQL. Column names are written as they are given.
 */
public final class BigQueryExpressionFormatter {
    private BigQueryExpressionFormatter() {
    }

    public static String formatExpression(Expression expression) {
        return new Formatter().process(expression, null);
    }

    /**
     * Quotes a string literal, escaping backslashes and single quotes.
     */
    public static String formatStringLiteral(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private static class Formatter
            extends PlanVisitor<String, Void> {
        @Override
        protected String visitColumnReference(ColumnReference node, Void context) {
            return node.getRelation().map(relation -> relation + "." + node.getName()).orElse(node.getName());
        }

        @Override
        protected String visitAllColumns(AllColumns node, Void context) {
            return "*";
        }

        @Override
        protected String visitLiteral(Literal node, Void context) {
            Object value = node.getValue();
            if (value instanceof String) {
                return formatStringLiteral((String) value);
            }
            if (value instanceof LocalDate) {
                return formatStringLiteral(value.toString());
            }
            if (value instanceof Boolean) {
                return ((Boolean) value) ? "TRUE" : "FALSE";
            }
            return value.toString();
        }

        @Override
        protected String visitComparisonExpression(ComparisonExpression node, Void context) {
            return process(node.getLeft(), context) + " " + node.getOperator().getValue() + " " + process(node.getRight(), context);
        }

        @Override
        protected String visitLogicalAnd(LogicalAnd node, Void context) {
            return Joiner.on(" AND ").join(formatAll(node.getTerms()));
        }

        @Override
        protected String visitInListExpression(InListExpression node, Void context) {
            return process(node.getValue(), context) + " IN (" + Joiner.on(", ").join(formatAll(node.getValueList())) + ")";
        }

        @Override
        protected String visitLikePredicate(LikePredicate node, Void context) {
            return process(node.getValue(), context) + " LIKE " + process(node.getPattern(), context);
        }

        @Override
        protected String visitBetweenPredicate(BetweenPredicate node, Void context) {
            return format("%s BETWEEN %s AND %s",
                    process(node.getValue(), context), process(node.getMin(), context), process(node.getMax(), context));
        }

        @Override
        protected String visitIsNotNullPredicate(IsNotNullPredicate node, Void context) {
            return process(node.getValue(), context) + " IS NOT NULL";
        }

        @Override
        protected String visitCaseWhen(CaseWhen node, Void context) {
            return format("CASE WHEN %s THEN %s END", process(node.getCondition(), context), process(node.getResult(), context));
        }

        @Override
        protected String visitFunctionCall(FunctionCall node, Void context) {
            List<String> arguments = formatAll(node.getArguments());
            switch (node.getFunction()) {
                case DATE_OF:
                    return format("DATE(%s)", arguments.get(0));
                case TIMESTAMP_FROM_MICROS:
                    return format("TIMESTAMP_MICROS(%s)", arguments.get(0));
                case TIMESTAMP_DIFF_SECONDS:
                    return format("TIMESTAMP_DIFF(%s, %s, SECOND)", arguments.get(0), arguments.get(1));
                default:
                    throw new UnsupportedOperationException("Function is not supported in BigQuery: " + node.getFunction());
            }
        }

        @Override
        protected String visitAggregateCall(AggregateCall node, Void context) {
            String argument = process(node.getArgument(), context);
            return format("%s(%s%s)", node.getAggregate().name(), node.isDistinct() ? "DISTINCT " : "", argument);
        }

        private List<String> formatAll(List<Expression> expressions) {
            return expressions.stream().map(expression -> process(expression, null)).collect(toImmutableList());
        }
    }
}
