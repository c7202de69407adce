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
import com.google.common.base.Strings;
import org.stepfunnel.plan.CteReference;
import org.stepfunnel.plan.Expression;
import org.stepfunnel.plan.Join;
import org.stepfunnel.plan.OrderItem;
import org.stepfunnel.plan.PlanFormatter;
import org.stepfunnel.plan.PlanVisitor;
import org.stepfunnel.plan.QueryPlan;
import org.stepfunnel.plan.Relation;
import org.stepfunnel.plan.Select;
import org.stepfunnel.plan.SelectItem;
import org.stepfunnel.plan.SourceTable;
import org.stepfunnel.plan.WithQuery;

import java.util.Iterator;
import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static org.stepfunnel.bigquery.BigQueryExpressionFormatter.formatExpression;

/**
 * Renders a funnel plan as a BigQuery Standard SQL statement. The source table is quoted with backticks,
 * every other name is written as it is.
 */
public class BigQuerySqlFormatter
        implements PlanFormatter {
    private static final String INDENT = "  ";

    @Override
    public String format(QueryPlan plan) {
        StringBuilder builder = new StringBuilder();
        new Formatter(builder).process(plan, 0);
        return builder.toString();
    }

    private static class Formatter
            extends PlanVisitor<Void, Integer> {
        private final StringBuilder builder;

        Formatter(StringBuilder builder) {
            this.builder = builder;
        }

        @Override
        protected Void visitQueryPlan(QueryPlan node, Integer indent) {
            append(indent, "WITH ");
            Iterator<WithQuery> queries = node.getWithQueries().iterator();
            while (queries.hasNext()) {
                process(queries.next(), indent);
                if (queries.hasNext()) {
                    builder.append(",\n");
                }
            }
            builder.append('\n');
            process(node.getBody(), indent);
            return null;
        }

        @Override
        protected Void visitWithQuery(WithQuery node, Integer indent) {
            builder.append(node.getName()).append(" AS (\n");
            process(node.getQuery(), indent + 1);
            append(indent, ")");
            return null;
        }

        @Override
        protected Void visitSelect(Select node, Integer indent) {
            line(indent, "SELECT");
            Iterator<SelectItem> items = node.getItems().iterator();
            while (items.hasNext()) {
                process(items.next(), indent + 1);
                builder.append(items.hasNext() ? ",\n" : "\n");
            }

            append(indent, "FROM ");
            process(node.getFrom(), indent);
            builder.append('\n');

            for (Join join : node.getJoins()) {
                process(join, indent);
            }

            node.getWhere().ifPresent(where -> line(indent, "WHERE " + formatExpression(where)));

            switch (node.getGroupBy().getKind()) {
                case ALL:
                    line(indent, "GROUP BY ALL");
                    break;
                case EXPRESSIONS:
                    line(indent, "GROUP BY " + Joiner.on(", ").join(formatAll(node.getGroupBy().getExpressions())));
                    break;
                case NONE:
                    break;
                default:
                    throw new UnsupportedOperationException("unknown grouping: " + node.getGroupBy().getKind());
            }

            if (!node.getOrderBy().isEmpty()) {
                line(indent, "ORDER BY " + Joiner.on(", ").join(node.getOrderBy().stream()
                        .map(Formatter::formatOrderItem)
                        .iterator()));
            }
            return null;
        }

        @Override
        protected Void visitSelectItem(SelectItem node, Integer indent) {
            append(indent, formatExpression(node.getExpression()));
            node.getAlias().ifPresent(alias -> builder.append(" AS ").append(alias));
            return null;
        }

        @Override
        protected Void visitJoin(Join node, Integer indent) {
            append(indent, node.getType().name()).append(" JOIN ");
            process(node.getRight(), indent);
            builder.append(" ON ").append(formatExpression(node.getCriteria())).append('\n');
            return null;
        }

        @Override
        protected Void visitSourceTable(SourceTable node, Integer indent) {
            builder.append('`').append(node.getTableId()).append('`');
            return null;
        }

        @Override
        protected Void visitCteReference(CteReference node, Integer indent) {
            builder.append(node.getName());
            return null;
        }

        private static String formatOrderItem(OrderItem item) {
            return formatExpression(item.getExpression()) + (item.getOrdering() == OrderItem.Ordering.ASCENDING ? " ASC" : " DESC");
        }

        private static List<String> formatAll(List<Expression> expressions) {
            return expressions.stream().map(BigQueryExpressionFormatter::formatExpression).collect(toImmutableList());
        }

        private void line(int indent, String value) {
            append(indent, value).append('\n');
        }

        private StringBuilder append(int indent, String value) {
            return builder.append(Strings.repeat(INDENT, indent)).append(value);
        }
    }
}
