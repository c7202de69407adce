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
package org.stepfunnel.analysis;

import com.google.common.collect.ImmutableList;
import org.stepfunnel.plan.AggregateCall;
import org.stepfunnel.plan.AllColumns;
import org.stepfunnel.plan.CaseWhen;
import org.stepfunnel.plan.ColumnReference;
import org.stepfunnel.plan.ComparisonExpression;
import org.stepfunnel.plan.CteReference;
import org.stepfunnel.plan.Expression;
import org.stepfunnel.plan.FunctionCall;
import org.stepfunnel.plan.GroupBy;
import org.stepfunnel.plan.IsNotNullPredicate;
import org.stepfunnel.plan.Join;
import org.stepfunnel.plan.Literal;
import org.stepfunnel.plan.LogicalAnd;
import org.stepfunnel.plan.OrderItem;
import org.stepfunnel.plan.QueryPlan;
import org.stepfunnel.plan.Select;
import org.stepfunnel.plan.SelectItem;
import org.stepfunnel.plan.SourceTable;
import org.stepfunnel.plan.WithQuery;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static org.stepfunnel.plan.ColumnReference.column;
import static org.stepfunnel.plan.ComparisonExpression.Operator.GREATER_THAN_OR_EQUAL;
import static org.stepfunnel.plan.ComparisonExpression.Operator.LESS_THAN_OR_EQUAL;
import static org.stepfunnel.plan.SelectItem.item;

/**
 * Builds the funnel query plan.
 *
 * <p>Every step is a subset of the filtered events that matches the step's event. Step {@code i} is left
 * joined to step {@code i - 1} on the user, on a timestamp that is not earlier than the previous step and
 * at most one window later, and on the grouping values of step 0. A user therefore reaches step
 * {@code i} only through a matched step {@code i - 1}. The window is always measured from the immediately
 * preceding step.
 *
 * <p>The builder is stateless and has a single code path for all table layouts, every difference between
 * layouts comes from the {@link SchemaDescriptor}.
 */
public final class FunnelPlanBuilder {
    public static final String BASE_RELATION = "filtered_events";
    public static final String USER_ID = "user_id";
    public static final String GROUP_VALUE = "group_value";
    public static final String TOTAL_USERS = "total_users";

    public QueryPlan build(FunnelSpec spec, SchemaDescriptor schema, String sourceTable) {
        requireNonNull(spec, "spec is null");
        requireNonNull(schema, "schema is null");
        requireNonNull(sourceTable, "sourceTable is null");

        WithQuery base = new WithQuery(BASE_RELATION, Select.select(
                ImmutableList.of(item(AllColumns.INSTANCE)),
                new SourceTable(sourceTable),
                Optional.of(basePredicate(spec, schema))));

        List<EventSpec> events = spec.getSteps();
        ImmutableList.Builder<WithQuery> steps = ImmutableList.builder();
        for (int i = 0; i < events.size(); i++) {
            steps.add(new WithQuery(stepRelation(i), stepSubset(i, events.get(i), spec.getGroupBy(), schema)));
        }

        ImmutableList.Builder<Join> joins = ImmutableList.builder();
        for (int i = 1; i < events.size(); i++) {
            joins.add(Join.leftJoin(new CteReference(stepRelation(i)), joinCriteria(i, spec)));
        }

        return new QueryPlan(base, steps.build(), body(spec, schema, joins.build()));
    }

    public static String stepRelation(int step) {
        return "e" + step;
    }

    public static String timestampColumn(int step) {
        return stepRelation(step) + "_timestamp";
    }

    public static String nameColumn(int step) {
        return stepRelation(step) + "_name";
    }

    public static String stepUsersColumn(int step) {
        return "step" + (step + 1) + "_users";
    }

    /**
     * Alias of the {@code k}-th grouping key. The first key keeps the plain name.
     */
    public static String groupValueColumn(int key) {
        checkArgument(key >= 0, "key index is negative");
        return key == 0 ? GROUP_VALUE : GROUP_VALUE + "_" + key;
    }

    private static Expression basePredicate(FunnelSpec spec, SchemaDescriptor schema) {
        Expression dateRange = schema.datePredicate(spec.getStartDate(), spec.getEndDate());
        return ConditionCompiler.compile(spec.getFilters())
                .map(filters -> LogicalAnd.and(dateRange, filters))
                .orElse(dateRange);
    }

    private static Select stepSubset(int step, EventSpec event, List<String> groupBy, SchemaDescriptor schema) {
        ImmutableList.Builder<SelectItem> items = ImmutableList.builder();
        items.add(item(column(schema.getIdentifierColumn()), USER_ID));
        items.add(item(schema.timestampValue(), timestampColumn(step)));
        for (int key = 0; key < groupBy.size(); key++) {
            items.add(item(column(groupBy.get(key)), groupValueColumn(key)));
        }
        // the step name is a tag, two steps may share an event name
        items.add(item(Literal.of(event.getName()), nameColumn(step)));

        return Select.select(items.build(), new CteReference(BASE_RELATION),
                Optional.of(ConditionCompiler.compileEvent(event)));
    }

    private static Expression joinCriteria(int step, FunnelSpec spec) {
        String current = stepRelation(step);
        String previous = stepRelation(step - 1);
        ColumnReference currentTimestamp = column(current, timestampColumn(step));
        ColumnReference previousTimestamp = column(previous, timestampColumn(step - 1));

        ImmutableList.Builder<Expression> terms = ImmutableList.builder();
        terms.add(ComparisonExpression.equal(column(current, USER_ID), column(previous, USER_ID)));
        terms.add(new ComparisonExpression(GREATER_THAN_OR_EQUAL, currentTimestamp, previousTimestamp));
        terms.add(new ComparisonExpression(LESS_THAN_OR_EQUAL,
                FunctionCall.timestampDiffSeconds(currentTimestamp, previousTimestamp),
                Literal.of(spec.getWindow().getSeconds())));
        for (int key = 0; key < spec.getGroupBy().size(); key++) {
            terms.add(ComparisonExpression.equal(
                    column(current, groupValueColumn(key)),
                    column(stepRelation(0), groupValueColumn(key))));
        }
        return LogicalAnd.and(terms.build()).get();
    }

    private static Select body(FunnelSpec spec, SchemaDescriptor schema, List<Join> joins) {
        String first = stepRelation(0);
        int stepCount = spec.getSteps().size();

        ImmutableList.Builder<SelectItem> items = ImmutableList.builder();
        items.add(item(AggregateCall.anyValue(column(first, USER_ID)), USER_ID));

        ImmutableList.Builder<Expression> groupingColumns = ImmutableList.builder();
        for (int key = 0; key < spec.getGroupBy().size(); key++) {
            ColumnReference groupValue = column(first, groupValueColumn(key));
            groupingColumns.add(groupValue);
            items.add(item(groupValue, groupValueColumn(key)));
        }

        for (int i = 0; i < stepCount; i++) {
            String relation = stepRelation(i);
            items.add(item(AggregateCall.anyValue(column(relation, timestampColumn(i))), timestampColumn(i)));
            items.add(item(AggregateCall.anyValue(column(relation, nameColumn(i))), nameColumn(i)));
        }

        items.add(item(AggregateCall.countDistinct(column(first, USER_ID)), TOTAL_USERS));
        for (int i = 0; i < stepCount; i++) {
            ColumnReference user = column(stepRelation(i), USER_ID);
            items.add(item(AggregateCall.countDistinct(new CaseWhen(new IsNotNullPredicate(user), user)), stepUsersColumn(i)));
        }

        List<Expression> keys = groupingColumns.build();
        GroupBy groupBy;
        ImmutableList.Builder<OrderItem> orderBy = ImmutableList.builder();
        if (!keys.isEmpty()) {
            groupBy = GroupBy.of(keys);
            for (Expression key : keys) {
                orderBy.add(OrderItem.ascending(key));
            }
        } else if (schema.isExplicitGroupingRequired()) {
            groupBy = GroupBy.all();
        } else {
            groupBy = GroupBy.none();
        }

        return new Select(items.build(), new CteReference(first), joins, Optional.empty(), groupBy, orderBy.build());
    }
}
