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
import com.google.common.collect.ImmutableMap;
import org.stepfunnel.plan.BetweenPredicate;
import org.stepfunnel.plan.ColumnReference;
import org.stepfunnel.plan.ComparisonExpression;
import org.stepfunnel.plan.CteReference;
import org.stepfunnel.plan.Expression;
import org.stepfunnel.plan.FunctionCall;
import org.stepfunnel.plan.GroupBy;
import org.stepfunnel.plan.Join;
import org.stepfunnel.plan.Literal;
import org.stepfunnel.plan.LogicalAnd;
import org.stepfunnel.plan.OrderItem;
import org.stepfunnel.plan.QueryPlan;
import org.stepfunnel.plan.Select;
import org.stepfunnel.plan.SelectItem;
import org.stepfunnel.plan.SourceTable;
import org.stepfunnel.plan.WithQuery;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static org.stepfunnel.plan.ColumnReference.column;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestFunnelPlanBuilder {
    private static final String TABLE = "analytics.events.raw";
    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 1, 31);

    private final FunnelPlanBuilder builder = new FunnelPlanBuilder();

    private static FunnelSpec funnel(String... events) {
        return FunnelSpec.of(
                ImmutableList.copyOf(events).stream().map(EventSpec::of).collect(toImmutableList()),
                START, END, TimeWindow.parse("24h"));
    }

    @DataProvider(name = "step-counts")
    public static Object[][] stepCounts() {
        return new Object[][] {{1}, {2}, {3}, {8}};
    }

    @Test(dataProvider = "step-counts")
    public void testOneSubsetPerStepAndOneJoinPerPair(int steps) {
        String[] events = IntStream.range(0, steps).mapToObj(i -> "event" + i).toArray(String[]::new);
        QueryPlan plan = builder.build(funnel(events), SchemaDescriptor.STANDARD, TABLE);

        assertEquals(plan.getSteps().size(), steps);
        assertEquals(plan.getJoins().size(), steps - 1);
        assertEquals(plan.getSteps().stream().map(WithQuery::getName).collect(Collectors.toList()),
                IntStream.range(0, steps).mapToObj(i -> "e" + i).collect(Collectors.toList()));
        for (int i = 1; i < steps; i++) {
            assertEquals(plan.getJoins().get(i - 1).getRight(), new CteReference("e" + i));
            assertEquals(plan.getJoins().get(i - 1).getType(), Join.Type.LEFT);
        }
    }

    @Test
    public void testSingleStep() {
        QueryPlan plan = builder.build(funnel("view"), SchemaDescriptor.STANDARD, TABLE);

        assertTrue(plan.getJoins().isEmpty());
        assertEquals(plan.getOutputColumns(), ImmutableList.of("user_id", "e0_timestamp", "e0_name", "total_users", "step1_users"));
        assertEquals(plan.getBody().getGroupBy(), GroupBy.none());
    }

    @Test
    public void testOutputColumns() {
        QueryPlan plan = builder.build(funnel("view", "add_to_cart", "purchase"), SchemaDescriptor.STANDARD, TABLE);

        List<String> columns = plan.getOutputColumns();
        assertTrue(columns.containsAll(ImmutableList.of("total_users", "step1_users", "step2_users", "step3_users")));
        assertTrue(columns.containsAll(ImmutableList.of("e0_timestamp", "e1_timestamp", "e2_timestamp", "e0_name", "e1_name", "e2_name")));
        assertFalse(columns.contains("step4_users"));
    }

    @Test
    public void testBaseSubset() {
        FunnelSpec spec = funnel("view", "purchase").withFilters(ImmutableMap.of("platform", "web"));
        Select base = builder.build(spec, SchemaDescriptor.STANDARD, TABLE).getBase().getQuery();

        assertEquals(base.getFrom(), new SourceTable(TABLE));
        assertEquals(base.getWhere().get(), LogicalAnd.and(
                new BetweenPredicate(FunctionCall.dateOf(column("timestamp")), Literal.of(START), Literal.of(END)),
                ComparisonExpression.equal(column("platform"), Literal.of("web"))));
    }

    @Test
    public void testStepSubset() {
        FunnelSpec spec = FunnelSpec.of(
                ImmutableList.of(EventSpec.of("view"), EventSpec.of("purchase", ImmutableMap.of("currency", "USD"))),
                START, END, TimeWindow.parse("1h"));
        Select step = builder.build(spec, SchemaDescriptor.STANDARD, TABLE).getSteps().get(1).getQuery();

        assertEquals(step.getFrom(), new CteReference("filtered_events"));
        assertEquals(step.getItems(), ImmutableList.of(
                SelectItem.item(column("user_id"), "user_id"),
                SelectItem.item(column("timestamp"), "e1_timestamp"),
                SelectItem.item(Literal.of("purchase"), "e1_name")));
        assertEquals(step.getWhere().get(), LogicalAnd.and(
                ComparisonExpression.equal(column("event_name"), Literal.of("purchase")),
                ComparisonExpression.equal(column("currency"), Literal.of("USD"))));
    }

    @Test
    public void testJoinChainsToPreviousStep() {
        QueryPlan plan = builder.build(funnel("view", "add_to_cart", "purchase"), SchemaDescriptor.STANDARD, TABLE);

        Join second = plan.getJoins().get(1);
        ColumnReference current = column("e2", "e2_timestamp");
        ColumnReference previous = column("e1", "e1_timestamp");
        assertEquals(second.getCriteria(), LogicalAnd.and(
                ComparisonExpression.equal(column("e2", "user_id"), column("e1", "user_id")),
                new ComparisonExpression(ComparisonExpression.Operator.GREATER_THAN_OR_EQUAL, current, previous),
                new ComparisonExpression(ComparisonExpression.Operator.LESS_THAN_OR_EQUAL,
                        FunctionCall.timestampDiffSeconds(current, previous), Literal.of(86400L))));
    }

    @Test
    public void testGrouping() {
        FunnelSpec spec = funnel("view", "purchase").withGroupBy(ImmutableList.of("platform", "country"));
        QueryPlan plan = builder.build(spec, SchemaDescriptor.GA4, TABLE);

        Select step = plan.getSteps().get(1).getQuery();
        assertTrue(step.getItems().contains(SelectItem.item(column("platform"), "group_value")));
        assertTrue(step.getItems().contains(SelectItem.item(column("country"), "group_value_1")));

        List<Expression> terms = ((LogicalAnd) plan.getJoins().get(0).getCriteria()).getTerms();
        assertTrue(terms.contains(ComparisonExpression.equal(column("e1", "group_value"), column("e0", "group_value"))));
        assertTrue(terms.contains(ComparisonExpression.equal(column("e1", "group_value_1"), column("e0", "group_value_1"))));

        Select body = plan.getBody();
        assertEquals(body.getGroupBy(), GroupBy.of(ImmutableList.of(column("e0", "group_value"), column("e0", "group_value_1"))));
        assertEquals(body.getOrderBy(), ImmutableList.of(
                OrderItem.ascending(column("e0", "group_value")),
                OrderItem.ascending(column("e0", "group_value_1"))));
        assertTrue(plan.getOutputColumns().containsAll(ImmutableList.of("group_value", "group_value_1")));
    }

    @Test
    public void testGroupingWithoutKeysDependsOnSchema() {
        assertEquals(builder.build(funnel("view", "purchase"), SchemaDescriptor.STANDARD, TABLE).getBody().getGroupBy(), GroupBy.none());
        assertEquals(builder.build(funnel("view", "purchase"), SchemaDescriptor.GA4, TABLE).getBody().getGroupBy(), GroupBy.all());
    }

    @Test
    public void testStandardAndGa4DifferOnlyInColumns() {
        FunnelSpec spec = funnel("view", "add_to_cart", "purchase");
        QueryPlan standard = builder.build(spec, SchemaDescriptor.STANDARD, TABLE);
        QueryPlan ga4 = builder.build(spec, SchemaDescriptor.GA4, TABLE);

        assertEquals(ga4.getJoins(), standard.getJoins());
        assertEquals(ga4.getBody().getItems(), standard.getBody().getItems());
        assertEquals(ga4.getOutputColumns(), standard.getOutputColumns());

        assertEquals(standard.getBase().getQuery().getWhere().get(),
                new BetweenPredicate(FunctionCall.dateOf(column("timestamp")), Literal.of(START), Literal.of(END)));
        assertEquals(ga4.getBase().getQuery().getWhere().get(),
                new BetweenPredicate(column("event_date"), Literal.of(START), Literal.of(END)));

        Select ga4Step = ga4.getSteps().get(0).getQuery();
        assertEquals(ga4Step.getItems().get(0), SelectItem.item(column("user_pseudo_id"), "user_id"));
        assertEquals(ga4Step.getItems().get(1), SelectItem.item(FunctionCall.timestampFromMicros(column("event_timestamp")), "e0_timestamp"));
        assertEquals(ga4Step.getWhere(), standard.getSteps().get(0).getQuery().getWhere());
    }

    @Test
    public void testRepeatedEventNames() {
        QueryPlan plan = builder.build(funnel("view", "view"), SchemaDescriptor.STANDARD, TABLE);

        assertEquals(plan.getSteps().get(0).getQuery().getWhere(), plan.getSteps().get(1).getQuery().getWhere());
        assertTrue(plan.getSteps().get(1).getQuery().getItems().contains(SelectItem.item(Literal.of("view"), "e1_name")));
    }

    @Test
    public void testPlanIsAValue() {
        FunnelSpec spec = funnel("view", "purchase").withGroupBy(ImmutableList.of("platform"));
        assertEquals(builder.build(spec, SchemaDescriptor.GA4, TABLE), builder.build(spec, SchemaDescriptor.GA4, TABLE));
    }
}
