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
import org.testng.annotations.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

/**
 * Runs generated plans over small event tables to check which users reach which step.
 */
public class TestFunnelSemantics {
    private static final String TABLE = "project.dataset.events";
    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 1, 31);
    private static final Instant T = Instant.parse("2024-01-10T10:00:00Z");

    private final FunnelPlanBuilder builder = new FunnelPlanBuilder();

    private static Map<String, Object> event(String user, String name, Instant timestamp, Object... properties) {
        Map<String, Object> row = new HashMap<>();
        row.put("user_id", user);
        row.put("event_name", name);
        row.put("timestamp", timestamp);
        for (int i = 0; i < properties.length; i += 2) {
            row.put((String) properties[i], properties[i + 1]);
        }
        return row;
    }

    private static Map<String, Object> ga4Event(String user, String name, Instant timestamp) {
        Map<String, Object> row = new HashMap<>();
        row.put("user_pseudo_id", user);
        row.put("event_name", name);
        row.put("event_timestamp", timestamp.getEpochSecond() * 1_000_000L + timestamp.getNano() / 1000);
        row.put("event_date", timestamp.atZone(ZoneOffset.UTC).toLocalDate());
        return row;
    }

    private static FunnelSpec funnel(String window, String... events) {
        List<EventSpec> steps = new ArrayList<>();
        for (String event : events) {
            steps.add(EventSpec.of(event));
        }
        return FunnelSpec.of(steps, START, END, TimeWindow.parse(window));
    }

    private List<Map<String, Object>> run(FunnelSpec spec, List<Map<String, Object>> rows) {
        InMemoryPlanEvaluator evaluator = new InMemoryPlanEvaluator(ImmutableMap.of(TABLE, rows));
        return evaluator.evaluate(builder.build(spec, spec.resolveSchema(), TABLE));
    }

    private Map<String, Object> runSingleRow(FunnelSpec spec, List<Map<String, Object>> rows) {
        List<Map<String, Object>> result = run(spec, rows);
        assertEquals(result.size(), 1);
        return result.get(0);
    }

    /**
     * Checks the users of every step, the first step is also the total.
     */
    private static void assertCounts(Map<String, Object> row, long... counts) {
        assertEquals(row.get("total_users"), counts[0]);
        for (int i = 0; i < counts.length; i++) {
            assertEquals(row.get("step" + (i + 1) + "_users"), counts[i], "step " + (i + 1));
        }
    }

    @Test
    public void testWindowIsMeasuredFromPreviousStep() {
        Map<String, Object> row = runSingleRow(funnel("3600s", "A", "B", "C"), ImmutableList.of(
                event("u1", "A", T),
                event("u1", "B", T.plusSeconds(3000)),
                event("u1", "C", T.plusSeconds(6000))));

        assertCounts(row, 1, 1, 1);
    }

    @Test
    public void testWindowIsInclusive() {
        Map<String, Object> row = runSingleRow(funnel("1h", "A", "B"), ImmutableList.of(
                event("u1", "A", T),
                event("u1", "B", T.plusSeconds(3600)),
                event("u2", "A", T),
                event("u2", "B", T.plusSeconds(3601))));

        assertCounts(row, 2, 1);
    }

    @Test
    public void testStepsMustBeInOrder() {
        Map<String, Object> row = runSingleRow(funnel("1d", "A", "B"), ImmutableList.of(
                event("u1", "B", T),
                event("u1", "A", T.plusSeconds(60))));

        assertCounts(row, 1, 0);
    }

    @Test
    public void testEqualTimestampsAreInOrder() {
        Map<String, Object> row = runSingleRow(funnel("1d", "A", "B"), ImmutableList.of(
                event("u1", "A", T),
                event("u1", "B", T)));

        assertCounts(row, 1, 1);
    }

    @Test
    public void testLaterStepRequiresPreviousStep() {
        Map<String, Object> row = runSingleRow(funnel("1d", "A", "B", "C"), ImmutableList.of(
                event("u1", "A", T),
                event("u1", "C", T.plusSeconds(60)),
                event("u2", "A", T),
                event("u2", "B", T.plusSeconds(30)),
                event("u2", "C", T.plusSeconds(60))));

        assertCounts(row, 2, 1, 1);
    }

    @Test
    public void testAnyOccurrenceOfFirstStepCanStartTheFunnel() {
        Map<String, Object> row = runSingleRow(funnel("1h", "A", "B"), ImmutableList.of(
                event("u1", "A", T),
                event("u1", "A", T.plusSeconds(10000)),
                event("u1", "B", T.plusSeconds(10500))));

        assertCounts(row, 1, 1);
    }

    @Test
    public void testUsersAreCountedOnce() {
        Map<String, Object> row = runSingleRow(funnel("1d", "A", "B"), ImmutableList.of(
                event("u1", "A", T),
                event("u1", "A", T.plusSeconds(1)),
                event("u1", "B", T.plusSeconds(2)),
                event("u1", "B", T.plusSeconds(3)),
                event("u2", "A", T),
                event("u3", "B", T)));

        assertCounts(row, 2, 1);
    }

    @Test
    public void testSingleStep() {
        Map<String, Object> row = runSingleRow(funnel("1d", "A"), ImmutableList.of(
                event("u1", "A", T),
                event("u2", "A", T),
                event("u3", "B", T)));

        assertCounts(row, 2);
        assertEquals(row.get("step1_users"), row.get("total_users"));
    }

    @Test
    public void testDateRangeIsInclusive() {
        Map<String, Object> row = runSingleRow(funnel("1d", "A"), ImmutableList.of(
                event("u1", "A", Instant.parse("2024-01-01T00:00:00Z")),
                event("u2", "A", Instant.parse("2024-01-31T23:59:59Z")),
                event("u3", "A", Instant.parse("2023-12-31T23:59:59Z")),
                event("u4", "A", Instant.parse("2024-02-01T00:00:00Z"))));

        assertCounts(row, 2);
    }

    @Test
    public void testEmptyTable() {
        Map<String, Object> row = runSingleRow(funnel("1d", "A", "B"), ImmutableList.of());

        assertCounts(row, 0, 0);
        assertNull(row.get("user_id"));
    }

    @Test
    public void testFilters() {
        FunnelSpec spec = funnel("1d", "A", "B").withFilters(ImmutableMap.of("platform", ImmutableList.of("ios", "android")));
        Map<String, Object> row = runSingleRow(spec, ImmutableList.of(
                event("u1", "A", T, "platform", "ios"),
                event("u1", "B", T.plusSeconds(1), "platform", "ios"),
                event("u2", "A", T, "platform", "web"),
                event("u2", "B", T.plusSeconds(1), "platform", "web"),
                event("u3", "A", T, "platform", "android"),
                event("u3", "B", T.plusSeconds(1), "platform", "web")));

        assertCounts(row, 2, 1);
    }

    @Test
    public void testStepParameters() {
        FunnelSpec spec = FunnelSpec.of(ImmutableList.of(
                        EventSpec.of("page_view", ImmutableMap.of("page", "/product/%")),
                        EventSpec.of("purchase", ImmutableMap.of("value", ImmutableList.of(10, 20)))),
                START, END, TimeWindow.parse("1d"));

        Map<String, Object> row = runSingleRow(spec, ImmutableList.of(
                event("u1", "page_view", T, "page", "/product/42"),
                event("u1", "purchase", T.plusSeconds(1), "value", 10L),
                event("u2", "page_view", T, "page", "/home"),
                event("u2", "purchase", T.plusSeconds(1), "value", 10L),
                event("u3", "page_view", T, "page", "/product/7"),
                event("u3", "purchase", T.plusSeconds(1), "value", 30L)));

        assertCounts(row, 2, 1);
    }

    @Test
    public void testGroupValueMustMatchFirstStep() {
        FunnelSpec spec = funnel("1d", "A", "B").withGroupBy(ImmutableList.of("platform"));
        List<Map<String, Object>> result = run(spec, ImmutableList.of(
                event("u1", "A", T, "platform", "ios"),
                event("u1", "B", T.plusSeconds(60), "platform", "web"),
                event("u2", "A", T, "platform", "web"),
                event("u2", "B", T.plusSeconds(60), "platform", "web")));

        assertEquals(result.size(), 2);
        assertEquals(result.get(0).get("group_value"), "ios");
        assertCounts(result.get(0), 1, 0);
        assertEquals(result.get(1).get("group_value"), "web");
        assertCounts(result.get(1), 1, 1);
    }

    @Test
    public void testGroupsAreOrdered() {
        FunnelSpec spec = funnel("1d", "A").withGroupBy(ImmutableList.of("country"));
        List<Map<String, Object>> result = run(spec, ImmutableList.of(
                event("u1", "A", T, "country", "US"),
                event("u2", "A", T, "country", "CA"),
                event("u3", "A", T, "country", "DE"),
                event("u4", "A", T, "country", "CA")));

        assertEquals(result.size(), 3);
        assertEquals(result.get(0).get("group_value"), "CA");
        assertCounts(result.get(0), 2);
        assertEquals(result.get(1).get("group_value"), "DE");
        assertEquals(result.get(2).get("group_value"), "US");
    }

    @Test
    public void testGa4() {
        FunnelSpec spec = funnel("3600s", "A", "B", "C").withDataSource(DataSource.GA4);
        Map<String, Object> row = runSingleRow(spec, ImmutableList.of(
                ga4Event("u1", "A", T),
                ga4Event("u1", "B", T.plusSeconds(3000)),
                ga4Event("u1", "C", T.plusSeconds(6000)),
                ga4Event("u2", "A", T),
                ga4Event("u2", "B", T.plusSeconds(3601)),
                ga4Event("u3", "A", Instant.parse("2024-02-01T00:00:00Z"))));

        assertCounts(row, 2, 1, 1);
    }

    @Test
    public void testGa4MicrosecondPrecision() {
        FunnelSpec spec = funnel("1s", "A", "B").withDataSource(DataSource.GA4);
        Map<String, Object> row = runSingleRow(spec, ImmutableList.of(
                ga4Event("u1", "A", T),
                ga4Event("u1", "B", T.plusNanos(1_500_000_000L)),
                ga4Event("u2", "A", T.plusNanos(1000)),
                ga4Event("u2", "B", T)));

        // B of u2 is one microsecond before A
        assertCounts(row, 2, 1);
    }

    @Test
    public void testStandardAndGa4Agree() {
        List<Map<String, Object>> standardRows = ImmutableList.of(
                event("u1", "A", T),
                event("u1", "B", T.plusSeconds(100)),
                event("u2", "A", T),
                event("u2", "B", T.plusSeconds(100000)));
        List<Map<String, Object>> ga4Rows = ImmutableList.of(
                ga4Event("u1", "A", T),
                ga4Event("u1", "B", T.plusSeconds(100)),
                ga4Event("u2", "A", T),
                ga4Event("u2", "B", T.plusSeconds(100000)));

        FunnelSpec spec = funnel("1d", "A", "B");
        Map<String, Object> standard = runSingleRow(spec, standardRows);
        Map<String, Object> ga4 = runSingleRow(spec.withDataSource(DataSource.GA4), ga4Rows);

        assertEquals(ga4.get("total_users"), standard.get("total_users"));
        assertEquals(ga4.get("step2_users"), standard.get("step2_users"));
    }

    @Test
    public void testTimestampColumnOverride() {
        FunnelSpec spec = funnel("1m", "A", "B").withTimestampColumn("server_timestamp");
        Map<String, Object> row = runSingleRow(spec, ImmutableList.of(
                event("u1", "A", T, "server_timestamp", T),
                event("u1", "B", T.plusSeconds(3600), "server_timestamp", T.plusSeconds(30))));

        assertCounts(row, 1, 1);
    }
}
