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

import org.stepfunnel.analysis.FunnelQueryExecutor;
import org.stepfunnel.analysis.TestFunnelQueryExecutor;
import org.stepfunnel.config.FunnelConfig;
import org.stepfunnel.report.QueryError;
import org.stepfunnel.report.QueryResult;
import org.stepfunnel.report.TestingQueryExecutor;
import org.stepfunnel.util.MissingRequiredColumnException;
import org.testng.annotations.Test;

import java.util.concurrent.CompletionException;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class TestBigQueryFunnelQueryExecutor
        extends TestFunnelQueryExecutor {
    private static final int MAX_STEPS = 8;

    private final TestingQueryExecutor queryExecutor = new TestingQueryExecutor();
    private final BigQueryFunnelQueryExecutor funnelQueryExecutor = new BigQueryFunnelQueryExecutor(
            new FunnelConfig().setMaxSteps(MAX_STEPS),
            new BigQueryConfig().setProjectId("acme").setDataset("analytics").setTable("events"),
            queryExecutor,
            new BigQuerySqlFormatter());

    @Override
    public FunnelQueryExecutor getFunnelQueryExecutor() {
        return funnelQueryExecutor;
    }

    @Override
    public TestingQueryExecutor getQueryExecutor() {
        return queryExecutor;
    }

    @Override
    public int getMaxSteps() {
        return MAX_STEPS;
    }

    @Override
    public QueryError unknownColumnError(String column) {
        return QueryError.create("Unrecognized name: " + column + " at [5:7]");
    }

    @Test
    public void testSourceTable() {
        assertTrue(funnelQueryExecutor.explain(funnel(2)).contains("FROM `acme.analytics.events`\n"));
    }

    @Test
    public void testNameNotFoundInsideRelation() {
        queryExecutor.setResult(QueryResult.errorResult(QueryError.create("Name group_value not found inside e0 at [31:3]")));

        try {
            funnelQueryExecutor.query(funnel(2)).getResult().join();
            fail("missing column must fail the execution");
        } catch (CompletionException e) {
            assertTrue(e.getCause() instanceof MissingRequiredColumnException, e.getCause().toString());
            assertEquals(((MissingRequiredColumnException) e.getCause()).getColumn(), "group_value");
        }
    }

    @Test
    public void testQualifiedUnrecognizedName() {
        queryExecutor.setResult(QueryResult.errorResult(unknownColumnError("device.category")));

        try {
            funnelQueryExecutor.query(funnel(1)).getResult().join();
            fail("missing column must fail the execution");
        } catch (CompletionException e) {
            assertEquals(((MissingRequiredColumnException) e.getCause()).getColumn(), "device.category");
        }
    }
}
