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

import org.stepfunnel.analysis.AbstractFunnelQueryExecutor;
import org.stepfunnel.analysis.FunnelSpec;
import org.stepfunnel.config.FunnelConfig;
import org.stepfunnel.plan.PlanFormatter;
import org.stepfunnel.report.QueryError;
import org.stepfunnel.report.QueryExecutor;

import javax.inject.Inject;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class BigQueryFunnelQueryExecutor
        extends AbstractFunnelQueryExecutor {
    // "Unrecognized name: country at [12:5]" and "Name country not found inside e0 at [3:9]"
    private static final Pattern UNRECOGNIZED_NAME = Pattern.compile("Unrecognized name: ([\\w.]+)");
    private static final Pattern NAME_NOT_FOUND = Pattern.compile("Name ([\\w.]+) not found inside \\w+");

    private final BigQueryConfig bigQueryConfig;

    @Inject
    public BigQueryFunnelQueryExecutor(FunnelConfig config, BigQueryConfig bigQueryConfig, QueryExecutor executor, PlanFormatter formatter) {
        super(config, executor, formatter);
        this.bigQueryConfig = bigQueryConfig;
    }

    @Override
    protected String getSourceTable(FunnelSpec spec) {
        return bigQueryConfig.getTableId();
    }

    @Override
    protected Optional<String> getMissingColumn(QueryError error) {
        if (error == null || error.message == null) {
            return Optional.empty();
        }
        for (Pattern pattern : new Pattern[] {UNRECOGNIZED_NAME, NAME_NOT_FOUND}) {
            Matcher matcher = pattern.matcher(error.message);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }
}
