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

import io.airlift.log.Logger;
import org.stepfunnel.config.FunnelConfig;
import org.stepfunnel.plan.PlanFormatter;
import org.stepfunnel.plan.QueryPlan;
import org.stepfunnel.report.DelegateQueryExecution;
import org.stepfunnel.report.QueryError;
import org.stepfunnel.report.QueryExecution;
import org.stepfunnel.report.QueryExecutor;
import org.stepfunnel.report.QueryResult;
import org.stepfunnel.util.InvalidFunnelSpecException;
import org.stepfunnel.util.MissingRequiredColumnException;

import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Runs funnels on a warehouse: builds the plan for the table layout of the request, renders it in the
 * warehouse dialect and submits the query. Subclasses name the source table and interpret warehouse errors.
 */
public abstract class AbstractFunnelQueryExecutor
        implements FunnelQueryExecutor {
    private final static Logger LOGGER = Logger.get(AbstractFunnelQueryExecutor.class);

    protected final FunnelConfig config;
    private final QueryExecutor executor;
    private final PlanFormatter formatter;
    private final FunnelPlanBuilder planBuilder;

    public AbstractFunnelQueryExecutor(FunnelConfig config, QueryExecutor executor, PlanFormatter formatter) {
        this.config = requireNonNull(config, "config is null");
        this.executor = requireNonNull(executor, "executor is null");
        this.formatter = requireNonNull(formatter, "formatter is null");
        this.planBuilder = new FunnelPlanBuilder();
    }

    /**
     * Fully qualified name of the event table the funnel is computed over.
     */
    protected abstract String getSourceTable(FunnelSpec spec);

    /**
     * The column the warehouse could not resolve, if the error is of that kind.
     */
    protected abstract Optional<String> getMissingColumn(QueryError error);

    @Override
    public QueryPlan plan(FunnelSpec spec) {
        requireNonNull(spec, "spec is null");
        int steps = spec.getSteps().size();
        if (steps > config.getMaxSteps()) {
            throw new InvalidFunnelSpecException(format("Funnel has %d steps, at most %d steps are allowed", steps, config.getMaxSteps()));
        }
        return planBuilder.build(spec, spec.resolveSchema(), getSourceTable(spec));
    }

    @Override
    public String explain(FunnelSpec spec) {
        return formatter.format(plan(spec));
    }

    @Override
    public QueryExecution query(FunnelSpec spec) {
        String query = explain(spec);
        LOGGER.debug("Running funnel query on %s: %s", spec.getDataSource().value(), query);

        QueryExecution execution = executor.executeRawQuery(query);
        return new DelegateQueryExecution(execution, query, result -> {
            if (result.isFailed()) {
                Optional<String> missingColumn = getMissingColumn(result.getError());
                if (missingColumn.isPresent()) {
                    throw new MissingRequiredColumnException(missingColumn.get(), result.getError().message);
                }
                LOGGER.error("Error while running funnel query: %s", result.getError());
                return result;
            }
            result.setProperty(QueryResult.QUERY, query);
            return result;
        });
    }
}
