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

import com.google.auto.service.AutoService;
import com.google.inject.Binder;
import com.google.inject.Scopes;
import org.stepfunnel.analysis.FunnelQueryExecutor;
import org.stepfunnel.config.FunnelConfig;
import org.stepfunnel.plan.PlanFormatter;
import org.stepfunnel.plugin.StepFunnelModule;
import org.stepfunnel.util.ConditionalModule;

@AutoService(StepFunnelModule.class)
@ConditionalModule(config = "funnel.warehouse", value = "bigquery")
public class BigQueryFunnelModule
        extends StepFunnelModule {
    @Override
    protected void setup(Binder binder) {
        buildConfigObject(FunnelConfig.class);
        buildConfigObject(BigQueryConfig.class);

        binder.bind(PlanFormatter.class).to(BigQuerySqlFormatter.class).in(Scopes.SINGLETON);
        binder.bind(FunnelQueryExecutor.class).to(BigQueryFunnelQueryExecutor.class).in(Scopes.SINGLETON);
    }

    @Override
    public String name() {
        return "BigQuery funnel module";
    }

    @Override
    public String description() {
        return "Runs funnels on BigQuery event tables";
    }
}
