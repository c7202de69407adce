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
import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import org.stepfunnel.util.ValidationUtil;

import static com.google.common.base.Preconditions.checkState;

public class BigQueryConfig {
    private String projectId;
    private String dataset;
    private String table;

    public String getProjectId() {
        return projectId;
    }

    @Config("bigquery.project-id")
    @ConfigDescription("Project of the event table, the default project of the client is used when it is not set")
    public BigQueryConfig setProjectId(String projectId) {
        this.projectId = projectId != null && projectId.isEmpty() ? null : projectId;
        return this;
    }

    public String getDataset() {
        return dataset;
    }

    @Config("bigquery.dataset")
    public BigQueryConfig setDataset(String dataset) {
        this.dataset = dataset;
        return this;
    }

    public String getTable() {
        return table;
    }

    @Config("bigquery.table")
    @ConfigDescription("Event table, may be a wildcard table such as events_*")
    public BigQueryConfig setTable(String table) {
        this.table = table;
        return this;
    }

    /**
     * The table as {@code project.dataset.table}, or {@code dataset.table} without a project.
     */
    public String getTableId() {
        checkState(dataset != null, "bigquery.dataset is not set");
        checkState(table != null, "bigquery.table is not set");
        return ValidationUtil.checkTableId(Joiner.on('.').skipNulls().join(projectId, dataset, table));
    }
}
