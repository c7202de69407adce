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
package org.stepfunnel.config;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import org.stepfunnel.analysis.DataSource;
import org.stepfunnel.analysis.TimeWindow;

public class FunnelConfig {
    private TimeWindow defaultWindow = TimeWindow.ofSeconds(TimeWindow.DAY);
    private int maxSteps = 32;
    private DataSource defaultDataSource = DataSource.STANDARD;

    public TimeWindow getDefaultWindow() {
        return defaultWindow;
    }

    @Config("funnel.default-window")
    @ConfigDescription("Window between consecutive steps when the request does not set one, such as 30m or 24h")
    public FunnelConfig setDefaultWindow(TimeWindow defaultWindow) {
        this.defaultWindow = defaultWindow;
        return this;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    @Config("funnel.max-steps")
    @ConfigDescription("Upper bound of funnel steps, the generated query has one join per step")
    public FunnelConfig setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
        return this;
    }

    public DataSource getDefaultDataSource() {
        return defaultDataSource;
    }

    @Config("funnel.default-data-source")
    public FunnelConfig setDefaultDataSource(DataSource defaultDataSource) {
        this.defaultDataSource = defaultDataSource;
        return this;
    }
}
