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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.stepfunnel.config.FunnelConfig;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A funnel request as it arrives over the wire. {@code group_by} accepts a single key or a list of keys.
 */
public class FunnelRequest {
    public final List<EventSpec> events;
    public final LocalDate startDate;
    public final LocalDate endDate;
    public final Optional<String> window;
    public final List<String> groupBy;
    public final Map<String, Object> filters;
    public final Optional<DataSource> dataSource;
    public final Optional<String> timestampField;

    @JsonCreator
    public FunnelRequest(@JsonProperty("events") List<EventSpec> events,
                         @JsonProperty("start_date") LocalDate startDate,
                         @JsonProperty("end_date") LocalDate endDate,
                         @JsonProperty("window") Optional<String> window,
                         @JsonProperty("group_by") List<String> groupBy,
                         @JsonProperty("filters") Map<String, Object> filters,
                         @JsonProperty("data_source") Optional<DataSource> dataSource,
                         @JsonProperty("timestamp_field") Optional<String> timestampField) {
        this.events = EventSpec.normalize(events);
        this.startDate = startDate;
        this.endDate = endDate;
        this.window = window == null ? Optional.empty() : window;
        this.groupBy = groupBy == null ? ImmutableList.of() : Collections.unmodifiableList(groupBy);
        this.filters = filters == null ? ImmutableMap.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        this.dataSource = dataSource == null ? Optional.empty() : dataSource;
        this.timestampField = timestampField == null ? Optional.empty() : timestampField;
    }

    /**
     * Validates the request, filling the window and the data source from the configuration when the request
     * leaves them out.
     */
    public FunnelSpec toFunnelSpec(FunnelConfig config) {
        TimeWindow timeWindow = window.map(TimeWindow::parse).orElse(config.getDefaultWindow());
        return new FunnelSpec(events, startDate, endDate, timeWindow, groupBy, filters,
                dataSource.orElse(config.getDefaultDataSource()), timestampField);
    }
}
