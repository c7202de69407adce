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
import org.stepfunnel.util.InvalidFunnelSpecException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A validated funnel definition. Steps are ordered, the position of an event is its step index.
 */
public final class FunnelSpec {
    private final List<EventSpec> steps;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final TimeWindow window;
    private final List<String> groupBy;
    private final Map<String, Object> filters;
    private final DataSource dataSource;
    private final Optional<String> timestampColumn;

    public FunnelSpec(List<EventSpec> steps,
                      LocalDate startDate,
                      LocalDate endDate,
                      TimeWindow window,
                      List<String> groupBy,
                      Map<String, ?> filters,
                      DataSource dataSource,
                      Optional<String> timestampColumn) {
        if (steps == null || steps.isEmpty()) {
            throw new InvalidFunnelSpecException("Funnel must have at least one step");
        }
        if (startDate == null || endDate == null) {
            throw new InvalidFunnelSpecException("Funnel date range is required");
        }
        if (startDate.isAfter(endDate)) {
            throw new InvalidFunnelSpecException(format("Start date %s is after end date %s", startDate, endDate));
        }
        if (window == null) {
            throw new InvalidFunnelSpecException("Funnel window is required");
        }
        this.steps = ImmutableList.copyOf(steps);
        this.startDate = startDate;
        this.endDate = endDate;
        this.window = window;

        ImmutableList.Builder<String> keys = ImmutableList.builder();
        if (groupBy != null) {
            for (String key : groupBy) {
                // passed to the warehouse as written, the warehouse reports unknown names
                if (key == null || key.trim().isEmpty()) {
                    throw new InvalidFunnelSpecException("Grouping key is empty");
                }
                keys.add(key);
            }
        }
        this.groupBy = keys.build();

        // null values are kept so that the compiler reports them
        this.filters = filters == null ? Collections.emptyMap() : copyFilters(filters);
        ConditionCompiler.compile(this.filters);

        this.dataSource = requireNonNull(dataSource, "dataSource is null");
        this.timestampColumn = requireNonNull(timestampColumn, "timestampColumn is null");
        timestampColumn.ifPresent(column -> {
            if (column.trim().isEmpty()) {
                throw new InvalidFunnelSpecException("Timestamp field is empty");
            }
        });
    }

    private static Map<String, Object> copyFilters(Map<String, ?> filters) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : filters.entrySet()) {
            Object value = entry.getValue();
            // list items may be null here, ImmutableList would reject them before the compiler does
            copy.put(entry.getKey(), value instanceof List ? Collections.unmodifiableList(new ArrayList<>((List<?>) value)) : value);
        }
        return Collections.unmodifiableMap(copy);
    }

    public static FunnelSpec of(List<EventSpec> steps, LocalDate startDate, LocalDate endDate, TimeWindow window) {
        return new FunnelSpec(steps, startDate, endDate, window, ImmutableList.of(), Collections.emptyMap(),
                DataSource.STANDARD, Optional.empty());
    }

    public List<EventSpec> getSteps() {
        return steps;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public Map<String, Object> getFilters() {
        return filters;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public Optional<String> getTimestampColumn() {
        return timestampColumn;
    }

    /**
     * The descriptor of the data source, with the timestamp column replaced when the request selects one.
     */
    public SchemaDescriptor resolveSchema() {
        SchemaDescriptor schema = dataSource.getSchema();
        return timestampColumn.map(schema::withTimestampColumn).orElse(schema);
    }

    public FunnelSpec withGroupBy(List<String> groupBy) {
        return new FunnelSpec(steps, startDate, endDate, window, groupBy, filters, dataSource, timestampColumn);
    }

    public FunnelSpec withFilters(Map<String, ?> filters) {
        return new FunnelSpec(steps, startDate, endDate, window, groupBy, filters, dataSource, timestampColumn);
    }

    public FunnelSpec withDataSource(DataSource dataSource) {
        return new FunnelSpec(steps, startDate, endDate, window, groupBy, filters, dataSource, timestampColumn);
    }

    public FunnelSpec withTimestampColumn(String timestampColumn) {
        return new FunnelSpec(steps, startDate, endDate, window, groupBy, filters, dataSource, Optional.of(timestampColumn));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunnelSpec)) {
            return false;
        }
        FunnelSpec that = (FunnelSpec) o;
        return steps.equals(that.steps) &&
                startDate.equals(that.startDate) &&
                endDate.equals(that.endDate) &&
                window.equals(that.window) &&
                groupBy.equals(that.groupBy) &&
                filters.equals(that.filters) &&
                dataSource == that.dataSource &&
                timestampColumn.equals(that.timestampColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(steps, startDate, endDate, window, groupBy, filters, dataSource, timestampColumn);
    }

    @Override
    public String toString() {
        return "FunnelSpec{" +
                "steps=" + steps +
                ", startDate=" + startDate +
                ", endDate=" + endDate +
                ", window=" + window +
                ", groupBy=" + groupBy +
                ", filters=" + filters +
                ", dataSource=" + dataSource +
                ", timestampColumn=" + timestampColumn +
                '}';
    }
}
