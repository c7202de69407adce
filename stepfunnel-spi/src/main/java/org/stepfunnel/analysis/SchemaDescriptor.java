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

import org.stepfunnel.plan.BetweenPredicate;
import org.stepfunnel.plan.ColumnReference;
import org.stepfunnel.plan.Expression;
import org.stepfunnel.plan.FunctionCall;
import org.stepfunnel.plan.Literal;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static org.stepfunnel.plan.ColumnReference.column;

/**
 * Column names and encodings of one event table layout. Everything that differs between layouts is
 * described here so that {@link FunnelPlanBuilder} has a single code path.
 */
public final class SchemaDescriptor {
    public enum TimestampEncoding {
        /**
         * The column already holds a timestamp value.
         */
        TIMESTAMP,
        /**
         * The column holds microseconds since the epoch as an integer.
         */
        EPOCH_MICROS
    }

    public enum DatePredicateStyle {
        /**
         * The date range is checked against the calendar date of the timestamp column.
         */
        TIMESTAMP_DATE,
        /**
         * The table has a date typed partition column that is compared directly.
         */
        DATE_COLUMN
    }

    public static final SchemaDescriptor STANDARD = builder("standard")
            .setIdentifierColumn("user_id")
            .setTimestampColumn("timestamp")
            .setTimestampEncoding(TimestampEncoding.TIMESTAMP)
            .setDatePredicateStyle(DatePredicateStyle.TIMESTAMP_DATE)
            .setExplicitGroupingRequired(false)
            .build();

    public static final SchemaDescriptor GA4 = builder("ga4")
            .setIdentifierColumn("user_pseudo_id")
            .setTimestampColumn("event_timestamp")
            .setTimestampEncoding(TimestampEncoding.EPOCH_MICROS)
            .setDatePredicateStyle(DatePredicateStyle.DATE_COLUMN)
            .setDateColumn("event_date")
            .setExplicitGroupingRequired(true)
            .build();

    private final String name;
    private final String identifierColumn;
    private final String timestampColumn;
    private final TimestampEncoding timestampEncoding;
    private final DatePredicateStyle datePredicateStyle;
    private final Optional<String> dateColumn;
    private final boolean explicitGroupingRequired;

    private SchemaDescriptor(String name,
                             String identifierColumn,
                             String timestampColumn,
                             TimestampEncoding timestampEncoding,
                             DatePredicateStyle datePredicateStyle,
                             Optional<String> dateColumn,
                             boolean explicitGroupingRequired) {
        this.name = requireNonNull(name, "name is null");
        this.identifierColumn = requireNonNull(identifierColumn, "identifierColumn is null");
        this.timestampColumn = requireNonNull(timestampColumn, "timestampColumn is null");
        this.timestampEncoding = requireNonNull(timestampEncoding, "timestampEncoding is null");
        this.datePredicateStyle = requireNonNull(datePredicateStyle, "datePredicateStyle is null");
        this.dateColumn = requireNonNull(dateColumn, "dateColumn is null");
        checkArgument(datePredicateStyle != DatePredicateStyle.DATE_COLUMN || dateColumn.isPresent(),
                "dateColumn is required for %s", datePredicateStyle);
        this.explicitGroupingRequired = explicitGroupingRequired;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getIdentifierColumn() {
        return identifierColumn;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public TimestampEncoding getTimestampEncoding() {
        return timestampEncoding;
    }

    public DatePredicateStyle getDatePredicateStyle() {
        return datePredicateStyle;
    }

    public Optional<String> getDateColumn() {
        return dateColumn;
    }

    /**
     * Whether an aggregate without grouping keys must still be written with an explicit group-by-all directive.
     */
    public boolean isExplicitGroupingRequired() {
        return explicitGroupingRequired;
    }

    public SchemaDescriptor withTimestampColumn(String timestampColumn) {
        return new SchemaDescriptor(name, identifierColumn, timestampColumn, timestampEncoding,
                datePredicateStyle, dateColumn, explicitGroupingRequired);
    }

    /**
     * The timestamp of an event row as a timestamp value, decoded from the stored representation.
     */
    public Expression timestampValue() {
        ColumnReference column = column(timestampColumn);
        switch (timestampEncoding) {
            case TIMESTAMP:
                return column;
            case EPOCH_MICROS:
                return FunctionCall.timestampFromMicros(column);
            default:
                throw new IllegalStateException("Unknown timestamp encoding: " + timestampEncoding);
        }
    }

    /**
     * Inclusive date range predicate over the event rows.
     */
    public Expression datePredicate(LocalDate startDate, LocalDate endDate) {
        Expression value;
        switch (datePredicateStyle) {
            case TIMESTAMP_DATE:
                value = FunctionCall.dateOf(timestampValue());
                break;
            case DATE_COLUMN:
                value = column(dateColumn.get());
                break;
            default:
                throw new IllegalStateException("Unknown date predicate style: " + datePredicateStyle);
        }
        return new BetweenPredicate(value, Literal.of(startDate), Literal.of(endDate));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaDescriptor)) {
            return false;
        }
        SchemaDescriptor that = (SchemaDescriptor) o;
        return explicitGroupingRequired == that.explicitGroupingRequired &&
                name.equals(that.name) &&
                identifierColumn.equals(that.identifierColumn) &&
                timestampColumn.equals(that.timestampColumn) &&
                timestampEncoding == that.timestampEncoding &&
                datePredicateStyle == that.datePredicateStyle &&
                dateColumn.equals(that.dateColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, identifierColumn, timestampColumn, timestampEncoding, datePredicateStyle, dateColumn, explicitGroupingRequired);
    }

    @Override
    public String toString() {
        return "SchemaDescriptor{" +
                "name='" + name + '\'' +
                ", identifierColumn='" + identifierColumn + '\'' +
                ", timestampColumn='" + timestampColumn + '\'' +
                ", timestampEncoding=" + timestampEncoding +
                ", datePredicateStyle=" + datePredicateStyle +
                ", dateColumn=" + dateColumn +
                '}';
    }

    public static class Builder {
        private final String name;
        private String identifierColumn;
        private String timestampColumn;
        private TimestampEncoding timestampEncoding = TimestampEncoding.TIMESTAMP;
        private DatePredicateStyle datePredicateStyle = DatePredicateStyle.TIMESTAMP_DATE;
        private String dateColumn;
        private boolean explicitGroupingRequired;

        private Builder(String name) {
            this.name = name;
        }

        public Builder setIdentifierColumn(String identifierColumn) {
            this.identifierColumn = identifierColumn;
            return this;
        }

        public Builder setTimestampColumn(String timestampColumn) {
            this.timestampColumn = timestampColumn;
            return this;
        }

        public Builder setTimestampEncoding(TimestampEncoding timestampEncoding) {
            this.timestampEncoding = timestampEncoding;
            return this;
        }

        public Builder setDatePredicateStyle(DatePredicateStyle datePredicateStyle) {
            this.datePredicateStyle = datePredicateStyle;
            return this;
        }

        public Builder setDateColumn(String dateColumn) {
            this.dateColumn = dateColumn;
            return this;
        }

        public Builder setExplicitGroupingRequired(boolean explicitGroupingRequired) {
            this.explicitGroupingRequired = explicitGroupingRequired;
            return this;
        }

        public SchemaDescriptor build() {
            return new SchemaDescriptor(name, identifierColumn, timestampColumn, timestampEncoding,
                    datePredicateStyle, Optional.ofNullable(dateColumn), explicitGroupingRequired);
        }
    }
}
