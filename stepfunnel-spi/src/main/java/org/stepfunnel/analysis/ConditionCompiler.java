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
import org.stepfunnel.plan.ColumnReference;
import org.stepfunnel.plan.ComparisonExpression;
import org.stepfunnel.plan.Expression;
import org.stepfunnel.plan.InListExpression;
import org.stepfunnel.plan.LikePredicate;
import org.stepfunnel.plan.Literal;
import org.stepfunnel.plan.LogicalAnd;
import org.stepfunnel.util.InvalidFunnelSpecException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static org.stepfunnel.plan.ColumnReference.column;

/**
 * Turns field to value maps into predicates over the event rows.
 *
 * <p>A list value becomes a membership test, a string containing {@value #WILDCARD} becomes a pattern match
 * and any other scalar becomes an equality test. Field names are opaque column references.
 */
public final class ConditionCompiler {
    public static final char WILDCARD = '%';
    public static final String EVENT_NAME_COLUMN = "event_name";

    private ConditionCompiler() {
    }

    public static Expression compile(String field, Object value) {
        if (field == null || field.trim().isEmpty()) {
            throw new InvalidFunnelSpecException("Filter field name is empty");
        }
        ColumnReference column = column(field);

        if (value instanceof List) {
            List<?> values = (List<?>) value;
            if (values.isEmpty()) {
                throw new InvalidFunnelSpecException(format("Value list of field '%s' is empty", field));
            }
            ImmutableList.Builder<Expression> literals = ImmutableList.builder();
            for (Object item : values) {
                literals.add(toLiteral(field, item));
            }
            return new InListExpression(column, literals.build());
        }

        Literal literal = toLiteral(field, value);
        if (value instanceof String && ((String) value).indexOf(WILDCARD) > -1) {
            return new LikePredicate(column, literal);
        }
        return ComparisonExpression.equal(column, literal);
    }

    /**
     * Conjunction of the predicates of every entry, in the iteration order of the map.
     * An empty map has no predicate.
     */
    public static Optional<Expression> compile(Map<String, ?> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return Optional.empty();
        }
        ImmutableList.Builder<Expression> terms = ImmutableList.builder();
        for (Map.Entry<String, ?> entry : conditions.entrySet()) {
            terms.add(compile(entry.getKey(), entry.getValue()));
        }
        return LogicalAnd.and(terms.build());
    }

    /**
     * The rows of one funnel step: the event name matches and every parameter filter holds.
     */
    public static Expression compileEvent(EventSpec event) {
        Expression name = ComparisonExpression.equal(column(EVENT_NAME_COLUMN), Literal.of(event.getName()));
        return compile(event.getParams())
                .map(params -> LogicalAnd.and(name, params))
                .orElse(name);
    }

    private static Literal toLiteral(String field, Object value) {
        if (value == null) {
            throw new InvalidFunnelSpecException(format("Value of field '%s' is null", field));
        }
        if (value instanceof String || value instanceof Boolean) {
            return Literal.of(value);
        }
        if (value instanceof Number) {
            Number number = (Number) value;
            if (value instanceof Double || value instanceof Float) {
                return Literal.of(number.doubleValue());
            }
            if (value instanceof BigDecimal) {
                double doubleValue = number.doubleValue();
                if (Double.isInfinite(doubleValue) || BigDecimal.valueOf(doubleValue).compareTo((BigDecimal) value) != 0) {
                    throw new InvalidFunnelSpecException(format("Value of field '%s' is not representable as a double: %s", field, value));
                }
                return Literal.of(doubleValue);
            }
            if (value instanceof BigInteger && ((BigInteger) value).bitLength() > 63) {
                throw new InvalidFunnelSpecException(format("Value of field '%s' is out of the 64-bit integer range: %s", field, value));
            }
            return Literal.of(number.longValue());
        }
        throw new InvalidFunnelSpecException(format("Value of field '%s' must be a string, number or boolean: %s", field, value));
    }
}
