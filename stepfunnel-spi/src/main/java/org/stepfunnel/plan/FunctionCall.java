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
package org.stepfunnel.plan;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Call of a scalar function. The set of functions is closed and dialect neutral; each dialect formatter
 * decides how a function is spelled.
 */
public final class FunctionCall
        extends Expression {
    public enum Function {
        /**
         * Calendar date (UTC) of a timestamp.
         */
        DATE_OF(1),
        /**
         * Timestamp from an integer count of microseconds since the epoch.
         */
        TIMESTAMP_FROM_MICROS(1),
        /**
         * Whole seconds elapsed from the second argument to the first.
         */
        TIMESTAMP_DIFF_SECONDS(2);

        private final int arity;

        Function(int arity) {
            this.arity = arity;
        }

        public int getArity() {
            return arity;
        }
    }

    private final Function function;
    private final List<Expression> arguments;

    public FunctionCall(Function function, List<Expression> arguments) {
        this.function = requireNonNull(function, "function is null");
        requireNonNull(arguments, "arguments is null");
        checkArgument(arguments.size() == function.getArity(), "%s expects %s arguments", function, function.getArity());
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public static FunctionCall dateOf(Expression timestamp) {
        return new FunctionCall(Function.DATE_OF, ImmutableList.of(timestamp));
    }

    public static FunctionCall timestampFromMicros(Expression micros) {
        return new FunctionCall(Function.TIMESTAMP_FROM_MICROS, ImmutableList.of(micros));
    }

    public static FunctionCall timestampDiffSeconds(Expression end, Expression start) {
        return new FunctionCall(Function.TIMESTAMP_DIFF_SECONDS, ImmutableList.of(end, start));
    }

    public Function getFunction() {
        return function;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(PlanVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCall(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunctionCall)) {
            return false;
        }
        FunctionCall that = (FunctionCall) o;
        return function == that.function && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, arguments);
    }

    @Override
    public String toString() {
        return function.name() + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
