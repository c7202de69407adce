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
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.CharMatcher;
import org.stepfunnel.util.InvalidWindowFormatException;
import org.stepfunnel.util.InvalidWindowUnitException;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Maximum elapsed time, in whole seconds, allowed between a funnel step and the step right before it.
 */
public final class TimeWindow {
    public static final int SECOND = 1;
    public static final int MINUTE = 60;
    public static final int HOUR = 60 * MINUTE;
    public static final int DAY = 24 * HOUR;

    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    private final long seconds;

    private TimeWindow(long seconds) {
        checkArgument(seconds >= 0, "window must not be negative");
        this.seconds = seconds;
    }

    public static TimeWindow ofSeconds(long seconds) {
        return new TimeWindow(seconds);
    }

    /**
     * Parses durations such as {@code 45s}, {@code 30m}, {@code 24h} or {@code 7d}. The unit is case-insensitive.
     */
    @JsonCreator
    public static TimeWindow parse(String window) {
        requireNonNull(window, "window is null");
        if (window.length() < 2) {
            throw new InvalidWindowFormatException(window);
        }

        String digits = window.substring(0, window.length() - 1);
        if (!DIGITS.matchesAllOf(digits)) {
            throw new InvalidWindowFormatException(window);
        }

        char unit = window.charAt(window.length() - 1);
        long multiplier;
        switch (Character.toLowerCase(unit)) {
            case 's':
                multiplier = SECOND;
                break;
            case 'm':
                multiplier = MINUTE;
                break;
            case 'h':
                multiplier = HOUR;
                break;
            case 'd':
                multiplier = DAY;
                break;
            default:
                throw new InvalidWindowUnitException(unit);
        }

        try {
            return new TimeWindow(Math.multiplyExact(Long.parseLong(digits), multiplier));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidWindowFormatException(window);
        }
    }

    /**
     * Same as {@link #parse(String)}, used when a window is read from configuration.
     */
    public static TimeWindow valueOf(String window) {
        return parse(window);
    }

    public long getSeconds() {
        return seconds;
    }

    @JsonValue
    public String format() {
        if (seconds != 0) {
            if (seconds % DAY == 0) {
                return (seconds / DAY) + "d";
            }
            if (seconds % HOUR == 0) {
                return (seconds / HOUR) + "h";
            }
            if (seconds % MINUTE == 0) {
                return (seconds / MINUTE) + "m";
            }
        }
        return seconds + "s";
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TimeWindow && seconds == ((TimeWindow) o).seconds);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(seconds);
    }

    @Override
    public String toString() {
        return format();
    }
}
