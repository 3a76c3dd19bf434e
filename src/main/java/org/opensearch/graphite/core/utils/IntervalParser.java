/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.core.utils;

import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;

/**
 * Parser for Graphite relative time intervals such as {@code 5min}, {@code -7d} or {@code 1h30min}.
 *
 * <p>An interval is an optional sign followed by one or more {@code <number><unit>} pairs. Months are 30 days
 * and years 365 days. A missing sign takes the caller supplied default sign.</p>
 */
public final class IntervalParser {

    private IntervalParser() {
        // Utility class
    }

    /**
     * Parse an interval into seconds.
     *
     * @param interval interval text
     * @param defaultSign sign applied when the text has none, {@code 1} or {@code -1}
     * @return signed number of seconds
     * @throws GraphiteFunctionException with {@link ErrorKind#BAD_TYPE} for an unknown unit or malformed number
     */
    public static long parseSeconds(String interval, int defaultSign) {
        if (interval == null || interval.isEmpty()) {
            throw GraphiteFunctionException.of(ErrorKind.BAD_TYPE, "empty interval");
        }
        String s = interval.trim();
        int sign = defaultSign;
        if (s.charAt(0) == '-') {
            sign = -1;
            s = s.substring(1);
        } else if (s.charAt(0) == '+') {
            sign = 1;
            s = s.substring(1);
        }
        if (s.isEmpty()) {
            throw GraphiteFunctionException.of(ErrorKind.BAD_TYPE, "empty interval");
        }

        long total = 0;
        int pos = 0;
        while (pos < s.length()) {
            int numberStart = pos;
            while (pos < s.length() && Character.isDigit(s.charAt(pos))) {
                pos++;
            }
            String number = s.substring(numberStart, pos);
            int unitStart = pos;
            while (pos < s.length() && !Character.isDigit(s.charAt(pos))) {
                pos++;
            }
            String unit = s.substring(unitStart, pos);
            if (number.isEmpty()) {
                throw GraphiteFunctionException.of(ErrorKind.BAD_TYPE, "invalid interval " + interval);
            }
            total += sign * Long.parseLong(number) * unitSeconds(unit, interval);
        }
        return total;
    }

    private static long unitSeconds(String unit, String interval) {
        switch (unit) {
            case "":
            case "s":
            case "sec":
            case "secs":
            case "second":
            case "seconds":
                return 1;
            case "m":
            case "min":
            case "mins":
            case "minute":
            case "minutes":
                return 60;
            case "h":
            case "hour":
            case "hours":
                return 3600;
            case "d":
            case "day":
            case "days":
                return 86400;
            case "w":
            case "week":
            case "weeks":
                return 7 * 86400;
            case "mon":
            case "month":
            case "months":
                return 30 * 86400;
            case "y":
            case "year":
            case "years":
                return 365 * 86400;
            default:
                throw new GraphiteFunctionException(ErrorKind.BAD_TYPE, "unknown time units: " + unit + " in " + interval);
        }
    }
}
