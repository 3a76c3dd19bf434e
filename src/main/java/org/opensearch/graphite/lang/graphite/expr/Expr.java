/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.expr;

import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.core.model.MetricRequest;
import org.opensearch.graphite.core.utils.IntervalParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable node of a parsed Graphite target expression.
 *
 * <p>A node is a metric name, a function call, or a literal. Function calls keep their positional arguments, their
 * named arguments and the raw argument text used to name result series, e.g. {@code sumSeries(a.*,b)} has the raw
 * arguments {@code a.*,b}.</p>
 *
 * <h2>Argument extraction:</h2>
 * <p>The typed getters check arity and type and raise a {@link GraphiteFunctionException} with
 * {@link ErrorKind#MISSING_ARGUMENT} when a required argument is absent and {@link ErrorKind#BAD_TYPE} when it has
 * the wrong kind. {@code *NamedOrPosArgDefault} getters look up the named argument first, then the positional one,
 * then fall back to the default.</p>
 */
public final class Expr {

    public static final long DEFAULT_BOOTSTRAP_INTERVAL = 7 * 86400L;

    private final ExprType type;
    private final String target;
    private final double value;
    private final String stringValue;
    private final List<Expr> args;
    private final Map<String, Expr> namedArgs;
    private final String rawArgs;

    private Expr(
        ExprType type,
        String target,
        double value,
        String stringValue,
        List<Expr> args,
        Map<String, Expr> namedArgs,
        String rawArgs
    ) {
        this.type = type;
        this.target = target;
        this.value = value;
        this.stringValue = stringValue;
        this.args = args;
        this.namedArgs = namedArgs;
        this.rawArgs = rawArgs;
    }

    /**
     * A metric name or glob pattern.
     */
    public static Expr name(String metric) {
        Objects.requireNonNull(metric, "metric cannot be null");
        return new Expr(ExprType.NAME, metric, 0, null, List.of(), Map.of(), null);
    }

    public static Expr constant(double value) {
        return new Expr(ExprType.CONST, null, value, formatConstant(value), List.of(), Map.of(), null);
    }

    public static Expr string(String value) {
        Objects.requireNonNull(value, "value cannot be null");
        return new Expr(ExprType.STRING, null, 0, value, List.of(), Map.of(), null);
    }

    public static Expr bool(boolean value) {
        return new Expr(ExprType.BOOL, null, value ? 1 : 0, Boolean.toString(value), List.of(), Map.of(), null);
    }

    /**
     * A function call with positional arguments only; the raw arguments are rendered from them.
     */
    public static Expr func(String name, Expr... args) {
        return func(name, List.of(args), Map.of());
    }

    /**
     * A function call; the raw arguments are rendered from the positional and named arguments.
     */
    public static Expr func(String name, List<Expr> args, Map<String, Expr> namedArgs) {
        List<String> rendered = new ArrayList<>(args.size() + namedArgs.size());
        for (Expr arg : args) {
            rendered.add(arg.toString());
        }
        for (Map.Entry<String, Expr> named : namedArgs.entrySet()) {
            rendered.add(named.getKey() + "=" + named.getValue());
        }
        return func(name, args, namedArgs, String.join(",", rendered));
    }

    /**
     * A function call with explicit raw argument text, as produced by a parser.
     */
    public static Expr func(String name, List<Expr> args, Map<String, Expr> namedArgs, String rawArgs) {
        Objects.requireNonNull(name, "function name cannot be null");
        return new Expr(
            ExprType.FUNC,
            name,
            0,
            null,
            List.copyOf(args),
            Collections.unmodifiableMap(new LinkedHashMap<>(namedArgs)),
            Objects.requireNonNull(rawArgs, "rawArgs cannot be null")
        );
    }

    public ExprType type() {
        return type;
    }

    public boolean isName() {
        return type == ExprType.NAME;
    }

    public boolean isFunc() {
        return type == ExprType.FUNC;
    }

    public boolean isConst() {
        return type == ExprType.CONST;
    }

    public boolean isString() {
        return type == ExprType.STRING;
    }

    public boolean isBool() {
        return type == ExprType.BOOL;
    }

    /**
     * @return the metric pattern for names, the function name for calls, {@code null} otherwise
     */
    public String target() {
        return target;
    }

    public double floatValue() {
        return value;
    }

    public String stringValue() {
        return stringValue;
    }

    public List<Expr> args() {
        return args;
    }

    public Expr arg(int index) {
        return args.get(index);
    }

    public int argsLength() {
        return args.size();
    }

    public Map<String, Expr> namedArgs() {
        return namedArgs;
    }

    public Expr namedArg(String name) {
        return namedArgs.get(name);
    }

    public String rawArgs() {
        return rawArgs;
    }

    /**
     * @return a copy of this call whose result names use {@code newRawArgs}
     */
    public Expr withRawArgs(String newRawArgs) {
        if (type != ExprType.FUNC) {
            throw new IllegalStateException("raw arguments only exist on function calls, got " + type);
        }
        return new Expr(type, target, value, stringValue, args, namedArgs, Objects.requireNonNull(newRawArgs));
    }

    // ---- typed argument getters ----

    public String stringArg(int n) {
        return asString(positional(n));
    }

    /**
     * Every positional argument from {@code n} on as a string; at least one is required.
     */
    public List<String> stringArgs(int n) {
        positional(n);
        List<String> result = new ArrayList<>(args.size() - n);
        for (int i = n; i < args.size(); i++) {
            result.add(asString(args.get(i)));
        }
        return result;
    }

    public String stringArgDefault(int n, String defaultValue) {
        return args.size() <= n ? defaultValue : asString(args.get(n));
    }

    public String stringNamedOrPosArgDefault(String key, int n, String defaultValue) {
        Expr named = namedArgs.get(key);
        return named != null ? asString(named) : stringArgDefault(n, defaultValue);
    }

    public double floatArg(int n) {
        return asFloat(positional(n));
    }

    public double floatArgDefault(int n, double defaultValue) {
        return args.size() <= n ? defaultValue : asFloat(args.get(n));
    }

    public double floatNamedOrPosArgDefault(String key, int n, double defaultValue) {
        Expr named = namedArgs.get(key);
        return named != null ? asFloat(named) : floatArgDefault(n, defaultValue);
    }

    public int intArg(int n) {
        return asInt(positional(n));
    }

    /**
     * Every positional argument from {@code n} on as an integer; an empty tail is allowed.
     */
    public List<Integer> intArgs(int n) {
        if (args.size() < n) {
            throw new GraphiteFunctionException(ErrorKind.MISSING_ARGUMENT, "missing argument " + n + " of " + target);
        }
        List<Integer> result = new ArrayList<>(args.size() - n);
        for (int i = n; i < args.size(); i++) {
            result.add(asInt(args.get(i)));
        }
        return result;
    }

    public int intArgDefault(int n, int defaultValue) {
        return args.size() <= n ? defaultValue : asInt(args.get(n));
    }

    public int intNamedOrPosArgDefault(String key, int n, int defaultValue) {
        Expr named = namedArgs.get(key);
        return named != null ? asInt(named) : intArgDefault(n, defaultValue);
    }

    public boolean boolArgDefault(int n, boolean defaultValue) {
        return args.size() <= n ? defaultValue : asBool(args.get(n));
    }

    public boolean boolNamedOrPosArgDefault(String key, int n, boolean defaultValue) {
        Expr named = namedArgs.get(key);
        return named != null ? asBool(named) : boolArgDefault(n, defaultValue);
    }

    /**
     * Interval argument in seconds.
     *
     * @param n position
     * @param defaultSign sign applied when the interval has none
     */
    public long intervalArg(int n, int defaultSign) {
        return parseInterval(asString(positional(n)), defaultSign);
    }

    public long intervalNamedOrPosArgDefault(String key, int n, int defaultSign, long defaultValue) {
        Expr named = namedArgs.get(key);
        if (named != null) {
            return parseInterval(asString(named), defaultSign);
        }
        if (args.size() <= n) {
            return defaultValue;
        }
        return parseInterval(asString(args.get(n)), defaultSign);
    }

    /**
     * Node indices or tag names starting at position {@code n}.
     *
     * @param n first position
     * @param single read exactly one argument, which is then required
     */
    public List<NodeOrTag> nodeOrTagArgs(int n, boolean single) {
        if ((single && args.size() <= n) || args.size() < n) {
            throw new GraphiteFunctionException(ErrorKind.MISSING_ARGUMENT, "missing argument " + n + " of " + target);
        }
        int until = single ? n + 1 : args.size();
        List<NodeOrTag> result = new ArrayList<>(until - n);
        for (int i = n; i < until; i++) {
            Expr arg = args.get(i);
            if (arg.isConst()) {
                result.add(NodeOrTag.ofNode((int) arg.value));
            } else if (arg.isString()) {
                result.add(NodeOrTag.ofTag(arg.stringValue));
            } else {
                throw badType(arg, "node or tag");
            }
        }
        return result;
    }

    /**
     * Leaf metric requests needed to evaluate this expression over {@code [from, until)}.
     *
     * <p>Functions that read outside the requested window widen their leaf windows: {@code timeShift} moves them by
     * its offset, moving window functions with an interval window and the Holt-Winters family extend them back.</p>
     */
    public List<MetricRequest> metrics(long from, long until) {
        switch (type) {
            case NAME:
                return List.of(new MetricRequest(target, from, until));
            case FUNC:
                break;
            default:
                return List.of();
        }

        List<MetricRequest> result = new ArrayList<>();
        for (Expr arg : args) {
            result.addAll(arg.metrics(from, until));
        }

        switch (target) {
            case "timeShift": {
                long offset = intervalArg(1, -1);
                return result.stream().map(r -> r.shift(offset)).collect(Collectors.toList());
            }
            case "movingAverage":
            case "movingSum":
            case "movingMin":
            case "movingMax":
            case "movingMedian":
            case "exponentialMovingAverage":
            case "ewma": {
                if (args.size() < 2 || !args.get(1).isString()) {
                    return result;
                }
                long window = intervalArg(1, 1);
                return result.stream().map(r -> new MetricRequest(r.pattern(), r.from() - window, r.until())).collect(Collectors.toList());
            }
            case "holtWintersForecast":
            case "holtWintersConfidenceBands":
            case "holtWintersConfidenceArea":
            case "holtWintersAberration": {
                int position = "holtWintersForecast".equals(target) ? 1 : 2;
                long bootstrap = intervalNamedOrPosArgDefault("bootstrapInterval", position, 1, DEFAULT_BOOTSTRAP_INTERVAL);
                return result.stream()
                    .map(r -> new MetricRequest(r.pattern(), r.from() - bootstrap, r.until()))
                    .collect(Collectors.toList());
            }
            default:
                return result;
        }
    }

    private Expr positional(int n) {
        if (args.size() <= n) {
            throw new GraphiteFunctionException(ErrorKind.MISSING_ARGUMENT, "missing argument " + n + " of " + target);
        }
        return args.get(n);
    }

    private static String asString(Expr arg) {
        if (!arg.isString()) {
            throw badType(arg, "string");
        }
        return arg.stringValue;
    }

    private static double asFloat(Expr arg) {
        if (!arg.isConst()) {
            throw badType(arg, "number");
        }
        return arg.value;
    }

    private static int asInt(Expr arg) {
        if (!arg.isConst()) {
            throw badType(arg, "integer");
        }
        return (int) arg.value;
    }

    private static boolean asBool(Expr arg) {
        if (arg.isBool()) {
            return arg.value != 0;
        }
        // unquoted true / false may reach us as a metric name
        if (arg.isName() && ("true".equalsIgnoreCase(arg.target) || "false".equalsIgnoreCase(arg.target))) {
            return Boolean.parseBoolean(arg.target.toLowerCase(Locale.ROOT));
        }
        throw badType(arg, "boolean");
    }

    private static long parseInterval(String interval, int defaultSign) {
        try {
            return IntervalParser.parseSeconds(interval, defaultSign);
        } catch (NumberFormatException e) {
            throw new GraphiteFunctionException(ErrorKind.BAD_TYPE, "invalid interval " + interval, e);
        }
    }

    private static GraphiteFunctionException badType(Expr arg, String expected) {
        return new GraphiteFunctionException(ErrorKind.BAD_TYPE, "bad type: expected " + expected + ", got " + arg);
    }

    private static String formatConstant(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Render back to Graphite target syntax.
     */
    @Override
    public String toString() {
        switch (type) {
            case FUNC:
                return target + "(" + rawArgs + ")";
            case CONST:
            case BOOL:
                return stringValue;
            case STRING:
                return "'" + stringValue.replace("\\", "\\\\").replace("'", "\\'") + "'";
            default:
                return target;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Expr that = (Expr) o;
        return type == that.type
            && Double.compare(that.value, value) == 0
            && Objects.equals(target, that.target)
            && Objects.equals(stringValue, that.stringValue)
            && args.equals(that.args)
            && namedArgs.equals(that.namedArgs)
            && Objects.equals(rawArgs, that.rawArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, target, value, stringValue, args, namedArgs, rawArgs);
    }
}
