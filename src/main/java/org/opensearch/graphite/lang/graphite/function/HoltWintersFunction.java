/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lang.graphite.function;

import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.core.model.MetricRequest;
import org.opensearch.graphite.lang.graphite.expr.Expr;
import org.opensearch.graphite.query.forecast.HoltWintersModel;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionRegistration;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holt-Winters family: {@code holtWintersForecast}, {@code holtWintersConfidenceBands},
 * {@code holtWintersAberration} and {@code holtWintersConfidenceArea}.
 *
 * <p>The series is read from {@code from - bootstrapInterval} so the model is warmed up when the requested window
 * starts; the bootstrap part is dropped from every output. {@code holtWintersConfidenceArea} needs a graph
 * renderer and fails with {@link ErrorKind#UNSUPPORTED_BUILD}.</p>
 */
public class HoltWintersFunction implements GraphiteFunction {

    public static final String FORECAST = "holtWintersForecast";
    public static final String CONFIDENCE_BANDS = "holtWintersConfidenceBands";
    public static final String ABERRATION = "holtWintersAberration";
    public static final String CONFIDENCE_AREA = "holtWintersConfidenceArea";

    static final String LOWER = "holtWintersConfidenceLower";
    static final String UPPER = "holtWintersConfidenceUpper";

    private static final double DEFAULT_DELTA = 3;

    public static FunctionRegistration registration() {
        return FunctionRegistration.registered(new HoltWintersFunction(), FORECAST, CONFIDENCE_BANDS, ABERRATION, CONFIDENCE_AREA);
    }

    @Override
    public List<MetricData> evaluate(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        String target = expr.target();
        if (CONFIDENCE_AREA.equals(target)) {
            throw GraphiteFunctionException.of(ErrorKind.UNSUPPORTED_BUILD, CONFIDENCE_AREA + " requires a graph renderer");
        }
        boolean forecast = FORECAST.equals(target);
        int bootstrapPosition = forecast ? 1 : 2;
        long bootstrap = expr.intervalNamedOrPosArgDefault("bootstrapInterval", bootstrapPosition, 1, Expr.DEFAULT_BOOTSTRAP_INTERVAL);
        long seasonality = expr.intervalNamedOrPosArgDefault("seasonality", bootstrapPosition + 1, 1, HoltWintersModel.DEFAULT_SEASONALITY);
        double delta = forecast ? DEFAULT_DELTA : expr.floatNamedOrPosArgDefault("delta", 1, DEFAULT_DELTA);

        List<MetricData> args = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from - bootstrap, until, values);
        List<MetricData> result = new ArrayList<>(forecast ? args.size() : args.size() * 2);
        for (MetricData series : args) {
            int skip = (int) (bootstrap / series.getStepTime());
            double[] samples = series.valuesWithNaN();
            switch (target) {
                case FORECAST: {
                    double[] predictions = HoltWintersModel.analyze(samples, series.getStepTime(), seasonality).predictions();
                    result.add(derive(series, FORECAST, dropBootstrap(predictions, skip), skip));
                    break;
                }
                case CONFIDENCE_BANDS: {
                    HoltWintersModel.Bands bands = HoltWintersModel.confidenceBands(samples, series.getStepTime(), seasonality, delta);
                    result.add(derive(series, LOWER, dropBootstrap(bands.lower(), skip), skip).toBuilder().tag(LOWER, "1").build());
                    result.add(derive(series, UPPER, dropBootstrap(bands.upper(), skip), skip).toBuilder().tag(UPPER, "1").build());
                    break;
                }
                case ABERRATION: {
                    HoltWintersModel.Bands bands = HoltWintersModel.confidenceBands(samples, series.getStepTime(), seasonality, delta);
                    double[] aberration = aberration(samples, bands, skip);
                    result.add(derive(series, ABERRATION, aberration, skip).toBuilder().tag(ABERRATION, "1").build());
                    break;
                }
                default:
                    throw GraphiteFunctionException.of(ErrorKind.UNKNOWN_FUNCTION, target);
            }
        }
        return result;
    }

    /**
     * Excess of every post-bootstrap sample over the upper band, or its shortfall below the lower band, else 0.
     */
    static double[] aberration(double[] samples, HoltWintersModel.Bands bands, int skip) {
        if (samples.length <= skip) {
            return new double[0];
        }
        double[] out = new double[samples.length - skip];
        for (int i = 0; i < out.length; i++) {
            double v = samples[i + skip];
            double upper = bands.upper()[i + skip];
            double lower = bands.lower()[i + skip];
            if (Double.isNaN(v)) {
                out[i] = 0;
            } else if (!Double.isNaN(upper) && v > upper) {
                out[i] = v - upper;
            } else if (!Double.isNaN(lower) && v < lower) {
                out[i] = v - lower;
            } else {
                out[i] = 0;
            }
        }
        return out;
    }

    private static double[] dropBootstrap(double[] values, int skip) {
        return values.length <= skip ? new double[0] : Arrays.copyOfRange(values, skip, values.length);
    }

    /**
     * Renames {@code series} and moves its start past the {@code skip} points actually dropped.
     */
    private static MetricData derive(MetricData series, String function, double[] values, int skip) {
        String name = function + "(" + series.getName() + ")";
        long step = series.getStepTime();
        long start = series.getStartTime() + (long) Math.min(skip, series.size()) * step;
        return series.toBuilder()
            .name(name)
            .pathExpression(name)
            .startTime(start)
            .stopTime(start + values.length * step)
            .values(values)
            .build();
    }

    @Override
    public Map<String, FunctionDescription> description() {
        Map<String, FunctionDescription> result = new LinkedHashMap<>();
        result.put(
            FORECAST,
            FunctionDescription.builder(FORECAST, "holtWintersForecast(seriesList, bootstrapInterval='7d', seasonality='1d')")
                .description(
                    "Performs a Holt-Winters forecast using the series as input data. Data from bootstrapInterval "
                        + "(one week by default) previous to the series is used to bootstrap the initial forecast."
                )
                .group("Calculate")
                .param(FunctionParam.seriesList())
                .param(bootstrapParam())
                .param(seasonalityParam())
                .nameChange()
                .valuesChange()
                .build()
        );
        result.put(
            CONFIDENCE_BANDS,
            withDelta(CONFIDENCE_BANDS)
                .description(
                    "Performs a Holt-Winters forecast using the series as input data and plots upper and lower bands "
                        + "with the predicted forecast deviations."
                )
                .build()
        );
        result.put(
            ABERRATION,
            withDelta(ABERRATION)
                .description(
                    "Performs a Holt-Winters forecast using the series as input data and plots the positive or negative "
                        + "deviation of the series data from the forecast."
                )
                .build()
        );
        result.put(
            CONFIDENCE_AREA,
            withDelta(CONFIDENCE_AREA)
                .description(
                    "Performs a Holt-Winters forecast using the series as input data and plots the area between the "
                        + "upper and lower bands of the predicted forecast deviations."
                )
                .build()
        );
        return result;
    }

    private static FunctionDescription.Builder withDelta(String name) {
        return FunctionDescription.builder(name, name + "(seriesList, delta=3, bootstrapInterval='7d', seasonality='1d')")
            .group("Calculate")
            .param(FunctionParam.seriesList())
            .param(FunctionParam.of("delta", FunctionType.INTEGER).defaultValue(3))
            .param(bootstrapParam())
            .param(seasonalityParam())
            .nameChange()
            .valuesChange();
    }

    private static FunctionParam bootstrapParam() {
        return FunctionParam.of("bootstrapInterval", FunctionType.INTERVAL).defaultValue("7d").suggestions("7d", "30d");
    }

    private static FunctionParam seasonalityParam() {
        return FunctionParam.of("seasonality", FunctionType.INTERVAL).defaultValue("1d").suggestions("1d", "7d");
    }
}
