package com.example.forecastmcp.forecast;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Additive model {@code y(t) = trend(t) + weekly(t) + yearly(t) + noise}, fitted by ordinary least squares.
 *
 * <p>The trend is linear in time scaled to {@code [0, 1]} over the history. Seasonal components are Fourier
 * series and are only switched on when the history can support them:
 * <ul>
 *   <li>weekly (up to order 3): cadence below one week and at least two weeks of history</li>
 *   <li>yearly (up to order 10): at least two years of history</li>
 * </ul>
 * The order is capped by how many samples per cycle the cadence provides.
 * Bands are regression prediction intervals, so they widen as the horizon moves away from the data.
 */
public class AdditiveRegressionForecastEngine implements ForecastEngine {
    private static final Logger log = LoggerFactory.getLogger(AdditiveRegressionForecastEngine.class);

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final int WEEKLY_ORDER = 3;
    private static final int YEARLY_ORDER = 10;
    private static final double WEEK_DAYS = 7.0;
    private static final double YEAR_DAYS = 365.25;
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final double z;

    public AdditiveRegressionForecastEngine(double intervalWidth) {
        if (!(intervalWidth > 0.0 && intervalWidth < 1.0)) {
            throw new IllegalArgumentException("intervalWidth must be in (0, 1): " + intervalWidth);
        }
        this.z = new NormalDistribution(0.0, 1.0).inverseCumulativeProbability(0.5 + intervalWidth / 2.0);
    }

    @Override
    public ForecastResult forecast(ForecastRequest request) throws ForecastException {
        List<Observation> history = IntStream.range(0, request.ds().size())
                .mapToObj(i -> new Observation(request.ds().get(i), request.y().get(i)))
                .sorted(Comparator.comparing(Observation::ds))
                .toList();
        TreeSet<LocalDateTime> distinct = new TreeSet<>(request.ds());
        if (distinct.size() < 2) {
            throw new ForecastException("At least 2 distinct ds values are required to fit a model");
        }

        LocalDateTime first = distinct.first();
        LocalDateTime last = distinct.last();
        Duration cadence = inferCadence(distinct);
        double spanDays = seconds(first, last) / SECONDS_PER_DAY;

        Design design = chooseDesign(history.size(), cadence, spanDays);
        Basis basis = new Basis(first, seconds(first, last), design);

        double[][] x = history.stream().map(o -> basis.features(o.ds())).toArray(double[][]::new);
        double[] y = history.stream().mapToDouble(Observation::y).toArray();
        checkInterrupted();

        double[] beta;
        double[][] covariance;
        double sigma;
        try {
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            regression.newSampleData(y, x);
            beta = regression.estimateRegressionParameters();
            covariance = regression.estimateRegressionParametersVariance();
            double[] residuals = regression.estimateResiduals();
            double ssr = 0.0;
            for (double r : residuals) {
                ssr += r * r;
            }
            int dof = Math.max(y.length - beta.length, 1);
            sigma = Math.sqrt(ssr / dof);
        } catch (MathIllegalArgumentException | MathArithmeticException | MathIllegalStateException ex) {
            throw new ForecastException("Model fitting failed: " + ex.getMessage(), ex);
        }
        checkInterrupted();
        log.debug("Fitted {} rows: weeklyOrder={}, yearlyOrder={}, cadence={}, sigma={}",
                y.length, design.weeklyOrder(), design.yearlyOrder(), cadence, sigma);

        List<LocalDateTime> timeline = new ArrayList<>(distinct);
        for (int k = 1; k <= request.periods(); k++) {
            timeline.add(last.plus(cadence.multipliedBy(k)));
        }

        List<ForecastResult.Point> points = new ArrayList<>(timeline.size());
        for (LocalDateTime ds : timeline) {
            checkInterrupted();
            double[] row = withIntercept(basis.features(ds));
            double yhat = dot(row, beta);
            double spread = z * sigma * Math.sqrt(1.0 + quadraticForm(row, covariance));
            if (!Double.isFinite(yhat) || !Double.isFinite(spread)) {
                throw new ForecastException("Model produced non-finite estimates");
            }
            points.add(new ForecastResult.Point(IsoTimestamps.format(ds), yhat, yhat - spread, yhat + spread));
        }

        ForecastResult.Meta meta = new ForecastResult.Meta(request.periods(), request.ds().size(),
                IsoTimestamps.format(first), IsoTimestamps.format(last));
        return new ForecastResult(meta, List.copyOf(points));
    }

    // The OLS solver never polls the interrupt flag, so cancellation is honoured between phases
    private static void checkInterrupted() throws ForecastException {
        if (Thread.currentThread().isInterrupted()) {
            throw new ForecastException("Forecast cancelled");
        }
    }

    // Median positive gap between consecutive distinct timestamps
    static Duration inferCadence(TreeSet<LocalDateTime> distinct) {
        List<Long> gaps = new ArrayList<>(distinct.size() - 1);
        LocalDateTime previous = null;
        for (LocalDateTime ds : distinct) {
            if (previous != null) {
                gaps.add(Duration.between(previous, ds).getSeconds());
            }
            previous = ds;
        }
        gaps.sort(Comparator.naturalOrder());
        return Duration.ofSeconds(gaps.get(gaps.size() / 2));
    }

    private Design chooseDesign(int rows, Duration cadence, double spanDays) {
        double cadenceDays = cadence.getSeconds() / SECONDS_PER_DAY;
        int weekly = cadenceDays < WEEK_DAYS && spanDays >= 2 * WEEK_DAYS
                ? fourierOrder(WEEKLY_ORDER, WEEK_DAYS, cadenceDays) : 0;
        int yearly = spanDays >= 2 * YEAR_DAYS
                ? fourierOrder(YEARLY_ORDER, YEAR_DAYS, cadenceDays) : 0;
        // intercept + trend + seasonal terms must leave at least one residual degree of freedom
        if (yearly > 0 && rows < 3 + 2 * (yearly + weekly)) {
            yearly = 0;
        }
        if (weekly > 0 && rows < 3 + 2 * weekly) {
            weekly = 0;
        }
        return new Design(weekly, yearly);
    }

    // A cycle sampled s times can carry at most (s - 1) / 2 harmonics
    private static int fourierOrder(int maxOrder, double periodDays, double cadenceDays) {
        int supported = (int) Math.floor((periodDays / cadenceDays - 1.0) / 2.0);
        return Math.max(0, Math.min(maxOrder, supported));
    }

    private static double seconds(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).getSeconds();
    }

    private static double[] withIntercept(double[] features) {
        double[] row = new double[features.length + 1];
        row[0] = 1.0;
        System.arraycopy(features, 0, row, 1, features.length);
        return row;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static double quadraticForm(double[] v, double[][] m) {
        double sum = 0.0;
        for (int i = 0; i < v.length; i++) {
            for (int j = 0; j < v.length; j++) {
                sum += v[i] * m[i][j] * v[j];
            }
        }
        return sum;
    }

    private record Observation(LocalDateTime ds, double y) {
    }

    private record Design(int weeklyOrder, int yearlyOrder) {
    }

    private static final class Basis {
        private final LocalDateTime origin;
        private final double spanSeconds;
        private final Design design;

        Basis(LocalDateTime origin, double spanSeconds, Design design) {
            this.origin = origin;
            this.spanSeconds = spanSeconds;
            this.design = design;
        }

        double[] features(LocalDateTime ds) {
            double elapsed = seconds(origin, ds);
            double days = elapsed / SECONDS_PER_DAY;
            List<Double> row = new ArrayList<>();
            row.add(elapsed / spanSeconds);
            addFourier(row, days, WEEK_DAYS, design.weeklyOrder());
            addFourier(row, days, YEAR_DAYS, design.yearlyOrder());
            return row.stream().mapToDouble(Double::doubleValue).toArray();
        }

        private static void addFourier(List<Double> row, double days, double period, int order) {
            for (int k = 1; k <= order; k++) {
                double angle = 2.0 * Math.PI * k * days / period;
                row.add(Math.sin(angle));
                row.add(Math.cos(angle));
            }
        }
    }
}
