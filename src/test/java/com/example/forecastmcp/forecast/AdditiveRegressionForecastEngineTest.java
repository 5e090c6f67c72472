package com.example.forecastmcp.forecast;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AdditiveRegressionForecastEngineTest {

    private final AdditiveRegressionForecastEngine engine = new AdditiveRegressionForecastEngine(0.8);

    private static List<LocalDateTime> days(LocalDate start, int count) {
        List<LocalDateTime> ds = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ds.add(start.plusDays(i).atStartOfDay());
        }
        return ds;
    }

    @Nested
    class ShortSeries {

        @Test
        void threePointsProduceHistoryPlusHorizon() throws Exception {
            ForecastResult result = engine.forecast(new ForecastRequest(
                    days(LocalDate.of(2021, 1, 1), 3), List.of(1.0, 2.0, 3.0), 2));

            assertThat(result.meta()).isEqualTo(new ForecastResult.Meta(2, 3,
                    "2021-01-01T00:00:00", "2021-01-03T00:00:00"));
            assertThat(result.forecast()).extracting(ForecastResult.Point::ds).containsExactly(
                    "2021-01-01T00:00:00", "2021-01-02T00:00:00", "2021-01-03T00:00:00",
                    "2021-01-04T00:00:00", "2021-01-05T00:00:00");
            assertThat(result.forecast().get(3).yhat()).isCloseTo(4.0, within(1e-6));
            assertThat(result.forecast().get(4).yhat()).isCloseTo(5.0, within(1e-6));
        }

        @Test
        void unsortedInputIsReturnedChronologically() throws Exception {
            List<LocalDateTime> ds = List.of(
                    LocalDateTime.of(2021, 1, 3, 0, 0),
                    LocalDateTime.of(2021, 1, 1, 0, 0),
                    LocalDateTime.of(2021, 1, 2, 0, 0));

            ForecastResult result = engine.forecast(new ForecastRequest(ds, List.of(30.0, 10.0, 20.0), 1));

            assertThat(result.forecast()).extracting(ForecastResult.Point::ds).isSorted();
            assertThat(result.meta().start()).isEqualTo("2021-01-01T00:00:00");
            assertThat(result.meta().end()).isEqualTo("2021-01-03T00:00:00");
            assertThat(result.forecast().get(3).yhat()).isCloseTo(40.0, within(1e-6));
        }

        @Test
        void duplicateTimestampsCollapseToOneRow() throws Exception {
            List<LocalDateTime> ds = List.of(
                    LocalDateTime.of(2021, 1, 1, 0, 0),
                    LocalDateTime.of(2021, 1, 1, 0, 0),
                    LocalDateTime.of(2021, 1, 2, 0, 0));

            ForecastResult result = engine.forecast(new ForecastRequest(ds, List.of(1.0, 3.0, 4.0), 1));

            assertThat(result.meta().nHistory()).isEqualTo(3);
            assertThat(result.forecast()).hasSize(3);
        }

        @Test
        void singleTimestampCannotBeFitted() {
            List<LocalDateTime> ds = List.of(LocalDateTime.of(2021, 1, 1, 0, 0));

            assertThatThrownBy(() -> engine.forecast(new ForecastRequest(ds, List.of(1.0), 3)))
                    .isInstanceOf(ForecastException.class)
                    .hasMessageContaining("At least 2 distinct");
        }
    }

    @Nested
    class LongerSeries {

        @Test
        void linearTrendIsExtrapolated() throws Exception {
            List<LocalDateTime> ds = days(LocalDate.of(2022, 3, 1), 30);
            List<Double> y = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                y.add(2.0 * i + 1.0);
            }

            ForecastResult result = engine.forecast(new ForecastRequest(ds, y, 5));

            assertThat(result.forecast()).hasSize(35);
            for (int k = 0; k < 5; k++) {
                assertThat(result.forecast().get(30 + k).yhat()).isCloseTo(2.0 * (30 + k) + 1.0, within(1e-6));
            }
        }

        @Test
        void bandsBracketPointEstimateAndWidenWithHorizon() throws Exception {
            List<LocalDateTime> ds = days(LocalDate.of(2022, 3, 1), 40);
            List<Double> y = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                y.add(10.0 + 0.5 * i + (i % 3 == 0 ? 1.5 : -0.75));
            }

            ForecastResult result = engine.forecast(new ForecastRequest(ds, y, 60));

            for (ForecastResult.Point point : result.forecast()) {
                assertThat(point.yhatLower()).isLessThan(point.yhat());
                assertThat(point.yhatUpper()).isGreaterThan(point.yhat());
            }
            ForecastResult.Point nearest = result.forecast().get(40);
            ForecastResult.Point farthest = result.forecast().get(99);
            assertThat(farthest.yhatUpper() - farthest.yhatLower())
                    .isGreaterThan(nearest.yhatUpper() - nearest.yhatLower());
        }

        @Test
        void weeklyPatternIsCarriedIntoTheFuture() throws Exception {
            LocalDate start = LocalDate.of(2023, 1, 2);
            List<LocalDateTime> ds = days(start, 56);
            List<Double> y = new ArrayList<>();
            for (LocalDateTime d : ds) {
                DayOfWeek dow = d.getDayOfWeek();
                y.add(dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY ? 20.0 : 10.0);
            }

            ForecastResult result = engine.forecast(new ForecastRequest(ds, y, 7));

            List<ForecastResult.Point> future = result.forecast().subList(56, 63);
            double weekendAverage = 0;
            double weekdayAverage = 0;
            for (ForecastResult.Point point : future) {
                DayOfWeek dow = LocalDateTime.parse(point.ds()).getDayOfWeek();
                if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
                    weekendAverage += point.yhat() / 2;
                } else {
                    weekdayAverage += point.yhat() / 5;
                }
            }
            assertThat(weekendAverage - weekdayAverage).isGreaterThan(5.0);
        }

        @Test
        void futureStepsFollowInferredCadence() throws Exception {
            List<LocalDateTime> ds = new ArrayList<>();
            List<Double> y = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                ds.add(LocalDateTime.of(2024, 1, 1, 0, 0).plusHours(6L * i));
                y.add((double) i);
            }

            ForecastResult result = engine.forecast(new ForecastRequest(ds, y, 2));

            assertThat(result.forecast().get(10).ds()).isEqualTo("2024-01-03T12:00:00");
            assertThat(result.forecast().get(11).ds()).isEqualTo("2024-01-03T18:00:00");
        }
    }

    @Test
    void cadenceIsMedianGap() {
        TreeSet<LocalDateTime> ds = new TreeSet<>(List.of(
                LocalDateTime.of(2021, 1, 1, 0, 0),
                LocalDateTime.of(2021, 1, 2, 0, 0),
                LocalDateTime.of(2021, 1, 3, 0, 0),
                LocalDateTime.of(2021, 1, 10, 0, 0)));

        assertThat(AdditiveRegressionForecastEngine.inferCadence(ds)).hasDays(1);
    }

    @Test
    void interruptedWorkerStopsBeforeFitting() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> engine.forecast(new ForecastRequest(
                    days(LocalDate.of(2021, 1, 1), 3), List.of(1.0, 2.0, 3.0), 2)))
                    .isInstanceOf(ForecastException.class)
                    .hasMessage("Forecast cancelled");
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void intervalWidthMustBeAProbability() {
        assertThatThrownBy(() -> new AdditiveRegressionForecastEngine(1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
