package com.ospicorp.indicatormetrics.indicator.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.indicatormetrics.indicator.model.DataPoint;
import com.ospicorp.indicatormetrics.indicator.model.MetricsRecord;
import com.ospicorp.indicatormetrics.indicator.model.PointListRecord;
import com.ospicorp.indicatormetrics.indicator.model.PointListRecords;
import com.ospicorp.indicatormetrics.indicator.model.SeriesObservations;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricsCalculatorTest {

  private static SeriesObservations monthly(double... values) {
    List<DataPoint> points = new ArrayList<>();
    LocalDate start = LocalDate.of(2023, 6, 1);
    for (int i = 0; i < values.length; i++) {
      points.add(new DataPoint(start.plusMonths(i), values[i]));
    }
    return new SeriesObservations(points);
  }

  private static MetricsRecord metrics(SeriesObservations raw) {
    return MetricsCalculator.compute(Normalizer.normalize(raw)).orElseThrow();
  }

  @Test
  void seriesUsesLastTwoObservationsForMonthOverMonth() {
    var m = metrics(monthly(100, 102, 105, 107, 110, 112, 115, 117, 120, 122, 125, 127, 130));

    assertEquals(130d, m.current());
    assertEquals(127d, m.previous());
    assertEquals(3d, m.momChange(), 1e-9);
    assertEquals(3d / 127d * 100d, m.momPct(), 1e-9);
    assertEquals(LocalDate.of(2024, 6, 1), m.currentDate());
  }

  @Test
  void seriesYearAgoIsTwelfthMostRecentEntry() {
    var m = metrics(monthly(100, 102, 105, 107, 110, 112, 115, 117, 120, 122, 125, 127, 130));

    assertEquals(102d, m.yearAgo());
    assertEquals(LocalDate.of(2023, 7, 1), m.yearAgoDate());
    assertEquals(28d, m.yoyChange(), 1e-9);
    assertEquals(28d / 102d * 100d, m.yoyPct(), 1e-9);
  }

  @Test
  void seriesWithExactlyTwelveEntriesHasYearAgo() {
    var m = metrics(monthly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12));

    assertEquals(1d, m.yearAgo());
  }

  @Test
  void seriesShorterThanTwelveHasNoYearAgo() {
    var m = metrics(monthly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11));

    assertNull(m.yearAgo());
    assertNull(m.yearAgoDate());
    assertNull(m.yoyChange());
    assertNull(m.yoyPct());
    assertEquals(10d, m.previous());
  }

  @Test
  void singleObservationHasNoReferencePoints() {
    var m = metrics(monthly(4.5));

    assertEquals(4.5d, m.current());
    assertNull(m.previous());
    assertNull(m.momChange());
    assertNull(m.momPct());
  }

  @Test
  void zeroPreviousGivesZeroPercent() {
    var m = metrics(monthly(0, 10));

    assertEquals(10d, m.momChange());
    assertEquals(0d, m.momPct());
  }

  @Test
  void zeroYearAgoGivesZeroPercent() {
    var m = metrics(monthly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11));

    assertEquals(0d, m.yearAgo());
    assertEquals(11d, m.yoyChange());
    assertEquals(0d, m.yoyPct());
  }

  @Test
  void emptyInputsReturnAbsent() {
    assertTrue(MetricsCalculator.compute(Normalizer.normalize(SeriesObservations.EMPTY)).isEmpty());
    assertTrue(MetricsCalculator.compute(Normalizer.normalize(PointListRecords.EMPTY)).isEmpty());
    var allNull = new PointListRecords(List.of(
        new PointListRecord("2024", null), new PointListRecord("2023", null)));
    assertTrue(MetricsCalculator.compute(Normalizer.normalize(allNull)).isEmpty());
  }

  @Test
  void pointListWithNullLeadRecordIsAbsent() {
    var raw = new PointListRecords(List.of(
        new PointListRecord("2024-06", null),
        new PointListRecord("2024-05", 50d),
        new PointListRecord("2023-05", 45d)));

    assertTrue(MetricsCalculator.compute(Normalizer.normalize(raw)).isEmpty());
  }

  @Test
  void pointListSkipsNullsForReferencePoints() {
    var raw = new PointListRecords(List.of(
        new PointListRecord("2024", 5.4),
        new PointListRecord("2023", null),
        new PointListRecord("2022", 6.7),
        new PointListRecord("2021", 5.1)));

    var m = MetricsCalculator.compute(Normalizer.normalize(raw)).orElseThrow();

    assertEquals(5.4d, m.current());
    assertEquals(6.7d, m.previous());
    assertEquals(LocalDate.of(2022, 1, 1), m.previousDate());
    assertEquals(6.7d, m.yearAgo());
    assertEquals(5.4d - 6.7d, m.yoyChange(), 1e-9);
  }

  @Test
  void pointListYearAgoIsFirstValueAtLeastOneYearBack() {
    var raw = new PointListRecords(List.of(
        new PointListRecord("2024M06", 7d),
        new PointListRecord("2024M05", 6d),
        new PointListRecord("2023M12", null),
        new PointListRecord("2023M07", 5d),
        new PointListRecord("2023M06", null),
        new PointListRecord("2023M05", 4d)));

    var m = MetricsCalculator.compute(Normalizer.normalize(raw)).orElseThrow();

    assertEquals(6d, m.previous());
    assertEquals(4d, m.yearAgo());
    assertEquals(LocalDate.of(2023, 5, 1), m.yearAgoDate());
    assertEquals(75d, m.yoyPct(), 1e-9);
  }

  @Test
  void pointListWithoutOldEnoughRecordHasNoYearAgo() {
    var raw = new PointListRecords(List.of(
        new PointListRecord("2024Q2", 2d),
        new PointListRecord("2024Q1", 1d)));

    var m = MetricsCalculator.compute(Normalizer.normalize(raw)).orElseThrow();

    assertEquals(1d, m.previous());
    assertNull(m.yearAgo());
    assertNull(m.yoyPct());
  }
}
