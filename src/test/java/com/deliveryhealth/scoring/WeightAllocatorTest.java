package com.deliveryhealth.scoring;

import com.deliveryhealth.SnapshotFixtures;
import com.deliveryhealth.config.ThresholdConfig;
import com.deliveryhealth.model.DeliveryFramework;
import com.deliveryhealth.model.WeeklySnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeightAllocatorTest {

    private final WeightAllocator allocator = new WeightAllocator();
    private final MetricNormalizer normalizer = new MetricNormalizer(ThresholdConfig.defaultConfig());

    @Test
    void proximity_shouldRampFromThirtyPercent() {
        assertEquals(0.0, WeightAllocator.proximity(0.10), 1e-12);
        assertEquals(0.0, WeightAllocator.proximity(0.30), 1e-12);
        assertEquals(0.5, WeightAllocator.proximity(0.65), 1e-9);
        assertEquals(1.0, WeightAllocator.proximity(1.0), 1e-12);
        assertEquals(1.0, WeightAllocator.proximity(1.4), 1e-12);
    }

    @Test
    void schemeFor_shouldDispatchOnFramework() {
        assertInstanceOf(PlannedWeightScheme.class, allocator.schemeFor(DeliveryFramework.PLANNED));
        assertInstanceOf(KanbanWeightScheme.class, allocator.schemeFor(DeliveryFramework.KANBAN));
        assertInstanceOf(PlannedWeightScheme.class, allocator.schemeFor(null));
    }

    @Test
    void allocate_shouldRenormalizeToOneForEveryGateCombination() {
        for (WeeklySnapshot snapshot : gateCombinations()) {
            for (double pct : new double[]{0.0, 0.3, 0.65, 1.0}) {
                WeeklySnapshot row = snapshot.toBuilder().actualPercentComplete(pct).build();
                WeekSignals signals = WeekSignals.derive(row, row.throughput == null ? List.of() : List.of(row.throughput));
                WeightScheme scheme = allocator.schemeFor(signals.framework);
                List<WeightedContribution> weighted = allocator.allocate(
                        scheme.terms(signals, normalizer, WeightAllocator.proximity(pct)));

                double total = 0.0;
                double maxPoints = 0.0;
                for (WeightedContribution c : weighted) {
                    total += c.weight();
                    maxPoints += c.maxPoints();
                    assertTrue(c.points() <= c.maxPoints() + 1e-9);
                }
                assertEquals(1.0, total, 1e-9);
                assertEquals(100.0, maxPoints, 1e-9);
            }
        }
    }

    @Test
    void plannedTerms_shouldGateOptionalMetrics() {
        WeeklySnapshot bare = SnapshotFixtures.planned("P1", 0).build();
        List<String> labels = labels(bare);

        assertEquals(9, labels.size());
        assertFalse(labels.contains(MetricLabels.CPI));
        assertFalse(labels.contains(MetricLabels.SPI));
        assertFalse(labels.contains(MetricLabels.FORECAST_SLIP));
        assertFalse(labels.contains(MetricLabels.MILESTONES));

        WeeklySnapshot full = bare.toBuilder()
                .plannedEndDate(SnapshotFixtures.PLANNED_END)
                .forecastEndDate(SnapshotFixtures.PLANNED_END.plusDays(14))
                .plannedCostToDate(1000.0)
                .actualCostToDate(1100.0)
                .milestonesPlanned(4.0)
                .milestonesHit(3.0)
                .risksHigh(2.0)
                .build();
        List<String> fullLabels = labels(full);

        assertEquals(13, fullLabels.size());
        assertTrue(fullLabels.containsAll(List.of(MetricLabels.CPI, MetricLabels.SPI,
                MetricLabels.FORECAST_SLIP, MetricLabels.MILESTONES)));
    }

    @Test
    void plannedTerms_shouldExcludeEvmWhenCostIsZero() {
        WeeklySnapshot row = SnapshotFixtures.planned("P1", 0)
                .plannedCostToDate(0.0)
                .actualCostToDate(500.0)
                .milestonesPlanned(0.0)
                .milestonesHit(0.0)
                .build();

        List<String> labels = labels(row);
        assertFalse(labels.contains(MetricLabels.CPI));
        assertFalse(labels.contains(MetricLabels.MILESTONES));
    }

    @Test
    void plannedTerms_shouldShiftWeightTowardScheduleNearCompletion() {
        WeekSignals signals = WeekSignals.derive(SnapshotFixtures.planned("P1", 0).build(), List.of());
        PlannedWeightScheme scheme = new PlannedWeightScheme();

        double early = weightOf(scheme.terms(signals, normalizer, 0.0), MetricLabels.SCHEDULE_VARIANCE);
        double late = weightOf(scheme.terms(signals, normalizer, 1.0), MetricLabels.SCHEDULE_VARIANCE);
        double earlyDeps = weightOf(scheme.terms(signals, normalizer, 0.0), MetricLabels.DEPENDENCIES);
        double lateDeps = weightOf(scheme.terms(signals, normalizer, 1.0), MetricLabels.DEPENDENCIES);

        assertEquals(0.12, early, 1e-12);
        assertEquals(0.20, late, 1e-12);
        assertTrue(lateDeps < earlyDeps);
    }

    @Test
    void kanbanTerms_shouldIgnoreProximity() {
        WeekSignals signals = WeekSignals.derive(SnapshotFixtures.kanban("K1", 0)
                .throughput(12.0).cycleTimeDays(5.0).wipCurrent(8.0).wipLimit(10.0).agingWipItems(1.0)
                .build(), List.of(12.0));
        KanbanWeightScheme scheme = new KanbanWeightScheme();

        List<MetricTerm> early = scheme.terms(signals, normalizer, 0.0);
        List<MetricTerm> late = scheme.terms(signals, normalizer, 1.0);

        assertEquals(early, late);
        assertEquals(MetricLabels.THROUGHPUT, early.get(0).label());
        assertEquals(0.18, early.get(0).weight(), 1e-12);
    }

    @Test
    void allocate_shouldRejectDuplicateLabels() {
        List<MetricTerm> terms = List.of(
                new MetricTerm(MetricLabels.TEAM_CHURN, 0.1, 1.0),
                new MetricTerm(MetricLabels.TEAM_CHURN, 0.2, 0.5));

        assertThrows(IllegalArgumentException.class, () -> allocator.allocate(terms));
    }

    @Test
    void allocate_shouldFloorTinyTotals() {
        List<WeightedContribution> weighted = allocator.allocate(List.of(new MetricTerm(MetricLabels.AGING_WIP, 0.0, 1.0)));

        assertEquals(1, weighted.size());
        assertEquals(0.0, weighted.get(0).maxPoints(), 1e-12);
        assertTrue(allocator.allocate(List.of()).isEmpty());
    }

    private List<String> labels(WeeklySnapshot row) {
        WeekSignals signals = WeekSignals.derive(row, List.of());
        List<String> out = new ArrayList<>();
        for (MetricTerm term : allocator.schemeFor(signals.framework)
                .terms(signals, normalizer, WeightAllocator.proximity(signals.actualPct))) {
            out.add(term.label());
        }
        return out;
    }

    private static double weightOf(List<MetricTerm> terms, String label) {
        for (MetricTerm term : terms) {
            if (term.label().equals(label)) {
                return term.weight();
            }
        }
        throw new AssertionError("missing term " + label);
    }

    private static List<WeeklySnapshot> gateCombinations() {
        List<WeeklySnapshot> out = new ArrayList<>();
        for (DeliveryFramework framework : DeliveryFramework.values()) {
            for (int mask = 0; mask < 16; mask++) {
                WeeklySnapshot.WeeklySnapshotBuilder b = SnapshotFixtures.planned("G", 0)
                        .deliveryFramework(framework)
                        .plannedPercentComplete(0.6)
                        .backlogItemsAdded(12)
                        .defectEscapeRate(0.05);
                if ((mask & 1) != 0) {
                    b.plannedEndDate(SnapshotFixtures.PLANNED_END).forecastEndDate(SnapshotFixtures.PLANNED_END.plusDays(30));
                }
                if ((mask & 2) != 0) {
                    b.plannedCostToDate(500.0).actualCostToDate(650.0);
                }
                if ((mask & 4) != 0) {
                    b.milestonesPlanned(5.0).milestonesHit(2.0).risksHigh(3.0);
                }
                if ((mask & 8) != 0) {
                    b.throughput(7.0).cycleTimeDays(9.0).wipCurrent(14.0).wipLimit(10.0).agingWipItems(4.0);
                }
                out.add(b.build());
            }
        }
        return out;
    }
}
