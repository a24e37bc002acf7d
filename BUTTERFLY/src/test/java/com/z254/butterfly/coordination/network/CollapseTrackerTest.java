package com.z254.butterfly.coordination.network;

import com.z254.butterfly.coordination.config.ButterflyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CollapseTrackerTest {

    private CollapseTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new CollapseTracker(new ButterflyProperties.Network());
    }

    private static NetworkMetrics metrics(long generation, int organisms, double clustering,
                                          double modularity, double pathLength) {
        return NetworkMetrics.builder()
                .generation(generation)
                .organismCount(organisms)
                .clusteringCoefficient(clustering)
                .modularity(modularity)
                .averagePathLength(pathLength)
                .build();
    }

    /**
     * Organism count from generation 10, path length from 15, modularity from
     * 25 and clustering from 40.
     */
    private static NetworkMetrics staged(long generation) {
        return metrics(generation,
                generation >= 10 ? 500 : 100,
                generation >= 40 ? 0.6 : 0.4,
                generation >= 25 ? 0.2 : 0.4,
                generation >= 15 ? 2.5 : 4.0);
    }

    @Test
    void threeOfFourIsNotCollapse() {
        CollapseStatus status = tracker.evaluate(metrics(1, 550, 0.7, 0.1, 3.5));

        assertThat(status.getProximity()).isEqualTo(0.75);
        assertThat(status.isCollapsed()).isFalse();
        assertThat(status.getSatisfied()).doesNotContain(CollapseCondition.PATH_LENGTH);
    }

    @Test
    void allFourInTheSameGenerationCollapse() {
        CollapseStatus status = tracker.evaluate(metrics(1, 500, 0.51, 0.29, 2.99));

        assertThat(status.getProximity()).isEqualTo(1.0);
        assertThat(status.isCollapsed()).isTrue();
        assertThat(tracker.diagnostics().getCollapsedAtGeneration()).isEqualTo(1L);
    }

    @Test
    void thresholdsAreStrictWhereDocumented() {
        CollapseStatus status = tracker.evaluate(metrics(1, 499, 0.5, 0.3, 3.0));

        assertThat(status.getSatisfied()).isEmpty();
        assertThat(status.getProximity()).isZero();
    }

    @Test
    void infinitePathLengthNeverSatisfiesThePathCondition() {
        CollapseStatus status = tracker.evaluate(metrics(1, 600, 0.9, 0.0, Double.POSITIVE_INFINITY));

        assertThat(status.getSatisfied()).containsExactlyInAnyOrder(
                CollapseCondition.ORGANISM_COUNT, CollapseCondition.CLUSTERING, CollapseCondition.MODULARITY);
        assertThat(status.isCollapsed()).isFalse();
    }

    @Test
    void bottleneckIsTheLastConditionToBecomeTrue() {
        for (long generation = 1; generation <= 39; generation++) {
            assertThat(tracker.evaluate(staged(generation)).isCollapsed()).isFalse();
        }
        CollapseDiagnostics before = tracker.diagnostics();
        assertThat(before.isBottleneckKnown()).isFalse();
        assertThat(before.getPendingConditions()).containsExactly(CollapseCondition.CLUSTERING);

        CollapseStatus status = tracker.evaluate(staged(40));
        CollapseDiagnostics diagnostics = tracker.diagnostics();

        assertThat(status.isCollapsed()).isTrue();
        assertThat(diagnostics.getFirstTrueGenerations())
                .containsEntry(CollapseCondition.ORGANISM_COUNT, 10L)
                .containsEntry(CollapseCondition.PATH_LENGTH, 15L)
                .containsEntry(CollapseCondition.MODULARITY, 25L)
                .containsEntry(CollapseCondition.CLUSTERING, 40L);
        assertThat(diagnostics.getBottleneckCondition()).isEqualTo(CollapseCondition.CLUSTERING);
        assertThat(diagnostics.getBottleneckGeneration()).isEqualTo(40L);
        assertThat(diagnostics.getCollapsedAtGeneration()).isEqualTo(40L);
        assertThat(diagnostics.getPendingConditions()).isEmpty();
    }

    @Test
    void lapsedConditionRestartsItsFirstTrueGeneration() {
        for (long generation = 1; generation <= 40; generation++) {
            tracker.evaluate(staged(generation));
        }

        tracker.evaluate(metrics(41, 500, 0.6, 0.35, 2.5));
        CollapseDiagnostics lapsed = tracker.diagnostics();
        assertThat(lapsed.getFirstTrueGenerations()).doesNotContainKey(CollapseCondition.MODULARITY);
        assertThat(lapsed.getPendingConditions()).containsExactly(CollapseCondition.MODULARITY);
        assertThat(lapsed.isBottleneckKnown()).isFalse();

        tracker.evaluate(metrics(45, 500, 0.6, 0.2, 2.5));
        CollapseDiagnostics recovered = tracker.diagnostics();
        assertThat(recovered.getFirstTrueGenerations()).containsEntry(CollapseCondition.MODULARITY, 45L);
        assertThat(recovered.getBottleneckCondition()).isEqualTo(CollapseCondition.MODULARITY);
        assertThat(recovered.getBottleneckGeneration()).isEqualTo(45L);
        assertThat(recovered.getCollapsedAtGeneration()).isEqualTo(40L);
    }

    @Test
    void thresholdsComeFromConfiguration() {
        ButterflyProperties.Network config = new ButterflyProperties.Network();
        config.setCollapseThreshold(50);
        config.setPathLengthThreshold(5.0);
        CollapseTracker custom = new CollapseTracker(config);

        CollapseStatus status = custom.evaluate(metrics(1, 50, 0.6, 0.2, 4.0));

        assertThat(status.isCollapsed()).isTrue();
    }
}
