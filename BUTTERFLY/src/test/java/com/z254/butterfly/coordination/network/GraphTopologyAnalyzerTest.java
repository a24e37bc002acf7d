package com.z254.butterfly.coordination.network;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GraphTopologyAnalyzerTest {

    private final GraphTopologyAnalyzer analyzer = new GraphTopologyAnalyzer(42L);

    @Test
    void triangleIsFullyClusteredWithUnitPathLength() {
        OrganismGraph graph = new OrganismGraph(5);
        int a = graph.addOrganism();
        int b = graph.addOrganism();
        int c = graph.addOrganism();
        graph.connect(a, b);
        graph.connect(b, c);
        graph.connect(a, c);

        NetworkMetrics metrics = analyzer.analyze(3, graph);

        assertThat(metrics.getGeneration()).isEqualTo(3);
        assertThat(metrics.getOrganismCount()).isEqualTo(3);
        assertThat(metrics.getConnectionCount()).isEqualTo(3);
        assertThat(metrics.getAverageDegree()).isCloseTo(2.0, within(1e-9));
        assertThat(metrics.getDensity()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.getClusteringCoefficient()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.getAveragePathLength()).isCloseTo(1.0, within(1e-9));
        assertThat(metrics.isConnected()).isTrue();
    }

    @Test
    void chainHasNoClusteringAndLongerPaths() {
        OrganismGraph graph = new OrganismGraph(5);
        int a = graph.addOrganism();
        int b = graph.addOrganism();
        int c = graph.addOrganism();
        graph.connect(a, b);
        graph.connect(b, c);

        NetworkMetrics metrics = analyzer.analyze(1, graph);

        assertThat(metrics.getClusteringCoefficient()).isZero();
        assertThat(metrics.getAveragePathLength()).isCloseTo(4.0 / 3.0, within(1e-9));
    }

    @Test
    void disconnectedGraphHasInfinitePathLength() {
        OrganismGraph graph = new OrganismGraph(5);
        int a = graph.addOrganism();
        int b = graph.addOrganism();
        graph.addOrganism();
        graph.connect(a, b);

        NetworkMetrics metrics = analyzer.analyze(1, graph);

        assertThat(metrics.getAveragePathLength()).isInfinite();
        assertThat(metrics.isConnected()).isFalse();
    }

    @Test
    void emptyAndSingletonGraphsAreDegenerateNotErrors() {
        OrganismGraph graph = new OrganismGraph(5);
        NetworkMetrics empty = analyzer.analyze(0, graph);
        assertThat(empty.getOrganismCount()).isZero();
        assertThat(empty.getClusteringCoefficient()).isZero();
        assertThat(empty.getModularity()).isZero();
        assertThat(empty.getAveragePathLength()).isInfinite();

        graph.addOrganism();
        NetworkMetrics single = analyzer.analyze(1, graph);
        assertThat(single.getDensity()).isZero();
        assertThat(single.getAveragePathLength()).isInfinite();
    }

    @Test
    void twoSeparateTrianglesFormTwoCommunities() {
        OrganismGraph graph = new OrganismGraph(5);
        for (int group = 0; group < 2; group++) {
            int a = graph.addOrganism();
            int b = graph.addOrganism();
            int c = graph.addOrganism();
            graph.connect(a, b);
            graph.connect(b, c);
            graph.connect(a, c);
        }

        NetworkMetrics metrics = analyzer.analyze(1, graph);

        assertThat(metrics.getModularity()).isCloseTo(0.5, within(1e-9));
        assertThat(metrics.getClusteringCoefficient()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void modularityStaysWithinUnitInterval() {
        OrganismGraph graph = new OrganismGraph(4);
        int previous = graph.addOrganism();
        for (int i = 0; i < 40; i++) {
            int next = graph.addOrganism();
            graph.connect(previous, next);
            previous = next;
        }

        NetworkMetrics metrics = analyzer.analyze(5, graph);

        assertThat(metrics.getModularity()).isBetween(0.0, 1.0);
    }
}
