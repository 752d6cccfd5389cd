package org.mides.delivery.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mides.delivery.algorithm.AStarSearch;
import org.mides.delivery.algorithm.ConstraintSolverTourOptimizer;
import org.mides.delivery.algorithm.DijkstraSearch;
import org.mides.delivery.algorithm.GeneticTourOptimizer;
import org.mides.delivery.algorithm.NearestNeighborTour;
import org.mides.delivery.exception.InvalidRouteRequestException;
import org.mides.delivery.exception.UnknownLocationException;
import org.mides.delivery.model.Algorithm;
import org.mides.delivery.model.Route;
import org.mides.delivery.model.WeightedGraph;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RouteOptimizerServiceTest {

    @Mock
    private GeneticTourOptimizer genetic;

    @Mock
    private ConstraintSolverTourOptimizer constraintSolver;

    private RouteOptimizerService routeOptimizerService;
    private WeightedGraph graph;

    @BeforeEach
    void setUp() {
        routeOptimizerService = new RouteOptimizerService(
            new DijkstraSearch(),
            new AStarSearch(),
            new NearestNeighborTour(),
            genetic,
            constraintSolver
        );

        // A->B 10, B->A 20, B->C 20, C->B 10, A->C 15, C->A 15
        graph = WeightedGraph.builder()
            .addEdge("A", "B", 10)
            .addEdge("B", "A", 20)
            .addEdge("B", "C", 20)
            .addEdge("C", "B", 10)
            .addEdge("A", "C", 15)
            .addEdge("C", "A", 15)
            .build();
    }

    @Test
    void optimizeMultiStop_genetic_shouldUseGeneticOptimizer() {
        var stops = List.of("B", "C");
        when(genetic.optimize(graph, "A", stops)).thenReturn(new Route(List.of("A", "C", "B", "A"), 45));

        var result = routeOptimizerService.optimizeMultiStop(graph, "A", stops, "genetic");

        assertEquals(Algorithm.GENETIC, result.getAlgorithm());
        assertEquals("genetic", result.getRequestedAlgorithm());
        assertEquals(List.of("A", "C", "B", "A"), result.getRoute());
        assertEquals(45.0, result.getDistance());
        assertEquals(2, result.getNumStops());
        assertTrue(result.isComplete());
        assertNull(result.getNote());
        verifyNoInteractions(constraintSolver);
    }

    @Test
    void optimizeMultiStop_constraintSolver_shouldUseSolver() {
        var stops = List.of("B", "C");
        when(constraintSolver.optimize(graph, "A", stops)).thenReturn(new Route(List.of("A", "B", "C", "A"), 45));

        var result = routeOptimizerService.optimizeMultiStop(graph, "A", stops, Algorithm.CONSTRAINT_SOLVER);

        assertEquals(Algorithm.CONSTRAINT_SOLVER, result.getAlgorithm());
        assertEquals(List.of("A", "B", "C", "A"), result.getRoute());
        verifyNoInteractions(genetic);
    }

    @Test
    void optimizeMultiStop_nearestNeighbor_shouldRunGreedyTour() {
        var result = routeOptimizerService.optimizeMultiStop(graph, "A", List.of("B", "C"), "nearest_neighbor");

        assertEquals(Algorithm.NEAREST_NEIGHBOR, result.getAlgorithm());
        assertEquals(List.of("A", "B", "C", "A"), result.getRoute());
        assertEquals(45.0, result.getDistance(), 1e-9);
        verifyNoInteractions(genetic, constraintSolver);
    }

    @Test
    void optimizeMultiStop_singlePathOrUnknownAlgorithm_shouldFallBackToNearestNeighbor() {
        for (var name : new String[]{"dijkstra", "a_star", "simulated_annealing", "", null}) {
            var result = routeOptimizerService.optimizeMultiStop(graph, "A", List.of("B", "C"), name);

            assertEquals(Algorithm.NEAREST_NEIGHBOR, result.getAlgorithm(), String.valueOf(name));
            assertEquals(name, result.getRequestedAlgorithm());
            assertEquals(List.of("A", "B", "C", "A"), result.getRoute());
            assertTrue(result.isComplete());
        }
        verifyNoInteractions(genetic, constraintSolver);
    }

    @Test
    void optimizeMultiStop_algorithmNameWithOtherCase_shouldFallBackToNearestNeighbor() {
        for (var name : new String[]{"Genetic", "CONSTRAINT_SOLVER", " nearest_neighbor "}) {
            var result = routeOptimizerService.optimizeMultiStop(graph, "A", List.of("B", "C"), name);

            assertEquals(Algorithm.NEAREST_NEIGHBOR, result.getAlgorithm(), name);
            assertEquals(name, result.getRequestedAlgorithm());
        }
        verifyNoInteractions(genetic, constraintSolver);
    }

    @Test
    void optimizeMultiStop_noStops_shouldReturnStartForEveryAlgorithm() {
        for (var algorithm : Algorithm.values()) {
            var result = routeOptimizerService.optimizeMultiStop(graph, "A", List.of(), algorithm);

            assertEquals(List.of("A"), result.getRoute());
            assertEquals(0.0, result.getDistance());
            assertEquals(0, result.getNumStops());
            assertTrue(result.isComplete());
            assertNull(result.getNote());
        }
        verifyNoInteractions(genetic, constraintSolver);
    }

    @Test
    void optimizeMultiStop_noStops_shouldReportAlgorithmThatWouldRun() {
        assertEquals(Algorithm.GENETIC,
            routeOptimizerService.optimizeMultiStop(graph, "A", List.of(), Algorithm.GENETIC).getAlgorithm());
        assertEquals(Algorithm.CONSTRAINT_SOLVER,
            routeOptimizerService.optimizeMultiStop(graph, "A", List.of(), Algorithm.CONSTRAINT_SOLVER).getAlgorithm());
        assertEquals(Algorithm.NEAREST_NEIGHBOR,
            routeOptimizerService.optimizeMultiStop(graph, "A", List.of(), Algorithm.NEAREST_NEIGHBOR).getAlgorithm());

        for (var algorithm : new Algorithm[]{Algorithm.DIJKSTRA, Algorithm.A_STAR, Algorithm.UNRECOGNIZED}) {
            var result = routeOptimizerService.optimizeMultiStop(graph, "A", List.of(), algorithm);

            assertEquals(Algorithm.NEAREST_NEIGHBOR, result.getAlgorithm(), algorithm.name());
        }

        var named = routeOptimizerService.optimizeMultiStop(graph, "A", List.of(), "dijkstra");
        assertEquals(Algorithm.NEAREST_NEIGHBOR, named.getAlgorithm());
        assertEquals("dijkstra", named.getRequestedAlgorithm());
    }

    @Test
    void optimizeMultiStop_startAmongStops_shouldThrow() {
        var exception = assertThrows(InvalidRouteRequestException.class,
            () -> routeOptimizerService.optimizeMultiStop(graph, "A", List.of("A", "B"), Algorithm.GENETIC));

        assertEquals("stops must not include the start location A", exception.getMessage());
        assertThrows(InvalidRouteRequestException.class,
            () -> routeOptimizerService.optimizeMultiStop(graph, "A", List.of("B", "A"), "constraint_solver"));
        verifyNoInteractions(genetic, constraintSolver);
    }

    @Test
    void optimizeMultiStop_unreachableStop_shouldReportIncompleteRoute() {
        var partial = WeightedGraph.builder()
            .addUndirectedEdge("A", "B", 3)
            .addNode("Z")
            .build();

        var result = routeOptimizerService.optimizeMultiStop(partial, "A", List.of("B", "Z"), "nearest_neighbor");

        assertEquals(List.of("A", "B", "A"), result.getRoute());
        assertFalse(result.isComplete());
        assertEquals("Route covers 1 of 2 requested stops; the rest are unreachable", result.getNote());
    }

    @Test
    void optimizeMultiStop_noEdgeBack_shouldNoteOpenRoute() {
        var oneWay = WeightedGraph.builder()
            .addEdge("A", "B", 1)
            .addEdge("B", "C", 1)
            .build();

        var result = routeOptimizerService.optimizeMultiStop(oneWay, "A", List.of("B", "C"), "nearest_neighbor");

        assertEquals(List.of("A", "B", "C"), result.getRoute());
        assertTrue(result.isComplete());
        assertEquals("No edge back to A, route is left open", result.getNote());
    }

    @Test
    void optimizeMultiStop_unknownLocation_shouldThrow() {
        assertThrows(UnknownLocationException.class,
            () -> routeOptimizerService.optimizeMultiStop(graph, "Q", List.of("B"), "genetic"));
        assertThrows(UnknownLocationException.class,
            () -> routeOptimizerService.optimizeMultiStop(graph, "A", List.of("B", "Q"), "genetic"));
        verifyNoInteractions(genetic, constraintSolver);
    }

    @Test
    void shortestPath_shouldAgreeAcrossSearches() {
        var dijkstra = routeOptimizerService.shortestPath(graph, "A", "C");
        var aStar = routeOptimizerService.shortestPathAStar(graph, Map.of(), "A", "C");

        assertEquals(List.of("A", "C"), dijkstra.getStops());
        assertEquals(dijkstra, aStar);
    }

    @Test
    void tourOperations_shouldDelegateToAlgorithms() {
        var stops = List.of("B", "C");
        var tour = new Route(List.of("A", "B", "C", "A"), 45);
        when(genetic.optimize(graph, "A", stops)).thenReturn(tour);
        when(genetic.optimize(graph, "A", stops, 0, 1)).thenReturn(tour);
        when(constraintSolver.optimize(graph, "A", stops)).thenReturn(tour);

        assertEquals(tour, routeOptimizerService.geneticTour(graph, "A", stops));
        assertEquals(tour, routeOptimizerService.geneticTour(graph, "A", stops, 0, 1));
        assertEquals(tour, routeOptimizerService.constraintSolverTour(graph, "A", stops));
        assertEquals(tour, routeOptimizerService.nearestNeighborTour(graph, "A", stops));
    }
}
