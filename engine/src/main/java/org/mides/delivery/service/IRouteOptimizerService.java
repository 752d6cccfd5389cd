package org.mides.delivery.service;

import org.mides.delivery.model.Algorithm;
import org.mides.delivery.model.Coordinate;
import org.mides.delivery.model.MultiStopResult;
import org.mides.delivery.model.Route;
import org.mides.delivery.model.WeightedGraph;

import java.util.List;
import java.util.Map;

public interface IRouteOptimizerService {
    Route shortestPath(WeightedGraph graph, String start, String end);
    Route shortestPathAStar(WeightedGraph graph, Map<String, Coordinate> coordinates, String start, String end);
    Route nearestNeighborTour(WeightedGraph graph, String start, List<String> stops);
    Route geneticTour(WeightedGraph graph, String start, List<String> stops);
    Route geneticTour(WeightedGraph graph, String start, List<String> stops, int generations, int populationSize);
    Route constraintSolverTour(WeightedGraph graph, String start, List<String> stops);
    MultiStopResult optimizeMultiStop(WeightedGraph graph, String start, List<String> stops, Algorithm algorithm);
    MultiStopResult optimizeMultiStop(WeightedGraph graph, String start, List<String> stops, String algorithmName);
}
