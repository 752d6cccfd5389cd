package org.mides.delivery.controller;

import jakarta.validation.Valid;
import org.mides.delivery.exception.InvalidRouteRequestException;
import org.mides.delivery.graph.GraphBuilder;
import org.mides.delivery.model.Algorithm;
import org.mides.delivery.model.Route;
import org.mides.delivery.model.WeightedGraph;
import org.mides.delivery.model.api.DeliveryEstimateRequest;
import org.mides.delivery.model.api.DeliveryEstimateResponse;
import org.mides.delivery.model.api.LocationsResponse;
import org.mides.delivery.model.api.RouteRequest;
import org.mides.delivery.model.api.RouteResponse;
import org.mides.delivery.model.api.TrafficConditions;
import org.mides.delivery.model.api.TrafficPredictionRequest;
import org.mides.delivery.model.api.TrafficPredictionResponse;
import org.mides.delivery.service.IDeliveryTimeEstimator;
import org.mides.delivery.service.IRouteOptimizerService;
import org.mides.delivery.service.ITrafficService;
import org.mides.delivery.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Validated
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("routing/v1")
public class RoutingController {

    private static final Logger logger = LoggerFactory.getLogger(RoutingController.class);

    private final GraphBuilder graphBuilder;
    private final IRouteOptimizerService routeOptimizerService;
    private final IDeliveryTimeEstimator deliveryTimeEstimator;
    private final ITrafficService trafficService;
    private final ExecutorService executorService;
    private final Clock clock;

    @Autowired
    public RoutingController(
        GraphBuilder graphBuilder,
        IRouteOptimizerService routeOptimizerService,
        IDeliveryTimeEstimator deliveryTimeEstimator,
        ITrafficService trafficService,
        ExecutorService executorService,
        Clock clock)
    {
        this.graphBuilder = graphBuilder;
        this.routeOptimizerService = routeOptimizerService;
        this.deliveryTimeEstimator = deliveryTimeEstimator;
        this.trafficService = trafficService;
        this.executorService = executorService;
        this.clock = clock;
    }

    @GetMapping("/locations")
    public ResponseEntity<LocationsResponse> locations() {
        return ResponseEntity.ok(new LocationsResponse(graphBuilder.getLocations()));
    }

    @PostMapping("/optimize-route")
    public CompletableFuture<ResponseEntity<RouteResponse>> optimizeRoute(@RequestBody @Valid RouteRequest request) {
        /* Reject bad references before any work is scheduled */
        graphBuilder.getLocation(request.getStart());
        if (request.isMultiStop()) {
            request.getStops().forEach(graphBuilder::getLocation);
            if (new HashSet<>(request.getStops()).size() != request.getStops().size())
                throw new InvalidRouteRequestException("stops must not repeat");
            if (request.getStops().contains(request.getStart()))
                throw new InvalidRouteRequestException(
                    String.format("stops must not include the start location %s", request.getStart())
                );
        } else {
            if (request.getEnd() == null || request.getEnd().isBlank())
                throw new InvalidRouteRequestException("Either end or stops must be provided");
            graphBuilder.getLocation(request.getEnd());
        }

        var now = LocalDateTime.now(clock);
        var conditions = new TrafficConditions(
            request.getHour() != null ? request.getHour() : now.getHour(),
            request.getDay() != null ? request.getDay() : now.getDayOfWeek().getValue() - 1,
            request.getWeather()
        );

        return CompletableFuture.supplyAsync(() -> {
            var graph = graphBuilder.dynamicGraph(conditions.getHour(), conditions.getDay(), conditions.getWeather());
            return request.isMultiStop()
                ? planMultiStop(request, graph, conditions)
                : planSingleDestination(request, graph, conditions);
        }, executorService).thenApply(ResponseEntity::ok);
    }

    @PostMapping("/predict-traffic")
    public ResponseEntity<TrafficPredictionResponse> predictTraffic(@RequestBody @Valid TrafficPredictionRequest request) {
        var now = LocalDateTime.now(clock);
        var prediction = trafficService.predict(
            request.getLocation(),
            request.getHour() != null ? request.getHour() : now.getHour(),
            request.getDay() != null ? request.getDay() : now.getDayOfWeek().getValue() - 1,
            request.getWeather()
        );
        return ResponseEntity.ok(prediction);
    }

    @PostMapping("/estimate-delivery")
    public ResponseEntity<DeliveryEstimateResponse> estimateDelivery(@RequestBody @Valid DeliveryEstimateRequest request) {
        var now = LocalDateTime.now(clock);
        if (request.getHour() == null)
            request.setHour(now.getHour());
        if (request.getDay() == null)
            request.setDay(now.getDayOfWeek().getValue() - 1);

        double minutes = deliveryTimeEstimator.estimateMinutes(
            request.getDistanceKm(),
            request.getNumStops(),
            request.getHour(),
            request.getDay(),
            request.getPackageSize(),
            request.getWeather()
        );

        var response = new DeliveryEstimateResponse();
        response.setEstimatedTimeMinutes(Utils.round(minutes, 1));
        response.setEstimatedTimeHours(Utils.round(minutes / 60, 2));
        response.setParameters(request);
        return ResponseEntity.ok(response);
    }

    private RouteResponse planMultiStop(RouteRequest request, WeightedGraph graph, TrafficConditions conditions) {
        var result = routeOptimizerService.optimizeMultiStop(
            graph, request.getStart(), request.getStops(), request.getAlgorithm()
        );

        var response = buildResponse(
            new Route(result.getRoute(), result.getDistance()),
            request.getStops().size(),
            request,
            conditions
        );
        response.setAlgorithm(result.getAlgorithm());
        response.setComplete(result.isComplete());
        if (result.getNote() != null)
            response.setNote(result.getNote());
        return response;
    }

    private RouteResponse planSingleDestination(RouteRequest request, WeightedGraph graph, TrafficConditions conditions) {
        var algorithm = Algorithm.fromName(request.getAlgorithm()) == Algorithm.A_STAR
            ? Algorithm.A_STAR
            : Algorithm.DIJKSTRA;

        var route = algorithm == Algorithm.A_STAR
            ? routeOptimizerService.shortestPathAStar(
                graph, graphBuilder.getCoordinateIndex(), request.getStart(), request.getEnd())
            : routeOptimizerService.shortestPath(graph, request.getStart(), request.getEnd());

        var response = buildResponse(route, 1, request, conditions);
        response.setAlgorithm(algorithm);
        if (!route.isReachable()) {
            response.setComplete(false);
            response.setNote(String.format("No path from %s to %s", request.getStart(), request.getEnd()));
        }
        return response;
    }

    private RouteResponse buildResponse(Route route, int stopCount, RouteRequest request, TrafficConditions conditions) {
        var response = new RouteResponse();
        response.setRequestedAlgorithm(request.getAlgorithm());
        response.setTrafficConditions(conditions);
        response.setRoute(route.getStops());
        response.setRouteCoords(routeCoordinates(route.getStops()));

        if (route.isReachable()) {
            response.setSuccess(true);
            response.setDistance(Utils.round(route.getDistance(), 2));
            double minutes = deliveryTimeEstimator.estimateMinutes(
                route.getDistance(),
                stopCount,
                conditions.getHour(),
                conditions.getDay(),
                request.getPackageSize(),
                conditions.getWeather()
            );
            response.setEstimatedTimeMinutes(Utils.round(minutes, 1));
        } else {
            response.setSuccess(false);
            logger.info("No drivable route from {} for request {}", request.getStart(), request);
        }
        return response;
    }

    private List<List<Double>> routeCoordinates(List<String> stops) {
        return stops.stream()
            .map(stop -> graphBuilder.getCoordinates(stop).toLatLng())
            .toList();
    }
}
