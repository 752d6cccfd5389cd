package org.mides.delivery.graph;

import org.mides.delivery.exception.InvalidReferenceDataException;
import org.mides.delivery.exception.UnknownLocationException;
import org.mides.delivery.model.Coordinate;
import org.mides.delivery.model.Location;
import org.mides.delivery.model.TrafficPattern;
import org.mides.delivery.model.TrafficProfile;
import org.mides.delivery.model.WeightedGraph;
import org.mides.delivery.util.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class GraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GraphBuilder.class);

    private final Map<String, Location> locations;
    private final TrafficProfile trafficProfile;
    private final WeightedGraph staticGraph;

    public GraphBuilder(Collection<Location> locations, TrafficProfile trafficProfile) {
        Objects.requireNonNull(locations, "locations");
        this.trafficProfile = Objects.requireNonNull(trafficProfile, "trafficProfile");

        var byName = new LinkedHashMap<String, Location>();
        for (Location location : locations) {
            if (byName.putIfAbsent(location.getName(), location) != null)
                throw new InvalidReferenceDataException(
                    String.format("Duplicate location name: %s", location.getName())
                );
        }
        this.locations = Collections.unmodifiableMap(byName);
        this.staticGraph = buildStaticGraph(byName.values());

        logger.info("Built static graph with {} locations and {} traffic patterns",
            this.locations.size(), trafficProfile.getPatterns().size());
    }

    public static WeightedGraph buildStaticGraph(Collection<Location> locations) {
        var builder = WeightedGraph.builder();
        for (Location from : locations) {
            builder.addNode(from.getName());
            for (Location to : locations) {
                if (from.getName().equals(to.getName()))
                    continue;
                double distance = GeoUtils.haversineKm(
                    from.getLatitude(), from.getLongitude(),
                    to.getLatitude(), to.getLongitude()
                );
                builder.addEdge(from.getName(), to.getName(), distance);
            }
        }
        return builder.build();
    }

    /* base * applicable patterns in profile order * weather */
    public double trafficMultiplier(String location, int hour, int day, String weather) {
        double multiplier = trafficProfile.baseMultiplier(location);

        for (TrafficPattern pattern : trafficProfile.getPatterns()) {
            if (pattern.appliesTo(location, hour, day))
                multiplier *= pattern.getMultiplier();
        }

        return multiplier * trafficProfile.weatherMultiplier(weather);
    }

    public WeightedGraph dynamicGraph(WeightedGraph staticGraph, int hour, int day, String weather) {
        return staticGraph.scaleOutgoing(source -> trafficMultiplier(source, hour, day, weather));
    }

    public WeightedGraph dynamicGraph(int hour, int day, String weather) {
        return dynamicGraph(staticGraph, hour, day, weather);
    }

    public WeightedGraph getStaticGraph() {
        return staticGraph;
    }

    public List<String> getLocationNames() {
        return new ArrayList<>(locations.keySet());
    }

    public List<Location> getLocations() {
        return new ArrayList<>(locations.values());
    }

    public Optional<Location> findLocation(String name) {
        return Optional.ofNullable(locations.get(name));
    }

    public Location getLocation(String name) {
        return findLocation(name).orElseThrow(() -> new UnknownLocationException(name));
    }

    public Coordinate getCoordinates(String name) {
        return getLocation(name).coordinate();
    }

    public Map<String, Coordinate> getCoordinateIndex() {
        var coordinates = new LinkedHashMap<String, Coordinate>();
        locations.forEach((name, location) -> coordinates.put(name, location.coordinate()));
        return coordinates;
    }
}
