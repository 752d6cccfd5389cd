package org.mides.delivery.algorithm;

import org.mides.delivery.config.OptimizerConfiguration;
import org.mides.delivery.model.Route;
import org.mides.delivery.model.WeightedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/* Closed tours [start, permutation(stops)..., start], fixed generation count */
@Component
public class GeneticTourOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(GeneticTourOptimizer.class);

    private final OptimizerConfiguration.Genetic settings;
    private final Supplier<Random> randomSource;

    @Autowired
    public GeneticTourOptimizer(OptimizerConfiguration optimizerConfig) {
        this(optimizerConfig.getGenetic());
    }

    public GeneticTourOptimizer(OptimizerConfiguration.Genetic settings) {
        this.settings = settings;
        this.randomSource = () -> settings.getSeed() != null ? new Random(settings.getSeed()) : new Random();
    }

    public Route optimize(WeightedGraph graph, String start, List<String> stops) {
        return optimize(graph, start, stops, settings.getGenerations(), settings.getPopulationSize());
    }

    public Route optimize(WeightedGraph graph, String start, List<String> stops, int generations, int populationSize) {
        return optimize(graph, start, stops, generations, populationSize, randomSource.get());
    }

    public Route optimize(
        WeightedGraph graph,
        String start,
        List<String> stops,
        int generations,
        int populationSize,
        Random random)
    {
        graph.requireNode(start);
        stops.forEach(graph::requireNode);

        if (generations < 0)
            throw new IllegalArgumentException("generations must not be negative: " + generations);
        if (populationSize < 1)
            throw new IllegalArgumentException("populationSize must be at least 1: " + populationSize);
        if (new HashSet<>(stops).size() != stops.size())
            throw new IllegalArgumentException("stops must not repeat: " + stops);
        if (stops.contains(start))
            throw new IllegalArgumentException("stops must not include the start: " + start);

        if (stops.isEmpty())
            return Route.trivial(start);

        var population = new ArrayList<Individual>(populationSize);
        for (int i = 0; i < populationSize; i++) {
            population.add(randomIndividual(graph, start, stops, random));
        }

        for (int generation = 0; generation < generations; generation++) {
            var ranked = new ArrayList<>(population);
            /* Stable, so equally fit individuals keep their population order */
            ranked.sort(Comparator.comparingDouble(Individual::fitness).reversed());

            int eliteCount = Math.min(settings.getEliteSize(), ranked.size());
            var next = new ArrayList<Individual>(populationSize);
            next.addAll(ranked.subList(0, eliteCount));

            while (next.size() < populationSize) {
                var parentOne = select(population, random);
                var parentTwo = select(population, random);
                var child = crossover(parentOne.tour, parentTwo.tour, random);
                child = mutate(child, random);
                next.add(new Individual(child, graph));
            }

            population = next;

            if (logger.isDebugEnabled())
                logger.debug("Generation {}: best cost {}", generation, ranked.get(0).cost);
        }

        var best = fittest(population);
        return new Route(best.tour, RouteCosts.totalCost(graph, best.tour));
    }

    /* First of the fittest among min(tournamentSize, population) distinct individuals */
    Individual select(List<Individual> population, Random random) {
        int size = Math.min(settings.getTournamentSize(), population.size());

        var indices = new int[population.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }

        Individual winner = null;
        for (int i = 0; i < size; i++) {
            int pick = i + random.nextInt(indices.length - i);
            int tmp = indices[i];
            indices[i] = indices[pick];
            indices[pick] = tmp;

            var candidate = population.get(indices[i]);
            if (winner == null || candidate.fitness > winner.fitness)
                winner = candidate;
        }
        return winner;
    }

    /* Order crossover on the interior; parent one keeps [c1, c2), parent two fills the rest */
    List<String> crossover(List<String> parentOne, List<String> parentTwo, Random random) {
        var start = parentOne.get(0);
        var middleOne = parentOne.subList(1, parentOne.size() - 1);
        var middleTwo = parentTwo.subList(1, parentTwo.size() - 1);

        if (middleOne.size() < 2)
            return new ArrayList<>(parentOne);

        int size = middleOne.size();
        int cutOne = random.nextInt(size);
        int cutTwo = cutOne + 1 + random.nextInt(size - cutOne);

        var childMiddle = new ArrayList<String>(Collections.nCopies(size, null));
        var kept = new HashSet<String>();
        for (int i = cutOne; i < cutTwo; i++) {
            childMiddle.set(i, middleOne.get(i));
            kept.add(middleOne.get(i));
        }

        var fill = middleTwo.stream().filter(stop -> !kept.contains(stop)).iterator();
        for (int i = 0; i < size; i++) {
            if (childMiddle.get(i) == null)
                childMiddle.set(i, fill.next());
        }

        var child = new ArrayList<String>(size + 2);
        child.add(start);
        child.addAll(childMiddle);
        child.add(start);
        return child;
    }

    List<String> mutate(List<String> tour, Random random) {
        if (random.nextDouble() >= settings.getMutationRate())
            return tour;

        var copy = new ArrayList<>(tour);
        int interior = copy.size() - 2;
        if (interior >= 2) {
            int i = 1 + random.nextInt(interior);
            int j = 1 + random.nextInt(interior - 1);
            if (j >= i)
                j++;
            Collections.swap(copy, i, j);
        }
        return copy;
    }

    private static Individual randomIndividual(WeightedGraph graph, String start, List<String> stops, Random random) {
        var shuffled = new ArrayList<>(stops);
        Collections.shuffle(shuffled, random);

        var tour = new ArrayList<String>(stops.size() + 2);
        tour.add(start);
        tour.addAll(shuffled);
        tour.add(start);
        return new Individual(tour, graph);
    }

    private static Individual fittest(List<Individual> population) {
        Individual best = population.get(0);
        for (var individual : population) {
            if (individual.fitness > best.fitness)
                best = individual;
        }
        return best;
    }

    static final class Individual {
        final List<String> tour;
        final double cost;
        final double fitness;

        Individual(List<String> tour, WeightedGraph graph) {
            this.tour = tour;
            this.cost = RouteCosts.totalCost(graph, tour);
            /* A tour with a missing edge never wins a tournament against a drivable one */
            this.fitness = Double.isInfinite(cost) ? 0 : 1 / (cost + 1);
        }

        double fitness() {
            return fitness;
        }
    }
}
