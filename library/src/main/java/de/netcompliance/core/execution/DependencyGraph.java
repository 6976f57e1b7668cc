package de.netcompliance.core.execution;

import de.netcompliance.core.model.Step;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Step dependency graph of one workflow, in declaration order.
 */
public final class DependencyGraph {

    private final Map<String, List<String>> dependencies = new LinkedHashMap<>();

    private DependencyGraph(final List<Step> steps) {
        steps.forEach(step -> dependencies.putIfAbsent(step.getName(), new ArrayList<>()));
        steps.forEach(step -> {
            if (Objects.nonNull(step.getDependsOn())) dependencies.get(step.getName()).addAll(step.getDependsOn());
        });
    }

    public static DependencyGraph of(final List<Step> steps) {
        return new DependencyGraph(steps);
    }

    public List<String> stepNames() {
        return List.copyOf(dependencies.keySet());
    }

    public List<String> dependenciesOf(final String step) {
        return Collections.unmodifiableList(dependencies.getOrDefault(step, List.of()));
    }

    /**
     * Declared dependencies that name no step of the workflow, keyed by the declaring step.
     */
    public Map<String, List<String>> unknownDependencies() {
        var unknown = new LinkedHashMap<String, List<String>>();
        dependencies.forEach((step, deps) -> deps.stream()
                .filter(dependency -> !dependencies.containsKey(dependency))
                .forEach(dependency -> unknown.computeIfAbsent(step, k -> new ArrayList<>()).add(dependency)));
        return unknown;
    }

    /**
     * First cycle found by depth-first search, as the list of steps closing the loop.
     */
    public Optional<List<String>> findCycle() {
        var visited = new LinkedHashSet<String>();
        for (String start : dependencies.keySet()) {
            var path = new ArrayList<String>();
            var cycle = visit(start, visited, new LinkedHashSet<>(), path);
            if (cycle.isPresent()) return cycle;
        }
        return Optional.empty();
    }

    private Optional<List<String>> visit(final String step, final Set<String> visited,
                                         final Set<String> onPath, final List<String> path) {
        if (onPath.contains(step)) {
            var cycle = new ArrayList<>(path.subList(path.indexOf(step), path.size()));
            cycle.add(step);
            return Optional.of(cycle);
        }
        if (!visited.add(step) || !dependencies.containsKey(step)) return Optional.empty();
        onPath.add(step);
        path.add(step);
        for (String dependency : dependencies.get(step)) {
            var cycle = visit(dependency, visited, onPath, path);
            if (cycle.isPresent()) return cycle;
        }
        onPath.remove(step);
        path.remove(path.size() - 1);
        return Optional.empty();
    }

    /**
     * All direct and indirect dependencies of a step.
     */
    public Set<String> transitiveDependencies(final String step) {
        var result = new LinkedHashSet<String>();
        var queue = new ArrayDeque<>(dependenciesOf(step));
        while (!queue.isEmpty()) {
            var next = queue.poll();
            if (result.add(next)) queue.addAll(dependenciesOf(next));
        }
        return result;
    }
}
