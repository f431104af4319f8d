package io.screenbind.core.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency view of a bindings map, where each target path depends on its source path.
 *
 * <p>
 * Paths are normalised before comparison: surrounding {@code {{ }}} and a leading {@code state.}
 * are stripped, so {@code state.a} and {@code {{state.a}}} are the same node.
 */
public final class BindingGraph {

    static final String ARROW = " → ";

    private final Map<String, Set<String>> edges;

    private BindingGraph(Map<String, Set<String>> edges) {
        this.edges = edges;
    }

    /** Builds the graph; a {@code null} map yields an empty graph. Insertion order is kept. */
    public static BindingGraph of(Map<String, String> bindings) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        if (bindings != null) {
            for (Map.Entry<String, String> binding : bindings.entrySet()) {
                String target = normalize(binding.getKey());
                String source = normalize(binding.getValue());
                edges.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(source);
                edges.computeIfAbsent(source, k -> new LinkedHashSet<>());
            }
        }
        return new BindingGraph(edges);
    }

    /**
     * Finds binding cycles with a depth-first walk. At most one cycle is reported per unvisited
     * start node, formatted as {@code a → b → a}.
     */
    public static List<String> detectCycles(Map<String, String> bindings) {
        return of(bindings).cycles();
    }

    public List<String> cycles() {
        Set<String> visited = new HashSet<>();
        List<String> found = new ArrayList<>();
        for (String node : edges.keySet()) {
            if (!visited.contains(node)) {
                walk(node, visited, new ArrayList<>(), found);
            }
        }
        return found;
    }

    /** The distinct sources {@code node} depends on directly. */
    public Set<String> dependenciesOf(String node) {
        return edges.getOrDefault(normalize(node), Set.of());
    }

    public Set<String> nodes() {
        return edges.keySet();
    }

    // The stack doubles as the recursion set: a neighbour still on it closes a cycle.
    private boolean walk(String node, Set<String> visited, List<String> stack, List<String> found) {
        visited.add(node);
        stack.add(node);
        for (String next : edges.getOrDefault(node, Set.of())) {
            int onStack = stack.indexOf(next);
            if (onStack >= 0) {
                List<String> cycle = new ArrayList<>(stack.subList(onStack, stack.size()));
                cycle.add(next);
                found.add(String.join(ARROW, cycle));
                return true;
            }
            if (!visited.contains(next) && walk(next, visited, stack, found)) {
                return true;
            }
        }
        stack.remove(stack.size() - 1);
        return false;
    }

    static String normalize(String path) {
        return BindingMutators.stripStatePrefix(BindingMutators.stripBraces(path));
    }
}
