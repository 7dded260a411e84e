package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.models.GraphSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Directed graph of "feeds" edges between cells: source -> dependent
 * means the dependent's formula reads the source.
 *
 * Nodes get stable integer ids when first seen; adjacency is kept as
 * id sets in both directions so edits can replace a cell's incoming
 * edges without scanning the whole graph.
 *
 * Not thread-safe: the owning engine serializes access.
 */
public class DependencyGraph {

    private final Map<String, Integer> ids = new HashMap<>();
    private final List<String> addresses = new ArrayList<>();
    // dependents.get(id): cells whose formulas read id
    private final List<Set<Integer>> dependents = new ArrayList<>();
    // sources.get(id): cells read by id's formula
    private final List<Set<Integer>> sources = new ArrayList<>();

    /**
     * Replaces every edge into address with one edge from each reference.
     * If that closes a loop, the previous incoming edges are restored
     * and a CircularReferenceException naming the loop is thrown.
     */
    public void setCellFormula(String address, Collection<String> references) {
        int target = ensureNode(address);
        Set<Integer> previous = new LinkedHashSet<>(sources.get(target));

        detachSources(target);
        for (String reference : references) {
            link(ensureNode(reference), target);
        }

        List<String> cycle = findCycleThrough(target);
        if (cycle != null) {
            detachSources(target);
            for (int source : previous) {
                link(source, target);
            }
            throw new CircularReferenceException(cycle);
        }
    }

    /**
     * Marks address as a literal cell: the node exists, nothing feeds it.
     */
    public void setCellLiteral(String address) {
        detachSources(ensureNode(address));
    }

    public boolean hasNode(String address) {
        return ids.containsKey(address);
    }

    /**
     * Cells that read address directly.
     */
    public Set<String> successors(String address) {
        Integer id = ids.get(address);
        return id == null ? Collections.emptySet() : toAddresses(dependents.get(id));
    }

    /**
     * Cells that address reads directly.
     */
    public Set<String> predecessors(String address) {
        Integer id = ids.get(address);
        return id == null ? Collections.emptySet() : toAddresses(sources.get(id));
    }

    /**
     * address plus every cell reachable from it through successors, breadth-first.
     */
    public Set<String> dependentClosure(String address) {
        Set<String> closure = new LinkedHashSet<>();
        closure.add(address);
        Integer start = ids.get(address);
        if (start == null) {
            return closure;
        }
        Set<Integer> visited = new LinkedHashSet<>();
        Queue<Integer> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int dependent : dependents.get(current)) {
                if (visited.add(dependent)) {
                    closure.add(addresses.get(dependent));
                    queue.add(dependent);
                }
            }
        }
        return closure;
    }

    /**
     * All nodes, every source before its dependents (Kahn's algorithm).
     */
    public List<String> topologicalOrder() {
        int size = addresses.size();
        int[] remaining = new int[size];
        Queue<Integer> ready = new ArrayDeque<>();
        for (int id = 0; id < size; id++) {
            remaining[id] = sources.get(id).size();
            if (remaining[id] == 0) {
                ready.add(id);
            }
        }

        List<String> order = new ArrayList<>(size);
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order.add(addresses.get(current));
            for (int dependent : dependents.get(current)) {
                if (--remaining[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != size) {
            // setCellFormula never leaves a loop behind
            throw new IllegalStateException("Dependency graph contains a cycle");
        }
        return order;
    }

    /**
     * Any loop in the graph, as addresses with the first repeated at the end.
     * Iterative DFS so long chains cannot overflow the stack.
     */
    public Optional<List<String>> findCycle() {
        int size = addresses.size();
        // 0 = unvisited, 1 = on the current path, 2 = done
        int[] state = new int[size];
        int[] parent = new int[size];

        for (int root = 0; root < size; root++) {
            if (state[root] != 0) {
                continue;
            }
            Deque<Iterator<Integer>> stack = new ArrayDeque<>();
            Deque<Integer> path = new ArrayDeque<>();
            state[root] = 1;
            parent[root] = -1;
            stack.push(dependents.get(root).iterator());
            path.push(root);

            while (!stack.isEmpty()) {
                int current = path.peek();
                Iterator<Integer> next = stack.peek();
                if (!next.hasNext()) {
                    state[current] = 2;
                    stack.pop();
                    path.pop();
                    continue;
                }
                int child = next.next();
                if (state[child] == 1) {
                    List<String> cycle = new ArrayList<>();
                    for (int node = current; node != child; node = parent[node]) {
                        cycle.add(0, addresses.get(node));
                    }
                    cycle.add(0, addresses.get(child));
                    cycle.add(addresses.get(child));
                    return Optional.of(cycle);
                }
                if (state[child] == 0) {
                    state[child] = 1;
                    parent[child] = current;
                    stack.push(dependents.get(child).iterator());
                    path.push(child);
                }
            }
        }
        return Optional.empty();
    }

    public List<String> nodes() {
        return new ArrayList<>(addresses);
    }

    public List<GraphSnapshot.Edge> edges() {
        List<GraphSnapshot.Edge> edges = new ArrayList<>();
        for (int source = 0; source < addresses.size(); source++) {
            for (int dependent : dependents.get(source)) {
                edges.add(new GraphSnapshot.Edge(addresses.get(source), addresses.get(dependent)));
            }
        }
        return edges;
    }

    public int size() {
        return addresses.size();
    }

    public void clear() {
        ids.clear();
        addresses.clear();
        dependents.clear();
        sources.clear();
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private int ensureNode(String address) {
        Integer existing = ids.get(address);
        if (existing != null) {
            return existing;
        }
        int id = addresses.size();
        ids.put(address, id);
        addresses.add(address);
        dependents.add(new LinkedHashSet<>());
        sources.add(new LinkedHashSet<>());
        return id;
    }

    private void link(int source, int dependent) {
        dependents.get(source).add(dependent);
        sources.get(dependent).add(source);
    }

    private void detachSources(int target) {
        for (int source : sources.get(target)) {
            dependents.get(source).remove(target);
        }
        sources.get(target).clear();
    }

    /**
     * The graph was acyclic before target's edges changed, so any new loop
     * runs through target: search forward from target until an edge leads back.
     */
    private List<String> findCycleThrough(int target) {
        Map<Integer, Integer> parent = new HashMap<>();
        Queue<Integer> queue = new ArrayDeque<>();
        queue.add(target);
        parent.put(target, -1);

        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int dependent : dependents.get(current)) {
                if (dependent == target) {
                    List<String> cycle = new ArrayList<>();
                    cycle.add(addresses.get(target));
                    for (int node = current; node != target; node = parent.get(node)) {
                        cycle.add(1, addresses.get(node));
                    }
                    cycle.add(addresses.get(target));
                    return cycle;
                }
                if (!parent.containsKey(dependent)) {
                    parent.put(dependent, current);
                    queue.add(dependent);
                }
            }
        }
        return null;
    }

    private Set<String> toAddresses(Set<Integer> nodeIds) {
        Set<String> result = new LinkedHashSet<>();
        for (int id : nodeIds) {
            result.add(addresses.get(id));
        }
        return result;
    }
}
