package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.models.FormulaError;

import java.util.*;

/**
 * Cell dependency graph of one sheet, kept as two adjacency maps:
 * - forward: "cell" -> cells its formula reads
 * - reverse: "cell" -> cells whose formulas read it
 * The reverse map is always the exact transpose of the forward map.
 */
public class DependencyGraph {

    public static final List<String> CIRCULAR = List.of(FormulaError.CIRCULAR.text());

    // Forward adjacency: "B1" -> {"A1"} when B1 = A1 + 5
    private final Map<String, Set<String>> forward = new LinkedHashMap<>();
    // Reverse adjacency: "A1" -> {"B1"}
    private final Map<String, Set<String>> reverse = new LinkedHashMap<>();

    /**
     * Replaces the outgoing edges of 'cell' with 'refs', keeping the reverse
     * map in step. An empty collection leaves the cell with no edges.
     */
    public void setDependencies(String cell, Collection<String> refs) {
        removeDependencies(cell);
        if (refs == null || refs.isEmpty()) {
            return;
        }
        Set<String> targets = new LinkedHashSet<>(refs);
        forward.put(cell, targets);
        for (String target : targets) {
            reverse.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(cell);
        }
    }

    /**
     * Removes all outgoing edges of 'cell', and 'cell' from the reverse
     * adjacency of every cell it used to read.
     */
    public void removeDependencies(String cell) {
        Set<String> oldTargets = forward.remove(cell);
        if (oldTargets == null) {
            return;
        }
        for (String target : oldTargets) {
            Set<String> readers = reverse.get(target);
            if (readers != null) {
                readers.remove(cell);
                if (readers.isEmpty()) {
                    reverse.remove(target);
                }
            }
        }
    }

    public Set<String> getDependencies(String cell) {
        return Collections.unmodifiableSet(forward.getOrDefault(cell, Collections.emptySet()));
    }

    public Set<String> getDirectDependents(String cell) {
        return Collections.unmodifiableSet(reverse.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * Every cell that transitively reads 'cell', in an order where each cell
     * comes after all of its own dependencies among the result. Returns
     * {@link #CIRCULAR} when a cycle runs back into 'cell'.
     */
    public List<String> getDependents(String cell) {
        return getDependents(Collections.singletonList(cell));
    }

    /**
     * Dependents of several changed cells at once, topologically ordered as
     * a single list. A start cell is only listed when another start cell
     * reaches it.
     */
    public List<String> getDependents(Collection<String> cells) {
        Set<String> starts = new LinkedHashSet<>(cells);
        Set<String> done = new HashSet<>();
        List<String> postOrder = new ArrayList<>();

        for (String start : starts) {
            if (done.contains(start)) {
                continue;
            }
            Set<String> onPath = new HashSet<>();
            Deque<Iterator<String>> stack = new ArrayDeque<>();
            Deque<String> path = new ArrayDeque<>();
            onPath.add(start);
            path.push(start);
            stack.push(reverse.getOrDefault(start, Collections.emptySet()).iterator());

            while (!stack.isEmpty()) {
                Iterator<String> children = stack.peek();
                if (children.hasNext()) {
                    String child = children.next();
                    if (onPath.contains(child)) {
                        return CIRCULAR;
                    }
                    if (done.contains(child)) {
                        continue;
                    }
                    onPath.add(child);
                    path.push(child);
                    stack.push(reverse.getOrDefault(child, Collections.emptySet()).iterator());
                } else {
                    stack.pop();
                    String finished = path.pop();
                    onPath.remove(finished);
                    done.add(finished);
                    postOrder.add(finished);
                }
            }
        }

        // reverse post-order of the reverse graph is a topological order
        List<String> ordered = new ArrayList<>();
        for (int i = postOrder.size() - 1; i >= 0; i--) {
            String id = postOrder.get(i);
            if (!starts.contains(id) || reachedFromOtherStart(id, starts)) {
                ordered.add(id);
            }
        }
        return ordered;
    }

    /**
     * Would giving 'cell' the edges 'proposedRefs' close a cycle? True when
     * 'cell' is reachable from any proposed reference along forward edges,
     * including a direct self reference.
     */
    public boolean hasCircular(String cell, Collection<String> proposedRefs) {
        Deque<String> stack = new ArrayDeque<>(proposedRefs);
        Set<String> visited = new HashSet<>();
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(cell)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            for (String next : forward.getOrDefault(current, Collections.emptySet())) {
                if (!visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        return false;
    }

    // Read-only views of the adjacency maps
    public Map<String, Set<String>> getForwardGraph() {
        return unmodifiable(forward);
    }

    public Map<String, Set<String>> getReverseGraph() {
        return unmodifiable(reverse);
    }

    public void clear() {
        forward.clear();
        reverse.clear();
    }

    // a start cell is a dependent of another start when its formula reads it transitively
    private boolean reachedFromOtherStart(String id, Set<String> starts) {
        if (starts.size() == 1) {
            return false;
        }
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>(forward.getOrDefault(id, Collections.emptySet()));
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!seen.add(current)) {
                continue;
            }
            if (starts.contains(current) && !current.equals(id)) {
                return true;
            }
            stack.addAll(forward.getOrDefault(current, Collections.emptySet()));
        }
        return false;
    }

    private static Map<String, Set<String>> unmodifiable(Map<String, Set<String>> graph) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : graph.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }
}
