package com.storyarchitect.validation;

import com.storyarchitect.models.Precedence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Directed "happens before" graph over timeline event keys, with the stage
 * result that asserted each edge.
 */
public class PrecedenceGraph {

    private final Map<String, Map<String, String>> edges = new HashMap<>();

    public static PrecedenceGraph of(List<Precedence> precedences) {
        PrecedenceGraph graph = new PrecedenceGraph();
        for (Precedence precedence : precedences) {
            graph.add(precedence.getBefore(), precedence.getAfter(), precedence.getAssertedBy());
        }
        return graph;
    }

    public void add(String before, String after, String assertedBy) {
        edges.computeIfAbsent(before, k -> new HashMap<>()).putIfAbsent(after, assertedBy);
    }

    public boolean reaches(String from, String to) {
        return !path(from, to).isEmpty();
    }

    /**
     * Event keys along a shortest path from {@code from} to {@code to},
     * both ends included, or an empty list when {@code to} is unreachable.
     */
    public List<String> path(String from, String to) {
        if (from.equals(to)) {
            return List.of(from);
        }
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        parent.put(from, from);
        while (!queue.isEmpty()) {
            String node = queue.poll();
            for (String next : edges.getOrDefault(node, Map.of()).keySet()) {
                if (parent.containsKey(next)) {
                    continue;
                }
                parent.put(next, node);
                if (next.equals(to)) {
                    List<String> path = new ArrayList<>();
                    for (String step = to; !step.equals(from); step = parent.get(step)) {
                        path.add(step);
                    }
                    path.add(from);
                    Collections.reverse(path);
                    return path;
                }
                queue.add(next);
            }
        }
        return List.of();
    }

    public String assertedBy(String before, String after) {
        return edges.getOrDefault(before, Map.of()).get(after);
    }
}
