package com.intenovation.mailsync.thread;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Conversation graph over local record ids, kept as parent pointers.
 * <p>
 * Children are derived on demand. Besides parents a root may be joined to
 * another node, which puts it in that node's thread without making it a reply;
 * this is how siblings under a missing thread root stay together. Every walk
 * carries a visited set, so a cycle in the pointers never loops.
 */
public class ThreadForest {
    private static final Logger LOGGER = Logger.getLogger(ThreadForest.class.getName());

    private final Set<Long> nodes = new LinkedHashSet<>();
    private final Map<Long, Long> parents = new HashMap<>();
    private final Map<Long, Long> joins = new HashMap<>();

    public ThreadForest add(long id) {
        nodes.add(id);
        return this;
    }

    public boolean contains(long id) {
        return nodes.contains(id);
    }

    /**
     * Make one node a reply to another. Self references are ignored.
     */
    public ThreadForest setParent(long child, long parent) {
        add(child);
        add(parent);
        if (child != parent) {
            parents.put(child, parent);
            joins.remove(child);
        }
        return this;
    }

    /**
     * Put a node into the thread of another without a reply edge
     */
    public ThreadForest join(long member, long anchor) {
        add(member);
        add(anchor);
        if (member != anchor && !parents.containsKey(member)) {
            joins.put(member, anchor);
        }
        return this;
    }

    public Long getParent(long id) {
        return parents.get(id);
    }

    public boolean hasParent(long id) {
        return parents.containsKey(id);
    }

    /**
     * The direct replies of a node, in insertion order
     */
    List<Long> getChildren(long id) {
        List<Long> children = new ArrayList<>();
        for (Long node : nodes) {
            Long parent = parents.get(node);
            if (parent != null && parent == id) {
                children.add(node);
            }
        }
        return children;
    }

    /**
     * All nodes below a node, depth first
     */
    List<Long> getDescendants(long id) {
        List<Long> result = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        visited.add(id);
        collect(id, visited, result);
        return result;
    }

    private void collect(long id, Set<Long> visited, List<Long> result) {
        for (Long child : getChildren(id)) {
            if (visited.add(child)) {
                result.add(child);
                collect(child, visited, result);
            }
        }
    }

    /**
     * Remove the parent and join pointers of one node on every cycle. Of the
     * nodes on a cycle the one added first is detached, which opens that cycle
     * for every other member.
     * <p>
     * Every node has at most one pointer up, so one walk per unvisited node that
     * stops at the first node already seen covers the graph in linear time. A walk
     * that meets a node of its own path has found a cycle.
     *
     * @return The detached nodes, in insertion order
     */
    public List<Long> breakCycles() {
        Map<Long, Integer> order = new HashMap<>();
        for (Long node : nodes) {
            order.put(node, order.size());
        }

        Set<Long> finished = new HashSet<>();
        List<Long> detached = new ArrayList<>();
        for (Long start : nodes) {
            if (finished.contains(start)) {
                continue;
            }
            List<Long> path = new ArrayList<>();
            Map<Long, Integer> onPath = new HashMap<>();
            Long current = start;
            while (current != null && !finished.contains(current) && !onPath.containsKey(current)) {
                onPath.put(current, path.size());
                path.add(current);
                current = up(current);
            }
            if (current != null && onPath.containsKey(current)) {
                long first = current;
                for (int i = onPath.get(current); i < path.size(); i++) {
                    if (order.get(path.get(i)) < order.get(first)) {
                        first = path.get(i);
                    }
                }
                LOGGER.warning("Thread cycle through message " + first + ", leaving it unparented");
                parents.remove(first);
                joins.remove(first);
                detached.add(first);
            }
            for (Long node : path) {
                finished.add(node);
            }
        }
        detached.sort(Comparator.comparing(order::get));
        return detached;
    }

    /**
     * The node whose identity names the thread of a node: follow parents to the
     * top, then any join from there
     */
    public long getThreadRoot(long id) {
        Set<Long> visited = new HashSet<>();
        long current = id;
        visited.add(current);
        Long next = up(current);
        while (next != null) {
            if (!visited.add(next)) {
                LOGGER.warning("Thread cycle reached from message " + id);
                return current;
            }
            current = next;
            next = up(current);
        }
        return current;
    }

    private Long up(long id) {
        Long parent = parents.get(id);
        return parent != null ? parent : joins.get(id);
    }

    public Set<Long> getNodes() {
        return nodes;
    }
}
