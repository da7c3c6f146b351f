package com.finmod.drg.engine;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Topology -- CSR-encoded static DAG over cell addresses.
 *
 * <p>
 * Built once from the committed edge set and never modified afterwards. The
 * graph is flattened into structure-of-arrays so reachability queries walk
 * plain int arrays instead of hashing addresses at every hop:
 * <ul>
 * <li><b>topoOrder:</b> all addresses sorted topologically (referenced cells
 * before referencing cells).</li>
 * <li><b>childrenList / childrenOffset:</b> dependents of each node, as
 * topological indices. The dependents of node {@code i} are
 * {@code childrenList[childrenOffset[i] .. childrenOffset[i+1])}.</li>
 * <li><b>parentList / parentOffset:</b> the same layout for dependencies.</li>
 * </ul>
 */
@Log4j2
public final class TopologicalOrder {
    // Addresses in topological order.
    private final String[] topoOrder;

    // CSR: dependents
    private final int[] childrenOffset;
    private final int[] childrenList;

    // CSR: dependencies
    private final int[] parentOffset;
    private final int[] parentList;

    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(String[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentOffset, int[] parentList, Map<String, Integer> nameToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentOffset = parentOffset;
        this.parentList = parentList;
        this.nameToIndex = nameToIndex;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    public int edgeCount() {
        return childrenList.length;
    }

    /** Address at the given topological index. */
    public String address(int ti) {
        return topoOrder[ti];
    }

    /** Resolves an address to its topological index, or -1 if absent. */
    public int indexOf(String address) {
        Integer idx = nameToIndex.get(address);
        return idx == null ? -1 : idx;
    }

    /** Resolves an address to its topological index. O(1) hash lookup. */
    public int topoIndex(String address) {
        Integer idx = nameToIndex.get(address);
        if (idx == null)
            throw new IllegalArgumentException("Unknown cell: " + address);
        return idx;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentOffset[ti + 1] - parentOffset[ti];
    }

    public int parent(int ti, int i) {
        return parentList[parentOffset[ti] + i];
    }

    /** Addresses in topological order. */
    public List<String> order() {
        return Collections.unmodifiableList(Arrays.asList(topoOrder));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<Set<Integer>> forwardEdges = new ArrayList<>();
        private int maxCycleSamples = CycleFinder.DEFAULT_SAMPLE_LIMIT;

        public Builder addNode(String address) {
            if (nameToIdx.containsKey(address))
                throw new IllegalArgumentException("Duplicate cell: " + address);
            nameToIdx.put(address, names.size());
            names.add(address);
            forwardEdges.add(new LinkedHashSet<>());
            return this;
        }

        /**
         * Adds an edge {@code from -> to}, i.e. {@code to} reads {@code from}.
         * Self-edges are accepted and reported as one-cell cycles by
         * {@link #build()}.
         */
        public Builder addEdge(String from, String to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        public Builder maxCycleSamples(int limit) {
            if (limit < 1)
                throw new IllegalArgumentException("Cycle sample limit must be positive: " + limit);
            this.maxCycleSamples = limit;
            return this;
        }

        private int requireIndex(String address) {
            Integer idx = nameToIdx.get(address);
            if (idx == null)
                throw new IllegalArgumentException("Unknown cell: " + address);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm for topological sorting and cycle detection.
         *
         * @throws CircularReferenceException if any cycle exists.
         */
        public TopologicalOrder build() {
            int n = names.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (Set<Integer> children : forwardEdges)
                for (int child : children)
                    inDegree[child]++;

            // 2. Initialize queue with nodes having in-degree 0
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // 3. Process queue (Kahn's algorithm)
            int[] topoMap = new int[n], reverseMap = new int[n];
            boolean[] ordered = new boolean[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                ordered[curr] = true;
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child; // Child is now ready
            }
            if (topoIdx != n) {
                List<List<String>> cycles = new CycleFinder(names, forwardEdges)
                        .findCycles(ordered, maxCycleSamples);
                log.warn("Cycle detected: ordered {} of {} cells, sample {}", topoIdx, n, cycles);
                throw new CircularReferenceException(cycles);
            }

            // 4. Construct compact arrays
            String[] orderedNames = new String[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                orderedNames[ti] = names.get(reverseMap[ti]);
                newNameToIndex.put(orderedNames[ti], ti);
            }

            // 5. Build CSR structure for children, counting parents on the way
            int[] childOffsets = new int[n + 1];
            int[] parentCounts = new int[n];
            for (int ti = 0; ti < n; ti++) {
                Set<Integer> children = forwardEdges.get(reverseMap[ti]);
                childOffsets[ti + 1] = childOffsets[ti] + children.size();
                for (int child : children)
                    parentCounts[topoMap[child]]++;
            }
            int totalEdges = childOffsets[n];
            int[] flatChildren = new int[totalEdges];
            for (int ti = 0; ti < n; ti++) {
                int j = childOffsets[ti];
                for (int child : forwardEdges.get(reverseMap[ti]))
                    flatChildren[j++] = topoMap[child];
            }

            // 6. Same for parents, filled from the child lists
            int[] parentOffsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                parentOffsets[ti + 1] = parentOffsets[ti] + parentCounts[ti];
            int[] fill = Arrays.copyOf(parentOffsets, n);
            int[] flatParents = new int[totalEdges];
            for (int ti = 0; ti < n; ti++)
                for (int k = childOffsets[ti]; k < childOffsets[ti + 1]; k++)
                    flatParents[fill[flatChildren[k]]++] = ti;

            return new TopologicalOrder(orderedNames, childOffsets, flatChildren,
                    parentOffsets, flatParents, newNameToIndex);
        }
    }
}
