package org.smilesforge.codegen.branch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalisation of branch-depth metadata. Depths are relative to the enclosing context, so the
 * shallowest position is shifted to depth 0 before traversal.
 */
public final class BranchDepths {

    private BranchDepths() {
    }

    /**
     * Shifts a depth list so its minimum is 0.
     *
     * @param depths Per-position depths.
     * @return The normalised depths; an empty list stays empty.
     */
    public static List<Integer> normalize(List<Integer> depths) {
        if (depths.isEmpty()) {
            return List.of();
        }
        int min = Collections.min(depths);
        List<Integer> normalized = new ArrayList<>(depths.size());
        for (int depth : depths) {
            normalized.add(depth - min);
        }
        return normalized;
    }

    /**
     * Shifts a position-keyed depth map so the minimum over {@code positions} is 0.
     * Positions missing from the map count as depth 0.
     *
     * @param depths    Depth per absolute position.
     * @param positions The positions in scope.
     * @return Normalised depth for every position in scope.
     */
    public static Map<Integer, Integer> normalize(Map<Integer, Integer> depths, Collection<Integer> positions) {
        int min = Integer.MAX_VALUE;
        for (Integer position : positions) {
            min = Math.min(min, depths.getOrDefault(position, 0));
        }
        if (min == Integer.MAX_VALUE) {
            min = 0;
        }
        Map<Integer, Integer> normalized = new HashMap<>();
        for (Integer position : positions) {
            normalized.put(position, depths.getOrDefault(position, 0) - min);
        }
        return normalized;
    }

    /**
     * @return true if the list has at least two different values.
     */
    public static boolean isNonUniform(List<Integer> depths) {
        if (depths.isEmpty()) {
            return false;
        }
        int first = depths.get(0);
        return depths.stream().anyMatch(depth -> depth != first);
    }
}
