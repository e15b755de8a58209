package org.smilesforge.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Copy helpers used by the node records to freeze their collections.
 * Absent collections become empty ones.
 */
final class AstCollections {

    private AstCollections() {
    }

    /**
     * Copies a bond list, mapping null entries to the empty string (single bond).
     */
    static List<String> bonds(List<String> bonds) {
        if (bonds == null || bonds.isEmpty()) {
            return List.of();
        }
        List<String> copy = new ArrayList<>(bonds.size());
        for (String bond : bonds) {
            copy.add(bond == null ? "" : bond);
        }
        return Collections.unmodifiableList(copy);
    }

    static <T> List<T> list(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    /**
     * Copies a position-keyed attachment map. Keys stay sorted so iteration follows atom order.
     */
    static Map<Integer, List<Attachment>> attachments(Map<Integer, List<Attachment>> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return Map.of();
        }
        TreeMap<Integer, List<Attachment>> copy = new TreeMap<>();
        attachments.forEach((position, list) -> {
            if (list != null && !list.isEmpty()) {
                copy.put(position, List.copyOf(list));
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    static <V> Map<Integer, V> map(Map<Integer, V> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new TreeMap<>(values));
    }

    static List<AstNode> children(Map<Integer, List<Attachment>> attachments) {
        List<AstNode> children = new ArrayList<>();
        attachments.values().forEach(list -> list.forEach(a -> children.add(a.node())));
        return children;
    }
}
