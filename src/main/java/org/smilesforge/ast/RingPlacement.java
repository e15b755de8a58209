package org.smilesforge.ast;

import java.util.List;

/**
 * Absolute placement of a ring inside an interleaved fused-ring system.
 *
 * @param positions The absolute position of each ring atom, in ring order.
 * @param start     The position where the ring-closure label is opened.
 * @param end       The position where the ring-closure label is closed.
 */
public record RingPlacement(List<Integer> positions, int start, int end) {

    public RingPlacement {
        positions = AstCollections.list(positions);
    }

    /**
     * Creates a placement that opens at the first position and closes at the last one.
     */
    public static RingPlacement of(List<Integer> positions) {
        if (positions.isEmpty()) {
            throw new IllegalArgumentException("Ring placement needs at least one position");
        }
        return new RingPlacement(positions, positions.get(0), positions.get(positions.size() - 1));
    }
}
