package org.smilesforge.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A group of rings that share atoms.
 * <p>
 * With a {@link FusedRingLayout} and member rings carrying a {@link RingPlacement}, the rings are
 * interleaved by absolute position. Without one, each ring is placed at its integer
 * {@link RingNode#offset()} in a shared position space.
 *
 * @param rings  The member rings.
 * @param layout Global position data, or null for the offset representation.
 */
public record FusedRingNode(List<RingNode> rings, FusedRingLayout layout) implements AstNode {

    public FusedRingNode {
        rings = AstCollections.list(rings);
    }

    public FusedRingNode(List<RingNode> rings) {
        this(rings, null);
    }

    public static FusedRingNode of(RingNode... rings) {
        return new FusedRingNode(List.of(rings), null);
    }

    /**
     * @return true if the interleaved representation applies: the layout lists global positions and
     *         at least one member ring is explicitly placed.
     */
    public boolean hasPositionData() {
        return layout != null
                && !layout.allPositions().isEmpty()
                && rings.stream().anyMatch(RingNode::hasPlacement);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        rings.forEach(ring -> children.addAll(ring.getChildren()));
        if (layout != null) {
            layout.sequentialRings().forEach(ring -> children.addAll(ring.getChildren()));
            layout.sequentialAtomAttachments().values()
                    .forEach(list -> list.forEach(a -> children.add(a.node())));
        }
        return children;
    }
}
