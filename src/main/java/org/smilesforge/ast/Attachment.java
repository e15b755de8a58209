package org.smilesforge.ast;

import java.util.Objects;

/**
 * A side branch hung off an atom of a chain or ring.
 *
 * @param node      The attached sub-tree.
 * @param placement Whether the sub-tree is a sibling branch or an inline continuation.
 */
public record Attachment(AstNode node, BranchPlacement placement) {

    public Attachment {
        Objects.requireNonNull(node, "node");
        placement = placement != null ? placement : BranchPlacement.UNSPECIFIED;
    }

    /**
     * Creates an attachment without an explicit placement.
     */
    public static Attachment of(AstNode node) {
        return new Attachment(node, BranchPlacement.UNSPECIFIED);
    }

    public static Attachment sibling(AstNode node) {
        return new Attachment(node, BranchPlacement.SIBLING);
    }

    public static Attachment inline(AstNode node) {
        return new Attachment(node, BranchPlacement.INLINE);
    }

    /**
     * @return true only if the placement was explicitly set to {@link BranchPlacement#INLINE}.
     */
    public boolean isInline() {
        return placement == BranchPlacement.INLINE;
    }

    public boolean isUnspecified() {
        return placement == BranchPlacement.UNSPECIFIED;
    }

    public Attachment withPlacement(BranchPlacement newPlacement) {
        return new Attachment(node, newPlacement);
    }
}
