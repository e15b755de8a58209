package org.smilesforge.codegen.branch;

import org.smilesforge.ast.Attachment;
import org.smilesforge.ast.BranchPlacement;

/**
 * Decides where deferred attachments are written when a branch closes.
 */
public enum ClosePolicy {

    /**
     * All attachments deferred at a depth are written right after the {@code )} that returns to it.
     * Placement is taken from the attachment as given.
     */
    INTERLEAVED,

    /**
     * Inline attachments are written before the {@code )} that ends their depth, sibling
     * attachments after it. An attachment without placement whose host atom is followed by an
     * inline branch counts as inline.
     */
    SIBLING_SPLIT;

    /**
     * Resolves the placement an attachment is rendered with.
     *
     * @param attachment          The attachment as declared on the node.
     * @param inlineBranchFollows Whether a deeper branch opens right after the host atom.
     * @return The attachment with an explicit placement.
     */
    public Attachment resolvePlacement(Attachment attachment, boolean inlineBranchFollows) {
        if (!attachment.isUnspecified()) {
            return attachment;
        }
        if (this == SIBLING_SPLIT && inlineBranchFollows) {
            return attachment.withPlacement(BranchPlacement.INLINE);
        }
        return attachment.withPlacement(BranchPlacement.SIBLING);
    }
}
