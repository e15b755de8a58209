package org.smilesforge.ast;

/**
 * How an attachment is written relative to the atom that hosts it.
 */
public enum BranchPlacement {
    /** No explicit choice; the builder that emits the attachment decides. */
    UNSPECIFIED,
    /** Wrapped in its own parentheses. */
    SIBLING,
    /** Written as a plain continuation of the current chain, without parentheses. */
    INLINE
}
