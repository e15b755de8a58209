package org.smilesforge.codegen;

/**
 * Thrown when attachments nest deeper than {@link CodegenOptions#maxNestingDepth()}.
 * Raised in place of a {@link StackOverflowError} on pathologically deep trees.
 */
public class NestingDepthExceededException extends SmilesCodegenException {

    private final int limit;

    public NestingDepthExceededException(int limit) {
        super("AST nesting exceeds the configured limit of " + limit + " levels");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
