package org.smilesforge.codegen;

/**
 * Thrown when the dispatcher receives a node for which no builder is registered,
 * including a {@code null} node.
 */
public class UnknownNodeKindException extends SmilesCodegenException {

    private final Class<?> nodeType;

    public UnknownNodeKindException(Class<?> nodeType) {
        super("Unknown AST node kind: " + (nodeType == null ? "null" : nodeType.getSimpleName()));
        this.nodeType = nodeType;
    }

    /**
     * @return The offending node class, or null if the node itself was null.
     */
    public Class<?> getNodeType() {
        return nodeType;
    }
}
