package org.smilesforge.ast;

import java.util.List;

/**
 * Common contract for all nodes of the molecule AST.
 * <p>
 * Nodes are immutable. The code generator only reads them.
 */
public interface AstNode {

    /**
     * Returns the sub-trees hosted by this node, in the order they are rendered.
     * For rings and chains these are the attachment nodes; for molecules the components.
     *
     * @return The child nodes, never null.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}
