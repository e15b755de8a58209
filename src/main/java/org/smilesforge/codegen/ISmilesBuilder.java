package org.smilesforge.codegen;

import org.smilesforge.ast.AstNode;

/**
 * Renders one kind of AST node into line notation.
 * Builders call back into {@link RenderContext#render(AstNode)} for attachment sub-trees.
 *
 * @param <T> The concrete AST node type handled by this builder.
 */
public interface ISmilesBuilder<T extends AstNode> {

    /**
     * Renders the node.
     *
     * @param node The node to render.
     * @param ctx  The state of the current render call.
     * @return The rendered text.
     */
    String build(T node, RenderContext ctx);
}
