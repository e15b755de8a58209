package org.smilesforge.codegen;

import org.smilesforge.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one top-level render call.
 * <p>
 * Every builder renders attachment sub-trees through {@link #render(AstNode)}, which dispatches on
 * the node class and tracks how deeply the renders are nested. A context is confined to the thread
 * that created it; independent renders each own a context.
 */
public final class RenderContext {

    private static final Logger LOG = LoggerFactory.getLogger(RenderContext.class);

    private final SmilesBuilderRegistry registry;
    private final CodegenOptions options;
    private int nestingDepth = 0;

    public RenderContext(SmilesBuilderRegistry registry, CodegenOptions options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Renders a node with the builder registered for its class.
     *
     * @param node The node to render.
     * @return The rendered text.
     * @throws UnknownNodeKindException       if the node is null or no builder handles its class.
     * @throws NestingDepthExceededException if nesting exceeds {@link CodegenOptions#maxNestingDepth()}.
     */
    @SuppressWarnings("unchecked")
    public String render(AstNode node) {
        if (node == null) {
            throw new UnknownNodeKindException(null);
        }
        ISmilesBuilder<AstNode> builder = (ISmilesBuilder<AstNode>) registry.resolve(node.getClass())
                .orElseThrow(() -> new UnknownNodeKindException(node.getClass()));

        if (nestingDepth >= options.maxNestingDepth()) {
            throw new NestingDepthExceededException(options.maxNestingDepth());
        }
        nestingDepth++;
        try {
            return builder.build(node, this);
        } finally {
            nestingDepth--;
        }
    }

    /**
     * Reports inconsistent metadata. Throws in strict mode, otherwise logs and lets the caller
     * continue with its fallback value.
     *
     * @param message Description of the inconsistency and the fallback used.
     * @throws MalformedAstException if {@link CodegenOptions#strictMetadata()} is set.
     */
    public void reportMalformed(String message) {
        if (options.strictMetadata()) {
            throw new MalformedAstException(message);
        }
        LOG.debug("Lenient metadata fallback: {}", message);
    }

    public CodegenOptions options() {
        return options;
    }

    /**
     * @return The number of renders currently on the call stack.
     */
    public int nestingDepth() {
        return nestingDepth;
    }
}
