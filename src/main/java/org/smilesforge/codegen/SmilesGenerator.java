package org.smilesforge.codegen;

import org.smilesforge.ast.AstNode;
import org.smilesforge.validation.SmilesSyntaxValidator;
import org.smilesforge.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a molecule AST into SMILES line notation.
 * <p>
 * The generator is immutable. Each {@link #render(AstNode)} call owns its own
 * {@link RenderContext}, so one generator can be shared between threads.
 * <p>
 * Rendering recurses once per attachment level. Trees nested deeper than
 * {@link CodegenOptions#maxNestingDepth()} are rejected with a
 * {@link NestingDepthExceededException}.
 */
public class SmilesGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SmilesGenerator.class);

    private final SmilesBuilderRegistry registry;
    private final CodegenOptions options;
    private final SmilesSyntaxValidator validator = new SmilesSyntaxValidator();

    public SmilesGenerator() {
        this(CodegenOptions.defaults());
    }

    public SmilesGenerator(CodegenOptions options) {
        this(SmilesBuilderRegistry.initializeWithDefaults(), options);
    }

    /**
     * Constructs a generator with a custom registry.
     *
     * @param registry The builders to dispatch to. Must not be modified afterwards.
     * @param options  The generator options.
     */
    public SmilesGenerator(SmilesBuilderRegistry registry, CodegenOptions options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Renders a tree.
     *
     * @param root The root node, usually a molecule.
     * @return The line notation.
     * @throws SmilesCodegenException if the tree cannot be rendered.
     */
    public String render(AstNode root) {
        RenderContext ctx = new RenderContext(registry, options);
        String smiles = ctx.render(root);
        LOG.trace("Rendered {} as {}", root.getClass().getSimpleName(), smiles);

        if (options.verifyOutput()) {
            ValidationResult result = validator.validate(smiles);
            if (!result.valid()) {
                throw new InvalidOutputException(smiles, result.error());
            }
        }
        return smiles;
    }

    public CodegenOptions options() {
        return options;
    }
}
