package org.smilesforge.codegen;

import org.smilesforge.ast.AstNode;
import org.smilesforge.ast.FusedRingNode;
import org.smilesforge.ast.LinearNode;
import org.smilesforge.ast.MoleculeNode;
import org.smilesforge.ast.RingNode;
import org.smilesforge.codegen.features.fused.FusedRingBuilder;
import org.smilesforge.codegen.features.fused.InterleavedFusedRingBuilder;
import org.smilesforge.codegen.features.fused.SimpleFusedRingBuilder;
import org.smilesforge.codegen.features.linear.LinearBuilder;
import org.smilesforge.codegen.features.molecule.MoleculeBuilder;
import org.smilesforge.codegen.features.ring.BranchCrossingRingBuilder;
import org.smilesforge.codegen.features.ring.RingBuilder;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to the builders that render them.
 * <p>
 * Populate the registry before handing it to a {@link SmilesGenerator}; lookups during rendering
 * are read-only, so one registry can serve concurrent renders.
 */
public final class SmilesBuilderRegistry {

    private final Map<Class<? extends AstNode>, ISmilesBuilder<? extends AstNode>> builders = new HashMap<>();

    /**
     * Registers a builder for the given node class, replacing any previous one.
     *
     * @param nodeType The concrete AST node class.
     * @param builder  The builder instance.
     * @param <T>      Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, ISmilesBuilder<T> builder) {
        builders.put(nodeType, builder);
    }

    /**
     * Resolves the builder for the given node class.
     *
     * @param nodeType The AST node class to look up.
     * @return Optional builder if registered.
     */
    public Optional<ISmilesBuilder<? extends AstNode>> resolve(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(builders.get(nodeType));
    }

    /**
     * Creates a registry with the builders for molecules, chains, rings and fused rings.
     *
     * @return A fully initialized registry.
     */
    public static SmilesBuilderRegistry initializeWithDefaults() {
        SmilesBuilderRegistry registry = new SmilesBuilderRegistry();
        InterleavedFusedRingBuilder interleaved = new InterleavedFusedRingBuilder();

        registry.register(MoleculeNode.class, new MoleculeBuilder());
        registry.register(LinearNode.class, new LinearBuilder());
        registry.register(RingNode.class, new RingBuilder(new BranchCrossingRingBuilder(), interleaved));
        registry.register(FusedRingNode.class, new FusedRingBuilder(interleaved, new SimpleFusedRingBuilder()));
        return registry;
    }
}
