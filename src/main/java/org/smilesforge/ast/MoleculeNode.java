package org.smilesforge.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The root of a molecule: an ordered sequence of chain, ring and fused-ring components.
 *
 * @param components The components in output order.
 */
public record MoleculeNode(List<Component> components) implements AstNode {

    public MoleculeNode {
        components = AstCollections.list(components);
    }

    /**
     * Creates a molecule whose components are joined without explicit bonds.
     */
    public static MoleculeNode of(AstNode... nodes) {
        List<Component> components = new ArrayList<>(nodes.length);
        for (AstNode node : nodes) {
            components.add(new Component(node, null));
        }
        return new MoleculeNode(components);
    }

    @Override
    public List<AstNode> getChildren() {
        return components.stream().map(Component::node).toList();
    }

    /**
     * One component of a molecule.
     *
     * @param node        The component node.
     * @param leadingBond Bond symbol joining this component to the previous one, or null.
     */
    public record Component(AstNode node, String leadingBond) {

        public Component {
            Objects.requireNonNull(node, "node");
        }

        public Component(AstNode node) {
            this(node, null);
        }

        public boolean hasLeadingBond() {
            return leadingBond != null && !leadingBond.isEmpty();
        }
    }
}
