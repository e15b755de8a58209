package org.smilesforge.codegen.features.molecule;

import org.smilesforge.ast.MoleculeNode;
import org.smilesforge.codegen.ISmilesBuilder;
import org.smilesforge.codegen.RenderContext;

import java.util.List;

/**
 * Renders a molecule by concatenating its components. Every component after the first is
 * prefixed with its leading bond, if it has one.
 */
public class MoleculeBuilder implements ISmilesBuilder<MoleculeNode> {

    @Override
    public String build(MoleculeNode node, RenderContext ctx) {
        StringBuilder out = new StringBuilder();
        List<MoleculeNode.Component> components = node.components();
        for (int i = 0; i < components.size(); i++) {
            MoleculeNode.Component component = components.get(i);
            if (i > 0 && component.hasLeadingBond()) {
                out.append(component.leadingBond());
            }
            out.append(ctx.render(component.node()));
        }
        return out.toString();
    }
}
