package org.smilesforge.codegen.features.linear;

import org.smilesforge.ast.Attachment;
import org.smilesforge.ast.LinearNode;
import org.smilesforge.codegen.ISmilesBuilder;
import org.smilesforge.codegen.RenderContext;

import java.util.List;

/**
 * Renders a linear chain atom by atom. Attachments of a chain are always written as
 * parenthesised side branches.
 */
public class LinearBuilder implements ISmilesBuilder<LinearNode> {

    @Override
    public String build(LinearNode node, RenderContext ctx) {
        List<String> atoms = node.atoms();
        List<String> bonds = node.bonds();
        boolean branchShape = node.hasBranchBondShape();
        StringBuilder out = new StringBuilder();

        for (int i = 0; i < atoms.size(); i++) {
            String bond;
            if (branchShape) {
                bond = bonds.get(i);
            } else {
                bond = i > 0 && i - 1 < bonds.size() ? bonds.get(i - 1) : "";
            }
            out.append(bond).append(atoms.get(i));

            for (Attachment attachment : node.attachments().getOrDefault(i + 1, List.of())) {
                out.append('(').append(ctx.render(attachment.node())).append(')');
            }
        }
        return out.toString();
    }
}
