package org.smilesforge.codegen.features.ring;

import org.smilesforge.ast.RingNode;
import org.smilesforge.codegen.ISmilesBuilder;
import org.smilesforge.codegen.RenderContext;
import org.smilesforge.codegen.branch.BranchDepths;
import org.smilesforge.codegen.branch.BranchWalker;
import org.smilesforge.codegen.branch.ClosePolicy;

import java.util.List;

/**
 * Renders a ring whose closure lies at a different branch depth than its opening atom,
 * e.g. {@code C1CCC(CC1)(CC(=O)O)CN}.
 * <p>
 * Depths are normalised to start at 0 and walked with the {@link ClosePolicy#SIBLING_SPLIT}
 * policy: attachments of an atom that opens an inline branch are held back until that branch
 * closes, inline ones inside the closing parenthesis and sibling ones after it.
 */
public class BranchCrossingRingBuilder implements ISmilesBuilder<RingNode> {

    @Override
    public String build(RingNode ring, RenderContext ctx) {
        List<Integer> depths = BranchDepths.normalize(ring.branchDepths());
        if (depths.size() < ring.size()) {
            ctx.reportMalformed("ring " + ring.ringNumber() + " has " + depths.size()
                    + " branch depths for " + ring.size() + " atoms, missing positions use depth 0");
        }
        String label = Integer.toString(ring.ringNumber());
        BranchWalker walker = new BranchWalker(ctx, ClosePolicy.SIBLING_SPLIT);

        for (int i = 1; i <= ring.size(); i++) {
            int depth = depthAt(depths, i - 1);
            walker.moveTo(depth);

            if (i > 1) {
                walker.append(ring.bondAt(i - 2));
            }
            walker.append(ring.atomAt(i));
            if (i == 1) {
                walker.append(ring.closureBond()).append(label);
            }
            if (i == ring.size()) {
                walker.append(label);
            }

            int nextDepth = i < ring.size() ? depthAt(depths, i) : 0;
            walker.placeAttachments(ring.attachmentsAt(i), nextDepth > depth);
        }
        return walker.finish();
    }

    private static int depthAt(List<Integer> depths, int index) {
        return index < depths.size() ? depths.get(index) : 0;
    }
}
