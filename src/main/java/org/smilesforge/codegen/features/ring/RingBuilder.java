package org.smilesforge.codegen.features.ring;

import org.smilesforge.ast.FusedRingLayout;
import org.smilesforge.ast.FusedRingNode;
import org.smilesforge.ast.RingNode;
import org.smilesforge.codegen.ISmilesBuilder;
import org.smilesforge.codegen.RenderContext;
import org.smilesforge.codegen.branch.BranchDepths;
import org.smilesforge.codegen.features.fused.InterleavedFusedRingBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Renders a single ring.
 * <p>
 * A ring followed by sequential rings is rendered as a one-member interleaved fused ring; a ring
 * whose branch depths differ between positions goes to the {@link BranchCrossingRingBuilder}.
 * Every other ring is written flat: the closure label follows the first atom (preceded by the
 * closure bond) and the last atom, and attachments are parenthesised after their atom.
 */
public class RingBuilder implements ISmilesBuilder<RingNode> {

    private static final Logger LOG = LoggerFactory.getLogger(RingBuilder.class);

    private final BranchCrossingRingBuilder branchCrossing;
    private final InterleavedFusedRingBuilder interleaved;

    public RingBuilder(BranchCrossingRingBuilder branchCrossing, InterleavedFusedRingBuilder interleaved) {
        this.branchCrossing = branchCrossing;
        this.interleaved = interleaved;
    }

    @Override
    public String build(RingNode ring, RenderContext ctx) {
        FusedRingLayout layout = ring.layout();
        if (layout != null && layout.hasSequentialRings() && !layout.allPositions().isEmpty()) {
            LOG.debug("Ring {} carries {} sequential ring(s), rendering as interleaved system",
                    ring.ringNumber(), layout.sequentialRings().size());
            return interleaved.build(new FusedRingNode(List.of(ring), layout), ctx);
        }
        if (BranchDepths.isNonUniform(ring.branchDepths())) {
            LOG.debug("Ring {} crosses a branch boundary, depths {}", ring.ringNumber(), ring.branchDepths());
            return branchCrossing.build(ring, ctx);
        }
        return buildFlat(ring, ctx);
    }

    private String buildFlat(RingNode ring, RenderContext ctx) {
        String label = Integer.toString(ring.ringNumber());
        StringBuilder out = new StringBuilder();

        for (int i = 1; i <= ring.size(); i++) {
            if (i > 1) {
                out.append(ring.bondAt(i - 2));
            }
            out.append(ring.atomAt(i));
            if (i == 1) {
                out.append(ring.closureBond()).append(label);
            }
            if (i == ring.size()) {
                out.append(label);
            }
            ring.attachmentsAt(i).forEach(attachment ->
                    out.append('(').append(ctx.render(attachment.node())).append(')'));
        }
        return out.toString();
    }
}
