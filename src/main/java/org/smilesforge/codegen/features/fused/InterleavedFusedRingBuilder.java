package org.smilesforge.codegen.features.fused;

import org.smilesforge.ast.Attachment;
import org.smilesforge.ast.FusedRingLayout;
import org.smilesforge.ast.FusedRingNode;
import org.smilesforge.ast.RingNode;
import org.smilesforge.ast.RingPlacement;
import org.smilesforge.codegen.ISmilesBuilder;
import org.smilesforge.codegen.RenderContext;
import org.smilesforge.codegen.branch.BranchDepths;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Renders a fused-ring system whose member rings carry absolute positions, e.g. naphthalene
 * written as {@code c1ccc2ccccc2c1}.
 * <p>
 * All member rings and sequential rings are merged into one {@link FusedRingSequence}. Positions
 * listed in the layout that belong to no ring become continuation atoms. An atom shared by several
 * rings takes its symbol, its bond and its attachments from the first ring that places it.
 */
public class InterleavedFusedRingBuilder implements ISmilesBuilder<FusedRingNode> {

    private static final String DEFAULT_CONTINUATION_ATOM = "C";

    @Override
    public String build(FusedRingNode fusedRing, RenderContext ctx) {
        FusedRingLayout layout = fusedRing.layout();
        List<Integer> allPositions = layout.allPositions();
        Map<Integer, Integer> depths = BranchDepths.normalize(layout.branchDepthMap(), allPositions);

        List<RingNode> rings = new ArrayList<>(fusedRing.rings());
        rings.addAll(layout.sequentialRings());

        FusedRingSequence.Builder sequence = new FusedRingSequence.Builder();
        Set<Integer> listed = new HashSet<>(allPositions);
        Set<Integer> ringPositions = new HashSet<>();
        Set<Integer> attached = new HashSet<>();

        for (RingNode ring : rings) {
            RingPlacement placement = placementOf(ring, ctx);
            sequence.marker(placement.start(), RingMarker.open(ring.ringNumber(), ring.closureBond()));
            sequence.marker(placement.end(), RingMarker.close(ring.ringNumber()));

            List<Integer> positions = placement.positions();
            for (int idx = 0; idx < positions.size(); idx++) {
                int position = positions.get(idx);
                int relative = idx + 1;
                if (!listed.contains(position)) {
                    ctx.reportMalformed("ring " + ring.ringNumber() + " places position " + position
                            + " which is not among the layout positions, skipping it");
                }
                ringPositions.add(position);

                String override = layout.atomValueMap().get(position);
                sequence.atom(position, override != null && !override.isEmpty() ? override : ring.atomAt(relative));
                if (idx > 0) {
                    sequence.bondBefore(position, ring.bondAt(idx - 1));
                }
                List<Attachment> attachments = ring.attachmentsAt(relative);
                if (!attachments.isEmpty() && attached.add(position)) {
                    sequence.attachments(position, attachments);
                }
            }
        }

        for (int position : allPositions) {
            if (sequence.hasAtom(position) || ringPositions.contains(position)) {
                continue;
            }
            String atom = layout.atomValueMap().get(position);
            if (atom == null || atom.isEmpty()) {
                ctx.reportMalformed("continuation atom at position " + position
                        + " has no atom value, using " + DEFAULT_CONTINUATION_ATOM);
                atom = DEFAULT_CONTINUATION_ATOM;
            }
            sequence.atom(position, atom)
                    .attachments(position, layout.sequentialAtomAttachments().getOrDefault(position, List.of()))
                    .bondBefore(position, layout.bondMap().get(position));
        }

        return sequence.build(allPositions, depths, layout.ringOrderMap(), true).render(ctx);
    }

    private static RingPlacement placementOf(RingNode ring, RenderContext ctx) {
        if (ring.hasPlacement()) {
            return ring.placement();
        }
        ctx.reportMalformed("ring " + ring.ringNumber() + " has no placement in an interleaved system, "
                + "using positions " + ring.offset() + ".." + (ring.offset() + ring.size() - 1));
        return RingPlacement.of(IntStream.range(ring.offset(), ring.offset() + ring.size()).boxed().toList());
    }
}
