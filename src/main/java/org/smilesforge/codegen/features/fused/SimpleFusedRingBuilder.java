package org.smilesforge.codegen.features.fused;

import org.smilesforge.ast.FusedRingNode;
import org.smilesforge.ast.RingNode;
import org.smilesforge.codegen.ISmilesBuilder;
import org.smilesforge.codegen.RenderContext;
import org.smilesforge.codegen.branch.BranchDepths;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a fused-ring system whose member rings are placed by integer offset into one shared
 * position space.
 * <p>
 * Rings are laid down in offset order. An overlapping position keeps the atom and bond of the
 * first ring that reaches it but collects the attachments of every ring. When any position sits
 * inside a branch the sequence is walked depth by depth; otherwise it is written in one pass.
 */
public class SimpleFusedRingBuilder implements ISmilesBuilder<FusedRingNode> {

    @Override
    public String build(FusedRingNode fusedRing, RenderContext ctx) {
        List<RingNode> rings = fusedRing.rings().stream()
                .sorted(Comparator.comparingInt(RingNode::offset))
                .toList();

        FusedRingSequence.Builder sequence = new FusedRingSequence.Builder();
        Map<Integer, Integer> rawDepths = new HashMap<>();

        for (RingNode ring : rings) {
            int offset = ring.offset();
            sequence.marker(offset, RingMarker.open(ring.ringNumber(), ring.closureBond()));
            sequence.marker(offset + ring.size() - 1, RingMarker.close(ring.ringNumber()));

            List<Integer> ringDepths = BranchDepths.normalize(ring.branchDepths());
            for (int i = 0; i < ring.size(); i++) {
                int position = offset + i;
                sequence.atom(position, ring.atomAt(i + 1));
                if (i > 0) {
                    sequence.bondBefore(position, ring.bondAt(i - 1));
                }
                sequence.attachments(position, ring.attachmentsAt(i + 1));
                if (i < ringDepths.size()) {
                    rawDepths.merge(position, ringDepths.get(i), Math::max);
                }
            }
        }

        List<Integer> positions = sequence.occupiedPositions();
        Map<Integer, Integer> depths = BranchDepths.normalize(rawDepths, positions);
        boolean branched = depths.values().stream().anyMatch(depth -> depth != 0);

        return sequence.build(positions, depths, Map.of(), branched).render(ctx);
    }
}
