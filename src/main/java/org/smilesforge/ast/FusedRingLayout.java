package org.smilesforge.ast;

import java.util.List;
import java.util.Map;

/**
 * Global position data of an interleaved fused-ring system.
 * <p>
 * All maps are keyed by absolute position. Positions listed in {@code allPositions} that belong
 * to no member ring are continuation atoms; their atom, bond and attachments come from
 * {@code atomValueMap}, {@code bondMap} and {@code sequentialAtomAttachments}.
 *
 * @param allPositions              Every position of the system in output order.
 * @param branchDepthMap            Branch depth of each position, relative to any base depth.
 * @param atomValueMap              Atom overrides.
 * @param bondMap                   Bond before each continuation atom.
 * @param ringOrderMap              Original left-to-right order of ring-closure labels at a position.
 * @param sequentialRings           Rings chained directly after the system.
 * @param sequentialAtomAttachments Attachments of continuation atoms.
 */
public record FusedRingLayout(
        List<Integer> allPositions,
        Map<Integer, Integer> branchDepthMap,
        Map<Integer, String> atomValueMap,
        Map<Integer, String> bondMap,
        Map<Integer, List<Integer>> ringOrderMap,
        List<RingNode> sequentialRings,
        Map<Integer, List<Attachment>> sequentialAtomAttachments
) {

    public FusedRingLayout {
        allPositions = AstCollections.list(allPositions);
        branchDepthMap = AstCollections.map(branchDepthMap);
        atomValueMap = AstCollections.map(atomValueMap);
        bondMap = AstCollections.map(bondMap);
        ringOrderMap = AstCollections.map(ringOrderMap);
        sequentialRings = AstCollections.list(sequentialRings);
        sequentialAtomAttachments = AstCollections.attachments(sequentialAtomAttachments);
    }

    /**
     * Creates a layout carrying only the position list.
     */
    public static FusedRingLayout of(List<Integer> allPositions) {
        return new FusedRingLayout(allPositions, null, null, null, null, null, null);
    }

    public FusedRingLayout withBranchDepths(Map<Integer, Integer> depths) {
        return new FusedRingLayout(allPositions, depths, atomValueMap, bondMap, ringOrderMap,
                sequentialRings, sequentialAtomAttachments);
    }

    public FusedRingLayout withAtomValues(Map<Integer, String> values) {
        return new FusedRingLayout(allPositions, branchDepthMap, values, bondMap, ringOrderMap,
                sequentialRings, sequentialAtomAttachments);
    }

    public FusedRingLayout withBonds(Map<Integer, String> bonds) {
        return new FusedRingLayout(allPositions, branchDepthMap, atomValueMap, bonds, ringOrderMap,
                sequentialRings, sequentialAtomAttachments);
    }

    public FusedRingLayout withRingOrder(Map<Integer, List<Integer>> order) {
        return new FusedRingLayout(allPositions, branchDepthMap, atomValueMap, bondMap, order,
                sequentialRings, sequentialAtomAttachments);
    }

    public FusedRingLayout withSequentialRings(List<RingNode> rings) {
        return new FusedRingLayout(allPositions, branchDepthMap, atomValueMap, bondMap, ringOrderMap,
                rings, sequentialAtomAttachments);
    }

    public FusedRingLayout withSequentialAtomAttachments(Map<Integer, List<Attachment>> attachments) {
        return new FusedRingLayout(allPositions, branchDepthMap, atomValueMap, bondMap, ringOrderMap,
                sequentialRings, attachments);
    }

    public boolean hasSequentialRings() {
        return !sequentialRings.isEmpty();
    }
}
