package org.smilesforge.codegen.features.fused;

import org.smilesforge.ast.Attachment;
import org.smilesforge.codegen.RenderContext;
import org.smilesforge.codegen.branch.BranchWalker;
import org.smilesforge.codegen.branch.ClosePolicy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The merged atom sequence of a fused-ring system, ready to be written.
 * <p>
 * Holds, per absolute position, the atom, the bond before it, its ring-closure markers, its
 * attachments and its branch depth. Built once per render by a fused-ring builder and then only
 * read.
 */
final class FusedRingSequence {

    private final List<Integer> positions;
    private final Map<Integer, Slot> slots;
    private final Map<Integer, String> bondsBefore;
    private final Map<Integer, List<RingMarker>> markers;
    private final Map<Integer, Integer> depths;
    private final Map<Integer, List<Integer>> ringOrder;
    private final boolean sortMarkers;

    private FusedRingSequence(Builder builder, List<Integer> positions, Map<Integer, Integer> depths,
                              Map<Integer, List<Integer>> ringOrder, boolean sortMarkers) {
        this.positions = List.copyOf(positions);
        this.slots = Map.copyOf(builder.slots);
        this.bondsBefore = Map.copyOf(builder.bondsBefore);
        this.markers = Map.copyOf(builder.markers);
        this.depths = Map.copyOf(depths);
        this.ringOrder = ringOrder;
        this.sortMarkers = sortMarkers;
    }

    /**
     * Writes the sequence. Positions without an atom are skipped. Attachments of an atom that is
     * followed by a deeper atom are released after the branch closes again
     * ({@link ClosePolicy#INTERLEAVED}).
     *
     * @param ctx The render context, used for attachment sub-trees.
     * @return The rendered text.
     */
    String render(RenderContext ctx) {
        BranchWalker walker = new BranchWalker(ctx, ClosePolicy.INTERLEAVED);

        for (int idx = 0; idx < positions.size(); idx++) {
            int position = positions.get(idx);
            Slot slot = slots.get(position);
            if (slot == null) {
                continue;
            }
            int depth = depths.getOrDefault(position, 0);
            walker.moveTo(depth);

            if (idx > 0) {
                walker.append(bondsBefore.get(position));
            }
            walker.append(slot.atom);
            for (RingMarker marker : markersAt(position)) {
                if (marker.open()) {
                    walker.append(marker.closureBond());
                }
                walker.append(marker.label());
            }

            int nextDepth = idx + 1 < positions.size()
                    ? depths.getOrDefault(positions.get(idx + 1), 0)
                    : depth;
            walker.placeAttachments(slot.attachments, nextDepth > depth);
        }
        return walker.finish();
    }

    /**
     * Returns the markers of a position. Opening labels come before closing ones; in sorted mode
     * labels of the same kind follow their original order where it is known for both, else
     * ascending label value. Unsorted mode keeps insertion order within each kind.
     */
    List<RingMarker> markersAt(int position) {
        List<RingMarker> atPosition = new ArrayList<>(markers.getOrDefault(position, List.of()));
        if (atPosition.size() < 2) {
            return atPosition;
        }
        Comparator<RingMarker> opensFirst = Comparator.comparing(marker -> !marker.open());
        if (!sortMarkers) {
            atPosition.sort(opensFirst);
            return atPosition;
        }
        List<Integer> original = ringOrder.getOrDefault(position, List.of());
        atPosition.sort(opensFirst.thenComparing((a, b) -> {
            int aIdx = original.indexOf(a.ringNumber());
            int bIdx = original.indexOf(b.ringNumber());
            if (aIdx != -1 && bIdx != -1) {
                return Integer.compare(aIdx, bIdx);
            }
            return Integer.compare(a.ringNumber(), b.ringNumber());
        }));
        return atPosition;
    }

    /**
     * Atom written at one position together with the attachments hung off it.
     */
    private static final class Slot {
        private final String atom;
        private final List<Attachment> attachments = new ArrayList<>();

        private Slot(String atom) {
            this.atom = atom;
        }
    }

    /**
     * Collects atoms, bonds, markers and attachments position by position.
     * The first atom and the first bond written to a position win.
     */
    static final class Builder {
        private final Map<Integer, Slot> slots = new HashMap<>();
        private final Map<Integer, String> bondsBefore = new HashMap<>();
        private final Map<Integer, List<RingMarker>> markers = new HashMap<>();

        boolean hasAtom(int position) {
            return slots.containsKey(position);
        }

        Builder atom(int position, String atom) {
            slots.putIfAbsent(position, new Slot(atom));
            return this;
        }

        /**
         * Adds attachments to the atom at a position. The atom must have been placed.
         */
        Builder attachments(int position, List<Attachment> attachments) {
            slots.get(position).attachments.addAll(attachments);
            return this;
        }

        Builder bondBefore(int position, String bond) {
            if (bond != null && !bond.isEmpty()) {
                bondsBefore.putIfAbsent(position, bond);
            }
            return this;
        }

        Builder marker(int position, RingMarker marker) {
            markers.computeIfAbsent(position, k -> new ArrayList<>()).add(marker);
            return this;
        }

        List<Integer> occupiedPositions() {
            return slots.keySet().stream().sorted().toList();
        }

        /**
         * Freezes the collected data.
         *
         * @param positions   Output order of positions.
         * @param depths      Normalised branch depth per position.
         * @param ringOrder   Original label order per position, used when {@code sortMarkers} is set.
         * @param sortMarkers Whether labels of the same kind are reordered.
         * @return The sequence.
         */
        FusedRingSequence build(List<Integer> positions, Map<Integer, Integer> depths,
                                Map<Integer, List<Integer>> ringOrder, boolean sortMarkers) {
            return new FusedRingSequence(this, positions, depths, ringOrder, sortMarkers);
        }
    }
}
