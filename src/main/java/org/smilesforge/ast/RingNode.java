package org.smilesforge.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single ring.
 * <p>
 * {@code bonds[i]} is the bond before atom {@code i + 2}; slot {@code size - 1} may hold the
 * bond of the ring closure. {@code branchDepths} records, per position, how many branch levels
 * the atom sits below the ring's first atom. A non-uniform list means the ring closure crosses a
 * branch boundary.
 *
 * @param atom          The base atom symbol of every position.
 * @param size          Number of ring atoms.
 * @param ringNumber    The ring-closure label.
 * @param offset        Start index inside a fused-ring system that has no explicit placement.
 * @param bonds         Bond symbols, empty string for an implicit single bond.
 * @param substitutions Atom overrides keyed by 1-based position.
 * @param attachments   Side branches keyed by 1-based position.
 * @param branchDepths  Per-position branch depths, empty when unknown.
 * @param placement     Absolute placement in an interleaved system, or null.
 * @param layout        Sequential-ring continuation data, or null.
 */
public record RingNode(
        String atom,
        int size,
        int ringNumber,
        int offset,
        List<String> bonds,
        Map<Integer, String> substitutions,
        Map<Integer, List<Attachment>> attachments,
        List<Integer> branchDepths,
        RingPlacement placement,
        FusedRingLayout layout
) implements AstNode {

    public RingNode {
        Objects.requireNonNull(atom, "atom");
        if (size < 1) {
            throw new IllegalArgumentException("Ring size must be positive, got " + size);
        }
        bonds = AstCollections.bonds(bonds);
        substitutions = AstCollections.map(substitutions);
        attachments = AstCollections.attachments(attachments);
        branchDepths = AstCollections.list(branchDepths);
    }

    public RingNode(String atom, int size, int ringNumber) {
        this(atom, size, ringNumber, 0, null, null, null, null, null, null);
    }

    /**
     * Returns the atom written at a 1-based position, honouring substitutions.
     */
    public String atomAt(int position) {
        String substitution = substitutions.get(position);
        return substitution != null && !substitution.isEmpty() ? substitution : atom;
    }

    /**
     * Returns the bond stored at an index of the bond list, or the empty string.
     */
    public String bondAt(int index) {
        return index >= 0 && index < bonds.size() ? bonds.get(index) : "";
    }

    /**
     * @return The bond symbol written before the ring-closure label, or the empty string.
     */
    public String closureBond() {
        return bondAt(size - 1);
    }

    public List<Attachment> attachmentsAt(int position) {
        return attachments.getOrDefault(position, List.of());
    }

    public boolean hasPlacement() {
        return placement != null;
    }

    @Override
    public List<AstNode> getChildren() {
        return AstCollections.children(attachments);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(atom, size)
                .ringNumber(ringNumber)
                .offset(offset)
                .bonds(bonds)
                .branchDepths(branchDepths)
                .placement(placement)
                .layout(layout);
        builder.substitutions.putAll(substitutions);
        attachments.forEach((position, list) -> builder.attachments.put(position, new ArrayList<>(list)));
        return builder;
    }

    public static Builder builder(String atom, int size) {
        return new Builder(atom, size);
    }

    /**
     * Builder for ring nodes. The ring number defaults to 1.
     */
    public static class Builder {
        private final String atom;
        private final int size;
        private int ringNumber = 1;
        private int offset;
        private List<String> bonds = List.of();
        private final Map<Integer, String> substitutions = new HashMap<>();
        private final Map<Integer, List<Attachment>> attachments = new HashMap<>();
        private List<Integer> branchDepths = List.of();
        private RingPlacement placement;
        private FusedRingLayout layout;

        private Builder(String atom, int size) {
            this.atom = atom;
            this.size = size;
        }

        public Builder ringNumber(int ringNumber) {
            this.ringNumber = ringNumber;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder bonds(List<String> bonds) {
            this.bonds = bonds;
            return this;
        }

        public Builder bonds(String... bonds) {
            this.bonds = Arrays.asList(bonds);
            return this;
        }

        public Builder substitute(int position, String atomSymbol) {
            substitutions.put(position, atomSymbol);
            return this;
        }

        /**
         * Appends an attachment at a 1-based position.
         */
        public Builder attach(int position, Attachment attachment) {
            attachments.computeIfAbsent(position, k -> new ArrayList<>()).add(attachment);
            return this;
        }

        public Builder attach(int position, AstNode node) {
            return attach(position, Attachment.of(node));
        }

        public Builder branchDepths(List<Integer> depths) {
            this.branchDepths = depths;
            return this;
        }

        public Builder branchDepths(Integer... depths) {
            this.branchDepths = List.of(depths);
            return this;
        }

        public Builder placement(RingPlacement placement) {
            this.placement = placement;
            return this;
        }

        public Builder layout(FusedRingLayout layout) {
            this.layout = layout;
            return this;
        }

        public RingNode build() {
            return new RingNode(atom, size, ringNumber, offset, bonds, substitutions, attachments,
                    branchDepths, placement, layout);
        }
    }
}
