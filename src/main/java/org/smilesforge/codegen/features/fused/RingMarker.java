package org.smilesforge.codegen.features.fused;

/**
 * Opening or closing occurrence of a ring-closure label at an atom.
 *
 * @param ringNumber  The label.
 * @param open        True for the opening occurrence.
 * @param closureBond Bond written before an opening label, empty if none.
 */
record RingMarker(int ringNumber, boolean open, String closureBond) {

    static RingMarker open(int ringNumber, String closureBond) {
        return new RingMarker(ringNumber, true, closureBond == null ? "" : closureBond);
    }

    static RingMarker close(int ringNumber) {
        return new RingMarker(ringNumber, false, "");
    }

    String label() {
        return Integer.toString(ringNumber);
    }
}
