package org.smilesforge.io;

/**
 * Field names and type tags of the AST JSON format.
 */
final class AstJsonFields {

    static final String TYPE = "type";
    static final String TYPE_MOLECULE = "molecule";
    static final String TYPE_LINEAR = "linear";
    static final String TYPE_RING = "ring";
    static final String TYPE_FUSED_RING = "fused_ring";

    static final String COMPONENTS = "components";
    static final String NODE = "node";
    static final String LEADING_BOND = "leadingBond";
    static final String SIBLING = "sibling";

    static final String ATOMS = "atoms";
    static final String ATOM = "atom";
    static final String BONDS = "bonds";
    static final String ATTACHMENTS = "attachments";

    static final String SIZE = "size";
    static final String RING_NUMBER = "ringNumber";
    static final String OFFSET = "offset";
    static final String SUBSTITUTIONS = "substitutions";
    static final String BRANCH_DEPTHS = "branchDepths";
    static final String PLACEMENT = "placement";
    static final String POSITIONS = "positions";
    static final String START = "start";
    static final String END = "end";
    static final String LAYOUT = "layout";

    static final String RINGS = "rings";
    static final String ALL_POSITIONS = "allPositions";
    static final String BRANCH_DEPTH_MAP = "branchDepthMap";
    static final String ATOM_VALUE_MAP = "atomValueMap";
    static final String BOND_MAP = "bondMap";
    static final String RING_ORDER_MAP = "ringOrderMap";
    static final String SEQUENTIAL_RINGS = "sequentialRings";
    static final String SEQUENTIAL_ATOM_ATTACHMENTS = "sequentialAtomAttachments";

    private AstJsonFields() {
    }
}
