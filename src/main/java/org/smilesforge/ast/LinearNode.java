package org.smilesforge.ast;

import java.util.List;
import java.util.Map;

/**
 * A linear chain of atoms.
 * <p>
 * The bond list has one of two shapes, told apart by its length:
 * <ul>
 *   <li>branch shape: {@code bonds.size() == atoms.size()}, {@code bonds[i]} precedes {@code atoms[i]};</li>
 *   <li>main-chain shape: {@code bonds.size() == atoms.size() - 1}, {@code bonds[i]} sits between
 *       {@code atoms[i]} and {@code atoms[i + 1]}.</li>
 * </ul>
 *
 * @param atoms       The atom symbols in chain order.
 * @param bonds       The bond symbols, empty string for an implicit single bond.
 * @param attachments Side branches keyed by 1-based atom position.
 */
public record LinearNode(
        List<String> atoms,
        List<String> bonds,
        Map<Integer, List<Attachment>> attachments
) implements AstNode {

    public LinearNode {
        atoms = AstCollections.list(atoms);
        bonds = AstCollections.bonds(bonds);
        attachments = AstCollections.attachments(attachments);
    }

    public LinearNode(List<String> atoms, List<String> bonds) {
        this(atoms, bonds, Map.of());
    }

    public LinearNode(List<String> atoms) {
        this(atoms, List.of(), Map.of());
    }

    /**
     * Convenience factory for a chain of single-bonded atoms.
     */
    public static LinearNode of(String... atoms) {
        return new LinearNode(List.of(atoms));
    }

    /**
     * @return true if the bond list uses the branch shape (one bond before each atom).
     */
    public boolean hasBranchBondShape() {
        return !atoms.isEmpty() && bonds.size() == atoms.size();
    }

    @Override
    public List<AstNode> getChildren() {
        return AstCollections.children(attachments);
    }
}
