package org.smilesforge.io;

import org.smilesforge.ast.Attachment;
import org.smilesforge.ast.AstNode;
import org.smilesforge.ast.FusedRingLayout;
import org.smilesforge.ast.FusedRingNode;
import org.smilesforge.ast.LinearNode;
import org.smilesforge.ast.MoleculeNode;
import org.smilesforge.ast.RingNode;
import org.smilesforge.ast.RingPlacement;
import org.smilesforge.codegen.UnknownNodeKindException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AstJsonWriterTest {

    private final AstJsonWriter writer = new AstJsonWriter();

    @Test
    void writesTypeTagsAndPlacementFlags() {
        LinearNode chain = new LinearNode(List.of("C", "C"), List.of(), Map.of(1, List.of(
                Attachment.inline(LinearNode.of("O")),
                Attachment.of(LinearNode.of("N")))));

        String json = writer.write(chain);

        assertThat(json).contains("\"type\": \"linear\"");
        assertThat(json).contains("\"sibling\": false");
        assertThat(json).doesNotContain("\"sibling\": true");
    }

    @Test
    void readerRestoresWrittenTree() {
        // Given: a tree touching every node kind and layout map
        RingNode placed = RingNode.builder("c", 6).ringNumber(2)
                .bonds("", "", "", "", "", "")
                .substitute(3, "n")
                .attach(1, Attachment.sibling(LinearNode.of("Cl")))
                .branchDepths(0, 0, 0, 0, 0, 0)
                .placement(RingPlacement.of(List.of(0, 1, 2, 3, 4, 5)))
                .build();
        FusedRingLayout layout = FusedRingLayout.of(List.of(0, 1, 2, 3, 4, 5, 6))
                .withAtomValues(Map.of(6, "O"))
                .withBonds(Map.of(6, "="))
                .withBranchDepths(Map.of(6, 1))
                .withRingOrder(Map.of(5, List.of(2)))
                .withSequentialAtomAttachments(Map.of(6, List.of(Attachment.inline(LinearNode.of("C")))));
        AstNode tree = new MoleculeNode(List.of(
                new MoleculeNode.Component(new FusedRingNode(List.of(placed), layout)),
                new MoleculeNode.Component(new RingNode("C", 3, 1), "=")));

        // When
        AstNode restored = new AstJsonReader().read(writer.write(tree));

        // Then
        assertThat(restored).isEqualTo(tree);
    }

    @Test
    void rejectsForeignNode() {
        AstNode foreign = new AstNode() {
        };

        assertThatThrownBy(() -> writer.write(foreign)).isInstanceOf(UnknownNodeKindException.class);
    }
}
