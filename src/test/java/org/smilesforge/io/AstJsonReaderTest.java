package org.smilesforge.io;

import org.smilesforge.ast.Attachment;
import org.smilesforge.ast.AstNode;
import org.smilesforge.ast.BranchPlacement;
import org.smilesforge.ast.FusedRingNode;
import org.smilesforge.ast.LinearNode;
import org.smilesforge.ast.MoleculeNode;
import org.smilesforge.ast.RingNode;
import org.smilesforge.codegen.MalformedAstException;
import org.smilesforge.codegen.SmilesGenerator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AstJsonReaderTest {

    private final AstJsonReader reader = new AstJsonReader();

    private AstNode readResource(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/ast/" + name);
             Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return reader.read(r);
        }
    }

    @Test
    void readsMoleculeWithWrappedAttachments() throws IOException {
        AstNode root = readResource("cyclohexylacetic-acid.json");

        assertThat(root).isInstanceOf(MoleculeNode.class);
        MoleculeNode molecule = (MoleculeNode) root;
        RingNode ring = (RingNode) molecule.components().get(0).node();
        assertThat(ring.branchDepths()).containsExactly(0, 0, 0, 0, 1, 1);
        Attachment acid = ring.attachmentsAt(4).get(0);
        assertThat(acid.placement()).isEqualTo(BranchPlacement.SIBLING);
        assertThat(((LinearNode) acid.node()).attachments().get(2).get(0).isUnspecified()).isTrue();

        assertThat(new SmilesGenerator().render(root)).isEqualTo("C1CCC(CC1)(CC(=O)O)CN");
    }

    @Test
    void readsPositionedFusedRing() throws IOException {
        FusedRingNode fused = (FusedRingNode) readResource("naphthalene.json");

        assertThat(fused.hasPositionData()).isTrue();
        assertThat(fused.rings().get(1).placement().start()).isEqualTo(3);
        assertThat(fused.rings().get(1).placement().end()).isEqualTo(8);
        assertThat(new SmilesGenerator().render(fused)).isEqualTo("c1ccc2ccccc2c1");
    }

    @Test
    void inlineFlagIsReadAsInlinePlacement() {
        AstNode node = reader.read("""
                {"type": "linear", "atoms": ["C"], "attachments": {
                  "1": [{"node": {"type": "linear", "atoms": ["O"]}, "sibling": false}]
                }}
                """);

        assertThat(((LinearNode) node).attachments().get(1).get(0).isInline()).isTrue();
    }

    @Test
    void acceptsComponentWithoutWrapper() {
        AstNode node = reader.read("""
                {"type": "molecule", "components": [
                  {"type": "linear", "atoms": ["C"]},
                  {"type": "linear", "atoms": ["O"], "leadingBond": "="}
                ]}
                """);

        assertThat(new SmilesGenerator().render(node)).isEqualTo("C=O");
    }

    @Test
    void rejectsUnknownType() {
        assertThatThrownBy(() -> reader.read("{\"type\": \"helix\"}"))
                .isInstanceOf(MalformedAstException.class)
                .hasMessageContaining("helix");
    }

    @Test
    void rejectsMissingType() {
        assertThatThrownBy(() -> reader.read("{\"atoms\": [\"C\"]}"))
                .isInstanceOf(MalformedAstException.class)
                .hasMessageContaining("type");
    }

    @Test
    void rejectsInvalidJson() {
        assertThatThrownBy(() -> reader.read("{\"type\": "))
                .isInstanceOf(MalformedAstException.class);
    }

    @Test
    void rejectsNonNumericPositionKey() {
        assertThatThrownBy(() -> reader.read("""
                {"type": "ring", "atom": "C", "size": 3, "substitutions": {"first": "N"}}
                """))
                .isInstanceOf(MalformedAstException.class)
                .hasMessageContaining("first");
    }

    @Test
    void rejectsInvalidRingSize() {
        assertThatThrownBy(() -> reader.read("{\"type\": \"ring\", \"atom\": \"C\", \"size\": 0}"))
                .isInstanceOf(MalformedAstException.class);
    }

    @Test
    void rejectsNullAttachmentList() {
        assertThatThrownBy(() -> reader.read(
                "{\"type\": \"linear\", \"atoms\": [\"C\", \"C\"], \"attachments\": {\"1\": null}}"))
                .isInstanceOf(MalformedAstException.class);
    }
}
