package org.smilesforge.codegen.features.molecule;

import org.smilesforge.ast.LinearNode;
import org.smilesforge.ast.MoleculeNode;
import org.smilesforge.ast.RingNode;
import org.smilesforge.codegen.CodegenOptions;
import org.smilesforge.codegen.RenderContext;
import org.smilesforge.codegen.SmilesBuilderRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MoleculeBuilderTest {

    private final MoleculeBuilder builder = new MoleculeBuilder();
    private final RenderContext ctx =
            new RenderContext(SmilesBuilderRegistry.initializeWithDefaults(), CodegenOptions.defaults());

    @Test
    void concatenatesComponentsInOrder() {
        MoleculeNode molecule = MoleculeNode.of(LinearNode.of("C", "C"), new RingNode("c", 6, 1));

        assertThat(builder.build(molecule, ctx)).isEqualTo("CCc1ccccc1");
    }

    @Test
    void leadingBondOfFirstComponentIsIgnored() {
        MoleculeNode molecule = new MoleculeNode(List.of(
                new MoleculeNode.Component(LinearNode.of("C"), "="),
                new MoleculeNode.Component(LinearNode.of("C"), "#"),
                new MoleculeNode.Component(LinearNode.of("N"))));

        assertThat(builder.build(molecule, ctx)).isEqualTo("C#CN");
    }

    @Test
    void emptyMoleculeRendersNothing() {
        assertThat(builder.build(new MoleculeNode(List.of()), ctx)).isEmpty();
    }
}
