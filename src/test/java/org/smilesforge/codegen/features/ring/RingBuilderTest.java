package org.smilesforge.codegen.features.ring;

import org.smilesforge.ast.Attachment;
import org.smilesforge.ast.FusedRingLayout;
import org.smilesforge.ast.LinearNode;
import org.smilesforge.ast.RingNode;
import org.smilesforge.ast.RingPlacement;
import org.smilesforge.codegen.CodegenOptions;
import org.smilesforge.codegen.RenderContext;
import org.smilesforge.codegen.SmilesBuilderRegistry;
import org.smilesforge.codegen.features.fused.InterleavedFusedRingBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
class RingBuilderTest {

    private RingBuilder builder;
    private RenderContext ctx;

    @BeforeEach
    void setUp() {
        builder = new RingBuilder(new BranchCrossingRingBuilder(), new InterleavedFusedRingBuilder());
        ctx = new RenderContext(SmilesBuilderRegistry.initializeWithDefaults(), CodegenOptions.defaults());
    }

    @Test
    void substitutionOverridesBaseAtom() {
        RingNode pyridine = RingNode.builder("c", 6).substitute(1, "n").build();

        assertThat(builder.build(pyridine, ctx)).isEqualTo("n1ccccc1");
    }

    @Test
    void closureBondPrecedesOpeningLabel() {
        RingNode ring = RingNode.builder("C", 6).bonds("", "", "", "", "", "=").build();

        assertThat(builder.build(ring, ctx)).isEqualTo("C=1CCCCC1");
    }

    @Test
    void usesConfiguredRingNumber() {
        RingNode ring = RingNode.builder("C", 5).ringNumber(3).build();

        assertThat(builder.build(ring, ctx)).isEqualTo("C3CCCC3");
    }

    @Test
    void flatRingParenthesisesEvenInlineAttachments() {
        RingNode ring = RingNode.builder("C", 6).attach(2, Attachment.inline(LinearNode.of("O"))).build();

        assertThat(builder.build(ring, ctx)).isEqualTo("C1C(O)CCCC1");
    }

    @Test
    void uniformNonZeroDepthsStayFlat() {
        BranchCrossingRingBuilder crossing = mock(BranchCrossingRingBuilder.class);
        RingBuilder routing = new RingBuilder(crossing, new InterleavedFusedRingBuilder());
        RingNode ring = RingNode.builder("C", 4).branchDepths(2, 2, 2, 2).build();

        assertThat(routing.build(ring, ctx)).isEqualTo("C1CCC1");
        verify(crossing, never()).build(any(), any());
    }

    @Test
    void nonUniformDepthsGoToBranchCrossingBuilder() {
        BranchCrossingRingBuilder crossing = mock(BranchCrossingRingBuilder.class);
        when(crossing.build(any(), any())).thenReturn("crossed");
        RingBuilder routing = new RingBuilder(crossing, new InterleavedFusedRingBuilder());
        RingNode ring = RingNode.builder("C", 4).branchDepths(0, 1, 1, 0).build();

        assertThat(routing.build(ring, ctx)).isEqualTo("crossed");
    }

    @Test
    void sequentialRingsAreRenderedAsOneSystem() {
        // Given: a cyclohexane directly followed by a second one
        RingNode next = RingNode.builder("C", 6).ringNumber(2)
                .placement(RingPlacement.of(List.of(6, 7, 8, 9, 10, 11)))
                .build();
        FusedRingLayout layout = FusedRingLayout.of(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11))
                .withSequentialRings(List.of(next));
        RingNode ring = RingNode.builder("C", 6)
                .placement(RingPlacement.of(List.of(0, 1, 2, 3, 4, 5)))
                .layout(layout)
                .build();

        assertThat(builder.build(ring, ctx)).isEqualTo("C1CCCCC1C2CCCCC2");
    }
}
