package org.smilesforge.ast;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RingNodeTest {

    @Test
    void substitutionWinsOverBaseAtom() {
        RingNode ring = RingNode.builder("c", 6).substitute(2, "n").substitute(3, "").build();

        assertThat(ring.atomAt(1)).isEqualTo("c");
        assertThat(ring.atomAt(2)).isEqualTo("n");
        assertThat(ring.atomAt(3)).isEqualTo("c");
    }

    @Test
    void bondLookupOutsideListIsSingleBond() {
        RingNode ring = RingNode.builder("C", 4).bonds("=").build();

        assertThat(ring.bondAt(0)).isEqualTo("=");
        assertThat(ring.bondAt(1)).isEmpty();
        assertThat(ring.bondAt(-1)).isEmpty();
        assertThat(ring.closureBond()).isEmpty();
    }

    @Test
    void closureBondIsLastSlot() {
        RingNode ring = RingNode.builder("C", 3).bonds("", "", "#").build();

        assertThat(ring.closureBond()).isEqualTo("#");
    }

    @Test
    void nullBondsBecomeSingleBonds() {
        RingNode ring = RingNode.builder("C", 3).bonds(Arrays.asList("=", null)).build();

        assertThat(ring.bonds()).containsExactly("=", "");
    }

    @Test
    void rejectsEmptyRing() {
        assertThatThrownBy(() -> new RingNode("C", 0, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toBuilderCopiesEveryField() {
        RingNode ring = RingNode.builder("C", 6)
                .ringNumber(4)
                .offset(2)
                .bonds("=")
                .substitute(1, "N")
                .attach(2, LinearNode.of("O"))
                .branchDepths(0, 0, 1, 1, 0, 0)
                .placement(RingPlacement.of(List.of(0, 1, 2, 3, 4, 5)))
                .build();

        assertThat(ring.toBuilder().build()).isEqualTo(ring);
    }

    @Test
    void childrenAreAttachmentNodes() {
        LinearNode oxygen = LinearNode.of("O");
        RingNode ring = RingNode.builder("C", 6).attach(5, oxygen).build();

        assertThat(ring.getChildren()).containsExactly(oxygen);
    }
}
