package org.smilesforge.codegen;

import org.smilesforge.ast.LinearNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RenderContextTest {

    @Test
    void tracksNestingDepthDuringBuild() {
        // Given: a builder that records the depth it is called at
        AtomicInteger seenDepth = new AtomicInteger(-1);
        SmilesBuilderRegistry registry = new SmilesBuilderRegistry();
        registry.register(LinearNode.class, (node, ctx) -> {
            seenDepth.set(ctx.nestingDepth());
            return "C";
        });
        RenderContext ctx = new RenderContext(registry, CodegenOptions.defaults());

        // When
        ctx.render(LinearNode.of("C"));

        // Then
        assertThat(seenDepth.get()).isEqualTo(1);
        assertThat(ctx.nestingDepth()).isZero();
    }

    @Test
    void restoresDepthWhenBuilderFails() {
        SmilesBuilderRegistry registry = new SmilesBuilderRegistry();
        registry.register(LinearNode.class, (node, ctx) -> {
            throw new MalformedAstException("broken");
        });
        RenderContext ctx = new RenderContext(registry, CodegenOptions.defaults());

        assertThatThrownBy(() -> ctx.render(LinearNode.of("C"))).isInstanceOf(MalformedAstException.class);
        assertThat(ctx.nestingDepth()).isZero();
    }

    @Test
    void unregisteredNodeClassIsUnknown() {
        RenderContext ctx = new RenderContext(new SmilesBuilderRegistry(), CodegenOptions.defaults());

        assertThatThrownBy(() -> ctx.render(LinearNode.of("C")))
                .isInstanceOf(UnknownNodeKindException.class)
                .hasMessage("Unknown AST node kind: LinearNode");
    }

    @Test
    void lenientModeToleratesMalformedMetadata() {
        RenderContext ctx = new RenderContext(new SmilesBuilderRegistry(), CodegenOptions.defaults());

        assertThatCode(() -> ctx.reportMalformed("missing depth")).doesNotThrowAnyException();
    }

    @Test
    void strictModeFailsOnMalformedMetadata() {
        RenderContext ctx = new RenderContext(new SmilesBuilderRegistry(),
                CodegenOptions.defaults().withStrictMetadata(true));

        assertThatThrownBy(() -> ctx.reportMalformed("missing depth"))
                .isInstanceOf(MalformedAstException.class)
                .hasMessage("missing depth");
    }
}
