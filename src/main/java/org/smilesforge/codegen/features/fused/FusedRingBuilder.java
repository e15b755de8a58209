package org.smilesforge.codegen.features.fused;

import org.smilesforge.ast.FusedRingNode;
import org.smilesforge.codegen.ISmilesBuilder;
import org.smilesforge.codegen.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a fused-ring system to the interleaved builder when it carries absolute position data
 * and to the offset-based builder otherwise.
 */
public class FusedRingBuilder implements ISmilesBuilder<FusedRingNode> {

    private static final Logger LOG = LoggerFactory.getLogger(FusedRingBuilder.class);

    private final InterleavedFusedRingBuilder interleaved;
    private final SimpleFusedRingBuilder simple;

    public FusedRingBuilder(InterleavedFusedRingBuilder interleaved, SimpleFusedRingBuilder simple) {
        this.interleaved = interleaved;
        this.simple = simple;
    }

    @Override
    public String build(FusedRingNode fusedRing, RenderContext ctx) {
        if (fusedRing.hasPositionData()) {
            LOG.debug("Fused system of {} ring(s) rendered from absolute positions", fusedRing.rings().size());
            return interleaved.build(fusedRing, ctx);
        }
        LOG.debug("Fused system of {} ring(s) rendered from offsets", fusedRing.rings().size());
        return simple.build(fusedRing, ctx);
    }
}
