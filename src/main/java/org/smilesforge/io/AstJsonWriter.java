package org.smilesforge.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.smilesforge.ast.Attachment;
import org.smilesforge.ast.AstNode;
import org.smilesforge.ast.FusedRingLayout;
import org.smilesforge.ast.FusedRingNode;
import org.smilesforge.ast.LinearNode;
import org.smilesforge.ast.MoleculeNode;
import org.smilesforge.ast.RingNode;
import org.smilesforge.ast.RingPlacement;
import org.smilesforge.codegen.UnknownNodeKindException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

import static org.smilesforge.io.AstJsonFields.*;

/**
 * Writes an AST in the JSON form read by {@link AstJsonReader}. Output is pretty-printed and
 * position maps are written in ascending key order.
 */
public class AstJsonWriter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Serializes a tree.
     *
     * @param node The root node.
     * @return The JSON document.
     * @throws UnknownNodeKindException if the tree contains a node class the format does not know.
     */
    public String write(AstNode node) {
        return gson.toJson(toJson(node));
    }

    JsonObject toJson(AstNode node) {
        if (node instanceof MoleculeNode molecule) {
            return molecule(molecule);
        }
        if (node instanceof LinearNode linear) {
            return linear(linear);
        }
        if (node instanceof RingNode ring) {
            return ring(ring);
        }
        if (node instanceof FusedRingNode fusedRing) {
            return fusedRing(fusedRing);
        }
        throw new UnknownNodeKindException(node == null ? null : node.getClass());
    }

    private JsonObject molecule(MoleculeNode molecule) {
        JsonObject obj = typed(TYPE_MOLECULE);
        JsonArray components = new JsonArray();
        for (MoleculeNode.Component component : molecule.components()) {
            JsonObject entry = new JsonObject();
            entry.add(NODE, toJson(component.node()));
            if (component.hasLeadingBond()) {
                entry.addProperty(LEADING_BOND, component.leadingBond());
            }
            components.add(entry);
        }
        obj.add(COMPONENTS, components);
        return obj;
    }

    private JsonObject linear(LinearNode linear) {
        JsonObject obj = typed(TYPE_LINEAR);
        obj.add(ATOMS, stringArray(linear.atoms()));
        obj.add(BONDS, stringArray(linear.bonds()));
        obj.add(ATTACHMENTS, attachments(linear.attachments()));
        return obj;
    }

    private JsonObject ring(RingNode ring) {
        JsonObject obj = typed(TYPE_RING);
        obj.addProperty(ATOM, ring.atom());
        obj.addProperty(SIZE, ring.size());
        obj.addProperty(RING_NUMBER, ring.ringNumber());
        obj.addProperty(OFFSET, ring.offset());
        obj.add(BONDS, stringArray(ring.bonds()));
        obj.add(SUBSTITUTIONS, positionMap(ring.substitutions(), gson::toJsonTree));
        obj.add(ATTACHMENTS, attachments(ring.attachments()));
        if (!ring.branchDepths().isEmpty()) {
            obj.add(BRANCH_DEPTHS, intArray(ring.branchDepths()));
        }
        if (ring.hasPlacement()) {
            RingPlacement placement = ring.placement();
            JsonObject placementObj = new JsonObject();
            placementObj.add(POSITIONS, intArray(placement.positions()));
            placementObj.addProperty(START, placement.start());
            placementObj.addProperty(END, placement.end());
            obj.add(PLACEMENT, placementObj);
        }
        if (ring.layout() != null) {
            obj.add(LAYOUT, layout(ring.layout()));
        }
        return obj;
    }

    private JsonObject fusedRing(FusedRingNode fusedRing) {
        JsonObject obj = typed(TYPE_FUSED_RING);
        JsonArray rings = new JsonArray();
        fusedRing.rings().forEach(ring -> rings.add(ring(ring)));
        obj.add(RINGS, rings);
        if (fusedRing.layout() != null) {
            obj.add(LAYOUT, layout(fusedRing.layout()));
        }
        return obj;
    }

    private JsonObject layout(FusedRingLayout layout) {
        JsonObject obj = new JsonObject();
        obj.add(ALL_POSITIONS, intArray(layout.allPositions()));
        obj.add(BRANCH_DEPTH_MAP, positionMap(layout.branchDepthMap(), gson::toJsonTree));
        obj.add(ATOM_VALUE_MAP, positionMap(layout.atomValueMap(), gson::toJsonTree));
        obj.add(BOND_MAP, positionMap(layout.bondMap(), gson::toJsonTree));
        obj.add(RING_ORDER_MAP, positionMap(layout.ringOrderMap(), AstJsonWriter::intArray));
        JsonArray sequentialRings = new JsonArray();
        layout.sequentialRings().forEach(ring -> sequentialRings.add(ring(ring)));
        obj.add(SEQUENTIAL_RINGS, sequentialRings);
        obj.add(SEQUENTIAL_ATOM_ATTACHMENTS, attachments(layout.sequentialAtomAttachments()));
        return obj;
    }

    private JsonObject attachments(Map<Integer, List<Attachment>> attachments) {
        return positionMap(attachments, list -> {
            JsonArray array = new JsonArray();
            list.forEach(attachment -> array.add(attachment(attachment)));
            return array;
        });
    }

    private JsonObject attachment(Attachment attachment) {
        if (attachment.isUnspecified()) {
            return toJson(attachment.node());
        }
        JsonObject obj = new JsonObject();
        obj.add(NODE, toJson(attachment.node()));
        obj.addProperty(SIBLING, !attachment.isInline());
        return obj;
    }

    private static <V> JsonObject positionMap(Map<Integer, V> map, Function<V, JsonElement> valueWriter) {
        JsonObject obj = new JsonObject();
        new TreeMap<>(map).forEach((position, value) -> obj.add(Integer.toString(position), valueWriter.apply(value)));
        return obj;
    }

    private static JsonObject typed(String type) {
        JsonObject obj = new JsonObject();
        obj.addProperty(TYPE, type);
        return obj;
    }

    private static JsonArray stringArray(Collection<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }

    private static JsonArray intArray(Collection<Integer> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }
}
