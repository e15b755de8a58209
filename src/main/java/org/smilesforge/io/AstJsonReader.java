package org.smilesforge.io;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.smilesforge.ast.Attachment;
import org.smilesforge.ast.AstNode;
import org.smilesforge.ast.BranchPlacement;
import org.smilesforge.ast.FusedRingLayout;
import org.smilesforge.ast.FusedRingNode;
import org.smilesforge.ast.LinearNode;
import org.smilesforge.ast.MoleculeNode;
import org.smilesforge.ast.RingNode;
import org.smilesforge.ast.RingPlacement;
import org.smilesforge.codegen.MalformedAstException;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.smilesforge.io.AstJsonFields.*;

/**
 * Reads an AST from its JSON form.
 * <p>
 * Every node object carries a {@code type} tag. Maps keyed by position are JSON objects whose keys
 * are decimal integers. An attachment is either a bare node object, which leaves its placement
 * unspecified, or a wrapper {@code {"node": {...}, "sibling": true|false}}.
 */
public class AstJsonReader {

    /**
     * Parses a JSON document into a node.
     *
     * @param json The document.
     * @return The root node.
     * @throws MalformedAstException if the text is not JSON or does not describe a valid tree.
     */
    public AstNode read(String json) {
        return read(new StringReader(json));
    }

    /**
     * Parses a JSON document into a node.
     *
     * @param reader Source of the document. Not closed by this method.
     * @return The root node.
     * @throws MalformedAstException if the text is not JSON or does not describe a valid tree.
     */
    public AstNode read(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new MalformedAstException("Invalid JSON: " + e.getMessage(), e);
        }
        try {
            return readNode(root);
        } catch (IllegalArgumentException | IllegalStateException | ClassCastException
                 | UnsupportedOperationException e) {
            throw new MalformedAstException("Invalid AST document: " + e.getMessage(), e);
        }
    }

    private AstNode readNode(JsonElement element) {
        JsonObject obj = asObject(element, "node");
        String type = requireString(obj, TYPE);
        return switch (type) {
            case TYPE_MOLECULE -> readMolecule(obj);
            case TYPE_LINEAR -> readLinear(obj);
            case TYPE_RING -> readRing(obj);
            case TYPE_FUSED_RING -> readFusedRing(obj);
            default -> throw new MalformedAstException("Unknown node type '" + type + "'");
        };
    }

    private MoleculeNode readMolecule(JsonObject obj) {
        List<MoleculeNode.Component> components = new ArrayList<>();
        for (JsonElement element : array(obj, COMPONENTS)) {
            JsonObject component = asObject(element, "component");
            if (component.has(NODE)) {
                components.add(new MoleculeNode.Component(readNode(component.get(NODE)),
                        optionalString(component, LEADING_BOND)));
            } else {
                components.add(new MoleculeNode.Component(readNode(component),
                        optionalString(component, LEADING_BOND)));
            }
        }
        return new MoleculeNode(components);
    }

    private LinearNode readLinear(JsonObject obj) {
        return new LinearNode(
                strings(array(obj, ATOMS)),
                strings(array(obj, BONDS)),
                attachments(obj.getAsJsonObject(ATTACHMENTS)));
    }

    private RingNode readRing(JsonObject obj) {
        String atom = obj.has(ATOM) ? requireString(obj, ATOM) : requireString(obj, ATOMS);
        RingNode.Builder builder = RingNode.builder(atom, requireInt(obj, SIZE))
                .ringNumber(obj.has(RING_NUMBER) ? obj.get(RING_NUMBER).getAsInt() : 1)
                .offset(obj.has(OFFSET) ? obj.get(OFFSET).getAsInt() : 0)
                .bonds(strings(array(obj, BONDS)))
                .branchDepths(ints(array(obj, BRANCH_DEPTHS)));

        positionMap(obj.getAsJsonObject(SUBSTITUTIONS), JsonElement::getAsString).forEach(builder::substitute);
        attachments(obj.getAsJsonObject(ATTACHMENTS)).forEach((position, list) ->
                list.forEach(attachment -> builder.attach(position, attachment)));

        if (obj.has(PLACEMENT)) {
            JsonObject placement = asObject(obj.get(PLACEMENT), PLACEMENT);
            List<Integer> positions = ints(array(placement, POSITIONS));
            if (placement.has(START) && placement.has(END)) {
                builder.placement(new RingPlacement(positions,
                        placement.get(START).getAsInt(), placement.get(END).getAsInt()));
            } else {
                builder.placement(RingPlacement.of(positions));
            }
        }
        if (obj.has(LAYOUT)) {
            builder.layout(readLayout(asObject(obj.get(LAYOUT), LAYOUT)));
        }
        return builder.build();
    }

    private FusedRingNode readFusedRing(JsonObject obj) {
        List<RingNode> rings = new ArrayList<>();
        for (JsonElement element : array(obj, RINGS)) {
            rings.add(readRing(asObject(element, "ring")));
        }
        FusedRingLayout layout = obj.has(LAYOUT) ? readLayout(asObject(obj.get(LAYOUT), LAYOUT)) : null;
        return new FusedRingNode(rings, layout);
    }

    private FusedRingLayout readLayout(JsonObject obj) {
        List<RingNode> sequentialRings = new ArrayList<>();
        for (JsonElement element : array(obj, SEQUENTIAL_RINGS)) {
            sequentialRings.add(readRing(asObject(element, "sequential ring")));
        }
        return new FusedRingLayout(
                ints(array(obj, ALL_POSITIONS)),
                positionMap(obj.getAsJsonObject(BRANCH_DEPTH_MAP), JsonElement::getAsInt),
                positionMap(obj.getAsJsonObject(ATOM_VALUE_MAP), JsonElement::getAsString),
                positionMap(obj.getAsJsonObject(BOND_MAP), JsonElement::getAsString),
                positionMap(obj.getAsJsonObject(RING_ORDER_MAP), e -> ints(e.getAsJsonArray())),
                sequentialRings,
                attachments(obj.getAsJsonObject(SEQUENTIAL_ATOM_ATTACHMENTS)));
    }

    private Map<Integer, List<Attachment>> attachments(JsonObject obj) {
        return positionMap(obj, element -> {
            List<Attachment> list = new ArrayList<>();
            for (JsonElement entry : element.getAsJsonArray()) {
                list.add(readAttachment(entry));
            }
            return list;
        });
    }

    private Attachment readAttachment(JsonElement element) {
        JsonObject obj = asObject(element, "attachment");
        if (!obj.has(NODE)) {
            return Attachment.of(readNode(obj));
        }
        BranchPlacement placement = BranchPlacement.UNSPECIFIED;
        if (obj.has(SIBLING) && !obj.get(SIBLING).isJsonNull()) {
            placement = obj.get(SIBLING).getAsBoolean() ? BranchPlacement.SIBLING : BranchPlacement.INLINE;
        }
        return new Attachment(readNode(obj.get(NODE)), placement);
    }

    private static <V> Map<Integer, V> positionMap(JsonObject obj, Function<JsonElement, V> valueReader) {
        Map<Integer, V> result = new HashMap<>();
        if (obj == null) {
            return result;
        }
        for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
            int position;
            try {
                position = Integer.parseInt(entry.getKey());
            } catch (NumberFormatException e) {
                throw new MalformedAstException("Position key '" + entry.getKey() + "' is not an integer", e);
            }
            result.put(position, valueReader.apply(entry.getValue()));
        }
        return result;
    }

    private static JsonObject asObject(JsonElement element, String what) {
        if (element == null || !element.isJsonObject()) {
            throw new MalformedAstException("Expected a JSON object for " + what + " but got " + element);
        }
        return element.getAsJsonObject();
    }

    private static JsonArray array(JsonObject obj, String field) {
        JsonElement element = obj.get(field);
        if (element == null || element.isJsonNull()) {
            return new JsonArray();
        }
        if (!element.isJsonArray()) {
            throw new MalformedAstException("Field '" + field + "' must be an array");
        }
        return element.getAsJsonArray();
    }

    private static String requireString(JsonObject obj, String field) {
        JsonElement element = obj.get(field);
        if (element == null || !element.isJsonPrimitive()) {
            throw new MalformedAstException("Missing field '" + field + "'");
        }
        return element.getAsString();
    }

    private static int requireInt(JsonObject obj, String field) {
        JsonElement element = obj.get(field);
        if (element == null || !element.isJsonPrimitive()) {
            throw new MalformedAstException("Missing field '" + field + "'");
        }
        return element.getAsInt();
    }

    private static String optionalString(JsonObject obj, String field) {
        JsonElement element = obj.get(field);
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }

    private static List<String> strings(JsonArray array) {
        List<String> result = new ArrayList<>(array.size());
        array.forEach(element -> result.add(element.isJsonNull() ? "" : element.getAsString()));
        return result;
    }

    private static List<Integer> ints(JsonArray array) {
        List<Integer> result = new ArrayList<>(array.size());
        array.forEach(element -> result.add(element.getAsInt()));
        return result;
    }
}
