package com.example.formlayout.codec;

import com.example.formlayout.model.Field;
import com.example.formlayout.model.FieldElement;
import com.example.formlayout.model.FieldSize;
import com.example.formlayout.model.Group;
import com.example.formlayout.model.Hr;
import com.example.formlayout.model.Label;
import com.example.formlayout.model.LayoutElement;
import com.example.formlayout.model.LayoutNode;
import com.example.formlayout.model.ReferenceTable;
import com.example.formlayout.model.Row;
import com.example.formlayout.model.Spacer;
import com.example.formlayout.model.Subtable;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Writes the typed layout model in the store's JSON shape. Absent attributes are left out,
 * except {@code size} on fields, which is always present.
 */
public final class LayoutJsonWriter {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private LayoutJsonWriter() {}

    public static ArrayNode writeLayout(List<? extends LayoutNode> layout) {
        ArrayNode arr = NODES.arrayNode();
        for (LayoutNode node : layout) {
            arr.add(writeElement(node));
        }
        return arr;
    }

    public static ObjectNode writeElement(LayoutElement element) {
        if (element instanceof Row) {
            return writeRow((Row) element);
        }
        if (element instanceof Group) {
            return writeGroup((Group) element);
        }
        if (element instanceof Subtable) {
            return writeSubtable((Subtable) element);
        }
        if (element instanceof Label) {
            ObjectNode n = typed(element);
            putIfPresent(n, "value", ((Label) element).getValue());
            return n;
        }
        if (element instanceof Spacer) {
            ObjectNode n = typed(element);
            putIfPresent(n, "elementId", ((Spacer) element).getElementId());
            return n;
        }
        if (element instanceof Hr) {
            ObjectNode n = typed(element);
            putIfPresent(n, "elementId", ((Hr) element).getElementId());
            return n;
        }
        if (element instanceof ReferenceTable) {
            ObjectNode n = typed(element);
            putIfPresent(n, "code", ((ReferenceTable) element).getCode());
            return n;
        }
        if (element instanceof Field) {
            return writeField((Field) element);
        }
        throw new IllegalArgumentException("Unsupported layout element: " + element.getClass().getName());
    }

    private static ObjectNode writeRow(Row row) {
        ObjectNode n = typed(row);
        ArrayNode fields = n.putArray("fields");
        for (FieldElement f : row.getFields()) {
            fields.add(writeElement(f));
        }
        return n;
    }

    private static ObjectNode writeGroup(Group group) {
        ObjectNode n = typed(group);
        putIfPresent(n, "code", group.getCode());
        putIfPresent(n, "label", group.getLabel());
        n.put("openGroup", group.isOpenGroup());
        n.set("layout", writeLayout(group.getLayout()));
        return n;
    }

    private static ObjectNode writeSubtable(Subtable table) {
        ObjectNode n = typed(table);
        putIfPresent(n, "code", table.getCode());
        Map<String, JsonNode> fields = table.getFields();
        if (fields != null) {
            if (table.isFieldsAsArray()) {
                ArrayNode arr = n.putArray("fields");
                fields.values().forEach(v -> arr.add(copyOrNull(v)));
            } else {
                ObjectNode obj = n.putObject("fields");
                fields.forEach((k, v) -> obj.set(k, copyOrNull(v)));
            }
        }
        return n;
    }

    private static ObjectNode writeField(Field field) {
        ObjectNode n = typed(field);
        putIfPresent(n, "code", field.getCode());
        ObjectNode size = n.putObject("size");
        FieldSize s = field.getSize();
        if (s != null) {
            putIfPresent(size, "width", s.getWidth());
            putIfPresent(size, "height", s.getHeight());
            putIfPresent(size, "innerHeight", s.getInnerHeight());
        }
        return n;
    }

    private static ObjectNode typed(LayoutElement element) {
        ObjectNode n = NODES.objectNode();
        n.put("type", element.getType());
        return n;
    }

    private static JsonNode copyOrNull(JsonNode v) {
        return v == null ? NODES.nullNode() : v.deepCopy();
    }

    private static void putIfPresent(ObjectNode n, String key, String value) {
        if (value != null) {
            n.put(key, value);
        }
    }
}
