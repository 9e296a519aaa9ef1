package com.example.formlayout.parser;

import com.example.formlayout.id.IdGenerator;
import com.example.formlayout.model.Field;
import com.example.formlayout.model.FieldElement;
import com.example.formlayout.model.FieldSize;
import com.example.formlayout.model.Group;
import com.example.formlayout.model.Hr;
import com.example.formlayout.model.Label;
import com.example.formlayout.model.LayoutElement;
import com.example.formlayout.model.LayoutNode;
import com.example.formlayout.model.LayoutTypes;
import com.example.formlayout.model.ReferenceTable;
import com.example.formlayout.model.Row;
import com.example.formlayout.model.Spacer;
import com.example.formlayout.model.Subtable;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns raw layout JSON into the typed layout model, repairing the nesting grammar on the way:
 * <ol>
 *   <li>a non-array document is wrapped; entries without {@code type} become ROW</li>
 *   <li>top-level entries are ROW / GROUP / SUBTABLE, loose row elements get a ROW around them</li>
 *   <li>a group's layout holds rows only; nested GROUP / SUBTABLE entries are dropped</li>
 *   <li>a row holding a GROUP holds nothing else; siblings are dropped, extra groups get their own row</li>
 *   <li>a subtable's fields never include a GROUP</li>
 *   <li>missing attributes are filled in (codes, labels, openGroup, element ids, field types)</li>
 * </ol>
 * Each repair is logged and reported as a {@link com.example.formlayout.model.LayoutWarning}.
 * A field or reference table without a code cannot be repaired; it is kept and reported as a notice.
 * The input tree is only read. In strict mode the first pass is still run, but any repair turns
 * into a {@link LayoutValidationException}.
 */
@Slf4j
public class LayoutNormalizer {

    private final IdGenerator idGenerator;
    private final boolean strict;

    public LayoutNormalizer(IdGenerator idGenerator) {
        this(idGenerator, false);
    }

    public LayoutNormalizer(IdGenerator idGenerator, boolean strict) {
        this.idGenerator = idGenerator;
        this.strict = strict;
    }

    /**
     * Repairs a whole layout document.
     *
     * @param value raw layout, normally an array; anything else is coerced
     * @return the repaired document and the repairs made
     * @throws LayoutValidationException only in strict mode, when a repair was needed
     */
    public NormalizeResult validateAndFix(JsonNode value) {
        NormalizeContext ctx = new NormalizeContext("layout");
        List<LayoutNode> layout;
        if (value == null || value.isNull() || value.isMissingNode()) {
            warn(ctx, "layout is missing, using an empty layout");
            layout = new ArrayList<>();
        } else {
            layout = normalizeTopLevel(asItems(value, ctx, "layout"), ctx);
        }
        failIfStrict(ctx);
        return new NormalizeResult(layout, ctx.warnings(), ctx.notices());
    }

    /**
     * Repairs a single element that is about to be inserted somewhere.
     * ROW / GROUP / SUBTABLE parse as nodes, everything else as a row element.
     */
    public ParsedElement parseElement(JsonNode value) {
        if (value == null || !value.isObject()) {
            throw new IllegalArgumentException("element must be a JSON object");
        }
        NormalizeContext ctx = new NormalizeContext("element");
        String type = text(value, "type");
        LayoutElement element;
        if (LayoutTypes.ROW.equals(type)) {
            element = normalizeRow(value, ctx, false);
        } else if (LayoutTypes.GROUP.equals(type)) {
            element = normalizeGroup(value, ctx);
        } else if (LayoutTypes.SUBTABLE.equals(type)) {
            element = normalizeSubtable(value, ctx);
        } else {
            element = normalizeFieldElement(value, ctx);
        }
        failIfStrict(ctx);
        return new ParsedElement(element, ctx.warnings(), ctx.notices());
    }

    // ====== sequences ======

    private List<LayoutNode> normalizeTopLevel(List<JsonNode> items, NormalizeContext ctx) {
        List<LayoutNode> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            JsonNode item = items.get(i);
            ctx.enterIndex(i);
            if (item == null || !item.isObject()) {
                warn(ctx, "entry is not an object, dropped");
                ctx.exit();
                continue;
            }
            String type = text(item, "type");
            if (type == null) {
                warn(ctx, "entry has no type, treated as ROW");
                type = LayoutTypes.ROW;
            }
            switch (type) {
                case LayoutTypes.ROW:
                    out.addAll(splitGroupRow(normalizeRow(item, ctx, false), ctx));
                    break;
                case LayoutTypes.GROUP:
                    out.add(normalizeGroup(item, ctx));
                    break;
                case LayoutTypes.SUBTABLE:
                    out.add(normalizeSubtable(item, ctx));
                    break;
                default:
                    warn(ctx, type + " element cannot stand at the top level, wrapped in a ROW");
                    FieldElement fe = normalizeFieldElement(item, ctx);
                    if (fe != null) {
                        out.add(Row.of(fe));
                    }
                    break;
            }
            ctx.exit();
        }
        return out;
    }

    private List<Row> normalizeGroupLayout(List<JsonNode> items, NormalizeContext ctx, String groupCode) {
        List<Row> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            JsonNode item = items.get(i);
            ctx.enterIndex(i);
            if (item == null || !item.isObject()) {
                warn(ctx, "entry is not an object, dropped");
                ctx.exit();
                continue;
            }
            String type = text(item, "type");
            if (type == null) {
                warn(ctx, "entry has no type, treated as ROW");
                type = LayoutTypes.ROW;
            }
            if (LayoutTypes.SUBTABLE.equals(type)) {
                warn(ctx, "SUBTABLE removed from GROUP \"" + groupCode + "\": a table cannot be placed in a group");
            } else if (LayoutTypes.GROUP.equals(type)) {
                warn(ctx, "GROUP removed from GROUP \"" + groupCode + "\": groups cannot be nested");
            } else if (LayoutTypes.ROW.equals(type)) {
                out.add(normalizeRow(item, ctx, true));
            } else {
                warn(ctx, type + " element cannot stand directly in a group layout, wrapped in a ROW");
                FieldElement fe = normalizeFieldElement(item, ctx);
                if (fe != null) {
                    out.add(Row.of(fe));
                }
            }
            ctx.exit();
        }
        return out;
    }

    // ====== nodes ======

    private Row normalizeRow(JsonNode item, NormalizeContext ctx, boolean insideGroup) {
        ctx.enter(".fields");
        List<JsonNode> entries = new ArrayList<>();
        JsonNode fieldsNode = item.get("fields");
        if (fieldsNode == null || fieldsNode.isNull()) {
            warn(ctx, "ROW has no fields, using an empty list");
        } else {
            entries = asItems(fieldsNode, ctx, "ROW fields");
        }

        List<JsonNode> groups = new ArrayList<>();
        for (JsonNode e : entries) {
            if (e != null && LayoutTypes.GROUP.equals(text(e, "type"))) {
                groups.add(e);
            }
        }
        if (!groups.isEmpty() && !insideGroup && groups.size() < entries.size()) {
            warn(ctx, "ROW mixes a GROUP with other elements; a group cannot share a row, only the GROUP entries are kept");
            entries = groups;
        }

        List<FieldElement> fields = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            JsonNode e = entries.get(i);
            ctx.enterIndex(i);
            if (e == null || !e.isObject()) {
                warn(ctx, "row element is not an object, dropped");
            } else if (insideGroup && LayoutTypes.GROUP.equals(text(e, "type"))) {
                warn(ctx, "GROUP removed from a row inside a group: groups cannot be nested");
            } else {
                FieldElement fe = normalizeFieldElement(e, ctx);
                if (fe != null) {
                    fields.add(fe);
                }
            }
            ctx.exit();
        }
        ctx.exit();
        return new Row(fields);
    }

    /** A row may carry a single group; a row with several becomes one row per group. */
    private List<Row> splitGroupRow(Row row, NormalizeContext ctx) {
        if (row.getFields().size() < 2 || !(row.getFields().get(0) instanceof Group)) {
            return List.of(row);
        }
        warn(ctx, "ROW holds " + row.getFields().size() + " GROUP elements, split into one row per group");
        List<Row> rows = new ArrayList<>();
        for (FieldElement g : row.getFields()) {
            rows.add(Row.of(g));
        }
        return rows;
    }

    private Group normalizeGroup(JsonNode item, NormalizeContext ctx) {
        Group group = new Group();

        String code = text(item, "code");
        if (code == null) {
            code = idGenerator.next("group");
            warn(ctx, "GROUP has no code, generated \"" + code + "\"");
        }
        group.setCode(code);

        String label = text(item, "label");
        if (label == null) {
            label = "Group " + code;
            warn(ctx, "GROUP \"" + code + "\" has no label, using \"" + label + "\"");
        }
        group.setLabel(label);

        group.setOpenGroup(readOpenGroup(item.get("openGroup"), code, ctx));

        ctx.enter(".layout");
        JsonNode layoutNode = item.get("layout");
        List<JsonNode> children;
        if (layoutNode == null || layoutNode.isNull()) {
            warn(ctx, "GROUP \"" + code + "\" has no layout, using an empty list");
            children = new ArrayList<>();
        } else {
            children = asItems(layoutNode, ctx, "GROUP \"" + code + "\" layout");
        }
        group.setLayout(normalizeGroupLayout(children, ctx, code));
        ctx.exit();
        return group;
    }

    private boolean readOpenGroup(JsonNode node, String code, NormalizeContext ctx) {
        if (node == null || node.isNull()) {
            // the store itself would default to closed; groups built here open by default
            warn(ctx, "GROUP \"" + code + "\" has no openGroup, set to true");
            return true;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        String s = node.asText();
        if ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s)) {
            warn(ctx, "GROUP \"" + code + "\" openGroup given as text, read as boolean");
            return Boolean.parseBoolean(s);
        }
        warn(ctx, "GROUP \"" + code + "\" openGroup is not a boolean, set to true");
        return true;
    }

    private Subtable normalizeSubtable(JsonNode item, NormalizeContext ctx) {
        Subtable table = new Subtable();
        String code = text(item, "code");
        if (code == null) {
            code = idGenerator.next("subtable");
            warn(ctx, "SUBTABLE has no code, generated \"" + code + "\"");
        }
        table.setCode(code);

        JsonNode fieldsNode = item.get("fields");
        if (fieldsNode == null || fieldsNode.isNull()) {
            return table;
        }
        ctx.enter(".fields");
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        if (fieldsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = fieldsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                putTableField(fields, e.getKey(), e.getValue(), code, ctx);
            }
        } else if (fieldsNode.isArray()) {
            table.setFieldsAsArray(true);
            for (int i = 0; i < fieldsNode.size(); i++) {
                putTableField(fields, String.valueOf(i), fieldsNode.get(i), code, ctx);
            }
        } else {
            warn(ctx, "SUBTABLE \"" + code + "\" fields is neither an object nor an array, dropped");
            ctx.exit();
            return table;
        }
        ctx.exit();
        table.setFields(fields);
        return table;
    }

    private void putTableField(Map<String, JsonNode> fields, String key, JsonNode def,
                               String tableCode, NormalizeContext ctx) {
        if (def != null && LayoutTypes.GROUP.equals(text(def, "type"))) {
            warn(ctx, "GROUP field \"" + key + "\" removed from SUBTABLE \"" + tableCode
                    + "\": a group cannot be placed in a table");
            return;
        }
        fields.put(key, def == null ? null : def.deepCopy());
    }

    // ====== row elements ======

    private FieldElement normalizeFieldElement(JsonNode item, NormalizeContext ctx) {
        String type = text(item, "type");
        if (type == null) {
            warn(ctx, "element has no type, set to " + LayoutTypes.DEFAULT_FIELD_TYPE);
            type = LayoutTypes.DEFAULT_FIELD_TYPE;
        }
        switch (type) {
            case LayoutTypes.LABEL: {
                JsonNode v = item.get("value");
                String value = v != null && v.isValueNode() && !v.isNull() ? v.asText() : null;
                if (value == null) {
                    warn(ctx, "LABEL has no value, using an empty text");
                    value = "";
                }
                return new Label(value);
            }
            case LayoutTypes.SPACER:
                return new Spacer(elementIdOrGenerate(item, "spacer", ctx));
            case LayoutTypes.HR:
                return new Hr(elementIdOrGenerate(item, "hr", ctx));
            case LayoutTypes.REFERENCE_TABLE: {
                String code = text(item, "code");
                if (code == null) {
                    note(ctx, "REFERENCE_TABLE has no code");
                }
                return new ReferenceTable(code);
            }
            case LayoutTypes.GROUP:
                return normalizeGroup(item, ctx);
            case LayoutTypes.ROW:
            case LayoutTypes.SUBTABLE:
                warn(ctx, type + " cannot be placed inside a row, dropped");
                return null;
            default: {
                String code = text(item, "code");
                if (code == null) {
                    note(ctx, type + " field has no code");
                }
                return new Field(type, code, normalizeSize(item.get("size"), ctx));
            }
        }
    }

    private String elementIdOrGenerate(JsonNode item, String prefix, NormalizeContext ctx) {
        String id = text(item, "elementId");
        if (id == null) {
            id = idGenerator.next(prefix);
            warn(ctx, prefix.toUpperCase(Locale.ROOT) + " has no elementId, generated \"" + id + "\"");
        }
        return id;
    }

    private FieldSize normalizeSize(JsonNode node, NormalizeContext ctx) {
        FieldSize size = new FieldSize();
        if (node == null || node.isNull()) {
            return size;
        }
        if (!node.isObject()) {
            warn(ctx, "size is not an object, replaced with {}");
            return size;
        }
        size.setWidth(sizeValue(node, "width", ctx));
        size.setHeight(sizeValue(node, "height", ctx));
        size.setInnerHeight(sizeValue(node, "innerHeight", ctx));
        return size;
    }

    private String sizeValue(JsonNode size, String key, NormalizeContext ctx) {
        JsonNode v = size.get(key);
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.isValueNode()) {
            warn(ctx, "size." + key + " is not a scalar, dropped");
            return null;
        }
        return v.asText();
    }

    // ====== helpers ======

    private List<JsonNode> asItems(JsonNode node, NormalizeContext ctx, String what) {
        List<JsonNode> items = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(items::add);
        } else {
            warn(ctx, what + " is not an array, wrapped in one");
            items.add(node);
        }
        return items;
    }

    /** Non-blank text of {@code key}, or null. */
    private static String text(JsonNode node, String key) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode v = node.get(key);
        if (v == null || v.isNull() || !v.isValueNode()) {
            return null;
        }
        String s = v.asText();
        return s.isEmpty() ? null : s;
    }

    private void warn(NormalizeContext ctx, String message) {
        ctx.addWarning(message);
        log.warn("Layout repaired at {}: {}", ctx.currentPath(), message);
    }

    private void note(NormalizeContext ctx, String message) {
        ctx.addNotice(message);
        log.info("Layout note at {}: {}", ctx.currentPath(), message);
    }

    private void failIfStrict(NormalizeContext ctx) {
        if (strict && ctx.hasWarnings()) {
            throw new LayoutValidationException(ctx.warnings());
        }
    }
}
