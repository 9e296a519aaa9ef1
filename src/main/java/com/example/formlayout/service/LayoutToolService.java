package com.example.formlayout.service;

import com.example.formlayout.builder.FormLayoutBuilder;
import com.example.formlayout.codec.LayoutJsonWriter;
import com.example.formlayout.config.LayoutProperties;
import com.example.formlayout.editor.LayoutEditor;
import com.example.formlayout.model.FieldDescriptor;
import com.example.formlayout.model.Group;
import com.example.formlayout.model.LayoutNode;
import com.example.formlayout.model.LayoutOptions;
import com.example.formlayout.model.LayoutPosition;
import com.example.formlayout.model.LayoutTypes;
import com.example.formlayout.model.LayoutWarning;
import com.example.formlayout.model.Row;
import com.example.formlayout.parser.LayoutNormalizer;
import com.example.formlayout.parser.NormalizeResult;
import com.example.formlayout.parser.ParsedElement;
import com.example.formlayout.store.FormLayoutSnapshot;
import com.example.formlayout.store.FormLayoutStore;
import com.example.formlayout.validation.LayoutFieldValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Tool entry points over the layout engine. Arguments arrive as one JSON object per call,
 * results go back as JSON.
 *
 * Reads and writes go through {@link FormLayoutStore}; every write passes
 * {@link LayoutFieldValidator} first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LayoutToolService {

    private final FormLayoutStore layoutStore;
    private final LayoutNormalizer normalizer;
    private final FormLayoutBuilder builder;
    private final LayoutEditor editor;
    private final LayoutFieldValidator fieldValidator;
    private final ObjectMapper objectMapper;
    private final LayoutProperties props;

    public JsonNode handle(String name, JsonNode args) {
        JsonNode a = args == null || args.isNull() ? objectMapper.createObjectNode() : args;
        if (!a.isObject()) {
            throw new IllegalArgumentException("Arguments of " + name + " must be a JSON object");
        }
        return switch (name == null ? "" : name) {
            case LayoutTools.GET_FORM_LAYOUT -> getFormLayout(requireText(a, "app_id"));
            case LayoutTools.UPDATE_FORM_LAYOUT -> updateFormLayout(
                    requireText(a, "app_id"),
                    require(a, "layout"),
                    readRevision(a.get("revision")));
            case LayoutTools.CREATE_FORM_LAYOUT -> createFormLayout(
                    requireText(a, "app_id"),
                    readDescriptors(requireArray(a, "fields")),
                    readOptions(a.get("options")));
            case LayoutTools.ADD_LAYOUT_ELEMENT -> addLayoutElement(
                    requireText(a, "app_id"),
                    require(a, "element"),
                    readPosition(a.get("position")));
            case LayoutTools.CREATE_GROUP_LAYOUT -> createGroupLayout(
                    requireText(a, "code"),
                    requireText(a, "label"),
                    readDescriptors(requireArray(a, "fields")),
                    readOpenGroup(a.get("openGroup")),
                    readOptions(a.get("options")));
            case LayoutTools.CREATE_TABLE_LAYOUT -> createTableLayout(readRows(requireArray(a, "rows")));
            default -> throw new IllegalArgumentException("Unknown layout tool: " + name
                    + " (expected one of " + LayoutTools.ALL + ")");
        };
    }

    // ====== tools ======

    public JsonNode getFormLayout(String appId) {
        FormLayoutSnapshot snapshot = layoutStore.fetch(appId);
        log.info("get_form_layout app={} revision={}", appId, snapshot.revision());

        ObjectNode out = objectMapper.createObjectNode();
        out.set("layout", snapshot.layout());
        out.put("revision", snapshot.revision());
        return out;
    }

    public JsonNode updateFormLayout(String appId, JsonNode layout, Long revision) {
        long expected = revision == null ? FormLayoutStore.LATEST_REVISION : revision;
        NormalizeResult normalized = normalizer.validateAndFix(layout);

        List<LayoutWarning> warnings = new ArrayList<>(normalized.warnings());
        warnings.addAll(normalized.notices());
        warnings.addAll(fieldValidator.check(appId, normalized.layout()));

        ArrayNode written = LayoutJsonWriter.writeLayout(normalized.layout());
        log.debug("update_form_layout app={} payload={}", appId, written);
        long next = layoutStore.persist(appId, written, expected);
        log.info("update_form_layout app={} revision={} repairs={} warnings={}",
                appId, next, normalized.warnings().size(), warnings.size());

        ObjectNode out = objectMapper.createObjectNode();
        out.put("revision", next);
        out.set("layout", written);
        out.set("warnings", writeWarnings(warnings));
        return out;
    }

    public JsonNode createFormLayout(String appId, List<FieldDescriptor> fields, LayoutOptions options) {
        List<LayoutNode> layout = builder.buildFormLayout(fields, options);
        List<LayoutWarning> warnings = fieldValidator.check(appId, layout);

        ArrayNode written = LayoutJsonWriter.writeLayout(layout);
        log.debug("create_form_layout app={} payload={}", appId, written);
        long next = layoutStore.persist(appId, written, FormLayoutStore.LATEST_REVISION);
        log.info("create_form_layout app={} revision={} descriptors={} nodes={}",
                appId, next, fields.size(), layout.size());

        ObjectNode out = objectMapper.createObjectNode();
        out.put("revision", next);
        out.set("layout", written);
        if (!warnings.isEmpty()) {
            out.set("warnings", writeWarnings(warnings));
        }
        return out;
    }

    public JsonNode addLayoutElement(String appId, JsonNode element, LayoutPosition position) {
        FormLayoutSnapshot snapshot = layoutStore.fetch(appId);
        NormalizeResult current = normalizer.validateAndFix(snapshot.layout());
        ParsedElement parsed = normalizer.parseElement(element);

        List<LayoutNode> edited = editor.addElementToLayout(current.layout(), parsed.element(), position);
        // the edited document goes through the same repair pass as a stored one
        NormalizeResult normalized = normalizer.validateAndFix(LayoutJsonWriter.writeLayout(edited));

        List<LayoutWarning> warnings = new ArrayList<>(current.warnings());
        warnings.addAll(parsed.warnings());
        warnings.addAll(normalized.warnings());
        // notices repeat on every pass, the last one covers the stored result
        warnings.addAll(normalized.notices());
        warnings.addAll(fieldValidator.check(appId, normalized.layout()));

        ArrayNode written = LayoutJsonWriter.writeLayout(normalized.layout());
        log.debug("add_layout_element app={} element={} position={}", appId, element, position);
        long next = layoutStore.persist(appId, written, snapshot.revision());
        log.info("add_layout_element app={} type={} revision {} -> {}",
                appId, parsed.element().getType(), snapshot.revision(), next);

        ObjectNode out = objectMapper.createObjectNode();
        out.put("revision", next);
        out.set("layout", written);
        out.set("warnings", writeWarnings(warnings));
        return out;
    }

    public JsonNode createGroupLayout(String code, String label, List<FieldDescriptor> fields,
                                      Boolean openGroup, LayoutOptions options) {
        Group group = builder.buildGroup(code, label, openGroup, fields, options);
        log.info("create_group_layout code={} rows={}", code, group.getLayout().size());
        return LayoutJsonWriter.writeElement(group);
    }

    public JsonNode createTableLayout(List<List<FieldDescriptor>> rows) {
        List<Row> layout = builder.buildTableLayout(rows);
        log.info("create_table_layout rows={} -> {}", rows.size(), layout.size());
        return LayoutJsonWriter.writeLayout(layout);
    }

    // ====== argument reading ======

    private static JsonNode require(JsonNode args, String name) {
        JsonNode v = args.get(name);
        if (v == null || v.isNull() || v.isMissingNode()) {
            throw new MissingArgumentException(name);
        }
        return v;
    }

    private static String requireText(JsonNode args, String name) {
        JsonNode v = require(args, name);
        String text = v.isValueNode() ? v.asText() : null;
        if (text == null || text.isBlank()) {
            throw new MissingArgumentException(name);
        }
        return text;
    }

    private static JsonNode requireArray(JsonNode args, String name) {
        JsonNode v = require(args, name);
        if (!v.isArray()) {
            throw new MissingArgumentException(name, name + " must be an array");
        }
        return v;
    }

    private static Long readRevision(JsonNode v) {
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isIntegralNumber()) {
            return v.asLong();
        }
        if (v.isTextual()) {
            try {
                return Long.parseLong(v.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("revision must be a number, got: " + v.asText(), e);
            }
        }
        throw new IllegalArgumentException("revision must be a number, got: " + v);
    }

    private static Boolean readOpenGroup(JsonNode v) {
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isBoolean()) {
            return v.asBoolean();
        }
        if (v.isTextual() && ("true".equalsIgnoreCase(v.asText()) || "false".equalsIgnoreCase(v.asText()))) {
            return Boolean.parseBoolean(v.asText());
        }
        throw new IllegalArgumentException("openGroup must be a boolean, got: " + v);
    }

    private LayoutOptions readOptions(JsonNode v) {
        LayoutOptions options = LayoutOptions.defaults();
        options.setFieldsPerRow(props.getDefaultFieldsPerRow());
        if (v == null || v.isNull()) {
            return options;
        }
        if (!v.isObject()) {
            throw new IllegalArgumentException("options must be a JSON object");
        }
        options.setGroupBySection(v.path("groupBySection").asBoolean(false));
        JsonNode perRow = v.get("fieldsPerRow");
        if (perRow != null && perRow.canConvertToInt()) {
            options.setFieldsPerRow(perRow.asInt());
        }
        return options;
    }

    private LayoutPosition readPosition(JsonNode v) {
        if (v == null || v.isNull()) {
            return LayoutPosition.none();
        }
        if (!v.isObject()) {
            throw new IllegalArgumentException("position must be a JSON object, got: " + v.getNodeType());
        }
        return objectMapper.convertValue(v, LayoutPosition.class);
    }

    private List<List<FieldDescriptor>> readRows(JsonNode rows) {
        List<List<FieldDescriptor>> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            JsonNode row = rows.get(i);
            if (!row.isArray()) {
                throw new IllegalArgumentException("rows[" + i + "] must be an array of field descriptors");
            }
            out.add(readDescriptors(row));
        }
        return out;
    }

    List<FieldDescriptor> readDescriptors(JsonNode fields) {
        List<FieldDescriptor> out = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            JsonNode f = fields.get(i);
            if (!f.isObject()) {
                throw new IllegalArgumentException("fields[" + i + "] must be a JSON object");
            }
            FieldDescriptor d = objectMapper.convertValue(f, FieldDescriptor.class);
            if (LayoutTypes.GROUP.equals(d.getType()) && f.has("layout")) {
                // a fully described group: its inner layout is repaired like any stored one
                d.setGroup((Group) normalizer.parseElement(f).element());
            }
            out.add(d);
        }
        return out;
    }

    private ArrayNode writeWarnings(List<LayoutWarning> warnings) {
        ArrayNode arr = objectMapper.createArrayNode();
        for (LayoutWarning w : warnings) {
            ObjectNode n = arr.addObject();
            n.put("path", w.path());
            n.put("message", w.message());
        }
        return arr;
    }
}
