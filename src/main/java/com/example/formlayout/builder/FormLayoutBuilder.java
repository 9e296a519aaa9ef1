package com.example.formlayout.builder;

import com.example.formlayout.id.IdGenerator;
import com.example.formlayout.model.Field;
import com.example.formlayout.model.FieldDescriptor;
import com.example.formlayout.model.FieldElement;
import com.example.formlayout.model.FieldSize;
import com.example.formlayout.model.Group;
import com.example.formlayout.model.Hr;
import com.example.formlayout.model.Label;
import com.example.formlayout.model.LayoutNode;
import com.example.formlayout.model.LayoutOptions;
import com.example.formlayout.model.LayoutTypes;
import com.example.formlayout.model.ReferenceTable;
import com.example.formlayout.model.Row;
import com.example.formlayout.model.Spacer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds layout documents from flat field descriptors. The output already satisfies the
 * nesting grammar, so it does not need a normalizer pass.
 */
@Slf4j
public class FormLayoutBuilder {

    private final IdGenerator idGenerator;

    public FormLayoutBuilder(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    /**
     * Lays out all descriptors, optionally one group per {@code section}.
     * Descriptors without a section stay at the top level, at the place their section
     * first appeared.
     */
    public List<LayoutNode> buildFormLayout(List<FieldDescriptor> fields, LayoutOptions options) {
        LayoutOptions opts = options == null ? LayoutOptions.defaults() : options;
        int fieldsPerRow = opts.effectiveFieldsPerRow();
        List<LayoutNode> layout = new ArrayList<>();

        if (!opts.isGroupBySection()) {
            layout.addAll(buildSectionLayout(fields, fieldsPerRow));
            return layout;
        }

        // section label -> descriptors, in first-appearance order; null key is the default section
        Map<String, List<FieldDescriptor>> sections = new LinkedHashMap<>();
        for (FieldDescriptor f : fields) {
            String section = (f.getSection() == null || f.getSection().isBlank()) ? null : f.getSection();
            sections.computeIfAbsent(section, k -> new ArrayList<>()).add(f);
        }

        for (Map.Entry<String, List<FieldDescriptor>> e : sections.entrySet()) {
            List<LayoutNode> sectionLayout = buildSectionLayout(e.getValue(), fieldsPerRow);
            if (e.getKey() == null) {
                layout.addAll(sectionLayout);
                continue;
            }
            Group group = new Group();
            group.setCode(sectionCode(e.getKey()));
            group.setLabel(e.getKey());
            group.setOpenGroup(true);
            group.setLayout(rowsOnly(sectionLayout, "section \"" + e.getKey() + "\""));
            layout.add(group);
        }
        log.debug("Built form layout: {} descriptors -> {} top-level nodes", fields.size(), layout.size());
        return layout;
    }

    /**
     * Chunks descriptors into rows of {@code fieldsPerRow}. GROUP descriptors never enter a row;
     * they are emitted as siblings ahead of the row built from their chunk. Empty rows are skipped.
     */
    public List<LayoutNode> buildSectionLayout(List<FieldDescriptor> fields, int fieldsPerRow) {
        int perRow = Math.max(1, fieldsPerRow);
        List<LayoutNode> layout = new ArrayList<>();
        for (int i = 0; i < fields.size(); i += perRow) {
            List<FieldDescriptor> chunk = fields.subList(i, Math.min(i + perRow, fields.size()));
            Row row = new Row();
            for (FieldDescriptor f : chunk) {
                if (LayoutTypes.GROUP.equals(f.getType())) {
                    layout.add(toGroup(f));
                    continue;
                }
                row.getFields().add(toElement(f, "row"));
            }
            if (!row.getFields().isEmpty()) {
                layout.add(row);
            }
        }
        return layout;
    }

    /** Rows for the inside of a group. A GROUP descriptor here is rejected: groups do not nest. */
    public List<Row> buildGroupLayout(List<FieldDescriptor> fields, LayoutOptions options) {
        LayoutOptions opts = options == null ? LayoutOptions.defaults() : options;
        return rowsOnly(buildSectionLayout(fields, opts.effectiveFieldsPerRow()), "group");
    }

    public Group buildGroup(String code, String label, Boolean openGroup,
                            List<FieldDescriptor> fields, LayoutOptions options) {
        Group group = new Group();
        group.setCode(code);
        group.setLabel(label);
        group.setOpenGroup(openGroup == null || openGroup);
        group.setLayout(buildGroupLayout(fields, options));
        return group;
    }

    /**
     * One row per inner list, no re-chunking.
     */
    public List<Row> buildTableLayout(List<List<FieldDescriptor>> rows) {
        List<Row> layout = new ArrayList<>();
        for (List<FieldDescriptor> rowFields : rows) {
            Row row = new Row();
            for (FieldDescriptor f : rowFields) {
                if (LayoutTypes.GROUP.equals(f.getType())) {
                    throw new LayoutBuildException("GROUP \"" + f.getCode()
                            + "\" cannot be placed in a table row: a group never shares a row");
                }
                row.getFields().add(toElement(f, "table row"));
            }
            if (!row.getFields().isEmpty()) {
                layout.add(row);
            }
        }
        return layout;
    }

    public static String sectionCode(String section) {
        return "section_" + section.replaceAll("\\s+", "_").toLowerCase(Locale.ROOT);
    }

    // ====== descriptor dispatch ======

    private FieldElement toElement(FieldDescriptor f, String where) {
        String type = f.getType() == null ? "" : f.getType();
        switch (type) {
            case LayoutTypes.LABEL:
                if (f.getValue() != null) {
                    return new Label(f.getValue());
                }
                return new Label(f.getLabel() != null ? f.getLabel() : "");
            case LayoutTypes.SPACER:
                return new Spacer(f.getElementId() != null ? f.getElementId() : idGenerator.next("spacer"));
            case LayoutTypes.HR:
                return new Hr(f.getElementId() != null ? f.getElementId() : idGenerator.next("hr"));
            case LayoutTypes.REFERENCE_TABLE:
                return new ReferenceTable(f.getCode());
            default:
                return toField(f, where);
        }
    }

    private Field toField(FieldDescriptor f, String where) {
        if (f.getCode() == null || f.getCode().isBlank()) {
            throw new MissingFieldIdentityException("A field element in a " + where + " requires a code");
        }
        String fieldType = f.resolvedType();
        if (fieldType == null) {
            throw new MissingFieldIdentityException("Field element \"" + f.getCode()
                    + "\" in a " + where + " requires a field type (type or fieldType)");
        }
        FieldSize size = f.getSize() == null ? new FieldSize() : f.getSize().copy();
        return new Field(fieldType, f.getCode(), size);
    }

    private Group toGroup(FieldDescriptor f) {
        if (f.getGroup() != null) {
            return f.getGroup().copy();
        }
        Group group = new Group();
        group.setCode(f.getCode() != null ? f.getCode() : idGenerator.next("group"));
        group.setLabel(f.getLabel() != null ? f.getLabel() : "Group " + group.getCode());
        group.setOpenGroup(f.getOpenGroup() == null || f.getOpenGroup());
        return group;
    }

    private static List<Row> rowsOnly(List<LayoutNode> nodes, String where) {
        List<Row> rows = new ArrayList<>(nodes.size());
        for (LayoutNode n : nodes) {
            if (!(n instanceof Row)) {
                throw new LayoutBuildException("A " + n.getType() + " cannot be placed inside a " + where
                        + ": groups cannot be nested");
            }
            rows.add((Row) n);
        }
        return rows;
    }
}
