package com.example.formlayout.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Titled, collapsible container. Its layout holds rows only.
 * A group may also show up inside a row when freshly authored; it is then the row's only entry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Group implements LayoutNode, FieldElement {

    private String code;
    private String label;
    private boolean openGroup = true;
    private List<Row> layout = new ArrayList<>();

    @Override
    public String getType() {
        return LayoutTypes.GROUP;
    }

    @Override
    public Group copy() {
        List<Row> rows = new ArrayList<>(layout.size());
        for (Row r : layout) {
            rows.add(r.copy());
        }
        return new Group(code, label, openGroup, rows);
    }
}
