package com.example.formlayout.validation;

import com.example.formlayout.model.Field;
import com.example.formlayout.model.FieldElement;
import com.example.formlayout.model.Group;
import com.example.formlayout.model.LayoutNode;
import com.example.formlayout.model.ReferenceTable;
import com.example.formlayout.model.Row;
import com.example.formlayout.model.Subtable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Walks a layout and reports what it places: field codes, and every field element.
 */
public final class LayoutFieldCollector {

    private LayoutFieldCollector() {}

    /**
     * Codes of everything that is a form field in its own right: input fields, reference tables,
     * groups and subtables. Document order, no duplicates.
     */
    public static Set<String> collectFieldCodes(List<? extends LayoutNode> layout) {
        Set<String> codes = new LinkedHashSet<>();
        for (LayoutNode node : layout) {
            if (node instanceof Subtable) {
                addIfPresent(codes, ((Subtable) node).getCode());
            } else if (node instanceof Group) {
                addIfPresent(codes, ((Group) node).getCode());
            }
        }
        forEachFieldElement(layout, fe -> {
            if (fe instanceof Field) {
                addIfPresent(codes, ((Field) fe).getCode());
            } else if (fe instanceof ReferenceTable) {
                addIfPresent(codes, ((ReferenceTable) fe).getCode());
            } else if (fe instanceof Group) {
                addIfPresent(codes, ((Group) fe).getCode());
            }
        });
        return codes;
    }

    /** Visits row elements at the top level, inside groups, and inside groups held by rows. */
    public static void forEachFieldElement(List<? extends LayoutNode> layout, Consumer<FieldElement> visitor) {
        for (LayoutNode node : layout) {
            if (node instanceof Row) {
                for (FieldElement fe : ((Row) node).getFields()) {
                    visitor.accept(fe);
                    if (fe instanceof Group) {
                        forEachFieldElement(((Group) fe).getLayout(), visitor);
                    }
                }
            } else if (node instanceof Group) {
                forEachFieldElement(((Group) node).getLayout(), visitor);
            }
        }
    }

    private static void addIfPresent(Set<String> codes, String code) {
        if (code != null && !code.isEmpty()) {
            codes.add(code);
        }
    }
}
