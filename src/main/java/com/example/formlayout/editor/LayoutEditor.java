package com.example.formlayout.editor;

import com.example.formlayout.model.Field;
import com.example.formlayout.model.FieldElement;
import com.example.formlayout.model.Group;
import com.example.formlayout.model.LayoutElement;
import com.example.formlayout.model.LayoutNode;
import com.example.formlayout.model.LayoutPosition;
import com.example.formlayout.model.LayoutTypes;
import com.example.formlayout.model.ReferenceTable;
import com.example.formlayout.model.Row;
import com.example.formlayout.model.Subtable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Inserts one element into a copy of a layout document. The caller's document is never touched.
 *
 * <p>Position modes, first match wins:
 * <ol>
 *   <li>{@code index}: splice into a group's layout ({@code type=GROUP} + {@code groupCode})
 *       or into the top level</li>
 *   <li>{@code after} / {@code before}: next to the first field with that code, depth-first;
 *       a GROUP becomes a top-level sibling of the node holding that field</li>
 *   <li>nothing: append at the top level</li>
 * </ol>
 */
@Slf4j
public class LayoutEditor {

    public List<LayoutNode> addElementToLayout(List<LayoutNode> document, LayoutElement element,
                                               LayoutPosition position) {
        List<LayoutNode> layout = copyOf(document);
        LayoutElement toInsert = element.copy();
        LayoutPosition pos = position == null ? LayoutPosition.none() : position;

        if (pos.getIndex() != null) {
            insertAtIndex(layout, toInsert, pos);
        } else if (pos.hasAdjacentTarget()) {
            insertAdjacent(layout, toInsert, pos);
        } else {
            layout.add(asTopLevel(toInsert));
        }
        return layout;
    }

    // ====== mode 1: absolute index ======

    private void insertAtIndex(List<LayoutNode> layout, LayoutElement element, LayoutPosition pos) {
        int index = pos.getIndex();
        if (LayoutTypes.GROUP.equals(pos.getType()) && pos.getGroupCode() != null) {
            Group target = findTopLevelGroup(layout, pos.getGroupCode());
            if (target == null) {
                log.warn("GROUP \"{}\" not found at the top level, element not inserted", pos.getGroupCode());
                return;
            }
            Row row;
            if (carriesGroup(element)) {
                throw new IllegalArgumentException("GROUP cannot be placed inside GROUP \""
                        + pos.getGroupCode() + "\": groups cannot be nested");
            } else if (element instanceof Row) {
                row = (Row) element;
            } else if (element instanceof FieldElement) {
                row = Row.of((FieldElement) element);
            } else {
                throw new IllegalArgumentException("A " + element.getType()
                        + " cannot be placed inside GROUP \"" + pos.getGroupCode() + "\"");
            }
            List<Row> rows = target.getLayout();
            rows.add(spliceIndex(index, rows.size()), row);
            return;
        }
        layout.add(spliceIndex(index, layout.size()), asTopLevel(element));
    }

    private static Group findTopLevelGroup(List<LayoutNode> layout, String code) {
        for (LayoutNode n : layout) {
            if (n instanceof Group && code.equals(((Group) n).getCode())) {
                return (Group) n;
            }
        }
        return null;
    }

    // ====== mode 2: next to a field code ======

    private void insertAdjacent(List<LayoutNode> layout, LayoutElement element, LayoutPosition pos) {
        boolean after = pos.getAfter() != null && !pos.getAfter().isEmpty();
        String targetCode = after ? pos.getAfter() : pos.getBefore();

        if (element instanceof Subtable) {
            log.warn("SUBTABLE cannot be placed inside a row, appended at the top level instead of next to \"{}\"",
                    targetCode);
            layout.add((Subtable) element);
            return;
        }

        // a group never shares a row, so it goes next to the top-level node holding the target
        if (carriesGroup(element)) {
            LayoutNode node = asTopLevel(element);
            int holder = indexOfHolder(layout, targetCode);
            if (holder < 0) {
                log.warn("Field \"{}\" not found in the layout, GROUP appended at the end", targetCode);
                layout.add(node);
            } else {
                layout.add(after ? holder + 1 : holder, node);
            }
            return;
        }

        List<FieldElement> toSplice = element instanceof Row
                ? ((Row) element).getFields()
                : List.of((FieldElement) element);

        if (!searchAndInsert(layout, targetCode, after, toSplice)) {
            log.warn("Field \"{}\" not found in the layout, element appended at the end", targetCode);
            layout.add(asTopLevel(element));
        }
    }

    /**
     * Pre-order walk over top-level nodes and group layouts. Stops at the first row holding
     * the target, so later duplicates of the same code are never reached.
     *
     * @return true once inserted
     */
    private boolean searchAndInsert(List<? extends LayoutNode> nodes, String targetCode, boolean after,
                                    List<FieldElement> toSplice) {
        for (LayoutNode node : nodes) {
            if (node instanceof Group) {
                if (searchAndInsert(((Group) node).getLayout(), targetCode, after, toSplice)) {
                    return true;
                }
            } else if (node instanceof Row) {
                List<FieldElement> fields = ((Row) node).getFields();
                int hit = indexOfCode(fields, targetCode);
                if (hit >= 0) {
                    fields.addAll(after ? hit + 1 : hit, toSplice);
                    return true;
                }
            }
        }
        return false;
    }

    /** Index of the first top-level node that holds {@code code}, directly or in a group's rows. */
    private static int indexOfHolder(List<LayoutNode> layout, String code) {
        for (int i = 0; i < layout.size(); i++) {
            LayoutNode node = layout.get(i);
            if (node instanceof Row && indexOfCode(((Row) node).getFields(), code) >= 0) {
                return i;
            }
            if (node instanceof Group) {
                for (Row r : ((Group) node).getLayout()) {
                    if (indexOfCode(r.getFields(), code) >= 0) {
                        return i;
                    }
                }
            }
        }
        return -1;
    }

    private static boolean carriesGroup(LayoutElement element) {
        if (element instanceof Group) {
            return true;
        }
        return element instanceof Row
                && ((Row) element).getFields().stream().anyMatch(f -> f instanceof Group);
    }

    private static int indexOfCode(List<FieldElement> fields, String code) {
        for (int i = 0; i < fields.size(); i++) {
            FieldElement f = fields.get(i);
            if (f instanceof Field && code.equals(((Field) f).getCode())) {
                return i;
            }
            if (f instanceof ReferenceTable && code.equals(((ReferenceTable) f).getCode())) {
                return i;
            }
        }
        return -1;
    }

    // ====== helpers ======

    /** ROW / GROUP / SUBTABLE go in as they are, anything else gets a ROW around it. */
    private static LayoutNode asTopLevel(LayoutElement element) {
        if (element instanceof LayoutNode) {
            return (LayoutNode) element;
        }
        return Row.of((FieldElement) element);
    }

    /** Array-splice semantics: past the end appends, negative counts back from the end. */
    static int spliceIndex(int index, int size) {
        if (index < 0) {
            return Math.max(size + index, 0);
        }
        return Math.min(index, size);
    }

    private static List<LayoutNode> copyOf(List<LayoutNode> document) {
        List<LayoutNode> copy = new ArrayList<>(document.size());
        for (LayoutNode n : document) {
            copy.add(n.copy());
        }
        return copy;
    }
}
