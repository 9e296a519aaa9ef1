package com.example.formlayout.builder;

import com.example.formlayout.codec.LayoutJsonWriter;
import com.example.formlayout.id.SequentialIdGenerator;
import com.example.formlayout.model.Field;
import com.example.formlayout.model.FieldDescriptor;
import com.example.formlayout.model.FieldSize;
import com.example.formlayout.model.Group;
import com.example.formlayout.model.Label;
import com.example.formlayout.model.LayoutNode;
import com.example.formlayout.model.LayoutOptions;
import com.example.formlayout.model.Row;
import com.example.formlayout.model.Spacer;
import com.example.formlayout.parser.LayoutNormalizer;
import com.example.formlayout.parser.NormalizeResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormLayoutBuilderTest {

    private final FormLayoutBuilder builder = new FormLayoutBuilder(new SequentialIdGenerator());

    private static FieldDescriptor field(String type, String code) {
        return FieldDescriptor.builder().type(type).code(code).build();
    }

    private static FieldDescriptor field(String type, String code, String section) {
        return FieldDescriptor.builder().type(type).code(code).section(section).build();
    }

    @Test
    @DisplayName("four fields, two per row: two rows in order, and the normalizer has nothing to fix")
    void buildsRowsThatNeedNoRepair() {
        List<FieldDescriptor> fields = List.of(
                field("NUMBER", "a"), field("NUMBER", "b"), field("DATE", "c"), field("DATE", "d"));

        List<LayoutNode> layout = builder.buildFormLayout(fields, new LayoutOptions(false, 2));

        assertEquals(2, layout.size());
        Row first = (Row) layout.get(0);
        Row second = (Row) layout.get(1);
        assertEquals(List.of("a", "b"), codes(first));
        assertEquals(List.of("c", "d"), codes(second));

        NormalizeResult again = new LayoutNormalizer(new SequentialIdGenerator(), true)
                .validateAndFix(LayoutJsonWriter.writeLayout(layout));
        assertFalse(again.repaired());
    }

    @Test
    void lastRowMayBeShort() {
        List<LayoutNode> layout = builder.buildSectionLayout(
                List.of(field("NUMBER", "a"), field("NUMBER", "b"), field("NUMBER", "c")), 2);

        assertEquals(2, layout.size());
        assertEquals(1, ((Row) layout.get(1)).getFields().size());
    }

    @Test
    void fieldsPerRowBelowOneMeansOne() {
        List<LayoutNode> layout = builder.buildSectionLayout(List.of(field("NUMBER", "a"), field("NUMBER", "b")), 0);

        assertEquals(2, layout.size());
    }

    // ====== sections ======

    @Test
    @DisplayName("groupBySection wraps each section into a group")
    void sectionBecomesGroup() throws Exception {
        List<LayoutNode> layout = builder.buildFormLayout(
                List.of(field("NUMBER", "a", "Billing")), new LayoutOptions(true, 1));

        ObjectMapper mapper = new ObjectMapper();
        assertEquals(mapper.readTree("[{\"type\":\"GROUP\",\"code\":\"section_billing\",\"label\":\"Billing\","
                        + "\"openGroup\":true,\"layout\":[{\"type\":\"ROW\",\"fields\":["
                        + "{\"type\":\"NUMBER\",\"code\":\"a\",\"size\":{}}]}]}]"),
                LayoutJsonWriter.writeLayout(layout));
    }

    @Test
    void sectionsKeepFirstAppearanceOrder() {
        List<LayoutNode> layout = builder.buildFormLayout(List.of(
                field("NUMBER", "x", "Zeta"),
                field("NUMBER", "plain"),
                field("NUMBER", "y", "Alpha"),
                field("NUMBER", "z", "Zeta")), new LayoutOptions(true, 3));

        assertEquals(3, layout.size());
        Group zeta = (Group) layout.get(0);
        assertEquals("section_zeta", zeta.getCode());
        assertEquals(List.of("x", "z"), codes(zeta.getLayout().get(0)));
        assertEquals(List.of("plain"), codes((Row) layout.get(1)));
        assertEquals("section_alpha", ((Group) layout.get(2)).getCode());
    }

    @Test
    void sectionCodeCollapsesWhitespace() {
        assertEquals("section_contact_info", FormLayoutBuilder.sectionCode("Contact   Info"));
    }

    // ====== descriptor dispatch ======

    @Test
    void layoutElementsAreDispatchedByType() {
        FieldDescriptor label = FieldDescriptor.builder().type("LABEL").label("Heading").build();
        FieldDescriptor spacer = FieldDescriptor.builder().type("SPACER").build();
        FieldDescriptor sized = FieldDescriptor.builder().fieldType("NUMBER").code("n")
                .size(new FieldSize("200", null, null)).build();

        Row row = (Row) builder.buildSectionLayout(List.of(label, spacer, sized), 3).get(0);

        assertEquals("Heading", ((Label) row.getFields().get(0)).getValue());
        assertEquals("spacer_1", ((Spacer) row.getFields().get(1)).getElementId());
        Field n = (Field) row.getFields().get(2);
        assertEquals("NUMBER", n.getType());
        assertEquals("200", n.getSize().getWidth());
    }

    @Test
    @DisplayName("LABEL without value or label gets an empty text that needs no repair")
    void labelWithoutTextIsEmpty() {
        FieldDescriptor bare = FieldDescriptor.builder().type("LABEL").build();

        List<LayoutNode> layout = builder.buildFormLayout(List.of(bare), new LayoutOptions(false, 1));

        assertEquals("", ((Label) ((Row) layout.get(0)).getFields().get(0)).getValue());
        NormalizeResult again = new LayoutNormalizer(new SequentialIdGenerator(), true)
                .validateAndFix(LayoutJsonWriter.writeLayout(layout));
        assertFalse(again.repaired());
    }

    @Test
    @DisplayName("a GROUP descriptor is a sibling of the row built from its chunk, never a member")
    void groupDescriptorNeverSharesRow() {
        FieldDescriptor group = FieldDescriptor.builder().type("GROUP").code("g").label("G").build();

        List<LayoutNode> layout = builder.buildSectionLayout(
                List.of(field("NUMBER", "a"), group, field("NUMBER", "b")), 3);

        assertEquals(2, layout.size());
        Group g = (Group) layout.get(0);
        assertEquals("g", g.getCode());
        assertTrue(g.isOpenGroup());
        assertEquals(List.of("a", "b"), codes((Row) layout.get(1)));
    }

    @Test
    void chunkOfOnlyGroupsEmitsNoEmptyRow() {
        FieldDescriptor group = FieldDescriptor.builder().type("GROUP").code("g").build();

        List<LayoutNode> layout = builder.buildSectionLayout(List.of(group), 1);

        assertEquals(1, layout.size());
        assertInstanceOf(Group.class, layout.get(0));
    }

    @Test
    void descriptorWithoutIdentityIsRejected() {
        FieldDescriptor noCode = FieldDescriptor.builder().type("NUMBER").build();
        FieldDescriptor noType = FieldDescriptor.builder().code("x").build();

        assertThrows(MissingFieldIdentityException.class,
                () -> builder.buildFormLayout(List.of(noCode), LayoutOptions.defaults()));
        assertThrows(MissingFieldIdentityException.class,
                () -> builder.buildFormLayout(List.of(noType), LayoutOptions.defaults()));
    }

    // ====== groups and tables ======

    @Test
    void groupLayoutRejectsNestedGroup() {
        FieldDescriptor group = FieldDescriptor.builder().type("GROUP").code("inner").build();

        assertThrows(LayoutBuildException.class,
                () -> builder.buildGroupLayout(List.of(field("NUMBER", "a"), group), LayoutOptions.defaults()));
    }

    @Test
    void buildGroupDefaultsToOpen() {
        Group group = builder.buildGroup("g", "General", null,
                List.of(field("NUMBER", "a"), field("NUMBER", "b")), new LayoutOptions(false, 2));

        assertTrue(group.isOpenGroup());
        assertEquals(1, group.getLayout().size());
        assertEquals(List.of("a", "b"), codes(group.getLayout().get(0)));
    }

    @Test
    void tableLayoutKeepsRowBoundaries() {
        List<Row> rows = builder.buildTableLayout(List.of(
                List.of(field("NUMBER", "a"), field("NUMBER", "b"), field("NUMBER", "c")),
                List.of(),
                List.of(field("DATE", "d"))));

        assertEquals(2, rows.size());
        assertEquals(List.of("a", "b", "c"), codes(rows.get(0)));
        assertEquals(List.of("d"), codes(rows.get(1)));
    }

    @Test
    void tableRowRejectsGroup() {
        FieldDescriptor group = FieldDescriptor.builder().type("GROUP").code("g").build();

        assertThrows(LayoutBuildException.class, () -> builder.buildTableLayout(List.of(List.of(group))));
    }

    private static List<String> codes(Row row) {
        return row.getFields().stream().map(f -> ((Field) f).getCode()).toList();
    }
}
