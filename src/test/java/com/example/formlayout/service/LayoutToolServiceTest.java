package com.example.formlayout.service;

import com.example.formlayout.builder.FormLayoutBuilder;
import com.example.formlayout.builder.MissingFieldIdentityException;
import com.example.formlayout.config.LayoutProperties;
import com.example.formlayout.editor.LayoutEditor;
import com.example.formlayout.id.SequentialIdGenerator;
import com.example.formlayout.parser.LayoutNormalizer;
import com.example.formlayout.store.FormLayoutNotFoundException;
import com.example.formlayout.store.FormLayoutSnapshot;
import com.example.formlayout.store.FormLayoutStore;
import com.example.formlayout.store.StaleRevisionException;
import com.example.formlayout.validation.InvalidFieldSizeException;
import com.example.formlayout.validation.LayoutFieldValidator;
import com.example.formlayout.validation.UnknownFieldCodeException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LayoutToolServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private InMemoryStore store;
    private Set<String> formFields;
    private LayoutToolService service;

    @BeforeEach
    void setUp() {
        SequentialIdGenerator ids = new SequentialIdGenerator();
        store = new InMemoryStore();
        formFields = new HashSet<>();
        LayoutProperties props = new LayoutProperties();
        props.setDefaultFieldsPerRow(2);
        service = new LayoutToolService(
                store,
                new LayoutNormalizer(ids),
                new FormLayoutBuilder(ids),
                new LayoutEditor(),
                new LayoutFieldValidator(appId -> formFields),
                mapper,
                props);
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    // ====== argument checks ======

    @Test
    void missingArgumentsAreNamed() throws Exception {
        MissingArgumentException noApp = assertThrows(MissingArgumentException.class,
                () -> service.handle("get_form_layout", json("{}")));
        assertEquals("app_id", noApp.getArgument());

        assertThrows(MissingArgumentException.class,
                () -> service.handle("update_form_layout", json("{'app_id':'1'}")));
        assertThrows(MissingArgumentException.class,
                () -> service.handle("create_form_layout", json("{'app_id':'1','fields':'a'}")));
        assertThrows(MissingArgumentException.class,
                () -> service.handle("add_layout_element", json("{'app_id':'1'}")));
        assertThrows(MissingArgumentException.class,
                () -> service.handle("create_group_layout", json("{'code':'g','fields':[]}")));
        assertThrows(MissingArgumentException.class,
                () -> service.handle("create_table_layout", null));
    }

    @Test
    void unknownToolIsRejected() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> service.handle("delete_everything", json("{}")));
    }

    @Test
    void positionMustBeObject() throws Exception {
        store.put("1", json("[]"), 1);

        assertThrows(IllegalArgumentException.class, () -> service.handle("add_layout_element",
                json("{'app_id':'1','element':{'type':'HR'},'position':3}")));
    }

    // ====== store-backed tools ======

    @Test
    void getReturnsStoredLayout() throws Exception {
        store.put("1", json("[{'type':'ROW','fields':[]}]"), 4);

        JsonNode out = service.handle("get_form_layout", json("{'app_id':'1'}"));

        assertEquals(4, out.get("revision").asLong());
        assertEquals("ROW", out.at("/layout/0/type").asText());
    }

    @Test
    void getUnknownAppFails() throws Exception {
        assertThrows(FormLayoutNotFoundException.class, () -> service.handle("get_form_layout", json("{'app_id':'9'}")));
    }

    @Test
    @DisplayName("update repairs the layout before storing it and reports the repairs")
    void updateRepairsAndPersists() throws Exception {
        JsonNode out = service.handle("update_form_layout",
                json("{'app_id':'1','layout':[{'type':'NUMBER','code':'a'}]}"));

        assertEquals(1, out.get("revision").asLong());
        assertEquals("ROW", out.at("/layout/0/type").asText());
        assertEquals(1, out.get("warnings").size());
        assertEquals(out.get("layout"), store.fetch("1").layout());
    }

    @Test
    void updateReportsFieldWithoutCode() throws Exception {
        JsonNode out = service.handle("update_form_layout",
                json("{'app_id':'1','layout':[{'type':'ROW','fields':[{'type':'NUMBER','size':{}}]}]}"));

        assertEquals(1, out.get("warnings").size());
        assertEquals("layout[0].fields[0]", out.at("/warnings/0/path").asText());
        assertEquals("NUMBER field has no code", out.at("/warnings/0/message").asText());
        assertFalse(out.at("/layout/0/fields/0").has("code"));
    }

    @Test
    void updateWithStaleRevisionFails() throws Exception {
        store.put("1", json("[]"), 3);

        assertThrows(StaleRevisionException.class, () -> service.handle("update_form_layout",
                json("{'app_id':'1','layout':[],'revision':2}")));
        assertEquals(3, store.fetch("1").revision());
    }

    @Test
    void updateRejectsBadSizeAndUnknownCode() throws Exception {
        assertThrows(InvalidFieldSizeException.class, () -> service.handle("update_form_layout",
                json("{'app_id':'1','layout':[{'type':'ROW','fields':[{'type':'NUMBER','code':'a','size':{'width':'wide'}}]}]}")));

        formFields.add("b");
        assertThrows(UnknownFieldCodeException.class, () -> service.handle("update_form_layout",
                json("{'app_id':'1','layout':[{'type':'ROW','fields':[{'type':'NUMBER','code':'a'}]}]}")));
        assertThrows(FormLayoutNotFoundException.class, () -> store.fetch("1"));
    }

    @Test
    void createUsesConfiguredFieldsPerRow() throws Exception {
        JsonNode out = service.handle("create_form_layout", json("{'app_id':'1','fields':["
                + "{'type':'NUMBER','code':'a'},{'fieldType':'DATE','code':'b'},{'type':'NUMBER','code':'c'}]}"));

        assertEquals(2, out.get("layout").size());
        assertEquals(2, out.at("/layout/0/fields").size());
        assertEquals("DATE", out.at("/layout/0/fields/1/type").asText());
    }

    @Test
    void createRejectsDescriptorWithoutCode() throws Exception {
        assertThrows(MissingFieldIdentityException.class, () -> service.handle("create_form_layout",
                json("{'app_id':'1','fields':[{'type':'NUMBER'}]}")));
    }

    @Test
    void createKeepsFullyDescribedGroup() throws Exception {
        JsonNode out = service.handle("create_form_layout", json("{'app_id':'1','fields':["
                + "{'type':'GROUP','code':'g','label':'G','openGroup':false,"
                + "'layout':[{'type':'ROW','fields':[{'type':'NUMBER','code':'in'}]}]}]}"));

        assertEquals("GROUP", out.at("/layout/0/type").asText());
        assertFalse(out.at("/layout/0/openGroup").asBoolean());
        assertEquals("in", out.at("/layout/0/layout/0/fields/0/code").asText());
    }

    @Test
    @DisplayName("add_layout_element edits the stored layout and quotes the fetched revision")
    void addElementAfterField() throws Exception {
        store.put("1", json("[{'type':'ROW','fields':[{'type':'NUMBER','code':'a','size':{}}]}]"), 2);

        JsonNode out = service.handle("add_layout_element", json("{'app_id':'1',"
                + "'element':{'type':'LABEL','value':'note'},'position':{'after':'a'}}"));

        assertEquals(3, out.get("revision").asLong());
        assertEquals("note", out.at("/layout/0/fields/1/value").asText());
        assertEquals(0, out.get("warnings").size());
    }

    @Test
    void addGroupAfterFieldKeepsExistingFields() throws Exception {
        store.put("1", json("[{'type':'ROW','fields':[{'type':'NUMBER','code':'x','size':{}},"
                + "{'type':'NUMBER','code':'y','size':{}}]}]"), 1);

        JsonNode out = service.handle("add_layout_element", json("{'app_id':'1',"
                + "'element':{'type':'GROUP','code':'g','label':'G','openGroup':true,'layout':[]},"
                + "'position':{'after':'x'}}"));

        JsonNode layout = store.fetch("1").layout();
        assertEquals(layout, out.get("layout"));
        assertEquals(2, layout.size());
        assertEquals("x", layout.at("/0/fields/0/code").asText());
        assertEquals("y", layout.at("/0/fields/1/code").asText());
        assertEquals("GROUP", layout.at("/1/type").asText());
        assertEquals(0, out.get("warnings").size());
    }

    // ====== pure builders ======

    @Test
    void groupLayoutIsNotStored() throws Exception {
        JsonNode out = service.handle("create_group_layout", json("{'code':'g','label':'General','openGroup':'false',"
                + "'fields':[{'type':'NUMBER','code':'a'}],'options':{'fieldsPerRow':1}}"));

        assertEquals("g", out.get("code").asText());
        assertFalse(out.get("openGroup").asBoolean());
        assertEquals(1, out.get("layout").size());
        assertTrue(store.layouts.isEmpty());
    }

    @Test
    void tableLayoutFollowsRows() throws Exception {
        JsonNode out = service.handle("create_table_layout", json("{'rows':[[{'type':'NUMBER','code':'a'},"
                + "{'type':'NUMBER','code':'b'}],[{'type':'HR','elementId':'sep'}]]}"));

        assertEquals(2, out.size());
        assertEquals(2, out.at("/0/fields").size());
        assertEquals("sep", out.at("/1/fields/0/elementId").asText());
    }

    /** Same revision rules as the Redis store, kept in a map. */
    private static class InMemoryStore implements FormLayoutStore {

        final Map<String, FormLayoutSnapshot> layouts = new HashMap<>();

        void put(String appId, JsonNode layout, long revision) {
            layouts.put(appId, new FormLayoutSnapshot(layout, revision));
        }

        @Override
        public FormLayoutSnapshot fetch(String appId) {
            FormLayoutSnapshot s = layouts.get(appId);
            if (s == null) {
                throw new FormLayoutNotFoundException(appId);
            }
            return s;
        }

        @Override
        public long persist(String appId, JsonNode layout, long revision) {
            long current = layouts.containsKey(appId) ? layouts.get(appId).revision() : 0L;
            if (revision != LATEST_REVISION && revision != current) {
                throw new StaleRevisionException(appId, revision, current);
            }
            layouts.put(appId, new FormLayoutSnapshot(layout.deepCopy(), current + 1));
            return current + 1;
        }
    }
}
