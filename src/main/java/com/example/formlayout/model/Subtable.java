package com.example.formlayout.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Subtable implements LayoutNode {

    private String code;

    /** Table's own field definitions, opaque here. null when the source carried none. */
    private Map<String, JsonNode> fields;

    /** true when {@link #fields} was read from an array and has to be written back as one */
    private boolean fieldsAsArray;

    @Override
    public String getType() {
        return LayoutTypes.SUBTABLE;
    }

    @Override
    public Subtable copy() {
        Map<String, JsonNode> copied = null;
        if (fields != null) {
            copied = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> e : fields.entrySet()) {
                copied.put(e.getKey(), e.getValue() == null ? null : e.getValue().deepCopy());
            }
        }
        return new Subtable(code, copied, fieldsAsArray);
    }
}
