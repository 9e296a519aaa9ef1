package com.example.formlayout.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat description of one element to lay out, as tool callers send it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldDescriptor {

    /** Field type (NUMBER, ...) or layout category (LABEL / SPACER / HR / REFERENCE_TABLE / GROUP) */
    private String type;

    /** Alternative spelling of {@link #type}, only read when type is absent */
    private String fieldType;

    private String code;

    /** LABEL text falls back to this when {@link #value} is absent; GROUP title */
    private String label;

    private String value;

    private String elementId;

    /** Section label; descriptors sharing it end up in the same group */
    private String section;

    private FieldSize size;

    private Boolean openGroup;

    /** Already built group, for GROUP descriptors */
    @JsonIgnore
    private Group group;

    public String resolvedType() {
        if (type != null && !type.isBlank()) {
            return type;
        }
        if (fieldType != null && !fieldType.isBlank()) {
            return fieldType;
        }
        return null;
    }
}
