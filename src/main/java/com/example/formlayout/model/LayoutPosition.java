package com.example.formlayout.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where the editor should put a new element. Modes are tried in order:
 * index, then after/before, then append.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayoutPosition {

    private Integer index;

    /** "GROUP" together with {@link #groupCode} targets a group's inner layout */
    private String type;

    private String groupCode;

    private String after;

    private String before;

    public static LayoutPosition none() {
        return new LayoutPosition();
    }

    public static LayoutPosition at(int index) {
        return LayoutPosition.builder().index(index).build();
    }

    public static LayoutPosition inGroup(String groupCode, int index) {
        return LayoutPosition.builder().type(LayoutTypes.GROUP).groupCode(groupCode).index(index).build();
    }

    public static LayoutPosition after(String code) {
        return LayoutPosition.builder().after(code).build();
    }

    public static LayoutPosition before(String code) {
        return LayoutPosition.builder().before(code).build();
    }

    public boolean hasAdjacentTarget() {
        return notBlank(after) || notBlank(before);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isEmpty();
    }
}
