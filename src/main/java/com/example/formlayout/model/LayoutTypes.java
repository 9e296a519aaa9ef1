package com.example.formlayout.model;

/**
 * Type tags of the layout grammar.
 */
public final class LayoutTypes {

    private LayoutTypes() {}

    // ====== top-level node tags ======
    public static final String ROW = "ROW";
    public static final String GROUP = "GROUP";
    public static final String SUBTABLE = "SUBTABLE";

    // ====== row element tags ======
    public static final String LABEL = "LABEL";
    public static final String SPACER = "SPACER";
    public static final String HR = "HR";
    public static final String REFERENCE_TABLE = "REFERENCE_TABLE";

    /** Field type used when a field element carries no type at all */
    public static final String DEFAULT_FIELD_TYPE = "SINGLE_LINE_TEXT";
}
