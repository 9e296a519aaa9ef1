package com.example.formlayout.service;

import java.util.List;

/**
 * Tool names accepted by {@link LayoutToolService#handle}.
 */
public final class LayoutTools {

    private LayoutTools() {}

    public static final String GET_FORM_LAYOUT = "get_form_layout";
    public static final String UPDATE_FORM_LAYOUT = "update_form_layout";
    public static final String CREATE_FORM_LAYOUT = "create_form_layout";
    public static final String ADD_LAYOUT_ELEMENT = "add_layout_element";
    public static final String CREATE_GROUP_LAYOUT = "create_group_layout";
    public static final String CREATE_TABLE_LAYOUT = "create_table_layout";

    public static final List<String> ALL = List.of(
            GET_FORM_LAYOUT,
            UPDATE_FORM_LAYOUT,
            CREATE_FORM_LAYOUT,
            ADD_LAYOUT_ELEMENT,
            CREATE_GROUP_LAYOUT,
            CREATE_TABLE_LAYOUT
    );
}
