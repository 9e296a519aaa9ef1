package com.example.formlayout.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Setter
@Getter
@Component
@ConfigurationProperties(prefix = "form-layout")
public class LayoutProperties {

    /**
     * If true: a layout that needs any repair is rejected with the list of problems.
     * If false: it is repaired, and the repairs are reported as warnings.
     */
    private boolean strict = false;

    /** uuid | sequential */
    private String idStrategy = "uuid";

    /** Namespace of every Redis key this service touches */
    private String redisKeyPrefix = "form:";

    /** Used by create_form_layout / create_group_layout when options.fieldsPerRow is absent */
    private int defaultFieldsPerRow = 1;
}
