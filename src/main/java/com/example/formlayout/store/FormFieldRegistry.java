package com.example.formlayout.store;

import java.util.Set;

/**
 * Field codes defined on an app's form. Layout writes are checked against it.
 */
public interface FormFieldRegistry {

    /** @return the app's field codes; empty when they are not known, which accepts any code */
    Set<String> fieldCodes(String appId);
}
