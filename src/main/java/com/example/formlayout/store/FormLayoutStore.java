package com.example.formlayout.store;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Where layouts live between tool calls. The engine itself keeps nothing.
 */
public interface FormLayoutStore {

    /** Revision value meaning "whatever is current, skip the check". */
    long LATEST_REVISION = -1L;

    /**
     * @throws FormLayoutNotFoundException when the app has no layout yet
     */
    FormLayoutSnapshot fetch(String appId);

    /**
     * Replaces the app's layout.
     *
     * @param revision revision the caller based its change on, or {@link #LATEST_REVISION}
     * @return the new revision
     * @throws StaleRevisionException when {@code revision} is not the current one
     */
    long persist(String appId, JsonNode layout, long revision);
}
