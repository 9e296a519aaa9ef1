package com.example.formlayout.store;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Layout as stored, together with the revision a later write has to quote.
 */
public record FormLayoutSnapshot(JsonNode layout, long revision) {}
