package com.automate.FindingSync.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Folds one page of a paginated response into the accumulator.
 */
@FunctionalInterface
public interface PageProcessor<T> {
    /** @return number of items present in this page */
    int process(JsonNode page, List<T> results);
}
