package com.quantori.faves.core.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pattern definition as stored in the library snapshot.
 *
 * @param id        stable identifier reported in classification results
 * @param name      human readable scaffold name
 * @param drugClass class the scaffold is characteristic of
 * @param smarts    query text
 */
public record ScaffoldPattern(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("drugClass") DrugClass drugClass,
    @JsonProperty("smarts") String smarts) {}
