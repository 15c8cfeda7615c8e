package com.classmonitor.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Alert payload pushed to every device of a recipient.
 * The broker carries it as-is and never inspects the fields.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertMessage(
        String message,
        String detail,
        String imageUrl,
        Instant timestamp,
        String sourceKey) {

    /**
     * Plain notice with no detail or evidence attached.
     */
    public static AlertMessage notice(String message) {
        return new AlertMessage(message, null, null, Instant.now(), null);
    }
}
