package org.bonusly.client.rest;

/**
 * Uniform wrapper around every Bonusly response.
 *
 * <pre>
 * { "success": true,  "result": { ... } }
 * { "success": false, "message": "not found" }
 * </pre>
 *
 * {@code success} is boxed so that a body without the flag can be told apart from a failure.
 */
public record Envelope<T>(
    Boolean success,
    String message,
    T result
) {}
