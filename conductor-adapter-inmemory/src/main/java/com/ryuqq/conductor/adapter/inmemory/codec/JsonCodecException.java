package com.ryuqq.conductor.adapter.inmemory.codec;

/**
 * Thrown when a value cannot be written to or read from JSON.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class JsonCodecException extends RuntimeException {

    public JsonCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
