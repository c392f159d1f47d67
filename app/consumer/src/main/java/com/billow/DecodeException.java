package com.billow;

import java.io.IOException;

/**
 * A special kind of {@link IOException} that indicates that a payload read
 * from the replication slot could not be decoded. The offending payload is
 * kept for diagnostics.
 */
public class DecodeException extends IOException {
    /** The payload that failed to decode. */
    private final String payload;

    /**
     * Create a new decode exception.
     *
     * @param message
     *            What is wrong with the payload.
     * @param payload
     *            The payload that could not be decoded.
     */
    public DecodeException(String message, String payload) {
        super(message);
        this.payload = payload;
    }

    /**
     * Create a new decode exception caused by a parser error.
     *
     * @param message
     *            What is wrong with the payload.
     * @param payload
     *            The payload that could not be decoded.
     * @param cause
     *            The underlying parser error.
     */
    public DecodeException(String message, String payload, Throwable cause) {
        super(message, cause);
        this.payload = payload;
    }

    /**
     * Get the payload that failed to decode.
     *
     * @return The raw payload.
     */
    public String getPayload() {
        return payload;
    }
}
