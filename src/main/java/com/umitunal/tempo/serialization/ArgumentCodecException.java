package com.umitunal.tempo.serialization;

/**
 * Arguments could not be encoded or decoded.
 */
public class ArgumentCodecException extends RuntimeException {

    public ArgumentCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
