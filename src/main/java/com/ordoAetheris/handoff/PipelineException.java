package com.ordoAetheris.handoff;

public class PipelineException extends RuntimeException {

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
