package com.flavorsnap.backend.common.error;

public class InvalidTransitionException extends PipelineException {

    private final String from;
    private final String to;

    public InvalidTransitionException(String code, String from, String to) {
        super(ErrorKind.INVALID_TRANSITION, code, "Illegal transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public String from() { return from; }
    public String to() { return to; }
}
