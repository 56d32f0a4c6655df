package com.flavorsnap.backend.common.error;

public class NotFoundException extends PipelineException {

    private final String id;

    public NotFoundException(String code, String id) {
        super(ErrorKind.NOT_FOUND, code, code + ": " + id);
        this.id = id;
    }

    public String id() { return id; }
}
