package com.adaptiverisk.exception;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resource, String id) {
        super(ErrorCode.NOT_FOUND, resource + " not found: " + id);
    }
}
