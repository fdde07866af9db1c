package com.storyscene.backend.generation.web;

public class ForbiddenException extends RuntimeException {
    public ForbiddenException(String code) {
        super(code);
    }
}
