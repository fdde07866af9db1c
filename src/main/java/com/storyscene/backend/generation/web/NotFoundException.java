package com.storyscene.backend.generation.web;

public class NotFoundException extends RuntimeException {
    public NotFoundException(String code) {
        super(code);
    }
}
