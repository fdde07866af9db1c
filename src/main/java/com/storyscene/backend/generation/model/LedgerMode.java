package com.storyscene.backend.generation.model;

/** How credits were handled for one generation attempt. */
public enum LedgerMode {
    RESERVED,
    UNRESERVED
}
