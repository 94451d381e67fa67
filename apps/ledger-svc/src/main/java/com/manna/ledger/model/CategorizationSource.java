package com.manna.ledger.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CategorizationSource {
    MANUAL("manual"),
    MAPPING("mapping"),
    KEYWORD("keyword"),
    NO_MATCH("no_match");

    private final String value;

    CategorizationSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
