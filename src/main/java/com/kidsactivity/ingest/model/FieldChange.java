package com.kidsactivity.ingest.model;

public record FieldChange(String field, Object oldValue, Object newValue) {

    @Override
    public String toString() {
        return field + ": " + oldValue + " -> " + newValue;
    }
}
