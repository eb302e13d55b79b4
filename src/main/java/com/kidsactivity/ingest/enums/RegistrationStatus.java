package com.kidsactivity.ingest.enums;

public enum RegistrationStatus {
    OPEN,
    FULL,
    WAITLIST,
    UNKNOWN
}
