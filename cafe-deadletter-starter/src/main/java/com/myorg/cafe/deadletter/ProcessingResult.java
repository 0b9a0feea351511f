package com.myorg.cafe.deadletter;

public enum ProcessingResult {
    PROCESSED,
    FAILED,
    // nothing eligible in the group
    EMPTY
}
