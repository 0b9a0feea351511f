package com.myorg.cafe.deadletter;

/**
 * @param ignored letters left queued behind heads that failed during this run
 */
public record ManualProcessingResult(int processed, int failed, int ignored) {
}
