package com.tekir.backend.modules.quota.application;

/**
 * @param processed rows deleted or reset by this invocation
 * @param failed    rows skipped after an individual failure
 * @param hasMore   more work is likely pending; invoke again
 */
public record SweepResult(int processed, int failed, boolean hasMore) {
}
