package com.webspec.report;

/** Counts read back from a TAP document. */
public record TapSummary(String version, int total, int passed, int failed) {

    public boolean isSuccess() {
        return failed == 0;
    }
}
