package com.geojoin.joiner.domain;

public enum OutcomeStatus {
    RESOLVED(null),
    POINT_LOOKUP_FAILED("POINTFAIL"),
    POLYGON_MATCH_FAILED("PIPFAIL");

    private final String failureTag;

    OutcomeStatus(String failureTag) {
        this.failureTag = failureTag;
    }

    public String failureTag() {
        return failureTag;
    }

    public boolean isFailure() {
        return this != RESOLVED;
    }
}
