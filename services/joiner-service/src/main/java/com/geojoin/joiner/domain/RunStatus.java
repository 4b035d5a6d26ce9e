package com.geojoin.joiner.domain;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    PARTIAL_SUCCESS,
    FAILED
}
