package com.geojoin.joiner.domain;

/**
 * Where identifiers and points are read from.
 */
public enum IndexBackend {
    DATABASE,
    LDAPI
}
