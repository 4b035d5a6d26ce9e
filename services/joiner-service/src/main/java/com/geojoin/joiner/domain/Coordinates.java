package com.geojoin.joiner.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Longitude/latitude pair exactly as read from the register. No reprojection is applied.
 */
public record Coordinates(BigDecimal longitude, BigDecimal latitude) {

    public Coordinates {
        Objects.requireNonNull(longitude, "longitude");
        Objects.requireNonNull(latitude, "latitude");
    }

    public static Coordinates of(String longitude, String latitude) {
        return new Coordinates(new BigDecimal(longitude), new BigDecimal(latitude));
    }
}
