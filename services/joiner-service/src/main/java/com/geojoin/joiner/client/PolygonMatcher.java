package com.geojoin.joiner.client;

import com.geojoin.joiner.domain.Coordinates;
import java.util.Optional;

public interface PolygonMatcher {

    /**
     * Find the polygon related to {@code point} by the named spatial predicate.
     *
     * @param point query point
     * @param predicate spatial relation name, e.g. {@code Contains} or {@code Intersects}; passed through unchecked
     * @return the polygon identifier, or empty when no polygon matched
     * @throws PipException when the service fails or answers with unparseable data
     */
    Optional<String> matchPolygon(Coordinates point, String predicate);
}
