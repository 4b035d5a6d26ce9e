package com.geojoin.joiner.service;

import com.geojoin.joiner.client.FetchPointException;
import com.geojoin.joiner.client.PipException;
import com.geojoin.joiner.client.PointProvider;
import com.geojoin.joiner.client.PolygonMatcher;
import com.geojoin.joiner.domain.Coordinates;
import com.geojoin.joiner.domain.ResolutionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a single identifier to its enclosing polygon. Record-level failures are turned into
 * tagged outcomes here and never reach the caller.
 */
public class RecordResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordResolver.class);

    private final PointProvider pointProvider;
    private final PolygonMatcher polygonMatcher;
    private final String predicate;

    public RecordResolver(PointProvider pointProvider, PolygonMatcher polygonMatcher, String predicate) {
        this.pointProvider = pointProvider;
        this.polygonMatcher = polygonMatcher;
        this.predicate = predicate;
    }

    public ResolutionOutcome resolve(long sequenceNumber, String identifier) {
        Coordinates point;
        try {
            point = pointProvider.getPoint(identifier);
        } catch (FetchPointException ex) {
            LOGGER.warn("Point lookup failed for #{} {}: {}", sequenceNumber, identifier, ex.getMessage());
            return ResolutionOutcome.pointLookupFailed(sequenceNumber, identifier);
        }

        try {
            String polygonId = polygonMatcher.matchPolygon(point, predicate).orElse("");
            return ResolutionOutcome.resolved(sequenceNumber, identifier, polygonId);
        } catch (PipException ex) {
            LOGGER.warn("Polygon match failed for #{} {}: {}", sequenceNumber, identifier, ex.getMessage());
            return ResolutionOutcome.polygonMatchFailed(sequenceNumber, identifier);
        }
    }
}
