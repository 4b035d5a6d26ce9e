package com.geojoin.joiner.domain;

public record ResolutionOutcome(
    long sequenceNumber,
    String identifier,
    OutcomeStatus status,
    String polygonId
) {

    public static ResolutionOutcome resolved(long sequenceNumber, String identifier, String polygonId) {
        return new ResolutionOutcome(sequenceNumber, identifier, OutcomeStatus.RESOLVED, polygonId == null ? "" : polygonId);
    }

    public static ResolutionOutcome pointLookupFailed(long sequenceNumber, String identifier) {
        return new ResolutionOutcome(sequenceNumber, identifier, OutcomeStatus.POINT_LOOKUP_FAILED, "");
    }

    public static ResolutionOutcome polygonMatchFailed(long sequenceNumber, String identifier) {
        return new ResolutionOutcome(sequenceNumber, identifier, OutcomeStatus.POLYGON_MATCH_FAILED, "");
    }

    /**
     * True for a successful lookup where no polygon contained the point.
     */
    public boolean isEmptyMatch() {
        return status == OutcomeStatus.RESOLVED && polygonId.isEmpty();
    }
}
