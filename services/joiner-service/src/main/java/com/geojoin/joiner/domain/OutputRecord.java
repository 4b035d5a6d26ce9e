package com.geojoin.joiner.domain;

public record OutputRecord(long sequenceNumber, String identifier, String result) {

    public static OutputRecord from(ResolutionOutcome outcome) {
        String result = outcome.status().isFailure() ? outcome.status().failureTag() : outcome.polygonId();
        return new OutputRecord(outcome.sequenceNumber(), outcome.identifier(), result);
    }

    public String toLine() {
        return sequenceNumber + "," + identifier + "," + result;
    }
}
