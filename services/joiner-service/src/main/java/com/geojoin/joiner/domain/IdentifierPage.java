package com.geojoin.joiner.domain;

import java.util.List;

public record IdentifierPage(List<String> identifiers, boolean hasMore) {

    public IdentifierPage {
        identifiers = List.copyOf(identifiers);
    }
}
