package com.geojoin.joiner.client;

import com.geojoin.joiner.domain.IdentifierPage;

public interface IdentifierPager {

    /**
     * Fetch one page of point identifiers.
     *
     * @param pageIndex 1-based page number
     * @param pageSize maximum number of identifiers returned
     * @return the identifiers in register order and whether further pages exist
     * @throws FetchIdBatchException when the page cannot be retrieved; no partial page is returned
     */
    IdentifierPage fetchPage(int pageIndex, int pageSize);
}
