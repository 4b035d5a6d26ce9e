package com.geojoin.joiner.client;

import com.geojoin.joiner.domain.Coordinates;

public interface PointProvider {

    /**
     * @throws FetchPointException when no point can be obtained for {@code identifier}
     */
    Coordinates getPoint(String identifier);
}
