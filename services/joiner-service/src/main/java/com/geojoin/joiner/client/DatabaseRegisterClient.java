package com.geojoin.joiner.client;

import com.geojoin.joiner.domain.Coordinates;
import com.geojoin.joiner.domain.IdentifierPage;
import com.geojoin.joiner.repository.AddressDefaultGeocodeRepository;
import com.geojoin.joiner.repository.AddressDetailRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;

/**
 * Register backed by the G-NAF tables. The record count is read once, when the client is built,
 * so {@code hasMore} reflects that snapshot for the whole run.
 */
public class DatabaseRegisterClient implements IdentifierPager, PointProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseRegisterClient.class);

    private final AddressDetailRepository addressDetailRepository;
    private final AddressDefaultGeocodeRepository geocodeRepository;
    private final long totalCount;

    public DatabaseRegisterClient(
        AddressDetailRepository addressDetailRepository,
        AddressDefaultGeocodeRepository geocodeRepository
    ) {
        this.addressDetailRepository = addressDetailRepository;
        this.geocodeRepository = geocodeRepository;
        try {
            this.totalCount = addressDetailRepository.count();
        } catch (RuntimeException ex) {
            throw new InitialisationException("Unable to count register records", ex);
        }
        LOGGER.info("Database register holds {} records", totalCount);
    }

    @Override
    public IdentifierPage fetchPage(int pageIndex, int pageSize) {
        List<String> pids;
        try {
            pids = addressDetailRepository.findPids(PageRequest.of(pageIndex - 1, pageSize));
        } catch (RuntimeException ex) {
            throw new FetchIdBatchException("Failed to read register page " + pageIndex + " (size " + pageSize + ")", ex);
        }
        return new IdentifierPage(pids, (long) pageIndex * pageSize < totalCount);
    }

    @Override
    public Coordinates getPoint(String identifier) {
        try {
            return geocodeRepository.findFirstByAddressDetailPid(identifier)
                .orElseThrow(() -> new FetchPointException("No default geocode for " + identifier))
                .toCoordinates();
        } catch (FetchPointException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new FetchPointException("Failed to read geocode for " + identifier, ex);
        }
    }

    public long getTotalCount() {
        return totalCount;
    }
}
