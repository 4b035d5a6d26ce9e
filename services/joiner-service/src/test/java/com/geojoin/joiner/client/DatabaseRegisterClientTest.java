package com.geojoin.joiner.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.geojoin.joiner.domain.AddressDefaultGeocodeEntity;
import com.geojoin.joiner.domain.Coordinates;
import com.geojoin.joiner.domain.IdentifierPage;
import com.geojoin.joiner.repository.AddressDefaultGeocodeRepository;
import com.geojoin.joiner.repository.AddressDetailRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;

class DatabaseRegisterClientTest {

    private AddressDetailRepository addressDetailRepository;
    private AddressDefaultGeocodeRepository geocodeRepository;
    private DatabaseRegisterClient client;

    @BeforeEach
    void setUp() {
        addressDetailRepository = mock(AddressDetailRepository.class);
        geocodeRepository = mock(AddressDefaultGeocodeRepository.class);
        when(addressDetailRepository.count()).thenReturn(10L);
        client = new DatabaseRegisterClient(addressDetailRepository, geocodeRepository);
    }

    @Test
    void countsRecordsOnceAtConstruction() {
        when(addressDetailRepository.findPids(any())).thenReturn(List.of("A"));

        client.fetchPage(1, 4);
        client.fetchPage(2, 4);

        assertEquals(10L, client.getTotalCount());
        verify(addressDetailRepository, times(1)).count();
    }

    @Test
    void singleFullPageHasNoMore() {
        when(addressDetailRepository.findPids(any())).thenReturn(pids(1, 10));

        IdentifierPage page = client.fetchPage(1, 10);

        assertEquals(10, page.identifiers().size());
        assertFalse(page.hasMore());
        assertEquals(0L, requestedPage().getOffset());
    }

    @Test
    void secondPageStartsAtOffsetOfOnePageAndHasMore() {
        when(addressDetailRepository.findPids(any())).thenReturn(pids(5, 8));

        IdentifierPage page = client.fetchPage(2, 4);

        Pageable requested = requestedPage();
        assertEquals(4L, requested.getOffset());
        assertEquals(4, requested.getPageSize());
        assertEquals(List.of("GA5", "GA6", "GA7", "GA8"), page.identifiers());
        assertTrue(page.hasMore());
    }

    @Test
    void thirdPageReturnsRemainderAndIsTheLast() {
        when(addressDetailRepository.findPids(any())).thenReturn(pids(9, 10));

        IdentifierPage page = client.fetchPage(3, 4);

        assertEquals(8L, requestedPage().getOffset());
        assertEquals(2, page.identifiers().size());
        assertFalse(page.hasMore());
    }

    @Test
    void queryFailureRaisesFetchIdBatchException() {
        when(addressDetailRepository.findPids(any())).thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThrows(FetchIdBatchException.class, () -> client.fetchPage(1, 10));
    }

    @Test
    void countFailureRaisesInitialisationException() {
        AddressDetailRepository broken = mock(AddressDetailRepository.class);
        when(broken.count()).thenThrow(new DataAccessResourceFailureException("database down"));

        assertThrows(InitialisationException.class, () -> new DatabaseRegisterClient(broken, geocodeRepository));
    }

    @Test
    void pointLookupReturnsStoredCoordinates() {
        when(geocodeRepository.findFirstByAddressDetailPid("GA123")).thenReturn(Optional.of(
            AddressDefaultGeocodeEntity.of(1L, "GA123", new BigDecimal("147.12345"), new BigDecimal("-39.12345"))
        ));

        Coordinates point = client.getPoint("GA123");

        assertEquals(new BigDecimal("147.12345"), point.longitude());
        assertEquals(new BigDecimal("-39.12345"), point.latitude());
    }

    @Test
    void missingGeocodeRaisesFetchPointException() {
        when(geocodeRepository.findFirstByAddressDetailPid("GA404")).thenReturn(Optional.empty());

        assertThrows(FetchPointException.class, () -> client.getPoint("GA404"));
    }

    @Test
    void pointQueryFailureRaisesFetchPointException() {
        when(geocodeRepository.findFirstByAddressDetailPid("GA123"))
            .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThrows(FetchPointException.class, () -> client.getPoint("GA123"));
    }

    private Pageable requestedPage() {
        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(addressDetailRepository).findPids(captor.capture());
        return captor.getValue();
    }

    private static List<String> pids(int from, int to) {
        return IntStream.rangeClosed(from, to).mapToObj(i -> "GA" + i).toList();
    }
}
