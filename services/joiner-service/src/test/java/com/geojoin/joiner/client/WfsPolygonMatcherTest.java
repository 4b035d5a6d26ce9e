package com.geojoin.joiner.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.geojoin.joiner.domain.Coordinates;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class WfsPolygonMatcherTest {

    private static final String NS_PREFIX = "ahgf_shcatch";
    private static final String NS_URL = "http://linked.data.gov.au/dataset/geof/v2/ahgf_shcatch";
    private static final String ENDPOINT = "http://geofabricld.net/geoserver/ows";
    private static final String LAYER = "ahgf_shcatch:AHGFCatchment";
    private static final String GEOMETRY_FIELD = "shape";
    private static final String LAYER_ID = "ahgf_shcatch:hydroid";
    private static final Coordinates POINT = Coordinates.of("149.03865604", "-35.20113263");

    private static final String TWO_FEATURES = """
        <?xml version="1.0" encoding="UTF-8"?>
        <wfs:FeatureCollection xmlns:wfs="http://www.opengis.net/wfs"
            xmlns:gml="http://www.opengis.net/gml"
            xmlns:ahgf_shcatch="http://linked.data.gov.au/dataset/geof/v2/ahgf_shcatch">
          <gml:featureMember>
            <ahgf_shcatch:AHGFCatchment fid="AHGFCatchment.1">
              <ahgf_shcatch:hydroid>1001</ahgf_shcatch:hydroid>
            </ahgf_shcatch:AHGFCatchment>
          </gml:featureMember>
          <gml:featureMember>
            <ahgf_shcatch:AHGFCatchment fid="AHGFCatchment.2">
              <ahgf_shcatch:ncb_id>77</ahgf_shcatch:ncb_id>
              <ahgf_shcatch:hydroid>1002</ahgf_shcatch:hydroid>
            </ahgf_shcatch:AHGFCatchment>
          </gml:featureMember>
        </wfs:FeatureCollection>
        """;

    private static final String NO_FEATURES = """
        <?xml version="1.0" encoding="UTF-8"?>
        <wfs:FeatureCollection xmlns:wfs="http://www.opengis.net/wfs" xmlns:gml="http://www.opengis.net/gml">
          <gml:boundedBy><gml:null>unknown</gml:null></gml:boundedBy>
        </wfs:FeatureCollection>
        """;

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void returnsIdentifierOfSingleMatchingFeature() throws IOException {
        WfsPolygonMatcher matcher = matcher(respondingWith(fixture("wfs-single-feature.xml")));

        assertEquals(Optional.of("7155143"), matcher.matchPolygon(POINT, "Contains"));
    }

    @Test
    void buildsGetFeatureRequestWithSinglePointFilter() throws IOException {
        WfsPolygonMatcher matcher = matcher(respondingWith(fixture("wfs-single-feature.xml")));

        matcher.matchPolygon(POINT, "Contains");

        URI uri = lastRequest.get().url();
        assertEquals("geofabricld.net", uri.getHost());
        assertEquals("/geoserver/ows", uri.getPath());
        String query = URLDecoder.decode(uri.getRawQuery(), StandardCharsets.UTF_8);
        assertTrue(query.startsWith("service=WFS&request=GetFeature&version=1.0.0"), query);
        assertTrue(query.contains("typeName=ahgf_shcatch:AHGFCatchment"), query);
        assertTrue(query.contains("outputFormat=GML2"), query);
        assertTrue(query.endsWith("PropertyName=ahgf_shcatch:hydroid"), query);
        assertTrue(query.contains(
            "FILTER=<Filter xmlns=\"http://www.opengis.net/ogc\" xmlns:gml=\"http://www.opengis.net/gml\">"
                + "<Contains><PropertyName>shape</PropertyName>"
                + "<gml:Point srsName=\"EPSG:4283\"><gml:coordinates>149.03865604,-35.20113263</gml:coordinates>"
                + "</gml:Point></Contains></Filter>"
        ), query);
    }

    @Test
    void forwardsPredicateNameVerbatim() {
        WfsPolygonMatcher matcher = matcher(respondingWith(NO_FEATURES));

        matcher.matchPolygon(POINT, "Intersects");

        String query = URLDecoder.decode(lastRequest.get().url().getRawQuery(), StandardCharsets.UTF_8);
        assertTrue(query.contains("<Intersects><PropertyName>shape</PropertyName>"), query);
        assertTrue(query.contains("</Intersects></Filter>"), query);
    }

    @Test
    void lastFeatureWinsWhenSeveralMatch() {
        WfsPolygonMatcher matcher = matcher(respondingWith(TWO_FEATURES));

        assertEquals(Optional.of("1002"), matcher.matchPolygon(POINT, "Intersects"));
    }

    @Test
    void noFeaturesIsAnEmptyMatchNotAFailure() {
        WfsPolygonMatcher matcher = matcher(respondingWith(NO_FEATURES));

        assertEquals(Optional.empty(), matcher.matchPolygon(POINT, "Contains"));
    }

    @Test
    void malformedResponseRaisesPipException() {
        WfsPolygonMatcher matcher = matcher(respondingWith("<html><body>Service unavailable"));

        assertThrows(PipException.class, () -> matcher.matchPolygon(POINT, "Contains"));
    }

    @Test
    void transportFailureRaisesPipException() {
        WfsPolygonMatcher matcher = matcher(request -> Mono.error(new ConnectException("Connection refused")));

        assertThrows(PipException.class, () -> matcher.matchPolygon(POINT, "Contains"));
    }

    @Test
    void errorStatusRaisesPipException() {
        WfsPolygonMatcher matcher = matcher(request -> Mono.just(
            ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR).body("boom").build()
        ));

        assertThrows(PipException.class, () -> matcher.matchPolygon(POINT, "Contains"));
    }

    @Test
    void layerPrefixMayRebindGmlPrefix() {
        String catchments = "http://example.org/catchments";
        String xml = """
            <?xml version="1.0" encoding="UTF-8"?>
            <wfs:FeatureCollection xmlns:wfs="http://www.opengis.net/wfs"
                xmlns:g="http://www.opengis.net/gml"
                xmlns:c="http://example.org/catchments">
              <g:featureMember>
                <c:Catchment fid="Catchment.9">
                  <c:hydroid>9009</c:hydroid>
                </c:Catchment>
              </g:featureMember>
            </wfs:FeatureCollection>
            """;
        WebClient webClient = WebClient.builder().exchangeFunction(respondingWith(xml)).build();
        WfsPolygonMatcher matcher = new WfsPolygonMatcher(
            webClient, ENDPOINT, "gml:Catchment", GEOMETRY_FIELD, "gml:hydroid", "gml", catchments, "EPSG:4283",
            Duration.ofSeconds(5)
        );

        assertEquals(Optional.of("9009"), matcher.matchPolygon(POINT, "Contains"));
    }

    private WfsPolygonMatcher matcher(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                lastRequest.set(request);
                return exchange.exchange(request);
            })
            .build();
        return new WfsPolygonMatcher(
            webClient, ENDPOINT, LAYER, GEOMETRY_FIELD, LAYER_ID, NS_PREFIX, NS_URL, "EPSG:4283", Duration.ofSeconds(5)
        );
    }

    private static ExchangeFunction respondingWith(String xml) {
        return request -> Mono.just(
            ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_XML_VALUE)
                .body(xml)
                .build()
        );
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = WfsPolygonMatcherTest.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IOException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
