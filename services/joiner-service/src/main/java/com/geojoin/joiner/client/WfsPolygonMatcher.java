package com.geojoin.joiner.client;

import com.geojoin.joiner.domain.Coordinates;
import java.io.StringReader;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Point-in-polygon lookups against a WFS 1.0.0 endpoint returning GML2.
 * <p>
 * One {@code GetFeature} request is made per point, filtered by a single-point OGC spatial filter and
 * asking only for the identifier attribute. When several features come back the last one in document
 * order is reported.
 */
public class WfsPolygonMatcher implements PolygonMatcher {

    static final String GML_NS = "http://www.opengis.net/gml";
    static final String WFS_NS = "http://www.opengis.net/wfs";

    private static final QName FEATURE_MEMBER = new QName(GML_NS, "featureMember");

    private final WebClient polygonWebClient;
    private final String endpoint;
    private final String layer;
    private final String geometryField;
    private final String layerId;
    private final String srsName;
    private final Duration requestTimeout;
    private final Map<String, String> namespaces;
    private final QName featureName;
    private final QName idName;
    private final XMLInputFactory xmlInputFactory;

    public WfsPolygonMatcher(
        WebClient polygonWebClient,
        String endpoint,
        String layer,
        String geometryField,
        String layerId,
        String nsPrefix,
        String nsUrl,
        String srsName,
        Duration requestTimeout
    ) {
        this.polygonWebClient = polygonWebClient;
        this.endpoint = endpoint;
        this.layer = layer;
        this.geometryField = geometryField;
        this.layerId = layerId;
        this.srsName = srsName;
        this.requestTimeout = requestTimeout;
        // the configured prefix may rebind gml or wfs
        this.namespaces = new LinkedHashMap<>();
        this.namespaces.put("gml", GML_NS);
        this.namespaces.put("wfs", WFS_NS);
        this.namespaces.put(nsPrefix, nsUrl);
        this.featureName = qualify(layer);
        this.idName = qualify(layerId);
        this.xmlInputFactory = XMLInputFactory.newFactory();
        this.xmlInputFactory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        this.xmlInputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        this.xmlInputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    @Override
    public Optional<String> matchPolygon(Coordinates point, String predicate) {
        URI queryUri = buildQueryUri(point, predicate);
        String body;
        try {
            body = polygonWebClient.get()
                .uri(queryUri)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .block();
        } catch (RuntimeException ex) {
            throw new PipException("PIP request failed for " + describe(point), ex);
        }
        if (body == null) {
            throw new PipException("Empty PIP response for " + describe(point));
        }
        try {
            return readLastFeatureId(body);
        } catch (XMLStreamException ex) {
            throw new PipException("Unparseable PIP response for " + describe(point), ex);
        }
    }

    URI buildQueryUri(Coordinates point, String predicate) {
        return UriComponentsBuilder.fromUriString(endpoint)
            .queryParam("service", "WFS")
            .queryParam("request", "GetFeature")
            .queryParam("version", "1.0.0")
            .queryParam("typeName", layer)
            .queryParam("outputFormat", "GML2")
            .queryParam("FILTER", "{filter}")
            .queryParam("PropertyName", layerId)
            .encode()
            .buildAndExpand(filter(point, predicate))
            .toUri();
    }

    String filter(Coordinates point, String predicate) {
        return "<Filter xmlns=\"http://www.opengis.net/ogc\" xmlns:gml=\"" + GML_NS + "\">"
            + "<" + predicate + ">"
            + "<PropertyName>" + geometryField + "</PropertyName>"
            + "<gml:Point srsName=\"" + srsName + "\">"
            + "<gml:coordinates>" + point.longitude().toPlainString() + "," + point.latitude().toPlainString()
            + "</gml:coordinates>"
            + "</gml:Point>"
            + "</" + predicate + ">"
            + "</Filter>";
    }

    private Optional<String> readLastFeatureId(String xml) throws XMLStreamException {
        XMLStreamReader reader = xmlInputFactory.createXMLStreamReader(new StringReader(xml));
        try {
            String id = null;
            // element path below the current gml:featureMember: 1 = member, 2 = feature, 3 = attribute
            int memberDepth = 0;
            boolean inFeature = false;
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.START_ELEMENT) {
                    if (memberDepth > 0) {
                        memberDepth++;
                        if (memberDepth == 2) {
                            inFeature = featureName.equals(reader.getName());
                        } else if (memberDepth == 3 && inFeature && idName.equals(reader.getName())) {
                            id = reader.getElementText().trim();
                            memberDepth--;
                        }
                    } else if (FEATURE_MEMBER.equals(reader.getName())) {
                        memberDepth = 1;
                    }
                } else if (event == XMLStreamConstants.END_ELEMENT && memberDepth > 0) {
                    memberDepth--;
                    if (memberDepth < 2) {
                        inFeature = false;
                    }
                }
            }
            return Optional.ofNullable(id);
        } finally {
            reader.close();
        }
    }

    private QName qualify(String prefixedName) {
        int colon = prefixedName.indexOf(':');
        if (colon < 0) {
            return new QName(XMLConstants.NULL_NS_URI, prefixedName);
        }
        String prefix = prefixedName.substring(0, colon);
        String namespace = namespaces.get(prefix);
        if (namespace == null) {
            throw new IllegalArgumentException("Unknown namespace prefix in " + prefixedName);
        }
        return new QName(namespace, prefixedName.substring(colon + 1));
    }

    private String describe(Coordinates point) {
        return "(" + point.longitude().toPlainString() + ", " + point.latitude().toPlainString() + ")";
    }
}
