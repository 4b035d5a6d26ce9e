package com.geojoin.joiner.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.geojoin.joiner.domain.Coordinates;
import com.geojoin.joiner.domain.IdentifierPage;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Register exposed through a Linked Data API. Items are listed page by page and each item URI
 * resolves to a document carrying a WKT point.
 */
public class LdApiRegisterClient implements IdentifierPager, PointProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(LdApiRegisterClient.class);

    private static final Pattern WKT_POINT = Pattern.compile(
        "POINT\\s*\\(\\s*(-?\\d+(?:\\.\\d+)?)\\s+(-?\\d+(?:\\.\\d+)?)\\s*\\)"
    );
    private static final Pattern LINK_REL = Pattern.compile(
        ";\\s*rel\\s*=\\s*(?:\"([^\"]*)\"|([^\\s;,]+))",
        Pattern.CASE_INSENSITIVE
    );

    private final WebClient registerWebClient;
    private final String endpoint;
    private final Duration requestTimeout;

    public LdApiRegisterClient(WebClient registerWebClient, String endpoint, Duration requestTimeout) {
        this.registerWebClient = registerWebClient;
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public IdentifierPage fetchPage(int pageIndex, int pageSize) {
        URI pageUri = UriComponentsBuilder.fromUriString(endpoint)
            .queryParam("page", pageIndex)
            .queryParam("per_page", pageSize)
            .build()
            .toUri();

        ResponseEntity<JsonNode> response;
        try {
            response = registerWebClient.get()
                .uri(pageUri)
                .retrieve()
                .toEntity(JsonNode.class)
                .timeout(requestTimeout)
                .block();
        } catch (RuntimeException ex) {
            throw new FetchIdBatchException("Failed to fetch " + pageUri, ex);
        }

        if (response == null || response.getBody() == null) {
            throw new FetchIdBatchException("Empty register response from " + pageUri);
        }
        JsonNode items = response.getBody().path("register_items");
        if (!items.isArray()) {
            throw new FetchIdBatchException("No register_items in response from " + pageUri);
        }

        List<String> identifiers = new ArrayList<>(items.size());
        for (int position = 0; position < items.size(); position++) {
            JsonNode item = items.get(position);
            String identifier = text(item.isArray() ? item.get(0) : item);
            if (identifier.isEmpty()) {
                // kept so the entry still gets a sequence number and a POINTFAIL row
                LOGGER.warn("Register page {} entry {} has no item URI: {}", pageIndex, position, item);
            }
            identifiers.add(identifier);
        }
        return new IdentifierPage(identifiers, hasNextRelation(response.getHeaders().get(HttpHeaders.LINK)));
    }

    @Override
    public Coordinates getPoint(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new FetchPointException("Register entry has no item URI");
        }
        String body;
        try {
            body = registerWebClient.get()
                .uri(URI.create(identifier))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .block();
        } catch (RuntimeException ex) {
            throw new FetchPointException("Failed to fetch point for " + identifier, ex);
        }
        return extractPoint(body)
            .orElseThrow(() -> new FetchPointException("No WKT point in document for " + identifier));
    }

    static Optional<Coordinates> extractPoint(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        Matcher matcher = WKT_POINT.matcher(payload);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(Coordinates.of(matcher.group(1), matcher.group(2)));
    }

    static boolean hasNextRelation(List<String> linkHeaders) {
        if (linkHeaders == null) {
            return false;
        }
        for (String header : linkHeaders) {
            Matcher matcher = LINK_REL.matcher(header);
            while (matcher.find()) {
                String rel = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
                for (String token : rel.trim().split("\\s+")) {
                    if ("next".equals(token.toLowerCase(Locale.ROOT))) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private String text(JsonNode node) {
        return node == null || !node.isValueNode() ? "" : node.asText("").trim();
    }
}
