package com.geojoin.joiner.config;

import com.geojoin.joiner.domain.IndexBackend;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "joiner")
public class JoinerProperties {

    @NotBlank
    private String wfsEndpoint;

    @NotBlank
    private String layer;

    @NotBlank
    private String geometryField;

    @NotBlank
    private String layerId;

    @NotBlank
    private String nsPrefix;

    @NotBlank
    private String nsUrl;

    @NotBlank
    private String srsName = "EPSG:4283";

    @NotNull
    private IndexBackend indexBackend = IndexBackend.DATABASE;

    private String indexEndpoint = "";

    @NotBlank
    private String predicate = "Contains";

    @Min(1)
    private int startPage = 1;

    @Min(2)
    private int stopPage = 2;

    @Min(1)
    private int pageSize = 10;

    @NotBlank
    private String outputFile = "joiner-output.csv";

    @Min(1)
    @Max(256)
    private int concurrency = 10;

    private long sequenceStart = 1;

    private String userAgent = "GeoJoiner/1.0";

    @Min(1)
    private int maxInMemoryMb = 16;

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);

    @AssertTrue(message = "stopPage must be greater than startPage")
    public boolean isPageRangeValid() {
        return stopPage > startPage;
    }

    @AssertTrue(message = "indexEndpoint is required for the ldapi backend")
    public boolean isIndexEndpointPresent() {
        return indexBackend != IndexBackend.LDAPI || (indexEndpoint != null && !indexEndpoint.isBlank());
    }

    public String getWfsEndpoint() {
        return wfsEndpoint;
    }

    public void setWfsEndpoint(String wfsEndpoint) {
        this.wfsEndpoint = wfsEndpoint;
    }

    public String getLayer() {
        return layer;
    }

    public void setLayer(String layer) {
        this.layer = layer;
    }

    public String getGeometryField() {
        return geometryField;
    }

    public void setGeometryField(String geometryField) {
        this.geometryField = geometryField;
    }

    public String getLayerId() {
        return layerId;
    }

    public void setLayerId(String layerId) {
        this.layerId = layerId;
    }

    public String getNsPrefix() {
        return nsPrefix;
    }

    public void setNsPrefix(String nsPrefix) {
        this.nsPrefix = nsPrefix;
    }

    public String getNsUrl() {
        return nsUrl;
    }

    public void setNsUrl(String nsUrl) {
        this.nsUrl = nsUrl;
    }

    public String getSrsName() {
        return srsName;
    }

    public void setSrsName(String srsName) {
        this.srsName = srsName;
    }

    public IndexBackend getIndexBackend() {
        return indexBackend;
    }

    public void setIndexBackend(IndexBackend indexBackend) {
        this.indexBackend = indexBackend;
    }

    public String getIndexEndpoint() {
        return indexEndpoint;
    }

    public void setIndexEndpoint(String indexEndpoint) {
        this.indexEndpoint = indexEndpoint;
    }

    public String getPredicate() {
        return predicate;
    }

    public void setPredicate(String predicate) {
        this.predicate = predicate;
    }

    public int getStartPage() {
        return startPage;
    }

    public void setStartPage(int startPage) {
        this.startPage = startPage;
    }

    public int getStopPage() {
        return stopPage;
    }

    public void setStopPage(int stopPage) {
        this.stopPage = stopPage;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public long getSequenceStart() {
        return sequenceStart;
    }

    public void setSequenceStart(long sequenceStart) {
        this.sequenceStart = sequenceStart;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public int getMaxInMemoryMb() {
        return maxInMemoryMb;
    }

    public void setMaxInMemoryMb(int maxInMemoryMb) {
        this.maxInMemoryMb = maxInMemoryMb;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}
