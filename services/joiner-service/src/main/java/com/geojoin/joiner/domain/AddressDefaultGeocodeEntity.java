package com.geojoin.joiner.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;

@Entity
@Table(name = "address_default_geocode", schema = "gnaf")
public class AddressDefaultGeocodeEntity {

    @Id
    @Column(name = "address_default_geocode_pid", nullable = false, updatable = false)
    private Long addressDefaultGeocodePid;

    @Column(name = "address_detail_pid", nullable = false)
    private String addressDetailPid;

    @Column(name = "longitude", precision = 11, scale = 8)
    private BigDecimal longitude;

    @Column(name = "latitude", precision = 10, scale = 8)
    private BigDecimal latitude;

    protected AddressDefaultGeocodeEntity() {
    }

    public static AddressDefaultGeocodeEntity of(
        Long addressDefaultGeocodePid,
        String addressDetailPid,
        BigDecimal longitude,
        BigDecimal latitude
    ) {
        AddressDefaultGeocodeEntity entity = new AddressDefaultGeocodeEntity();
        entity.addressDefaultGeocodePid = addressDefaultGeocodePid;
        entity.addressDetailPid = addressDetailPid;
        entity.longitude = longitude;
        entity.latitude = latitude;
        return entity;
    }

    public Coordinates toCoordinates() {
        return new Coordinates(longitude, latitude);
    }

    public Long getAddressDefaultGeocodePid() {
        return addressDefaultGeocodePid;
    }

    public String getAddressDetailPid() {
        return addressDetailPid;
    }

    public BigDecimal getLongitude() {
        return longitude;
    }

    public BigDecimal getLatitude() {
        return latitude;
    }
}
