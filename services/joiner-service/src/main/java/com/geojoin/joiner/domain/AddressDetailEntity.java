package com.geojoin.joiner.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "address_detail", schema = "gnaf")
public class AddressDetailEntity {

    @Id
    @Column(name = "address_detail_pid", nullable = false, updatable = false)
    private String addressDetailPid;

    protected AddressDetailEntity() {
    }

    public static AddressDetailEntity of(String addressDetailPid) {
        AddressDetailEntity entity = new AddressDetailEntity();
        entity.addressDetailPid = addressDetailPid;
        return entity;
    }

    public String getAddressDetailPid() {
        return addressDetailPid;
    }
}
