package com.geojoin.joiner.repository;

import com.geojoin.joiner.domain.AddressDefaultGeocodeEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AddressDefaultGeocodeRepository extends JpaRepository<AddressDefaultGeocodeEntity, Long> {

    Optional<AddressDefaultGeocodeEntity> findFirstByAddressDetailPid(String addressDetailPid);
}
