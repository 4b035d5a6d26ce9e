package com.geojoin.joiner.repository;

import com.geojoin.joiner.domain.AddressDetailEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface AddressDetailRepository extends JpaRepository<AddressDetailEntity, String> {

    @Query("""
        select a.addressDetailPid from AddressDetailEntity a
        order by a.addressDetailPid
        """)
    List<String> findPids(Pageable pageable);
}
