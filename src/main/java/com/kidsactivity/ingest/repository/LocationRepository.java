package com.kidsactivity.ingest.repository;

import com.kidsactivity.ingest.entity.Location;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LocationRepository extends JpaRepository<Location, Long> {

    // Step 1: exact venue match
    Optional<Location> findFirstByNameAndAddressOrderByIdAsc(String name, String address);

    // Step 2: synonym-collapsed match
    Optional<Location> findFirstByNormalizedNameOrderByIdAsc(String normalizedName);

    // Step 3 candidates; containment is checked by the caller
    List<Location> findAllByOrderByIdAsc();
}
