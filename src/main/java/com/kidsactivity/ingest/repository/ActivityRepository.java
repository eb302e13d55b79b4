package com.kidsactivity.ingest.repository;

import com.kidsactivity.ingest.entity.Activity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ActivityRepository extends JpaRepository<Activity, Long> {

    Optional<Activity> findByProviderIdAndExternalId(Long providerId, String externalId);

    List<Activity> findByProviderIdAndActiveTrue(Long providerId);

    long countByProviderIdAndActiveTrue(Long providerId);

    // === Monitoring ===
    @Query("""
        SELECT a.registrationStatus, COUNT(a) FROM Activity a
        WHERE a.providerId = :providerId
          AND a.active = true
        GROUP BY a.registrationStatus
        """)
    List<Object[]> countActiveByRegistrationStatus(@Param("providerId") Long providerId);
}
