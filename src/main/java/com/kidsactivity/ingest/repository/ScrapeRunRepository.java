package com.kidsactivity.ingest.repository;

import com.kidsactivity.ingest.entity.ScrapeRun;
import com.kidsactivity.ingest.enums.ScrapeRunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ScrapeRunRepository extends JpaRepository<ScrapeRun, Long> {

    Optional<ScrapeRun> findFirstByProviderIdAndStatusOrderByStartedAtDesc(Long providerId, ScrapeRunStatus status);
}
