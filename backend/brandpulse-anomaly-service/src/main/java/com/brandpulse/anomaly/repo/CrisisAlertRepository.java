package com.brandpulse.anomaly.repo;

import com.brandpulse.anomaly.model.CrisisAlertRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.time.Instant;
import java.util.List;

public interface CrisisAlertRepository extends JpaRepository<CrisisAlertRecord, Long>, JpaSpecificationExecutor<CrisisAlertRecord> {
  List<CrisisAlertRecord> findAllByOrderByTriggeredAtDesc(Pageable pageable);

  long countByTriggeredAtBetween(Instant start, Instant end);
}
