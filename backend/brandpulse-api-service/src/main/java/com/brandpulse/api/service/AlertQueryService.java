package com.brandpulse.api.service;

import com.brandpulse.anomaly.model.CrisisAlert;
import com.brandpulse.anomaly.model.CrisisAlertRecord;
import com.brandpulse.anomaly.model.Severity;
import com.brandpulse.anomaly.repo.CrisisAlertRepository;
import com.brandpulse.api.model.AlertsResponse;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
public class AlertQueryService {

  static final int MAX_LIMIT = 200;

  private final CrisisAlertRepository repo;
  private final Clock clock;

  public AlertQueryService(CrisisAlertRepository repo, Clock clock) {
    this.repo = repo;
    this.clock = clock;
  }

  /** Newest first; {@code limit} is clamped to [1, 200]. */
  public AlertsResponse latest(int page, int limit, String brand, Severity severity, Instant since) {
    int size = Math.max(1, Math.min(limit, MAX_LIMIT));
    int pageNo = Math.max(0, page);
    var pageable = PageRequest.of(pageNo, size);

    List<CrisisAlertRecord> rows;
    if ((brand == null || brand.isBlank()) && severity == null && since == null) {
      rows = repo.findAllByOrderByTriggeredAtDesc(pageable);
    } else {
      rows = repo.findAll(buildSpec(brand, severity, since), pageable).getContent();
    }
    List<CrisisAlert> alerts = rows.stream().map(CrisisAlertRecord::toAlert).toList();

    Instant now = clock.instant();
    Instant startOfDayUtc = LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay().toInstant(ZoneOffset.UTC);
    long today = repo.countByTriggeredAtBetween(startOfDayUtc, now);
    return new AlertsResponse(alerts, new AlertsResponse.Meta(today, pageNo, size));
  }

  private Specification<CrisisAlertRecord> buildSpec(String brand, Severity severity, Instant since) {
    return (root, query, cb) -> {
      List<Predicate> predicates = new ArrayList<>();
      if (brand != null && !brand.isBlank()) {
        predicates.add(cb.equal(cb.lower(root.get("brand")), brand.trim().toLowerCase(Locale.ROOT)));
      }
      if (severity != null) {
        predicates.add(cb.equal(root.get("severity"), severity.wireValue()));
      }
      if (since != null) {
        predicates.add(cb.greaterThanOrEqualTo(root.get("triggeredAt"), since));
      }
      query.orderBy(cb.desc(root.get("triggeredAt")));
      return cb.and(predicates.toArray(new Predicate[0]));
    };
  }
}
