package com.brandpulse.anomaly.service;

import com.brandpulse.anomaly.model.CrisisAlert;
import com.brandpulse.anomaly.model.CrisisAlertRecord;
import com.brandpulse.anomaly.repo.CrisisAlertRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.EncoderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Hands crisis alerts to the outside world: a crisis_alerts row, then an Avro-encoded
 * Kafka message keyed by brand. The Kafka leg is best-effort.
 */
@Service
public class CrisisAlertPublisher implements CrisisAlertSink {

  private static final Logger log = LoggerFactory.getLogger(CrisisAlertPublisher.class);

  private final CrisisAlertRepository alertRepo;
  private final KafkaTemplate<String, byte[]> kafka;
  private final String alertsTopic;
  private final Schema alertSchema;
  private final Counter alertsPublished;
  private final Counter alertsDuplicate;

  public CrisisAlertPublisher(CrisisAlertRepository alertRepo,
                              KafkaTemplate<String, byte[]> kafka,
                              @Value("${brandpulse.crisis.alerts-topic:crisis_alerts}") String alertsTopic,
                              MeterRegistry metrics) {
    this.alertRepo = alertRepo;
    this.kafka = kafka;
    this.alertsTopic = alertsTopic;
    this.alertSchema = loadSchema("/avro/crisis_alert.avsc");
    this.alertsPublished = metrics.counter("brandpulse_crisis_alerts_published_total");
    this.alertsDuplicate = metrics.counter("brandpulse_crisis_alerts_skipped_total", "reason", "duplicate");
  }

  private Schema loadSchema(String path) {
    try (InputStream in = Objects.requireNonNull(getClass().getResourceAsStream(path))) {
      return new Schema.Parser().parse(in);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to load Avro schema: " + path, e);
    }
  }

  @Override
  public boolean publish(CrisisAlert alert) {
    try {
      alertRepo.save(CrisisAlertRecord.from(alert));
    } catch (DataIntegrityViolationException dup) {
      alertsDuplicate.increment();
      log.debug("Crisis alert already stored: brand='{}' at={}", alert.brand(), alert.triggeredAt());
      return false;
    }

    try {
      kafka.send(alertsTopic, alert.brand(), encode(alert));
      alertsPublished.increment();
    } catch (Exception ex) {
      log.debug("Kafka crisis alert publish failed (non-fatal): {}", ex.getMessage());
    }
    return true;
  }

  GenericRecord toRecord(CrisisAlert alert) {
    GenericData.Record record = new GenericData.Record(alertSchema);
    record.put("brand", alert.brand());
    record.put("alert_type", alert.alertType());
    record.put("severity", alert.severity() == null ? null : alert.severity().wireValue());
    record.put("message", alert.message());
    record.put("negative_pct", alert.negativePct());
    record.put("z_score", alert.zScore());
    record.put("window_posts", alert.windowPosts());
    record.put("triggered_at", alert.triggeredAt().toEpochMilli());
    return record;
  }

  byte[] encode(CrisisAlert alert) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
    try {
      new GenericDatumWriter<GenericRecord>(alertSchema).write(toRecord(alert), encoder);
      encoder.flush();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode crisis alert for " + alert.brand(), e);
    }
    return out.toByteArray();
  }
}
