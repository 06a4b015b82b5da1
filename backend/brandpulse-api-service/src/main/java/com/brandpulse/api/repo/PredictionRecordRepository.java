package com.brandpulse.api.repo;

import com.brandpulse.api.entity.PredictionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PredictionRecordRepository extends JpaRepository<PredictionRecord, Long> {

  @Query("SELECT p.brand AS brand, p.sentiment AS sentiment, COUNT(p) AS total FROM PredictionRecord p " +
      "WHERE LOWER(p.brand) = LOWER(:brand) " +
      "GROUP BY p.brand, p.sentiment")
  List<SentimentCount> countSentimentsForBrand(@Param("brand") String brand);

  @Query("SELECT p.brand AS brand, p.sentiment AS sentiment, COUNT(p) AS total FROM PredictionRecord p " +
      "WHERE p.brand IS NOT NULL " +
      "GROUP BY p.brand, p.sentiment")
  List<SentimentCount> countSentimentsByBrand();

  long countByBrandIgnoreCaseAndCrisisFlagTrue(String brand);
}
