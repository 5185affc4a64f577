package com.example.webhookpipeline.repository;

import com.example.webhookpipeline.model.AnomalyRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AnomalyRecordRepository extends JpaRepository<AnomalyRecord, Long> {

    List<AnomalyRecord> findTop100ByWorkspaceIdOrderByDetectedAtDesc(String workspaceId);

    long countByWorkspaceIdAndMetricName(String workspaceId, String metricName);
}
