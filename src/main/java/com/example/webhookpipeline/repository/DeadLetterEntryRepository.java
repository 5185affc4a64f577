package com.example.webhookpipeline.repository;

import com.example.webhookpipeline.model.DeadLetterEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DeadLetterEntryRepository extends JpaRepository<DeadLetterEntry, Long> {
}
