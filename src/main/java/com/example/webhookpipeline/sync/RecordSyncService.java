package com.example.webhookpipeline.sync;

import com.example.webhookpipeline.model.SyncedObjectType;
import com.example.webhookpipeline.model.SyncedRecord;
import com.example.webhookpipeline.model.WebhookProvider;
import com.example.webhookpipeline.repository.SyncedRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class RecordSyncService implements SyncService {

    private final SyncedRecordRepository recordRepository;

    @Override
    @Transactional
    public SyncedRecord upsert(SyncCommand command) {
        if (command.getExternalId() == null || command.getExternalId().isBlank()) {
            throw new IllegalArgumentException("Cannot sync " + command.getObjectType() + " without an external id");
        }
        SyncedRecord record = recordRepository.findByWorkspaceIdAndProviderAndObjectTypeAndExternalId(
                command.getWorkspaceId(), command.getProvider(), command.getObjectType(), command.getExternalId())
                .orElseGet(() -> SyncedRecord.builder()
                        .workspaceId(command.getWorkspaceId())
                        .provider(command.getProvider())
                        .objectType(command.getObjectType())
                        .externalId(command.getExternalId())
                        .build());
        boolean created = record.getId() == null;

        if (command.getAmount() != null) {
            record.setAmount(command.getAmount());
        }
        if (command.getStatus() != null) {
            record.setStatus(command.getStatus());
        }
        if (command.getCustomerRef() != null) {
            record.setCustomerRef(command.getCustomerRef());
        }
        if (command.getOccurredAt() != null && (created || record.getOccurredAt() == null)) {
            record.setOccurredAt(command.getOccurredAt());
        }

        SyncedRecord saved = recordRepository.save(record);
        log.debug("Synced {} {} {} for workspace {} ({})", command.getProvider(), command.getObjectType(),
                command.getExternalId(), command.getWorkspaceId(), created ? "created" : "updated");
        return saved;
    }

    @Override
    @Transactional
    public boolean delete(String workspaceId, WebhookProvider provider, SyncedObjectType objectType,
            String externalId) {
        Optional<SyncedRecord> existing = recordRepository
                .findByWorkspaceIdAndProviderAndObjectTypeAndExternalId(workspaceId, provider, objectType, externalId);
        existing.ifPresent(recordRepository::delete);
        return existing.isPresent();
    }
}
