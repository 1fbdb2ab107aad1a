package com.example.datadestruction.service;

import com.example.datadestruction.access.ParticipantAccess;
import com.example.datadestruction.access.WarehouseAccess;
import com.example.datadestruction.config.BatchDestructionProperties;
import com.example.datadestruction.config.DestructionProperties;
import com.example.datadestruction.models.Participant;
import com.example.datadestruction.models.TargetTable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Daily job that deletes derived rows for participants whose destruction has been both requested
 * and confirmed in the participant registry.
 *
 * A participant's rows are never touched until the upstream system of record has set the
 * "data has been destroyed" flag alongside the "destroy data" flag. The registry scan filters on
 * both flags and every entry is re-checked before its id is used.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "destruction.batch.enabled", havingValue = "true")
public class ScheduledDestructionJob {

    private final Clock clock;
    private final BatchDestructionProperties properties;
    private final DestructionProperties destructionProperties;
    private final ParticipantAccess participantAccess;
    private final WarehouseAccess warehouseAccess;

    @Scheduled(cron = "${destruction.batch.schedule:0 30 7 * * *}", zone = "${destruction.batch.zone:UTC}")
    public void destroyConfirmedParticipantData() {
        Instant startedAt = clock.instant();
        String jobRequestId = "destruction-job-" + UUID.randomUUID();

        log.info("[{}] Starting scheduled destruction job at {} ({} target tables)",
                jobRequestId, startedAt, properties.getTargets().size());

        Set<String> confirmedIds = participantAccess.findConfirmedDestructions().stream()
                .filter(Participant::isDestructionConfirmed)
                .map(Participant::getConnectId)
                .collect(Collectors.toCollection(TreeSet::new));

        if (confirmedIds.isEmpty()) {
            log.info("[{}] No participants with confirmed destruction; nothing to delete", jobRequestId);
            return;
        }

        log.info("[{}] Found {} participants with confirmed destruction", jobRequestId, confirmedIds.size());

        int totalDeleted = 0;
        int failedTargets = 0;

        for (BatchDestructionProperties.Target configured : properties.getTargets()) {
            TargetTable target = configured.in(destructionProperties.getProject());
            try {
                int deleted = warehouseAccess.deleteByKeys(target, confirmedIds);
                totalDeleted += deleted;
                log.info("[{}] Deleted {} rows from {}", jobRequestId, deleted, target.physicalName());
            } catch (Exception ex) {
                failedTargets++;
                log.error("[{}] Failed to delete from {}: {}",
                        jobRequestId, target.physicalName(), ex.getMessage(), ex);
            }
        }

        long duration = Duration.between(startedAt, clock.instant()).toMillis();
        log.info("[{}] Completed scheduled destruction job in {}ms: participants={}, deleted={}, failedTargets={}",
                jobRequestId, duration, confirmedIds.size(), totalDeleted, failedTargets);
    }
}
