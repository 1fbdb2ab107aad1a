package com.example.datadestruction.service;

import com.example.datadestruction.access.WarehouseAccess;
import com.example.datadestruction.config.DestructionProperties;
import com.example.datadestruction.models.ProtocolConfig;
import com.example.datadestruction.models.TargetTable;
import com.example.datadestruction.requests.DestructionServiceRequest;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Executes on-demand destruction requests: resolves the protocol to its target, finds which of
 * the requested Connect_IDs have rows there, deletes those rows and reports the found/not-found
 * split. Holds no state between calls.
 */
@Service
@Slf4j
public class DataDestructionService {

    private final TargetRegistry targetRegistry;
    private final WarehouseAccess warehouseAccess;
    private final DestructionProperties properties;

    public DataDestructionService(TargetRegistry targetRegistry,
                                  WarehouseAccess warehouseAccess,
                                  DestructionProperties properties) {
        this.targetRegistry = targetRegistry;
        this.warehouseAccess = warehouseAccess;
        this.properties = properties;
    }

    /**
     * Deletes every row of the protocol's target table whose key is one of the requested ids.
     *
     * <p>The existence check and the delete are two separate store operations with no
     * transaction around them. A concurrent request for an overlapping id may observe it as
     * existing too; both then report it as deleted and the second delete is a no-op.
     *
     * @throws DataDestructionException with {@code PROTOCOL_NOT_SUPPORTED} for an unknown
     *         protocol, or {@code EXECUTION_FAILED} when either store operation fails
     */
    public DeletionOutcome destroy(DestructionServiceRequest request) {
        Objects.requireNonNull(request, "request");

        ProtocolConfig config = targetRegistry.resolve(request.protocol());
        TargetTable target = config.in(properties.getProject());
        Set<String> requested = new LinkedHashSet<>(request.connectIds());

        // An empty list is a liveness probe: never touch the store.
        if (requested.isEmpty()) {
            log.info("[{}] Empty destruction request for protocol {}; nothing to do",
                    request.requestId(), config.name());
            return DeletionOutcome.empty(target);
        }

        Set<String> existing;
        try {
            existing = warehouseAccess.selectExistingKeys(target, requested);
            if (!existing.isEmpty()) {
                // Filtered by the requested set, not re-scoped to existing: rows inserted since
                // the read are destroyed as well.
                warehouseAccess.deleteByKeys(target, requested);
            }
        } catch (RuntimeException ex) {
            log.error("[{}] Destruction against {} failed: {}",
                    request.requestId(), target.physicalName(), ex.getMessage(), ex);
            throw DataDestructionException.executionFailed(ex);
        }

        DeletionOutcome outcome = DeletionOutcome.partition(target, requested, existing);
        log.info("[{}] Destruction via protocol {} on {}: requested={}, deleted={}, not_found={}",
                request.requestId(), config.name(), target.physicalName(),
                requested.size(), outcome.deletedIds().size(), outcome.notFound().size());
        return outcome;
    }
}
