package com.example.datadestruction.service;

import com.example.datadestruction.models.TargetTable;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Result of one destruction request: which of the requested identifiers had rows in the target
 * (and were deleted) and which had none. The two sets never overlap and together equal the
 * de-duplicated request.
 */
public record DeletionOutcome(
        TargetTable target,
        SortedSet<String> deletedIds,
        SortedSet<String> notFound
) {

    public DeletionOutcome {
        Objects.requireNonNull(target, "target");
        deletedIds = Collections.unmodifiableSortedSet(new TreeSet<>(Objects.requireNonNull(deletedIds, "deletedIds")));
        notFound = Collections.unmodifiableSortedSet(new TreeSet<>(Objects.requireNonNull(notFound, "notFound")));
        for (String id : deletedIds) {
            if (notFound.contains(id)) {
                throw new IllegalArgumentException("Connect_ID " + id + " is both deleted and not found");
            }
        }
    }

    public static DeletionOutcome empty(TargetTable target) {
        return new DeletionOutcome(target, new TreeSet<>(), new TreeSet<>());
    }

    /**
     * Splits {@code requested} into ids present in {@code existing} and the rest. Ids in
     * {@code existing} that were never requested are ignored.
     */
    public static DeletionOutcome partition(TargetTable target, Set<String> requested, Set<String> existing) {
        SortedSet<String> deleted = new TreeSet<>();
        SortedSet<String> missing = new TreeSet<>();
        for (String id : requested) {
            if (existing.contains(id)) {
                deleted.add(id);
            } else {
                missing.add(id);
            }
        }
        return new DeletionOutcome(target, deleted, missing);
    }

    public boolean hasDeletions() {
        return !deletedIds.isEmpty();
    }
}
