package com.example.datadestruction.access;

import com.example.datadestruction.models.TargetTable;
import java.util.Set;

/**
 * Identifier-keyed read and delete against a target table. The two operations are independent
 * statements: nothing makes a read and a following delete atomic.
 */
public interface WarehouseAccess {

    /**
     * Returns the subset of {@code keys} that currently have at least one row in the target,
     * matching on the target's key column.
     *
     * @param target the table to read
     * @param keys the identifiers to look up; must not be empty
     * @return identifiers with rows, never containing anything outside {@code keys}
     */
    Set<String> selectExistingKeys(TargetTable target, Set<String> keys);

    /**
     * Deletes every row of the target whose key column is one of {@code keys}. Keys without rows
     * are ignored, so repeating a call is harmless.
     *
     * @param target the table to delete from
     * @param keys the identifiers whose rows are removed
     * @return number of rows deleted
     */
    int deleteByKeys(TargetTable target, Set<String> keys);
}
