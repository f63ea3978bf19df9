package com.pgenum.migrations.operation;

import com.pgenum.migrations.service.EnumMutationExecutor;

/**
 * A declared enum change and its inverse.
 *
 * <p>Neither half caches anything from the other: each reads whatever catalog
 * state it needs when it runs, so a rollback sees the labels as they are at
 * rollback time.
 */
public interface EnumOperation {

    void apply(EnumMutationExecutor executor);

    void revert(EnumMutationExecutor executor);
}
