package com.pgenum.migrations.operation;

import com.pgenum.migrations.exception.IrreversibleOperationException;
import com.pgenum.migrations.service.EnumMutationExecutor;

import java.util.List;
import java.util.Objects;

/**
 * Drops an enum. Only reversible when {@code values} were declared; a
 * {@code null} list makes {@link #revert} fail.
 */
public record DropEnum(String name, List<String> values) implements EnumOperation {

    public DropEnum {
        Objects.requireNonNull(name, "name");
        values = values == null ? null : List.copyOf(values);
    }

    public DropEnum(String name) {
        this(name, null);
    }

    public boolean isReversible() {
        return values != null;
    }

    @Override
    public void apply(EnumMutationExecutor executor) {
        executor.drop(name);
    }

    @Override
    public void revert(EnumMutationExecutor executor) {
        if (!isReversible()) {
            throw new IrreversibleOperationException(name, "dropEnum");
        }
        executor.create(name, values);
    }
}
