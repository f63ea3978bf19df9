package com.pgenum.migrations.operation;

import com.pgenum.migrations.service.EnumMutationExecutor;

import java.util.Objects;

public record RenameEnum(String from, String to) implements EnumOperation {

    public RenameEnum {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    @Override
    public void apply(EnumMutationExecutor executor) {
        executor.rename(from, to);
    }

    @Override
    public void revert(EnumMutationExecutor executor) {
        executor.rename(to, from);
    }
}
