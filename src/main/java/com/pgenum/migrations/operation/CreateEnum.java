package com.pgenum.migrations.operation;

import com.pgenum.migrations.service.EnumMutationExecutor;

import java.util.List;
import java.util.Objects;

public record CreateEnum(String name, List<String> values) implements EnumOperation {

    public CreateEnum {
        Objects.requireNonNull(name, "name");
        values = List.copyOf(values);
    }

    @Override
    public void apply(EnumMutationExecutor executor) {
        executor.create(name, values);
    }

    @Override
    public void revert(EnumMutationExecutor executor) {
        executor.drop(name);
    }
}
