package com.pgenum.migrations.operation;

import com.pgenum.migrations.service.EnumMutationExecutor;

import java.util.List;
import java.util.Objects;

/**
 * Adds and removes labels in one substitution. The inverse swaps the two lists,
 * so labels removed going forward are appended at the end of the type on
 * rollback rather than restored to their former position.
 */
public record ChangeEnumValues(String name, List<String> add, List<String> remove) implements EnumOperation {

    public ChangeEnumValues {
        Objects.requireNonNull(name, "name");
        add = List.copyOf(add);
        remove = List.copyOf(remove);
    }

    public static ChangeEnumValues addValues(String name, List<String> values) {
        return new ChangeEnumValues(name, values, List.of());
    }

    public static ChangeEnumValues removeValues(String name, List<String> values) {
        return new ChangeEnumValues(name, List.of(), values);
    }

    public ChangeEnumValues inverse() {
        return new ChangeEnumValues(name, remove, add);
    }

    @Override
    public void apply(EnumMutationExecutor executor) {
        executor.changeValues(name, add, remove);
    }

    @Override
    public void revert(EnumMutationExecutor executor) {
        inverse().apply(executor);
    }
}
