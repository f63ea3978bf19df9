package com.pgenum.migrations.migration;

import com.pgenum.migrations.operation.EnumOperation;
import com.pgenum.migrations.service.EnumMutationExecutor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public enum Direction {

    /** Applies each operation as soon as it is declared. */
    UP {
        @Override
        void declared(EnumOperation operation, EnumMutationExecutor executor) {
            operation.apply(executor);
        }

        @Override
        void completed(List<EnumOperation> operations, EnumMutationExecutor executor) {
        }
    },

    /** Reverts the declared operations once all are known, last declared first. */
    DOWN {
        @Override
        void declared(EnumOperation operation, EnumMutationExecutor executor) {
        }

        @Override
        void completed(List<EnumOperation> operations, EnumMutationExecutor executor) {
            List<EnumOperation> reversed = new ArrayList<>(operations);
            Collections.reverse(reversed);
            for (EnumOperation operation : reversed) {
                operation.revert(executor);
            }
        }
    };

    abstract void declared(EnumOperation operation, EnumMutationExecutor executor);

    abstract void completed(List<EnumOperation> operations, EnumMutationExecutor executor);
}
