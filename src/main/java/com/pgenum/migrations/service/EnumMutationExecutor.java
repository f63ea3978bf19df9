package com.pgenum.migrations.service;

import com.pgenum.migrations.config.EnumMigrationProperties;
import com.pgenum.migrations.exception.EnumNotFoundException;
import com.pgenum.migrations.model.ColumnBinding;
import com.pgenum.migrations.repository.EnumCatalogRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Primitive enum actions against the catalog.
 *
 * <p>PostgreSQL can append labels to an enum but cannot remove them, so every
 * label change goes through type substitution: the columns are parked on a
 * placeholder copy of the type, the type is recreated with the new labels, and
 * the columns are moved back. None of the steps recover from failure; the
 * caller's transaction is expected to undo a partial sequence.
 */
@Service
@RequiredArgsConstructor
public class EnumMutationExecutor {

    private static final Logger log = LoggerFactory.getLogger(EnumMutationExecutor.class);

    private final EnumCatalogRepository catalog;
    private final EnumMigrationProperties properties;

    public void create(String name, List<String> labels) {
        log.debug("Create enum `{}` with values {}", name, labels);
        catalog.createType(name, labels);
    }

    public void drop(String name) {
        log.debug("Drop enum `{}`", name);
        catalog.dropType(name);
    }

    public List<String> listLabels(String name) {
        return catalog.findLabels(name);
    }

    public List<ColumnBinding> listBindings(String name) {
        return catalog.findBindings(name);
    }

    /**
     * Replaces the labels of {@code name} with {@code current + add - remove},
     * reading the current labels from the catalog.
     */
    public void changeValues(String name, List<String> add, List<String> remove) {
        log.debug("Change enum `{}` values: add {}, remove {}", name, add, remove);
        List<String> current = snapshot(name);
        substitute(name, current, targetLabels(current, add, remove));
    }

    /**
     * Retained labels keep their relative order and new labels follow in the order
     * given. Labels already present are not added twice.
     */
    static List<String> targetLabels(List<String> current, List<String> add, List<String> remove) {
        Set<String> target = new LinkedHashSet<>(current);
        target.addAll(add);
        remove.forEach(target::remove);
        return new ArrayList<>(target);
    }

    public void rename(String from, String to) {
        log.debug("Rename enum from `{}` to `{}`", from, to);
        List<String> labels = snapshot(from);

        catalog.createType(to, labels);
        repoint(from, to);
        catalog.dropType(from);
    }

    private void substitute(String name, List<String> current, List<String> target) {
        String temporaryName = properties.temporaryName(name);

        catalog.createType(temporaryName, current);
        List<ColumnBinding> bindings = repoint(name, temporaryName);
        catalog.dropType(name);

        catalog.createType(name, target);
        for (ColumnBinding binding : bindings) {
            catalog.alterColumnType(binding, name);
        }
        catalog.dropType(temporaryName);
    }

    private List<ColumnBinding> repoint(String from, String to) {
        log.debug("Change enum type from `{}` to `{}`", from, to);
        List<ColumnBinding> bindings = catalog.findBindings(from);
        for (ColumnBinding binding : bindings) {
            catalog.alterColumnType(binding, to);
        }
        return bindings;
    }

    private List<String> snapshot(String name) {
        List<String> labels = catalog.findLabels(name);
        if (labels.isEmpty() && !catalog.exists(name)) {
            throw new EnumNotFoundException(name);
        }
        return labels;
    }
}
