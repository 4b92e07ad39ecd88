/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The crate names a package depends on, by where they were declared. Names
 * are stored the way they're written in code, with hyphens replaced by
 * underscores.
 *
 * @param dependencies Names from {@code [dependencies]}
 * @param devDependencies Names from {@code [dev-dependencies]}
 * @param buildDependencies Names from {@code [build-dependencies]}
 */
public record DependencySet(Set<String> dependencies, Set<String> devDependencies, Set<String> buildDependencies) {
    public static final DependencySet EMPTY = new DependencySet(Set.of(), Set.of(), Set.of());

    public DependencySet {
        dependencies = normalizeAll(dependencies);
        devDependencies = normalizeAll(devDependencies);
        buildDependencies = normalizeAll(buildDependencies);
    }

    /**
     * @param dependencies Names of regular dependencies
     * @return A set with only regular dependencies
     */
    public static DependencySet of(String... dependencies) {
        return new DependencySet(Set.of(dependencies), Set.of(), Set.of());
    }

    /**
     * @param name A crate name, as written in code or in a manifest
     * @return Whether any of the three sets contain the name
     */
    public boolean contains(String name) {
        String normalized = normalize(name);
        return dependencies.contains(normalized)
                || devDependencies.contains(normalized)
                || buildDependencies.contains(normalized);
    }

    /**
     * @return Whether there are no dependencies at all
     */
    public boolean isEmpty() {
        return dependencies.isEmpty() && devDependencies.isEmpty() && buildDependencies.isEmpty();
    }

    /**
     * @param name A crate name
     * @return The name with hyphens replaced by underscores
     */
    public static String normalize(String name) {
        return name.replace('-', '_');
    }

    private static Set<String> normalizeAll(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String name : names) {
            normalized.add(normalize(name));
        }
        return Set.copyOf(normalized);
    }
}
