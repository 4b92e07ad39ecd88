/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.cargo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import software.amazon.rustimports.imports.DependencySet;

/**
 * Reads the dependencies of a package from its {@code Cargo.toml}.
 */
public final class CargoManifest {
    public static final String FILE_NAME = "Cargo.toml";

    private static final Logger LOGGER = Logger.getLogger(CargoManifest.class.getName());
    private static final TomlMapper TOML_MAPPER = new TomlMapper();

    private CargoManifest() {
    }

    /**
     * @param sourceFile A file in the package
     * @return The path of the closest {@code Cargo.toml} in the directory of
     *  {@code sourceFile} or one of its parents, or {@code null} if there
     *  isn't one
     */
    public static Path findCargoToml(Path sourceFile) {
        Path dir = sourceFile.toAbsolutePath().getParent();
        while (dir != null) {
            Path candidate = dir.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
            dir = dir.getParent();
        }
        return null;
    }

    /**
     * @param sourceFile A file in the package
     * @return The dependencies declared in the package's manifest, or
     *  {@link DependencySet#EMPTY} if it can't be found or read
     */
    public static DependencySet forSourceFile(Path sourceFile) {
        Path manifest = findCargoToml(sourceFile);
        if (manifest == null) {
            LOGGER.fine(() -> "No " + FILE_NAME + " found for " + sourceFile);
            return DependencySet.EMPTY;
        }
        return read(manifest);
    }

    /**
     * Reads {@code [dependencies]}, {@code [dev-dependencies]} and
     * {@code [build-dependencies]}. A workspace's
     * {@code [workspace.dependencies]} count as regular dependencies. A
     * dependency renamed with {@code package = "..."} is recorded under its
     * package name.
     *
     * @param manifest The path of the manifest
     * @return The dependencies declared in the manifest, or
     *  {@link DependencySet#EMPTY} if it can't be read
     */
    public static DependencySet read(Path manifest) {
        if (!Files.isRegularFile(manifest)) {
            return DependencySet.EMPTY;
        }

        try {
            return parse(Files.readString(manifest));
        } catch (IOException e) {
            LOGGER.warning(() -> "Couldn't read " + manifest + ": " + e.getMessage());
            return DependencySet.EMPTY;
        }
    }

    /**
     * @param text The text of a manifest
     * @return The dependencies declared in {@code text}
     * @throws IOException If {@code text} isn't valid TOML
     */
    public static DependencySet parse(String text) throws IOException {
        JsonNode root = TOML_MAPPER.readTree(text);
        if (root == null) {
            return DependencySet.EMPTY;
        }

        Set<String> dependencies = names(root.get("dependencies"));
        dependencies.addAll(names(root.path("workspace").get("dependencies")));
        return new DependencySet(
                dependencies,
                names(root.get("dev-dependencies")),
                names(root.get("build-dependencies")));
    }

    private static Set<String> names(JsonNode table) {
        Set<String> names = new LinkedHashSet<>();
        if (table == null || !table.isObject()) {
            return names;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = table.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode renamedFrom = field.getValue().get("package");
            if (renamedFrom != null && renamedFrom.isTextual()) {
                names.add(renamedFrom.asText());
            } else {
                names.add(field.getKey());
            }
        }
        return names;
    }
}
