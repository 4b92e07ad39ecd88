/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import software.amazon.rustimports.cargo.CargoManifest;
import software.amazon.rustimports.document.Document;
import software.amazon.rustimports.imports.DependencySet;
import software.amazon.rustimports.protocol.LspAdapter;

/**
 * Keeps track of the state of the server: the documents the client has open,
 * and the dependencies read from the manifests of their packages.
 */
public final class ServerState {
    private static final Logger LOGGER = Logger.getLogger(ServerState.class.getName());

    private final Map<String, Document> openDocuments = new ConcurrentHashMap<>();
    private final Map<Path, DependencySet> manifests = new ConcurrentHashMap<>();

    /**
     * @param uri The URI of the document
     * @param text The text of the document
     * @return The opened document
     */
    public Document open(String uri, String text) {
        Document document = Document.of(text);
        openDocuments.put(uri, document);
        return document;
    }

    /**
     * @param uri The URI of the document to stop tracking
     */
    public void close(String uri) {
        openDocuments.remove(uri);
    }

    /**
     * @param uri The URI of the document
     * @return The open document, or {@code null} if it isn't open
     */
    public Document getDocument(String uri) {
        return openDocuments.get(uri);
    }

    /**
     * @return The URIs of all open documents
     */
    public Set<String> openUris() {
        return openDocuments.keySet();
    }

    /**
     * @param uri The URI of a source file
     * @return The dependencies of the package the file is in, or
     *  {@link DependencySet#EMPTY} if the file isn't on disk or isn't in a package
     */
    public DependencySet dependenciesFor(String uri) {
        Path path = LspAdapter.toPath(uri);
        if (path == null) {
            return DependencySet.EMPTY;
        }
        Path manifest = CargoManifest.findCargoToml(path);
        if (manifest == null) {
            return DependencySet.EMPTY;
        }
        return manifests.computeIfAbsent(manifest, CargoManifest::read);
    }

    /**
     * Forgets the dependencies read from a manifest, so they're read again
     * the next time they're needed.
     *
     * @param manifest The path of the manifest that changed
     */
    public void invalidateManifest(Path manifest) {
        if (manifests.remove(manifest.toAbsolutePath()) != null) {
            LOGGER.fine(() -> "Dropped cached dependencies of " + manifest);
        }
    }
}
