/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports;

import java.util.List;
import org.eclipse.lsp4j.DidChangeWatchedFilesRegistrationOptions;
import org.eclipse.lsp4j.FileSystemWatcher;
import org.eclipse.lsp4j.Registration;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import software.amazon.rustimports.cargo.CargoManifest;

/**
 * The registration that tells the client to notify the server when a
 * manifest changes, so cached dependencies can be dropped.
 */
final class ManifestWatcherRegistrations {
    static final String WATCH_MANIFESTS_ID = "WatchCargoManifests";
    static final String WATCH_FILES_METHOD = "workspace/didChangeWatchedFiles";
    static final String MANIFEST_PATTERN = "**/" + CargoManifest.FILE_NAME;

    private ManifestWatcherRegistrations() {
    }

    static List<Registration> getManifestWatcherRegistrations() {
        FileSystemWatcher watcher = new FileSystemWatcher(Either.forLeft(MANIFEST_PATTERN));
        return List.of(new Registration(
                WATCH_MANIFESTS_ID,
                WATCH_FILES_METHOD,
                new DidChangeWatchedFilesRegistrationOptions(List.of(watcher))));
    }
}
