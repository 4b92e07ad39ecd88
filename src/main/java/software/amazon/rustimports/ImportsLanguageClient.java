/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;
import org.eclipse.lsp4j.ApplyWorkspaceEditParams;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.Registration;
import org.eclipse.lsp4j.RegistrationParams;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * The slice of {@link LanguageClient} the server talks to: log messages,
 * capability registration, and workspace edits.
 */
public final class ImportsLanguageClient {
    private static final Logger LOGGER = Logger.getLogger(ImportsLanguageClient.class.getName());

    private final LanguageClient remote;

    ImportsLanguageClient(LanguageClient remote) {
        this.remote = remote;
    }

    /**
     * @param message Shown in the client's log as {@link MessageType#Info}
     */
    public void info(String message) {
        log(MessageType.Info, message);
    }

    /**
     * @param message Shown in the client's log as {@link MessageType#Error}
     */
    public void error(String message) {
        log(MessageType.Error, message);
    }

    /**
     * Reports a request naming a document the client never opened.
     *
     * @param uri URI the request named
     * @param request Short name of the request, e.g. "code action"
     */
    public void unknownDocumentError(String uri, String request) {
        error(request + " for " + uri + ", which isn't open");
    }

    /**
     * @param registrations Capabilities to register dynamically
     * @return A future completing once the client has acknowledged them
     */
    public CompletableFuture<Void> register(List<Registration> registrations) {
        return remote.registerCapability(new RegistrationParams(registrations));
    }

    /**
     * Asks the client to apply {@code edit}, reporting a refusal in its log.
     *
     * @param label Label the client may show for the edit, e.g. in its undo history
     * @param edit The edit to apply
     * @return A future completing with whether the client applied it
     */
    public CompletableFuture<Boolean> applyEdit(String label, WorkspaceEdit edit) {
        return remote.applyEdit(new ApplyWorkspaceEditParams(edit, label)).thenApply(response -> {
            if (!response.isApplied()) {
                error(label + " was rejected: " + response.getFailureReason());
            }
            return response.isApplied();
        });
    }

    private void log(MessageType type, String message) {
        LOGGER.fine(() -> type + ": " + message);
        remote.logMessage(new MessageParams(type, message));
    }
}
