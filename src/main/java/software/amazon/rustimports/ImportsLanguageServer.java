/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports;

import static java.util.concurrent.CompletableFuture.completedFuture;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;
import org.eclipse.lsp4j.ClientCapabilities;
import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.CodeActionOptions;
import org.eclipse.lsp4j.CodeActionParams;
import org.eclipse.lsp4j.Command;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.ExecuteCommandOptions;
import org.eclipse.lsp4j.ExecuteCommandParams;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.SetTraceParams;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkDoneProgressCancelParams;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import software.amazon.rustimports.cargo.CargoManifest;
import software.amazon.rustimports.codeactions.OrganizeImportsAction;
import software.amazon.rustimports.codeactions.RustCodeActions;
import software.amazon.rustimports.document.Document;
import software.amazon.rustimports.format.ExternalFormatter;
import software.amazon.rustimports.format.RustfmtFormatter;
import software.amazon.rustimports.imports.ImportOrganizer;
import software.amazon.rustimports.imports.ImportSuggestion;
import software.amazon.rustimports.imports.LoggingMergeListener;
import software.amazon.rustimports.protocol.LspAdapter;
import software.amazon.rustimports.syntax.UseParseException;

public class ImportsLanguageServer implements
        LanguageServer, LanguageClientAware, WorkspaceService, TextDocumentService {
    private static final Logger LOGGER = Logger.getLogger(ImportsLanguageServer.class.getName());
    private static final Gson GSON = new Gson();
    private static final ServerCapabilities CAPABILITIES;

    static {
        ServerCapabilities capabilities = new ServerCapabilities();
        capabilities.setCodeActionProvider(new CodeActionOptions(RustCodeActions.kinds()));
        capabilities.setExecuteCommandProvider(new ExecuteCommandOptions(RustCodeActions.commands()));
        capabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
        CAPABILITIES = capabilities;
    }

    private ImportsLanguageClient client;
    private final ServerState state = new ServerState();
    private final ImportOrganizer organizer = new ImportOrganizer(new LoggingMergeListener());
    private ClientCapabilities clientCapabilities;
    private ServerOptions serverOptions = ServerOptions.builder().build();

    ImportsLanguageServer() {
    }

    ServerState getState() {
        return state;
    }

    ServerOptions getServerOptions() {
        return serverOptions;
    }

    @Override
    public void connect(LanguageClient client) {
        LOGGER.finest("Connect");
        this.client = new ImportsLanguageClient(client);
        String message = "rust-import-organizer";
        try {
            Properties props = new Properties();
            props.load(Objects.requireNonNull(getClass().getClassLoader().getResourceAsStream("version.properties")));
            message += " version " + props.getProperty("version");
        } catch (IOException e) {
            this.client.error("Failed to load rust-import-organizer version: " + e);
        }
        this.client.info(message + " started.");
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        LOGGER.finest("Initialize");

        Optional.ofNullable(params.getProcessId())
                .flatMap(ProcessHandle::of)
                .ifPresent(processHandle -> processHandle.onExit().thenRun(this::exit));

        this.serverOptions = ServerOptions.fromInitializeParams(params, client);
        this.clientCapabilities = params.getCapabilities();

        LOGGER.finest("Done initialize");
        return completedFuture(new InitializeResult(CAPABILITIES));
    }

    @Override
    public void initialized(InitializedParams params) {
        if (isDynamicWatchRegistrationSupported()) {
            client.register(ManifestWatcherRegistrations.getManifestWatcherRegistrations());
        }
    }

    private boolean isDynamicWatchRegistrationSupported() {
        return clientCapabilities != null
               && clientCapabilities.getWorkspace() != null
               && clientCapabilities.getWorkspace().getDidChangeWatchedFiles() != null
               && Boolean.TRUE.equals(clientCapabilities.getWorkspace().getDidChangeWatchedFiles()
                        .getDynamicRegistration());
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return this;
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return this;
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        return completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    @Override
    public void cancelProgress(WorkDoneProgressCancelParams params) {
        // Avoids the runtime error of lsp4j's default implementation. No
        // request reports progress, so there's nothing to cancel.
        LOGGER.warning("window/workDoneProgress/cancel not implemented");
    }

    @Override
    public void setTrace(SetTraceParams params) {
        LOGGER.warning("$/setTrace not implemented");
    }

    @Override
    public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
        LOGGER.finest("DidChangeWatchedFiles");
        for (FileEvent event : params.getChanges()) {
            Path path = LspAdapter.toPath(event.getUri());
            if (path != null && path.endsWith(CargoManifest.FILE_NAME)) {
                state.invalidateManifest(path);
            }
        }
    }

    @Override
    public void didChangeConfiguration(DidChangeConfigurationParams params) {
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        LOGGER.finest("DidChange");

        if (params.getContentChanges().isEmpty()) {
            LOGGER.info("Received empty DidChange");
            return;
        }

        String uri = params.getTextDocument().getUri();
        Document document = state.getDocument(uri);
        if (document == null) {
            client.unknownDocumentError(uri, "change");
            return;
        }

        for (TextDocumentContentChangeEvent contentChangeEvent : params.getContentChanges()) {
            if (contentChangeEvent.getRange() != null) {
                document.applyEdit(contentChangeEvent.getRange(), contentChangeEvent.getText());
            } else {
                document.applyEdit(document.fullRange(), contentChangeEvent.getText());
            }
        }
    }

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        LOGGER.finest("DidOpen");
        state.open(params.getTextDocument().getUri(), params.getTextDocument().getText());
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        LOGGER.finest("DidClose");
        state.close(params.getTextDocument().getUri());
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
    }

    @Override
    public CompletableFuture<List<Either<Command, CodeAction>>> codeAction(CodeActionParams params) {
        LOGGER.finest("CodeAction");

        String uri = params.getTextDocument().getUri();
        Document document = state.getDocument(uri);
        if (document == null) {
            client.unknownDocumentError(uri, "code action");
            return completedFuture(List.of());
        }

        List<String> only = params.getContext() == null ? null : params.getContext().getOnly();
        if (!RustCodeActions.isRequested(only)) {
            return completedFuture(List.of());
        }

        List<TextEdit> edits = computeEdits(uri, document, params.getContext() == null
                ? List.of()
                : params.getContext().getDiagnostics(), List.of());
        if (edits.isEmpty()) {
            return completedFuture(List.of());
        }
        CodeAction codeAction = OrganizeImportsAction.build(uri, edits);
        return completedFuture(List.of(Either.forRight(codeAction)));
    }

    @Override
    public CompletableFuture<Object> executeCommand(ExecuteCommandParams params) {
        LOGGER.finest("ExecuteCommand");

        if (!RustCodeActions.ORGANIZE_IMPORTS_COMMAND.equals(params.getCommand())) {
            client.error("Unknown command: " + params.getCommand());
            return completedFuture(null);
        }

        List<Object> arguments = params.getArguments();
        if (arguments == null || arguments.isEmpty()) {
            client.error(RustCodeActions.ORGANIZE_IMPORTS_COMMAND + " needs the URI of a document");
            return completedFuture(null);
        }

        String uri = stringArgument(arguments.get(0));
        Document document = uri == null ? null : state.getDocument(uri);
        if (document == null) {
            client.unknownDocumentError(String.valueOf(uri), "command");
            return completedFuture(null);
        }

        List<ImportSuggestion> suggestions;
        try {
            suggestions = arguments.size() > 1 ? suggestionsArgument(arguments.get(1)) : List.of();
        } catch (JsonParseException | IllegalStateException e) {
            client.error("Invalid import suggestions: " + e.getMessage());
            return completedFuture(null);
        }

        List<TextEdit> edits;
        try {
            edits = computeEdits(uri, document, List.of(), suggestions);
        } catch (IllegalArgumentException | UseParseException e) {
            client.error("Couldn't organize imports: " + e.getMessage());
            return completedFuture(null);
        }

        if (edits.isEmpty()) {
            return completedFuture(null);
        }
        WorkspaceEdit edit = new WorkspaceEdit(Map.of(uri, edits));
        return client.applyEdit(OrganizeImportsAction.TITLE, edit).thenApply(applied -> null);
    }

    private List<TextEdit> computeEdits(
            String uri,
            Document document,
            List<Diagnostic> diagnostics,
            List<ImportSuggestion> suggestions
    ) {
        ExternalFormatter formatter = serverOptions.getUseRustfmt()
                ? new RustfmtFormatter(serverOptions.getRustfmtPath())
                : ExternalFormatter.IDENTITY;
        OrganizeImportsAction action = new OrganizeImportsAction(
                organizer, formatter, serverOptions.getGroupImports(), serverOptions.getRemoveUnused());
        return action.computeEdits(
                document,
                state.dependenciesFor(uri),
                RustCodeActions.unusedImportSpans(diagnostics),
                suggestions);
    }

    private static String stringArgument(Object argument) {
        if (argument instanceof String string) {
            return string;
        }
        if (argument instanceof JsonElement element && element.isJsonPrimitive()) {
            return element.getAsString();
        }
        return null;
    }

    private static List<ImportSuggestion> suggestionsArgument(Object argument) {
        JsonElement element = argument instanceof JsonElement json ? json : GSON.toJsonTree(argument);
        if (element == null || element.isJsonNull()) {
            return List.of();
        }
        ImportSuggestion[] suggestions = GSON.fromJson(element, ImportSuggestion[].class);
        List<ImportSuggestion> result = new ArrayList<>();
        for (ImportSuggestion suggestion : suggestions) {
            if (suggestion == null || suggestion.path() == null) {
                throw new JsonParseException("suggestion is missing a path");
            }
            result.add(suggestion);
        }
        return result;
    }
}
