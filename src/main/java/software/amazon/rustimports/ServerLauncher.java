/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.services.LanguageClient;

/**
 * Wires an {@link ImportsLanguageServer} to its client, either over the
 * process's standard streams or over a socket on localhost, and runs it
 * until the client goes away.
 */
class ServerLauncher {
    private static final Logger LOGGER = Logger.getLogger(ServerLauncher.class.getName());
    private static final String LOCALHOST = "localhost";

    private final int port;
    private Channel channel;

    ServerLauncher(int port) {
        this.port = port;
    }

    // Overridden in tests.
    Socket createSocket() throws IOException {
        return new Socket(LOCALHOST, port);
    }

    void initConnection() throws IOException {
        if (port == ServerArguments.DEFAULT_PORT) {
            LOGGER.fine("Talking to the client over standard in/out");
            channel = new Channel(System.in, System.out, null);
            return;
        }

        LOGGER.fine(() -> "Connecting to the client at " + LOCALHOST + ":" + port);
        Socket socket = createSocket();
        channel = new Channel(socket.getInputStream(), socket.getOutputStream(), socket);
    }

    InputStream getInputStream() {
        return channel.input();
    }

    OutputStream getOutputStream() {
        return channel.output();
    }

    void closeConnection() {
        if (channel == null || channel.socket() == null) {
            return;
        }
        try {
            channel.socket().close();
        } catch (IOException e) {
            LOGGER.warning("Could not close the client socket: " + e.getMessage());
        }
    }

    /**
     * Blocks until the client closes the connection.
     */
    void launch() throws InterruptedException, ExecutionException {
        ImportsLanguageServer server = new ImportsLanguageServer();
        Launcher<LanguageClient> launcher = LSPLauncher.createServerLauncher(
                server, getInputStream(), getOutputStream());
        server.connect(launcher.getRemoteProxy());
        try {
            LOGGER.info("Rust import organizer is listening");
            launcher.startListening().get();
        } finally {
            closeConnection();
        }
    }

    private record Channel(InputStream input, OutputStream output, Socket socket) {
    }
}
