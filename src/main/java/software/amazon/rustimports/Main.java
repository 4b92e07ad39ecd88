/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports;

import software.amazon.smithy.cli.CliError;

/**
 * Main launcher for the import organizer language server, started by the editor.
 */
public final class Main {
    private Main() {
    }

    /**
     * Main entry point for the language server.
     * @param args Arguments passed to the server.
     * @throws Exception If there is an error starting the server.
     */
    public static void main(String[] args) throws Exception {
        ServerArguments serverArguments;
        try {
            serverArguments = ServerArguments.create(args);
        } catch (CliError e) {
            System.err.println(e.getMessage());
            System.exit(e.code);
            return;
        }

        if (serverArguments.help()) {
            System.out.println(serverArguments.helpText());
            System.exit(0);
        }

        ServerLauncher launcher = new ServerLauncher(serverArguments.port());
        launcher.initConnection();
        launcher.launch();
    }
}
