/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports;

import java.util.List;
import java.util.function.Consumer;
import software.amazon.smithy.cli.ArgumentReceiver;
import software.amazon.smithy.cli.Arguments;
import software.amazon.smithy.cli.CliError;
import software.amazon.smithy.cli.HelpPrinter;

/**
 * Parsed command line of the server: an optional port, and whether usage was requested.
 */
final class ServerArguments implements ArgumentReceiver {
    /**
     * Port value meaning "use standard in/out instead of a socket".
     */
    static final int DEFAULT_PORT = 0;

    private static final int HIGHEST_PORT = 65535;
    private static final String PORT_DESCRIPTION =
            "Port on localhost to connect to the client on. Omitted or 0 means standard in/out.";
    private static final String USAGE = "Usage: rust-import-organizer [--help | -h] [--port | -p PORT]\n"
            + "\n"
            + "    --help, -h\n"
            + "        Print this usage text and exit.\n"
            + "    --port, -p PORT\n"
            + "        " + PORT_DESCRIPTION;

    private boolean help;
    private int port = DEFAULT_PORT;

    private ServerArguments() {
    }

    /**
     * @param args Raw process arguments
     * @return The parsed arguments
     * @throws CliError If an argument is unknown, positional, or the port is malformed
     */
    static ServerArguments create(String[] args) {
        ServerArguments result = new ServerArguments();
        Arguments arguments = Arguments.of(args);
        arguments.addReceiver(result);

        List<String> leftover = arguments.getPositional();
        if (!leftover.isEmpty()) {
            throw new CliError("Unexpected arguments: " + String.join(" ", leftover));
        }
        return result;
    }

    @Override
    public void registerHelp(HelpPrinter printer) {
        printer.option("--help", "-h", "Print this usage text and exit.");
        printer.param("--port", "-p", "PORT", PORT_DESCRIPTION);
    }

    @Override
    public boolean testOption(String name) {
        switch (name) {
            case "--help", "-h" -> {
                help = true;
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    @Override
    public Consumer<String> testParameter(String name) {
        return switch (name) {
            case "--port", "-p" -> value -> port = parsePort(value);
            default -> null;
        };
    }

    int port() {
        return port;
    }

    boolean help() {
        return help;
    }

    boolean useSocket() {
        return port != DEFAULT_PORT;
    }

    String helpText() {
        return USAGE;
    }

    private static int parsePort(String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw badPort(value);
        }
        if (parsed < DEFAULT_PORT || parsed > HIGHEST_PORT) {
            throw badPort(value);
        }
        return parsed;
    }

    private static CliError badPort(String value) {
        return new CliError("Bad port '" + value + "': expected 0 for standard in/out, or a port up to "
                + HIGHEST_PORT);
    }
}
