/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.format;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Formats text by piping it through {@code rustfmt --emit stdout}.
 *
 * <p>Any failure, like rustfmt not being installed, exiting with an error, or
 * taking too long, is logged and the text is returned as-is.
 */
public final class RustfmtFormatter implements ExternalFormatter {
    static final long DEFAULT_TIMEOUT_SECONDS = 10;

    private static final Logger LOGGER = Logger.getLogger(RustfmtFormatter.class.getName());

    private final String executable;
    private final long timeoutSeconds;

    /**
     * @param executable The name or path of the rustfmt executable
     */
    public RustfmtFormatter(String executable) {
        this(executable, DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * @param executable The name or path of the rustfmt executable
     * @param timeoutSeconds How long to wait for rustfmt to exit
     */
    public RustfmtFormatter(String executable, long timeoutSeconds) {
        this.executable = executable;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * @return The command this formatter runs
     */
    public List<String> command() {
        return List.of(executable, "--emit", "stdout");
    }

    @Override
    public String format(String text) {
        try {
            return run(text);
        } catch (IOException | UncheckedIOException e) {
            LOGGER.warning(() -> "Couldn't run " + executable + ": " + e.getMessage());
        } catch (TimeoutException e) {
            LOGGER.warning(() -> executable + " didn't finish within " + timeoutSeconds + " seconds");
        } catch (ExecutionException e) {
            LOGGER.warning(() -> "Couldn't read the output of " + executable + ": " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning(() -> "Interrupted while waiting for " + executable);
        }
        return text;
    }

    private String run(String text) throws IOException, InterruptedException, ExecutionException,
            TimeoutException {
        Process process = new ProcessBuilder(command()).start();
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));

        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(text.getBytes(StandardCharsets.UTF_8));
        }

        if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            throw new TimeoutException();
        }

        String output = stdout.get(timeoutSeconds, TimeUnit.SECONDS);
        if (process.exitValue() != 0 || output.isBlank()) {
            String errors = stderr.get(timeoutSeconds, TimeUnit.SECONDS);
            LOGGER.warning(() -> executable + " exited with " + process.exitValue() + ": " + errors);
            return text;
        }

        // rustfmt's trailing line breaks aren't ours to decide
        String formatted = output.strip();
        return text.endsWith("\n") ? formatted + "\n" : formatted;
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
