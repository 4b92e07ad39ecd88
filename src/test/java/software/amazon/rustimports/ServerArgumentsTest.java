/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import software.amazon.smithy.cli.CliError;

public class ServerArgumentsTest {
    @Test
    void noArgumentsMeansStandardStreams() {
        ServerArguments parsed = ServerArguments.create(new String[0]);

        assertThat(parsed.port(), is(ServerArguments.DEFAULT_PORT));
        assertThat(parsed.useSocket(), is(false));
        assertThat(parsed.help(), is(false));
    }

    @ParameterizedTest
    @MethodSource("portCases")
    void parsesPort(String[] args, int expectedPort, boolean expectSocket) {
        ServerArguments parsed = ServerArguments.create(args);

        assertThat(parsed.port(), is(expectedPort));
        assertThat(parsed.useSocket(), is(expectSocket));
    }

    private static Stream<Arguments> portCases() {
        return Stream.of(
                Arguments.of(new String[] {"--port", "5007"}, 5007, true),
                Arguments.of(new String[] {"-p", "65535"}, 65535, true),
                Arguments.of(new String[] {"-p", "0"}, 0, false));
    }

    @ParameterizedTest
    @ValueSource(strings = {"65536", "port", "1.5"})
    void rejectsMalformedPort(String value) {
        CliError error = assertThrows(CliError.class, () -> ServerArguments.create(new String[] {"--port", value}));

        assertThat(error.getMessage(), containsString(value));
    }

    @Test
    void rejectsLeftoverArguments() {
        CliError error = assertThrows(CliError.class,
                () -> ServerArguments.create(new String[] {"-p", "80", "src/main.rs"}));

        assertThat(error.getMessage(), containsString("Unexpected arguments: src/main.rs"));
    }

    @Test
    void rejectsUnknownFlag() {
        assertThrows(CliError.class, () -> ServerArguments.create(new String[] {"--stdio"}));
    }

    @ParameterizedTest
    @ValueSource(strings = {"--help", "-h"})
    void recognizesHelp(String flag) {
        ServerArguments parsed = ServerArguments.create(new String[] {flag});

        assertThat(parsed.help(), is(true));
        assertThat(parsed.helpText(), allOf(containsString("--port"), containsString("--help")));
    }
}
