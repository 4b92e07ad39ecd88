/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.eclipse.lsp4j.InitializeParams;

/**
 * Settings of the organize imports action, sent by the client as
 * initialization options.
 */
public final class ServerOptions {
    static final String GROUP_IMPORTS = "organizeImports.groupImports";
    static final String REMOVE_UNUSED = "organizeImports.removeUnused";
    static final String RUSTFMT = "organizeImports.rustfmt";
    static final String RUSTFMT_PATH = "organizeImports.rustfmtPath";

    private final boolean groupImports;
    private final boolean removeUnused;
    private final boolean useRustfmt;
    private final String rustfmtPath;

    private ServerOptions(Builder builder) {
        this.groupImports = builder.groupImports;
        this.removeUnused = builder.removeUnused;
        this.useRustfmt = builder.useRustfmt;
        this.rustfmtPath = builder.rustfmtPath;
    }

    public boolean getGroupImports() {
        return groupImports;
    }

    public boolean getRemoveUnused() {
        return removeUnused;
    }

    public boolean getUseRustfmt() {
        return useRustfmt;
    }

    public String getRustfmtPath() {
        return rustfmtPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a ServerOptions instance from the initialization options provided by the client.
     * Invalid values are reported to the client, and the default is used instead.
     *
     * @param params The params passed directly from the client
     * @param client The language client used for reporting invalid options
     * @return A new {@code ServerOptions} instance with parsed configuration values
     */
    public static ServerOptions fromInitializeParams(InitializeParams params, ImportsLanguageClient client) {
        Builder builder = builder();
        if (params.getInitializationOptions() instanceof JsonObject jsonObject) {
            Boolean groupImports = booleanOption(jsonObject, GROUP_IMPORTS, client);
            if (groupImports != null) {
                builder.setGroupImports(groupImports);
            }
            Boolean removeUnused = booleanOption(jsonObject, REMOVE_UNUSED, client);
            if (removeUnused != null) {
                builder.setRemoveUnused(removeUnused);
            }
            Boolean rustfmt = booleanOption(jsonObject, RUSTFMT, client);
            if (rustfmt != null) {
                builder.setUseRustfmt(rustfmt);
                client.info("Configured rustfmt: " + rustfmt);
            }
            if (jsonObject.has(RUSTFMT_PATH)) {
                JsonElement value = jsonObject.get(RUSTFMT_PATH);
                if (isString(value) && !value.getAsString().isBlank()) {
                    builder.setRustfmtPath(value.getAsString());
                } else {
                    client.error(String.format("""
                            Invalid value for '%s': %s.
                            Must be a non-empty string.""", RUSTFMT_PATH, value));
                }
            }
        }
        return builder.build();
    }

    private static Boolean booleanOption(JsonObject jsonObject, String name, ImportsLanguageClient client) {
        if (!jsonObject.has(name)) {
            return null;
        }
        JsonElement value = jsonObject.get(name);
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()) {
            return value.getAsBoolean();
        }
        client.error(String.format("""
                Invalid value for '%s': %s.
                Must be true or false.""", name, value));
        return null;
    }

    private static boolean isString(JsonElement value) {
        return value.isJsonPrimitive() && value.getAsJsonPrimitive().isString();
    }

    public static final class Builder {
        private boolean groupImports = true;
        private boolean removeUnused = true;
        private boolean useRustfmt = false;
        private String rustfmtPath = "rustfmt";

        public Builder setGroupImports(boolean groupImports) {
            this.groupImports = groupImports;
            return this;
        }

        public Builder setRemoveUnused(boolean removeUnused) {
            this.removeUnused = removeUnused;
            return this;
        }

        public Builder setUseRustfmt(boolean useRustfmt) {
            this.useRustfmt = useRustfmt;
            return this;
        }

        public Builder setRustfmtPath(String rustfmtPath) {
            this.rustfmtPath = rustfmtPath;
            return this;
        }

        public ServerOptions build() {
            return new ServerOptions(this);
        }
    }
}
