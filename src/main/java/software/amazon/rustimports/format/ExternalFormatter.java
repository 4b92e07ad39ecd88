/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.format;

/**
 * Reformats rendered use declarations with a tool outside of this server.
 */
public interface ExternalFormatter {
    /**
     * A formatter that returns its input unchanged.
     */
    ExternalFormatter IDENTITY = text -> text;

    /**
     * @param text The text to format
     * @return The formatted text, or {@code text} itself if it couldn't be formatted
     */
    String format(String text);
}
