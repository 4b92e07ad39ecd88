/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

/**
 * The output groups use declarations are sorted into, in the order the
 * groups appear in an organized file.
 */
public enum ImportCategory {
    STANDARD_LIBRARY,
    EXTERNAL,
    INTERNAL,
    ATTRIBUTED
}
