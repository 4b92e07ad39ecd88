/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.rustimports.imports;

import java.util.Objects;

/**
 * Decides which alias survives when two imports of the same path collide:
 * an explicit alias beats no alias, which beats the {@code _} placeholder
 * used to import a trait without bringing its name into scope.
 */
public final class AliasPriority {
    /**
     * The alias that imports a name without making it usable.
     */
    public static final String DISCARD = "_";

    private AliasPriority() {
    }

    /**
     * @param alias The nullable alias
     * @return 0 for the discard placeholder, 1 for no alias, 2 for an explicit alias
     */
    public static int rank(String alias) {
        if (alias == null) {
            return 1;
        }
        return DISCARD.equals(alias) ? 0 : 2;
    }

    /**
     * @param a First nullable alias
     * @param b Second nullable alias
     * @return Positive if {@code a} wins over {@code b}, negative if {@code b}
     *  wins, zero if they have the same priority
     */
    public static int compare(String a, String b) {
        return Integer.compare(rank(a), rank(b));
    }

    /**
     * @param existing The nullable alias seen first
     * @param incoming The nullable alias seen second
     * @return The alias with higher priority, or {@code existing} if neither wins
     */
    public static String preferred(String existing, String incoming) {
        return compare(incoming, existing) > 0 ? incoming : existing;
    }

    /**
     * @param a First nullable alias
     * @param b Second nullable alias
     * @return Whether {@code a} and {@code b} are different explicit aliases
     */
    public static boolean conflicts(String a, String b) {
        return rank(a) == 2 && rank(b) == 2 && !Objects.equals(a, b);
    }
}
