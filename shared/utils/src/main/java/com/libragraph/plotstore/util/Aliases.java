package com.libragraph.plotstore.util;

import java.util.regex.Pattern;

/**
 * Format rule for human-readable image aliases: 3–64 characters of
 * {@code [A-Za-z0-9_-]}, case-sensitive.
 */
public final class Aliases {

    public static final String REGEX = "^[A-Za-z0-9_-]{3,64}$";

    private static final Pattern PATTERN = Pattern.compile(REGEX);

    private Aliases() {
    }

    public static boolean isValid(String alias) {
        return alias != null && PATTERN.matcher(alias).matches();
    }

    /**
     * @throws IllegalArgumentException if {@code alias} does not match {@link #REGEX}
     */
    public static String requireValid(String alias) {
        if (!isValid(alias)) {
            throw new IllegalArgumentException("Invalid alias format: '" + alias
                    + "'. Must be 3-64 characters, alphanumeric with hyphens/underscores only.");
        }
        return alias;
    }
}
