package io.github.flameyossnowy.network.api.utils;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Naming helpers shared by the relation builder and the stores.
 */
public final class Identifiers {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private Identifiers() {
        throw new AssertionError("No instances");
    }

    /**
     * Whether the name can be used verbatim as a column, table or accessor name.
     */
    @Contract("null -> false")
    public static boolean isIdentifier(@Nullable String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /**
     * {@code "Person"} -> {@code "person"}, {@code "BlogPost"} -> {@code "blog_post"}.
     */
    public static @NotNull String snakeCase(@NotNull String name) {
        StringBuilder out = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && name.charAt(i - 1) != '_') out.append('_');
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
