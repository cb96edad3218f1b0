package parser.semantic;

import java.util.Locale;

/** Derives element ids from visible labels: "Sign In!" becomes "sign-in". */
public final class Slugs {
    private Slugs() {}

    public static String slugify(String text) {
        if (text == null) return "";
        String s = text.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        return s;
    }
}
