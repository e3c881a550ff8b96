package work.mkly.runtime;

import java.util.regex.Pattern;

/**
 * HTML escaping shared by the compiler and block renderers.
 */
public final class Html {
    private static final Pattern ENTITY_AMPERSAND = Pattern.compile("&(?!#?\\w+;)");
    private static final Pattern UNSAFE_URL = Pattern.compile("^(javascript|data|vbscript):.*", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern INVISIBLE = Pattern.compile("[\\x00\\s]");

    private Html() {}

    /** Escapes markup characters. Existing entities and {@code \~} (non-breaking space) are kept. */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String escaped = ENTITY_AMPERSAND.matcher(text.replace("\\~", "\u0000NBSP\u0000")).replaceAll("&amp;");
        return escaped
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("\u0000NBSP\u0000", "&nbsp;");
    }

    /** Escaping for attribute values that must not keep entities. */
    public static String attribute(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;").replace("\"", "&quot;").replace("<", "&lt;");
    }

    public static boolean isSafeUrl(String url) {
        if (url == null) {
            return false;
        }
        return !UNSAFE_URL.matcher(INVISIBLE.matcher(url).replaceAll("")).matches();
    }

    /** {@code url} when it uses a safe scheme, otherwise {@code "#"}. */
    public static String safeUrl(String url) {
        return isSafeUrl(url) ? url : "#";
    }

    /** Inert box shown in place of a block that failed to render. */
    public static String errorBox(String message, int line) {
        return "<div class=\"mkly-error\" data-mkly-error data-line=\"" + line + "\">"
            + escape(message)
            + " <span>(line " + line + ")</span></div>";
    }
}
