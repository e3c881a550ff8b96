package work.mkly.parse;

/**
 * Canonical order of document directives. The parser's phase cursor only moves forward.
 */
enum DirectivePhase {
    USE("earlier in the document"),
    DEFINE("\"--- define-theme/define-preset\"; move it above the define blocks"),
    THEME("\"--- theme:\"; move it above the theme declarations"),
    META("\"--- meta\"; move it above the meta block"),
    STYLE("\"--- style\"; move it above the style block"),
    BLOCKS("content blocks; move it above the first block");

    private final String requirement;

    DirectivePhase(String requirement) {
        this.requirement = requirement;
    }

    /** Phase a directive belongs to, or {@code BLOCKS} for ordinary block types. */
    static DirectivePhase of(String directive) {
        return switch (directive) {
            case "use" -> USE;
            case "define-theme", "define-preset" -> DEFINE;
            case "theme", "preset" -> THEME;
            case "meta" -> META;
            case "style" -> STYLE;
            default -> BLOCKS;
        };
    }

    boolean isAfter(DirectivePhase other) {
        return ordinal() > other.ordinal();
    }

    /**
     * Message for {@code directive} showing up while the cursor already sits on this phase.
     */
    String orderingMessage(String directive) {
        if (this == USE) {
            return "\"--- " + directive + "\" must appear " + requirement;
        }
        return "\"--- " + directive + "\" must appear before " + requirement;
    }
}
