package work.mkly.core;

import java.util.List;
import java.util.regex.Pattern;
import work.mkly.kit.BlockDefinition;
import work.mkly.kit.ContentMode;
import work.mkly.parse.Block;
import work.mkly.runtime.CompileContext;
import work.mkly.runtime.Html;
import work.mkly.style.StyleCss;

/**
 * Renderers of the built-in {@code core/*} blocks.
 */
final class CoreBlocks {
    private static final Pattern CSS_VALUE = Pattern.compile("^[\\w\\s#%.,()+-]+$");
    private static final Pattern SCRIPT = Pattern.compile("<script\\b[\\s\\S]*?</script>", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVENT_HANDLER = Pattern.compile("\\s+on\\w+\\s*=\\s*(\"[^\"]*\"|'[^']*')", Pattern.CASE_INSENSITIVE);

    static final String SANITIZE_VARIABLE = "__sanitize";

    private CoreBlocks() {}

    static List<BlockDefinition> definitions() {
        return List.of(
            BlockDefinition.of("heading", ContentMode.TEXT, CoreBlocks::heading),
            BlockDefinition.of("text", ContentMode.TEXT, (block, ctx) -> "<div class=\"" + cls(block) + "\">" + md(block) + "</div>"),
            BlockDefinition.of("image", ContentMode.PROPERTIES, CoreBlocks::image),
            BlockDefinition.of("button", ContentMode.MIXED, CoreBlocks::button),
            BlockDefinition.of("divider", ContentMode.PROPERTIES, (block, ctx) -> "<hr class=\"" + cls(block) + "\">"),
            BlockDefinition.of("spacer", ContentMode.PROPERTIES, CoreBlocks::spacer),
            BlockDefinition.of("code", ContentMode.MIXED, CoreBlocks::code),
            BlockDefinition.of("quote", ContentMode.MIXED, CoreBlocks::quote),
            BlockDefinition.container("section", ContentMode.MIXED, CoreBlocks::section),
            BlockDefinition.of("card", ContentMode.MIXED, CoreBlocks::card),
            BlockDefinition.of("list", ContentMode.TEXT, (block, ctx) -> "<div class=\"" + cls(block) + "\">" + md(block) + "</div>"),
            BlockDefinition.of("html", ContentMode.VERBATIM, CoreBlocks::html)
        );
    }

    /** CSS class of the block, with the {@code --label} modifier when the block is labelled. */
    static String cls(Block block) {
        String base = StyleCss.blockClass(block.blockType());
        return block.label() == null ? base : base + " " + base + "--" + block.label();
    }

    static String cls(Block block, String suffix) {
        return StyleCss.blockClass(block.blockType()) + suffix;
    }

    private static String md(Block block) {
        return MarkdownRenderer.render(block.content());
    }

    private static String lineAttr(Block block, String... properties) {
        for (String property : properties) {
            Integer line = block.propertyLines().get(property);
            if (line != null) {
                return " data-mkly-line=\"" + line + "\"";
            }
        }
        return "";
    }

    private static String url(String value) {
        return Html.isSafeUrl(value) ? Html.escape(value) : "";
    }

    private static String missing(Block block, CompileContext ctx, String property, String message) {
        ctx.error(block, "Missing required property \"" + property + "\"");
        return Html.errorBox(message, block.range().startLine());
    }

    static int level(String value) {
        if (value == null) {
            return 2;
        }
        try {
            return Math.min(Math.max(Integer.parseInt(value.trim()), 1), 6);
        } catch (NumberFormatException ex) {
            return 2;
        }
    }

    private static String heading(Block block, CompileContext ctx) {
        int level = level(block.property("level"));
        String text = block.content().isEmpty() ? block.property("text", "") : block.content();
        return "<h" + level + " class=\"" + cls(block) + " " + cls(block, "--" + level) + "\"" + lineAttr(block, "level", "text") + ">"
            + Html.escape(text) + "</h" + level + ">";
    }

    private static String image(Block block, CompileContext ctx) {
        String src = block.property("src", block.property("url"));
        if (src == null || src.isBlank()) {
            return missing(block, ctx, "src", "image block requires \"src\" property");
        }
        String alt = block.property("alt");
        if (alt == null) {
            ctx.warn(block, "image block is missing \"alt\" property (accessibility)");
        }
        String width = block.property("width");
        String widthAttr = width == null || width.isEmpty() ? "" : " width=\"" + Html.escape(width) + "\"";
        return "<figure class=\"" + cls(block) + "\"><img src=\"" + url(src) + "\" alt=\"" + Html.escape(alt == null ? "" : alt) + "\""
            + widthAttr + " class=\"" + cls(block, "__img") + "\"" + lineAttr(block, "src", "url") + "></figure>";
    }

    private static String button(Block block, CompileContext ctx) {
        String href = block.property("url", block.property("href"));
        if (href == null || href.isBlank()) {
            return missing(block, ctx, "url", "button block requires \"url\" property");
        }
        String label = block.property("label", block.content().trim());
        if (label.isEmpty()) {
            return missing(block, ctx, "label", "button block requires \"label\" property or text content");
        }
        return "<div class=\"" + cls(block) + "\"><a href=\"" + url(href) + "\" class=\"" + cls(block, "__link") + "\""
            + lineAttr(block, "url", "href") + ">" + Html.escape(label) + "</a></div>";
    }

    private static String spacer(Block block, CompileContext ctx) {
        String height = block.property("height");
        if (height == null || height.isBlank()) {
            return missing(block, ctx, "height", "spacer block requires \"height\" property");
        }
        if (!CSS_VALUE.matcher(height).matches()) {
            ctx.error(block, "Invalid CSS value for \"height\": " + height);
            return Html.errorBox("spacer has invalid \"height\" value: " + height, block.range().startLine());
        }
        return "<div class=\"" + cls(block) + "\" style=\"height:" + height + ";\"" + lineAttr(block, "height") + "></div>";
    }

    private static String code(Block block, CompileContext ctx) {
        String lang = block.property("lang");
        String langAttr = lang == null || lang.isEmpty() ? "" : " data-lang=\"" + Html.escape(lang) + "\"";
        return "<div class=\"" + cls(block) + "\"><pre><code" + langAttr + lineAttr(block, "lang") + ">"
            + Html.escape(block.content()) + "</code></pre></div>";
    }

    private static String quote(Block block, CompileContext ctx) {
        String author = block.property("author");
        String footer = author == null || author.isEmpty()
            ? ""
            : "<footer class=\"" + cls(block, "__author") + "\"" + lineAttr(block, "author") + ">\u2014 " + Html.escape(author) + "</footer>";
        return "<blockquote class=\"" + cls(block) + "\">" + md(block) + footer + "</blockquote>";
    }

    private static String section(Block block, CompileContext ctx) {
        String title = block.property("title");
        String titleHtml = title == null || title.isEmpty()
            ? ""
            : "<h2 class=\"" + cls(block, "__title") + "\"" + lineAttr(block, "title") + ">" + Html.escape(title) + "</h2>";
        return "<section class=\"" + cls(block) + "\">" + titleHtml + BlockDefinition.CHILDREN + "</section>";
    }

    private static String card(Block block, CompileContext ctx) {
        String image = block.property("image");
        String link = block.property("link", block.property("url"));
        String imageHtml = image == null || image.isEmpty()
            ? ""
            : "<img src=\"" + url(image) + "\" alt=\"\" class=\"" + cls(block, "__img") + "\"" + lineAttr(block, "image") + ">";
        String linkHtml = link == null || link.isEmpty()
            ? ""
            : "<a href=\"" + url(link) + "\" class=\"" + cls(block, "__link") + "\"" + lineAttr(block, "link", "url") + ">Read more</a>";
        return "<article class=\"" + cls(block) + "\">" + imageHtml + "<div class=\"" + cls(block, "__body") + "\">"
            + md(block) + linkHtml + "</div></article>";
    }

    private static String html(Block block, CompileContext ctx) {
        String content = block.content();
        if ("true".equals(ctx.variables().get(SANITIZE_VARIABLE))) {
            content = EVENT_HANDLER.matcher(SCRIPT.matcher(content).replaceAll("")).replaceAll("");
        }
        return "<div class=\"" + cls(block) + "\">" + content + "</div>";
    }
}
