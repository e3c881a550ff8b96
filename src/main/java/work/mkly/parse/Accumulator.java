package work.mkly.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import work.mkly.kit.Preset;
import work.mkly.kit.Theme;

/**
 * Line sink of the directive or block currently open in the parser. Exactly one is active at a time.
 */
abstract class Accumulator {
    protected final Document.Builder doc;

    Accumulator(Document.Builder doc) {
        this.doc = doc;
    }

    abstract void property(Token token);

    abstract void text(Token token);

    abstract void blank(Token token);

    void comment(Token token) {
        doc.comment(new Comment(token.value(), token.line()));
    }

    /** Publishes what was collected. Called once when the next directive starts or the document ends. */
    void flush() {}

    /** True once the accumulator captures every line until the matching close. */
    boolean capturingVerbatim() {
        return false;
    }

    void verbatim(Token token) {
        throw new IllegalStateException("Not a verbatim block");
    }

    static Accumulator idle(Document.Builder doc) {
        return new Idle(doc);
    }

    static List<String> trimBlankEdges(List<String> lines) {
        int from = 0;
        int to = lines.size();
        while (from < to && lines.get(from).isBlank()) {
            from++;
        }
        while (to > from && lines.get(to - 1).isBlank()) {
            to--;
        }
        return lines.subList(from, to);
    }

    /** Before the first directive: stray lines are ignored. */
    static final class Idle extends Accumulator {
        Idle(Document.Builder doc) {
            super(doc);
        }

        @Override
        void property(Token token) {}

        @Override
        void text(Token token) {}

        @Override
        void blank(Token token) {}
    }

    /** Ordinary content block: properties until the first text or blank line, then body. */
    static final class BlockBody extends Accumulator {
        private final Block.Builder block;
        private final boolean verbatimType;
        private boolean inProperties = true;
        private boolean verbatim;

        BlockBody(Document.Builder doc, Block.Builder block, boolean verbatimType) {
            super(doc);
            this.block = block;
            this.verbatimType = verbatimType;
        }

        Block.Builder block() {
            return block;
        }

        @Override
        void property(Token token) {
            if (!inProperties) {
                block.contentLine(token.raw(), token.line());
                return;
            }
            String key = token.key();
            if (key.startsWith("@")) {
                doc.diagnostic(
                    Diagnostic.error(
                        DiagnosticKind.PROPERTY,
                        "Invalid property \"" + key + "\": property names cannot start with @. Use a --- style block for styling.",
                        token.line()
                    ).forBlock(block.blockType(), key)
                );
                return;
            }
            if (block.hasProperty(key)) {
                doc.diagnostic(
                    Diagnostic.warning(
                        DiagnosticKind.PROPERTY,
                        "Duplicate property \"" + key + "\": previous value will be overwritten",
                        token.line()
                    ).forBlock(block.blockType(), key)
                );
            }
            block.property(key, token.value(), token.line());
        }

        @Override
        void text(Token token) {
            endProperties();
            block.contentLine(token.raw(), token.line());
        }

        @Override
        void blank(Token token) {
            if (inProperties) {
                endProperties();
                return;
            }
            block.contentLine("", token.line());
        }

        @Override
        boolean capturingVerbatim() {
            return verbatim;
        }

        @Override
        void verbatim(Token token) {
            block.contentLine(token.is(TokenType.BLANK) ? "" : token.raw(), token.line());
        }

        private void endProperties() {
            if (inProperties) {
                inProperties = false;
                verbatim = verbatimType;
            }
        }
    }

    /** {@code --- meta}: every property line is a meta entry. */
    static final class Meta extends Accumulator {
        Meta(Document.Builder doc) {
            super(doc);
        }

        @Override
        void property(Token token) {
            doc.meta(token.key(), token.value());
        }

        @Override
        void text(Token token) {}

        @Override
        void blank(Token token) {}
    }

    /** {@code --- style}: body kept verbatim, comments included. */
    static final class Style extends Accumulator {
        private final List<String> lines = new ArrayList<>();
        private final List<Integer> lineNumbers = new ArrayList<>();

        Style(Document.Builder doc) {
            super(doc);
        }

        @Override
        void property(Token token) {
            add(token.raw(), token.line());
        }

        @Override
        void text(Token token) {
            add(token.raw(), token.line());
        }

        @Override
        void blank(Token token) {
            add("", token.line());
        }

        @Override
        void comment(Token token) {
            add(token.raw(), token.line());
        }

        private void add(String line, int number) {
            lines.add(line);
            lineNumbers.add(number);
        }

        @Override
        void flush() {
            int first = 0;
            while (first < lines.size() && lines.get(first).isBlank()) {
                first++;
            }
            List<String> kept = trimBlankEdges(lines);
            if (!kept.isEmpty()) {
                doc.styleSection(new StyleSection(String.join("\n", kept), lineNumbers.get(first)));
            }
        }
    }

    /** {@code --- use}, {@code --- theme}, {@code --- preset}: one name per non-blank line. */
    static final class NameList extends Accumulator {
        private final Consumer<String> sink;

        NameList(Document.Builder doc, Consumer<String> sink) {
            super(doc);
            this.sink = sink;
        }

        @Override
        void property(Token token) {
            add(token.raw());
        }

        @Override
        void text(Token token) {
            add(token.raw());
        }

        @Override
        void blank(Token token) {}

        private void add(String line) {
            String name = line.strip();
            if (!name.isEmpty()) {
                sink.accept(name);
            }
        }
    }

    /** {@code --- define-theme: name}: leading variables, then style-DSL body. */
    static final class DefineTheme extends Accumulator {
        private final String name;
        private final int line;
        private final Map<String, String> variables = new LinkedHashMap<>();
        private final List<String> css = new ArrayList<>();
        private boolean inVariables = true;

        DefineTheme(Document.Builder doc, String name, int line) {
            super(doc);
            this.name = name;
            this.line = line;
        }

        @Override
        void property(Token token) {
            if (inVariables) {
                variables.put(token.key(), token.value());
            } else {
                css.add(token.raw());
            }
        }

        @Override
        void text(Token token) {
            inVariables = false;
            css.add(token.raw());
        }

        @Override
        void blank(Token token) {
            if (inVariables) {
                inVariables = false;
            } else {
                css.add("");
            }
        }

        @Override
        void flush() {
            if (name == null) {
                return;
            }
            List<String> body = trimBlankEdges(css);
            if (variables.isEmpty() && body.isEmpty()) {
                doc.diagnostic(
                    Diagnostic.warning(DiagnosticKind.DEFINITION, "Empty define-theme \"" + name + "\": add variables or CSS", line)
                );
                return;
            }
            doc.inlineTheme(Theme.of(name, variables, body.isEmpty() ? null : String.join("\n", body)));
        }
    }

    /** {@code --- define-preset: name}: style-DSL body. */
    static final class DefinePreset extends Accumulator {
        private final String name;
        private final int line;
        private final List<String> css = new ArrayList<>();

        DefinePreset(Document.Builder doc, String name, int line) {
            super(doc);
            this.name = name;
            this.line = line;
        }

        @Override
        void property(Token token) {
            css.add(token.raw());
        }

        @Override
        void text(Token token) {
            css.add(token.raw());
        }

        @Override
        void blank(Token token) {
            css.add("");
        }

        @Override
        void flush() {
            if (name == null) {
                return;
            }
            List<String> body = trimBlankEdges(css);
            if (body.isEmpty()) {
                doc.diagnostic(
                    Diagnostic.warning(DiagnosticKind.DEFINITION, "Empty define-preset \"" + name + "\": add CSS rules", line)
                );
                return;
            }
            doc.inlinePreset(Preset.of(name, String.join("\n", body)));
        }
    }
}
