package work.mkly.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns mkly source into a {@link Document}.
 *
 * <p>Ordinary blocks are kept on a stack of frames. A close directive seals the innermost unclosed
 * frame of the same type and adopts every frame above it as children, so containers nest to any depth.
 */
public final class DocumentParser {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentParser.class);

    public static final int MAX_SOURCE_LENGTH = 10 * 1024 * 1024;
    public static final int MAX_BLOCKS = 10_000;

    private DocumentParser() {}

    public static Document parse(String source) {
        return parse(source, ParseOptions.DEFAULT);
    }

    public static Document parse(String source, ParseOptions options) {
        String text = source == null ? "" : source;
        ParseOptions effective = options == null ? ParseOptions.DEFAULT : options;
        var doc = Document.builder();
        if (text.length() > MAX_SOURCE_LENGTH) {
            doc.diagnostic(Diagnostic.fatal(DiagnosticKind.LIMIT, "Document exceeds maximum size (10 MB)", 1));
            return doc.build();
        }
        List<Token> tokens = Tokenizer.tokenize(text);
        var run = new Run(doc, effective);
        run.consume(tokens);

        DocumentVersion.Resolution version = DocumentVersion.resolve(doc.meta());
        doc.version(version.version(), version.declared());
        version.error().ifPresent(message -> doc.diagnostic(Diagnostic.error(DiagnosticKind.VERSION, message, 1)));

        Document document = doc.build();
        LOG.debug("Parsed {} lines into {} top-level blocks ({} diagnostics)",
            tokens.size(), document.blocks().size(), document.diagnostics().size());
        return document;
    }

    /** Open block on the stack. {@code sealed} is set once its close directive has been seen. */
    private static final class Frame {
        final Block.Builder builder;
        Block sealed;

        Frame(Block.Builder builder) {
            this.builder = builder;
        }

        String blockType() {
            return builder.blockType();
        }

        Block toBlock() {
            return sealed != null ? sealed : builder.build(List.of());
        }
    }

    private static final class Run {
        private final Document.Builder doc;
        private final ParseOptions options;
        private final List<Frame> frames = new ArrayList<>();
        private final Map<String, Deque<Integer>> unclosed = new HashMap<>();
        private Accumulator active;
        private DirectivePhase phase = DirectivePhase.USE;
        private int blockCount;

        Run(Document.Builder doc, ParseOptions options) {
            this.doc = doc;
            this.options = options;
            this.active = Accumulator.idle(doc);
        }

        void consume(List<Token> tokens) {
            for (Token token : tokens) {
                if (active.capturingVerbatim()) {
                    var body = (Accumulator.BlockBody) active;
                    if (token.is(TokenType.BLOCK_END) && token.blockType().equals(body.block().blockType())) {
                        close(token);
                    } else {
                        active.verbatim(token);
                    }
                    continue;
                }
                switch (token.type()) {
                    case BLOCK_START -> {
                        if (!open(token)) {
                            finish(token.line());
                            return;
                        }
                    }
                    case BLOCK_END -> close(token);
                    case PROPERTY -> active.property(token);
                    case TEXT -> active.text(token);
                    case BLANK -> active.blank(token);
                    case COMMENT -> active.comment(token);
                    default -> throw new IllegalStateException("Unexpected token " + token.type());
                }
            }
            finish(tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line());
        }

        private boolean open(Token token) {
            String type = token.blockType();
            DirectivePhase directive = DirectivePhase.of(type);
            boolean ordinary = directive == DirectivePhase.BLOCKS;
            if (ordinary && blockCount >= MAX_BLOCKS) {
                doc.diagnostic(Diagnostic.fatal(
                    DiagnosticKind.LIMIT,
                    "Maximum block count (" + MAX_BLOCKS + ") exceeded",
                    token.line()
                ));
                return false;
            }
            endActive(token.line() > 1 ? token.line() - 1 : 1);

            if (!ordinary) {
                if (phase.isAfter(directive)) {
                    String name = "meta".equals(type) || "style".equals(type) ? type : type + ":";
                    doc.diagnostic(Diagnostic.error(DiagnosticKind.ORDERING, phase.orderingMessage(name), token.line()));
                }
                advance(directive);
                active = directive(token);
                return true;
            }

            advance(DirectivePhase.BLOCKS);
            blockCount++;
            var builder = new Block.Builder(type, token.label(), token.line(), options.sourceMap());
            unclosed.computeIfAbsent(type, key -> new ArrayDeque<>()).push(frames.size());
            frames.add(new Frame(builder));
            active = new Accumulator.BlockBody(doc, builder, options.verbatimTypes().contains(type));
            return true;
        }

        private Accumulator directive(Token token) {
            String label = token.label();
            return switch (token.blockType()) {
                case "meta" -> new Accumulator.Meta(doc);
                case "style" -> new Accumulator.Style(doc);
                case "use" -> nameList(label, doc::use);
                case "theme" -> nameList(label, doc::theme);
                case "preset" -> nameList(label, doc::preset);
                case "define-theme" -> {
                    requireName(token);
                    yield new Accumulator.DefineTheme(doc, label, token.line());
                }
                case "define-preset" -> {
                    requireName(token);
                    yield new Accumulator.DefinePreset(doc, label, token.line());
                }
                default -> throw new IllegalArgumentException("Not a directive: " + token.blockType());
            };
        }

        private Accumulator nameList(String label, Consumer<String> sink) {
            if (label != null) {
                sink.accept(label);
            }
            return new Accumulator.NameList(doc, sink);
        }

        private void requireName(Token token) {
            if (token.label() == null) {
                String type = token.blockType();
                String example = "define-theme".equals(type) ? "my-theme" : "my-preset";
                doc.diagnostic(Diagnostic.error(
                    DiagnosticKind.DEFINITION,
                    "\"--- " + type + "\" requires a name (e.g. --- " + type + ": " + example + ")",
                    token.line()
                ));
            }
        }

        private void advance(DirectivePhase next) {
            if (next.isAfter(phase)) {
                phase = next;
            }
        }

        private void close(Token token) {
            endActive(token.line());
            Deque<Integer> open = unclosed.get(token.blockType());
            if (open == null || open.isEmpty()) {
                doc.diagnostic(Diagnostic.warning(
                    DiagnosticKind.STRUCTURE,
                    "Closing --- /" + token.blockType() + " has no matching opening block",
                    token.line()
                ).forBlock(token.blockType(), null));
                return;
            }
            int index = open.pop();
            List<Frame> adopted = frames.subList(index + 1, frames.size());
            List<Block> children = new ArrayList<>(adopted.size());
            for (Frame child : adopted) {
                if (child.sealed == null) {
                    // adopted unclosed frames are always the newest entries of their type
                    unclosed.get(child.blockType()).pop();
                }
                children.add(child.toBlock());
            }
            adopted.clear();
            Frame container = frames.get(index);
            container.builder.end(token.line());
            container.sealed = container.builder.build(children);
        }

        private void endActive(int endLine) {
            active.flush();
            if (active instanceof Accumulator.BlockBody body) {
                Frame top = frames.get(frames.size() - 1);
                if (top.sealed == null && top.builder == body.block()) {
                    top.builder.end(endLine);
                }
            }
            active = Accumulator.idle(doc);
        }

        private void finish(int lastLine) {
            endActive(lastLine);
            for (Frame frame : frames) {
                doc.block(frame.toBlock());
            }
        }
    }
}
