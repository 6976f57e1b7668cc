package de.netcompliance.infrastructure.resolving;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import de.netcompliance.core.exception.ExpressionException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;

/**
 * Compiles text templates with {@code {{ expr }}} output, {@code {% if %}}/{@code elif}/{@code else},
 * {@code {% for x in list %}}, {@code {% set x = expr %}} and {@code {# comments #}}.
 * A {@code -} next to a delimiter trims the whitespace on that side.
 */
public class TemplateRenderer {

    private static final Pattern FOR_TAG = Pattern.compile("^for\\s+([A-Za-z_][A-Za-z0-9_]*)\\s+in\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern SET_TAG = Pattern.compile("^set\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.+)$", Pattern.DOTALL);

    private final Cache<String, Template> cache = CacheBuilder.newBuilder()
            .maximumSize(500)
            .build();

    public Template compile(final String text) {
        try {
            return cache.get(Objects.requireNonNullElse(text, ""), () -> new Compiler(text).compile());
        } catch (ExecutionException | UncheckedExecutionException e) {
            if (e.getCause() instanceof ExpressionException expressionException) throw expressionException;
            throw new ExpressionException("Cannot compile template", e.getCause());
        }
    }

    public RenderResult render(final String text, final Map<String, Object> scope) {
        return compile(text).render(scope);
    }

    public static boolean isTemplated(final String text) {
        return Objects.nonNull(text) && (text.contains("{{") || text.contains("{%"));
    }

    private enum TagKind {
        TEXT, OUTPUT, STATEMENT, COMMENT
    }

    private record Piece(TagKind kind, String content, int position) {
    }

    private static final class Compiler {

        private final String source;
        private final List<Template.Node> root = new ArrayList<>();

        Compiler(final String source) {
            this.source = Objects.requireNonNullElse(source, "");
        }

        Template compile() {
            var pieces = split();
            var stack = new ArrayDeque<Block>();
            for (Piece piece : pieces) {
                var target = stack.isEmpty() ? root : stack.peek().current();
                switch (piece.kind()) {
                    case TEXT -> target.add(new Template.Text(piece.content()));
                    case OUTPUT -> target.add(new Template.Output(ExpressionParser.parse(piece.content())));
                    case COMMENT -> {
                        // dropped
                    }
                    case STATEMENT -> statement(piece, target, stack);
                }
            }
            if (!stack.isEmpty()) {
                throw new ExpressionException("Unclosed '%s' block in template".formatted(stack.peek().keyword()));
            }
            return new Template(source, root);
        }

        private void statement(final Piece piece, final List<Template.Node> target, final Deque<Block> stack) {
            var content = piece.content();
            var keyword = content.split("\\s+", 2)[0];
            var rest = content.length() > keyword.length() ? content.substring(keyword.length()).trim() : "";
            switch (keyword) {
                case "if" -> {
                    var block = new Block("if");
                    block.branches.add(new Template.Branch(ExpressionParser.parse(requireArgument(rest, piece)), new ArrayList<>()));
                    stack.push(block);
                }
                case "elif" -> {
                    var block = requireOpen(stack, "if", piece);
                    if (block.inElse) throw error("'elif' after 'else'", piece);
                    block.branches.add(new Template.Branch(ExpressionParser.parse(requireArgument(rest, piece)), new ArrayList<>()));
                }
                case "else" -> {
                    var block = stack.peek();
                    if (Objects.isNull(block) || block.inElse) throw error("Unexpected 'else'", piece);
                    block.inElse = true;
                }
                case "endif" -> {
                    var block = requireOpen(stack, "if", piece);
                    stack.pop();
                    addTo(stack, new Template.Conditional(List.copyOf(block.branches), List.copyOf(block.otherwise)));
                }
                case "for" -> {
                    var matcher = FOR_TAG.matcher(content);
                    if (!matcher.matches()) throw error("Malformed 'for' tag", piece);
                    var block = new Block("for");
                    block.loopVariable = matcher.group(1);
                    block.iterable = ExpressionParser.parse(matcher.group(2));
                    stack.push(block);
                }
                case "endfor" -> {
                    var block = requireOpen(stack, "for", piece);
                    stack.pop();
                    addTo(stack, new Template.Loop(block.loopVariable, block.iterable, List.copyOf(block.body), List.copyOf(block.otherwise)));
                }
                case "set" -> {
                    var matcher = SET_TAG.matcher(content);
                    if (!matcher.matches()) throw error("Malformed 'set' tag", piece);
                    target.add(new Template.Assignment(matcher.group(1), ExpressionParser.parse(matcher.group(2))));
                }
                default -> throw error("Unsupported tag '%s'".formatted(keyword), piece);
            }
        }

        private void addTo(final Deque<Block> stack, final Template.Node node) {
            if (stack.isEmpty()) {
                root.add(node);
            } else {
                stack.peek().current().add(node);
            }
        }

        private Block requireOpen(final Deque<Block> stack, final String keyword, final Piece piece) {
            var block = stack.peek();
            if (Objects.isNull(block) || !block.keyword().equals(keyword)) {
                throw error("'%s' without matching '%s'".formatted(piece.content().split("\\s+", 2)[0], keyword), piece);
            }
            return block;
        }

        private String requireArgument(final String argument, final Piece piece) {
            if (argument.isBlank()) throw error("Missing condition", piece);
            return argument;
        }

        private ExpressionException error(final String message, final Piece piece) {
            return new ExpressionException("%s at %d in template".formatted(message, piece.position()));
        }

        private List<Piece> split() {
            var pieces = new ArrayList<Piece>();
            int position = 0;
            boolean trimNextText = false;
            while (position < source.length()) {
                int open = nextOpening(position);
                if (open < 0) {
                    addText(pieces, source.substring(position), trimNextText, false, position);
                    break;
                }
                char marker = source.charAt(open + 1);
                String closing = switch (marker) {
                    case '{' -> "}}";
                    case '%' -> "%}";
                    default -> "#}";
                };
                int close = source.indexOf(closing, open + 2);
                if (close < 0) {
                    throw new ExpressionException("Unclosed '%s' at %d in template".formatted(source.substring(open, open + 2), open));
                }
                boolean trimBefore = open + 2 < source.length() && source.charAt(open + 2) == '-';
                boolean trimAfter = close > open + 2 && source.charAt(close - 1) == '-';
                addText(pieces, source.substring(position, open), trimNextText, trimBefore, position);
                var inner = source.substring(open + 2 + (trimBefore ? 1 : 0), close - (trimAfter ? 1 : 0)).trim();
                var kind = switch (marker) {
                    case '{' -> TagKind.OUTPUT;
                    case '%' -> TagKind.STATEMENT;
                    default -> TagKind.COMMENT;
                };
                if (kind != TagKind.COMMENT && inner.isEmpty()) {
                    throw new ExpressionException("Empty tag at %d in template".formatted(open));
                }
                pieces.add(new Piece(kind, inner, open));
                trimNextText = trimAfter;
                position = close + 2;
            }
            return pieces;
        }

        private int nextOpening(final int from) {
            int best = -1;
            for (String opening : List.of("{{", "{%", "{#")) {
                int found = source.indexOf(opening, from);
                if (found >= 0 && (best < 0 || found < best)) best = found;
            }
            return best;
        }

        private static void addText(final List<Piece> pieces, final String text, final boolean trimStart,
                                    final boolean trimEnd, final int position) {
            var value = text;
            if (trimStart) value = value.stripLeading();
            if (trimEnd) value = value.stripTrailing();
            if (!value.isEmpty()) pieces.add(new Piece(TagKind.TEXT, value, position));
        }
    }

    private static final class Block {
        private final String keyword;
        private final List<Template.Branch> branches = new ArrayList<>();
        private final List<Template.Node> body = new ArrayList<>();
        private final List<Template.Node> otherwise = new ArrayList<>();
        private boolean inElse;
        private String loopVariable;
        private Expression iterable;

        Block(final String keyword) {
            this.keyword = keyword;
        }

        String keyword() {
            return keyword;
        }

        List<Template.Node> current() {
            if (inElse) return otherwise;
            if (keyword.equals("if")) return branches.get(branches.size() - 1).body();
            return body;
        }
    }
}
