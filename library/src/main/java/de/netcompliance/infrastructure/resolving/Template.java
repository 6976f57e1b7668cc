package de.netcompliance.infrastructure.resolving;

import de.netcompliance.core.exception.ExpressionException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiled template. Immutable and safe to render from several threads.
 */
public final class Template {

    private final String source;
    private final List<Node> nodes;

    Template(final String source, final List<Node> nodes) {
        this.source = source;
        this.nodes = List.copyOf(nodes);
    }

    public String getSource() {
        return source;
    }

    public RenderResult render(final Map<String, Object> scope) {
        var frame = new Frame(new HashMap<>(Objects.isNull(scope) ? Map.of() : scope), new LinkedHashMap<>());
        var out = new StringBuilder();
        renderAll(nodes, frame, out);
        return new RenderResult(out.toString(), frame.assigned());
    }

    private static void renderAll(final List<Node> nodes, final Frame frame, final StringBuilder out) {
        for (Node node : nodes) {
            node.render(frame, out);
        }
    }

    record Frame(Map<String, Object> scope, Map<String, Object> assigned) {
        Frame child() {
            return new Frame(new HashMap<>(scope), new HashMap<>());
        }
    }

    interface Node {
        void render(final Frame frame, final StringBuilder out);
    }

    record Text(String text) implements Node {
        @Override
        public void render(final Frame frame, final StringBuilder out) {
            out.append(text);
        }
    }

    record Output(Expression expression) implements Node {
        @Override
        public void render(final Frame frame, final StringBuilder out) {
            out.append(Values.render(expression.evaluate(frame.scope())));
        }
    }

    record Assignment(String name, Expression expression) implements Node {
        @Override
        public void render(final Frame frame, final StringBuilder out) {
            var value = expression.evaluate(frame.scope());
            frame.scope().put(name, value);
            frame.assigned().put(name, value);
        }
    }

    record Branch(Expression condition, List<Node> body) {
    }

    record Conditional(List<Branch> branches, List<Node> otherwise) implements Node {
        @Override
        public void render(final Frame frame, final StringBuilder out) {
            for (Branch branch : branches) {
                if (branch.condition().test(frame.scope())) {
                    renderAll(branch.body(), frame, out);
                    return;
                }
            }
            renderAll(otherwise, frame, out);
        }
    }

    record Loop(String variable, Expression iterable, List<Node> body, List<Node> otherwise) implements Node {
        @Override
        public void render(final Frame frame, final StringBuilder out) {
            var items = toItems(iterable.evaluate(frame.scope()));
            if (items.isEmpty()) {
                renderAll(otherwise, frame, out);
                return;
            }
            for (int i = 0; i < items.size(); i++) {
                var iteration = frame.child();
                iteration.scope().put(variable, items.get(i));
                var loop = new HashMap<String, Object>();
                loop.put("index", i + 1);
                loop.put("index0", i);
                loop.put("first", i == 0);
                loop.put("last", i == items.size() - 1);
                loop.put("length", items.size());
                iteration.scope().put("loop", loop);
                renderAll(body, iteration, out);
            }
        }

        private static List<Object> toItems(final Object value) {
            if (Objects.isNull(value)) return List.of();
            if (value instanceof Collection<?> collection) return new ArrayList<>(collection);
            if (value instanceof Map<?, ?> map) return new ArrayList<>(map.keySet());
            throw new ExpressionException("Cannot iterate over %s".formatted(value.getClass().getSimpleName()));
        }
    }
}
