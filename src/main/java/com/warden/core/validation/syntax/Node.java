package com.warden.core.validation.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Syntax tree of untrusted content. Every variant is an immutable record carrying its source
 * position; {@link #children()} gives the direct sub-nodes in source order so that visitors can
 * walk the tree without knowing every variant.
 */
public sealed interface Node {

    int line();

    int column();

    List<Node> children();

    /** Collects the non-null nodes and node lists in {@code parts}, preserving order. */
    static List<Node> childrenOf(Object... parts) {
        var out = new ArrayList<Node>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                out.add(node);
            } else if (part instanceof java.util.Collection<?> collection) {
                for (Object item : collection) {
                    if (item instanceof Node node) {
                        out.add(node);
                    }
                }
            }
        }
        return out;
    }

    // ── Statements ─────────────────────────────────────────────────────

    record Module(List<Node> body, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(body); }
    }

    /** {@code import a.b as c, d}. */
    record Import(List<Alias> names, int line, int column) implements Node {
        public List<Node> children() { return List.of(); }
    }

    /** {@code from ..a.b import c as d}; {@code level} is the number of leading dots. */
    record ImportFrom(String module, List<Alias> names, int level, int line, int column) implements Node {
        public List<Node> children() { return List.of(); }
    }

    record Alias(String name, String asName) {
        public String boundName() {
            if (asName != null) {
                return asName;
            }
            int dot = name.indexOf('.');
            return dot < 0 ? name : name.substring(0, dot);
        }
    }

    record FunctionDef(String name, List<Param> params, Node returns, List<Node> decorators,
                       List<Node> body, int line, int column) implements Node {
        public List<Node> children() {
            var defaults = new ArrayList<Node>();
            for (Param p : params) {
                if (p.defaultValue() != null) {
                    defaults.add(p.defaultValue());
                }
                if (p.annotation() != null) {
                    defaults.add(p.annotation());
                }
            }
            return childrenOf(decorators, defaults, returns, body);
        }
    }

    /** Function or lambda parameter; {@code stars} is 0, 1 ({@code *args}) or 2 ({@code **kw}). */
    record Param(String name, Node annotation, Node defaultValue, int stars) {}

    record ClassDef(String name, List<Node> bases, List<Node> decorators, List<Node> body,
                    int line, int column) implements Node {
        public List<Node> children() { return childrenOf(decorators, bases, body); }
    }

    record Return(Node value, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(value); }
    }

    record Assign(List<Node> targets, Node value, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(targets, value); }
    }

    record AugAssign(Node target, String op, Node value, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(target, value); }
    }

    record AnnAssign(Node target, Node annotation, Node value, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(target, annotation, value); }
    }

    record If(Node test, List<Node> body, List<Node> orElse, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(test, body, orElse); }
    }

    record For(Node target, Node iter, List<Node> body, List<Node> orElse, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(target, iter, body, orElse); }
    }

    record While(Node test, List<Node> body, List<Node> orElse, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(test, body, orElse); }
    }

    record Try(List<Node> body, List<Node> handlers, List<Node> orElse, List<Node> finalBody,
               int line, int column) implements Node {
        public List<Node> children() { return childrenOf(body, handlers, orElse, finalBody); }
    }

    record ExceptHandler(Node type, String name, List<Node> body, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(type, body); }
    }

    record With(List<Node> contexts, List<Node> targets, List<Node> body, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(contexts, targets, body); }
    }

    record Raise(Node exception, Node cause, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(exception, cause); }
    }

    record Assert(Node test, Node message, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(test, message); }
    }

    record Delete(List<Node> targets, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(targets); }
    }

    /** {@code global} / {@code nonlocal} declarations. */
    record Scope(String keyword, List<String> names, int line, int column) implements Node {
        public List<Node> children() { return List.of(); }
    }

    /** {@code pass}, {@code break} and {@code continue}. */
    record Keyword(String keyword, int line, int column) implements Node {
        public List<Node> children() { return List.of(); }
    }

    record ExprStatement(Node value, int line, int column) implements Node {
        public List<Node> children() { return List.of(value); }
    }

    // ── Expressions ────────────────────────────────────────────────────

    record Name(String id, int line, int column) implements Node {
        public List<Node> children() { return List.of(); }
    }

    enum LiteralKind { NUMBER, STRING, BYTES, BOOLEAN, NONE, ELLIPSIS }

    /** Literal constant; {@code value} is the decoded string for STRING/BYTES and the source text otherwise. */
    record Literal(LiteralKind kind, String value, int line, int column) implements Node {
        public List<Node> children() { return List.of(); }
    }

    record Attribute(Node value, String attr, int line, int column) implements Node {
        public List<Node> children() { return List.of(value); }
    }

    record Subscript(Node value, Node index, int line, int column) implements Node {
        public List<Node> children() { return List.of(value, index); }
    }

    record Slice(Node lower, Node upper, Node step, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(lower, upper, step); }
    }

    record Call(Node func, List<Node> args, List<KeywordArg> keywords, int line, int column) implements Node {
        public List<Node> children() {
            var values = new ArrayList<Node>();
            for (KeywordArg k : keywords) {
                values.add(k.value());
            }
            return childrenOf(func, args, values);
        }
    }

    /** Keyword argument; {@code name} is null for {@code **mapping}. */
    record KeywordArg(String name, Node value) {}

    record Starred(Node value, int line, int column) implements Node {
        public List<Node> children() { return List.of(value); }
    }

    record BinOp(Node left, String op, Node right, int line, int column) implements Node {
        public List<Node> children() { return List.of(left, right); }
    }

    record UnaryOp(String op, Node operand, int line, int column) implements Node {
        public List<Node> children() { return List.of(operand); }
    }

    record BoolOp(String op, List<Node> values, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(values); }
    }

    record Compare(Node left, List<String> ops, List<Node> comparators, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(left, comparators); }
    }

    record IfExp(Node test, Node body, Node orElse, int line, int column) implements Node {
        public List<Node> children() { return List.of(test, body, orElse); }
    }

    record Lambda(List<Param> params, Node body, int line, int column) implements Node {
        public List<Node> children() {
            var defaults = new ArrayList<Node>();
            for (Param p : params) {
                if (p.defaultValue() != null) {
                    defaults.add(p.defaultValue());
                }
            }
            return childrenOf(defaults, body);
        }
    }

    record NamedExpr(Node target, Node value, int line, int column) implements Node {
        public List<Node> children() { return List.of(target, value); }
    }

    record Yield(Node value, boolean from, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(value); }
    }

    enum SequenceKind { LIST, TUPLE, SET }

    record Sequence(SequenceKind kind, List<Node> elements, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(elements); }
    }

    /** Dict display; a null key marks a {@code **mapping} entry. */
    record Dict(List<Node> keys, List<Node> values, int line, int column) implements Node {
        public List<Node> children() { return childrenOf(keys, values); }
    }

    enum ComprehensionKind { LIST, SET, DICT, GENERATOR }

    record Comprehension(ComprehensionKind kind, Node element, Node value, List<ComprehensionClause> clauses,
                         int line, int column) implements Node {
        public List<Node> children() {
            var parts = new ArrayList<Node>();
            parts.add(element);
            if (value != null) {
                parts.add(value);
            }
            for (ComprehensionClause c : clauses) {
                parts.add(c.target());
                parts.add(c.iter());
                parts.addAll(c.conditions());
            }
            return parts;
        }
    }

    record ComprehensionClause(Node target, Node iter, List<Node> conditions) {}
}
