package com.warden.core.validation;

import com.warden.core.model.Violation;
import com.warden.core.model.ViolationKind;
import com.warden.core.policy.CapabilitySet;
import com.warden.core.policy.ValidationLimits;
import com.warden.core.validation.syntax.Node;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Capability check for factor expressions. Only data-field names, numeric literals, arithmetic,
 * comparisons, boolean logic, conditionals and direct calls to registered operators are allowed.
 */
public final class ExpressionValidator {

    private final Set<String> operators;
    private final CapabilitySet capabilities;
    private final ValidationLimits limits;
    private final Set<Violation> violations = new LinkedHashSet<>();
    private int nodes;
    private int maxDepthSeen;
    private int complexity = 1;

    private ExpressionValidator(Set<String> operators, CapabilitySet capabilities, ValidationLimits limits) {
        this.operators = operators;
        this.capabilities = capabilities;
        this.limits = limits;
    }

    public static List<Violation> validate(Node expression, Set<String> operators, CapabilitySet capabilities,
                                           ValidationLimits limits) {
        var validator = new ExpressionValidator(operators, capabilities, limits);
        validator.visit(expression, 0);
        validator.checkStructure();
        return List.copyOf(validator.violations);
    }

    private void visit(Node node, int depth) {
        nodes++;
        maxDepthSeen = Math.max(maxDepthSeen, depth);
        complexity += CapabilityValidator.complexityOf(node);

        List<Node> children = node.children();
        if (node instanceof Node.Name name) {
            checkName(name);
        } else if (node instanceof Node.Literal lit) {
            if (lit.kind() != Node.LiteralKind.NUMBER && lit.kind() != Node.LiteralKind.BOOLEAN) {
                add(ViolationKind.VALIDATION_FAILED,
                        lit.kind().name().toLowerCase() + " literals are not permitted in expressions", node);
            }
        } else if (node instanceof Node.Call call) {
            checkCall(call);
            children = children.subList(1, children.size());
        } else if (node instanceof Node.UnaryOp unary) {
            if ("await".equals(unary.op())) {
                add(ViolationKind.VALIDATION_FAILED, "await is not permitted in expressions", node);
            }
        } else if (node instanceof Node.Attribute attr) {
            if (CapabilityValidator.isDunder(attr.attr())) {
                add(ViolationKind.BLACKLIST_DETECTED, "Dunder attribute access: " + attr.attr(), node);
            } else {
                add(ViolationKind.VALIDATION_FAILED, "Attribute access is not permitted in expressions: ."
                        + attr.attr(), node);
            }
        } else if (!(node instanceof Node.BinOp || node instanceof Node.Compare
                || node instanceof Node.BoolOp || node instanceof Node.IfExp)) {
            add(ViolationKind.VALIDATION_FAILED,
                    node.getClass().getSimpleName() + " is not permitted in expressions", node);
        }

        for (Node child : children) {
            visit(child, depth + 1);
        }
    }

    // Plain names are data fields (open, close, volume, ...) and resolve only against the input series.
    private void checkName(Node.Name name) {
        if (CapabilityValidator.isDunder(name.id())) {
            add(ViolationKind.BLACKLIST_DETECTED, "Dunder name access: " + name.id(), name);
        }
    }

    private void checkCall(Node.Call call) {
        if (!(call.func() instanceof Node.Name name)) {
            String dotted = CapabilityValidator.dottedName(call.func());
            if (dotted != null && (capabilities.deniedCalls().contains(dotted)
                    || capabilities.isModuleDenied(dotted.substring(0, dotted.indexOf('.'))))) {
                add(ViolationKind.BLACKLIST_DETECTED, "Denied call: " + dotted, call);
            } else {
                add(ViolationKind.VALIDATION_FAILED, "Only direct operator calls are permitted", call);
            }
            return;
        }
        String id = name.id();
        if (capabilities.deniedCalls().contains(id) || CapabilityValidator.isDunder(id)) {
            add(ViolationKind.BLACKLIST_DETECTED, "Denied call: " + id, call);
        } else if (!operators.contains(id)) {
            add(ViolationKind.VALIDATION_FAILED, "Operator not in registry: " + id, call);
        }
        for (Node.KeywordArg keyword : call.keywords()) {
            if (keyword.name() == null) {
                add(ViolationKind.VALIDATION_FAILED, "Keyword unpacking is not permitted in expressions", call);
            }
        }
    }

    private void checkStructure() {
        if (maxDepthSeen > limits.maxDepth()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Expression depth " + maxDepthSeen + " exceeds limit " + limits.maxDepth()));
        }
        if (nodes > limits.maxNodes()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Expression has " + nodes + " nodes, limit is " + limits.maxNodes()));
        }
        if (complexity > limits.maxComplexity()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Cyclomatic complexity " + complexity + " exceeds limit " + limits.maxComplexity()));
        }
    }

    private void add(ViolationKind kind, String detail, Node at) {
        violations.add(new Violation(kind, detail, at.line(), at.column()));
    }
}
