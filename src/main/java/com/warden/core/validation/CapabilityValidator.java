package com.warden.core.validation;

import com.warden.core.model.Violation;
import com.warden.core.model.ViolationKind;
import com.warden.core.policy.CapabilitySet;
import com.warden.core.policy.ValidationLimits;
import com.warden.core.validation.syntax.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks a CODE syntax tree and classifies every import, call and name reference against a
 * {@link CapabilitySet}. All violations are collected; the walk never stops at the first one.
 * <p>
 * In {@link Mode#DENY_ONLY} only denied calls, denied modules and forbidden destinations are
 * reported. That mode is used for content that was submitted as prose or configuration but
 * looks like code.
 */
public final class CapabilityValidator {

    public enum Mode { FULL, DENY_ONLY }

    /**
     * Static check of a destination written into content.
     */
    @FunctionalInterface
    public interface DestinationCheck {
        /** Reason the destination is denied, or empty when it is permitted. */
        Optional<String> denialReason(String destination);
    }

    static final Set<String> NETWORK_MODULES = Set.of(
            "socket", "urllib", "urllib2", "urllib3", "http", "requests", "httpx", "aiohttp", "ftplib",
            "telnetlib", "smtplib", "poplib", "imaplib", "ssl", "websocket", "websockets", "xmlrpc", "paramiko");

    private static final Set<String> SAFE_DUNDER_NAMES = Set.of("__name__", "__doc__");
    private static final Set<String> SAFE_DUNDER_ATTRIBUTES = Set.of("__init__", "__name__", "__doc__");
    private static final Set<String> DYNAMIC_EXECUTION = Set.of("eval", "exec", "compile");
    private static final Set<String> INSTANCE_RECEIVERS = Set.of("self", "cls");
    // Method names shared with builtin containers; only denied on a resolved module path.
    private static final Set<String> CONTAINER_METHODS = Set.of("remove");
    // os.exec*/os.spawn* variants: execv, execlp, spawnvpe, ...
    private static final Pattern CALL_VARIANT_SUFFIX = Pattern.compile("[lpve]{1,3}");

    static final Pattern DESTINATION = Pattern.compile(
            "\\b(?:https?|ftp|wss?|tcp|udp)://[^\\s'\"<>]+", Pattern.CASE_INSENSITIVE);

    private final CapabilitySet capabilities;
    private final ValidationLimits limits;
    private final Mode mode;
    private final DestinationCheck destinations;

    private final Set<String> locals = new HashSet<>();
    private final Map<String, String> aliases = new HashMap<>();
    private final Set<String> importedRoots = new LinkedHashSet<>();
    private final Set<Violation> violations = new LinkedHashSet<>();
    private int nodes;
    private int maxDepthSeen;
    private int complexity = 1;

    private CapabilityValidator(CapabilitySet capabilities, ValidationLimits limits, Mode mode,
                                DestinationCheck destinations) {
        this.capabilities = capabilities;
        this.limits = limits;
        this.mode = mode;
        this.destinations = destinations == null ? d -> Optional.empty() : destinations;
    }

    /**
     * Validates a parsed module.
     *
     * @return violations in source order, structural limits last
     */
    public static List<Violation> validate(Node.Module module, CapabilitySet capabilities, ValidationLimits limits,
                                           Mode mode, DestinationCheck destinations) {
        var validator = new CapabilityValidator(capabilities, limits, mode, destinations);
        validator.collectBindings(module);
        validator.visit(module, 0);
        validator.checkStructure();
        return List.copyOf(validator.violations);
    }

    /** Checks every destination-looking substring of a string literal. */
    static List<Violation> checkDestinations(String text, int line, int column, DestinationCheck check) {
        var found = new ArrayList<Violation>();
        Matcher m = DESTINATION.matcher(text);
        while (m.find()) {
            String destination = m.group();
            check.denialReason(destination).ifPresent(reason -> found.add(new Violation(
                    ViolationKind.NETWORK_VIOLATION, "Network destination denied: " + destination + " (" + reason + ")",
                    line, column)));
        }
        return found;
    }

    // ── bindings ───────────────────────────────────────────────────────

    private void collectBindings(Node node) {
        if (node instanceof Node.Import imp) {
            for (Node.Alias alias : imp.names()) {
                aliases.put(alias.boundName(), alias.asName() != null ? alias.name() : alias.boundName());
            }
        } else if (node instanceof Node.ImportFrom from) {
            for (Node.Alias alias : from.names()) {
                if (!"*".equals(alias.name())) {
                    String prefix = from.level() == 0 ? from.module() + "." : "";
                    aliases.put(alias.boundName(), prefix + alias.name());
                }
            }
        } else if (node instanceof Node.Assign assign) {
            assign.targets().forEach(this::bindTarget);
        } else if (node instanceof Node.AugAssign aug) {
            bindTarget(aug.target());
        } else if (node instanceof Node.AnnAssign ann) {
            bindTarget(ann.target());
        } else if (node instanceof Node.For loop) {
            bindTarget(loop.target());
        } else if (node instanceof Node.With with) {
            with.targets().forEach(this::bindTarget);
        } else if (node instanceof Node.NamedExpr named) {
            bindTarget(named.target());
        } else if (node instanceof Node.FunctionDef def) {
            locals.add(def.name());
            def.params().forEach(p -> locals.add(p.name()));
        } else if (node instanceof Node.Lambda lambda) {
            lambda.params().forEach(p -> locals.add(p.name()));
        } else if (node instanceof Node.ClassDef cls) {
            locals.add(cls.name());
        } else if (node instanceof Node.ExceptHandler handler && handler.name() != null) {
            locals.add(handler.name());
        } else if (node instanceof Node.Comprehension comp) {
            comp.clauses().forEach(c -> bindTarget(c.target()));
        } else if (node instanceof Node.Scope scope) {
            locals.addAll(scope.names());
        }
        for (Node child : node.children()) {
            collectBindings(child);
        }
    }

    private void bindTarget(Node target) {
        if (target instanceof Node.Name name) {
            locals.add(name.id());
        } else if (target instanceof Node.Sequence seq) {
            seq.elements().forEach(this::bindTarget);
        } else if (target instanceof Node.Starred starred) {
            bindTarget(starred.value());
        }
    }

    // ── walk ───────────────────────────────────────────────────────────

    private void visit(Node node, int depth) {
        nodes++;
        maxDepthSeen = Math.max(maxDepthSeen, depth);
        complexity += complexityOf(node);

        List<Node> children = node.children();
        if (node instanceof Node.Import imp) {
            imp.names().forEach(alias -> checkModule(alias.name(), imp));
        } else if (node instanceof Node.ImportFrom from) {
            checkImportFrom(from);
        } else if (node instanceof Node.Call call) {
            checkCall(call);
            if (call.func() instanceof Node.Name) {
                children = children.subList(1, children.size());
            }
        } else if (node instanceof Node.Attribute attr) {
            checkAttribute(attr);
        } else if (node instanceof Node.Name name) {
            checkName(name);
        } else if (node instanceof Node.Literal lit && lit.kind() == Node.LiteralKind.STRING) {
            violations.addAll(checkDestinations(lit.value(), lit.line(), lit.column(), destinations));
        }

        for (Node child : children) {
            visit(child, depth + 1);
        }
    }

    private void checkModule(String dotted, Node at) {
        String root = rootOf(dotted);
        importedRoots.add(root);
        if (capabilities.isModuleDenied(dotted)) {
            add(ViolationKind.BLACKLIST_DETECTED, "Denied module import: " + dotted, at);
        } else if (mode == Mode.FULL && !capabilities.isModuleAllowed(dotted)) {
            add(ViolationKind.VALIDATION_FAILED, "Module not in allow-list: " + dotted, at);
        }
        if (NETWORK_MODULES.contains(root)) {
            add(ViolationKind.NETWORK_VIOLATION, "Network module import: " + dotted, at);
        }
    }

    private void checkImportFrom(Node.ImportFrom from) {
        if (from.level() > 0) {
            if (mode == Mode.FULL) {
                add(ViolationKind.VALIDATION_FAILED, "Relative import not permitted: "
                        + ".".repeat(from.level()) + from.module(), from);
            }
            return;
        }
        checkModule(from.module(), from);
        for (Node.Alias alias : from.names()) {
            if ("*".equals(alias.name())) {
                if (mode == Mode.FULL) {
                    add(ViolationKind.VALIDATION_FAILED, "Wildcard import from " + from.module(), from);
                }
                continue;
            }
            String full = from.module() + "." + alias.name();
            if (isDeniedCall(full) || capabilities.deniedCalls().contains(alias.name())) {
                add(ViolationKind.BLACKLIST_DETECTED, "Denied call import: " + full, from);
            }
            if (namesDeniedModule(alias.name())) {
                add(ViolationKind.BLACKLIST_DETECTED, "Denied module reached through import: " + full, from);
            } else if (mode == Mode.FULL && isPrivate(alias.name())) {
                add(ViolationKind.BLACKLIST_DETECTED, "Private name import: " + full, from);
            }
        }
    }

    private void checkCall(Node.Call call) {
        Node func = call.func();
        if (func instanceof Node.Name name) {
            String id = name.id();
            String resolved = aliases.getOrDefault(id, id);
            if (isDeniedCall(id) || isDeniedCall(resolved)) {
                add(ViolationKind.BLACKLIST_DETECTED,
                        "Denied call: " + (resolved.equals(id) ? id : id + " (" + resolved + ")"), call);
            } else if (isDunder(id) && !SAFE_DUNDER_NAMES.contains(id)) {
                add(ViolationKind.BLACKLIST_DETECTED, "Dunder name access: " + id, call);
            } else if (mode == Mode.FULL && !aliases.containsKey(id) && !locals.contains(id)
                    && !capabilities.allowedCalls().contains(id)) {
                add(ViolationKind.VALIDATION_FAILED, "Call to function not in allow-list: " + id, call);
            }
            return;
        }
        String dotted = dottedName(func);
        if (dotted != null) {
            String root = rootOf(dotted);
            String full = aliases.containsKey(root) && !locals.contains(root)
                    ? aliases.get(root) + dotted.substring(root.length())
                    : dotted;
            if (isDeniedCall(full) || isDeniedCall(dotted)) {
                add(ViolationKind.BLACKLIST_DETECTED, "Denied call: " + full, call);
                return;
            }
        }
        if (func instanceof Node.Attribute attr && isDeniedMethod(attr)) {
            add(ViolationKind.BLACKLIST_DETECTED, "Denied call: ." + attr.attr() + "()", call);
        }
    }

    private void checkAttribute(Node.Attribute attr) {
        String name = attr.attr();
        if (isDunder(name)) {
            if (!SAFE_DUNDER_ATTRIBUTES.contains(name)) {
                add(ViolationKind.BLACKLIST_DETECTED, "Dunder attribute access: " + name, attr);
            }
            return;
        }
        boolean instanceAccess = attr.value() instanceof Node.Name receiver
                && INSTANCE_RECEIVERS.contains(receiver.id()) && locals.contains(receiver.id());
        if (instanceAccess) {
            return;
        }
        if (namesDeniedModule(name)) {
            add(ViolationKind.BLACKLIST_DETECTED, "Denied module reached through attribute: " + name, attr);
        } else if (mode == Mode.FULL && isPrivate(name)) {
            add(ViolationKind.BLACKLIST_DETECTED, "Private attribute access: " + name, attr);
        }
    }

    /**
     * A method call whose name is the last segment of a denied call ({@code .system}, {@code .check_output})
     * is denied on any receiver, except on a plain import of an allowed module.
     */
    private boolean isDeniedMethod(Node.Attribute attr) {
        String name = attr.attr();
        if (DYNAMIC_EXECUTION.contains(name) && capabilities.deniedCalls().contains(name)) {
            return true;
        }
        if (attr.value() instanceof Node.Name receiver && aliases.containsKey(receiver.id())
                && !locals.contains(receiver.id())) {
            String module = aliases.get(receiver.id());
            if (capabilities.isModuleAllowed(module) && !capabilities.isModuleDenied(module)) {
                return false;
            }
        }
        for (String denied : capabilities.deniedCalls()) {
            int dot = denied.lastIndexOf('.');
            if (dot < 0) {
                continue;
            }
            String suffix = denied.substring(dot + 1);
            if (name.equals(suffix)) {
                return !CONTAINER_METHODS.contains(name) || resolvesToDeniedModule(attr.value());
            }
            if (name.startsWith(suffix) && CALL_VARIANT_SUFFIX.matcher(name.substring(suffix.length())).matches()) {
                return true;
            }
        }
        return false;
    }

    private boolean resolvesToDeniedModule(Node receiver) {
        String dotted = dottedName(receiver);
        if (dotted == null) {
            return false;
        }
        String root = rootOf(dotted);
        String full = aliases.containsKey(root) && !locals.contains(root)
                ? aliases.get(root) + dotted.substring(root.length())
                : dotted;
        return capabilities.isModuleDenied(full);
    }

    /** {@code os}, and private re-exports such as {@code _os} or {@code __sys}. */
    private boolean namesDeniedModule(String name) {
        String stripped = name;
        while (true) {
            if (capabilities.deniedModules().contains(stripped)) {
                return true;
            }
            if (!stripped.startsWith("_") || stripped.length() == 1) {
                return false;
            }
            stripped = stripped.substring(1);
        }
    }

    private void checkName(Node.Name name) {
        String id = name.id();
        if (isDunder(id) && !SAFE_DUNDER_NAMES.contains(id)) {
            add(ViolationKind.BLACKLIST_DETECTED, "Dunder name access: " + id, name);
            return;
        }
        if (locals.contains(id) || aliases.containsKey(id)) {
            return;
        }
        if (capabilities.deniedCalls().contains(id)) {
            add(ViolationKind.BLACKLIST_DETECTED, "Reference to denied call: " + id, name);
        } else if (capabilities.isModuleDenied(id)) {
            add(ViolationKind.BLACKLIST_DETECTED, "Reference to denied module: " + id, name);
        }
    }

    private void checkStructure() {
        if (maxDepthSeen > limits.maxDepth()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Syntax tree depth " + maxDepthSeen + " exceeds limit " + limits.maxDepth()));
        }
        if (nodes > limits.maxNodes()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Syntax tree has " + nodes + " nodes, limit is " + limits.maxNodes()));
        }
        if (complexity > limits.maxComplexity()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    "Cyclomatic complexity " + complexity + " exceeds limit " + limits.maxComplexity()));
        }
        if (importedRoots.size() > limits.maxImports()) {
            violations.add(Violation.of(ViolationKind.VALIDATION_FAILED,
                    importedRoots.size() + " distinct imported modules, limit is " + limits.maxImports()));
        }
    }

    private boolean isDeniedCall(String name) {
        if (capabilities.deniedCalls().contains(name)) {
            return true;
        }
        // Dotted entries also deny their suffixed variants (os.exec covers os.execv, os.execl, ...).
        for (String denied : capabilities.deniedCalls()) {
            if (denied.indexOf('.') > 0 && name.startsWith(denied)) {
                return true;
            }
        }
        return false;
    }

    private void add(ViolationKind kind, String detail, Node at) {
        violations.add(new Violation(kind, detail, at.line(), at.column()));
    }

    static int complexityOf(Node node) {
        if (node instanceof Node.If || node instanceof Node.For || node instanceof Node.While
                || node instanceof Node.ExceptHandler || node instanceof Node.With || node instanceof Node.IfExp) {
            return 1;
        }
        if (node instanceof Node.BoolOp boolOp) {
            return boolOp.values().size() - 1;
        }
        if (node instanceof Node.Comprehension comp) {
            int n = 0;
            for (Node.ComprehensionClause clause : comp.clauses()) {
                n += 1 + clause.conditions().size();
            }
            return n;
        }
        return 0;
    }

    /** {@code a.b.c} for a pure name/attribute chain, null otherwise. */
    static String dottedName(Node node) {
        if (node instanceof Node.Name name) {
            return name.id();
        }
        if (node instanceof Node.Attribute attr) {
            String base = dottedName(attr.value());
            return base == null ? null : base + "." + attr.attr();
        }
        return null;
    }

    static boolean isPrivate(String id) {
        return id.startsWith("_") && !isDunder(id);
    }

    static boolean isDunder(String id) {
        return id.length() > 4 && id.startsWith("__") && id.endsWith("__");
    }

    private static String rootOf(String dotted) {
        int dot = dotted.indexOf('.');
        return dot < 0 ? dotted : dotted.substring(0, dot);
    }
}
