package com.repo.complexity.syntax.estree;

import com.repo.complexity.core.ComplexityConfig;
import com.repo.complexity.model.Dependency;
import com.repo.complexity.syntax.HalsteadDescriptor;
import com.repo.complexity.syntax.SyntaxEntry;
import com.repo.complexity.syntax.SyntaxTable;
import com.repo.complexity.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Syntax table for ESTree (JavaScript) node types, expressed over the generic
 * {@link SyntaxNode} model.
 *
 * Sub-nodes are children in ESTree field order, e.g. IfStatement is
 * [test, consequent, alternate?] and CallExpression is [callee, arguments...].
 * Scalar fields such as {@code operator}, {@code name}, {@code value},
 * {@code kind} and {@code prefix} are attributes.
 *
 * Optional sub-nodes that are not positional are flagged by attribute instead.
 * Loops carry {@code test: false} when the test is absent ({@code for (;;)});
 * without the attribute they count as tested. A {@code SwitchCase} counts as
 * {@code case} only with a truthy {@code test} attribute and as {@code default}
 * otherwise. ESTree dumps write {@code test: null} for both, which the loader
 * drops, so convert those to {@code test: false} and keep the test
 * expression's presence as {@code test: true} on switch cases.
 *
 * A table keeps the AMD path aliases seen so far, so build one per analysis.
 */
public class EstreeSyntax implements SyntaxTable<SyntaxNode> {

    static final String DYNAMIC_DEPENDENCY = "* dynamic dependency *";

    private final ComplexityConfig config;
    private final Map<String, SyntaxEntry<SyntaxNode>> entries = new HashMap<>();
    private final Map<String, String> amdPathAliases = new HashMap<>();

    public EstreeSyntax(ComplexityConfig config) {
        this.config = config;
        registerStatements();
        registerExpressions();
        registerDeclarations();
    }

    /**
     * Table factory for {@link com.repo.complexity.walk.SyntaxTreeWalker}.
     */
    public static SyntaxTable<SyntaxNode> table(ComplexityConfig config) {
        return new EstreeSyntax(config);
    }

    @Override
    public SyntaxEntry<SyntaxNode> entryFor(SyntaxNode node) {
        return entries.get(node.type());
    }

    private void register(String type, SyntaxEntry.Builder<SyntaxNode> builder) {
        entries.put(type, builder.build());
    }

    private static SyntaxEntry.Builder<SyntaxNode> entry() {
        return SyntaxEntry.builder();
    }

    // === Statements ===

    private void registerStatements() {
        register("BreakStatement", entry().lloc(1).operator("break"));
        register("ContinueStatement", entry().lloc(1).operator("continue"));
        register("DebuggerStatement", entry().lloc(1).operator("debugger"));
        register("ExpressionStatement", entry().lloc(1));
        register("ReturnStatement", entry().lloc(1).operator("return"));
        register("ThrowStatement", entry().lloc(1).operator("throw"));
        register("TryStatement", entry().lloc(1).operator("try"));
        register("WithStatement", entry().lloc(1).operator("with"));
        register("SwitchStatement", entry().lloc(1).operator("switch"));
        register("LabeledStatement", entry().lloc(1).operator("label"));

        register("IfStatement", entry()
                .lloc(node -> hasAlternate(node) ? 2 : 1)
                .complexity(1)
                .operator("if")
                .operator(HalsteadDescriptor.<SyntaxNode>of("else").when(EstreeSyntax::hasAlternate)));

        register("SwitchCase", entry()
                .lloc(1)
                .complexity(node -> config.isSwitchCase() && hasTest(node) ? 1 : 0)
                .operator(HalsteadDescriptor.<SyntaxNode>of("case").when(EstreeSyntax::hasTest))
                .operator(HalsteadDescriptor.<SyntaxNode>of("default").when(node -> !hasTest(node))));

        register("CatchClause", entry()
                .lloc(1)
                .complexity(node -> config.isTryCatch() ? 1 : 0)
                .operator("catch"));

        register("ForStatement", entry()
                .lloc(1)
                .complexity(node -> hasTest(node) ? 1 : 0)
                .operator("for"));
        register("ForInStatement", entry()
                .lloc(1)
                .complexity(node -> config.isForIn() ? 1 : 0)
                .operator("forin"));
        register("ForOfStatement", entry()
                .lloc(1)
                .complexity(node -> config.isForIn() ? 1 : 0)
                .operator("forof"));
        register("WhileStatement", entry()
                .lloc(1)
                .complexity(node -> hasTest(node) ? 1 : 0)
                .operator("while"));
        register("DoWhileStatement", entry()
                .lloc(2)
                .complexity(node -> hasTest(node) ? 1 : 0)
                .operator("dowhile"));
    }

    // === Expressions ===

    private void registerExpressions() {
        register("Identifier", entry().operand(HalsteadDescriptor.<SyntaxNode>computed(node -> node.text("name"))));
        register("Literal", entry().operand(HalsteadDescriptor.<SyntaxNode>computed(EstreeSyntax::literalIdentifier)));
        register("ThisExpression", entry().operand("this"));

        register("ArrayExpression", entry().operator("[]"));
        register("ObjectExpression", entry().operator("{}"));
        register("MemberExpression", entry().operator("."));
        register("Property", entry().lloc(1).operator(":"));
        register("SequenceExpression", entry().operator(","));

        register("AssignmentExpression", entry().operator(operatorAttribute()));
        register("BinaryExpression", entry().operator(operatorAttribute()));
        register("UnaryExpression", entry().operator(operatorAttribute()));
        register("UpdateExpression", entry().operator(HalsteadDescriptor.<SyntaxNode>computed(
                node -> node.text("operator") + (Boolean.TRUE.equals(node.attribute("prefix")) ? " (prefix)" : " (postfix)"))));

        register("LogicalExpression", entry()
                .complexity(node -> {
                    String operator = node.text("operator");
                    boolean isAnd = "&&".equals(operator);
                    boolean isOr = "||".equals(operator);
                    return isAnd || (config.isLogicalOr() && isOr) ? 1 : 0;
                })
                .operator(operatorAttribute()));

        register("ConditionalExpression", entry().complexity(1).operator(":?"));

        register("CallExpression", entry()
                .lloc(node -> calleeIsFunction(node) ? 1 : 0)
                .operator("()")
                .dependencies(this::dependenciesOf));
        register("NewExpression", entry()
                .lloc(node -> calleeIsFunction(node) ? 1 : 0)
                .operator("new"));
    }

    // === Declarations ===

    private void registerDeclarations() {
        register("FunctionDeclaration", entry()
                .lloc(1)
                .operator("function")
                .operand(HalsteadDescriptor.<SyntaxNode>computed(node -> node.text("name"))
                        .when(node -> node.attribute("name") != null))
                .newScope());
        register("FunctionExpression", entry()
                .operator("function")
                .operand(HalsteadDescriptor.<SyntaxNode>computed(node -> node.text("name"))
                        .when(node -> node.attribute("name") != null))
                .newScope());
        register("ArrowFunctionExpression", entry()
                .operator("=>")
                .newScope());

        register("VariableDeclaration", entry()
                .lloc(1)
                .operator(HalsteadDescriptor.<SyntaxNode>computed(node -> Optional.ofNullable(node.text("kind")).orElse("var"))));
        register("VariableDeclarator", entry()
                .operator(HalsteadDescriptor.<SyntaxNode>of("=").when(node -> node.children().size() > 1)));
    }

    // === Dependencies ===

    private Object dependenciesOf(SyntaxNode call, boolean clearAliases) {
        if (clearAliases) {
            amdPathAliases.clear();
        }

        Optional<SyntaxNode> callee = call.child(0);
        if (callee.isEmpty()) {
            return null;
        }

        if (isIdentifier(callee.get(), "require")) {
            return processRequire(call);
        }

        if (isIdentifier(callee.get(), "define")) {
            return processDefine(call);
        }

        if (isRequireConfig(callee.get())) {
            call.child(1).ifPresent(this::recordAmdPathAliases);
        }
        return null;
    }

    private Object processRequire(SyntaxNode call) {
        List<SyntaxNode> arguments = call.children().subList(1, call.children().size());
        int line = call.getLocation().map(l -> l.startLine()).orElse(0);

        if (arguments.size() == 1) {
            return new Dependency(line, literalPath(arguments.get(0)), "CommonJS");
        }

        if (arguments.size() == 2) {
            SyntaxNode modules = arguments.get(0);
            if (!modules.is("ArrayExpression")) {
                return new Dependency(line, DYNAMIC_DEPENDENCY, "AMD");
            }
            return amdDependencies(line, modules);
        }

        return null;
    }

    /**
     * {@code define([deps], factory)} and {@code define("id", [deps], factory)}.
     * A define without a dependency array declares nothing.
     */
    private Object processDefine(SyntaxNode call) {
        int line = call.getLocation().map(l -> l.startLine()).orElse(0);
        for (SyntaxNode argument : call.children().subList(1, call.children().size())) {
            if (argument.is("ArrayExpression")) {
                return amdDependencies(line, argument);
            }
        }
        return null;
    }

    private List<Dependency> amdDependencies(int line, SyntaxNode modules) {
        List<Dependency> dependencies = new ArrayList<>();
        for (SyntaxNode element : modules.children()) {
            String path = literalPath(element);
            dependencies.add(new Dependency(line, amdPathAliases.getOrDefault(path, path), "AMD"));
        }
        return dependencies;
    }

    private void recordAmdPathAliases(SyntaxNode configObject) {
        if (!configObject.is("ObjectExpression")) {
            return;
        }
        for (SyntaxNode property : configObject.children()) {
            if (!property.is("Property") || !"paths".equals(property.text("key"))) {
                continue;
            }
            property.child(0)
                    .filter(paths -> paths.is("ObjectExpression"))
                    .ifPresent(paths -> {
                        for (SyntaxNode alias : paths.children()) {
                            String key = alias.text("key");
                            Optional<SyntaxNode> value = alias.child(0);
                            if (key != null && value.isPresent() && value.get().is("Literal")) {
                                amdPathAliases.put(key, value.get().text("value"));
                            }
                        }
                    });
        }
    }

    // === Node shape helpers ===

    private static HalsteadDescriptor<SyntaxNode> operatorAttribute() {
        return HalsteadDescriptor.<SyntaxNode>computed(node -> node.text("operator"));
    }

    static boolean hasAlternate(SyntaxNode node) {
        return node.children().size() > 2;
    }

    /**
     * Loops and switch cases carry their test as the {@code test} attribute;
     * an explicit {@code test: false} marks an absent test.
     */
    static boolean hasTest(SyntaxNode node) {
        Object test = node.attribute("test");
        if (node.is("SwitchCase")) {
            return test != null && !Boolean.FALSE.equals(test);
        }
        return !Boolean.FALSE.equals(test);
    }

    private static boolean calleeIsFunction(SyntaxNode node) {
        return node.child(0).map(callee -> callee.is("FunctionExpression")).orElse(false);
    }

    private static boolean isIdentifier(SyntaxNode node, String name) {
        return node.is("Identifier") && name.equals(node.text("name"));
    }

    private static boolean isRequireConfig(SyntaxNode callee) {
        return callee.is("MemberExpression")
                && callee.child(0).map(object -> isIdentifier(object, "require")).orElse(false)
                && callee.child(1).map(property -> isIdentifier(property, "config")).orElse(false);
    }

    private static String literalPath(SyntaxNode node) {
        Object value = node.attribute("value");
        if (node.is("Literal") && value instanceof String) {
            return (String) value;
        }
        return DYNAMIC_DEPENDENCY;
    }

    private static Object literalIdentifier(SyntaxNode node) {
        Object value = node.attribute("value");
        if (value instanceof String) {
            return "\"" + value + "\"";
        }
        return value;
    }
}
