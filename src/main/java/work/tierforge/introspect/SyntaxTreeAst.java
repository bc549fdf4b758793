package work.tierforge.introspect;

import io.pebbletemplates.pebble.node.ArgumentsNode;
import io.pebbletemplates.pebble.node.AutoEscapeNode;
import io.pebbletemplates.pebble.node.BlockNode;
import io.pebbletemplates.pebble.node.BodyNode;
import io.pebbletemplates.pebble.node.ExtendsNode;
import io.pebbletemplates.pebble.node.ForNode;
import io.pebbletemplates.pebble.node.IfNode;
import io.pebbletemplates.pebble.node.ImportNode;
import io.pebbletemplates.pebble.node.IncludeNode;
import io.pebbletemplates.pebble.node.MacroNode;
import io.pebbletemplates.pebble.node.NamedArgumentNode;
import io.pebbletemplates.pebble.node.ParallelNode;
import io.pebbletemplates.pebble.node.PositionalArgumentNode;
import io.pebbletemplates.pebble.node.PrintNode;
import io.pebbletemplates.pebble.node.RenderableNode;
import io.pebbletemplates.pebble.node.SetNode;
import io.pebbletemplates.pebble.node.TestInvocationExpression;
import io.pebbletemplates.pebble.node.expression.ArrayExpression;
import io.pebbletemplates.pebble.node.expression.BinaryExpression;
import io.pebbletemplates.pebble.node.expression.BlockFunctionExpression;
import io.pebbletemplates.pebble.node.expression.ContextVariableExpression;
import io.pebbletemplates.pebble.node.expression.Expression;
import io.pebbletemplates.pebble.node.expression.FilterExpression;
import io.pebbletemplates.pebble.node.expression.FilterInvocationExpression;
import io.pebbletemplates.pebble.node.expression.FunctionOrMacroInvocationExpression;
import io.pebbletemplates.pebble.node.expression.GetAttributeExpression;
import io.pebbletemplates.pebble.node.expression.LiteralStringExpression;
import io.pebbletemplates.pebble.node.expression.MapExpression;
import io.pebbletemplates.pebble.node.expression.TernaryExpression;
import io.pebbletemplates.pebble.node.expression.UnaryExpression;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.tierforge.error.TemplateSyntaxException;
import work.tierforge.template.ConditionExpression;
import work.tierforge.template.ParsedTemplate;

/**
 * {@link TemplateAst} over the engine's syntax tree. The tree is walked once with scope tracking so
 * that names bound inside the template are not reported as inputs.
 */
public final class SyntaxTreeAst implements TemplateAst {
    private static final Set<String> GLOBALS = Set.of("locale", "template", "_context");

    private final ParsedTemplate template;
    private final Set<String> freeNames;
    private final Set<String> testOnlyNames;
    private final List<FilterApplication> filterApplications;

    public SyntaxTreeAst(ParsedTemplate template) {
        this.template = template;
        var walker = new Walker();
        walker.walkTemplate(template);
        this.freeNames = Collections.unmodifiableSet(walker.references.keySet());
        var testOnly = new LinkedHashSet<String>();
        walker.references.forEach((name, outsideTest) -> {
            if (!outsideTest) {
                testOnly.add(name);
            }
        });
        this.testOnlyNames = Collections.unmodifiableSet(testOnly);
        this.filterApplications = List.copyOf(walker.filters);
    }

    @Override
    public String templateName() {
        return template.name();
    }

    @Override
    public Optional<String> findExtendsTarget() {
        var extendsNode = template.extendsNode();
        if (extendsNode.isEmpty()) {
            return Optional.empty();
        }
        if (extendsNode.get().getParentExpression() instanceof LiteralStringExpression literal) {
            return Optional.of(literal.getValue());
        }
        throw new TemplateSyntaxException(
            template.name(), extendsNode.get().getLineNumber(), "extends target must be a string literal"
        );
    }

    @Override
    public List<FilterApplication> findFilterApplications(String filterName) {
        var matches = new ArrayList<FilterApplication>();
        for (var application : filterApplications) {
            if (application.filterName().equals(filterName)) {
                matches.add(application);
            }
        }
        return matches;
    }

    @Override
    public Set<String> findConditionalTestVariables() {
        return testOnlyNames;
    }

    @Override
    public Set<String> findFreeVariableNames() {
        return freeNames;
    }

    @Override
    public String toString() {
        return "SyntaxTreeAst[" + template.name() + "]";
    }

    private static final class Walker {
        // name -> referenced at least once outside an if/elif test
        private final Map<String, Boolean> references = new LinkedHashMap<>();
        private final List<FilterApplication> filters = new ArrayList<>();
        private final Deque<Set<String>> scopes = new ArrayDeque<>();
        private boolean inTest;

        void walkTemplate(ParsedTemplate template) {
            // import aliases are visible anywhere in the template
            scopes.push(new HashSet<>(template.importAliases()));
            walk(template.root().getBody());
            scopes.pop();
        }

        private void walk(BodyNode body) {
            if (body == null) {
                return;
            }
            for (RenderableNode node : body.getChildren()) {
                walk(node);
            }
        }

        private void walk(RenderableNode node) {
            if (node instanceof PrintNode print) {
                expr(print.getExpression());
            } else if (node instanceof IfNode conditional) {
                for (var branch : conditional.getConditionsWithBodies()) {
                    condition(branch.getLeft());
                    walk(branch.getRight());
                }
                walk(conditional.getElseBody());
            } else if (node instanceof ForNode loop) {
                expr(loop.getIterable());
                scopes.push(new HashSet<>(List.of(loop.getIterationVariable(), "loop")));
                walk(loop.getBody());
                scopes.pop();
                walk(loop.getElseBody());
            } else if (node instanceof SetNode set) {
                expr(set.getValue());
                bind(set.getName());
            } else if (node instanceof BlockNode block) {
                scopes.push(new HashSet<>());
                walk(block.getBody());
                scopes.pop();
            } else if (node instanceof MacroNode macro) {
                var macroScope = new HashSet<String>();
                for (NamedArgumentNode param : macro.getArgs().getNamedArgs()) {
                    if (param.getValueExpression() != null) {
                        expr(param.getValueExpression());
                    }
                    macroScope.add(param.getName());
                }
                // macros see only their arguments
                var outer = new ArrayDeque<>(scopes);
                scopes.clear();
                scopes.push(macroScope);
                walk(macro.getBody());
                scopes.clear();
                outer.descendingIterator().forEachRemaining(scopes::push);
            } else if (node instanceof ImportNode importNode) {
                expr(importNode.getImportExpression());
            } else if (node instanceof IncludeNode include) {
                expr(include.getIncludeExpression());
            } else if (node instanceof ExtendsNode extendsNode) {
                expr(extendsNode.getParentExpression());
            } else if (node instanceof AutoEscapeNode autoEscape) {
                walk(autoEscape.getBody());
            } else if (node instanceof ParallelNode parallel) {
                walk(parallel.getBody());
            }
        }

        private void condition(Expression<?> test) {
            boolean previous = inTest;
            inTest = true;
            expr(test instanceof ConditionExpression condition ? condition.getTest() : test);
            inTest = previous;
        }

        private void expr(Expression<?> expr) {
            if (expr == null) {
                return;
            }
            if (expr instanceof ContextVariableExpression variable) {
                reference(variable.getName());
            } else if (expr instanceof ConditionExpression condition) {
                condition(condition);
            } else if (expr instanceof FilterExpression filter) {
                var invocation = (FilterInvocationExpression) filter.getRightExpression();
                String operandName = null;
                if (filter.getLeftExpression() instanceof ContextVariableExpression variable && !isBound(variable.getName())) {
                    operandName = variable.getName();
                }
                filters.add(new FilterApplication(invocation.getFilterName(), operandName, invocation.getLineNumber()));
                expr(filter.getLeftExpression());
                args(invocation.getArgs());
            } else if (expr instanceof BinaryExpression<?> binary) {
                expr(binary.getLeftExpression());
                if (binary.getRightExpression() instanceof TestInvocationExpression test) {
                    args(test.getArgs());
                } else {
                    expr(binary.getRightExpression());
                }
            } else if (expr instanceof UnaryExpression unary) {
                expr(unary.getChildExpression());
            } else if (expr instanceof TernaryExpression ternary) {
                expr(ternary.getExpression1());
                expr(ternary.getExpression2());
                expr(ternary.getExpression3());
            } else if (expr instanceof GetAttributeExpression attribute) {
                expr(attribute.getNode());
                expr(attribute.getAttributeNameExpression());
                args(attribute.getArgumentsNode());
            } else if (expr instanceof FunctionOrMacroInvocationExpression call) {
                args(call.getArguments());
            } else if (expr instanceof ArrayExpression array) {
                array.getValues().forEach(this::expr);
            } else if (expr instanceof MapExpression map) {
                map.getEntries().forEach((key, value) -> {
                    expr(key);
                    expr(value);
                });
            } else if (expr instanceof BlockFunctionExpression block) {
                expr(block.getBlockNameExpression());
            }
        }

        private void args(ArgumentsNode args) {
            if (args == null) {
                return;
            }
            if (args.getPositionalArgs() != null) {
                for (PositionalArgumentNode arg : args.getPositionalArgs()) {
                    expr(arg.getValueExpression());
                }
            }
            if (args.getNamedArgs() != null) {
                for (NamedArgumentNode arg : args.getNamedArgs()) {
                    expr(arg.getValueExpression());
                }
            }
        }

        private void reference(String name) {
            if (isBound(name) || GLOBALS.contains(name)) {
                return;
            }
            references.merge(name, !inTest, (a, b) -> a || b);
        }

        private boolean isBound(String name) {
            for (var scope : scopes) {
                if (scope.contains(name)) {
                    return true;
                }
            }
            return false;
        }

        private void bind(String name) {
            scopes.peek().add(name);
        }
    }
}
