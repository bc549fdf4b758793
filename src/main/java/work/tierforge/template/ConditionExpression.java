package work.tierforge.template;

import io.pebbletemplates.pebble.error.AttributeNotFoundException;
import io.pebbletemplates.pebble.extension.NodeVisitor;
import io.pebbletemplates.pebble.node.expression.AndExpression;
import io.pebbletemplates.pebble.node.expression.Expression;
import io.pebbletemplates.pebble.node.expression.OrExpression;
import io.pebbletemplates.pebble.node.expression.UnaryNotExpression;
import io.pebbletemplates.pebble.template.EvaluationContextImpl;
import io.pebbletemplates.pebble.template.PebbleTemplateImpl;
import java.util.Collection;
import java.util.Map;

/**
 * Test of an {@code if}/{@code elif} branch.
 *
 * <p>Undefined names and attributes are false instead of failing the render, and any value has a truth
 * value: empty strings, collections and maps, zero and {@code null} are false.
 */
public final class ConditionExpression implements Expression<Boolean> {
    private final Expression<?> test;

    ConditionExpression(Expression<?> test) {
        this.test = test;
    }

    public Expression<?> getTest() {
        return test;
    }

    @Override
    public Boolean evaluate(PebbleTemplateImpl self, EvaluationContextImpl context) {
        return holds(test, self, context);
    }

    private static boolean holds(Expression<?> expression, PebbleTemplateImpl self, EvaluationContextImpl context) {
        if (expression instanceof UnaryNotExpression not) {
            return !holds(not.getChildExpression(), self, context);
        }
        if (expression instanceof AndExpression and) {
            return holds(and.getLeftExpression(), self, context) && holds(and.getRightExpression(), self, context);
        }
        if (expression instanceof OrExpression or) {
            return holds(or.getLeftExpression(), self, context) || holds(or.getRightExpression(), self, context);
        }
        Object value;
        try {
            value = expression.evaluate(self, context);
        } catch (AttributeNotFoundException ex) {
            return false;
        }
        return truthy(value);
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        if (value instanceof CharSequence chars) {
            return chars.length() > 0;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public int getLineNumber() {
        return test.getLineNumber();
    }
}
