package work.tierforge.template;

import io.pebbletemplates.pebble.error.ParserException;
import io.pebbletemplates.pebble.lexer.Token;
import io.pebbletemplates.pebble.lexer.TokenStream;
import io.pebbletemplates.pebble.node.BodyNode;
import io.pebbletemplates.pebble.node.IfNode;
import io.pebbletemplates.pebble.node.RenderableNode;
import io.pebbletemplates.pebble.node.expression.Expression;
import io.pebbletemplates.pebble.parser.Parser;
import io.pebbletemplates.pebble.parser.StoppingCondition;
import io.pebbletemplates.pebble.tokenParser.TokenParser;
import io.pebbletemplates.pebble.utils.Pair;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code {% if %}} with {@code elif} (or {@code elseif}) branches whose tests go through
 * {@link ConditionExpression}.
 */
final class ConditionTokenParser implements TokenParser {
    private static final StoppingCondition BRANCH_END = token -> token.test(Token.Type.NAME, "elif", "elseif", "else", "endif");

    @Override
    public String getTag() {
        return "if";
    }

    @Override
    public RenderableNode parse(Token token, Parser parser) {
        TokenStream stream = parser.getStream();
        int lineNumber = token.getLineNumber();
        stream.next();

        List<Pair<Expression<?>, BodyNode>> branches = new ArrayList<>();
        branches.add(branch(parser));

        BodyNode elseBody = null;
        while (true) {
            Token current = stream.current();
            String tag = current.getValue();
            if (tag == null) {
                throw new ParserException(null, "Unexpected end of template, expected endif", current.getLineNumber(), stream.getFilename());
            }
            if (tag.equals("elif") || tag.equals("elseif")) {
                stream.next();
                branches.add(branch(parser));
            } else if (tag.equals("else")) {
                stream.next();
                stream.expect(Token.Type.EXECUTE_END);
                elseBody = parser.subparse(next -> next.test(Token.Type.NAME, "endif"));
            } else if (tag.equals("endif")) {
                stream.next();
                break;
            } else {
                throw new ParserException(null, "Expected elif, else or endif but found " + tag, current.getLineNumber(), stream.getFilename());
            }
        }
        stream.expect(Token.Type.EXECUTE_END);
        return new IfNode(lineNumber, branches, elseBody);
    }

    private static Pair<Expression<?>, BodyNode> branch(Parser parser) {
        Expression<?> test = parser.getExpressionParser().parseExpression();
        parser.getStream().expect(Token.Type.EXECUTE_END);
        BodyNode body = parser.subparse(BRANCH_END);
        return new Pair<>(new ConditionExpression(test), body);
    }
}
