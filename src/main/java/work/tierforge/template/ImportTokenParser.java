package work.tierforge.template;

import io.pebbletemplates.pebble.lexer.Token;
import io.pebbletemplates.pebble.lexer.TokenStream;
import io.pebbletemplates.pebble.node.ImportNode;
import io.pebbletemplates.pebble.node.RenderableNode;
import io.pebbletemplates.pebble.node.expression.Expression;
import io.pebbletemplates.pebble.parser.Parser;
import io.pebbletemplates.pebble.tokenParser.TokenParser;

/**
 * {@code {% import "macros" [as alias] %}}. The alias is reported to the {@link TemplateCapture} since
 * the parsed node does not expose it.
 */
final class ImportTokenParser implements TokenParser {
    private final TemplateCapture capture;

    ImportTokenParser(TemplateCapture capture) {
        this.capture = capture;
    }

    @Override
    public String getTag() {
        return "import";
    }

    @Override
    public RenderableNode parse(Token token, Parser parser) {
        TokenStream stream = parser.getStream();
        int lineNumber = token.getLineNumber();
        stream.next();

        Expression<?> template = parser.getExpressionParser().parseExpression();
        String alias = null;
        Token current = stream.current();
        if (current.test(Token.Type.NAME, "as")) {
            stream.next();
            alias = stream.expect(Token.Type.NAME).getValue();
            capture.recordImportAlias(stream.getFilename(), alias);
        }
        stream.expect(Token.Type.EXECUTE_END);
        return new ImportNode(lineNumber, template, alias);
    }
}
