package work.tierforge.error;

/**
 * Template source that cannot be tokenised or parsed.
 */
public final class TemplateSyntaxException extends ScaffoldException {
    private final String templateName;
    private final int line;

    public TemplateSyntaxException(String templateName, int line, String message) {
        super("ERR_TEMPLATE_SYNTAX", describe(templateName, line, message));
        this.templateName = templateName;
        this.line = line;
    }

    public String templateName() {
        return templateName;
    }

    public int line() {
        return line;
    }

    private static String describe(String templateName, int line, String message) {
        var where = templateName == null ? "<string>" : templateName;
        return "Template syntax error in " + where + " line " + line + ": " + message;
    }
}
