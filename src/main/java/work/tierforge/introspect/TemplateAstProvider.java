package work.tierforge.introspect;

/**
 * Supplies parsed templates by root-relative name.
 */
@FunctionalInterface
public interface TemplateAstProvider {
    TemplateAst load(String templateName);
}
