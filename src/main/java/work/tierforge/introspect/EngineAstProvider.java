package work.tierforge.introspect;

import work.tierforge.template.TemplateEngine;

/**
 * {@link TemplateAstProvider} backed by the engine's parse cache.
 */
public final class EngineAstProvider implements TemplateAstProvider {
    private final TemplateEngine engine;

    public EngineAstProvider(TemplateEngine engine) {
        this.engine = engine;
    }

    @Override
    public TemplateAst load(String templateName) {
        return new SyntaxTreeAst(engine.parse(templateName));
    }
}
