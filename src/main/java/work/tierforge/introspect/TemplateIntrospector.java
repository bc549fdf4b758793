package work.tierforge.introspect;

import java.util.Optional;
import work.tierforge.template.TemplateEngine;

/**
 * Answers "what does this template need?" for a template under an engine's root.
 */
public final class TemplateIntrospector {
    private final TemplateEngine engine;
    private final InheritanceResolver resolver;
    private final VariableClassifier classifier;

    public TemplateIntrospector(TemplateEngine engine) {
        this(engine, new InheritanceResolver(new EngineAstProvider(engine)), new VariableClassifier());
    }

    public TemplateIntrospector(TemplateEngine engine, InheritanceResolver resolver, VariableClassifier classifier) {
        this.engine = engine;
        this.resolver = resolver;
        this.classifier = classifier;
    }

    public ResolvedChain resolve(String templateName) {
        return resolver.resolveChain(templateName);
    }

    public TemplateSchema schema(String templateName) {
        return classifier.classify(resolver.resolveChain(templateName));
    }

    public Optional<TemplateHeader> header(String templateName) {
        return TemplateHeaderReader.read(templateName, engine.readSource(templateName));
    }
}
