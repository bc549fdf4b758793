package work.tierforge.introspect;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the variables of an inheritance chain into required and optional inputs.
 *
 * <p>A variable is optional when any template of the chain gives it a {@code default} (or {@code d})
 * directly, or only ever reads it inside {@code if}/{@code elif} tests. Optional wins when templates of
 * the chain disagree. System fields are skipped.
 */
public final class VariableClassifier {
    private static final List<String> DEFAULT_FILTERS = List.of("default", "d");

    public TemplateSchema classify(Set<String> allVariableRefs, List<TemplateAst> asts) {
        var optionalSignals = new HashSet<String>();
        for (var ast : asts) {
            for (String filter : DEFAULT_FILTERS) {
                for (var application : ast.findFilterApplications(filter)) {
                    if (application.operandName() != null) {
                        optionalSignals.add(application.operandName());
                    }
                }
            }
            optionalSignals.addAll(ast.findConditionalTestVariables());
        }
        var required = new HashSet<String>();
        var optional = new HashSet<String>();
        for (String name : allVariableRefs) {
            if (SystemFields.isSystemField(name)) {
                continue;
            }
            if (optionalSignals.contains(name)) {
                optional.add(name);
            } else {
                required.add(name);
            }
        }
        var chain = new ArrayList<String>();
        asts.forEach(ast -> chain.add(ast.templateName()));
        return new TemplateSchema(required, optional, chain);
    }

    public TemplateSchema classify(ResolvedChain resolved) {
        return classify(resolved.allVariableRefs(), resolved.asts());
    }
}
