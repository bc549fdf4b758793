package work.tierforge.introspect;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only queries over one parsed template. The resolver and classifier only see templates through
 * this interface.
 */
public interface TemplateAst {
    String templateName();

    /**
     * Parent named by {@code extends}, if any.
     *
     * @throws work.tierforge.error.TemplateSyntaxException when the target is not a string literal
     */
    Optional<String> findExtendsTarget();

    List<FilterApplication> findFilterApplications(String filterName);

    /**
     * Free variables whose every reference in this template sits inside an {@code if}/{@code elif} test.
     */
    Set<String> findConditionalTestVariables();

    /**
     * Names read by the template that it does not bind itself (set, loop targets, macro parameters,
     * imports) and that are not engine globals.
     */
    Set<String> findFreeVariableNames();
}
