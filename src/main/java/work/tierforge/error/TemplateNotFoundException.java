package work.tierforge.error;

import java.util.List;

public final class TemplateNotFoundException extends ScaffoldException {
    private final String templateName;

    public TemplateNotFoundException(String templateName) {
        super(
            "ERR_TEMPLATE_NOT_FOUND",
            "Template not found: " + templateName,
            List.of("Check the template name against 'tierforge templates'")
        );
        this.templateName = templateName;
    }

    public String templateName() {
        return templateName;
    }
}
