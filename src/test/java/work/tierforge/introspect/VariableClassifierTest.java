package work.tierforge.introspect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.tierforge.TemplateFixtures;
import work.tierforge.template.TemplateEngine;

class VariableClassifierTest {
    private final VariableClassifier classifier = new VariableClassifier();

    private TemplateSchema classify(String source) {
        var ast = new SyntaxTreeAst(TemplateFixtures.engine(Map.of("t", source)).parse("t"));
        return classifier.classify(ast.findFreeVariableNames(), List.of(ast));
    }

    @Test
    void defaultFilterMakesVariableOptional() {
        var schema = classify("{{ v | default('x') }}");
        assertEquals(Set.of("v"), schema.optional());
        assertTrue(schema.required().isEmpty());
        assertEquals(Set.of("w"), classify("{{ w | d('x') }}").optional());
    }

    @Test
    void conditionalTestOnlyMakesVariableOptional() {
        var schema = classify("{% if v %}shown{% endif %}");
        assertEquals(Set.of("v"), schema.optional());
        assertEquals(Set.of("w"), classify("{% if a %}{% elif w is defined %}{% endif %}{{ a }}").optional());
    }

    @Test
    void attributeAccessOutsideConditionalIsRequired() {
        var schema = classify("{{ v.field }}");
        assertEquals(Set.of("v"), schema.required());
        assertTrue(schema.optional().isEmpty());
    }

    @Test
    void readingATestedVariableInTheBodyMakesItRequired() {
        var schema = classify("{% if v %}{{ v }}{% endif %}");
        assertEquals(Set.of("v"), schema.required());
    }

    @Test
    void systemFieldsAreNeverClassified() {
        var schema = classify("{{ template_id }} {{ template_version }} {{ scaffold_created }} {{ output_path }} {{ format }} {{ name }}");
        assertEquals(Set.of("name"), schema.required());
        for (String field : SystemFields.NAMES) {
            assertFalse(schema.required().contains(field));
            assertFalse(schema.optional().contains(field));
        }
    }

    @Test
    void locallyBoundNamesAreNotInputs() {
        var schema = classify(
            "{% set greeting = 'hi' %}{{ greeting }}"
                + "{% for item in items %}{{ item }}{{ loop.index }}{% endfor %}"
                + "{% macro m(p) %}{{ p }}{% endmacro %}{{ m(1) }}"
                + "{% for i in range(0, 2) %}{{ i }}{% endfor %}"
        );
        assertEquals(Set.of("items"), schema.required());
        assertTrue(schema.optional().isEmpty());
    }

    @Test
    void optionalInAnyTemplateOfTheChainWins() {
        var engine = TemplateFixtures.engine(Map.of("parent", "{{ title | default('Untitled') }}", "child", "{{ title }}"));
        var parent = new SyntaxTreeAst(engine.parse("parent"));
        var child = new SyntaxTreeAst(engine.parse("child"));
        var schema = classifier.classify(Set.of("title"), List.of(parent, child));
        assertEquals(Set.of("title"), schema.optional());
        assertEquals(List.of("parent", "child"), schema.inheritanceChain());
    }

    @Test
    void classifiesTheFourTierChain() {
        var engine = new TemplateEngine(Path.of("src", "test", "resources", "chain"));
        var schema = new TemplateIntrospector(engine).schema("concrete");
        assertEquals(Set.of("family", "owner"), schema.required());
        assertEquals(Set.of("language", "notes"), schema.optional());
        assertEquals(List.of("tier0", "tier1", "tier2", "concrete"), schema.inheritanceChain());
    }

    @Test
    void classifiesProjectTemplateWithImportedMacros() {
        var engine = new TemplateEngine(Path.of("src", "test", "resources", "project", "templates"));
        var schema = new TemplateIntrospector(engine).schema("concrete/dto.py.jinja2");
        assertEquals(Set.of("fields", "name"), schema.required());
        assertEquals(Set.of("description", "frozen", "imports"), schema.optional());
    }

    @Test
    void schemaSerializesSorted() {
        var schema = new TemplateSchema(Set.of("b", "a"), Set.of("c"), List.of("t"));
        assertEquals(Map.of(
            "required", List.of("a", "b"),
            "optional", List.of("c"),
            "inheritance_chain", List.of("t")
        ), schema.toMap());
    }
}
