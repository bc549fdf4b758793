package work.tierforge.template;

import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.error.ParserException;
import io.pebbletemplates.pebble.error.PebbleException;
import io.pebbletemplates.pebble.node.ExtendsNode;
import io.pebbletemplates.pebble.node.expression.LiteralStringExpression;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tierforge.error.ConfigException;
import work.tierforge.error.InheritanceCycleException;
import work.tierforge.error.RenderException;
import work.tierforge.error.ScaffoldException;
import work.tierforge.error.TemplateNotFoundException;
import work.tierforge.error.TemplateSyntaxException;

/**
 * Loads templates from a fixed root directory and renders them with Pebble. Compiled templates are
 * cached for the lifetime of the engine.
 *
 * <p>Undefined variables fail the render, except inside {@code if}/{@code elif} tests and under the
 * {@code default} (or {@code d}) filter.
 */
public final class TemplateEngine {
    private static final Logger log = LoggerFactory.getLogger(TemplateEngine.class);
    private static final List<String> TEMPLATE_SUFFIXES = List.of(".jinja2", ".j2");

    private final Path root;
    private final TemplateRootLoader loader;
    private final TemplateCapture capture = new TemplateCapture();
    private final PebbleEngine pebble;

    public TemplateEngine(Path templateRoot) {
        if (templateRoot == null || !Files.isDirectory(templateRoot)) {
            throw new ConfigException(
                "Template root not found",
                templateRoot,
                List.of("Point templates.root in tierforge.toml at an existing directory")
            );
        }
        this.root = templateRoot.toAbsolutePath().normalize();
        this.loader = new TemplateRootLoader(root);
        this.pebble = new PebbleEngine.Builder()
            .loader(loader)
            .extension(new ScaffoldExtension(capture))
            .autoEscaping(false)
            .strictVariables(true)
            .newLineTrimming(false)
            .defaultLocale(Locale.ROOT)
            .build();
    }

    public Path root() {
        return root;
    }

    /**
     * Renders the named template (root-relative, forward slashes) with the given variables.
     *
     * @throws TemplateNotFoundException when the template or one of its parents/imports is missing
     * @throws InheritanceCycleException when the template extends itself through its ancestry
     * @throws RenderException when a value is undefined or a filter rejects its input
     */
    public String render(String templateName, Map<String, ?> bindings) {
        String name = TemplateRootLoader.normalize(templateName);
        log.debug("Rendering {}", name);
        checkAncestry(name);
        var context = new HashMap<String, Object>();
        if (bindings != null) {
            context.putAll(bindings);
        }
        return translate(name, () -> {
            var writer = new StringWriter();
            try {
                compile(name).evaluate(writer, context);
            } catch (IOException ex) {
                throw new ScaffoldException("ERR_IO", "Failed to render " + name + ": " + ex.getMessage(), List.of(), ex);
            }
            return writer.toString();
        });
    }

    /**
     * Compiles (or returns the cached tree of) the named template without rendering it.
     */
    public ParsedTemplate parse(String templateName) {
        String name = TemplateRootLoader.normalize(templateName);
        translate(name, () -> compile(name));
        var parsed = capture.get(name);
        if (parsed == null) {
            // compiled before the capture was cleared
            pebble.getTemplateCache().invalidateAll();
            translate(name, () -> compile(name));
            parsed = capture.get(name);
        }
        return parsed;
    }

    public String readSource(String templateName) {
        Path path = loader.resolve(templateName);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ScaffoldException("ERR_IO", "Failed to read template " + templateName + ": " + ex.getMessage(), List.of(), ex);
        }
    }

    public boolean exists(String templateName) {
        return templateName != null && !templateName.isBlank() && loader.resourceExists(templateName);
    }

    /**
     * Root-relative paths of every template file, sorted, with forward slashes.
     */
    public List<String> listTemplates() {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> TEMPLATE_SUFFIXES.stream().anyMatch(suffix -> path.getFileName().toString().endsWith(suffix)))
                .map(path -> root.relativize(path).toString().replace('\\', '/'))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new ScaffoldException("ERR_IO", "Failed to list templates under " + root + ": " + ex.getMessage(), List.of(), ex);
        }
    }

    public void clearCache() {
        pebble.getTemplateCache().invalidateAll();
        capture.clear();
    }

    private PebbleTemplate compile(String name) {
        return pebble.getTemplate(name);
    }

    // Pebble follows extends at render time and never returns from a cycle.
    private void checkAncestry(String name) {
        var visited = new LinkedHashSet<String>();
        String current = name;
        while (current != null) {
            if (!visited.add(current)) {
                var cycle = new ArrayList<>(visited);
                cycle.add(current);
                throw new InheritanceCycleException(cycle);
            }
            String anchor = current;
            current = parse(anchor).extendsNode()
                .map(ExtendsNode::getParentExpression)
                .filter(LiteralStringExpression.class::isInstance)
                .map(target -> ((LiteralStringExpression) target).getValue())
                .map(target -> TemplateRootLoader.normalize(loader.resolveRelativePath(target, anchor)))
                .orElse(null);
        }
    }

    private static <T> T translate(String name, Supplier<T> action) {
        try {
            return action.get();
        } catch (ScaffoldException ex) {
            throw ex;
        } catch (ParserException ex) {
            var cause = scaffoldCause(ex);
            if (cause != null) {
                throw cause;
            }
            String file = ex.getFileName() != null ? TemplateRootLoader.normalize(ex.getFileName()) : name;
            int line = ex.getLineNumber() != null ? ex.getLineNumber() : 0;
            throw new TemplateSyntaxException(file, line, ex.getPebbleMessage());
        } catch (PebbleException ex) {
            var cause = scaffoldCause(ex);
            if (cause != null) {
                throw cause;
            }
            throw new RenderException("Failed to render " + name + ": " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            var cause = scaffoldCause(ex);
            if (cause != null) {
                throw cause;
            }
            throw new RenderException("Failed to render " + name + ": " + ex, ex);
        }
    }

    private static ScaffoldException scaffoldCause(Throwable ex) {
        for (Throwable cause = ex.getCause(); cause != null && cause != cause.getCause(); cause = cause.getCause()) {
            if (cause instanceof ScaffoldException scaffold) {
                return scaffold;
            }
        }
        return null;
    }
}
