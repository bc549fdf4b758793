package work.tierforge.template;

import io.pebbletemplates.pebble.loader.Loader;
import io.pebbletemplates.pebble.utils.PathUtils;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import work.tierforge.error.ScaffoldException;
import work.tierforge.error.TemplateNotFoundException;

/**
 * Serves templates from one directory. Names are root-relative with forward slashes; a name that
 * resolves outside the root is treated as missing.
 */
final class TemplateRootLoader implements Loader<String> {
    private final Path root;
    private Charset charset = StandardCharsets.UTF_8;

    TemplateRootLoader(Path root) {
        this.root = root;
    }

    @Override
    public Reader getReader(String templateName) {
        Path path = resolve(templateName);
        try {
            return Files.newBufferedReader(path, charset);
        } catch (IOException ex) {
            throw new ScaffoldException("ERR_IO", "Failed to read template " + templateName + ": " + ex.getMessage(), List.of(), ex);
        }
    }

    @Override
    public void setCharset(String charset) {
        this.charset = Charset.forName(charset);
    }

    @Override
    public void setPrefix(String prefix) {
        throw new UnsupportedOperationException("Templates are always loaded from " + root);
    }

    @Override
    public void setSuffix(String suffix) {
        throw new UnsupportedOperationException("Template names carry their own suffix");
    }

    @Override
    public String resolveRelativePath(String relativePath, String anchorPath) {
        return PathUtils.resolveRelativePath(relativePath, anchorPath, '/');
    }

    @Override
    public String createCacheKey(String templateName) {
        return normalize(templateName);
    }

    @Override
    public boolean resourceExists(String templateName) {
        Path path = root.resolve(normalize(templateName)).normalize();
        return path.startsWith(root) && Files.isRegularFile(path);
    }

    Path resolve(String templateName) {
        String name = normalize(templateName);
        Path path = root.resolve(name).normalize();
        if (!path.startsWith(root) || !Files.isRegularFile(path)) {
            throw new TemplateNotFoundException(name);
        }
        return path;
    }

    static String normalize(String templateName) {
        if (templateName == null || templateName.isBlank()) {
            throw new TemplateNotFoundException(String.valueOf(templateName));
        }
        String name = templateName.replace('\\', '/');
        while (name.startsWith("./")) {
            name = name.substring(2);
        }
        return name;
    }
}
