package com.triage.orchestrator.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Read-only, sandboxed access to the code base under investigation.
 *
 * <ul>
 *   <li>Paths must resolve inside the base directory.</li>
 *   <li>Only source, config and documentation extensions are readable.</li>
 *   <li>Anything that looks like a secret (.env files, keys, credentials) is refused.</li>
 *   <li>Reads stop after {@code maxLines} lines.</li>
 * </ul>
 */
@Component
public class CodeReader {

    private static final Logger log = LoggerFactory.getLogger(CodeReader.class);

    static final Set<String> ALLOWED_EXTENSIONS = Set.of(
            ".py", ".js", ".ts", ".jsx", ".tsx",
            ".java", ".go", ".rs", ".cpp", ".c", ".h",
            ".yaml", ".yml", ".json", ".toml",
            ".md", ".txt", ".rst",
            ".html", ".css", ".scss",
            ".sql",
            ".sh", ".bash", ".zsh",
            ".dockerfile", ".containerfile");

    // Matched case-insensitively against the path relative to the base directory.
    static final Set<String> BLOCKED_PATTERNS = Set.of(
            ".env", ".env.local", ".env.production",
            "secrets", "credentials", "password",
            ".pem", ".key", ".crt", ".pfx",
            "id_rsa", "id_ed25519",
            ".aws/credentials");

    static final Set<String> EXCLUDED_DIRS = Set.of(
            "node_modules", ".git", "__pycache__", "venv", ".venv");

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry(".py", "python"),   Map.entry(".js", "javascript"), Map.entry(".ts", "typescript"),
            Map.entry(".jsx", "javascript"), Map.entry(".tsx", "typescript"), Map.entry(".java", "java"),
            Map.entry(".go", "go"),       Map.entry(".rs", "rust"),       Map.entry(".cpp", "cpp"),
            Map.entry(".c", "c"),         Map.entry(".h", "c"),           Map.entry(".yaml", "yaml"),
            Map.entry(".yml", "yaml"),    Map.entry(".json", "json"),     Map.entry(".toml", "toml"),
            Map.entry(".md", "markdown"), Map.entry(".html", "html"),     Map.entry(".css", "css"),
            Map.entry(".sql", "sql"),     Map.entry(".sh", "bash"),       Map.entry(".dockerfile", "dockerfile"));

    private final Path baseDirectory;
    private final int  maxLines;

    public CodeReader(@Value("${triage.workspace.base-directory:.}") String baseDirectory,
                      @Value("${triage.workspace.max-lines:500}") int maxLines) {
        this.baseDirectory = Path.of(baseDirectory).toAbsolutePath().normalize();
        this.maxLines      = maxLines;
    }

    // ------------------------------------------------------------------
    // Reading
    // ------------------------------------------------------------------

    /**
     * Read one file, relative to the base directory or absolute inside it.
     *
     * @throws FileAccessException if the file is blocked, not allowed, missing or unreadable
     */
    public FileContent read(String filePath) {
        Path path = resolve(filePath);
        if (!isSafe(path)) {
            throw new FileAccessException(FileAccessException.Kind.BLOCKED,
                    "Access denied: " + filePath + " is blocked for security reasons");
        }
        String ext = extension(path);
        if (!ALLOWED_EXTENSIONS.contains(ext)) {
            throw new FileAccessException(FileAccessException.Kind.EXTENSION_NOT_ALLOWED,
                    "File type not allowed: " + (ext.isEmpty() ? "(none)" : ext));
        }
        if (!Files.isRegularFile(path)) {
            throw new FileAccessException(FileAccessException.Kind.NOT_FOUND, "File not found: " + filePath);
        }

        List<String> lines = new ArrayList<>();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(path), decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (lines.size() >= maxLines) {
                    lines.add("... [Truncated at " + maxLines + " lines] ...");
                    break;
                }
                lines.add(line);
            }
        } catch (IOException e) {
            throw new FileAccessException(FileAccessException.Kind.IO_ERROR,
                    "Error reading file " + filePath + ": " + e.getMessage(), e);
        }

        return new FileContent(relative(path), String.join("\n", lines), language(ext), lines.size());
    }

    // ------------------------------------------------------------------
    // Searching
    // ------------------------------------------------------------------

    /**
     * Find readable files matching any of the glob patterns, e.g. {@code **}{@code /settings.py}.
     * Patterns are matched against the path relative to the base directory; a leading
     * {@code **}{@code /} also matches files at the top level. Invalid globs are skipped.
     *
     * @return sorted, de-duplicated paths relative to the base directory
     */
    public List<String> find(List<String> globs) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String g : globs) {
            try {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + g));
                if (g.startsWith("**/")) {
                    matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + g.substring(3)));
                }
            } catch (PatternSyntaxException e) {
                log.warn("Skipping invalid glob '{}': {}", g, e.getDescription());
            }
        }
        if (matchers.isEmpty()) return List.of();

        Set<String> matches = new TreeSet<>();
        try (Stream<Path> walk = Files.walk(baseDirectory)) {
            walk.filter(Files::isRegularFile)
                    .filter(p -> !inExcludedDir(p))
                    .filter(this::isSafe)
                    .map(baseDirectory::relativize)
                    .filter(rel -> matchers.stream().anyMatch(m -> m.matches(rel)))
                    .forEach(rel -> matches.add(rel.toString()));
        } catch (IOException | UncheckedIOException e) {
            log.warn("File search under {} stopped early: {}", baseDirectory, e.getMessage());
        }
        return List.copyOf(matches);
    }

    /** Render a file for inclusion in a prompt. */
    public String format(FileContent file) {
        return """

                --- File: %s ---
                Language: %s
                Lines: %d

                ```%s
                %s
                ```
                """.formatted(file.path(), file.language(), file.lineCount(), file.language(), file.content());
    }

    // ------------------------------------------------------------------
    // Safety checks
    // ------------------------------------------------------------------

    /** True if the path stays inside the base directory and matches no blocked pattern. */
    boolean isSafe(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(baseDirectory)) return false;
        if (Files.exists(normalized)) {
            try {
                if (!normalized.toRealPath().startsWith(baseDirectory.toRealPath())) return false;
            } catch (IOException e) {
                return false;
            }
        }
        String rel = baseDirectory.relativize(normalized).toString().replace('\\', '/').toLowerCase(Locale.ROOT);
        return BLOCKED_PATTERNS.stream().noneMatch(rel::contains);
    }

    private Path resolve(String filePath) {
        Path p = Path.of(filePath);
        return (p.isAbsolute() ? p : baseDirectory.resolve(p)).normalize();
    }

    private boolean inExcludedDir(Path p) {
        for (Path part : baseDirectory.relativize(p)) {
            if (EXCLUDED_DIRS.contains(part.toString())) return true;
        }
        return false;
    }

    private String relative(Path p) {
        return baseDirectory.relativize(p.toAbsolutePath().normalize()).toString();
    }

    private static String extension(Path p) {
        String name = p.getFileName() == null ? "" : p.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot);
    }

    private static String language(String ext) {
        return LANGUAGES.getOrDefault(ext, "text");
    }
}
