package com.triage.orchestrator.workspace;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CodeReader against a throwaway directory tree.
 */
class CodeReaderTest {

    @TempDir Path base;

    CodeReader reader;

    @BeforeEach
    void setUp() throws IOException {
        write("app/settings.py", "DATABASE_PORT = 5433\n");
        write("docker-compose.yml", "services:\n  db:\n    ports: [\"5433:5432\"]\n");
        write("node_modules/lib/settings.py", "ignored = True\n");
        write(".env", "DB_PASSWORD=hunter2\n");
        write("config/secrets.yaml", "token: abc\n");
        write("credentials.json", "{}\n");
        write("bin/tool.exe", "MZ");
        reader = new CodeReader(base.toString(), 5);
    }

    // ------------------------------------------------------------------
    // read()
    // ------------------------------------------------------------------

    @Test
    void read_allowedFile_returnsContentAndLanguage() {
        FileContent file = reader.read("app/settings.py");

        assertThat(file.path()).isEqualTo(Path.of("app", "settings.py").toString());
        assertThat(file.content()).isEqualTo("DATABASE_PORT = 5433");
        assertThat(file.language()).isEqualTo("python");
        assertThat(file.lineCount()).isEqualTo(1);
    }

    @Test
    void read_absolutePathInsideBase_isAllowed() {
        FileContent file = reader.read(base.resolve("docker-compose.yml").toString());

        assertThat(file.language()).isEqualTo("yaml");
        assertThat(file.lineCount()).isEqualTo(3);
    }

    @Test
    void read_longFile_isTruncated() throws IOException {
        write("long.txt", IntStream.rangeClosed(1, 20).mapToObj(i -> "line " + i)
                .collect(Collectors.joining("\n")));

        FileContent file = reader.read("long.txt");

        assertThat(file.content()).startsWith("line 1\n");
        assertThat(file.content()).doesNotContain("line 6");
        assertThat(file.content()).endsWith("... [Truncated at 5 lines] ...");
    }

    @Test
    void read_secretFiles_areBlocked() {
        for (String path : List.of(".env", "config/secrets.yaml", "credentials.json")) {
            assertThatThrownBy(() -> reader.read(path))
                    .isInstanceOf(FileAccessException.class)
                    .satisfies(e -> assertThat(((FileAccessException) e).getKind())
                            .isEqualTo(FileAccessException.Kind.BLOCKED));
        }
    }

    @Test
    void read_pathOutsideBase_isBlocked() {
        assertThatThrownBy(() -> reader.read("../../../etc/passwd"))
                .isInstanceOf(FileAccessException.class)
                .hasMessageContaining("BLOCKED");
        assertThatThrownBy(() -> reader.read("/etc/passwd"))
                .isInstanceOf(FileAccessException.class)
                .hasMessageContaining("BLOCKED");
    }

    @Test
    void read_disallowedExtension_isRefused() {
        assertThatThrownBy(() -> reader.read("bin/tool.exe"))
                .isInstanceOf(FileAccessException.class)
                .hasMessageContaining("EXTENSION_NOT_ALLOWED");
    }

    @Test
    void read_missingFile_isNotFound() {
        assertThatThrownBy(() -> reader.read("app/missing.py"))
                .isInstanceOf(FileAccessException.class)
                .hasMessageContaining("NOT_FOUND");
    }

    // ------------------------------------------------------------------
    // find()
    // ------------------------------------------------------------------

    @Test
    void find_skipsExcludedDirectories() {
        assertThat(reader.find(List.of("**/settings.py")))
                .containsExactly(Path.of("app", "settings.py").toString());
    }

    @Test
    void find_doubleStarPrefix_matchesTopLevelFiles() {
        assertThat(reader.find(List.of("**/docker-compose.yml", "**/*docker-compose*")))
                .containsExactly("docker-compose.yml");
    }

    @Test
    void find_invalidGlob_isSkipped() {
        assertThat(reader.find(List.of("**/config{prod", "**/settings.py")))
                .containsExactly(Path.of("app", "settings.py").toString());
        assertThat(reader.find(List.of("**/config{prod"))).isEmpty();
    }

    @Test
    void find_neverReturnsBlockedFiles() {
        assertThat(reader.find(List.of("**/*"))).doesNotContain(".env", "credentials.json",
                Path.of("config", "secrets.yaml").toString());
    }

    @Test
    void format_includesPathAndLanguageFence() {
        String formatted = reader.format(reader.read("app/settings.py"));

        assertThat(formatted).contains("--- File: " + Path.of("app", "settings.py") + " ---");
        assertThat(formatted).contains("```python\nDATABASE_PORT = 5433\n```");
    }

    private void write(String relative, String content) throws IOException {
        Path p = base.resolve(relative);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content);
    }
}
