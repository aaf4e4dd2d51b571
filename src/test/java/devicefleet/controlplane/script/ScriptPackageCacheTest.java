package devicefleet.controlplane.script;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import devicefleet.controlplane.config.ScriptProperties;
import devicefleet.controlplane.exception.ScriptPackageException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.FileSystemUtils;

@DisplayName("ScriptPackageCache Tests")
class ScriptPackageCacheTest {

    private static final FileTime MODIFIED = FileTime.fromMillis(1_700_000_000_000L);

    @TempDir
    Path scriptsRoot;

    private ScriptPackageCache cache;

    @BeforeEach
    void setUp() {
        ScriptProperties properties = new ScriptProperties();
        properties.setLargeFileThreshold(64);
        properties.setCacheMaxEntries(3);
        properties.setCacheTrimTo(2);
        cache = new ScriptPackageCache(properties, new FileChecksumCache(properties));
    }

    @Nested
    @DisplayName("Single file scripts")
    class SingleFileTests {

        @Test
        @DisplayName("Should place the file under the device script directory with base64 content")
        void shouldEncodeSingleFile() throws IOException {
            Path script = Files.writeString(scriptsRoot.resolve("demo.lua"), "print(1)");

            List<ScriptFile> files = cache.collect(script, "demo.lua", false, false);

            assertThat(files).hasSize(1);
            ScriptFile file = files.get(0);
            assertThat(file.path()).isEqualTo("lua/scripts/demo.lua");
            assertThat(file.sourcePath()).isEqualTo(script);
            assertThat(file.size()).isEqualTo(8);
            assertThat(decode(file.data())).isEqualTo("print(1)");
            assertThat(file.isInline()).isTrue();
            assertThat(file.md5()).isEmpty();
        }

        @Test
        @DisplayName("Should serve an unchanged script from cache")
        void shouldReuseUnchangedEntry() throws IOException {
            Path script = Files.writeString(scriptsRoot.resolve("demo.lua"), "print(1)");

            List<ScriptFile> first = cache.collect(script, "demo.lua", false, false);
            List<ScriptFile> second = cache.collect(script, "demo.lua", false, false);

            assertThat(second).isSameAs(first);
            assertThat(cache.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should return the new content after the file is rewritten")
        void shouldRebuildAfterRewrite() throws IOException {
            Path script = Files.writeString(scriptsRoot.resolve("demo.lua"), "print(1)");
            cache.collect(script, "demo.lua", false, false);

            Files.writeString(script, "print('updated')");
            List<ScriptFile> files = cache.collect(script, "demo.lua", false, false);

            assertThat(decode(files.get(0).data())).isEqualTo("print('updated')");
            assertThat(cache.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should leave large files out of the inline data")
        void shouldNotInlineLargeFiles() throws IOException {
            Path script = Files.writeString(scriptsRoot.resolve("big.lua"), "x".repeat(64));

            ScriptFile file = cache.collect(script, "big.lua", false, false).get(0);

            assertThat(file.data()).isEmpty();
            assertThat(file.isInline()).isFalse();
            assertThat(file.size()).isEqualTo(64);
            assertThat(file.md5()).isEqualTo("c1bb4f81d892b2d57947682aeb252456");
        }
    }

    @Nested
    @DisplayName("Directory scripts")
    class DirectoryTests {

        @Test
        @DisplayName("Should list files depth first in lexical order below the script directory")
        void shouldListInLexicalOrder() throws IOException {
            Path app = scriptsRoot.resolve("app.xpp");
            write(app.resolve("main.json"), "{}");
            write(app.resolve("lua/scripts/b.lua"), "b");
            write(app.resolve("lua/scripts/a.lua"), "a");
            write(app.resolve("res/icon.txt"), "i");

            List<ScriptFile> files = cache.collect(app, "app.xpp", true, false);

            assertThat(files).extracting(ScriptFile::path).containsExactly(
                "lua/scripts/app.xpp/lua/scripts/a.lua",
                "lua/scripts/app.xpp/lua/scripts/b.lua",
                "lua/scripts/app.xpp/main.json",
                "lua/scripts/app.xpp/res/icon.txt");
            assertThat(files).filteredOn(ScriptFile::mainJson).hasSize(1);
        }

        @Test
        @DisplayName("Should keep the device layout of piled packages")
        void shouldKeepPiledLayout() throws IOException {
            Path piled = scriptsRoot.resolve("piled");
            write(piled.resolve("lua/scripts/main.lua"), "main");
            write(piled.resolve("lua/scripts/main.json"), "{}");

            List<ScriptFile> files = cache.collect(piled, "piled", true, true);

            assertThat(files).extracting(ScriptFile::normalizedPath)
                .containsExactly("lua/scripts/main.json", "lua/scripts/main.lua");
            assertThat(files.get(0).mainJson()).isTrue();
        }

        @Test
        @DisplayName("Should pick up a file added to the directory")
        void shouldRebuildAfterAddingFile() throws IOException {
            Path app = scriptsRoot.resolve("app.xpp");
            write(app.resolve("main.lua"), "main");
            assertThat(cache.collect(app, "app.xpp", true, false)).hasSize(1);

            write(app.resolve("util.lua"), "util");

            assertThat(cache.collect(app, "app.xpp", true, false)).hasSize(2);
        }

        @Test
        @DisplayName("Should keep the cached package when the script cannot be read")
        void shouldKeepEntryOnReadFailure() throws IOException {
            Path app = scriptsRoot.resolve("app.xpp");
            Path main = app.resolve("main.lua");
            write(main, "main");
            Files.setLastModifiedTime(main, MODIFIED);
            List<ScriptFile> first = cache.collect(app, "app.xpp", true, false);

            FileSystemUtils.deleteRecursively(app);

            ScriptPackageException ex = catchThrowableOfType(
                () -> cache.collect(app, "app.xpp", true, false), ScriptPackageException.class);

            assertThat(ex).isNotNull();
            assertThat(ex.getScriptPath()).isEqualTo(app.toString());
            assertThat(cache.size()).isEqualTo(1);

            write(main, "main");
            Files.setLastModifiedTime(main, MODIFIED);

            assertThat(cache.collect(app, "app.xpp", true, false)).isSameAs(first);
        }
    }

    @Test
    @DisplayName("Should evict the oldest packages when the cache is full")
    void shouldTrimOldestEntries() throws IOException {
        Path first = Files.writeString(scriptsRoot.resolve("s0.lua"), "0");
        List<ScriptFile> cachedFirst = cache.collect(first, "s0.lua", false, false);
        for (int i = 1; i < 5; i++) {
            Path script = Files.writeString(scriptsRoot.resolve("s" + i + ".lua"), Integer.toString(i));
            cache.collect(script, "s" + i + ".lua", false, false);
        }

        assertThat(cache.size()).isLessThanOrEqualTo(3);
        assertThat(cache.collect(first, "s0.lua", false, false)).isNotSameAs(cachedFirst);
    }

    @Test
    @DisplayName("Fingerprint should change with file size")
    void fingerprintShouldTrackSize() throws IOException {
        Path script = Files.writeString(scriptsRoot.resolve("demo.lua"), "a");
        String before = cache.fingerprint(script, false);

        Files.writeString(script, "ab");

        assertThat(cache.fingerprint(script, false)).isNotEqualTo(before);
    }

    private static void write(Path path, String content) throws IOException {
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
    }

    private static String decode(String base64) {
        return new String(Base64.getDecoder().decode(base64), StandardCharsets.UTF_8);
    }
}
