package devicefleet.controlplane.script;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import devicefleet.controlplane.config.ScriptProperties;
import devicefleet.controlplane.exception.InvalidScriptPathException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ScriptPathResolver Tests")
class ScriptPathResolverTest {

    @TempDir
    Path scriptsRoot;

    private ScriptPathResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(scriptsRoot.resolve("demo.lua"), "print(1)");
        Files.writeString(scriptsRoot.resolve("notes.txt"), "hello");
        Files.createDirectories(scriptsRoot.resolve("app.xpp"));
        Files.createDirectories(scriptsRoot.resolve("piled/lua/scripts"));
        Files.writeString(scriptsRoot.resolve("piled/lua/scripts/main.xxt"), "compiled");
        Files.createDirectories(scriptsRoot.resolve("folder/sub"));
        Files.writeString(scriptsRoot.resolve("folder/sub/tool.lua"), "tool");

        ScriptProperties properties = new ScriptProperties();
        properties.setRoot(scriptsRoot);
        resolver = new ScriptPathResolver(properties);
    }

    @Test
    @DisplayName("Should resolve a single script file and run it by name")
    void shouldResolveFile() {
        ScriptTarget target = resolver.resolve("demo.lua");

        assertThat(target.directory()).isFalse();
        assertThat(target.piled()).isFalse();
        assertThat(target.runName()).isEqualTo("demo.lua");
        assertThat(target.path()).isEqualTo(scriptsRoot.resolve("demo.lua").toAbsolutePath().normalize());
    }

    @Test
    @DisplayName("Should resolve nested files after cleaning the name")
    void shouldCleanNestedName() {
        ScriptTarget target = resolver.resolve(" ./folder//sub/tool.lua ");

        assertThat(target.normalizedName()).isEqualTo("folder/sub/tool.lua");
        assertThat(target.runName()).isEqualTo("folder/sub/tool.lua");
    }

    @Test
    @DisplayName("Should resolve an app package directory")
    void shouldResolveAppPackage() {
        ScriptTarget target = resolver.resolve("app.xpp");

        assertThat(target.directory()).isTrue();
        assertThat(target.piled()).isFalse();
        assertThat(target.runName()).isEqualTo("app.xpp");
    }

    @Test
    @DisplayName("Should run the main entry of a piled directory")
    void shouldResolvePiledDirectory() {
        ScriptTarget target = resolver.resolve("piled");

        assertThat(target.directory()).isTrue();
        assertThat(target.piled()).isTrue();
        assertThat(target.runName()).isEqualTo("main.xxt");
    }

    @Test
    @DisplayName("Should refuse files and folders that are not scripts")
    void shouldRefuseNonScripts() {
        assertThatThrownBy(() -> resolver.resolve("notes.txt"))
            .isInstanceOf(InvalidScriptPathException.class)
            .hasMessage("not a selectable script");
        assertThatThrownBy(() -> resolver.resolve("folder"))
            .isInstanceOf(InvalidScriptPathException.class)
            .hasMessage("not a selectable script");
    }

    @Test
    @DisplayName("Should report missing scripts")
    void shouldReportMissing() {
        assertThatThrownBy(() -> resolver.resolve("missing.lua"))
            .isInstanceOf(InvalidScriptPathException.class)
            .hasMessage("script not found");
    }

    @Test
    @DisplayName("Should refuse names that leave the scripts directory")
    void shouldRefuseEscapingNames() {
        assertThatThrownBy(() -> resolver.resolve("../demo.lua")).hasMessage("invalid script name");
        assertThatThrownBy(() -> resolver.resolve("folder/../../x.lua")).hasMessage("invalid script name");
        assertThatThrownBy(() -> resolver.resolve("/etc/passwd")).hasMessage("invalid script name");
        assertThatThrownBy(() -> resolver.resolve("C:\\scripts\\a.lua")).hasMessage("invalid script name");
        assertThatThrownBy(() -> resolver.resolve("./.")).hasMessage("invalid script name");
    }

    @Test
    @DisplayName("Should require a name")
    void shouldRequireName() {
        assertThatThrownBy(() -> resolver.resolve("  ")).hasMessage("script name is required");
        assertThatThrownBy(() -> resolver.resolve(null)).hasMessage("script name is required");
    }
}
