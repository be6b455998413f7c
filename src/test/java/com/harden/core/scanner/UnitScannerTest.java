package com.harden.core.scanner;

import com.harden.core.config.HardenProperties;
import com.harden.core.model.Unit;
import com.harden.core.model.UnitStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnitScannerTest {

    @TempDir
    Path root;

    private HardenProperties properties;
    private UnitScanner scanner;

    @BeforeEach
    void setUp() {
        properties = new HardenProperties();
        properties.getDiscovery().setRoot(root.toString());
        scanner = new UnitScanner(properties);
    }

    private void touch(String relative) throws Exception {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "# " + relative + "\n");
    }

    @Test
    @DisplayName("finds matching files sorted by path, skipping excluded names and directories")
    void discoversUnits() throws Exception {
        touch("app/controllers/b_controller.rb");
        touch("app/controllers/a_controller.rb");
        touch("app/controllers/application_controller.rb");
        touch("app/controllers/admin/users_controller.rb");
        touch("app/controllers/concerns/auth_controller.rb");
        touch("app/controllers/.harden/a_controller/old_controller.rb");
        touch("app/controllers/helpers.rb");

        List<Unit> units = scanner.scan();

        assertEquals(List.of("a_controller", "users_controller", "b_controller"),
                units.stream().map(Unit::name).toList());
        Unit a = units.get(0);
        assertEquals(Path.of("app/controllers/a_controller.rb").toString(), a.path());
        assertEquals(root.resolve("app/controllers/a_controller.rb").toString(), a.fullPath());
        assertEquals(UnitStatus.PENDING, a.status());
        assertNull(a.analysis());
        assertNull(a.decision());
    }

    @Test
    @DisplayName("missing source directory raises DiscoveryException")
    void missingSourceDirectory() {
        var e = assertThrows(DiscoveryException.class, scanner::scan);
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    @DisplayName("suffix and exclusions come from configuration")
    void configurable() throws Exception {
        properties.getDiscovery().setSourceDir("src");
        properties.getDiscovery().setSuffix("Handler.java");
        properties.getDiscovery().setExcludeNames(List.of("BaseHandler"));
        touch("src/UserHandler.java");
        touch("src/BaseHandler.java");
        touch("src/Other.java");

        assertEquals(List.of("UserHandler"), scanner.scan().stream().map(Unit::name).toList());
    }

    @Test
    @DisplayName("empty source directory yields no units")
    void emptyDirectory() throws Exception {
        Files.createDirectories(root.resolve("app/controllers"));
        assertTrue(scanner.scan().isEmpty());
    }
}
