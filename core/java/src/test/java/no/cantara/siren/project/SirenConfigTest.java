package no.cantara.siren.project;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SirenConfigTest {

    private static SirenConfig parse(String yaml) {
        return SirenConfig.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void parsesKnownKeys() {
        SirenConfig config = parse("project_name: Apollo\nparallel: false\n");

        assertEquals("Apollo", config.projectName());
        assertFalse(config.parallel());
    }

    @Test
    void emptyDocumentIsDefaults() {
        assertEquals(SirenConfig.defaults(), parse(""));
    }

    @Test
    void missingFileIsDefaults(@TempDir Path dir) throws IOException {
        assertEquals(SirenConfig.defaults(), SirenConfig.load(dir.resolve("siren.config.yaml")));
    }

    @Test
    void nonStringNameIsStringified() {
        assertEquals("2024", SirenConfig.fromMap(Map.of("project_name", 2024)).projectName());
    }

    @Test
    void rejectsNonMappingRoot() {
        assertThrows(IllegalArgumentException.class, () -> parse("- a\n- b\n"));
    }

    @Test
    void rejectsNonBooleanParallel() {
        assertThrows(IllegalArgumentException.class, () -> parse("parallel: sometimes\n"));
    }

    @Test
    void refusesArbitraryTypeTags() {
        assertThrows(RuntimeException.class, () -> parse("!!java.io.File [\"/tmp\"]\n"));
    }
}
