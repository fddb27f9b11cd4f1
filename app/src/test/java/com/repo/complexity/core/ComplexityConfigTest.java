package com.repo.complexity.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        ComplexityConfig config = ComplexityConfig.defaults();
        assertTrue(config.isLogicalOr());
        assertTrue(config.isSwitchCase());
        assertFalse(config.isForIn());
        assertFalse(config.isTryCatch());
        assertFalse(config.isNewMi());
    }

    @Test
    void testYamlLoading() throws IOException {
        Path yamlFile = tempDir.resolve("complexity.yaml");
        String yamlContent = """
                logicalor: false
                forin: true
                newmi: true
                """;
        Files.writeString(yamlFile, yamlContent);

        ComplexityConfig config = ComplexityConfig.load(tempDir);

        assertFalse(config.isLogicalOr(), "Should override default logicalor");
        assertTrue(config.isForIn(), "Should override default forin");
        assertTrue(config.isNewMi(), "Should override default newmi");
        assertTrue(config.isSwitchCase(), "Unset keys keep their defaults");
        assertFalse(config.isTryCatch(), "Unset keys keep their defaults");
    }

    @Test
    void testNonBooleanValuesAreIgnored() throws IOException {
        Files.writeString(tempDir.resolve("complexity.yaml"), "switchcase: maybe\n");

        ComplexityConfig config = ComplexityConfig.load(tempDir);

        assertTrue(config.isSwitchCase());
    }

    @Test
    void testMissingFileUsesDefaults() {
        ComplexityConfig config = ComplexityConfig.load(tempDir);

        assertTrue(config.isLogicalOr());
        assertFalse(config.isNewMi());
    }

    @Test
    void testNonMappingDocumentUsesDefaults() throws IOException {
        Files.writeString(tempDir.resolve("complexity.yaml"), "- newmi\n- true\n");

        ComplexityConfig config = ComplexityConfig.load(tempDir);

        assertTrue(config.isLogicalOr());
        assertFalse(config.isNewMi());
    }

    @Test
    void testBrokenYamlUsesDefaults() throws IOException {
        Files.writeString(tempDir.resolve("complexity.yaml"), "newmi: [true\nforin: {\n");

        ComplexityConfig config = ComplexityConfig.load(tempDir);

        assertFalse(config.isNewMi());
        assertFalse(config.isForIn());
    }
}
