package com.repo.complexity.tree;

import com.repo.complexity.core.Location;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxTreeLoaderTest {

    private final SyntaxTreeLoader loader = new SyntaxTreeLoader();

    @TempDir
    Path tempDir;

    @Test
    void testNodesAttributesAndLocations() {
        SyntaxNode root = loader.parse("""
                type: Program
                loc: {start: 1, end: 6}
                children:
                  - type: FunctionDeclaration
                    name: add
                    params: [a, b]
                    loc: {start: {line: 2}, end: {line: 4}}
                    children:
                      - type: ReturnStatement
                """);

        assertEquals("Program", root.type());
        assertEquals(Optional.of(new Location(1, 6)), root.getLocation());
        assertEquals(1, root.children().size());

        SyntaxNode function = root.children().get(0);
        assertEquals("add", function.text("name"));
        assertEquals(List.of("a", "b"), function.attribute("params"));
        assertEquals(new Location(2, 4), function.location());
        assertFalse(function.attributes().containsKey("loc"), "Reserved keys are not attributes");
        assertTrue(function.child(0).get().is("ReturnStatement"));
        assertTrue(function.child(0).get().getLocation().isEmpty());
    }

    @Test
    void testLoadFromFile() throws IOException {
        Path file = tempDir.resolve("tree.yaml");
        Files.writeString(file, "{\"type\": \"Program\", \"children\": [{\"type\": \"EmptyStatement\"}]}");

        SyntaxNode root = loader.load(file);

        assertEquals("Program", root.type());
        assertEquals("EmptyStatement", root.children().get(0).type());
    }

    @Test
    void testMalformedDocuments() {
        assertThrows(IllegalArgumentException.class, () -> loader.parse("- just\n- a list\n"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("name: untyped\n"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("type: Program\nchildren: nope\n"));
        assertThrows(IllegalArgumentException.class, () -> loader.parse("type: Program\nchildren: [1, 2]\n"));
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("absent.yaml")));
    }
}
