package io.stepjs.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ResourceTest {

    @TempDir
    Path tempDir;

    @Test
    void testText() {
        Resource resource = Resource.text("var a = 1;\r\nvar b = 2;\nb");
        assertFalse(resource.isFile());
        assertEquals("", resource.getRelativePath());
        assertEquals("", resource.getPrefixedPath());
        assertEquals("var a = 1;", resource.getLine(0));
        assertEquals("var b = 2;", resource.getLine(1));
        assertEquals("b", resource.getLine(2));
        assertEquals("", resource.getLine(3));
        assertEquals("", resource.getLine(-1));
        assertEquals("(inline)", resource.toString());
    }

    @Test
    void testTextWithPath() {
        Resource resource = Resource.text("1 + 2", "scripts/add.js");
        assertFalse(resource.isFile());
        assertEquals("scripts/add.js", resource.getRelativePath());
        assertEquals("scripts/add.js", resource.toString());
    }

    @Test
    void testNullText() {
        Resource resource = Resource.text(null);
        assertEquals("", resource.getText());
        assertEquals("", resource.getLine(0));
    }

    @Test
    void testFile() throws IOException {
        Path file = tempDir.resolve("test.js");
        Files.writeString(file, "// héllo\nvar x = 1;\n", StandardCharsets.UTF_8);
        Resource resource = Resource.from(file);
        assertTrue(resource.isFile());
        assertEquals("// héllo\nvar x = 1;\n", resource.getText());
        assertEquals("var x = 1;", resource.getLine(1));
        assertTrue(resource.getRelativePath().endsWith("test.js"));
        assertTrue(resource.getPrefixedPath().startsWith("file:"));
        assertEquals(file, ((PathResource) resource).getPath());
    }

    @Test
    void testMissingFile() {
        Resource resource = Resource.from(tempDir.resolve("missing.js"));
        UncheckedIOException e = assertThrows(UncheckedIOException.class, resource::getText);
        assertTrue(e.getMessage().contains("missing.js"));
    }

}
