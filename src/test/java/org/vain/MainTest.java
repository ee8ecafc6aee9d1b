package org.vain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
public class MainTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path path = dir.resolve(name);
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    @Test
    public void testBuildDirectory() throws IOException {
        write("a.vain", "const a = 1\n");
        write("b.vain", "let b: Int\n");
        assertEquals(0, Main.run(new String[]{"build", dir.toString()}));
        assertTrue(Files.exists(dir.resolve("a.vim")));
        assertTrue(Files.exists(dir.resolve("b.vim")));
    }

    @Test
    public void testFailureExitStatus() throws IOException {
        Path bad = write("bad.vain", "const a = b\n");
        assertEquals(1, Main.run(new String[]{"build", bad.toString()}));
        assertFalse(Files.exists(dir.resolve("bad.vim")));
    }

    @Test
    public void testConfigFile() throws IOException {
        Path source = write("a.vain", "const a = b\n");
        Path config = write("rules.yaml", "rules:\n  undeclared-variable: false\n");
        assertEquals(0, Main.run(new String[]{"--config", config.toString(), "build", source.toString()}));

        Path broken = write("broken.yaml", "rules:\n  nonsense: false\n");
        assertEquals(1, Main.run(new String[]{"--config", broken.toString(), "build", source.toString()}));
    }

    @Test
    public void testUsageErrors() {
        assertEquals(1, Main.run(new String[]{"--bogus"}));
        assertEquals(1, Main.run(new String[]{"build", dir.resolve("missing").toString()}));
    }

    @Test
    public void testHelpMentionsDroppedComments() {
        PrintStream saved = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
            assertEquals(0, Main.run(new String[]{"--help"}));
        } finally {
            System.setOut(saved);
        }
        String help = captured.toString(StandardCharsets.UTF_8);
        assertTrue(help.contains("fmt "), help);
        assertTrue(help.contains("comments inside (), [] and {} are not kept"), help);
    }

    @Test
    public void testInformational() throws IOException {
        assertEquals(0, Main.run(new String[]{"--version"}));
        assertEquals(0, Main.run(new String[]{"--help"}));
        Path source = write("a.vain", "const a = [1, 2]\n");
        assertEquals(0, Main.run(new String[]{"--tokenize", "build", source.toString()}));
        assertEquals(0, Main.run(new String[]{"--parse", "build", source.toString()}));
        Path bad = write("bad.vain", "const = 1\n");
        assertEquals(1, Main.run(new String[]{"--parse", "dump", bad.toString()}));
    }
}
