package confetti.tool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import confetti.lang.ConfMapper;
import confetti.lang.Confetti;
import confetti.lang.MapperOptions;
import confetti.lang.ParserOptions;

public class ConfettiFilesTest {

    record Database(String url, int poolSize, List<String> replicas) {}

    @TempDir
    Path tempDir;

    ConfMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ConfMapper();
    }

    @Test
    void saveAndLoadRecord() {
        var path = tempDir.resolve("db.conf");
        var database = new Database("jdbc:h2:mem:test", 4, List.of("r1", "r2"));

        ConfettiFiles.toFile(path, database, mapper);

        assertEquals(database, ConfettiFiles.fromFile(path, Database.class, mapper));
    }

    @Test
    void parseFileReadsUtf8() throws Exception {
        var path = tempDir.resolve("greeting.conf");
        Files.writeString(path, "greeting \"grüß dich\"\n");

        var tree = ConfettiFiles.parseFile(path, ParserOptions.DEFAULT);

        assertEquals(List.of("grüß dich"), tree.directives().get(0).argumentValues());
    }

    @Test
    void writeTree() {
        var path = tempDir.resolve("tree.conf");

        ConfettiFiles.writeTree(path, Confetti.parse("a{b}"), MapperOptions.DEFAULT);

        assertEquals("a {\n  b;\n}\n", ConfettiFiles.read(path));
    }

    @Test
    void missingFile() {
        var path = tempDir.resolve("nope.conf");

        var ex = assertThrows(ConfettiIoException.class, () -> ConfettiFiles.parseFile(path, ParserOptions.DEFAULT));
        assertEquals(path, ex.getPath());
    }

    @Test
    void unwritableLocation() {
        var path = tempDir.resolve("no-such-dir").resolve("out.conf");

        assertThrows(ConfettiIoException.class, () -> ConfettiFiles.write(path, "a;\n"));
    }
}
