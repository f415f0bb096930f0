package flatkv.persistence;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlatFileTest {

    @TempDir
    Path dir;

    @Test
    void missingFileLoadsEmpty() {
        assertTrue(new FlatFile(dir.resolve("absent.txt")).load().isEmpty());
    }

    @Test
    void malformedLinesAreSkipped() throws IOException {
        Path file = dir.resolve("store.txt");
        Files.write(file, List.of("a\t1", "no-delimiter", "", "   ", "b\t2", "trailing\t"));

        Map<String, String> entries = new FlatFile(file).load();
        assertEquals(Map.of("a", "1", "b", "2"), entries);
    }

    @Test
    void splitsOnFirstTabOnly() throws IOException {
        Path file = dir.resolve("store.txt");
        Files.write(file, List.of("k\tv\twith\ttabs"));

        assertEquals("v\twith\ttabs", new FlatFile(file).load().get("k"));
    }

    @Test
    void laterLinesOverrideEarlierOnes() throws IOException {
        Path file = dir.resolve("store.txt");
        Files.write(file, List.of("k\t1", "k\t2"));

        assertEquals(Map.of("k", "2"), new FlatFile(file).load());
    }

    @Test
    void unreadableFileIsReportedNotThrown() {
        // a directory exists but cannot be read as text
        assertTrue(assertDoesNotThrow(() -> new FlatFile(dir).load()).isEmpty());
    }

    @Test
    void saveRewritesWholeFile() throws IOException {
        Path file = dir.resolve("store.txt");
        Files.write(file, List.of("stale\tentry", "other\tline"));

        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("x", "1");
        entries.put("y", "2");
        new FlatFile(file).save(entries);

        assertEquals("x\t1\ny\t2\n", Files.readString(file));
    }

    @Test
    void saveIntoMissingDirectoryFails() {
        FlatFile flatFile = new FlatFile(dir.resolve("missing").resolve("store.txt"));
        assertThrows(IOException.class, () -> flatFile.save(Map.of("a", "1")));
    }
}
