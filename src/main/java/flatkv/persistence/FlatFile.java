package flatkv.persistence;

import com.google.common.base.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flat text mirror of the store: one {@code key<TAB>value} line per entry, no header.
 * Keys and values are not escaped, so a tab or newline inside either corrupts the file.
 * {@link #save(Map)} truncates and rewrites in place; a crash mid-write leaves a
 * truncated file behind.
 */
public class FlatFile {

    private static final Logger logger = LoggerFactory.getLogger(FlatFile.class);

    private static final char DELIMITER = '\t';
    private static final Splitter ENTRY_SPLITTER = Splitter.on(DELIMITER).limit(2);

    private final Path file;

    public FlatFile(Path file) {
        this.file = file;
    }

    public Path path() {
        return file;
    }

    /**
     * Reads every well formed line. A missing file reads as empty; lines without a tab
     * are skipped. An I/O failure is logged and the entries read before it are returned.
     */
    public Map<String, String> load() {
        Map<String, String> entries = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            logger.info("no store file at {}, starting empty", file);
            return entries;
        }

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.strip();
                if (line.isEmpty()) continue;
                List<String> parts = ENTRY_SPLITTER.splitToList(line);
                if (parts.size() == 2) {
                    entries.put(parts.get(0), parts.get(1));
                } else {
                    logger.debug("skipping malformed line in {}", file);
                }
            }
        } catch (IOException e) {
            logger.error("Error loading data from {}, keeping {} entries read so far", file, entries.size(), e);
        }
        return entries;
    }

    public void save(Map<String, String> entries) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                writer.write(entry.getKey());
                writer.write(DELIMITER);
                writer.write(entry.getValue());
                writer.write('\n');
            }
        }
    }
}
