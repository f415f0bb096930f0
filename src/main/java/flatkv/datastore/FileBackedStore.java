package flatkv.datastore;

import flatkv.command.CommandResult;
import flatkv.persistence.FlatFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory map mirrored to a {@link FlatFile}. Every operation, including the file
 * rewrite that follows a mutation, runs under one lock, so all calls are serialized
 * across connections and readers never see a half-applied change.
 */
public class FileBackedStore implements KeyValueStore {

    private static final Logger logger = LoggerFactory.getLogger(FileBackedStore.class);

    private final FlatFile flatFile;
    private final Map<String, String> store;
    private final ReentrantLock lock;

    public FileBackedStore(Path storePath) {
        this.flatFile = new FlatFile(storePath);
        this.store = new LinkedHashMap<>();
        this.lock = new ReentrantLock();
        load();
    }

    void load() {
        lock.lock();
        try {
            store.putAll(flatFile.load());
            logger.info("{} entries loaded from {}", store.size(), flatFile.path());
        } finally {
            lock.unlock();
        }
    }

    // save failures are logged only; callers still report the mutation as applied
    private void save() {
        lock.lock();
        try {
            flatFile.save(store);
        } catch (IOException e) {
            logger.error("Error saving data to {}", flatFile.path(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CommandResult set(String key, String value) {
        lock.lock();
        try {
            logger.debug("setting key '{}' to value '{}'", key, value);
            store.put(key, value);
            save();
        } finally {
            lock.unlock();
        }
        return CommandResult.ok("Added key '" + key + "' with value '" + value + "'\n");
    }

    @Override
    public CommandResult get(String key) {
        lock.lock();
        try {
            String value = store.get(key);
            return value == null ? notFound(key) : CommandResult.ok(value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CommandResult remove(String key) {
        lock.lock();
        try {
            if (!store.containsKey(key)) {
                return notFound(key);
            }
            store.remove(key);
            save();
            return CommandResult.ok("Removed key '" + key + "'.\n");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CommandResult print() {
        lock.lock();
        try {
            if (store.isEmpty()) {
                return CommandResult.ok("Store is empty.\n");
            }
            StringBuilder response = new StringBuilder();
            store.forEach((key, value) ->
                    response.append("[KEY]: ").append(key).append("\t[VALUE]: ").append(value).append('\n'));
            return CommandResult.ok(response.toString());
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    private static CommandResult notFound(String key) {
        return CommandResult.error("Key '" + key + "' not found.");
    }
}
