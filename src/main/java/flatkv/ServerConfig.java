package flatkv;

import com.google.common.base.Preconditions;

/**
 * Construction-time settings for {@link FlatKvServer}. Start from {@link #defaults()}
 * and override with the {@code with*} copies.
 */
public record ServerConfig(String host, int port, String storePath, int backlog,
                           int readBufferSize, int sessionThreads) {

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 3490;
    public static final String DEFAULT_STORE_PATH = "store.txt";
    public static final int DEFAULT_BACKLOG = 10;
    public static final int DEFAULT_READ_BUFFER_SIZE = 1024;
    public static final int DEFAULT_SESSION_THREADS = 16;

    public ServerConfig {
        Preconditions.checkNotNull(host, "host");
        Preconditions.checkNotNull(storePath, "storePath");
        Preconditions.checkArgument(port >= 0 && port <= 65535, "port out of range: %s", port);
        Preconditions.checkArgument(backlog > 0, "backlog must be positive: %s", backlog);
        Preconditions.checkArgument(readBufferSize > 0, "readBufferSize must be positive: %s", readBufferSize);
        Preconditions.checkArgument(sessionThreads > 0, "sessionThreads must be positive: %s", sessionThreads);
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_STORE_PATH, DEFAULT_BACKLOG,
                DEFAULT_READ_BUFFER_SIZE, DEFAULT_SESSION_THREADS);
    }

    public ServerConfig withHost(String host) {
        return new ServerConfig(host, port, storePath, backlog, readBufferSize, sessionThreads);
    }

    public ServerConfig withPort(int port) {
        return new ServerConfig(host, port, storePath, backlog, readBufferSize, sessionThreads);
    }

    public ServerConfig withStorePath(String storePath) {
        return new ServerConfig(host, port, storePath, backlog, readBufferSize, sessionThreads);
    }
}
