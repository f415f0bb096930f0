package flatkv.client;

import flatkv.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Blocking client for the line protocol. Mirrors the server's framing: one write per
 * command and one bounded read per reply.
 */
public class FlatKvClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FlatKvClient.class);

    private final String host;
    private final int port;
    private final byte[] readBuffer = new byte[ServerConfig.DEFAULT_READ_BUFFER_SIZE];
    private Socket socket;

    public FlatKvClient(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public void connect() throws IOException {
        socket = new Socket(host, port);
        logger.info("Connected to server at {}:{}", host, port);
    }

    public void send(String message) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(message.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    /** @return the reply text, or {@code null} once the server has closed the connection */
    public String receive() throws IOException {
        InputStream in = socket.getInputStream();
        int read = in.read(readBuffer);
        if (read <= 0) {
            return null;
        }
        return new String(readBuffer, 0, read, StandardCharsets.UTF_8);
    }

    public String request(String message) throws IOException {
        send(message);
        return receive();
    }

    @Override
    public void close() throws IOException {
        if (socket != null) {
            socket.close();
            socket = null;
        }
    }
}
