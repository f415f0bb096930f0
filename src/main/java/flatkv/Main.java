package flatkv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.defaults();
        if (args.length > 0) config = config.withPort(Integer.parseInt(args[0]));
        if (args.length > 1) config = config.withStorePath(args[1]);

        FlatKvServer server = new FlatKvServer(config);
        try {
            server.start();
        } catch (Exception e) {
            logger.error("Some error during server start {}", e.getMessage(), e);
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Server is shutting down gracefully.");
            server.stop();
        }, "flatkv-shutdown"));

        try {
            server.awaitStop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop();
        }
    }
}
