package flatkv.client;

import flatkv.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

public class ClientMain {

    private static final Logger logger = LoggerFactory.getLogger(ClientMain.class);

    public static void main(String[] args) {
        String host = args.length > 0 ? args[0] : "localhost";
        int port = args.length > 1 ? Integer.parseInt(args[1]) : ServerConfig.DEFAULT_PORT;

        try (FlatKvClient client = new FlatKvClient(host, port);
             BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            client.connect();
            while (true) {
                System.out.print("Enter command (or 'quit' to exit): ");
                String message = console.readLine();
                if (message == null) break;

                client.send(message);
                if (message.strip().equalsIgnoreCase("quit")) {
                    System.out.println("Exiting client.");
                    break;
                }

                String response = client.receive();
                if (response == null) {
                    System.out.println("Server disconnected.");
                    break;
                }
                System.out.println("Response: " + response);
            }
        } catch (IOException e) {
            logger.error("Client failed talking to {}:{}", host, port, e);
        }
    }
}
