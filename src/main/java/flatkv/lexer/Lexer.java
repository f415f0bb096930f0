package flatkv.lexer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class Lexer {

    // blank input yields no tokens
    public List<String> tokenize(String command) {
        if (command == null || command.isBlank()) {
            return new ArrayList<>();
        }

        String[] tokens = command.trim().split("\\s+");
        return new ArrayList<>(Arrays.asList(tokens));
    }
}
