package ai.blackjack.player;

import ai.blackjack.game.Action;
import ai.blackjack.game.GameState;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Human player that reads commands from stdin (CLI).
 */
@Component
@Profile("ai-human")
public class HumanPlayer implements Player {
    private static final String PROMPT = "Enter command (hit | stand): ";

    private final Scanner scanner;
    private final PrintStream out;

    @Autowired
    public HumanPlayer() {
        this(System.in, System.out);
    }

    public HumanPlayer(InputStream in, PrintStream out) {
        this.scanner = new Scanner(in);
        this.out = out;
    }

    @Override
    public Action nextAction(GameState state) {
        while (true) {
            out.println(state);
            out.print(PROMPT);
            if (!scanner.hasNextLine()) {
                return null;
            }
            String input = scanner.nextLine();
            Action action = Action.parse(input);
            if (action != null) {
                return action;
            }
            out.println("Unknown command \"" + input.trim() + "\". Use 'hit' or 'stand'.");
        }
    }
}
