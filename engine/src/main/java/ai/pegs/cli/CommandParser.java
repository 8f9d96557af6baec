package ai.pegs.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code find} and {@code simulate <seed>} from the raw program arguments. Command names
 * must match exactly, in lower case.
 * <p>
 * Spring Boot options ({@code --key=value}) are skipped so configuration can be passed alongside
 * the command.
 */
public final class CommandParser {

    public static final String USAGE = String.join("\n",
            "usage: peg-solitaire <command> [seed]",
            "",
            "    available commands:",
            "        find            run until a solution with score 1 is found",
            "        simulate        simulate a game from given seed",
            "",
            "    arguments:",
            "        seed            provide seed for a given simulation, only",
            "                        used when command is \"simulate\".",
            "                        use seed 0 for random seed.");

    private CommandParser() {
    }

    /**
     * Parses the command line.
     *
     * @param args raw program arguments
     * @return the command to run
     * @throws UsageException if the command is missing or unknown, has the wrong number of
     *                        arguments, or the seed is not a non-negative integer
     */
    public static Command parse(String... args) throws UsageException {
        List<String> words = new ArrayList<>();
        if (args != null) {
            for (String arg : args) {
                if (arg != null && !arg.startsWith("--")) {
                    words.add(arg.trim());
                }
            }
        }
        if (words.isEmpty()) {
            throw new UsageException("missing command");
        }
        switch (words.get(0)) {
            case "find":
                if (words.size() != 1) {
                    throw new UsageException("find takes no arguments");
                }
                return Command.find();
            case "simulate":
                if (words.size() != 2) {
                    throw new UsageException("simulate takes exactly one seed");
                }
                return Command.simulate(parseSeed(words.get(1)));
            default:
                throw new UsageException("unknown command: " + words.get(0));
        }
    }

    private static long parseSeed(String text) throws UsageException {
        long seed;
        try {
            seed = Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new UsageException("unable to parse seed: " + text, e);
        }
        if (seed < 0) {
            throw new UsageException("seed must not be negative: " + text);
        }
        return seed;
    }
}
