package com.mischwald.scorer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mischwald.scorer.api.CardScoreDetail;
import com.mischwald.scorer.api.PlayerInput;
import com.mischwald.scorer.api.PlayerScoreResult;
import com.mischwald.scorer.card.CardDatabase;
import com.mischwald.scorer.card.CardDatabaseException;
import com.mischwald.scorer.scoring.MischwaldScorer;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Mischwald scorer CLI - Main entry point.
 */
@Command(name = "mischwald-scorer",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Scores Mischwald layouts from detected card boxes",
        subcommands = {
                Main.ScoreCommand.class
        })
public class Main implements Runnable {

    /** Card file bundled on the classpath. */
    static final String DEFAULT_CARDS_RESOURCE = "cards.json";

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    enum OutputFormat { json, text }

    // ========== SCORE COMMAND ==========
    @Command(name = "score", description = "Score the players in a detection file")
    static class ScoreCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "JSON file with an array of players and their detected cards")
        String inputPath;

        @Option(names = {"-c", "--cards"},
                description = "Path to the card definitions (default: bundled cards.json)")
        String cardsPath;

        @Option(names = {"-f", "--format"}, defaultValue = "text",
                description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
        OutputFormat format;

        @Override
        public Integer call() throws Exception {
            CardDatabase db;
            try {
                db = cardsPath != null
                        ? CardDatabase.fromFile(cardsPath)
                        : CardDatabase.fromResource(DEFAULT_CARDS_RESOURCE);
            } catch (CardDatabaseException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return 1;
            }

            ObjectMapper mapper = new ObjectMapper()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            List<PlayerInput> players;
            try {
                players = mapper.readValue(Files.readString(Path.of(inputPath)),
                        new TypeReference<List<PlayerInput>>() {});
            } catch (IOException e) {
                System.err.println("✗ Failed to read players from '" + inputPath + "': " + e.getMessage());
                return 1;
            }

            List<PlayerScoreResult> results = new MischwaldScorer(db).score(players);

            if (format == OutputFormat.json) {
                System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(results));
            } else {
                printResults(System.out, results);
            }
            return 0;
        }
    }

    // ========== HELPER METHODS ==========

    /**
     * Print one block per player: card lines, then the total.
     */
    static void printResults(PrintStream out, List<PlayerScoreResult> results) {
        for (PlayerScoreResult result : results) {
            out.println("\n=== " + result.name() + " ===\n");
            for (CardScoreDetail detail : result.cardDetails()) {
                out.printf("  %-28s %4d  %-12s %s%n",
                        detail.cardId(), detail.points(),
                        detail.group() != null ? detail.group() : "-",
                        detail.reason());
            }
            out.println("-".repeat(50));
            out.printf("  %-28s %4d%n", "Total", result.totalScore());
        }
    }
}
