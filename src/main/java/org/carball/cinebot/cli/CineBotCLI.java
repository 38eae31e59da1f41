package org.carball.cinebot.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.agent.AgentSession;
import org.carball.cinebot.agent.TurnResult;
import org.carball.cinebot.ai.OpenAiDecisionClient;
import org.carball.cinebot.catalog.CatalogImporter;
import org.carball.cinebot.catalog.CatalogLoader;
import org.carball.cinebot.catalog.CatalogStore;
import org.carball.cinebot.config.AgentSettings;
import org.carball.cinebot.config.ConfigurationLoader;
import org.carball.cinebot.memory.PreferenceMemory;
import org.carball.cinebot.resolver.MovieResolver;
import org.carball.cinebot.tool.CatalogTools;
import org.carball.cinebot.tool.HttpOmdbClient;
import org.carball.cinebot.tool.OmdbTools;
import org.carball.cinebot.tool.ToolRegistry;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Slf4j
public class CineBotCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          CineBot - your movie assistant  v%s               ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;
    private static final Set<String> EXIT_WORDS = Set.of("/exit", "exit", "выход", "пока");

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (isHelpRequested(args)) {
            printUsage();
            System.exit(0);
        }

        try {
            List<String> arguments = new ArrayList<>(Arrays.asList(args));
            boolean verbose = arguments.remove("--verbose");
            verbose |= arguments.remove("-v");
            if (verbose) {
                enableVerboseLogging();
            }

            String command = !arguments.isEmpty() && !arguments.get(0).startsWith("-")
                    ? arguments.remove(0)
                    : "chat";

            switch (command) {
                case "chat":
                    runChat(arguments.toArray(new String[0]));
                    break;
                case "import":
                    runImport(arguments);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown command: " + command);
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static void runChat(String[] options) throws IOException {
        AgentSettings settings = new ConfigurationLoader().loadConfiguration(options);

        System.out.print("🎞️ Loading movie catalog... ");
        CatalogStore catalog = new CatalogLoader().load(Paths.get(settings.getCatalogPath()));
        System.out.println(catalog.isEmpty() ? "not found, catalog tools are limited" : catalog.size() + " movies ✓");

        MovieResolver resolver = MovieResolver.fromSettings(catalog, settings);
        ToolRegistry registry = ToolRegistry.create(
                new CatalogTools(catalog, resolver, settings.getDefaultResultLimit()),
                new OmdbTools(HttpOmdbClient.fromSettings(settings), settings.getDefaultResultLimit()));
        if (settings.getOmdbApiKey() == null || settings.getOmdbApiKey().isBlank()) {
            System.out.println("   OMDb key not set, online lookups will report an error");
        }

        PreferenceMemory memory = new PreferenceMemory(Paths.get(settings.getMemoryFile()), settings.getCorrections());
        AgentSession session = AgentSession.create(settings, OpenAiDecisionClient.fromSettings(settings),
                registry, memory);
        if (session.getProfile().hasName()) {
            System.out.println("   Welcome back, " + session.getProfile().getName() + "!");
        }

        System.out.println("\nAsk me about movies: ratings, casts, plots or what to watch tonight.");
        System.out.println("Type /exit to end the session.");

        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        while (true) {
            System.out.print("\nYou: ");
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            String userText = line.trim();
            if (userText.isEmpty()) {
                continue;
            }
            if (EXIT_WORDS.contains(userText.toLowerCase(Locale.ROOT))) {
                System.out.println("CineBot: Signing off. Come back whenever you want another movie night! 👋");
                break;
            }

            TurnResult result = session.handle(userText);
            System.out.println("CineBot: " + result.getAnswer());
        }
    }

    private static void runImport(List<String> arguments) throws IOException {
        if (arguments.isEmpty() || arguments.get(0).startsWith("-")) {
            throw new IllegalArgumentException("CSV file not specified");
        }
        Path csvFile = Paths.get(arguments.get(0));
        Path databaseFile = arguments.size() > 1 && !arguments.get(1).startsWith("-")
                ? Paths.get(arguments.get(1))
                : Paths.get(AgentSettings.defaults().getCatalogPath());

        System.out.print("📥 Importing " + csvFile + " into " + databaseFile + "... ");
        int imported = new CatalogImporter(new CatalogLoader()).importCsv(csvFile, databaseFile);
        System.out.println("✓");
        System.out.println("\n✅ Imported " + imported + " movies.");
    }

    private static void enableVerboseLogging() {
        Logger logger = (Logger) LoggerFactory.getLogger("org.carball.cinebot");
        logger.setLevel(Level.DEBUG);
        log.debug("Verbose logging enabled");
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar cinebot.jar [chat] [options]");
        System.out.println("       java -jar cinebot.jar import <csv-file> [database-file]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  chat                Interactive movie conversation (default)");
        System.out.println("  import              Build the SQLite catalog from the IMDb Top 1000 CSV");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --api-key           OpenAI API key (or set OPENAI_API_KEY env var)");
        System.out.println("  --omdb-key          OMDb API key (or set OMDB_API_KEY env var)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getSettingsHelp());
        System.out.println("Examples:");
        System.out.println("  java -jar cinebot.jar import imdb_top_1000.csv data/imdb_top_1000.db");
        System.out.println("  java -jar cinebot.jar chat --profile lenient --settings.max-steps 6");
    }
}
