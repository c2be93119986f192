package org.carball.motif.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.motif.config.ConfigurationLoader;
import org.carball.motif.config.EngineSettings;
import org.carball.motif.config.OutputFormat;
import org.carball.motif.model.Solution;
import org.carball.motif.model.SolutionCategory;
import org.carball.motif.model.SolutionMetrics;
import org.carball.motif.model.TechStack;
import org.carball.motif.output.SolutionReport;
import org.carball.motif.persistence.BehaviorLogFile;
import org.carball.motif.recommendation.RecommendationContext;
import org.carball.motif.recommendation.RecommendationResult;
import org.carball.motif.repository.SearchFilters;
import org.carball.motif.repository.SolutionStorageException;
import org.carball.motif.studio.SolutionStudio;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class SolutionStudioCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════╗
        ║          Motif Solution Engine v%s             ║
        ╚═══════════════════════════════════════════════════╝
        """;

    private static final Set<String> COMMANDS = Set.of(
            "stats", "search", "top-rated", "most-used", "trending", "recommend", "evaluate", "report");
    private static final Set<String> COMMANDS_WITH_ARGUMENT = Set.of("search", "evaluate");
    private static final Set<String> SETTINGS_OPTIONS = Set.of(
            "--storage", "--config", "--cache-ttl", "--cache-size", "--recent-days",
            "--trending-days", "--similar-limit", "--auto-evaluate");

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1 || isHelpRequested(args)) {
            out.printf((BANNER) + "%n", VERSION);
            printUsage(out);
            return args.length < 1 ? 1 : 0;
        }

        try {
            CommandOptions options = parseArgs(args);
            EngineSettings settings = new ConfigurationLoader().loadConfiguration(args);

            SolutionStudio studio = SolutionStudio.open(settings, null);
            Path behaviorLog = settings.getStoragePath().resolve(BehaviorLogFile.DEFAULT_FILE_NAME);
            if (Files.exists(behaviorLog)) {
                importBehaviorLog(studio, behaviorLog);
            }

            SolutionReport report = execute(studio, settings, options);
            String rendered = options.getFormat() == OutputFormat.JSON ? report.toJson() : report.toMarkdown();

            if (options.getOutputFile() != null) {
                Files.writeString(Paths.get(options.getOutputFile()), rendered);
                out.println("Report written to " + options.getOutputFile());
            } else {
                out.println(rendered);
            }
            return 0;

        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException | SolutionStorageException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        }
    }

    private static void importBehaviorLog(SolutionStudio studio, Path behaviorLog) {
        try {
            studio.importBehavior(behaviorLog);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Ignoring unreadable behavior log {}: {}", behaviorLog, e.getMessage());
        }
    }

    static SolutionReport execute(SolutionStudio studio, EngineSettings settings, CommandOptions options) {
        int limit = options.getLimit() != null ? options.getLimit() : settings.getDefaultLimit();
        LocalDateTime now = LocalDateTime.now();

        switch (options.getCommand()) {
            case "stats":
                return new SolutionReport("Solution Repository Statistics",
                        studio.getRepository().statistics(), null, null, now);

            case "search": {
                List<Solution> matches = studio.getRepository().search(options.getArgument(), filtersFrom(options));
                return new SolutionReport("Search: " + options.getArgument(),
                        null, matches.stream().limit(limit).collect(Collectors.toList()), null, now);
            }

            case "top-rated":
                return new SolutionReport("Top Rated Solutions",
                        null, studio.getRepository().topRated(limit), null, now);

            case "most-used":
                return new SolutionReport("Most Used Solutions",
                        null, studio.getRepository().mostUsed(limit), null, now);

            case "trending":
                return new SolutionReport("Trending Solutions", null, studio.trending(limit), null, now);

            case "recommend": {
                List<RecommendationResult> results = studio.recommend(contextFrom(options), limit);
                return new SolutionReport("Recommended Solutions", null, null, results, now);
            }

            case "evaluate": {
                Solution solution = studio.getRepository().get(options.getArgument())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown solution: " + options.getArgument()));
                SolutionMetrics metrics = studio.getEvaluator().evaluateAndApply(solution);
                studio.getRepository().update(solution);
                log.info("Evaluated {}: {}", solution.getId(), metrics.getSummary());
                return new SolutionReport("Evaluation: " + solution.getName(),
                        null, List.of(solution), null, now);
            }

            case "report": {
                List<RecommendationResult> results = studio.recommend(contextFrom(options), limit);
                return new SolutionReport("Solution Studio Report",
                        studio.getRepository().statistics(), studio.getRepository().topRated(limit), results, now);
            }

            default:
                throw new IllegalArgumentException("Unknown command: " + options.getCommand());
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage(PrintStream out) {
        out.println("\nUsage: java -jar motif-solution-engine.jar <command> [argument] [options]");
        out.println();
        out.println("Commands:");
        out.println("  stats               Repository statistics");
        out.println("  search <query>      Search name, description and tags");
        out.println("  top-rated           Highest rated solutions");
        out.println("  most-used           Most used solutions");
        out.println("  trending            Solutions trending in the recent window");
        out.println("  recommend           Ranked recommendations for the current context");
        out.println("  evaluate <id>       Re-score a stored solution");
        out.println("  report              Statistics, top rated and recommendations");
        out.println();
        out.println("Options:");
        out.println("  --category <name>   Filter or context category (entrance, exit, transition, ...)");
        out.println("  --tech <name>       Filter or context tech stack (css_animation, gsap, ...)");
        out.println("  --min-quality <num> Minimum overall score (0-100)");
        out.println("  --min-rating <num>  Minimum user rating (0-5)");
        out.println("  --keywords <a,b>    Context keywords for recommendations");
        out.println("  --limit <num>       Maximum number of results");
        out.println("  --format, -f        Output format: json|markdown (default: markdown)");
        out.println("  --output, -o        Write the report to a file");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
    }

    static CommandOptions parseArgs(String[] args) {
        CommandOptions options = new CommandOptions();
        String command = args[0].toLowerCase();
        if (!COMMANDS.contains(command)) {
            throw new IllegalArgumentException("Unknown command: " + args[0]);
        }
        options.setCommand(command);

        int i = 1;
        if (COMMANDS_WITH_ARGUMENT.contains(command)) {
            if (args.length < 2 || args[1].startsWith("--")) {
                throw new IllegalArgumentException("Command '" + command + "' requires an argument");
            }
            options.setArgument(args[1]);
            i = 2;
        }

        for (; i < args.length; i++) {
            String option = args[i];
            if (SETTINGS_OPTIONS.contains(option)) {
                // handled by ConfigurationLoader
                i++;
                continue;
            }

            switch (option) {
                case "--category":
                    options.setCategory(SolutionCategory.fromValue(requireValue(args, ++i, option)));
                    break;

                case "--tech":
                    options.setTechStack(TechStack.fromValue(requireValue(args, ++i, option)));
                    break;

                case "--min-quality":
                    options.setMinQuality(parseNumber(requireValue(args, ++i, option), option));
                    break;

                case "--min-rating":
                    options.setMinRating(parseNumber(requireValue(args, ++i, option), option));
                    break;

                case "--keywords":
                    options.setKeywords(Arrays.stream(requireValue(args, ++i, option).split(","))
                            .map(String::trim)
                            .filter(keyword -> !keyword.isEmpty())
                            .collect(Collectors.toList()));
                    break;

                case "--limit":
                    options.setLimit(parseNumber(requireValue(args, ++i, option), option).intValue());
                    break;

                case "--format":
                case "-f":
                    options.setFormat(OutputFormat.fromOption(requireValue(args, ++i, option)));
                    break;

                case "--output":
                case "-o":
                    options.setOutputFile(requireValue(args, ++i, option));
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + option);
            }
        }

        return options;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Value not specified for " + option);
        }
        return args[index];
    }

    private static Double parseNumber(String value, String option) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + option + ": " + value);
        }
    }

    static SearchFilters filtersFrom(CommandOptions options) {
        return SearchFilters.builder()
                .category(options.getCategory())
                .techStack(options.getTechStack())
                .minQuality(options.getMinQuality())
                .minRating(options.getMinRating())
                .build();
    }

    static RecommendationContext contextFrom(CommandOptions options) {
        return RecommendationContext.builder()
                .targetCategory(options.getCategory())
                .preferredTech(options.getTechStack())
                .keywords(options.getKeywords() == null ? Collections.emptyList() : options.getKeywords())
                .build();
    }
}
