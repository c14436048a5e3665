package io.github.nicechester.logos.tool;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.nicechester.logos.parser.StrongsNumberNormalizer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Standalone tool to refresh the {@code strong_def} of every token in the verse file from a
 * Strong's definitions file.
 *
 * <p>Usage:
 * <pre>
 * mvn exec:java -Dexec.mainClass="io.github.nicechester.logos.tool.StrongsDefinitionUpdater" \
 *     -Dexec.args="--verses src/main/resources/data/verses.json --definitions strongs_cleaned.json"
 * </pre>
 */
public class StrongsDefinitionUpdater {

    private static final String DEFAULT_VERSES = "src/main/resources/data/verses.json";
    private static final String DEFAULT_DEFINITIONS = "src/main/resources/data/lexicon.json";
    private static final int MISSING_PREVIEW_LIMIT = 20;

    private final ObjectMapper mapper;
    private final StrongsNumberNormalizer strongsNormalizer;

    public StrongsDefinitionUpdater(ObjectMapper mapper, StrongsNumberNormalizer strongsNormalizer) {
        this.mapper = mapper;
        this.strongsNormalizer = strongsNormalizer;
    }

    /**
     * Counts produced by a single update run.
     */
    public record UpdateSummary(int updated, int notFound, SortedSet<String> missingNumbers) {}

    public static void main(String[] args) throws Exception {
        String versesPath = DEFAULT_VERSES;
        String definitionsPath = DEFAULT_DEFINITIONS;
        String outputPath = null;

        for (int i = 0; i < args.length; i++) {
            if ("--verses".equals(args[i]) && i + 1 < args.length) {
                versesPath = args[++i];
            } else if ("--definitions".equals(args[i]) && i + 1 < args.length) {
                definitionsPath = args[++i];
            } else if ("--output".equals(args[i]) && i + 1 < args.length) {
                outputPath = args[++i];
            } else if ("--help".equals(args[i])) {
                printHelp();
                return;
            }
        }

        StrongsDefinitionUpdater updater = new StrongsDefinitionUpdater(new ObjectMapper(), new StrongsNumberNormalizer());
        updater.run(Path.of(versesPath), Path.of(definitionsPath),
            Path.of(outputPath != null ? outputPath : versesPath));
    }

    private static void printHelp() {
        System.out.println("Usage: StrongsDefinitionUpdater [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --verses <path>       Verse file to update");
        System.out.println("                        Default: " + DEFAULT_VERSES);
        System.out.println("  --definitions <path>  Strong's number -> definition JSON");
        System.out.println("                        Default: " + DEFAULT_DEFINITIONS);
        System.out.println("  --output <path>       Where to write the result (default: overwrite --verses)");
        System.out.println("  --help                Show this help message");
    }

    public UpdateSummary run(Path versesFile, Path definitionsFile, Path outputFile) throws IOException {
        System.out.println("Loading Strong's definitions from " + definitionsFile + "...");
        Map<String, String> definitions = mapper.readValue(definitionsFile.toFile(),
            new TypeReference<Map<String, String>>() {});
        System.out.println("✓ Loaded " + definitions.size() + " definitions");

        System.out.println("Loading verses from " + versesFile + "...");
        JsonNode root = mapper.readTree(versesFile.toFile());
        if (!(root instanceof ObjectNode verses)) {
            throw new IOException("Verse file is not a JSON object: " + versesFile);
        }
        System.out.println("✓ Loaded " + verses.size() + " verses");

        UpdateSummary summary = update(verses, definitions);

        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputFile.toFile(), verses);

        System.out.println();
        System.out.println("════════════════════════════════════════════════════════════");
        System.out.println("Update complete!");
        System.out.println("────────────────────────────────────────────────────────────");
        System.out.printf("  Output:               %s%n", outputFile);
        System.out.printf("  Definitions updated:  %,d%n", summary.updated());
        System.out.printf("  Numbers not found:    %,d%n", summary.notFound());
        if (!summary.missingNumbers().isEmpty()) {
            System.out.printf("  Missing (%d unique):%n", summary.missingNumbers().size());
            summary.missingNumbers().stream()
                .limit(MISSING_PREVIEW_LIMIT)
                .forEach(number -> System.out.println("    - " + number));
            if (summary.missingNumbers().size() > MISSING_PREVIEW_LIMIT) {
                System.out.printf("    ... and %d more%n", summary.missingNumbers().size() - MISSING_PREVIEW_LIMIT);
            }
        }
        System.out.println("════════════════════════════════════════════════════════════");

        return summary;
    }

    /**
     * Rewrites {@code strong_def} in place on every token whose Strong's number has a definition.
     * Numbers are matched in normalized form, so "g0025" in the verse file finds "G25".
     */
    public UpdateSummary update(ObjectNode verses, Map<String, String> definitions) {
        Map<String, String> normalizedDefinitions = new HashMap<>();
        definitions.forEach((number, definition) ->
            normalizedDefinitions.putIfAbsent(strongsNormalizer.tryNormalize(number).orElse(number), definition));

        int updated = 0;
        int notFound = 0;
        SortedSet<String> missing = new TreeSet<>();

        for (JsonNode verse : verses) {
            JsonNode tokens = verse.get("tokens");
            if (tokens == null || !tokens.isArray()) continue;

            for (JsonNode token : tokens) {
                String strongs = token.path("strongs").asText("");
                if (strongs.isEmpty() || !(token instanceof ObjectNode tokenNode)) continue;

                String key = strongsNormalizer.tryNormalize(strongs).orElse(strongs);
                String definition = normalizedDefinitions.get(key);
                if (definition == null) {
                    notFound++;
                    missing.add(strongs);
                    continue;
                }

                if (!definition.equals(token.path("strong_def").asText(""))) {
                    tokenNode.put("strong_def", definition);
                    updated++;
                }
            }
        }

        return new UpdateSummary(updated, notFound, missing);
    }
}
