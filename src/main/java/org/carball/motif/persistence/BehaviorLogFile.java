package org.carball.motif.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.motif.behavior.BehaviorEvent;
import org.carball.motif.behavior.BehaviorTracker;
import org.carball.motif.preference.PreferenceModel;
import org.carball.motif.preference.PreferenceVector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports the behavior log, with the preferences derived from it, to a JSON
 * document and reads the events back. The preference block is informational;
 * on import preferences are derived again from the events.
 */
@Slf4j
public class BehaviorLogFile {

    public static final String DEFAULT_FILE_NAME = "behavior_log.json";

    private final Path file;
    private final ObjectMapper objectMapper;

    public BehaviorLogFile(Path file) {
        this.file = file;
        this.objectMapper = SolutionJson.createMapper();
    }

    public void export(BehaviorTracker tracker, PreferenceModel preferenceModel) throws IOException {
        PreferenceVector preferences = preferenceModel.derive();

        ObjectNode root = objectMapper.createObjectNode();
        root.set("exported_at", objectMapper.valueToTree(LocalDateTime.now(tracker.getClock())));
        root.put("event_count", tracker.size());
        root.set("events", objectMapper.valueToTree(tracker.getEvents()));

        ObjectNode preferenceNode = root.putObject("preferences");
        ObjectNode categories = preferenceNode.putObject("category_weights");
        preferences.getCategoryWeights().forEach((category, weight) -> categories.put(category.getValue(), weight));
        ObjectNode stacks = preferenceNode.putObject("tech_stack_weights");
        preferences.getTechStackWeights().forEach((stack, weight) -> stacks.put(stack.getValue(), weight));
        preferenceNode.put("quality_threshold", preferences.getQualityThreshold());
        preferenceNode.put("complexity_appetite", preferences.getComplexityAppetite());
        preferenceNode.put("novelty_appetite", preferences.getNoveltyAppetite());

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(file.toFile(), root);
        log.info("Exported {} behavior events to {}", tracker.size(), file);
    }

    /**
     * Reads the events of a previously exported log. A missing file yields no
     * events.
     */
    public List<BehaviorEvent> read() throws IOException {
        if (!Files.exists(file)) {
            log.debug("No behavior log at {}", file);
            return new ArrayList<>();
        }
        JsonNode events = objectMapper.readTree(file.toFile()).path("events");
        if (!events.isArray()) {
            throw new IOException("Behavior log " + file + " has no events array");
        }
        return objectMapper.convertValue(events, new TypeReference<List<BehaviorEvent>>() {
        });
    }

    /**
     * Appends the exported events to the tracker.
     *
     * @return number of imported events
     */
    public int importInto(BehaviorTracker tracker) throws IOException {
        List<BehaviorEvent> events = read();
        tracker.importEvents(events);
        return events.size();
    }

    public Path getFile() {
        return file;
    }
}
