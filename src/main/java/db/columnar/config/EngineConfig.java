package db.columnar.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import db.columnar.error.EngineException;
import db.columnar.exec.AggregateOperator;
import db.columnar.exec.HashJoinOperator;

/**
 * Engine settings read from JSON with Gson. Keys missing from the file keep their defaults:
 * <pre>
 * {
 *   "join":      { "defaultStrategy": "HASH", "hashBuildSide": "SMALLER" },
 *   "aggregate": { "groupOrder": "FIRST_SEEN" }
 * }
 * </pre>
 */
public class EngineConfig {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_RESOURCE = "columnar-engine.json";

    public enum JoinStrategy { HASH, SORT_MERGE, NESTED_LOOP }

    private static final Gson gson = new Gson();

    // Field names mirror the JSON document.
    private Join join = new Join();
    private Aggregate aggregate = new Aggregate();

    static final class Join {
        JoinStrategy defaultStrategy = JoinStrategy.HASH;
        HashJoinOperator.BuildSide hashBuildSide = HashJoinOperator.BuildSide.SMALLER;
    }

    static final class Aggregate {
        AggregateOperator.GroupOrder groupOrder = AggregateOperator.GroupOrder.FIRST_SEEN;
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, falling back to defaults when absent.
     */
    public static EngineConfig load() {
        InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            log.warn("No {} on classpath, using default engine configuration", DEFAULT_RESOURCE);
            return defaults();
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            EngineConfig config = parse(reader, DEFAULT_RESOURCE);
            log.info("Loaded engine configuration from classpath {}: {}", DEFAULT_RESOURCE, config);
            return config;
        } catch (IOException e) {
            throw new EngineException("Failed reading " + DEFAULT_RESOURCE, e);
        }
    }

    public static EngineConfig load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            EngineConfig config = parse(reader, file.toString());
            log.info("Loaded engine configuration from {}: {}", file, config);
            return config;
        } catch (IOException e) {
            throw new EngineException("Failed reading engine configuration " + file, e);
        }
    }

    public static EngineConfig fromJson(String json) {
        return parse(new StringReader(json), "inline JSON");
    }

    private static EngineConfig parse(Reader reader, String source) {
        JsonElement tree;
        EngineConfig config;
        try {
            tree = JsonParser.parseReader(reader);
            config = gson.fromJson(tree, EngineConfig.class);
        } catch (JsonParseException e) {
            throw new EngineException("Malformed engine configuration in " + source, e);
        }
        if (config == null) return defaults(); // empty document
        if (config.join == null) config.join = new Join();
        if (config.aggregate == null) config.aggregate = new Aggregate();
        // Gson maps an unknown enum name to null; only a missing or null key may fall back
        requireResolved(tree, "join", "defaultStrategy", config.join.defaultStrategy, source);
        requireResolved(tree, "join", "hashBuildSide", config.join.hashBuildSide, source);
        requireResolved(tree, "aggregate", "groupOrder", config.aggregate.groupOrder, source);
        if (config.join.defaultStrategy == null) config.join.defaultStrategy = JoinStrategy.HASH;
        if (config.join.hashBuildSide == null) config.join.hashBuildSide = HashJoinOperator.BuildSide.SMALLER;
        if (config.aggregate.groupOrder == null) config.aggregate.groupOrder = AggregateOperator.GroupOrder.FIRST_SEEN;
        return config;
    }

    private static void requireResolved(JsonElement tree, String section, String key, Object resolved, String source) {
        if (resolved != null) return;
        JsonElement sectionTree = tree.getAsJsonObject().get(section);
        if (sectionTree == null || !sectionTree.isJsonObject()) return;
        JsonElement value = sectionTree.getAsJsonObject().get(key);
        if (value != null && !value.isJsonNull()) {
            throw new EngineException("Unknown value " + value + " for " + section + "." + key + " in " + source);
        }
    }

    public JoinStrategy defaultJoinStrategy() { return join.defaultStrategy; }

    public HashJoinOperator.BuildSide hashBuildSide() { return join.hashBuildSide; }

    public AggregateOperator.GroupOrder groupOrder() { return aggregate.groupOrder; }

    @Override
    public String toString() {
        return gson.toJson(this);
    }
}
