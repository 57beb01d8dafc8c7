package io.otto4j.taskconfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Loads layered task execution config from the runtime home directory.
 *
 * <p>Layout:
 * <pre>
 * &lt;home&gt;/task-config/base.jsonc
 * &lt;home&gt;/task-config/profiles/&lt;profileId&gt;.jsonc
 * </pre>
 *
 * <p>Files are JSON with comments and trailing commas allowed. Every failure is reported as a
 * {@link TaskConfigException}.
 */
public class TaskConfigLoader {

    static final String TASK_CONFIG_DIRECTORY = "task-config";
    static final String BASE_CONFIG_FILE = "base.jsonc";
    static final String PROFILES_DIRECTORY = "profiles";
    private static final int SUPPORTED_VERSION = 1;

    private final Path home;
    private final ObjectMapper jsonc;

    public TaskConfigLoader(Path home) {
        this.home = Objects.requireNonNull(home, "home must not be null");
        this.jsonc = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .build();
    }

    public Path taskConfigDirectory() {
        return home.resolve(TASK_CONFIG_DIRECTORY);
    }

    public TaskRuntimeBaseConfig loadBaseConfig() {
        Path file = taskConfigDirectory().resolve(BASE_CONFIG_FILE);
        JsonNode root = read(file);
        requireVersion(root, file);

        ObjectNode base = requireObject(root.path("base").path("opencode"), "base.opencode", file);
        return new TaskRuntimeBaseConfig(base, readLanes(root.path("lanes"), "lanes", file));
    }

    public TaskProfile loadProfile(String profileId) {
        if (profileId == null || profileId.isBlank()) {
            throw new TaskConfigException("profileId must not be blank");
        }
        Path file = taskConfigDirectory().resolve(PROFILES_DIRECTORY).resolve(profileId + ".jsonc");
        JsonNode root = read(file);
        requireVersion(root, file);

        JsonNode id = root.path("id");
        if (!id.isTextual() || id.asText().isBlank()) {
            throw new TaskConfigException("Invalid task config in " + file + ": id must be a non-empty string");
        }
        if (!id.asText().trim().equals(profileId)) {
            throw new TaskConfigException("Task profile id mismatch in " + file
                    + ": expected '" + profileId + "', got '" + id.asText() + "'");
        }

        JsonNode description = root.path("description");
        return new TaskProfile(
                profileId,
                description.isTextual() ? description.asText() : null,
                readLanes(root.path("laneOverrides"), "laneOverrides", file)
        );
    }

    /**
     * Loads the base config and, when {@code profileId} is set, the profile, then layers them for {@code lane}.
     */
    public EffectiveTaskConfig loadEffectiveConfig(ExecutionLane lane, String profileId) {
        TaskRuntimeBaseConfig base = loadBaseConfig();
        TaskProfile profile = profileId == null || profileId.isBlank() ? null : loadProfile(profileId);
        return buildEffectiveTaskExecutionConfig(base, lane, profile);
    }

    /**
     * Deep-merges base, then the lane overlay, then the profile's lane override. Objects merge key by
     * key; any other value replaces what was there.
     */
    public static EffectiveTaskConfig buildEffectiveTaskExecutionConfig(TaskRuntimeBaseConfig base,
                                                                        ExecutionLane lane,
                                                                        TaskProfile profile) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(lane, "lane must not be null");

        ObjectNode merged = base.base().deepCopy();
        ObjectNode laneOverlay = base.lanes().get(lane);
        if (laneOverlay != null) {
            mergeInto(merged, laneOverlay);
        }
        if (profile != null) {
            ObjectNode profileOverlay = profile.laneOverrides().get(lane);
            if (profileOverlay != null) {
                mergeInto(merged, profileOverlay);
            }
        }
        return new EffectiveTaskConfig(merged);
    }

    private static void mergeInto(ObjectNode target, ObjectNode override) {
        Iterator<Map.Entry<String, JsonNode>> fields = override.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject && field.getValue() instanceof ObjectNode overrideObject) {
                mergeInto(existingObject, overrideObject);
            } else {
                target.set(field.getKey(), field.getValue().deepCopy());
            }
        }
    }

    private Map<ExecutionLane, ObjectNode> readLanes(JsonNode lanesNode, String path, Path file) {
        Map<ExecutionLane, ObjectNode> lanes = new EnumMap<>(ExecutionLane.class);
        if (lanesNode.isMissingNode() || lanesNode.isNull()) {
            return lanes;
        }
        if (!lanesNode.isObject()) {
            throw new TaskConfigException("Invalid task config in " + file + ": " + path + " must be an object");
        }
        for (ExecutionLane lane : ExecutionLane.values()) {
            JsonNode laneNode = lanesNode.get(lane.key());
            if (laneNode == null || laneNode.isNull()) {
                continue;
            }
            lanes.put(lane, requireObject(laneNode.path("opencode"), path + "." + lane.key() + ".opencode", file));
        }
        return lanes;
    }

    private JsonNode read(Path file) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TaskConfigException("Unable to read task config file: " + file, e);
        }
        try {
            JsonNode root = jsonc.readTree(source);
            if (root == null || !root.isObject()) {
                throw new TaskConfigException("Invalid task config in " + file + ": root must be an object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new TaskConfigException("Invalid JSONC in task config file: " + file, e);
        }
    }

    private static void requireVersion(JsonNode root, Path file) {
        JsonNode version = root.path("version");
        if (!version.isInt() || version.intValue() != SUPPORTED_VERSION) {
            throw new TaskConfigException("Invalid task config in " + file + ": version must be " + SUPPORTED_VERSION);
        }
    }

    private static ObjectNode requireObject(JsonNode node, String path, Path file) {
        if (!(node instanceof ObjectNode objectNode)) {
            throw new TaskConfigException("Invalid task config in " + file + ": " + path + " must be an object");
        }
        return objectNode;
    }
}
