package com.umitunal.qrunner.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.qrunner.schedule.Schedule;
import com.umitunal.qrunner.schedule.ScheduledJobDefinition;
import com.umitunal.qrunner.serialization.JsonCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads schedule definitions from JSON.
 *
 * <pre>
 * [
 *   {
 *     "name": "nightly",
 *     "startOn": "2024-01-01T02:00:00Z",
 *     "repeatHours": 24,
 *     "jobs": [ { "type": "cleanup", "properties": { "olderThanDays": "30" } } ]
 *   }
 * ]
 * </pre>
 */
public class ScheduleConfigLoader {
    private final ObjectMapper mapper;

    public ScheduleConfigLoader() {
        this(JsonCodec.createDefaultMapper());
    }

    public ScheduleConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Schedule> load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public List<Schedule> load(InputStream in) throws IOException {
        return parse(mapper.readTree(in));
    }

    public List<Schedule> parse(String json) throws IOException {
        return parse(mapper.readTree(json));
    }

    private List<Schedule> parse(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Schedule configuration must be a JSON array.");
        }

        List<Schedule> schedules = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            schedules.add(parseSchedule(node, index++));
        }
        return schedules;
    }

    private Schedule parseSchedule(JsonNode node, int index) {
        String name = node.path("name").asText(null);
        String label = name != null ? "'" + name + "'" : "#" + index;
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Schedule " + label + " has no name.");
        }

        Schedule.Builder builder = Schedule.newBuilder(name);

        JsonNode startOn = node.path("startOn");
        if (!startOn.isMissingNode() && !startOn.isNull()) {
            try {
                builder.startOn(Instant.parse(startOn.asText()));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Schedule " + label + " has an invalid startOn: " + startOn.asText(), e);
            }
        }

        JsonNode repeat = node.path("repeatHours");
        if (!repeat.isMissingNode() && !repeat.isNull()) {
            if (!repeat.isNumber()) {
                throw new IllegalArgumentException("Schedule " + label + " has a non-numeric repeatHours.");
            }
            try {
                builder.repeatHours(repeat.asDouble());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Schedule " + label + ": " + e.getMessage(), e);
            }
        }

        for (JsonNode job : node.path("jobs")) {
            String type = job.path("type").asText(null);
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("Schedule " + label + " has a job without a type.");
            }
            builder.addJob(new ScheduledJobDefinition(type, properties(job.path("properties"))));
        }

        return builder.build();
    }

    private static Map<String, String> properties(JsonNode node) {
        Map<String, String> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNull()) {
                properties.put(field.getKey(), field.getValue().asText());
            }
        }
        return properties;
    }
}
