package in.hostsnap.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.hostsnap.snapshot.CategorySnapshot;
import in.hostsnap.snapshot.CategoryState;
import in.hostsnap.snapshot.RefreshReport;
import in.hostsnap.snapshot.RootSnapshot;
import in.hostsnap.source.QueryFailureException;

import java.io.UncheckedIOException;
import java.time.Instant;

/**
 * JSON rendering of snapshots and refresh reports.
 *
 * Timestamps are ISO-8601 strings; a never-refreshed category renders {@code lastUpdated: null}.
 */
public final class SnapshotJsonMapper {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private SnapshotJsonMapper() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * {@code { "freshness", "categories": { name: category } }}
     */
    public static ObjectNode toJson(RootSnapshot root, boolean includeRecords) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("freshness", timestamp(root.freshness()));
        ObjectNode categories = node.putObject("categories");
        for (CategorySnapshot<?> snapshot : root.categories()) {
            categories.set(snapshot.name(), toJson(snapshot, includeRecords));
        }
        return node;
    }

    /**
     * {@code { "lastUpdated", "changed", "refreshCount", "recordCount", "added", "removed", "records" }}
     */
    public static ObjectNode toJson(CategorySnapshot<?> snapshot, boolean includeRecords) {
        CategoryState<?> state = snapshot.state();
        ObjectNode node = MAPPER.createObjectNode();
        node.put("lastUpdated", timestamp(state.lastUpdated()));
        node.put("changed", state.changed());
        node.put("refreshCount", state.refreshCount());
        node.put("recordCount", state.size());
        node.put("added", state.diff().added().size());
        node.put("removed", state.diff().removed().size());
        if (includeRecords) {
            node.set("records", MAPPER.valueToTree(state.records()));
        }
        return node;
    }

    /**
     * {@code { "startedAt", "finishedAt", "durationMs", "succeeded", "changed", "failures": { name: {reason, message} } }}
     */
    public static ObjectNode toJson(RefreshReport report) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("startedAt", report.startedAt().toString());
        node.put("finishedAt", report.finishedAt().toString());
        node.put("durationMs", report.duration().toMillis());
        node.set("succeeded", MAPPER.valueToTree(report.succeeded()));
        node.set("changed", MAPPER.valueToTree(report.changed()));
        ObjectNode failures = node.putObject("failures");
        for (var entry : report.failures().entrySet()) {
            QueryFailureException failure = entry.getValue();
            ObjectNode f = failures.putObject(entry.getKey());
            f.put("reason", failure.getReason().name());
            f.put("message", failure.getMessage());
        }
        return node;
    }

    public static String write(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String timestamp(Instant instant) {
        return CategoryState.NEVER.equals(instant) ? null : instant.toString();
    }
}
