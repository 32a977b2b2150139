package in.hostsnap.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.hostsnap.source.Category;
import in.hostsnap.source.InventorySource;
import in.hostsnap.transport.http.SnapshotJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Diagnostic dump of one category's raw rows as field → value maps.
 *
 * Runs a single query straight against the source, bypassing any snapshot, so the output shows
 * exactly what a refresh would commit.
 */
public final class FieldDumper {
    private static final Logger log = LoggerFactory.getLogger(FieldDumper.class);
    private static final TypeReference<Map<String, Object>> ROW = new TypeReference<>() {};

    private final InventorySource source;
    private final ObjectMapper mapper;

    public FieldDumper(InventorySource source) {
        this(source, SnapshotJsonMapper.mapper());
    }

    public FieldDumper(InventorySource source, ObjectMapper mapper) {
        this.source = Objects.requireNonNull(source, "source");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @throws in.hostsnap.source.QueryFailureException if the query fails
     */
    public List<Map<String, Object>> dump(Category<?> category) {
        List<?> rows = source.query(category);
        List<Map<String, Object>> fields = new ArrayList<>(rows.size());
        for (Object row : rows) {
            fields.add(mapper.convertValue(row, ROW));
        }
        log.debug("[FieldDumper] {} returned {} rows", category.name(), fields.size());
        return fields;
    }

    /**
     * Field names of the category's record type, in declaration order.
     */
    public static List<String> fieldNames(Category<?> category) {
        Class<?> type = category.recordType();
        List<String> names = new ArrayList<>();
        if (type.isRecord()) {
            for (var component : type.getRecordComponents()) {
                names.add(component.getName());
            }
        }
        return names;
    }
}
