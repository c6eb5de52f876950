package io.journeyguard.core.repair;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.registry.RegistryConstants;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Repairs the journey-level metadata of an {@code exports} document: the journey type, the
 * data and version timestamps, the version defaults and the version state.
 *
 * <p>
 * Documents without the {@code exports} envelope are left untouched.
 */
public final class DocumentRepairs {

    static final String DEFAULT_JOURNEY_TYPE = "anonymous";
    static final String DEFAULT_STATE = "version";
    static final String DEFAULT_DESCRIPTION = "Generated journey";

    private static final long STALE_AFTER_SECONDS = 3600;
    private static final long FUTURE_TOLERANCE_SECONDS = 60;
    private static final List<String> DATA_TIMESTAMPS = List.of("created_date", "last_modified_date");
    private static final List<String> VERSION_TIMESTAMPS = List.of("created_at", "last_modified");
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;
    private final RegistryConstants constants;

    public DocumentRepairs(Clock clock, RegistryConstants constants) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.constants = Objects.requireNonNull(constants, "constants must not be null");
    }

    /**
     * Applies all document-level repairs.
     *
     * @param root the document root
     * @return the changes made, in application order
     */
    public List<FixRecord> apply(ObjectNode root) {
        List<FixRecord> records = new ArrayList<>();
        JsonNode exports = root.get("exports");
        if (exports == null || !exports.isArray() || exports.isEmpty()) {
            return records;
        }
        JsonNode data = exports.get(0).get("data");
        if (data == null || !data.isObject()) {
            return records;
        }
        ObjectNode dataObject = (ObjectNode) data;
        fixJourneyType(dataObject, records);
        fixTimestampsAndDefaults(dataObject, records);
        return records;
    }

    private void fixJourneyType(ObjectNode data, List<FixRecord> records) {
        JsonNode type = data.get("type");
        boolean valid = type != null
                && type.isTextual()
                && RegistryConstants.allows(constants.validJourneyTypes(), type.asText());
        if (valid) {
            return;
        }
        boolean present = type != null && !type.isNull() && !(type.isTextual() && type.asText().isEmpty());
        String action = present
                ? "Changed invalid journey type '" + (type.isTextual() ? type.asText() : type.toString()) + "'"
                : "Added missing journey type";
        data.put("type", DEFAULT_JOURNEY_TYPE);
        records.add(record(action + " to '" + DEFAULT_JOURNEY_TYPE + "'"));
    }

    private void fixTimestampsAndDefaults(ObjectNode data, List<FixRecord> records) {
        long nowMillis = clock.millis();
        long nowSeconds = nowMillis / 1000;

        for (String field : DATA_TIMESTAMPS) {
            JsonNode value = data.get(field);
            if (value == null) {
                data.put(field, nowMillis);
                records.add(record("Added missing '" + field + "' timestamp to data: " + nowMillis));
            } else if (value.isNumber()) {
                double timestamp = value.asDouble();
                if (timestamp < nowMillis - STALE_AFTER_SECONDS * 1000) {
                    data.put(field, nowMillis);
                    records.add(record("Updated '" + field + "' from " + display((long) timestamp)
                            + " to current time: " + nowMillis));
                } else if (timestamp > nowMillis + FUTURE_TOLERANCE_SECONDS * 1000) {
                    data.put(field, nowMillis);
                    records.add(record("Updated '" + field + "' from future timestamp " + value.asText()
                            + " to current time: " + nowMillis));
                }
            }
        }

        if (!data.has("versions")) {
            data.putArray("versions");
            records.add(record("Added missing 'versions' array to journey data"));
        }
        JsonNode versions = data.get("versions");
        if (!versions.isArray() || versions.isEmpty() || !versions.get(0).isObject()) {
            return;
        }
        ObjectNode version = (ObjectNode) versions.get(0);

        if (!version.has("state")) {
            version.put("state", DEFAULT_STATE);
            records.add(record("Added missing 'state' field with default value '" + DEFAULT_STATE + "'"));
        }
        if (!version.has("desc")) {
            version.put("desc", DEFAULT_DESCRIPTION);
            records.add(record("Added missing 'desc' field with default description"));
        }
        for (String field : VERSION_TIMESTAMPS) {
            if (!version.has(field)) {
                version.put(field, nowSeconds);
                records.add(record("Added missing '" + field + "' timestamp to version: " + nowSeconds));
            }
        }

        for (String field : VERSION_TIMESTAMPS) {
            JsonNode value = version.get(field);
            if (!value.isNumber()) {
                continue;
            }
            double timestamp = value.asDouble();
            if (timestamp < nowSeconds - STALE_AFTER_SECONDS) {
                version.put(field, nowSeconds);
                records.add(record("Updated version '" + field + "' from " + display((long) timestamp * 1000)
                        + " to current time: " + nowSeconds));
            } else if (timestamp > nowSeconds + FUTURE_TOLERANCE_SECONDS) {
                version.put(field, nowSeconds);
                records.add(record("Updated version '" + field + "' from future timestamp " + value.asText()
                        + " to current time: " + nowSeconds));
            }
        }

        JsonNode state = version.get("state");
        String stateText = state.isTextual() ? state.asText() : state.toString();
        if (!state.isTextual() || !RegistryConstants.allows(constants.validVersionStates(), stateText)) {
            version.put("state", DEFAULT_STATE);
            records.add(record("Changed invalid state '" + stateText + "' to '" + DEFAULT_STATE + "'"));
        }
    }

    private String display(long epochMillis) {
        return DISPLAY.withZone(clock.getZone()).format(Instant.ofEpochMilli(epochMillis));
    }

    private static FixRecord record(String description) {
        return new FixRecord(Category.METADATA, null, description);
    }
}
