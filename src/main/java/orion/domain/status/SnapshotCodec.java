package orion.domain.status;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.util.Locale;

/**
 * Converts the JSON status payload shared by {@code GET /status} and the status stream into a {@link DeviceSnapshot}.
 * Only {@code status} is mandatory; every other field is read leniently and falls back to null or zero.
 *
 * @author Orion team
 * @since 15/10/2026
 */
public class SnapshotCodec {
    private static final double NANOS_THRESHOLD = 1e9;
    private static final double MICROS_THRESHOLD = 1e3;

    /**
     * Parse a raw payload
     * @throws SnapshotParseException on malformed JSON, a non-object root or a missing/unknown status
     */
    public DeviceSnapshot decode(String json) throws SnapshotParseException {
        if (json == null || json.isBlank()) {
            throw new SnapshotParseException("Empty status payload");
        }
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new SnapshotParseException("Malformed status payload: " + e.getMessage(), e);
        }
        if (root == null || !root.isJsonObject()) {
            throw new SnapshotParseException("Status payload is not a JSON object");
        }
        return parse(root.getAsJsonObject());
    }

    public DeviceSnapshot parse(JsonObject json) throws SnapshotParseException {
        String rawStatus = string(json, "status");
        if (rawStatus == null || rawStatus.isBlank()) {
            throw new SnapshotParseException("Missing mandatory field 'status'");
        }

        DeviceSnapshot.Builder builder;
        switch (rawStatus.trim().toLowerCase(Locale.ROOT)) {
            case "idle":
                builder = DeviceSnapshot.builder(DeviceStatus.IDLE);
                break;
            case "printing":
                builder = DeviceSnapshot.builder(bool(json, "paused") ? DeviceStatus.PAUSED : DeviceStatus.PRINTING);
                break;
            case "paused":
                builder = DeviceSnapshot.builder(DeviceStatus.PAUSED);
                break;
            case "canceled":
            case "cancelled":
                builder = DeviceSnapshot.builder(DeviceStatus.CANCELED);
                break;
            case "pausing":
                builder = DeviceSnapshot.builder(DeviceStatus.PRINTING).pauseLatched(true);
                break;
            case "canceling":
            case "cancelling":
                builder = DeviceSnapshot.builder(DeviceStatus.PRINTING).cancelLatched(true);
                break;
            default:
                throw new SnapshotParseException("Unknown status '" + rawStatus + "'");
        }

        JsonObject printData = object(json, "print_data");
        JsonObject physicalState = object(json, "physical_state");

        Integer layer = integer(json, "layer");
        Integer layerCount = printData != null ? integer(printData, "layer_count") : null;
        builder.layer(layer, layerCount)
                .progress(progress(layer, layerCount, json))
                .finishedHint(bool(json, "finished"));

        if (bool(json, "pause_latched")) {
            builder.pauseLatched(true);
        }
        if (bool(json, "cancel_latched")) {
            builder.cancelLatched(true);
        }

        if (printData != null) {
            builder.usedMaterialMl(number(printData, "used_material", 0.0))
                    .elapsedSeconds((long) number(printData, "print_time", 0.0))
                    .job(jobInfo(object(printData, "file_data")));
        }
        if (physicalState != null) {
            builder.zPosition(number(physicalState, "z", 0.0))
                    .curing(bool(physicalState, "curing"));
        }

        String message = string(json, "device_status_message");
        builder.deviceStatusMessage(message != null ? message : rawStatus);
        builder.prevLayerSeconds(prevLayerSeconds(json));

        Double resin = nullableNumber(json, "resin");
        if (resin == null) {
            resin = nullableNumber(json, "resin_temperature");
        }
        builder.resinTemperature(resin != null ? (int) Math.round(resin) : null);

        Double cpu = nullableNumber(json, "temp");
        builder.cpuTemperature(cpu != null ? cpu : nullableNumber(json, "cpu_temp"));

        return builder.build();
    }

    private static double progress(Integer layer, Integer layerCount, JsonObject json) {
        if (layer != null && layerCount != null && layerCount > 0) {
            return (double) layer / layerCount;
        }
        return number(json, "progress", 0.0);
    }

    private static JobInfo jobInfo(JsonObject fileData) {
        if (fileData == null) {
            return null;
        }
        String path = string(fileData, "path");
        if (path == null || path.isBlank()) {
            return null;
        }
        String name = string(fileData, "name");
        if (name == null || name.isBlank()) {
            int slash = path.lastIndexOf('/');
            name = slash >= 0 ? path.substring(slash + 1) : path;
        }
        return new JobInfo(name, path, string(fileData, "location_category"));
    }

    /**
     * Previous layer duration; large raw values are nanoseconds or microseconds depending on the backend build
     */
    private static Double prevLayerSeconds(JsonObject json) {
        Double raw = nullableNumber(json, "PrevLayerTime");
        if (raw == null) {
            raw = nullableNumber(json, "prev_layer_seconds");
        }
        if (raw == null || raw < 0) {
            return null;
        }
        if (raw >= NANOS_THRESHOLD) {
            return raw / 1e9;
        }
        if (raw >= MICROS_THRESHOLD) {
            return raw / 1e6;
        }
        return raw;
    }

    private static JsonPrimitive primitive(JsonObject json, String key) {
        JsonElement element = json.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsJsonPrimitive();
    }

    private static JsonObject object(JsonObject json, String key) {
        JsonElement element = json.get(key);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    private static String string(JsonObject json, String key) {
        JsonPrimitive p = primitive(json, key);
        return p != null && p.isString() ? p.getAsString() : null;
    }

    private static boolean bool(JsonObject json, String key) {
        JsonPrimitive p = primitive(json, key);
        return p != null && p.isBoolean() && p.getAsBoolean();
    }

    private static Double nullableNumber(JsonObject json, String key) {
        JsonPrimitive p = primitive(json, key);
        if (p == null || !p.isNumber()) {
            return null;
        }
        double value = p.getAsDouble();
        return Double.isFinite(value) ? value : null;
    }

    private static double number(JsonObject json, String key, double defaultValue) {
        Double value = nullableNumber(json, key);
        return value != null ? value : defaultValue;
    }

    private static Integer integer(JsonObject json, String key) {
        Double value = nullableNumber(json, key);
        if (value == null) {
            return null;
        }
        long rounded = Math.round(value);
        // Out of int range is treated like any other ill-typed field
        if (rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) {
            return null;
        }
        return (int) rounded;
    }
}
