package com.socdash.reconciler.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.socdash.reconciler.catalog.StepCatalog;
import com.socdash.reconciler.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns one raw status payload ({@code state} + open-shaped {@code info})
 * into a list of step patches.
 *
 * The task backend reports progress in several shapes depending on which
 * task wrote the meta. Each shape has its own decoder; they are tried in a
 * fixed priority order and the first one that recognises the payload wins.
 * Shapes are never combined.
 * <pre>
 *   1. {steps: [{step, status, timestamp, duration, logs|log}, ...]}
 *   2. {completed_steps: [...], current_step?, errors?}
 *   3. {step | current_step | current: "key"}
 *   4. {history | steps_history: [{step, success?, failed?, ...}, ...]}
 *   5. nothing recognisable: derive from the top-level state only
 * </pre>
 *
 * Pure: no I/O, never throws on malformed input.
 */
public class StatusSnapshotParser {

    private static final Logger log = LoggerFactory.getLogger(StatusSnapshotParser.class);

    static final String UNKNOWN_STATE = "UNKNOWN";

    private static final String[] STEP_KEY_FIELDS      = {"key", "step", "step_id", "name"};
    private static final String[] STATUS_FIELDS        = {"status", "state"};
    private static final String[] TIMESTAMP_FIELDS     = {"timestamp", "time", "completed_at", "started_at"};
    private static final String[] CURRENT_STEP_FIELDS  = {"current_step", "step"};
    private static final String[] SCALAR_STEP_FIELDS   = {"current_step", "step", "current"};
    private static final String[] ERROR_MESSAGE_FIELDS = {"error", "message", "detail"};
    private static final String[] SUCCESS_FIELDS       = {"success", "succeeded", "ok"};
    private static final String[] FAILED_FIELDS        = {"failed", "failure", "error"};

    private final List<Function<JsonNode, Optional<List<StepPatch>>>> decoders = List.of(
            this::decodeStepList,
            this::decodeCompletedSteps,
            this::decodeCurrentStep,
            this::decodeHistory
    );

    private final boolean firstStepFallback;

    /**
     * @param firstStepFallback when true, an unstructured payload in a running
     *        or failed top-level state marks the first catalog step running or
     *        failed; when false it produces no patches at all
     */
    public StatusSnapshotParser(boolean firstStepFallback) {
        this.firstStepFallback = firstStepFallback;
    }

    public ParseResult parse(String topLevelState, JsonNode info) {
        String state = topLevelState == null || topLevelState.isBlank() ? UNKNOWN_STATE : topLevelState;

        if (info != null && info.isObject()) {
            for (int i = 0; i < decoders.size(); i++) {
                Optional<List<StepPatch>> patches = decoders.get(i).apply(info);
                if (patches.isPresent()) {
                    log.debug("Payload matched shape #{} with {} patch(es)", i + 1, patches.get().size());
                    return ParseResult.structured(state, patches.get());
                }
            }
        }
        return ParseResult.unstructured(state, fallback(state));
    }

    // ------------------------------------------------------------------
    // Shape 1: explicit step records
    // ------------------------------------------------------------------

    private Optional<List<StepPatch>> decodeStepList(JsonNode info) {
        JsonNode steps = info.get("steps");
        if (steps == null || !steps.isArray() || steps.isEmpty()) return Optional.empty();

        List<StepPatch> patches = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            JsonNode entry = steps.get(i);
            if (entry.isValueNode() && !entry.isNull()) {
                patches.add(StepPatch.of(entry.asText(), StepStatus.PENDING));
                continue;
            }
            if (!entry.isObject()) continue;
            String key = text(entry, STEP_KEY_FIELDS).orElse(positionalKey(i));
            StepStatus status = StepStatus.fromWire(text(entry, STATUS_FIELDS).orElse(null));
            patches.add(new StepPatch(key, status,
                    text(entry, TIMESTAMP_FIELDS).orElse(null),
                    text(entry, "duration").orElse(null),
                    logs(entry)));
        }
        return Optional.of(patches);
    }

    // ------------------------------------------------------------------
    // Shape 2: completed list + current step + errors
    // ------------------------------------------------------------------

    private Optional<List<StepPatch>> decodeCompletedSteps(JsonNode info) {
        JsonNode completed = info.get("completed_steps");
        if (completed == null || !completed.isArray()) return Optional.empty();

        List<StepPatch> patches = new ArrayList<>();
        for (JsonNode key : completed) {
            if (key.isValueNode() && !key.isNull()) {
                patches.add(StepPatch.of(key.asText(), StepStatus.COMPLETED));
            }
        }

        Optional<String> current = text(info, CURRENT_STEP_FIELDS);
        current.ifPresent(key -> patches.add(StepPatch.of(key, StepStatus.RUNNING)));

        JsonNode errors = info.get("errors");
        if (errors != null && errors.isArray() && !errors.isEmpty()) {
            JsonNode first = errors.get(0);
            if (first.isObject()) {
                Optional<String> key = text(first, "step", "key").or(() -> current);
                String message = text(first, ERROR_MESSAGE_FIELDS).orElse(first.toString());
                key.ifPresent(k -> patches.add(StepPatch.failed(k, message)));
            } else if (first.isValueNode() && !first.isNull()) {
                patches.add(StepPatch.failed(first.asText(), first.asText()));
            }
        }
        return Optional.of(patches);
    }

    // ------------------------------------------------------------------
    // Shape 3: single current-step scalar
    // ------------------------------------------------------------------

    private Optional<List<StepPatch>> decodeCurrentStep(JsonNode info) {
        return text(info, SCALAR_STEP_FIELDS)
                .map(key -> List.of(StepPatch.of(key, StepStatus.RUNNING)));
    }

    // ------------------------------------------------------------------
    // Shape 4: history log
    // ------------------------------------------------------------------

    private Optional<List<StepPatch>> decodeHistory(JsonNode info) {
        JsonNode history = info.get("history");
        if (history == null || !history.isArray() || history.isEmpty()) history = info.get("steps_history");
        if (history == null || !history.isArray() || history.isEmpty()) return Optional.empty();

        List<StepPatch> patches = new ArrayList<>();
        for (int i = 0; i < history.size(); i++) {
            JsonNode entry = history.get(i);
            if (!entry.isObject()) continue;
            StepStatus status = flag(entry, SUCCESS_FIELDS) ? StepStatus.COMPLETED
                              : flag(entry, FAILED_FIELDS)  ? StepStatus.FAILED
                              : StepStatus.PENDING;
            patches.add(new StepPatch(
                    text(entry, STEP_KEY_FIELDS).orElse(positionalKey(i)),
                    status,
                    text(entry, TIMESTAMP_FIELDS).orElse(null),
                    text(entry, "duration").orElse(null),
                    logs(entry)));
        }
        return Optional.of(patches);
    }

    // ------------------------------------------------------------------
    // Shape 5: top-level state only
    // ------------------------------------------------------------------

    // SUCCESS is not handled here: the merger completes every pending step.
    private List<StepPatch> fallback(String state) {
        if (!firstStepFallback) return List.of();
        String firstKey = StepCatalog.first().key();
        return switch (state.toUpperCase(Locale.ROOT)) {
            case "STARTED", "PROGRESS", "RUNNING" -> List.of(StepPatch.of(firstKey, StepStatus.RUNNING));
            case "FAILURE", "REVOKED" -> List.of(StepPatch.of(firstKey, StepStatus.FAILED));
            default -> List.of();
        };
    }

    // ------------------------------------------------------------------
    // Field helpers
    // ------------------------------------------------------------------

    /** First of the given fields holding a non-null scalar, as text. */
    private static Optional<String> text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }

    private static boolean flag(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isBoolean() && value.booleanValue()) return true;
        }
        return false;
    }

    /** "logs" list, or a singular "log" wrapped into one line; null when neither is present. */
    private static List<String> logs(JsonNode entry) {
        JsonNode logs = entry.get("logs");
        if (logs != null && logs.isArray()) {
            List<String> lines = new ArrayList<>(logs.size());
            logs.forEach(line -> lines.add(line.isValueNode() ? line.asText() : line.toString()));
            return lines;
        }
        return text(entry, "logs", "log").map(List::of).orElse(null);
    }

    private static String positionalKey(int index) {
        return "step_" + index;
    }
}
