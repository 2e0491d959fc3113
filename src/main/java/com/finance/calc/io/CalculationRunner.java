package com.finance.calc.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finance.calc.FinanceEngine;
import com.finance.calc.api.FinanceException;
import com.finance.calc.safety.SafetyLimits;

import lombok.extern.log4j.Log4j2;

/**
 * Parses JSON {@link CalculationRequest}s and dispatches each to the engine.
 * <p>
 * A {@link FinanceException} from the engine becomes a failed
 * {@link CalculationResult}. Malformed requests (unknown type, missing or
 * non-numeric parameter) are programming errors and throw
 * {@link IllegalArgumentException}.
 */
@Log4j2
public final class CalculationRunner {
    private static final TypeReference<List<CalculationRequest>> REQUEST_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock;
    private final FinanceEngine defaultEngine;

    public CalculationRunner() {
        this(Clock.systemDefaultZone());
    }

    public CalculationRunner(Clock clock) {
        this.clock = clock;
        this.defaultEngine = new FinanceEngine(SafetyLimits.DEFAULT, clock);
    }

    /** Parses a JSON array of requests. */
    public List<CalculationRequest> parse(String json) {
        try {
            return mapper.readValue(json, REQUEST_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed calculation requests: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a JSON file holding an array of requests. */
    public List<CalculationRequest> parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a classpath resource holding an array of requests. */
    public List<CalculationRequest> parseResource(String resource) {
        try (InputStream in = CalculationRunner.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Resource not found: " + resource);
            return mapper.readValue(in, REQUEST_LIST);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load calculation requests from " + resource, e);
        }
    }

    public CalculationResult run(CalculationRequest request) {
        CalculationType type = CalculationType.fromString(request.getType());
        Map<String, Object> params = request.getParams() != null ? request.getParams() : Collections.emptyMap();
        FinanceEngine engine = engineFor(request);

        log.debug("Running {} (id={}) with {}", type, request.getId(), params);
        try {
            Object value = type.calculate(engine, params);
            return CalculationResult.ok(request.getId(), type.name(), value);
        } catch (FinanceException e) {
            log.warn("{} (id={}) failed: {} {}", type, request.getId(), e.getKind(), e.getMessage());
            return CalculationResult.failed(request.getId(), type.name(), e);
        }
    }

    public List<CalculationResult> runAll(List<CalculationRequest> requests) {
        List<CalculationResult> results = new ArrayList<>(requests.size());
        for (CalculationRequest r : requests)
            results.add(run(r));
        return results;
    }

    /** Serialises a result (or list of results) to JSON. */
    public String toJson(Object results) {
        try {
            return mapper.writeValueAsString(results);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise results", e);
        }
    }

    private FinanceEngine engineFor(CalculationRequest request) {
        if (request.getLimits() == null || request.getLimits().isEmpty())
            return defaultEngine;
        return new FinanceEngine(SafetyLimits.fromProperties(request.getLimits()), clock);
    }

    // ── Parameter helpers ───────────────────────────────────────────

    static double requireDouble(Map<String, Object> params, String key) {
        Object v = params.get(key);
        if (v == null)
            throw new IllegalArgumentException("Missing parameter '" + key + "'");
        return toDouble(v, key);
    }

    static double getDouble(Map<String, Object> params, String key, double def) {
        Object v = params.get(key);
        if (v == null)
            return def;
        return toDouble(v, key);
    }

    static int requireInt(Map<String, Object> params, String key) {
        Object v = params.get(key);
        if (v == null)
            throw new IllegalArgumentException("Missing parameter '" + key + "'");
        if (v instanceof Integer i)
            return i;
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE)
                throw new IllegalArgumentException("Parameter '" + key + "' must be an integer: " + v);
            return (int) d;
        }
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an integer: " + v, e);
        }
    }

    static String getString(Map<String, Object> params, String key, String def) {
        Object v = params.get(key);
        return v == null ? def : v.toString();
    }

    static double[] requireArray(Map<String, Object> params, String key) {
        Object v = params.get(key);
        if (v == null)
            throw new IllegalArgumentException("Missing parameter '" + key + "'");
        if (!(v instanceof List<?> list))
            throw new IllegalArgumentException("Parameter '" + key + "' must be an array: " + v);
        double[] out = new double[list.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = toDouble(list.get(i), key + "[" + i + "]");
        return out;
    }

    /** Maps an absent answer to {@code null} so it serialises as a missing value. */
    static Double optional(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private static double toDouble(Object v, String key) {
        if (v == null)
            throw new IllegalArgumentException("Parameter '" + key + "' must be numeric: null");
        if (v instanceof Number n)
            return n.doubleValue();
        try {
            // Accepts "NaN" and "Infinity" so the engine, not the parser, rejects them.
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be numeric: " + v, e);
        }
    }
}
