package com.medwatch.anomaly.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medwatch.anomaly.model.Anomaly;
import com.medwatch.anomaly.model.AnomalyStatus;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.DetectionType;
import com.medwatch.anomaly.model.RawFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Converts one detector finding into exactly one canonical {@link Anomaly}.
 *
 * Details normalization:
 * 1. Map details are copied as-is
 * 2. Text that is brace-delimited after trimming is parsed as a JSON object;
 *    unparseable text becomes {originalDetails: text}
 * 3. Any other non-empty value becomes {originalDetails: value}
 * 4. Absent or empty details start from an empty object
 * Finally causesOfShortages is always set, falling back to "Not specified".
 *
 * Never throws on malformed details and has no side effects.
 */
@Component
public class AnomalyNormalizer {

    private static final Logger log = LoggerFactory.getLogger(AnomalyNormalizer.class);

    public static final String DEFAULT_SEVERITY = "medium";
    public static final String CAUSES_KEY = "causesOfShortages";
    public static final String ORIGINAL_DETAILS_KEY = "originalDetails";
    public static final String CAUSES_NOT_SPECIFIED = "Not specified";
    static final String MISSING_ID = "N/A";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Clock clock;
    private final ObjectMapper objectMapper;

    public AnomalyNormalizer(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Anomaly normalize(DetectionType detectionType, RawFinding finding) {
        DataPoint dataPoint = finding.getDataPoint();
        String medicineId = dataPoint != null ? dataPoint.getMedicineId() : null;
        String displayId = medicineId != null ? medicineId : MISSING_ID;

        Map<String, Object> details = normalizeDetails(finding.getDetails());
        details.put(CAUSES_KEY, hasValue(finding.getCausesOfShortages())
                ? finding.getCausesOfShortages()
                : CAUSES_NOT_SPECIFIED);

        return Anomaly.builder()
                .anomalyId(UUID.randomUUID().toString())
                .detectionType(detectionType.getLabel())
                .severity(orDefault(finding.getSeverity(), DEFAULT_SEVERITY))
                .message(orDefault(finding.getMessage(), "Anomaly detected for medicine ID: " + displayId))
                .description(orDefault(finding.getDescription(), "General anomaly for medicine ID: " + displayId + "."))
                .confidence(clampConfidence(finding.getConfidence()))
                .type(orDefault(finding.getType(), detectionType.getLabel()))
                .details(details)
                .medicineDataId(medicineId)
                .disease(dataPoint != null ? dataPoint.getDisease() : null)
                .assignedTo(orDefault(finding.getAssignedTo(), ""))
                .status(AnomalyStatus.ACTIVE.getLabel())
                .timestamp(Instant.now(clock).toString())
                .reviewedAt(null)
                .build();
    }

    Map<String, Object> normalizeDetails(Object details) {
        Map<String, Object> normalized = new LinkedHashMap<>();

        if (details instanceof Map<?, ?> map) {
            map.forEach((key, value) -> normalized.put(String.valueOf(key), value));
        } else if (details instanceof String text && isBraceDelimited(text)) {
            try {
                normalized.putAll(objectMapper.readValue(text, MAP_TYPE));
            } catch (JsonProcessingException e) {
                log.debug("Details look like JSON but do not parse, keeping raw text: {}", e.getOriginalMessage());
                normalized.put(ORIGINAL_DETAILS_KEY, text);
            }
        } else if (details != null && !"".equals(details)) {
            normalized.put(ORIGINAL_DETAILS_KEY, details);
        }

        return normalized;
    }

    private boolean isBraceDelimited(String text) {
        String trimmed = text.trim();
        return trimmed.startsWith("{") && trimmed.endsWith("}");
    }

    private double clampConfidence(Double confidence) {
        if (confidence == null || confidence.isNaN()) return 0.0;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static boolean hasValue(String value) {
        return value != null && !value.isEmpty();
    }

    private static String orDefault(String value, String fallback) {
        return hasValue(value) ? value : fallback;
    }
}
