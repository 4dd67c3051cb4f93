package io.hearthwarrio.elementscout.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Canonical JSON form of a scan: a pretty-printed array of {@link ElementRecord} objects.
 * <p>
 * {@link #read(String)} accepts what {@link #write(List)} produces and yields equal records.
 * Unknown properties are ignored so that consumers may annotate saved inventories.
 */
public final class ElementRecordJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<List<ElementRecord>> RECORD_LIST = new TypeReference<List<ElementRecord>>() {
    };

    private ElementRecordJson() {
        // utility class
    }

    public static String write(List<ElementRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new ElementScanException("Cannot serialize " + records.size() + " element records", e);
        }
    }

    public static String write(ScanResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return write(result.getRecords());
    }

    /**
     * @param json JSON array as produced by {@link #write(List)}
     * @return records in array order; empty for a blank input
     * @throws ElementScanException if the input is not a valid record array
     */
    public static List<ElementRecord> read(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<ElementRecord> records = MAPPER.readValue(json, RECORD_LIST);
            return records == null ? Collections.emptyList() : records;
        } catch (JsonProcessingException e) {
            throw new ElementScanException("Cannot parse element records: " + e.getOriginalMessage(), e);
        }
    }
}
