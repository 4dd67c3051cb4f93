package io.hearthwarrio.elementscout.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of one scan: scanned elements in document order plus the wall-clock time the pass took.
 */
public final class ScanResult {

    private final List<ScannedElement> elements;
    private final Duration elapsed;

    public ScanResult(List<ScannedElement> elements, Duration elapsed) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(elements, "elements must not be null")));
        this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public List<ScannedElement> getElements() {
        return elements;
    }

    /**
     * @return records in document order (read-only)
     */
    public List<ElementRecord> getRecords() {
        List<ElementRecord> records = new ArrayList<>(elements.size());
        for (ScannedElement e : elements) {
            records.add(e.getRecord());
        }
        return Collections.unmodifiableList(records);
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public String toString() {
        return "ScanResult{" +
                "elements=" + elements.size() +
                ", elapsed=" + elapsed.toMillis() + "ms" +
                '}';
    }
}
