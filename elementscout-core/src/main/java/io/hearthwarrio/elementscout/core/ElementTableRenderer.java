package io.hearthwarrio.elementscout.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders records as a fixed-width text table for quick human inspection.
 * <p>
 * One row per record, in scan order. Cells longer than {@link #DEFAULT_MAX_CELL_WIDTH} are cut with "...".
 * Missing values are shown as an empty cell. The JSON form stays the authoritative output.
 */
public class ElementTableRenderer {

    public static final int DEFAULT_MAX_CELL_WIDTH = 40;

    private static final String[] HEADERS = {
            "#", "tag", "id", "type", "computedText", "xpath", "x", "y", "width", "height"
    };

    private static final String ELLIPSIS = "...";

    private final int maxCellWidth;

    public ElementTableRenderer() {
        this(DEFAULT_MAX_CELL_WIDTH);
    }

    public ElementTableRenderer(int maxCellWidth) {
        if (maxCellWidth <= ELLIPSIS.length()) {
            throw new IllegalArgumentException("maxCellWidth must be greater than " + ELLIPSIS.length());
        }
        this.maxCellWidth = maxCellWidth;
    }

    public String render(ScanResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return render(result.getRecords());
    }

    public String render(List<ElementRecord> records) {
        Objects.requireNonNull(records, "records must not be null");

        List<String[]> rows = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            rows.add(toRow(i, records.get(i)));
        }

        int[] widths = new int[HEADERS.length];
        for (int c = 0; c < HEADERS.length; c++) {
            widths[c] = HEADERS[c].length();
        }
        for (String[] row : rows) {
            for (int c = 0; c < row.length; c++) {
                widths[c] = Math.max(widths[c], row[c].length());
            }
        }

        StringBuilder sb = new StringBuilder(128 + rows.size() * 96);
        appendSeparator(sb, widths);
        appendRow(sb, HEADERS, widths);
        appendSeparator(sb, widths);
        for (String[] row : rows) {
            appendRow(sb, row, widths);
        }
        appendSeparator(sb, widths);
        return sb.toString();
    }

    private String[] toRow(int index, ElementRecord r) {
        ElementLocation loc = r.getLocation();
        return new String[]{
                String.valueOf(index),
                cell(r.getTagName()),
                cell(r.getAttributes().getId()),
                cell(r.getAttributes().getType()),
                cell(r.getText().getComputedText()),
                cell(r.getXpath()),
                number(loc.getX()),
                number(loc.getY()),
                number(loc.getWidth()),
                number(loc.getHeight())
        };
    }

    private String cell(String value) {
        if (value == null) {
            return "";
        }
        String v = value.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
        if (v.length() <= maxCellWidth) {
            return v;
        }
        return v.substring(0, maxCellWidth - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static void appendRow(StringBuilder sb, String[] cells, int[] widths) {
        sb.append('|');
        for (int c = 0; c < cells.length; c++) {
            sb.append(' ').append(cells[c]);
            for (int pad = cells[c].length(); pad < widths[c]; pad++) {
                sb.append(' ');
            }
            sb.append(" |");
        }
        sb.append('\n');
    }

    private static void appendSeparator(StringBuilder sb, int[] widths) {
        sb.append('+');
        for (int w : widths) {
            for (int i = 0; i < w + 2; i++) {
                sb.append('-');
            }
            sb.append('+');
        }
        sb.append('\n');
    }
}
