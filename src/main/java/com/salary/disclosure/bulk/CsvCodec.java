package com.salary.disclosure.bulk;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal CSV codec: comma separated, double-quote quoting with doubled quotes
 * as the escape, quoted fields may span lines.
 */
public final class CsvCodec {

    private CsvCodec() {
        // Utility class
    }

    /**
     * Reads the next logical record, joining physical lines while a quoted field is open.
     *
     * @return the fields, or null at end of input
     */
    public static List<String> readRecord(BufferedReader reader) throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        StringBuilder buffer = new StringBuilder(line);
        while (hasOpenQuote(buffer)) {
            String next = reader.readLine();
            if (next == null) {
                break;
            }
            buffer.append('\n').append(next);
        }
        return parseLine(buffer.toString());
    }

    /**
     * Splits one record into fields, unquoting quoted values.
     */
    public static List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
            } else if (c != '\r') {
                field.append(c);
            }
        }
        fields.add(field.toString());
        return fields;
    }

    /**
     * Quotes a value when it contains a comma, quote or line break.
     */
    public static String escape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    public static String joinRow(List<String> values) {
        StringBuilder row = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                row.append(',');
            }
            row.append(escape(values.get(i)));
        }
        return row.toString();
    }

    private static boolean hasOpenQuote(CharSequence text) {
        int quotes = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '"') {
                quotes++;
            }
        }
        return quotes % 2 != 0;
    }
}
