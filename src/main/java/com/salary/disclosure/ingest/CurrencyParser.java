package com.salary.disclosure.ingest;

/**
 * Parses published currency amounts such as {@code "$123,456.78"}.
 * A dash or blank is zero. Anything unparseable, negative or non-finite also becomes
 * zero and is counted as a malformed value.
 */
public class CurrencyParser {

    private long malformedCount;

    public double parse(String value) {
        if (value == null) {
            return 0.0;
        }
        String cleaned = value.replace("$", "").replace(",", "").trim();
        if (cleaned.isEmpty() || cleaned.equals("-")) {
            return 0.0;
        }
        try {
            double amount = Double.parseDouble(cleaned);
            if (Double.isNaN(amount) || Double.isInfinite(amount) || amount < 0) {
                malformedCount++;
                return 0.0;
            }
            return amount;
        } catch (NumberFormatException e) {
            malformedCount++;
            return 0.0;
        }
    }

    public long getMalformedCount() {
        return malformedCount;
    }
}
