package com.salary.disclosure.ingest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the header variants used across yearly extracts onto the standard column names.
 * Headers are trimmed and lower-cased before lookup.
 */
public final class ColumnDictionary {

    public static final String SECTOR = "sector";
    public static final String LAST_NAME = "last_name";
    public static final String FIRST_NAME = "first_name";
    public static final String SALARY = "salary";
    public static final String BENEFITS = "benefits";
    public static final String EMPLOYER = "employer";
    public static final String JOB_TITLE = "job_title";
    public static final String YEAR = "year";

    /**
     * Columns every input must carry. The year column is optional since the file name decides the year.
     */
    public static final List<String> REQUIRED = List.of(
            SECTOR, LAST_NAME, FIRST_NAME, SALARY, BENEFITS, EMPLOYER, JOB_TITLE);

    private static final Map<String, String> VARIANTS = new HashMap<>();

    static {
        VARIANTS.put("sector", SECTOR);
        VARIANTS.put("last name", LAST_NAME);
        VARIANTS.put("surname", LAST_NAME);
        VARIANTS.put("last_name", LAST_NAME);
        VARIANTS.put("first name", FIRST_NAME);
        VARIANTS.put("first_name", FIRST_NAME);
        VARIANTS.put("salary paid", SALARY);
        VARIANTS.put("salary", SALARY);
        VARIANTS.put("taxable benefits", BENEFITS);
        VARIANTS.put("benefits", BENEFITS);
        VARIANTS.put("employer", EMPLOYER);
        VARIANTS.put("job title", JOB_TITLE);
        VARIANTS.put("position", JOB_TITLE);
        VARIANTS.put("job_title", JOB_TITLE);
        VARIANTS.put("jobtitle", JOB_TITLE);
        VARIANTS.put("year", YEAR);
        VARIANTS.put("calendar year", YEAR);
    }

    private ColumnDictionary() {
        // Utility class
    }

    public static Optional<String> standardName(String header) {
        if (header == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(VARIANTS.get(header.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Standard column name to header position. Unknown headers are ignored; when two
     * headers map to the same column the first one is used.
     */
    public static Map<String, Integer> indexHeaders(List<String> headers) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            int index = i;
            standardName(headers.get(i)).ifPresent(column -> positions.putIfAbsent(column, index));
        }
        return positions;
    }

    public static List<String> missingRequired(Map<String, Integer> positions) {
        List<String> missing = new ArrayList<>();
        for (String column : REQUIRED) {
            if (!positions.containsKey(column)) {
                missing.add(column);
            }
        }
        return missing;
    }
}
