package com.salary.disclosure.ingest;

import java.util.List;

/**
 * Thrown when an input file lacks one or more required columns.
 * The whole file is rejected; sibling files are unaffected.
 */
public class MissingFieldException extends Exception {

    private final String inputName;
    private final List<String> missingColumns;

    public MissingFieldException(String inputName, List<String> missingColumns) {
        super("Input '" + inputName + "' is missing required columns " + missingColumns);
        this.inputName = inputName;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public String getInputName() {
        return inputName;
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
