package com.salary.disclosure.core.model;

/**
 * One disclosed salary row as ingested from a yearly extract.
 * Text fields are never null (missing text becomes the empty string).
 *
 * @param year        disclosure year
 * @param sector      sector as published
 * @param lastName    last name, possibly empty
 * @param firstName   first name, possibly empty
 * @param employerRaw employer string as published
 * @param jobTitleRaw job title as published
 * @param salary      salary paid, already currency-parsed
 * @param benefits    taxable benefits, already currency-parsed
 */
public record RawRecord(
        int year,
        String sector,
        String lastName,
        String firstName,
        String employerRaw,
        String jobTitleRaw,
        double salary,
        double benefits
) {
    public RawRecord {
        sector = sector != null ? sector : "";
        lastName = lastName != null ? lastName : "";
        firstName = firstName != null ? firstName : "";
        employerRaw = employerRaw != null ? employerRaw : "";
        jobTitleRaw = jobTitleRaw != null ? jobTitleRaw : "";
        if (salary < 0 || Double.isNaN(salary)) {
            throw new IllegalArgumentException("salary must be >= 0, got " + salary);
        }
        if (benefits < 0 || Double.isNaN(benefits)) {
            throw new IllegalArgumentException("benefits must be >= 0, got " + benefits);
        }
    }

    public double totalComp() {
        return salary + benefits;
    }
}
