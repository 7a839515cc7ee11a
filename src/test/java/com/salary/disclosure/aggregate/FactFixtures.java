package com.salary.disclosure.aggregate;

import com.salary.disclosure.core.model.FactRecord;

/**
 * Compact fact builders for analytics tests.
 */
final class FactFixtures {

    private FactFixtures() {
    }

    static FactRecord fact(int year, long personId, long employerId, double totalComp) {
        return FactRecord.builder()
                .year(year)
                .personId(personId)
                .employerId(employerId)
                .jobId(1)
                .sector("Other")
                .salary(totalComp)
                .firstName("P" + personId)
                .lastName("L" + personId)
                .employerCanonical("E" + employerId)
                .jobCanonical("ANALYST")
                .build();
    }

    static FactRecord sectorFact(int year, String sector, long employerId, String job, double totalComp) {
        return FactRecord.builder()
                .year(year)
                .personId(1)
                .employerId(employerId)
                .jobId(job.hashCode() & 0xFFFFL)
                .sector(sector)
                .salary(totalComp)
                .employerCanonical("E" + employerId)
                .jobCanonical(job)
                .build();
    }
}
