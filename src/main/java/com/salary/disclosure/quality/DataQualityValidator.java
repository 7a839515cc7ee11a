package com.salary.disclosure.quality;

import com.salary.disclosure.aggregate.Distributions;
import com.salary.disclosure.core.model.FactRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the data-quality checks over the fact stream and builds a {@link DataQualityReport}.
 * Checks run in a fixed order so the same facts always give the same issue list.
 */
public class DataQualityValidator {
    private static final Logger log = LoggerFactory.getLogger(DataQualityValidator.class);

    static final int HIGH_SALARY_SAMPLES = 5;
    static final int DROPS_PER_YEAR = 5;
    static final int DROP_SAMPLES = 10;

    private final QualityThresholds thresholds;
    private final Clock clock;

    public DataQualityValidator() {
        this(QualityThresholds.defaults(), Clock.systemUTC());
    }

    public DataQualityValidator(QualityThresholds thresholds, Clock clock) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public DataQualityReport validate(List<FactRecord> facts) {
        List<QualityIssue> issues = new ArrayList<>();
        issues.addAll(checkEmptyFields(facts));
        issues.addAll(checkCompensation(facts));
        issues.addAll(checkHeadcountDrops(facts));
        issues.addAll(checkDuplicates(facts));

        DataQualityReport report = new DataQualityReport(clock.instant(), summarize(facts), issues);
        log.info("validation.completed records={} issues={} counts={}",
                facts.size(), issues.size(), report.issueCounts());
        if (report.hasHighSeverity()) {
            log.warn("validation.highSeverity issues={}", report.issueCounts().get(Severity.HIGH));
        }
        return report;
    }

    List<QualityIssue> checkEmptyFields(List<FactRecord> facts) {
        Map<String, Function<FactRecord, String>> fields = new LinkedHashMap<>();
        fields.put("first_name", FactRecord::firstName);
        fields.put("last_name", FactRecord::lastName);
        fields.put("employer_canonical", FactRecord::employerCanonical);

        List<QualityIssue> issues = new ArrayList<>();
        fields.forEach((field, accessor) -> {
            long empty = facts.stream().filter(fact -> accessor.apply(fact).isEmpty()).count();
            if (empty > 0) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("field", field);
                details.put("null_count", 0L);
                details.put("empty_count", empty);
                issues.add(new QualityIssue("null_values", Severity.MEDIUM, empty, details));
            }
        });
        return issues;
    }

    List<QualityIssue> checkCompensation(List<FactRecord> facts) {
        List<QualityIssue> issues = new ArrayList<>();

        List<FactRecord> high = facts.stream()
                .filter(fact -> fact.totalComp() > thresholds.highCompThreshold())
                .collect(Collectors.toList());
        if (!high.isEmpty()) {
            double max = high.stream().mapToDouble(FactRecord::totalComp).max().orElse(0.0);
            List<Map<String, Object>> sample = new ArrayList<>();
            for (FactRecord fact : high.subList(0, Math.min(HIGH_SALARY_SAMPLES, high.size()))) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("first_name", fact.firstName());
                row.put("last_name", fact.lastName());
                row.put("employer_canonical", fact.employerCanonical());
                row.put("total_comp", fact.totalComp());
                row.put("year", fact.year());
                sample.add(row);
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("max_value", max);
            details.put("sample", sample);
            issues.add(new QualityIssue("high_salary", Severity.INFO, high.size(), details));
        }

        SortedSet<Integer> zeroYears = new TreeSet<>();
        long zero = 0;
        long below = 0;
        for (FactRecord fact : facts) {
            if (fact.totalComp() <= 0) {
                zero++;
                zeroYears.add(fact.year());
            } else if (fact.totalComp() < thresholds.disclosureThreshold()) {
                below++;
            }
        }
        if (zero > 0) {
            issues.add(new QualityIssue("zero_negative_salary", Severity.MEDIUM, zero,
                    Map.of("years_affected", List.copyOf(zeroYears))));
        }
        if (below > 0) {
            issues.add(new QualityIssue("below_threshold", Severity.LOW, below,
                    Map.of("note", "Records below the disclosure threshold; may be a partial year or a data issue")));
        }
        return issues;
    }

    /**
     * Employers whose headcount fell below half of the previous dataset year's, among
     * employers that had at least the configured minimum. An employer absent from the
     * current year is not a drop.
     */
    List<QualityIssue> checkHeadcountDrops(List<FactRecord> facts) {
        SortedMap<Integer, Map<String, Integer>> headcounts = new TreeMap<>();
        SortedSet<String> employers = new TreeSet<>();
        for (FactRecord fact : facts) {
            headcounts.computeIfAbsent(fact.year(), y -> new HashMap<>())
                    .merge(fact.employerCanonical(), 1, Integer::sum);
            employers.add(fact.employerCanonical());
        }

        List<Map<String, Object>> drops = new ArrayList<>();
        Map<String, Integer> previous = null;
        for (Map.Entry<Integer, Map<String, Integer>> entry : headcounts.entrySet()) {
            Map<String, Integer> current = entry.getValue();
            if (previous != null) {
                int found = 0;
                for (String employer : employers) {
                    int prev = previous.getOrDefault(employer, 0);
                    int curr = current.getOrDefault(employer, 0);
                    if (prev >= thresholds.headcountDropMin() && curr > 0 && curr < prev * 0.5) {
                        if (found++ >= DROPS_PER_YEAR) {
                            break;
                        }
                        Map<String, Object> drop = new LinkedHashMap<>();
                        drop.put("employer", employer);
                        drop.put("year", entry.getKey());
                        drop.put("prev_count", prev);
                        drop.put("curr_count", curr);
                        drop.put("drop_pct", Distributions.round((1.0 - (double) curr / prev) * 100.0, 1));
                        drops.add(drop);
                    }
                }
            }
            previous = current;
        }

        if (drops.isEmpty()) {
            return List.of();
        }
        return List.of(new QualityIssue("large_headcount_drops", Severity.INFO, drops.size(),
                Map.of("samples", List.copyOf(drops.subList(0, Math.min(DROP_SAMPLES, drops.size()))))));
    }

    List<QualityIssue> checkDuplicates(List<FactRecord> facts) {
        Map<ExactKey, Integer> exact = new HashMap<>();
        Map<PersonYearKey, Integer> near = new HashMap<>();
        for (FactRecord fact : facts) {
            exact.merge(new ExactKey(fact.firstName(), fact.lastName(), fact.employerCanonical(),
                    fact.year(), fact.totalComp()), 1, Integer::sum);
            near.merge(new PersonYearKey(fact.firstName(), fact.lastName(), fact.employerCanonical(),
                    fact.year()), 1, Integer::sum);
        }

        long exactRows = 0;
        long exactGroups = 0;
        for (int count : exact.values()) {
            if (count > 1) {
                exactRows += count;
                exactGroups++;
            }
        }
        long nearRows = near.values().stream().filter(count -> count > 1).mapToLong(Integer::longValue).sum();

        List<QualityIssue> issues = new ArrayList<>();
        if (exactRows > 0) {
            issues.add(new QualityIssue("exact_duplicates", Severity.HIGH, exactRows,
                    Map.of("unique_groups", exactGroups)));
        }
        long nearOnly = nearRows - exactRows;
        if (nearOnly > 0) {
            issues.add(new QualityIssue("same_person_employer_year", Severity.LOW, nearOnly,
                    Map.of("note", "May indicate job changes within the same year and employer")));
        }
        return issues;
    }

    QualitySummary summarize(List<FactRecord> facts) {
        if (facts.isEmpty()) {
            return new QualitySummary(0, null, null, 0, 0, 0, 0.0, 0.0, 0.0);
        }
        Set<String> employers = new HashSet<>();
        Set<Long> persons = new HashSet<>();
        Set<String> jobs = new HashSet<>();
        List<Double> totals = new ArrayList<>(facts.size());
        int firstYear = Integer.MAX_VALUE;
        int lastYear = Integer.MIN_VALUE;
        double sum = 0.0;
        for (FactRecord fact : facts) {
            employers.add(fact.employerCanonical());
            persons.add(fact.personId());
            jobs.add(fact.jobCanonical());
            totals.add(fact.totalComp());
            firstYear = Math.min(firstYear, fact.year());
            lastYear = Math.max(lastYear, fact.year());
            sum += fact.totalComp();
        }
        return new QualitySummary(facts.size(), firstYear, lastYear, employers.size(), persons.size(),
                jobs.size(), sum, sum / facts.size(), Distributions.median(totals));
    }

    private record ExactKey(String firstName, String lastName, String employer, int year, double totalComp) {}

    private record PersonYearKey(String firstName, String lastName, String employer, int year) {}
}
