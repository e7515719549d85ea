package com.waterCompliance.complianceDemo.compliance.service;

import com.waterCompliance.complianceDemo.compliance.model.SampleRecord;
import com.waterCompliance.complianceDemo.compliance.model.ValidationCheck;
import com.waterCompliance.complianceDemo.compliance.model.ValidationFinding;
import com.waterCompliance.complianceDemo.compliance.model.ValidationOutcome;
import com.waterCompliance.complianceDemo.compliance.model.ValidationReport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks identifier format, record completeness and collection timing before any
 * rule evaluation happens. A FAIL outcome blocks violation classification.
 */
@Component
public class SampleDataValidator {

    // two-letter state or region code followed by seven digits
    private static final Pattern PWSID_PATTERN = Pattern.compile("^[A-Z]{2}\\d{7}$");

    private final Clock clock;
    private final Duration stalenessWindow;
    private final Duration clockSkewTolerance;

    public SampleDataValidator(Clock clock,
                               @Value("${compliance.validation.staleness-window:P365D}") Duration stalenessWindow,
                               @Value("${compliance.validation.clock-skew-tolerance:PT5M}") Duration clockSkewTolerance) {
        this.clock = clock;
        this.stalenessWindow = stalenessWindow;
        this.clockSkewTolerance = clockSkewTolerance;
    }

    public ValidationReport validate(String pwsid, List<SampleRecord> samples) {
        List<SampleRecord> records = samples == null ? List.of() : samples;
        List<ValidationFinding> findings = new ArrayList<>();
        findings.add(checkIdentifier(pwsid));
        findings.add(checkCompleteness(records));
        findings.add(checkTiming(records));

        ValidationOutcome outcome = findings.stream()
                .map(ValidationFinding::getOutcome)
                .reduce(ValidationOutcome.PASS, ValidationOutcome::worst);

        return ValidationReport.builder()
                .pwsid(pwsid)
                .outcome(outcome)
                .sampleCount(records.size())
                .findings(List.copyOf(findings))
                .build();
    }

    private ValidationFinding checkIdentifier(String pwsid) {
        if (pwsid == null || pwsid.isBlank()) {
            return finding(ValidationCheck.IDENTIFIER_FORMAT, ValidationOutcome.FAIL, "No water system identifier supplied");
        }
        if (!PWSID_PATTERN.matcher(pwsid).matches()) {
            return finding(ValidationCheck.IDENTIFIER_FORMAT, ValidationOutcome.FAIL,
                    "Identifier '" + pwsid + "' does not match two letters followed by seven digits");
        }
        return finding(ValidationCheck.IDENTIFIER_FORMAT, ValidationOutcome.PASS, "Identifier " + pwsid + " is well formed");
    }

    private ValidationFinding checkCompleteness(List<SampleRecord> records) {
        if (records.isEmpty()) {
            return finding(ValidationCheck.RECORD_COMPLETENESS, ValidationOutcome.CONDITIONAL, "No sample records supplied");
        }
        int missingCore = 0;
        int missingLocation = 0;
        for (SampleRecord record : records) {
            if (isBlank(record.getParameter()) || record.getResult() == null || isBlank(record.getUnit())
                    || record.getCollectedAt() == null) {
                missingCore++;
            } else if (isBlank(record.getLocationId())) {
                missingLocation++;
            }
        }
        if (missingCore > 0) {
            return finding(ValidationCheck.RECORD_COMPLETENESS, ValidationOutcome.FAIL,
                    missingCore + " of " + records.size() + " records lack parameter, result, unit or collection time");
        }
        if (missingLocation > 0) {
            return finding(ValidationCheck.RECORD_COMPLETENESS, ValidationOutcome.CONDITIONAL,
                    missingLocation + " of " + records.size() + " records lack a sampling location");
        }
        return finding(ValidationCheck.RECORD_COMPLETENESS, ValidationOutcome.PASS,
                records.size() + " records complete");
    }

    private ValidationFinding checkTiming(List<SampleRecord> records) {
        Instant now = clock.instant();
        Instant latestAllowed = now.plus(clockSkewTolerance);
        Instant staleBefore = now.minus(stalenessWindow);
        int future = 0;
        int stale = 0;
        for (SampleRecord record : records) {
            Instant collectedAt = record.getCollectedAt();
            if (collectedAt == null) {
                continue;
            }
            if (collectedAt.isAfter(latestAllowed)) {
                future++;
            } else if (collectedAt.isBefore(staleBefore)) {
                stale++;
            }
        }
        if (future > 0) {
            return finding(ValidationCheck.TIMING_PLAUSIBILITY, ValidationOutcome.FAIL,
                    future + " records have a collection time in the future");
        }
        if (stale > 0) {
            return finding(ValidationCheck.TIMING_PLAUSIBILITY, ValidationOutcome.CONDITIONAL,
                    stale + " records are older than " + stalenessWindow.toDays() + " days");
        }
        return finding(ValidationCheck.TIMING_PLAUSIBILITY, ValidationOutcome.PASS, "Collection times plausible");
    }

    private static ValidationFinding finding(ValidationCheck check, ValidationOutcome outcome, String detail) {
        return ValidationFinding.builder().check(check).outcome(outcome).detail(detail).build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
