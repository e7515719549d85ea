package com.waterCompliance.complianceDemo.compliance.service;

import com.waterCompliance.complianceDemo.compliance.config.ThresholdTable;
import com.waterCompliance.complianceDemo.compliance.exception.RuleEvaluationException;
import com.waterCompliance.complianceDemo.compliance.model.NotificationTier;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.compliance.model.SampleRecord;
import com.waterCompliance.complianceDemo.compliance.model.StatisticMethod;
import com.waterCompliance.complianceDemo.compliance.model.ThresholdEntry;
import com.waterCompliance.complianceDemo.compliance.model.ThresholdKind;
import com.waterCompliance.complianceDemo.compliance.model.Violation;
import com.waterCompliance.complianceDemo.compliance.util.PercentileCalculator;
import com.waterCompliance.complianceDemo.compliance.util.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Deterministic rule engine: compares sample statistics with the threshold table
 * and assigns tier and severity. The same input always yields the same violations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ViolationClassifier {

    private final ThresholdTable thresholdTable;

    /**
     * Classifies the records of a single parameter. Records for other parameters are ignored.
     *
     * @return the violation, or empty when the parameter is within its limit
     * @throws RuleEvaluationException for an unknown parameter, an unconvertible unit or an
     *         empty record set with no monitoring requirement
     */
    public Optional<Violation> classify(String parameter, List<SampleRecord> records) {
        ThresholdEntry entry = thresholdTable.find(parameter)
                .orElseThrow(() -> new RuleEvaluationException("No threshold defined for parameter: " + parameter));
        List<SampleRecord> relevant = records == null ? List.of() : records.stream()
                .filter(record -> entry == thresholdTable.find(record.getParameter()).orElse(null))
                .toList();
        return classify(entry, relevant);
    }

    /**
     * Classifies a mixed record set. Violations come back in threshold table order.
     * Parameters with no records only produce a violation when monitoring is required.
     */
    public List<Violation> classifyAll(List<SampleRecord> records) {
        Map<ThresholdEntry, List<SampleRecord>> grouped = new LinkedHashMap<>();
        for (SampleRecord record : records == null ? List.<SampleRecord>of() : records) {
            ThresholdEntry entry = thresholdTable.find(record.getParameter())
                    .orElseThrow(() -> new RuleEvaluationException(
                            "No threshold defined for parameter: " + record.getParameter()));
            grouped.computeIfAbsent(entry, key -> new ArrayList<>()).add(record);
        }

        List<Violation> violations = new ArrayList<>();
        for (ThresholdEntry entry : thresholdTable.getEntries()) {
            List<SampleRecord> entryRecords = grouped.get(entry);
            if (entryRecords == null && !entry.isMonitoringRequired()) {
                continue;
            }
            classify(entry, entryRecords == null ? List.of() : entryRecords).ifPresent(violations::add);
        }
        log.debug("Classification finished - records: {}, violations: {}",
                records == null ? 0 : records.size(), violations.size());
        return violations;
    }

    private Optional<Violation> classify(ThresholdEntry entry, List<SampleRecord> records) {
        if (records.isEmpty()) {
            if (!entry.isMonitoringRequired()) {
                throw new RuleEvaluationException("No samples to evaluate for parameter: " + entry.getParameter());
            }
            return Optional.of(monitoringViolation(entry));
        }

        List<Double> values = convertedValues(entry, records);
        double measured = statistic(entry, values);
        if (!entry.getComparison().exceeds(measured, entry.getThreshold())) {
            return Optional.empty();
        }

        Double ratio = null;
        RiskLevel severity = entry.getTier().getBaseSeverity();
        if (entry.getStatistic() != StatisticMethod.PRESENCE && entry.getThreshold() > 0) {
            ratio = measured / entry.getThreshold();
            severity = RiskLevel.max(severity, thresholdTable.healthSeverity(entry.getParameter(), ratio).orElse(null));
        }

        return Optional.of(Violation.builder()
                .parameter(entry.getParameter())
                .measuredValue(measured)
                .statistic(entry.getStatistic())
                .unit(entry.getUnit())
                .threshold(entry.getThreshold())
                .thresholdKind(entry.getKind())
                .tier(entry.getTier())
                .severity(severity)
                .citation(entry.getCitation())
                .healthEffects(entry.getHealthEffects())
                .sampleCount(records.size())
                .exceedanceRatio(ratio)
                .build());
    }

    private Violation monitoringViolation(ThresholdEntry entry) {
        return Violation.builder()
                .parameter(entry.getParameter())
                .measuredValue(0)
                .statistic(entry.getStatistic())
                .unit(entry.getUnit())
                .threshold(entry.getThreshold())
                .thresholdKind(ThresholdKind.MONITORING_REQUIREMENT)
                .tier(NotificationTier.TIER_3)
                .severity(entry.getMonitoringSeverity())
                .citation(entry.getCitation())
                .healthEffects("Required monitoring for " + entry.getParameter() + " was not performed")
                .sampleCount(0)
                .build();
    }

    private List<Double> convertedValues(ThresholdEntry entry, List<SampleRecord> records) {
        List<Double> values = new ArrayList<>(records.size());
        for (SampleRecord record : records) {
            if (record.getResult() == null) {
                throw new RuleEvaluationException("Sample for " + entry.getParameter() + " has no result value");
            }
            if (entry.getStatistic() == StatisticMethod.PRESENCE) {
                values.add(presenceValue(entry, record));
            } else {
                values.add(UnitConverter.convert(record.getResult(), record.getUnit(), entry.getUnit()));
            }
        }
        return values;
    }

    // presence/absence parameters read any positive count or "present" flag as detected
    private double presenceValue(ThresholdEntry entry, SampleRecord record) {
        if (!UnitConverter.isPresenceCompatible(record.getUnit())) {
            throw new RuleEvaluationException("Unit " + record.getUnit() + " cannot express presence of " + entry.getParameter());
        }
        return record.indicatesPresence() ? 1.0 : 0.0;
    }

    private double statistic(ThresholdEntry entry, List<Double> values) {
        return switch (entry.getStatistic()) {
            case PRESENCE, MAXIMUM -> PercentileCalculator.maximum(values);
            case PERCENTILE -> PercentileCalculator.percentile(values, entry.getPercentile(), entry.getPercentileMethod());
            case ARITHMETIC_MEAN -> PercentileCalculator.arithmeticMean(values);
            case GEOMETRIC_MEAN -> PercentileCalculator.geometricMean(values, entry.getZeroSubstitute());
        };
    }
}
