package com.waterCompliance.complianceDemo.registry.client;

import com.waterCompliance.complianceDemo.compliance.model.NotificationTier;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.registry.model.RecordedViolation;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns rows of the SDWIS violation table into {@link RecordedViolation}s.
 */
final class SdwisViolationMapper {

    static final int MAX_RECORDED_VIOLATIONS = 10;

    private static final Map<String, String> CONTAMINANT_NAMES = Map.of(
            "PB90", "Lead",
            "CU90", "Copper",
            "1040", "Nitrate",
            "1005", "Arsenic",
            "2950", "Total Trihalomethanes",
            "2456", "Haloacetic Acids",
            "3100", "Total Coliform",
            "3014", "E. coli",
            "0100", "Turbidity",
            "4010", "Combined Radium"
    );

    // acute contaminants: coliform bacteria and nitrate
    private static final Set<String> TIER_ONE_CODES = Set.of("3100", "3014", "1040");

    private static final Set<String> CRITICAL_CODES = Set.of("PB90", "3100", "3014", "1040", "1005");

    private SdwisViolationMapper() {}

    /**
     * Maps at most {@link #MAX_RECORDED_VIOLATIONS} rows; rows without a contaminant code are skipped.
     */
    static List<RecordedViolation> toRecordedViolations(List<Map<String, Object>> rows) {
        if (rows == null) {
            return List.of();
        }
        return rows.stream()
                .map(SdwisViolationMapper::toRecordedViolation)
                .filter(Objects::nonNull)
                .limit(MAX_RECORDED_VIOLATIONS)
                .toList();
    }

    static RecordedViolation toRecordedViolation(Map<String, Object> row) {
        String contaminantCode = text(row.get("contaminant_code"));
        if (contaminantCode == null || contaminantCode.isEmpty()) {
            return null;
        }
        return RecordedViolation.builder()
                .parameter(contaminantName(contaminantCode))
                .contaminantCode(contaminantCode)
                .violationCode(text(row.get("violation_code")))
                .compliancePeriodBegin(text(row.get("compl_per_begin_date")))
                .tier(TIER_ONE_CODES.contains(contaminantCode) ? NotificationTier.TIER_1 : NotificationTier.TIER_2)
                .severity(CRITICAL_CODES.contains(contaminantCode) ? RiskLevel.CRITICAL : RiskLevel.HIGH)
                .build();
    }

    static String contaminantName(String code) {
        return CONTAMINANT_NAMES.getOrDefault(code, "Contaminant " + code);
    }

    private static String text(Object value) {
        return value != null ? value.toString().trim() : null;
    }
}
