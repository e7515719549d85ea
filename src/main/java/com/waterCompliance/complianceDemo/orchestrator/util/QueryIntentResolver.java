package com.waterCompliance.complianceDemo.orchestrator.util;

import com.waterCompliance.complianceDemo.orchestrator.model.AnalysisCommand;
import com.waterCompliance.complianceDemo.orchestrator.model.AnalysisIntent;
import com.waterCompliance.complianceDemo.orchestrator.model.QueryIntent;
import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;
import com.waterCompliance.complianceDemo.registry.repository.SystemCatalogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves which system and contaminant a free-text question is about.
 *
 * Resolution order for the system: explicit pwsid in the request, an identifier written in
 * the question, a catalog name or keyword mentioned in the question, then the configured default.
 */
@Slf4j
@Component
public class QueryIntentResolver {

    private static final Pattern PWSID_IN_TEXT = Pattern.compile("\\b([A-Za-z]{2}\\d{7})\\b");

    private static final Map<Pattern, String> CONTAMINANT_PATTERNS = new LinkedHashMap<>();

    static {
        CONTAMINANT_PATTERNS.put(keywords("e\\.? ?coli", "coliform", "bacteria"), "E. coli");
        CONTAMINANT_PATTERNS.put(keywords("lead"), "Lead");
        CONTAMINANT_PATTERNS.put(keywords("copper"), "Copper");
        CONTAMINANT_PATTERNS.put(keywords("nitrates?"), "Nitrate");
        CONTAMINANT_PATTERNS.put(keywords("pfoa", "pfas", "forever chemicals?"), "PFOA");
        CONTAMINANT_PATTERNS.put(keywords("tthm", "trihalomethanes?"), "Total Trihalomethanes");
        CONTAMINANT_PATTERNS.put(keywords("arsenic"), "Arsenic");
    }

    private static final Pattern NOTIFICATION_WORDS = keywords("notif\\w*", "notices?", "warn\\w*", "tell residents");
    private static final Pattern SAFETY_WORDS = keywords("safe", "drink\\w*", "boil");

    private final SystemCatalogRepository systemCatalogRepository;
    private final String defaultPwsid;

    public QueryIntentResolver(SystemCatalogRepository systemCatalogRepository,
                               @Value("${analysis.default-pwsid:OH7700001}") String defaultPwsid) {
        this.systemCatalogRepository = systemCatalogRepository;
        this.defaultPwsid = defaultPwsid;
    }

    public QueryIntent resolve(AnalysisCommand command) {
        String question = command.getQuestion() != null ? command.getQuestion() : "";
        String contaminant = findContaminant(question).orElse(null);

        String pwsid = command.getPwsid();
        boolean defaulted = false;
        if (pwsid == null || pwsid.isBlank()) {
            pwsid = findPwsid(question)
                    .or(() -> systemCatalogRepository.findByMention(question).map(WaterSystemInfo::getPwsid))
                    .orElse(null);
        }
        if (pwsid == null) {
            pwsid = defaultPwsid;
            defaulted = true;
        }

        QueryIntent intent = QueryIntent.builder()
                .intent(classify(question, contaminant))
                .pwsid(pwsid.trim())
                .contaminant(contaminant)
                .defaultedSystem(defaulted)
                .build();
        log.debug("Query intent resolved - correlationId: {}, intent: {}, pwsid: {}, contaminant: {}",
                command.getCorrelationId(), intent.getIntent(), intent.getPwsid(), contaminant);
        return intent;
    }

    private AnalysisIntent classify(String question, String contaminant) {
        if (contaminant != null) {
            return AnalysisIntent.CONTAMINANT_INQUIRY;
        }
        if (NOTIFICATION_WORDS.matcher(question).find()) {
            return AnalysisIntent.NOTIFICATION_INQUIRY;
        }
        if (SAFETY_WORDS.matcher(question).find()) {
            return AnalysisIntent.SAFETY_CHECK;
        }
        return AnalysisIntent.GENERAL_COMPLIANCE;
    }

    private static Optional<String> findPwsid(String question) {
        Matcher matcher = PWSID_IN_TEXT.matcher(question);
        return matcher.find() ? Optional.of(matcher.group(1).toUpperCase(Locale.ROOT)) : Optional.empty();
    }

    private static Optional<String> findContaminant(String question) {
        return CONTAMINANT_PATTERNS.entrySet().stream()
                .filter(entry -> entry.getKey().matcher(question).find())
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private static Pattern keywords(String... alternatives) {
        return Pattern.compile("\\b(?:" + String.join("|", alternatives) + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
