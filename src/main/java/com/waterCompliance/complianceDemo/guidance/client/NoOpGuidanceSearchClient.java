package com.waterCompliance.complianceDemo.guidance.client;

import com.waterCompliance.complianceDemo.guidance.model.GuidanceReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@ConditionalOnProperty(name = "guidance.provider", havingValue = "none", matchIfMissing = true)
public class NoOpGuidanceSearchClient implements GuidanceSearchClient {

    @Override
    public List<GuidanceReference> search(String contaminant, String violationType) {
        log.debug("Guidance search disabled - contaminant: {}", contaminant);
        return List.of();
    }
}
