package com.waterCompliance.complianceDemo.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation IDs for request tracking. A caller-supplied ID is kept when it is safe to log.
 */
@Service
public class CorrelationIdService {

    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9-]{8,64}$");

    public String resolveCorrelationId(String incoming) {
        if (incoming != null && SAFE_ID.matcher(incoming).matches()) {
            return incoming;
        }
        return UUID.randomUUID().toString();
    }
}
