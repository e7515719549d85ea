package com.waterCompliance.complianceDemo.registry.client;

import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;

import java.util.Optional;

/**
 * Looks up a public water system by identifier. Empty means the registry does not know it;
 * transport failures are thrown as ExternalCallException.
 */
public interface SystemLookupClient {

    Optional<WaterSystemInfo> lookup(String pwsid);
}
