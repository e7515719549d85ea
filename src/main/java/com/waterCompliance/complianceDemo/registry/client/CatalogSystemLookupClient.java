package com.waterCompliance.complianceDemo.registry.client;

import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;
import com.waterCompliance.complianceDemo.registry.repository.SystemCatalogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "registry.provider", havingValue = "catalog", matchIfMissing = true)
public class CatalogSystemLookupClient implements SystemLookupClient {

    private final SystemCatalogRepository systemCatalogRepository;

    @Override
    public Optional<WaterSystemInfo> lookup(String pwsid) {
        return systemCatalogRepository.findByPwsid(pwsid)
                .map(system -> system.toBuilder().dataSource("catalog").build());
    }
}
