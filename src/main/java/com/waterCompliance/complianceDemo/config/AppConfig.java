package com.waterCompliance.complianceDemo.config;

import com.waterCompliance.complianceDemo.thread.MdcAwareExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs analysis pipelines. One task per session; the request thread never waits on it.
     */
    @Bean(name = "analysisExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor analysisExecutor(@Value("${analysis.executor.threads:8}") int threads) {
        return new MdcAwareExecutor("analysis-", threads);
    }

    @Bean(name = "broadcastExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor broadcastExecutor(@Value("${broadcast.executor.threads:4}") int threads) {
        return new MdcAwareExecutor("broadcast-", threads);
    }

    /**
     * Shared by every outbound client (reasoning, system registry, guidance search).
     */
    @Bean(name = "externalRequestFactory")
    public ClientHttpRequestFactory externalRequestFactory(
            @Value("${external.http.connect-timeout:PT5S}") Duration connectTimeout,
            @Value("${external.http.read-timeout:PT30S}") Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return factory;
    }
}
