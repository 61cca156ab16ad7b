package com.eon.credit.config;

import com.eon.credit.attestation.AttestationRepository;
import com.eon.credit.attestation.AttestedReputationSource;
import com.eon.credit.scoring.AggregatorReputationClient;
import com.eon.credit.scoring.ExternalReputationSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/** Reputation comes from the external aggregator when one is configured, else from finalized attestations. */
@Slf4j
@Configuration
public class ReputationConfig {

    @Value("${reputation.baseUrl:}")
    private String baseUrl;

    @Bean
    public ExternalReputationSource reputationSource(RestTemplate restTemplate, AttestationRepository attestations,
                                                     CreditProperties properties) {
        if (StringUtils.hasText(baseUrl)) {
            log.info("Reputation aggregator at {}", baseUrl);
            return new AggregatorReputationClient(restTemplate, baseUrl);
        }
        log.info("No reputation aggregator configured, using attested scores");
        return new AttestedReputationSource(attestations, properties);
    }
}
