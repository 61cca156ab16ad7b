package com.eon.credit.scoring;

import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Map;

/** Reads the aggregate reputation from the cross-system score service: GET {base}/scores/{subject} -> {"score": n}. */
@Slf4j
public class AggregatorReputationClient implements ExternalReputationSource {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public AggregatorReputationClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    @SuppressWarnings("rawtypes")
    public int reputationOf(String subject) {
        URI uri = URI.create(baseUrl + "/scores/" + subject);
        ResponseEntity<Map> resp;
        try {
            resp = restTemplate.exchange(RequestEntity.get(uri).build(), Map.class);
        } catch (RestClientException ex) {
            log.warn("Reputation lookup failed for {}: {}", subject, ex.toString());
            throw new UpstreamException(CreditErrorCode.REPUTATION_UNAVAILABLE,
                    "Reputation service unavailable for " + subject, ex);
        }
        Object score = resp.getBody() == null ? null : resp.getBody().get("score");
        if (!(score instanceof Number)) {
            throw new UpstreamException(CreditErrorCode.REPUTATION_UNAVAILABLE,
                    "Reputation service returned no score for " + subject);
        }
        return ((Number) score).intValue();
    }
}
