package com.eon.credit.scoring;

import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.UpstreamException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AggregatorReputationClient")
@SuppressWarnings("rawtypes")
class AggregatorReputationClientTest {

    private static final String SUBJECT = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";

    @Mock
    private RestTemplate restTemplate;

    private AggregatorReputationClient client;

    @BeforeEach
    void setUp() {
        client = new AggregatorReputationClient(restTemplate, "http://reputation.local/");
    }

    private void respond(Map body) {
        when(restTemplate.exchange(any(RequestEntity.class), eq(Map.class)))
                .thenReturn(new ResponseEntity<Map>(body, HttpStatus.OK));
    }

    @Test
    @DisplayName("reads the score for the subject")
    void score() {
        respond(Map.of("score", 73));

        assertThat(client.reputationOf(SUBJECT)).isEqualTo(73);

        ArgumentCaptor<RequestEntity> request = ArgumentCaptor.forClass(RequestEntity.class);
        verify(restTemplate).exchange(request.capture(), eq(Map.class));
        assertThat(request.getValue().getUrl().toString()).isEqualTo("http://reputation.local/scores/" + SUBJECT);
    }

    @Test
    @DisplayName("fails when the body has no numeric score")
    void missingScore() {
        respond(Map.of("subject", SUBJECT));

        assertThatThrownBy(() -> client.reputationOf(SUBJECT))
                .isInstanceOf(UpstreamException.class)
                .hasFieldOrPropertyWithValue("code", CreditErrorCode.REPUTATION_UNAVAILABLE);
    }

    @Test
    @DisplayName("fails on a textual score")
    void textualScore() {
        respond(Map.of("score", "73"));

        assertThatThrownBy(() -> client.reputationOf(SUBJECT))
                .isInstanceOf(UpstreamException.class)
                .hasFieldOrPropertyWithValue("code", CreditErrorCode.REPUTATION_UNAVAILABLE);
    }

    @Test
    @DisplayName("fails on an empty body")
    void emptyBody() {
        respond(null);

        assertThatThrownBy(() -> client.reputationOf(SUBJECT))
                .isInstanceOf(UpstreamException.class)
                .hasFieldOrPropertyWithValue("code", CreditErrorCode.REPUTATION_UNAVAILABLE);
    }

    @Test
    @DisplayName("wraps transport failures")
    void unreachable() {
        when(restTemplate.exchange(any(RequestEntity.class), eq(Map.class)))
                .thenThrow(new ResourceAccessException("connection refused"));

        assertThatThrownBy(() -> client.reputationOf(SUBJECT))
                .isInstanceOf(UpstreamException.class)
                .hasFieldOrPropertyWithValue("code", CreditErrorCode.REPUTATION_UNAVAILABLE)
                .hasCauseInstanceOf(ResourceAccessException.class);
    }
}
