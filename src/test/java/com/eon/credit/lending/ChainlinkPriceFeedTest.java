package com.eon.credit.lending;

import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.UpstreamException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.abi.datatypes.generated.Uint80;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChainlinkPriceFeed")
class ChainlinkPriceFeedTest {

    private static final String WETH_AGGREGATOR = "0x5f4eC3Df9cbd43714FE2740f5E3616155c5b8419";
    private static final Instant UPDATED = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private Web3j web3j;

    private ChainlinkPriceFeed feed;

    @BeforeEach
    void setUp() {
        feed = new ChainlinkPriceFeed(web3j, Map.of("WETH", WETH_AGGREGATOR));
    }

    @SuppressWarnings("rawtypes")
    private static String encode(Type... values) {
        return "0x" + FunctionEncoder.encodeConstructor(Arrays.asList(values));
    }

    private static String roundData(long answer) {
        return encode(new Uint80(BigInteger.ONE), new Int256(BigInteger.valueOf(answer)),
                new Uint256(BigInteger.valueOf(UPDATED.getEpochSecond() - 60)),
                new Uint256(BigInteger.valueOf(UPDATED.getEpochSecond())), new Uint80(BigInteger.ONE));
    }

    @SuppressWarnings("unchecked")
    private static Request<?, EthCall> reply(String result) throws IOException {
        EthCall response = new EthCall();
        response.setResult(result);
        Request<?, EthCall> request = mock(Request.class);
        when(request.send()).thenReturn(response);
        return request;
    }

    @Test
    @DisplayName("scales the answer by the aggregator's decimals")
    void scalesByDecimals() throws IOException {
        Request<?, EthCall> round = reply(roundData(200012345678L));
        Request<?, EthCall> decimals = reply(encode(new Uint8(BigInteger.valueOf(8))));
        doReturn(round).doReturn(decimals).when(web3j).ethCall(any(), any());

        PriceQuote quote = feed.latestPrice("WETH");

        assertThat(quote.asset()).isEqualTo("WETH");
        assertThat(quote.price()).isEqualByComparingTo("2000.12345678");
        assertThat(quote.updatedAt()).isEqualTo(UPDATED);
    }

    @Test
    @DisplayName("rejects a non-positive answer")
    void nonPositive() throws IOException {
        Request<?, EthCall> round = reply(roundData(-1));
        Request<?, EthCall> decimals = reply(encode(new Uint8(BigInteger.valueOf(8))));
        doReturn(round).doReturn(decimals).when(web3j).ethCall(any(), any());

        assertThatThrownBy(() -> feed.latestPrice("WETH"))
                .isInstanceOf(UpstreamException.class)
                .hasFieldOrPropertyWithValue("code", CreditErrorCode.PRICE_UNAVAILABLE);
    }

    @Test
    @DisplayName("reports a reverted call")
    @SuppressWarnings("unchecked")
    void reverted() throws IOException {
        EthCall response = new EthCall();
        response.setError(new Response.Error(3, "execution reverted"));
        Request<?, EthCall> request = mock(Request.class);
        when(request.send()).thenReturn(response);
        doReturn(request).when(web3j).ethCall(any(), any());

        assertThatThrownBy(() -> feed.latestPrice("WETH"))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("execution reverted");
    }

    @Test
    @DisplayName("wraps an unreachable node")
    @SuppressWarnings("unchecked")
    void unreachable() throws IOException {
        Request<?, EthCall> request = mock(Request.class);
        when(request.send()).thenThrow(new IOException("connection refused"));
        doReturn(request).when(web3j).ethCall(any(), any());

        assertThatThrownBy(() -> feed.latestPrice("WETH"))
                .isInstanceOf(UpstreamException.class)
                .hasFieldOrPropertyWithValue("code", CreditErrorCode.PRICE_UNAVAILABLE)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("fails for an asset without an aggregator")
    void unknownAsset() {
        ChainlinkPriceFeed empty = new ChainlinkPriceFeed(web3j, Collections.emptyMap());

        assertThatThrownBy(() -> empty.latestPrice("WBTC"))
                .isInstanceOf(UpstreamException.class)
                .hasFieldOrPropertyWithValue("code", CreditErrorCode.PRICE_UNAVAILABLE);
        verifyNoInteractions(web3j);
    }
}
