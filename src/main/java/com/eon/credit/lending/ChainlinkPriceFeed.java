package com.eon.credit.lending;

import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.UpstreamException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.abi.datatypes.generated.Uint80;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Reads Chainlink aggregator contracts ({@code latestRoundData}, {@code decimals}) over JSON-RPC. */
@Slf4j
@RequiredArgsConstructor
public class ChainlinkPriceFeed implements PriceFeed {

    private static final String CALLER = "0x0000000000000000000000000000000000000000";

    private final Web3j web3j;
    private final Map<String, String> aggregators;

    @Override
    @SuppressWarnings("rawtypes")
    public PriceQuote latestPrice(String asset) {
        String aggregator = aggregators.get(asset);
        if (aggregator == null) {
            throw new UpstreamException(CreditErrorCode.PRICE_UNAVAILABLE, "No price aggregator configured for " + asset);
        }
        try {
            List<Type> round = call(aggregator, new Function("latestRoundData", Collections.emptyList(),
                    Arrays.<TypeReference<?>>asList(
                            new TypeReference<Uint80>() {},
                            new TypeReference<Int256>() {},
                            new TypeReference<Uint256>() {},
                            new TypeReference<Uint256>() {},
                            new TypeReference<Uint80>() {})));
            List<Type> decimals = call(aggregator, new Function("decimals", Collections.emptyList(),
                    Collections.<TypeReference<?>>singletonList(new TypeReference<Uint8>() {})));

            BigInteger answer = (BigInteger) round.get(1).getValue();
            BigInteger updatedAt = (BigInteger) round.get(3).getValue();
            int scale = ((BigInteger) decimals.get(0).getValue()).intValue();
            if (answer.signum() <= 0) {
                throw new UpstreamException(CreditErrorCode.PRICE_UNAVAILABLE, "Non-positive answer for " + asset);
            }
            return new PriceQuote(asset, new BigDecimal(answer, scale), Instant.ofEpochSecond(updatedAt.longValue()));
        } catch (IOException ex) {
            log.warn("Price read failed for {} at {}: {}", asset, aggregator, ex.toString());
            throw new UpstreamException(CreditErrorCode.PRICE_UNAVAILABLE, "Price feed unreachable for " + asset, ex);
        }
    }

    @SuppressWarnings("rawtypes")
    private List<Type> call(String contract, Function function) throws IOException {
        String data = FunctionEncoder.encode(function);
        EthCall response = web3j.ethCall(
                Transaction.createEthCallTransaction(CALLER, contract, data),
                DefaultBlockParameterName.LATEST).send();
        if (response.hasError()) {
            throw new UpstreamException(CreditErrorCode.PRICE_UNAVAILABLE,
                    function.getName() + " reverted on " + contract + ": " + response.getError().getMessage());
        }
        List<Type> values = FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
        if (values.isEmpty()) {
            throw new UpstreamException(CreditErrorCode.PRICE_UNAVAILABLE, function.getName() + " returned no data on " + contract);
        }
        return values;
    }
}
