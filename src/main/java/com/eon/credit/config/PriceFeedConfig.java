package com.eon.credit.config;

import com.eon.credit.lending.ChainlinkPriceFeed;
import com.eon.credit.lending.PriceFeed;
import com.eon.credit.lending.StaticPriceFeed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Clock;

@Slf4j
@Configuration
public class PriceFeedConfig {

    @Bean
    @ConditionalOnProperty(prefix = "credit.price-feed", name = "mode", havingValue = "static", matchIfMissing = true)
    public PriceFeed staticPriceFeed(CreditProperties properties, Clock clock) {
        log.info("Using static prices for {}", properties.getPriceFeed().getStaticPrices().keySet());
        return new StaticPriceFeed(properties.getPriceFeed().getStaticPrices(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "credit.price-feed", name = "mode", havingValue = "chainlink")
    public Web3j web3j(Environment env) {
        String rpc = env.getRequiredProperty("web3.rpc-url");
        return Web3j.build(new HttpService(rpc));
    }

    @Bean
    @ConditionalOnProperty(prefix = "credit.price-feed", name = "mode", havingValue = "chainlink")
    public PriceFeed chainlinkPriceFeed(Web3j web3j, CreditProperties properties) {
        log.info("Using Chainlink aggregators for {}", properties.getPriceFeed().getAggregators().keySet());
        return new ChainlinkPriceFeed(web3j, properties.getPriceFeed().getAggregators());
    }
}
