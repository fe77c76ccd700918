package com.bit.unchained.config;

import com.bit.unchained.common.Address;
import com.bit.unchained.custody.CustodianDirectory;
import com.bit.unchained.custody.memory.MemoryNftRegistry;
import com.bit.unchained.custody.memory.MemoryPriceOracle;
import com.bit.unchained.custody.memory.MemoryTokenLedger;
import com.bit.unchained.signature.EngineDomain;
import com.bit.unchained.structure.params.GlobalParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 引擎装配：时钟、签名域、内存托管方（代币、NFT、价格预言机）与初始全局参数
 */
@Slf4j
@Configuration
public class CommonConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EngineDomain engineDomain(StakingProperties properties) {
        EngineDomain domain = new EngineDomain(properties.getName(), properties.getVersion(),
                properties.getChainId(), Address.fromHex(properties.getEngineAddress()));
        log.info("签名域 name={} version={} chainId={} 引擎地址={}",
                domain.getName(), domain.getVersion(), domain.getChainId(), domain.getSelfAddress());
        return domain;
    }

    @Bean
    public MemoryTokenLedger tokenLedger(StakingProperties properties) {
        return new MemoryTokenLedger(Address.fromHex(properties.getToken()));
    }

    @Bean
    public MemoryNftRegistry nftRegistry(StakingProperties properties) {
        return new MemoryNftRegistry(Address.fromHex(properties.getNft()));
    }

    @Bean
    public MemoryPriceOracle priceOracle(StakingProperties properties) {
        return new MemoryPriceOracle(Address.fromHex(properties.getNftTracker()));
    }

    @Bean
    public CustodianDirectory custodianDirectory(MemoryTokenLedger tokenLedger,
                                                 MemoryNftRegistry nftRegistry,
                                                 MemoryPriceOracle priceOracle) {
        return new CustodianDirectory().register(tokenLedger).register(nftRegistry).register(priceOracle);
    }

    @Bean
    public GlobalParams initialParams(StakingProperties properties) {
        return GlobalParams.builder()
                .token(Address.fromHex(properties.getToken()))
                .nft(Address.fromHex(properties.getNft()))
                .nftTracker(Address.fromHex(properties.getNftTracker()))
                .threshold(properties.getThreshold())
                .expiration(properties.getExpiration())
                .collector(Address.fromHex(properties.getCollector()))
                .version(0L)
                .build();
    }
}
