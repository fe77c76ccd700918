package com.bit.unchained;

import com.bit.unchained.util.ByteUtils;
import com.bit.unchained.util.Secp256k1Signer;
import com.bit.unchained.util.Sha;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.math.BigInteger;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.unchained")
public class UnchainedApplication {
    public static void main(String[] args) {
        SpringApplication.run(UnchainedApplication.class, args);

        long start = System.currentTimeMillis();
        Sha.applyKeccak256(new byte[0]);
        Secp256k1Signer.addressOf(Secp256k1Signer.keyFromPrivate(
                ByteUtils.uint256(BigInteger.ONE)));
        log.info("预热耗时{}ms", System.currentTimeMillis() - start);
    }
    //二进制统一大端
}
