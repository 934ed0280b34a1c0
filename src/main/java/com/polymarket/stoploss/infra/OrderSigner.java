package com.polymarket.stoploss.infra;

import com.polymarket.stoploss.config.StopLossProperties;
import lombok.Builder;
import lombok.Data;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * EIP-712 signing for CLOB orders and for the L1 {@code ClobAuth} attestation used to derive API keys.
 */
@Component
public class OrderSigner {

    // Exchange contracts on Polygon
    public static final String CTF_EXCHANGE = "0x4bFb41d5B3570DeFd03C39a9A4D8dE6Bd8B8982E";
    public static final String NEG_RISK_CTF_EXCHANGE = "0xC5d563A36AE78145C45a50134d48A1215220f80a";

    static final String CLOB_AUTH_MESSAGE = "This message attests that I control the given wallet";

    // EIP-712 Type Hashes
    private static final byte[] EIP712_DOMAIN_TYPEHASH = keccak(
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)");

    private static final byte[] CLOB_AUTH_DOMAIN_TYPEHASH = keccak(
            "EIP712Domain(string name,string version,uint256 chainId)");

    private static final byte[] ORDER_TYPEHASH = keccak(
            "Order(uint256 salt,address maker,address signer,address taker,uint256 tokenId,uint256 makerAmount,uint256 takerAmount,uint256 expiration,uint256 nonce,uint256 feeRateBps,uint8 side,uint8 signatureType)");

    private static final byte[] CLOB_AUTH_TYPEHASH = keccak(
            "ClobAuth(address address,string timestamp,uint256 nonce,string message)");

    private final byte[] exchangeDomainSeparator;
    private final byte[] negRiskExchangeDomainSeparator;
    private final byte[] clobAuthDomainSeparator;

    @Autowired
    public OrderSigner(StopLossProperties properties) {
        this(properties.clob().chainId());
    }

    public OrderSigner(long chainId) {
        BigInteger chain = BigInteger.valueOf(chainId);
        this.exchangeDomainSeparator = buildExchangeDomainSeparator(chain, CTF_EXCHANGE);
        this.negRiskExchangeDomainSeparator = buildExchangeDomainSeparator(chain, NEG_RISK_CTF_EXCHANGE);
        this.clobAuthDomainSeparator = keccak(concat(
                CLOB_AUTH_DOMAIN_TYPEHASH,
                keccak("ClobAuthDomain"),
                keccak("1"),
                Numeric.toBytesPadded(chain, 32)));
    }

    @Data
    @Builder
    public static class Order {
        private BigInteger salt;
        private String maker;
        private String signer;
        private String taker;
        private BigInteger tokenId;
        private BigInteger makerAmount;
        private BigInteger takerAmount;
        private BigInteger expiration;
        private BigInteger nonce;
        private BigInteger feeRateBps;
        private int side; // 0 = BUY, 1 = SELL
        private int signatureType; // 0 = EOA, 1 = POLY_PROXY, 2 = POLY_GNOSIS_SAFE
    }

    public String signOrder(Order order, boolean negRisk, Credentials credentials) {
        return sign(orderDigest(order, negRisk), credentials);
    }

    public String signClobAuth(String address, long timestamp, long nonce, Credentials credentials) {
        return sign(clobAuthDigest(address, timestamp, nonce), credentials);
    }

    byte[] orderDigest(Order o, boolean negRisk) {
        byte[] hashStruct = keccak(concat(
                ORDER_TYPEHASH,
                Numeric.toBytesPadded(o.salt, 32),
                addressWord(o.maker),
                addressWord(o.signer),
                addressWord(o.taker),
                Numeric.toBytesPadded(o.tokenId, 32),
                Numeric.toBytesPadded(o.makerAmount, 32),
                Numeric.toBytesPadded(o.takerAmount, 32),
                Numeric.toBytesPadded(o.expiration, 32),
                Numeric.toBytesPadded(o.nonce, 32),
                Numeric.toBytesPadded(o.feeRateBps, 32),
                Numeric.toBytesPadded(BigInteger.valueOf(o.side), 32), // uint8 is expanded by abi.encode
                Numeric.toBytesPadded(BigInteger.valueOf(o.signatureType), 32)));
        return typedDataDigest(negRisk ? negRiskExchangeDomainSeparator : exchangeDomainSeparator, hashStruct);
    }

    byte[] clobAuthDigest(String address, long timestamp, long nonce) {
        byte[] hashStruct = keccak(concat(
                CLOB_AUTH_TYPEHASH,
                addressWord(address),
                keccak(Long.toString(timestamp)),
                Numeric.toBytesPadded(BigInteger.valueOf(nonce), 32),
                keccak(CLOB_AUTH_MESSAGE)));
        return typedDataDigest(clobAuthDomainSeparator, hashStruct);
    }

    private static String sign(byte[] digest, Credentials credentials) {
        Sign.SignatureData signatureData = Sign.signMessage(digest, credentials.getEcKeyPair(), false);

        // CLOB expects r ‖ s ‖ v (65 bytes) as hex, v being 27 or 28
        ByteBuffer sigBuffer = ByteBuffer.allocate(65);
        sigBuffer.put(signatureData.getR());
        sigBuffer.put(signatureData.getS());
        sigBuffer.put(signatureData.getV());
        return Numeric.toHexString(sigBuffer.array());
    }

    // keccak256("\x19\x01" ‖ domainSeparator ‖ hashStruct(message))
    private static byte[] typedDataDigest(byte[] domainSeparator, byte[] hashStruct) {
        ByteBuffer buffer = ByteBuffer.allocate(2 + 32 + 32);
        buffer.put((byte) 0x19);
        buffer.put((byte) 0x01);
        buffer.put(domainSeparator);
        buffer.put(hashStruct);
        return Hash.sha3(buffer.array());
    }

    private static byte[] buildExchangeDomainSeparator(BigInteger chainId, String exchange) {
        return keccak(concat(
                EIP712_DOMAIN_TYPEHASH,
                keccak("Polymarket CTF Exchange"),
                keccak("1"),
                Numeric.toBytesPadded(chainId, 32),
                addressWord(exchange)));
    }

    private static byte[] addressWord(String address) {
        return Numeric.toBytesPadded(Numeric.toBigInt(address), 32);
    }

    private static byte[] keccak(String value) {
        return Hash.sha3(value.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] keccak(byte[] value) {
        return Hash.sha3(value);
    }

    private static byte[] concat(byte[]... arrays) {
        int totalLength = Arrays.stream(arrays).mapToInt(a -> a.length).sum();
        ByteBuffer buffer = ByteBuffer.allocate(totalLength);
        for (byte[] array : arrays) {
            buffer.put(array);
        }
        return buffer.array();
    }
}
