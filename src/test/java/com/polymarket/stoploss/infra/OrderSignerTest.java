package com.polymarket.stoploss.infra;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;

class OrderSignerTest {

    private final OrderSigner signer = new OrderSigner(137L);

    @Test
    void testSignOrderRecoversSigner() throws Exception {
        ECKeyPair keyPair = Keys.createEcKeyPair();
        Credentials credentials = Credentials.create(keyPair);
        OrderSigner.Order order = sellOrder(credentials.getAddress());

        String signature = signer.signOrder(order, false, credentials);

        Assertions.assertTrue(signature.startsWith("0x"));
        Assertions.assertEquals(132, signature.length()); // 65 bytes = 130 hex chars + 0x

        BigInteger recovered = Sign.signedMessageHashToKey(signer.orderDigest(order, false), toSignatureData(signature));
        Assertions.assertEquals(keyPair.getPublicKey(), recovered);
    }

    @Test
    void testNegRiskOrdersUseTheirOwnExchangeDomain() throws Exception {
        Credentials credentials = Credentials.create(Keys.createEcKeyPair());
        OrderSigner.Order order = sellOrder(credentials.getAddress());

        Assertions.assertFalse(Arrays.equals(signer.orderDigest(order, false), signer.orderDigest(order, true)));
        Assertions.assertNotEquals(signer.signOrder(order, false, credentials),
                signer.signOrder(order, true, credentials));
    }

    @Test
    void testDigestDependsOnChain() throws Exception {
        Credentials credentials = Credentials.create(Keys.createEcKeyPair());
        OrderSigner.Order order = sellOrder(credentials.getAddress());

        Assertions.assertFalse(Arrays.equals(signer.orderDigest(order, false),
                new OrderSigner(80002L).orderDigest(order, false)));
    }

    @Test
    void testClobAuthSignatureRecoversSigner() throws Exception {
        ECKeyPair keyPair = Keys.createEcKeyPair();
        Credentials credentials = Credentials.create(keyPair);

        String signature = signer.signClobAuth(credentials.getAddress(), 1_735_000_000L, 0, credentials);

        BigInteger recovered = Sign.signedMessageHashToKey(
                signer.clobAuthDigest(credentials.getAddress(), 1_735_000_000L, 0), toSignatureData(signature));
        Assertions.assertEquals(keyPair.getPublicKey(), recovered);
    }

    private static OrderSigner.Order sellOrder(String maker) {
        return OrderSigner.Order.builder()
                .salt(BigInteger.valueOf(123456789L))
                .maker(maker)
                .signer(maker)
                .taker("0x0000000000000000000000000000000000000000")
                .tokenId(new BigInteger("71321045679252212594626385532706912750332728571942532289631379312455583992563"))
                .makerAmount(BigInteger.valueOf(50_000_000L)) // 50 tokens
                .takerAmount(BigInteger.valueOf(19_000_000L)) // 19 USDC
                .expiration(BigInteger.ZERO)
                .nonce(BigInteger.ZERO)
                .feeRateBps(BigInteger.ZERO)
                .side(1)
                .signatureType(1)
                .build();
    }

    private static Sign.SignatureData toSignatureData(String signature) {
        byte[] bytes = Numeric.hexStringToByteArray(signature);
        return new Sign.SignatureData(bytes[64],
                Arrays.copyOfRange(bytes, 0, 32),
                Arrays.copyOfRange(bytes, 32, 64));
    }
}
