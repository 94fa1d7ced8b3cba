package org.abstractica.chat.crypto;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.util.Arrays;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the crypto layer components.
 */
class CryptoTest
{
    private static final HexFormat HEX = HexFormat.of();
    private static final SecureRandom RANDOM = new SecureRandom();

    // ========== HKDF ==========

    @Test
    void hkdf_rfc5869TestCase1()
    {
        byte[] ikm = new byte[22];
        Arrays.fill(ikm, (byte) 0x0b);
        byte[] salt = HEX.parseHex("000102030405060708090a0b0c");
        byte[] info = HEX.parseHex("f0f1f2f3f4f5f6f7f8f9");

        byte[] okm = Hkdf.derive(ikm, salt, info, 42);

        assertEquals("3cb25f25faacd57a90434f64d0362f2a2d2d0a90cf1a5a4c5db02d56ecc4c5bf34007208d5b887185865",
                HEX.formatHex(okm));
    }

    @Test
    void hkdf_rfc5869TestCase3_emptySaltAndInfo()
    {
        byte[] ikm = new byte[22];
        Arrays.fill(ikm, (byte) 0x0b);

        byte[] okm = Hkdf.derive(ikm, new byte[0], new byte[0], 42);

        assertEquals("8da4e775a563c18f715f802a063c5a31b8a11f5c5ee1879ec3454e5f3c738d2d9d201395faa4b61a96c8",
                HEX.formatHex(okm));
    }

    @Test
    void hkdf_sessionKeyUsesEmptySaltAndInfo()
    {
        byte[] secret = "shared-secret".getBytes(StandardCharsets.UTF_8);

        assertArrayEquals(Hkdf.derive(secret, null, new byte[0], 32), Hkdf.deriveSessionKey(secret));
        assertEquals(32, Hkdf.deriveSessionKey(secret).length);
    }

    @Test
    void hkdf_invalidOutputLength_throws()
    {
        byte[] secret = new byte[32];

        assertThrows(IllegalArgumentException.class, () -> Hkdf.derive(secret, null, new byte[0], 0));
        assertThrows(IllegalArgumentException.class, () -> Hkdf.derive(secret, null, new byte[0], 255 * 32 + 1));
    }

    // ========== EcdhKeyExchange ==========

    @Test
    void keyExchange_publicKeyIsCompressed()
    {
        byte[] publicKey = new EcdhKeyExchange().getPublicKey();

        assertEquals(33, publicKey.length);
        assertTrue(publicKey[0] == 0x02 || publicKey[0] == 0x03);
    }

    @Test
    void keyExchange_generatesDifferentKeyPairs()
    {
        assertFalse(Arrays.equals(new EcdhKeyExchange().getPublicKey(), new EcdhKeyExchange().getPublicKey()));
    }

    @Test
    void keyExchange_bothSidesComputeSameSecret() throws CryptoException
    {
        EcdhKeyExchange client = new EcdhKeyExchange();
        EcdhKeyExchange server = new EcdhKeyExchange();

        byte[] clientSecret = client.computeSharedSecret(server.getPublicKey());
        byte[] serverSecret = server.computeSharedSecret(client.getPublicKey());

        assertArrayEquals(clientSecret, serverSecret);
        assertEquals(32, clientSecret.length);
    }

    @Test
    void keyExchange_bothSidesDeriveSameSessionKey() throws CryptoException
    {
        EcdhKeyExchange client = new EcdhKeyExchange();
        EcdhKeyExchange server = new EcdhKeyExchange();

        assertArrayEquals(
                client.deriveSessionKey(server.getPublicKey()),
                server.deriveSessionKey(client.getPublicKey()));
    }

    @Test
    void keyExchange_compressionRoundTrips() throws Exception
    {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp256r1"));

        for (int i = 0; i < 20; i++)
        {
            ECPublicKey key = (ECPublicKey) generator.generateKeyPair().getPublic();
            ECPoint restored = EcdhKeyExchange.decompress(EcdhKeyExchange.compress(key.getW()), key.getParams());
            assertEquals(key.getW(), restored);
        }
    }

    @Test
    void keyExchange_invalidPublicKeyLength_throws()
    {
        EcdhKeyExchange kx = new EcdhKeyExchange();

        assertThrows(CryptoException.class, () -> kx.computeSharedSecret(new byte[32]));
        assertThrows(CryptoException.class, () -> kx.computeSharedSecret(new byte[65]));
    }

    @Test
    void keyExchange_uncompressedPrefix_throws()
    {
        EcdhKeyExchange kx = new EcdhKeyExchange();
        byte[] key = new EcdhKeyExchange().getPublicKey();
        key[0] = 0x04;

        assertThrows(CryptoException.class, () -> kx.computeSharedSecret(key));
    }

    @Test
    void keyExchange_pointNotOnCurve_throws() throws Exception
    {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp256r1"));
        ECParameterSpec params = ((ECPublicKey) generator.generateKeyPair().getPublic()).getParams();

        // Roughly half of all x coordinates have no point on the curve
        int rejected = 0;
        for (int x = 1; x <= 64; x++)
        {
            byte[] encoded = new byte[33];
            encoded[0] = 0x02;
            byte[] xBytes = BigInteger.valueOf(x).toByteArray();
            System.arraycopy(xBytes, 0, encoded, 33 - xBytes.length, xBytes.length);
            try
            {
                EcdhKeyExchange.decompress(encoded, params);
            }
            catch (CryptoException e)
            {
                rejected++;
            }
        }
        assertTrue(rejected > 0, "Expected some x coordinates to be rejected");
    }

    // ========== FrameCipher ==========

    @Test
    void frameCipher_sealOpenRoundTrip() throws CryptoException
    {
        FrameCipher cipher = new FrameCipher(randomKey());
        byte[] frame = {0, 2, 0, 'h', 'i'};

        FrameCipher.Sealed sealed = cipher.seal(frame);

        assertEquals(12, sealed.nonce().length);
        assertEquals(frame.length + 16, sealed.ciphertext().length);
        assertArrayEquals(frame, cipher.open(sealed.nonce(), sealed.ciphertext()));
    }

    @Test
    void frameCipher_freshNoncePerFrame()
    {
        FrameCipher cipher = new FrameCipher(randomKey());
        byte[] frame = {0, 0, 0};

        FrameCipher.Sealed first = cipher.seal(frame);
        FrameCipher.Sealed second = cipher.seal(frame);

        assertFalse(Arrays.equals(first.nonce(), second.nonce()));
        assertFalse(Arrays.equals(first.ciphertext(), second.ciphertext()));
    }

    @Test
    void frameCipher_tamperedCiphertext_throws()
    {
        FrameCipher cipher = new FrameCipher(randomKey());
        FrameCipher.Sealed sealed = cipher.seal(new byte[]{0, 2, 0, 'h', 'i'});
        sealed.ciphertext()[0] ^= 0x01;

        assertThrows(CryptoException.class, () -> cipher.open(sealed.nonce(), sealed.ciphertext()));
    }

    @Test
    void frameCipher_wrongKey_throws()
    {
        FrameCipher.Sealed sealed = new FrameCipher(randomKey()).seal(new byte[]{0, 0, 0});
        FrameCipher other = new FrameCipher(randomKey());

        assertThrows(CryptoException.class, () -> other.open(sealed.nonce(), sealed.ciphertext()));
    }

    @Test
    void frameCipher_shortCiphertext_throws()
    {
        FrameCipher cipher = new FrameCipher(randomKey());

        assertThrows(CryptoException.class, () -> cipher.open(new byte[12], new byte[15]));
    }

    @Test
    void frameCipher_wrongKeyLength_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> new FrameCipher(new byte[16]));
    }

    private static byte[] randomKey()
    {
        byte[] key = new byte[32];
        RANDOM.nextBytes(key);
        return key;
    }
}
