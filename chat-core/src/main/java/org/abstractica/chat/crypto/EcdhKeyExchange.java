package org.abstractica.chat.crypto;

import javax.crypto.KeyAgreement;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECFieldFp;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.security.spec.EllipticCurve;
import java.util.Arrays;
import java.util.Objects;

/**
 * Ephemeral P-256 Elliptic Curve Diffie-Hellman key exchange.
 *
 * <p>Public keys travel in SEC1 compressed form: a prefix byte (0x02 for an
 * even y coordinate, 0x03 for an odd one) followed by the 32-byte big-endian x
 * coordinate.</p>
 */
public final class EcdhKeyExchange
{
    private static final String CURVE = "secp256r1";
    private static final int COORDINATE_LENGTH = 32;

    /**
     * Length of a compressed public key on the wire.
     */
    public static final int PUBLIC_KEY_LENGTH = 1 + COORDINATE_LENGTH;

    private static final byte EVEN_PREFIX = 0x02;
    private static final byte ODD_PREFIX = 0x03;

    private final KeyPair keyPair;
    private final ECParameterSpec params;

    /**
     * Creates a new key exchange with a freshly generated ephemeral key pair.
     */
    public EcdhKeyExchange()
    {
        try
        {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec(CURVE));
            this.keyPair = generator.generateKeyPair();
            this.params = ((ECPublicKey) keyPair.getPublic()).getParams();
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException("Failed to generate " + CURVE + " key pair", e);
        }
    }

    /**
     * Returns the compressed public key.
     *
     * @return public key bytes ({@value #PUBLIC_KEY_LENGTH} bytes)
     */
    public byte[] getPublicKey()
    {
        return compress(((ECPublicKey) keyPair.getPublic()).getW());
    }

    /**
     * Computes the raw ECDH shared secret with the peer's compressed public key.
     *
     * @param peerPublicKey the peer's compressed public key
     * @return the shared secret (the x coordinate of the shared point, 32 bytes)
     * @throws CryptoException if the key is malformed or not a point on the curve
     */
    public byte[] computeSharedSecret(byte[] peerPublicKey) throws CryptoException
    {
        Objects.requireNonNull(peerPublicKey, "peerPublicKey");
        ECPoint point = decompress(peerPublicKey, params);

        try
        {
            KeyFactory keyFactory = KeyFactory.getInstance("EC");
            PublicKey publicKey = keyFactory.generatePublic(new ECPublicKeySpec(point, params));

            KeyAgreement keyAgreement = KeyAgreement.getInstance("ECDH");
            keyAgreement.init(keyPair.getPrivate());
            keyAgreement.doPhase(publicKey, true);
            return keyAgreement.generateSecret();
        }
        catch (GeneralSecurityException e)
        {
            throw new CryptoException("Key agreement failed", e);
        }
    }

    /**
     * Runs the agreement and derives the 256-bit session key from it.
     *
     * @param peerPublicKey the peer's compressed public key
     * @return the session key
     * @throws CryptoException if the key is malformed or agreement fails
     */
    public byte[] deriveSessionKey(byte[] peerPublicKey) throws CryptoException
    {
        return Hkdf.deriveSessionKey(computeSharedSecret(peerPublicKey));
    }

    // ========== Point Compression ==========

    static byte[] compress(ECPoint point)
    {
        byte[] encoded = new byte[PUBLIC_KEY_LENGTH];
        encoded[0] = point.getAffineY().testBit(0) ? ODD_PREFIX : EVEN_PREFIX;

        byte[] x = point.getAffineX().toByteArray();
        // toByteArray may carry a leading sign byte or be shorter than 32 bytes
        int copy = Math.min(x.length, COORDINATE_LENGTH);
        System.arraycopy(x, x.length - copy, encoded, PUBLIC_KEY_LENGTH - copy, copy);
        return encoded;
    }

    static ECPoint decompress(byte[] encoded, ECParameterSpec params) throws CryptoException
    {
        if (encoded.length != PUBLIC_KEY_LENGTH)
        {
            throw new CryptoException("Public key must be " + PUBLIC_KEY_LENGTH + " bytes: " + encoded.length);
        }
        byte prefix = encoded[0];
        if (prefix != EVEN_PREFIX && prefix != ODD_PREFIX)
        {
            throw new CryptoException("Not a compressed point, prefix 0x" + Integer.toHexString(prefix & 0xFF));
        }

        EllipticCurve curve = params.getCurve();
        BigInteger p = ((ECFieldFp) curve.getField()).getP();
        BigInteger x = new BigInteger(1, Arrays.copyOfRange(encoded, 1, PUBLIC_KEY_LENGTH));
        if (x.compareTo(p) >= 0)
        {
            throw new CryptoException("Point x coordinate out of range");
        }

        // y^2 = x^3 + ax + b (mod p); p = 3 (mod 4) so sqrt(r) = r^((p+1)/4)
        BigInteger rhs = x.pow(3).add(curve.getA().multiply(x)).add(curve.getB()).mod(p);
        BigInteger y = rhs.modPow(p.add(BigInteger.ONE).shiftRight(2), p);
        if (!y.multiply(y).mod(p).equals(rhs))
        {
            throw new CryptoException("Point is not on the curve");
        }

        boolean wantOdd = prefix == ODD_PREFIX;
        if (y.testBit(0) != wantOdd)
        {
            if (y.signum() == 0)
            {
                throw new CryptoException("Point has no root with the requested parity");
            }
            y = p.subtract(y);
        }
        return new ECPoint(x, y);
    }
}
