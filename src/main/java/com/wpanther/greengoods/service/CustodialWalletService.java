package com.wpanther.greengoods.service;

import com.wpanther.greengoods.exception.InvalidKeyMaterialException;
import lombok.RequiredArgsConstructor;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Generates custodial secp256k1 keys and derives their checksummed ledger addresses.
 */
@Service
@RequiredArgsConstructor
public class CustodialWalletService {

    private static final X9ECParameters CURVE = CustomNamedCurves.getByName("secp256k1");
    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern PRIVATE_KEY = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private final SecureRandom secureRandom;

    /**
     * @return 0x-prefixed 32-byte hex key in [1, n-1]
     */
    public String generatePrivateKey() {
        BigInteger n = CURVE.getN();
        BigInteger d;
        do {
            d = new BigInteger(256, secureRandom);
        } while (d.signum() == 0 || d.compareTo(n) >= 0);
        return "0x" + toHex32(d);
    }

    public String deriveAddress(String privateKey) {
        if (!isValidPrivateKey(privateKey)) {
            throw new InvalidKeyMaterialException("Invalid private key format");
        }
        BigInteger d = new BigInteger(privateKey.substring(2), 16);
        if (d.signum() == 0 || d.compareTo(CURVE.getN()) >= 0) {
            throw new InvalidKeyMaterialException("Private key is outside the curve order");
        }

        ECPoint publicPoint = new FixedPointCombMultiplier().multiply(CURVE.getG(), d).normalize();
        byte[] uncompressed = publicPoint.getEncoded(false);
        // Drop the 0x04 prefix, hash X||Y, keep the last 20 bytes
        byte[] hash = keccak256(Arrays.copyOfRange(uncompressed, 1, uncompressed.length));
        String lower = Hex.toHexString(Arrays.copyOfRange(hash, hash.length - 20, hash.length));
        return toChecksumAddress("0x" + lower);
    }

    /**
     * Mixed-case checksum encoding (EIP-55).
     */
    public String toChecksumAddress(String address) {
        if (!isValidAddress(address)) {
            throw new InvalidKeyMaterialException("Invalid address format");
        }
        String lower = address.substring(2).toLowerCase(Locale.ROOT);
        String hashHex = Hex.toHexString(keccak256(lower.getBytes(StandardCharsets.US_ASCII)));

        StringBuilder checksummed = new StringBuilder("0x");
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isLetter(c) && Character.digit(hashHex.charAt(i), 16) >= 8) {
                checksummed.append(Character.toUpperCase(c));
            } else {
                checksummed.append(c);
            }
        }
        return checksummed.toString();
    }

    public boolean isValidAddress(String address) {
        return address != null && ADDRESS.matcher(address).matches();
    }

    public boolean isValidPrivateKey(String privateKey) {
        return privateKey != null && PRIVATE_KEY.matcher(privateKey).matches();
    }

    /**
     * 8 random bytes as 16 hex characters.
     */
    public String generateSecureId() {
        byte[] bytes = new byte[8];
        secureRandom.nextBytes(bytes);
        return Hex.toHexString(bytes);
    }

    private static byte[] keccak256(byte[] input) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        return digest.digest(input);
    }

    private static String toHex32(BigInteger value) {
        String hex = value.toString(16);
        StringBuilder padded = new StringBuilder();
        for (int i = hex.length(); i < 64; i++) {
            padded.append('0');
        }
        return padded.append(hex).toString();
    }
}
