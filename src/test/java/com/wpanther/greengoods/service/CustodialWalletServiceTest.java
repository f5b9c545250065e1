package com.wpanther.greengoods.service;

import com.wpanther.greengoods.exception.InvalidKeyMaterialException;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CustodialWalletServiceTest {

    private final CustodialWalletService walletService = new CustodialWalletService(new SecureRandom());

    @Test
    void testDeriveAddress_KnownVector() {
        // Arrange
        String privateKey = "0x0000000000000000000000000000000000000000000000000000000000000001";

        // Act
        String address = walletService.deriveAddress(privateKey);

        // Assert
        assertThat(address).isEqualTo("0x7E5F4552091A69125d5DfCb7b8C2659029395Bdf");
    }

    @Test
    void testGeneratePrivateKey_FormatAndDerivation() {
        // Act
        String privateKey = walletService.generatePrivateKey();
        String address = walletService.deriveAddress(privateKey);

        // Assert
        assertThat(privateKey).matches("^0x[0-9a-f]{64}$");
        assertThat(walletService.isValidAddress(address)).isTrue();
        assertThat(walletService.deriveAddress(privateKey)).isEqualTo(address);
    }

    @Test
    void testGeneratePrivateKey_Unique() {
        // Act
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < 20; i++) {
            keys.add(walletService.generatePrivateKey());
        }

        // Assert
        assertThat(keys).hasSize(20);
    }

    @Test
    void testDeriveAddress_RejectsMalformedOrOutOfRangeKeys() {
        // Act & Assert
        assertThatThrownBy(() -> walletService.deriveAddress("0x1234"))
                .isInstanceOf(InvalidKeyMaterialException.class);
        assertThatThrownBy(() -> walletService.deriveAddress(
                "0x0000000000000000000000000000000000000000000000000000000000000000"))
                .isInstanceOf(InvalidKeyMaterialException.class);
        assertThatThrownBy(() -> walletService.deriveAddress(
                "0xffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff"))
                .isInstanceOf(InvalidKeyMaterialException.class);
    }

    @Test
    void testToChecksumAddress_Eip55Vectors() {
        // Assert
        assertThat(walletService.toChecksumAddress("0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed"))
                .isEqualTo("0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed");
        assertThat(walletService.toChecksumAddress("0xFB6916095CA1DF60BB79CE92CE3EA74C37C5D359"))
                .isEqualTo("0xfB6916095ca1df60bB79Ce92cE3Ea74c37c5d359");
    }

    @Test
    void testIsValidAddress() {
        // Assert
        assertThat(walletService.isValidAddress("0x" + "a".repeat(40))).isTrue();
        assertThat(walletService.isValidAddress("0x" + "a".repeat(39))).isFalse();
        assertThat(walletService.isValidAddress("0x" + "g".repeat(40))).isFalse();
        assertThat(walletService.isValidAddress("a".repeat(42))).isFalse();
        assertThat(walletService.isValidAddress(null)).isFalse();
    }

    @Test
    void testGenerateSecureId_SixteenHexCharacters() {
        // Act
        String first = walletService.generateSecureId();
        String second = walletService.generateSecureId();

        // Assert
        assertThat(first).matches("^[0-9a-f]{16}$");
        assertThat(first).isNotEqualTo(second);
    }
}
