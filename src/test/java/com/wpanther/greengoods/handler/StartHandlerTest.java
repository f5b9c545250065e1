package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.CreateUserRequest;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.message.ParseMode;
import com.wpanther.greengoods.entity.Platform;
import com.wpanther.greengoods.port.StoragePort;
import com.wpanther.greengoods.service.CustodialWalletService;
import com.wpanther.greengoods.testutil.TestMessages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StartHandlerTest {

    private static final String KEY = "0x0000000000000000000000000000000000000000000000000000000000000001";

    @Mock
    private StoragePort storage;

    @Mock
    private CustodialWalletService walletService;

    @InjectMocks
    private StartHandler startHandler;

    @Test
    void testHandle_NewUserGetsWallet() {
        // Arrange
        when(walletService.generatePrivateKey()).thenReturn(KEY);
        when(walletService.deriveAddress(KEY)).thenReturn(TestMessages.GARDENER_ADDRESS);
        when(storage.createUser(any(CreateUserRequest.class)))
                .thenAnswer(invocation -> TestMessages.gardener("7", null));

        // Act
        HandlerResult result = startHandler.handle(TestMessages.command("7", "start"), null);

        // Assert
        ArgumentCaptor<CreateUserRequest> captor = ArgumentCaptor.forClass(CreateUserRequest.class);
        verify(storage).createUser(captor.capture());
        assertThat(captor.getValue().getPlatform()).isEqualTo(Platform.TELEGRAM);
        assertThat(captor.getValue().getPlatformId()).isEqualTo("7");
        assertThat(captor.getValue().getPrivateKey()).isEqualTo(KEY);
        assertThat(captor.getValue().getAddress()).isEqualTo(TestMessages.GARDENER_ADDRESS);

        assertThat(result.getResponse().getText())
                .startsWith("🌿 *Welcome to Green Goods!*")
                .contains(TestMessages.GARDENER_ADDRESS);
        assertThat(result.getResponse().getParseMode()).isEqualTo(ParseMode.MARKDOWN);
        assertThat(result.getSessionUpdate()).isNull();
        assertThat(result.isClearSession()).isFalse();
    }

    @Test
    void testHandle_ExistingUserWelcomedBack() {
        // Arrange
        BotUser existing = TestMessages.gardener("7", TestMessages.GARDEN);

        // Act
        HandlerResult result = startHandler.handle(TestMessages.command("7", "start"), existing);

        // Assert
        assertThat(result.getResponse().getText())
                .startsWith("🌿 *Welcome back!*")
                .contains("Wallet: `0x7E5F...5Bdf`")
                .contains("Garden: `0xAAAA...aaaa`");
        verifyNoInteractions(storage, walletService);
    }

    @Test
    void testHandle_ExistingUserWithoutGarden() {
        // Act
        HandlerResult result = startHandler.handle(TestMessages.command("7", "start"), TestMessages.gardener("7", null));

        // Assert
        assertThat(result.getResponse().getText()).contains("Garden: _Not joined_");
    }

    @Test
    void testHandle_StorageFailureReported() {
        // Arrange
        when(walletService.generatePrivateKey()).thenReturn(KEY);
        when(walletService.deriveAddress(KEY)).thenReturn(TestMessages.GARDENER_ADDRESS);
        when(storage.createUser(any(CreateUserRequest.class))).thenThrow(new IllegalStateException("database locked"));

        // Act
        HandlerResult result = startHandler.handle(TestMessages.command("7", "start"), null);

        // Assert
        assertThat(result.getResponse().getText())
                .contains("couldn't create your wallet")
                .contains("Error: database locked");
    }
}
