package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.WorkDraftData;
import com.wpanther.greengoods.dto.ledger.SubmitApprovalRequest;
import com.wpanther.greengoods.dto.ledger.SubmitWorkRequest;
import com.wpanther.greengoods.dto.ledger.VerificationResult;
import com.wpanther.greengoods.entity.PendingWork;
import com.wpanther.greengoods.entity.Platform;
import com.wpanther.greengoods.exception.LedgerException;
import com.wpanther.greengoods.port.LedgerPort;
import com.wpanther.greengoods.port.StoragePort;
import com.wpanther.greengoods.testutil.TestMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RejectHandlerTest {

    private static final String WORK_ID = "abcd1234abcd1234";

    @Mock
    private StoragePort storage;

    @Mock
    private LedgerPort ledgerPort;

    @Mock
    private OperatorVerifier operatorVerifier;

    @Mock
    private BestEffortNotifier notifier;

    private RejectHandler rejectHandler;

    private BotUser operator;
    private PendingWork work;

    @BeforeEach
    void setUp() {
        rejectHandler = new RejectHandler(storage, ledgerPort, operatorVerifier, notifier, new PendingWorkLocks(8));
        operator = TestMessages.operator("99", TestMessages.GARDEN);
        work = PendingWork.builder()
                .id(WORK_ID)
                .gardenerAddress(TestMessages.GARDENER_ADDRESS)
                .gardenerPlatform(Platform.TELEGRAM)
                .gardenerPlatformId("7")
                .gardenAddress(TestMessages.GARDEN)
                .data(WorkDraftData.builder().title("Submission").plantSelection(List.of("trees")).build())
                .createdAt(Instant.parse("2024-01-15T10:00:00Z"))
                .build();
    }

    @Test
    void testHandle_RemovesAndNotifiesWithReason() {
        // Arrange
        when(storage.getPendingWork(WORK_ID)).thenReturn(Optional.of(work));
        when(operatorVerifier.verify(TestMessages.GARDEN, TestMessages.OPERATOR_ADDRESS))
                .thenReturn(VerificationResult.verified());

        // Act
        HandlerResult result = rejectHandler.handle(operator,
                TestMessages.commandContent("reject", WORK_ID, "Needs", "photos"));

        // Assert
        verify(storage).removePendingWork(WORK_ID);
        verify(notifier).send(eq(Platform.TELEGRAM), eq("7"), contains("Reason: Needs photos"));
        verify(ledgerPort, never()).submitApproval(any());
        assertThat(result.getResponse().getText())
                .isEqualTo("❌ Work " + WORK_ID + " rejected.\n\nReason: Needs photos");
    }

    @Test
    void testHandle_DefaultReason() {
        // Arrange
        when(storage.getPendingWork(WORK_ID)).thenReturn(Optional.of(work));
        when(operatorVerifier.verify(anyString(), anyString())).thenReturn(VerificationResult.verified());

        // Act
        HandlerResult result = rejectHandler.handle(operator, TestMessages.commandContent("reject", WORK_ID));

        // Assert
        assertThat(result.getResponse().getText()).endsWith("Reason: " + RejectHandler.DEFAULT_REASON);
    }

    @Test
    void testHandle_UnknownId() {
        // Arrange
        when(storage.getPendingWork("gone")).thenReturn(Optional.empty());

        // Act
        HandlerResult result = rejectHandler.handle(operator, TestMessages.commandContent("reject", "gone"));

        // Assert
        assertThat(result.getResponse().getText()).isEqualTo(ApproveHandler.NOT_FOUND);
        verify(storage, never()).removePendingWork(anyString());
    }

    @Test
    void testHandle_DeniedKeepsWork() {
        // Arrange
        when(storage.getPendingWork(WORK_ID)).thenReturn(Optional.of(work));
        when(operatorVerifier.verify(anyString(), anyString()))
                .thenReturn(VerificationResult.denied("Verification failed: timeout"));

        // Act
        HandlerResult result = rejectHandler.handle(operator, TestMessages.commandContent("reject", WORK_ID));

        // Assert
        assertThat(result.getResponse().getText()).contains("Only registered operators can reject work");
        verify(storage, never()).removePendingWork(anyString());
        verifyNoInteractions(notifier);
    }

    @Test
    void testHandle_NegativeAttestationWhenSupported() {
        // Arrange
        when(storage.getPendingWork(WORK_ID)).thenReturn(Optional.of(work));
        when(operatorVerifier.verify(anyString(), anyString())).thenReturn(VerificationResult.verified());
        when(ledgerPort.supportsApprovalAttestation()).thenReturn(true);

        // Act
        rejectHandler.handle(operator, TestMessages.commandContent("reject", WORK_ID, "blurry"));

        // Assert
        ArgumentCaptor<SubmitApprovalRequest> captor = ArgumentCaptor.forClass(SubmitApprovalRequest.class);
        verify(ledgerPort).submitApproval(captor.capture());
        assertThat(captor.getValue().isApproved()).isFalse();
        assertThat(captor.getValue().getFeedback()).isEqualTo("blurry");
        verify(storage).removePendingWork(WORK_ID);
    }

    @Test
    void testHandle_AttestationFailureKeepsWork() {
        // Arrange
        when(storage.getPendingWork(WORK_ID)).thenReturn(Optional.of(work));
        when(operatorVerifier.verify(anyString(), anyString())).thenReturn(VerificationResult.verified());
        when(ledgerPort.supportsApprovalAttestation()).thenReturn(true);
        when(ledgerPort.submitApproval(any(SubmitApprovalRequest.class))).thenThrow(new LedgerException("reverted"));

        // Act
        HandlerResult result = rejectHandler.handle(operator, TestMessages.commandContent("reject", WORK_ID));

        // Assert
        assertThat(result.getResponse().getText()).startsWith("❌ Error rejecting: reverted");
        verify(storage, never()).removePendingWork(anyString());
    }

    @Test
    void testReason_BlankExtraArgsUseDefault() {
        assertThat(RejectHandler.reason(List.of(WORK_ID, " "))).isEqualTo(RejectHandler.DEFAULT_REASON);
        assertThat(RejectHandler.reason(List.of(WORK_ID))).isEqualTo(RejectHandler.DEFAULT_REASON);
        assertThat(RejectHandler.reason(null)).isEqualTo(RejectHandler.DEFAULT_REASON);
    }

    @Test
    void testHandle_RejectWaitsForInFlightApproval() throws Exception {
        // Arrange
        PendingWorkLocks sharedLocks = new PendingWorkLocks(8);
        ApproveHandler approveHandler = new ApproveHandler(storage, ledgerPort, operatorVerifier, notifier, sharedLocks);
        RejectHandler racingReject = new RejectHandler(storage, ledgerPort, operatorVerifier, notifier, sharedLocks);
        Map<String, PendingWork> queue = new ConcurrentHashMap<>(Map.of(WORK_ID, work));
        when(storage.getPendingWork(WORK_ID)).thenAnswer(invocation -> Optional.ofNullable(queue.get(WORK_ID)));
        when(storage.removePendingWork(WORK_ID)).thenAnswer(invocation -> queue.remove(WORK_ID) != null);
        when(operatorVerifier.verify(anyString(), anyString())).thenReturn(VerificationResult.verified());
        CountDownLatch ledgerEntered = new CountDownLatch(1);
        when(ledgerPort.submitWork(any(SubmitWorkRequest.class))).thenAnswer(invocation -> {
            ledgerEntered.countDown();
            Thread.sleep(200);
            return "0xfeed";
        });
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            // Act
            Future<HandlerResult> approval = executor.submit(
                    () -> approveHandler.handle(operator, TestMessages.commandContent("approve", WORK_ID)));
            assertThat(ledgerEntered.await(5, TimeUnit.SECONDS)).isTrue();
            Future<HandlerResult> rejection = executor.submit(
                    () -> racingReject.handle(operator, TestMessages.commandContent("reject", WORK_ID, "late")));

            // Assert
            assertThat(approval.get(5, TimeUnit.SECONDS).getResponse().getText())
                    .contains("✅ *Work approved and attested!*");
            assertThat(rejection.get(5, TimeUnit.SECONDS).getResponse().getText())
                    .isEqualTo(ApproveHandler.NOT_FOUND);
            verify(notifier, never()).send(any(), anyString(), contains("rejected"));
        } finally {
            executor.shutdownNow();
        }
    }
}
