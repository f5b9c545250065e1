package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.WorkDraftData;
import com.wpanther.greengoods.dto.ai.ParsedTask;
import com.wpanther.greengoods.dto.ai.ParsedWorkData;
import com.wpanther.greengoods.dto.ai.TaskType;
import com.wpanther.greengoods.dto.message.ResponseButton;
import com.wpanther.greengoods.dto.message.VoiceContent;
import com.wpanther.greengoods.entity.ConversationSession;
import com.wpanther.greengoods.entity.PendingWork;
import com.wpanther.greengoods.entity.Platform;
import com.wpanther.greengoods.entity.SessionStep;
import com.wpanther.greengoods.entity.UserKey;
import com.wpanther.greengoods.exception.TranscriptionException;
import com.wpanther.greengoods.port.AiPort;
import com.wpanther.greengoods.port.StoragePort;
import com.wpanther.greengoods.port.VoiceProcessor;
import com.wpanther.greengoods.service.CustodialWalletService;
import com.wpanther.greengoods.testutil.TestMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubmissionHandlerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private StoragePort storage;

    @Mock
    private AiPort aiPort;

    @Mock
    private VoiceProcessor voiceProcessor;

    @Mock
    private CustodialWalletService walletService;

    @Mock
    private BestEffortNotifier notifier;

    private SubmissionHandler submissionHandler;
    private BotUser gardener;

    @BeforeEach
    void setUp() {
        submissionHandler = new SubmissionHandler(storage, aiPort, Optional.of(voiceProcessor), walletService,
                notifier, Clock.fixed(NOW, ZoneOffset.UTC));
        gardener = TestMessages.gardener("7", TestMessages.GARDEN);
    }

    private ParsedWorkData plantedTrees() {
        return ParsedWorkData.builder()
                .tasks(List.of(ParsedTask.builder().type(TaskType.PLANTING).species("trees").count(5).build()))
                .notes("I planted 5 trees today")
                .date("2024-01-15")
                .build();
    }

    private ConversationSession confirmingSession(ParsedWorkData draft) {
        return ConversationSession.builder()
                .platform(Platform.TELEGRAM)
                .platformId("7")
                .step(SessionStep.CONFIRMING_WORK)
                .draft(draft)
                .updatedAt(NOW)
                .build();
    }

    @Test
    void testHandleText_ParsedTasksAskForConfirmation() {
        // Arrange
        when(aiPort.parseWorkText("I planted 5 trees today", "en")).thenReturn(plantedTrees());

        // Act
        HandlerResult result = submissionHandler.handleText(
                TestMessages.text("7", "I planted 5 trees today"), gardener, "I planted 5 trees today");

        // Assert
        assertThat(result.getResponse().getText())
                .contains("📋 *Confirm your submission:*")
                .contains("• planting: 5 trees")
                .contains("*Date:* 2024-01-15");
        assertThat(result.getResponse().getButtons())
                .extracting(ResponseButton::getCallbackData)
                .containsExactly("confirm_submission", "cancel_submission");
        assertThat(result.getSessionUpdate().getStep()).isEqualTo(SessionStep.CONFIRMING_WORK);
        assertThat(result.getSessionUpdate().getDraft()).isEqualTo(plantedTrees());
        assertThat(result.isClearSession()).isFalse();
    }

    @Test
    void testHandleText_NoTasksLeavesSessionAlone() {
        // Arrange
        when(aiPort.parseWorkText(anyString(), any())).thenReturn(ParsedWorkData.builder().notes("hello").build());

        // Act
        HandlerResult result = submissionHandler.handleText(TestMessages.text("7", "hello"), gardener, "hello");

        // Assert
        assertThat(result.getResponse().getText()).startsWith("🤔 I couldn't identify any work tasks");
        assertThat(result.getSessionUpdate()).isNull();
        assertThat(result.isClearSession()).isFalse();
    }

    @Test
    void testHandleVoice_TranscribesThenParses() {
        // Arrange
        when(voiceProcessor.downloadAndTranscribe("file-1", "audio/ogg")).thenReturn("I planted 5 trees today");
        when(aiPort.parseWorkText("I planted 5 trees today", "en")).thenReturn(plantedTrees());

        // Act
        HandlerResult result = submissionHandler.handleVoice(TestMessages.voice("7", "file-1"), gardener,
                new VoiceContent("file-1", "audio/ogg", 4));

        // Assert
        assertThat(result.getSessionUpdate().getStep()).isEqualTo(SessionStep.CONFIRMING_WORK);
    }

    @Test
    void testHandleVoice_TranscriptionFailure() {
        // Arrange
        when(voiceProcessor.downloadAndTranscribe(anyString(), anyString()))
                .thenThrow(new TranscriptionException("whisper offline"));

        // Act
        HandlerResult result = submissionHandler.handleVoice(TestMessages.voice("7", "file-1"), gardener,
                new VoiceContent("file-1", "audio/ogg", 4));

        // Assert
        assertThat(result.getResponse().getText())
                .startsWith("❌ Sorry, I couldn't process that audio.")
                .contains("whisper offline");
        assertThat(result.getSessionUpdate()).isNull();
        verifyNoInteractions(aiPort);
    }

    @Test
    void testHandleVoice_NoProcessorConfigured() {
        // Arrange
        SubmissionHandler textOnly = new SubmissionHandler(storage, aiPort, Optional.empty(), walletService,
                notifier, Clock.fixed(NOW, ZoneOffset.UTC));

        // Act
        HandlerResult result = textOnly.handleVoice(TestMessages.voice("7", "file-1"), gardener,
                new VoiceContent("file-1", "audio/ogg", 4));

        // Assert
        assertThat(result.getResponse().getText()).contains("Voice processing is not available");
    }

    @Test
    void testConfirm_CreatesPendingWorkAndNotifiesOperator() {
        // Arrange
        when(walletService.generateSecureId()).thenReturn("abcd1234abcd1234");
        when(storage.pendingWorkExists("abcd1234abcd1234")).thenReturn(false);
        when(storage.getOperatorForGarden(TestMessages.GARDEN))
                .thenReturn(Optional.of(new UserKey(Platform.TELEGRAM, "99")));

        // Act
        HandlerResult result = submissionHandler.confirm(TestMessages.callback("7", "confirm_submission"),
                gardener, confirmingSession(plantedTrees()));

        // Assert
        ArgumentCaptor<PendingWork> captor = ArgumentCaptor.forClass(PendingWork.class);
        verify(storage).addPendingWork(captor.capture());
        PendingWork saved = captor.getValue();
        assertThat(saved.getId()).isEqualTo("abcd1234abcd1234");
        assertThat(saved.getGardenAddress()).isEqualTo(TestMessages.GARDEN);
        assertThat(saved.getGardenerAddress()).isEqualTo(TestMessages.GARDENER_ADDRESS);
        assertThat(saved.getGardenerPlatformId()).isEqualTo("7");
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
        assertThat(saved.getData().getPlantSelection()).containsExactly("trees");
        assertThat(saved.getData().getPlantCount()).isEqualTo(5);

        verify(notifier).send(eq(Platform.TELEGRAM), eq("99"), contains("/approve abcd1234abcd1234"));
        assertThat(result.isClearSession()).isTrue();
        assertThat(result.getResponse().getText()).contains("✅ *Work submitted for approval!*");
    }

    @Test
    void testConfirm_RegeneratesCollidingId() {
        // Arrange
        when(walletService.generateSecureId()).thenReturn("taken", "fresh");
        when(storage.pendingWorkExists("taken")).thenReturn(true);
        when(storage.pendingWorkExists("fresh")).thenReturn(false);
        when(storage.getOperatorForGarden(anyString())).thenReturn(Optional.empty());

        // Act
        submissionHandler.confirm(TestMessages.callback("7", "confirm_submission"),
                gardener, confirmingSession(plantedTrees()));

        // Assert
        ArgumentCaptor<PendingWork> captor = ArgumentCaptor.forClass(PendingWork.class);
        verify(storage).addPendingWork(captor.capture());
        assertThat(captor.getValue().getId()).isEqualTo("fresh");
        verifyNoInteractions(notifier);
    }

    @Test
    void testConfirm_GivesUpAfterRepeatedCollisions() {
        // Arrange
        when(walletService.generateSecureId()).thenReturn("taken");
        when(storage.pendingWorkExists("taken")).thenReturn(true);

        // Act & Assert
        assertThatThrownBy(() -> submissionHandler.confirm(TestMessages.callback("7", "confirm_submission"),
                gardener, confirmingSession(plantedTrees())))
                .isInstanceOf(IllegalStateException.class);
        verify(storage, times(5)).pendingWorkExists("taken");
        verify(storage, never()).addPendingWork(any());
    }

    @Test
    void testConfirm_EmptyDraftExpires() {
        // Act
        HandlerResult result = submissionHandler.confirm(TestMessages.callback("7", "confirm_submission"),
                gardener, confirmingSession(ParsedWorkData.builder().build()));

        // Assert
        assertThat(result.getResponse().getText()).startsWith("Session expired");
        assertThat(result.isClearSession()).isTrue();
        verify(storage, never()).addPendingWork(any());
    }

    @Test
    void testConfirm_NoSessionExpires() {
        // Act
        HandlerResult result = submissionHandler.confirm(TestMessages.callback("7", "confirm_submission"),
                gardener, null);

        // Assert
        assertThat(result.getResponse().getText()).startsWith("Session expired");
        verify(storage, never()).addPendingWork(any());
    }

    @Test
    void testConfirm_DraftOnWrongStepIsIgnored() {
        // Arrange
        ConversationSession session = confirmingSession(plantedTrees());
        session.setStep(SessionStep.IDLE);

        // Act
        HandlerResult result = submissionHandler.confirm(TestMessages.callback("7", "confirm_submission"),
                gardener, session);

        // Assert
        assertThat(result.getResponse().getText()).startsWith("Session expired");
        verify(storage, never()).addPendingWork(any());
    }

    @Test
    void testCancel_ClearsSession() {
        // Act
        HandlerResult result = submissionHandler.cancel();

        // Assert
        assertThat(result.isClearSession()).isTrue();
        assertThat(result.getResponse().getText()).isEqualTo("❌ Submission cancelled.");
    }

    @Test
    void testToDraftData_SumsQuantities() {
        // Arrange
        ParsedWorkData work = ParsedWorkData.builder()
                .tasks(List.of(
                        ParsedTask.builder().type(TaskType.PLANTING).species("oak").count(3).build(),
                        ParsedTask.builder().type(TaskType.WEEDING).species("weeds").amount(10).unit("kg").build()))
                .notes("busy day")
                .build();

        // Act
        WorkDraftData data = SubmissionHandler.toDraftData(work);

        // Assert
        assertThat(data.getPlantCount()).isEqualTo(13);
        assertThat(data.getPlantSelection()).containsExactly("oak", "weeds");
        assertThat(data.getFeedback()).isEqualTo("busy day");
        assertThat(data.getTitle()).isEqualTo("Submission");
    }

    @Test
    void testToDraftData_SaturatesHugeQuantities() {
        // Arrange
        ParsedWorkData work = ParsedWorkData.builder()
                .tasks(List.of(
                        ParsedTask.builder().type(TaskType.PLANTING).species("trees").count(Integer.MAX_VALUE).build(),
                        ParsedTask.builder().type(TaskType.WEEDING).species("weeds").amount(5).unit("kg").build()))
                .notes("planted 99999999999 trees and removed 5 kg of weeds")
                .build();

        // Act
        WorkDraftData data = SubmissionHandler.toDraftData(work);

        // Assert
        assertThat(data.getPlantCount()).isEqualTo(Integer.MAX_VALUE);
    }
}
