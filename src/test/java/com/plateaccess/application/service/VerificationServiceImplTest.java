package com.plateaccess.application.service;

import com.plateaccess.domain.exception.PersistenceFailureException;
import com.plateaccess.domain.model.OwnerRecord;
import com.plateaccess.domain.model.VerificationAttempt;
import com.plateaccess.domain.model.VerificationResult;
import com.plateaccess.domain.port.OwnerRegistryPort;
import com.plateaccess.domain.port.VerificationLogPort;
import com.plateaccess.presentation.websocket.VerificationWebSocketHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerificationServiceImplTest {

    @Mock
    private OwnerRegistryPort ownerRegistryPort;

    @Mock
    private VerificationLogPort verificationLogPort;

    @Mock
    private VerificationWebSocketHandler webSocketHandler;

    private VerificationServiceImpl service;

    private final AtomicLong ids = new AtomicLong();

    @BeforeEach
    void setUp() {
        service = new VerificationServiceImpl(ownerRegistryPort, verificationLogPort, webSocketHandler);
        ReflectionTestUtils.setField(service, "recentMaxLimit", 500);
    }

    private void logAcceptsAppends() {
        when(verificationLogPort.append(any())).thenAnswer(invocation -> {
            VerificationAttempt attempt = invocation.getArgument(0);
            attempt.setAttemptId(ids.incrementAndGet());
            attempt.setScanTimestamp(LocalDateTime.now());
            return attempt;
        });
    }

    @Test
    void matchReturnsOwnerAndRecordsOwnerId() {
        logAcceptsAppends();
        OwnerRecord john = OwnerRecord.builder()
                .ownerId("STU001").displayName("John Doe").vehicleDescriptor("Silver").plateKey("ABC1234").build();
        when(ownerRegistryPort.findByPlate("ABC1234")).thenReturn(Optional.of(john));

        VerificationResult result = service.verify("abc1234", 0.95);

        assertThat(result.matchFound()).isTrue();
        assertThat(result.ownerInfo().getDisplayName()).isEqualTo("John Doe");
        assertThat(result.scannedPlate()).isEqualTo("ABC1234");
        assertThat(result.confidence()).isEqualTo(0.95);
        assertThat(result.message()).isEqualTo("Match found: John Doe (STU001)");
        assertThat(result.attemptId()).isEqualTo(1L);

        ArgumentCaptor<VerificationAttempt> captor = ArgumentCaptor.forClass(VerificationAttempt.class);
        verify(verificationLogPort).append(captor.capture());
        assertThat(captor.getValue().getMatchedOwnerId()).isEqualTo("STU001");
        assertThat(captor.getValue().isMatchFound()).isTrue();
        assertThat(captor.getValue().getScannedPlate()).isEqualTo("ABC1234");
    }

    @Test
    void noMatchIsLoggedWithoutOwner() {
        logAcceptsAppends();
        when(ownerRegistryPort.findByPlate("UNKNOWN99")).thenReturn(Optional.empty());

        VerificationResult result = service.verify("UNKNOWN99", 0.85);

        assertThat(result.matchFound()).isFalse();
        assertThat(result.ownerInfo()).isNull();
        assertThat(result.message()).isEqualTo("No record found for plate: UNKNOWN99");

        ArgumentCaptor<VerificationAttempt> captor = ArgumentCaptor.forClass(VerificationAttempt.class);
        verify(verificationLogPort).append(captor.capture());
        assertThat(captor.getValue().getMatchedOwnerId()).isNull();
        assertThat(captor.getValue().isMatchFound()).isFalse();
    }

    @Test
    void emptyScanIsLoggedButNeverLookedUp() {
        logAcceptsAppends();

        VerificationResult result = service.verify("   ", 0.4);

        assertThat(result.matchFound()).isFalse();
        assertThat(result.scannedPlate()).isEmpty();
        assertThat(result.message()).isEqualTo("No plate text to verify");
        verify(ownerRegistryPort, never()).findByPlate(anyString());
        verify(verificationLogPort, times(1)).append(any());
    }

    @Test
    void confidenceIsClampedBeforeLoggingAndReturning() {
        logAcceptsAppends();
        when(ownerRegistryPort.findByPlate(anyString())).thenReturn(Optional.empty());

        assertThat(service.verify("A1", 1.7).confidence()).isEqualTo(1.0);
        assertThat(service.verify("A1", -0.2).confidence()).isEqualTo(0.0);
        assertThat(service.verify("A1", Double.NaN).confidence()).isEqualTo(0.0);

        ArgumentCaptor<VerificationAttempt> captor = ArgumentCaptor.forClass(VerificationAttempt.class);
        verify(verificationLogPort, times(3)).append(captor.capture());
        assertThat(captor.getAllValues()).extracting(VerificationAttempt::getConfidence)
                .containsExactly(1.0, 0.0, 0.0);
    }

    @Test
    void appendFailurePropagatesInsteadOfReportingNoMatch() {
        when(ownerRegistryPort.findByPlate("ABC1234")).thenReturn(Optional.empty());
        when(verificationLogPort.append(any()))
                .thenThrow(PersistenceFailureException.auditLog("append", new RuntimeException("down")));

        assertThatThrownBy(() -> service.verify("ABC1234", 0.9))
                .isInstanceOf(PersistenceFailureException.class);
        verify(webSocketHandler, never()).broadcastAttempt(any());
    }

    @Test
    void lookupFailurePropagatesAndNothingIsAppended() {
        when(ownerRegistryPort.findByPlate("ABC1234"))
                .thenThrow(PersistenceFailureException.registry("findByPlate", new RuntimeException("down")));

        assertThatThrownBy(() -> service.verify("abc1234", 0.9))
                .isInstanceOf(PersistenceFailureException.class);
        verify(verificationLogPort, never()).append(any());
    }

    @Test
    void broadcastFailureDoesNotAffectResult() {
        logAcceptsAppends();
        when(ownerRegistryPort.findByPlate("ABC1234")).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("socket closed")).when(webSocketHandler).broadcastAttempt(any());

        VerificationResult result = service.verify("ABC1234", 0.5);

        assertThat(result.attemptId()).isNotNull();
        assertThat(result.matchFound()).isFalse();
    }

    @Test
    void recentAttemptsIsCappedByConfiguredMaximum() {
        ReflectionTestUtils.setField(service, "recentMaxLimit", 3);
        when(verificationLogPort.recent(3)).thenReturn(List.of());

        assertThat(service.recentAttempts(1000)).isEmpty();
        verify(verificationLogPort).recent(3);
    }

    @Test
    void statsSplitMatchedAndUnmatched() {
        when(verificationLogPort.count()).thenReturn(5L);
        when(verificationLogPort.countMatched()).thenReturn(2L);
        when(verificationLogPort.recent(1)).thenReturn(List.of());
        when(ownerRegistryPort.count()).thenReturn(4L);

        VerificationService.VerificationStatsDto stats = service.getStats();

        assertThat(stats.totalAttempts()).isEqualTo(5);
        assertThat(stats.matchedAttempts()).isEqualTo(2);
        assertThat(stats.unmatchedAttempts()).isEqualTo(3);
        assertThat(stats.registeredOwners()).isEqualTo(4);
        assertThat(stats.lastScanTime()).isEqualTo("--");
    }
}
