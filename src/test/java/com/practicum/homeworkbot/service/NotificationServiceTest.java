package com.practicum.homeworkbot.service;

import com.practicum.homeworkbot.config.MetricsConfig;
import com.practicum.homeworkbot.model.ErrorKind;
import com.practicum.homeworkbot.model.ErrorSignature;
import com.practicum.homeworkbot.model.Verdict;
import com.practicum.homeworkbot.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock private MessageSender sender;
    @Mock private MetricsConfig metricsConfig;

    private NotificationService service;

    @BeforeEach
    void setUp() {
        lenient().when(sender.channel()).thenReturn("telegram");
        service = new NotificationService(sender, metricsConfig);
    }

    @Test
    void notifyStatusChange_messageNamesHomeworkAndVerdict() {
        boolean sent = service.notifyStatusChange(TestDataFactory.change("hw1", Verdict.ACCEPTED, Verdict.PENDING));

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(sender).send(body.capture());
        assertThat(sent).isTrue();
        assertThat(body.getValue()).contains("hw1").contains("accepted").contains(Verdict.ACCEPTED.getText());
        verify(metricsConfig).recordNotification("telegram", "success");
    }

    @Test
    void alertFailure_messageCarriesKindAndMessage() {
        service.alertFailure(new ErrorSignature(ErrorKind.CURSOR_MISSING, "Response has no 'current_date'"));

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(sender).send(body.capture());
        assertThat(body.getValue()).contains("CURSOR_MISSING").contains("current_date");
    }

    @Test
    void announceStartup_sendsOneMessage() {
        assertThat(service.announceStartup(Instant.parse("2024-03-01T10:15:00Z"))).isTrue();
        verify(sender).send(startsWith("Homework bot started: "));
    }

    @Test
    void senderFailure_isContainedAndReportedAsFalse() {
        doThrow(new IllegalStateException("chat not found")).when(sender).send(anyString());

        boolean sent = service.notifyStatusChange(TestDataFactory.change("hw1", Verdict.REJECTED, null));

        assertThat(sent).isFalse();
        verify(metricsConfig).recordNotification("telegram", "error");
        verify(metricsConfig, never()).recordNotification("telegram", "success");
    }
}
