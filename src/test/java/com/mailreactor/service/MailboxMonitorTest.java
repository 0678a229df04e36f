package com.mailreactor.service;

import com.mailreactor.config.GatewayProperties;
import com.mailreactor.domain.FolderChanges;
import com.mailreactor.domain.FolderCursor;
import com.mailreactor.domain.MessageSummary;
import com.mailreactor.error.GatewayErrorKind;
import com.mailreactor.error.GatewayException;
import com.mailreactor.event.MessageReceivedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;

import static com.mailreactor.support.TestAccounts.credentials;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * MailboxMonitor unit tests
 * - first poll only records the baseline
 * - later polls publish one event per arrival
 * - a renumbered folder is re-baselined
 */
@ExtendWith(MockitoExtension.class)
class MailboxMonitorTest {

    private static final String ALICE = "alice@example.com";
    private static final String BOB = "bob@example.com";

    @Mock
    private GatewayService gatewayService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private MailboxMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new MailboxMonitor(gatewayService, new GatewayProperties(), eventPublisher);
    }

    private static FolderCursor cursor(long uidValidity, long uid) {
        return new FolderCursor("INBOX", uidValidity, uid);
    }

    private static MessageSummary summary(long uid) {
        return MessageSummary.builder().uid(uid).folder("INBOX").subject("message " + uid).build();
    }

    @Test
    @DisplayName("First poll records the folder position without publishing")
    void testPoll_Baseline() {
        when(gatewayService.folderCursor(ALICE, "INBOX")).thenReturn(cursor(7, 5));

        assertThat(monitor.pollAccount(ALICE)).isZero();

        verify(gatewayService, never()).newMessages(anyString(), any());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("Arrivals after the baseline are published and advance it")
    void testPoll_NewMessages() {
        when(gatewayService.folderCursor(ALICE, "INBOX")).thenReturn(cursor(7, 5));
        when(gatewayService.newMessages(ALICE, cursor(7, 5)))
                .thenReturn(new FolderChanges(cursor(7, 7), List.of(summary(6), summary(7)), false));
        when(gatewayService.newMessages(ALICE, cursor(7, 7)))
                .thenReturn(new FolderChanges(cursor(7, 7), List.of(), false));

        monitor.pollAccount(ALICE);
        assertThat(monitor.pollAccount(ALICE)).isEqualTo(2);
        assertThat(monitor.pollAccount(ALICE)).isZero();

        ArgumentCaptor<Object> published = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(2)).publishEvent(published.capture());
        assertThat(published.getAllValues())
                .extracting(event -> ((MessageReceivedEvent) event).getMessage().getUid())
                .containsExactly(6L, 7L);
        assertThat(((MessageReceivedEvent) published.getValue()).getAccountEmail()).isEqualTo(ALICE);
    }

    @Test
    @DisplayName("UIDVALIDITY change: no events for the old numbering, later arrivals use the new one")
    void testPoll_Renumbered() {
        when(gatewayService.folderCursor(ALICE, "INBOX")).thenReturn(cursor(7, 120));
        when(gatewayService.newMessages(ALICE, cursor(7, 120)))
                .thenReturn(FolderChanges.renumbered(cursor(8, 15)));
        when(gatewayService.newMessages(ALICE, cursor(8, 15)))
                .thenReturn(new FolderChanges(cursor(8, 16), List.of(summary(16)), false));

        monitor.pollAccount(ALICE);
        assertThat(monitor.pollAccount(ALICE)).isZero();
        verify(eventPublisher, never()).publishEvent(any(Object.class));

        assertThat(monitor.pollAccount(ALICE)).isEqualTo(1);
        ArgumentCaptor<Object> published = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(published.capture());
        assertThat(((MessageReceivedEvent) published.getValue()).getMessage().getUid()).isEqualTo(16L);
    }

    @Test
    @DisplayName("A failing account does not stop the poll of the others")
    void testPoll_FailureIsolated() {
        when(gatewayService.listAccounts()).thenReturn(List.of(credentials(ALICE, "a"), credentials(BOB, "b")));
        when(gatewayService.folderCursor(ALICE, "INBOX"))
                .thenThrow(new GatewayException(GatewayErrorKind.CONNECTION, ALICE, "Connection failed"));
        when(gatewayService.folderCursor(BOB, "INBOX")).thenReturn(cursor(1, 1));

        monitor.poll();

        verify(gatewayService).folderCursor(BOB, "INBOX");
    }
}
