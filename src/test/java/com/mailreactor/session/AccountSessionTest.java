package com.mailreactor.session;

import com.mailreactor.error.GatewayErrorKind;
import com.mailreactor.error.GatewayException;
import com.mailreactor.imap.ImapConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.mailreactor.support.TestAccounts.credentials;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * AccountSession state machine unit tests
 */
class AccountSessionTest {

    private AccountSession session;
    private ImapConnection connection;

    @BeforeEach
    void setUp() {
        session = new AccountSession(credentials("alice@example.com", "secret"));
        connection = mock(ImapConnection.class);
    }

    @Test
    @DisplayName("Initial state: DISCONNECTED")
    void testInitialState() {
        assertThat(session.getState()).isEqualTo(SessionState.DISCONNECTED);
        assertThat(session.needsConnect()).isTrue();
    }

    @Test
    @DisplayName("DISCONNECTED -> CONNECTING -> READY -> BUSY -> READY")
    void testHappyPath() {
        long generation = session.beginConnecting();
        assertThat(session.getState()).isEqualTo(SessionState.CONNECTING);

        assertThat(session.connected(connection, generation)).isTrue();
        assertThat(session.getState()).isEqualTo(SessionState.READY);

        SessionHandle handle = session.checkout();
        assertThat(session.getState()).isEqualTo(SessionState.BUSY);
        assertThat(handle.getConnection()).isSameAs(connection);

        session.checkin(handle);
        assertThat(session.getState()).isEqualTo(SessionState.READY);
    }

    @Test
    @DisplayName("Failed connect counts a failure and returns to DISCONNECTED")
    void testConnectFailed() {
        long generation = session.beginConnecting();
        session.connectFailed(generation);

        assertThat(session.getState()).isEqualTo(SessionState.DISCONNECTED);
        assertThat(session.getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Invalidation while BUSY drops the connection; the old handle cannot bring it back")
    void testInvalidate_WhileBusy() {
        session.connected(connection, session.beginConnecting());
        SessionHandle handle = session.checkout();

        assertThat(session.invalidate(-1)).isSameAs(connection);
        assertThat(session.getState()).isEqualTo(SessionState.DISCONNECTED);

        session.checkin(handle);
        assertThat(session.getState()).isEqualTo(SessionState.DISCONNECTED);
        assertThat(session.invalidate(handle.getGeneration())).isNull();
    }

    @Test
    @DisplayName("A connect attempt superseded by invalidation is rejected")
    void testInvalidate_WhileConnecting() {
        long generation = session.beginConnecting();
        session.invalidate(-1);

        assertThat(session.connected(connection, generation)).isFalse();
        assertThat(session.getState()).isEqualTo(SessionState.DISCONNECTED);
    }

    @Test
    @DisplayName("Successful connect resets the failure count")
    void testConnected_ResetsFailures() {
        session.connectFailed(session.beginConnecting());
        session.connectFailed(session.beginConnecting());
        assertThat(session.getConsecutiveFailures()).isEqualTo(2);

        session.connected(connection, session.beginConnecting());
        assertThat(session.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("CLOSED is terminal")
    void testClose_Terminal() {
        session.connected(connection, session.beginConnecting());

        assertThat(session.close()).isSameAs(connection);
        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(session.close()).isNull();
        assertThat(session.invalidate(-1)).isNull();

        assertThatThrownBy(session::requireOpen)
                .isInstanceOf(GatewayException.class)
                .extracting(e -> ((GatewayException) e).getKind())
                .isEqualTo(GatewayErrorKind.NOT_FOUND);
        assertThatThrownBy(session::beginConnecting).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Illegal transition: checkout without a connection")
    void testCheckout_WhenDisconnected() {
        assertThatThrownBy(session::checkout).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Allowed transitions")
    void testSessionStateTransitions() {
        assertThat(SessionState.DISCONNECTED.canMoveTo(SessionState.CONNECTING)).isTrue();
        assertThat(SessionState.DISCONNECTED.canMoveTo(SessionState.BUSY)).isFalse();
        assertThat(SessionState.READY.canMoveTo(SessionState.BUSY)).isTrue();
        assertThat(SessionState.BUSY.canMoveTo(SessionState.DISCONNECTED)).isTrue();
        for (SessionState next : SessionState.values()) {
            assertThat(SessionState.CLOSED.canMoveTo(next)).isFalse();
        }
    }
}
