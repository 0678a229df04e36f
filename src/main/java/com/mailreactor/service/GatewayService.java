package com.mailreactor.service;

import com.mailreactor.config.GatewayProperties;
import com.mailreactor.domain.AccountCredentials;
import com.mailreactor.domain.ComposedMessage;
import com.mailreactor.domain.FolderChanges;
import com.mailreactor.domain.FolderCursor;
import com.mailreactor.domain.MessageBody;
import com.mailreactor.domain.MessageQuery;
import com.mailreactor.domain.MessageSummary;
import com.mailreactor.domain.ProviderProfile;
import com.mailreactor.domain.SecretType;
import com.mailreactor.error.ErrorClassifier;
import com.mailreactor.error.GatewayException;
import com.mailreactor.event.MessageSentEvent;
import com.mailreactor.provider.MxProviderLookup;
import com.mailreactor.provider.ProviderProfileResolver;
import com.mailreactor.session.OutboundHandle;
import com.mailreactor.session.SessionHandle;
import com.mailreactor.session.SessionPool;
import com.mailreactor.session.SessionState;
import com.mailreactor.util.MailAddressUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Gateway facade: account lifecycle and mailbox operations.
 *
 * Every operation runs under the configured timeout, holds the account's session only while it runs,
 * and reports failures as classified {@link GatewayException}s.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    static final String OPERATION_TIMER = "mailreactor.operation";
    static final String ERROR_COUNTER = "mailreactor.errors";

    private final SessionPool sessionPool;
    private final CommandTranslator translator;
    private final ErrorClassifier errorClassifier;
    private final ProviderProfileResolver profileResolver;
    private final MxProviderLookup mxProviderLookup;
    private final GatewayProperties properties;
    private final MeterRegistry meterRegistry;
    private final ApplicationEventPublisher eventPublisher;

    /** Registered accounts by normalized email */
    private final Map<String, AccountCredentials> accounts = new ConcurrentHashMap<>();

    // ========== Accounts ==========

    /**
     * Resolve the provider profile, verify the credentials by opening a session and register the account.
     * Nothing is registered when verification fails.
     *
     * @return the registered credentials with their completed profile
     */
    public AccountCredentials addAccount(AccountCredentials request) {
        String email = MailAddressUtil.normalize(request.getEmail());
        if (email == null) {
            throw GatewayException.configuration(request.getEmail(), "Invalid email address: " + request.getEmail());
        }
        if (request.getSecret() == null || request.getSecret().isEmpty()) {
            throw GatewayException.configuration(email, "Secret is required");
        }

        AccountCredentials credentials = request.toBuilder()
                .email(email)
                .secretType(request.getSecretType() != null ? request.getSecretType() : SecretType.PASSWORD)
                .profile(resolveProfile(email, request.getProfile()))
                .build();
        log.info("Adding account {} (provider: {})", email, credentials.getProfile().getId());

        try {
            execute("addAccount", credentials, true, () -> {
                sessionPool.release(sessionPool.acquire(credentials, properties.getOperationTimeout()));
                return Boolean.TRUE;
            });
        } catch (GatewayException e) {
            if (!accounts.containsKey(email)) {
                sessionPool.remove(email);
            }
            log.warn("Account {} not added: {}", email, e.getMessage());
            throw e;
        }

        accounts.put(email, credentials);
        if (sessionPool.stateOf(email).isEmpty()) {
            // removed while verification ran
            accounts.remove(email, credentials);
            throw GatewayException.noSuchAccount(email);
        }
        log.info("Account {} registered", email);
        return credentials;
    }

    /**
     * Unregister the account and close its session. Unknown accounts are ignored.
     */
    public void removeAccount(String email) {
        String normalized = MailAddressUtil.normalize(email);
        if (normalized == null) {
            return;
        }
        AccountCredentials removed = accounts.remove(normalized);
        boolean hadSession = sessionPool.remove(normalized);
        if (removed != null || hadSession) {
            log.info("Account {} removed", normalized);
        }
    }

    /**
     * Replace the account's secret after verifying it against the server.
     * The previous secret stays active when verification fails.
     */
    public void rotateSecret(String email, String secret, SecretType secretType) {
        AccountCredentials current = requireAccount(email);
        if (secret == null || secret.isEmpty()) {
            throw GatewayException.configuration(current.getEmail(), "Secret is required");
        }
        AccountCredentials rotated = current.toBuilder()
                .secret(secret)
                .secretType(secretType != null ? secretType : current.getSecretType())
                .build();

        withSession("rotateSecret", rotated, handle -> Boolean.TRUE);
        accounts.put(rotated.getEmail(), rotated);
        log.info("Secret of {} rotated", rotated.getEmail());
    }

    public List<AccountCredentials> listAccounts() {
        return accounts.values().stream()
                .sorted(Comparator.comparing(AccountCredentials::getEmail))
                .toList();
    }

    /**
     * Current session state; DISCONNECTED for a registered account without a session yet
     */
    public SessionState sessionState(String email) {
        AccountCredentials credentials = requireAccount(email);
        return sessionPool.stateOf(credentials.getEmail()).orElse(SessionState.DISCONNECTED);
    }

    /**
     * Session state of every registered account, by email
     */
    public Map<String, SessionState> sessionStates() {
        Map<String, SessionState> states = new TreeMap<>();
        for (String email : accounts.keySet()) {
            states.put(email, sessionPool.stateOf(email).orElse(SessionState.DISCONNECTED));
        }
        return states;
    }

    // ========== Messages ==========

    public List<MessageSummary> listMessages(String email, MessageQuery query) {
        AccountCredentials credentials = requireAccount(email);
        MessageQuery normalized = normalizeQuery(credentials.getEmail(), query);
        return withSession("listMessages", credentials, handle -> translator.listMessages(handle, normalized));
    }

    public MessageBody getMessage(String email, String folder, long uid) {
        AccountCredentials credentials = requireAccount(email);
        if (uid < 1) {
            throw GatewayException.configuration(credentials.getEmail(), "Invalid message id: " + uid);
        }
        String target = folderOrInbox(folder);
        return withSession("getMessage", credentials, handle -> translator.fetchBody(handle, target, uid));
    }

    public List<String> listFolders(String email) {
        AccountCredentials credentials = requireAccount(email);
        return withSession("listFolders", credentials, translator::listFolders);
    }

    /**
     * Messages that arrived after the cursor, oldest first, and the cursor for the next call
     */
    public FolderChanges newMessages(String email, FolderCursor since) {
        AccountCredentials credentials = requireAccount(email);
        return withSession("newMessages", credentials, handle -> translator.newMessages(handle, since));
    }

    public FolderCursor folderCursor(String email, String folder) {
        AccountCredentials credentials = requireAccount(email);
        String target = folderOrInbox(folder);
        return withSession("folderCursor", credentials, handle -> translator.cursor(handle, target));
    }

    /**
     * Submit a message over a fresh SMTP connection.
     *
     * @return Message-ID of the accepted message
     */
    public String sendMessage(String email, ComposedMessage message) {
        AccountCredentials credentials = requireAccount(email);
        if (message == null || (!message.isRaw() && message.allRecipients().isEmpty())) {
            throw GatewayException.configuration(credentials.getEmail(), "Message has no recipients");
        }

        String messageId = execute("sendMessage", credentials, false, () -> {
            try (OutboundHandle handle = sessionPool.openOutbound(credentials)) {
                return translator.sendMessage(handle, message);
            }
        });
        try {
            eventPublisher.publishEvent(new MessageSentEvent(
                    credentials.getEmail(), messageId, message.getSubject(), message.allRecipients(), Instant.now()));
        } catch (RuntimeException e) {
            // the server already accepted the message; a listener cannot undo that
            log.error("MessageSentEvent listener failed for {} ({})", credentials.getEmail(), messageId, e);
        }
        return messageId;
    }

    // ========== Internals ==========

    AccountCredentials requireAccount(String email) {
        String normalized = MailAddressUtil.normalize(email);
        AccountCredentials credentials = normalized != null ? accounts.get(normalized) : null;
        if (credentials == null) {
            throw GatewayException.noSuchAccount(normalized != null ? normalized : email);
        }
        return credentials;
    }

    private ProviderProfile resolveProfile(String email, ProviderProfile explicit) {
        ProviderProfile known = profileResolver.resolve(email);
        boolean explicitComplete = explicit != null && explicit.isResolved();
        if (!known.isResolved() && !explicitComplete && properties.getProvider().isMxLookupEnabled()) {
            known = mxProviderLookup.detect(MailAddressUtil.extractDomain(email)).orElse(ProviderProfile.UNRESOLVED);
        }
        return profileResolver.complete(email, explicit, known);
    }

    private MessageQuery normalizeQuery(String email, MessageQuery query) {
        MessageQuery source = query != null ? query : MessageQuery.builder()
                .maxResults(properties.getQuery().getDefaultMaxResults())
                .build();
        int limit = properties.getQuery().getMaxResultsLimit();
        if (source.getMaxResults() < 1 || source.getMaxResults() > limit) {
            throw GatewayException.configuration(email, "maxResults must be between 1 and " + limit);
        }
        return source.toBuilder().folder(folderOrInbox(source.getFolder())).build();
    }

    private static String folderOrInbox(String folder) {
        return folder == null || folder.isBlank() ? MessageQuery.INBOX : folder.trim();
    }

    /**
     * Acquire, run, release. Failures that leave the connection in doubt invalidate it.
     * Never creates a session: an account removed after its lookup fails with NOT_FOUND.
     */
    private <T> T withSession(String operation, AccountCredentials credentials, SessionCall<T> call) {
        Duration timeout = properties.getOperationTimeout();
        return execute(operation, credentials, true, () -> {
            SessionHandle handle = sessionPool.acquireExisting(credentials, timeout);
            try {
                return call.apply(handle);
            } catch (Exception e) {
                if (errorClassifier.kindOf(e).invalidatesSession()) {
                    sessionPool.invalidate(handle);
                }
                throw e;
            } finally {
                sessionPool.release(handle);
            }
        });
    }

    /**
     * Run on the bounded elastic scheduler under the operation timeout and classify any failure.
     * An expired timeout invalidates the session: the connection is assumed wedged.
     */
    private <T> T execute(String operation, AccountCredentials credentials, boolean invalidateOnTimeout,
                          Callable<T> action) {
        Duration timeout = properties.getOperationTimeout();
        String email = credentials.getEmail();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            T result = Mono.fromCallable(action)
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
            sample.stop(operationTimer(operation, "success"));
            return result;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            GatewayException failure;
            if (cause instanceof TimeoutException) {
                log.warn("{} for {} timed out after {}ms", operation, email, timeout.toMillis());
                if (invalidateOnTimeout) {
                    sessionPool.invalidate(email);
                }
                failure = GatewayException.timeout(email, timeout);
            } else {
                failure = errorClassifier.classify(cause, email, credentials.getSecret());
                log.warn("{} for {} failed: [{}] {}", operation, email, failure.getKind(), failure.getMessage());
            }
            sample.stop(operationTimer(operation, failure.getKind().name()));
            Counter.builder(ERROR_COUNTER)
                    .tag("kind", failure.getKind().name())
                    .register(meterRegistry)
                    .increment();
            throw failure;
        }
    }

    private Timer operationTimer(String operation, String outcome) {
        return Timer.builder(OPERATION_TIMER)
                .tag("op", operation)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    @FunctionalInterface
    private interface SessionCall<T> {
        T apply(SessionHandle handle) throws Exception;
    }
}
