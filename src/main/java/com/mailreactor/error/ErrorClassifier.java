package com.mailreactor.error;

import com.mailreactor.util.SecretRedactor;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.FolderClosedException;
import jakarta.mail.FolderNotFoundException;
import jakarta.mail.MessageRemovedException;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.StoreClosedException;
import jakarta.mail.internet.AddressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Maps raw protocol failures onto {@link GatewayErrorKind}.
 * The whole cause chain is inspected; the most specific kind wins.
 * Produced messages never contain the account secret.
 */
@Slf4j
@Component
public class ErrorClassifier {

    private static final int MAX_CHAIN_DEPTH = 16;

    private static final List<Rule> RULES = List.of(
            new Rule(GatewayErrorKind.AUTHENTICATION, AuthenticationFailedException.class::isInstance),
            new Rule(GatewayErrorKind.TIMEOUT, t -> t instanceof TimeoutException
                    || t instanceof SocketTimeoutException),
            new Rule(GatewayErrorKind.NOT_FOUND, t -> t instanceof FolderNotFoundException
                    || t instanceof MessageRemovedException),
            new Rule(GatewayErrorKind.CONFIGURATION, AddressException.class::isInstance),
            new Rule(GatewayErrorKind.PROTOCOL, t -> t instanceof SendFailedException
                    || t instanceof UnsupportedEncodingException),
            new Rule(GatewayErrorKind.CONNECTION, t -> t instanceof StoreClosedException
                    || t instanceof FolderClosedException
                    || t instanceof UnknownHostException
                    || t instanceof SocketException
                    || t instanceof SSLException
                    || t instanceof IOException),
            new Rule(GatewayErrorKind.PROTOCOL, MessagingException.class::isInstance));

    /**
     * Classify a failure raised while serving {@code email}.
     *
     * @param failure raw failure, possibly already a {@link GatewayException}
     * @param email   account the operation ran for, may be null
     * @param secret  account secret to scrub from messages, may be null
     */
    public GatewayException classify(Throwable failure, String email, String secret) {
        if (failure instanceof GatewayException gatewayException) {
            return gatewayException;
        }
        List<Throwable> chain = causeChain(failure);
        for (Rule rule : RULES) {
            for (Throwable candidate : chain) {
                if (rule.matches().test(candidate)) {
                    return new GatewayException(rule.kind(), email, describe(rule.kind(), candidate, secret));
                }
            }
        }
        log.error("Unclassified failure for {}: {}", email, failure == null ? "null" : failure.getClass().getName());
        return new GatewayException(GatewayErrorKind.INTERNAL, email, GatewayErrorKind.INTERNAL.getTitle());
    }

    /**
     * Kind only, for callers that decide on session invalidation
     */
    public GatewayErrorKind kindOf(Throwable failure) {
        return classify(failure, null, null).getKind();
    }

    private String describe(GatewayErrorKind kind, Throwable cause, String secret) {
        String detail = cause.getMessage();
        if (cause instanceof SendFailedException sendFailed && sendFailed.getInvalidAddresses() != null
                && sendFailed.getInvalidAddresses().length > 0) {
            detail = "recipients rejected: " + Arrays.stream(sendFailed.getInvalidAddresses())
                    .map(Object::toString)
                    .collect(Collectors.joining(", "));
        }
        if (detail == null || detail.isBlank()) {
            return kind.getTitle();
        }
        return kind.getTitle() + ": " + SecretRedactor.redact(detail.trim(), secret);
    }

    private static List<Throwable> causeChain(Throwable failure) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = failure;
        while (current != null && chain.size() < MAX_CHAIN_DEPTH && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    private record Rule(GatewayErrorKind kind, Predicate<Throwable> matches) {
    }
}
