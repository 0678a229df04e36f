package com.mailreactor.service;

import com.mailreactor.config.GatewayProperties;
import com.mailreactor.domain.AccountCredentials;
import com.mailreactor.domain.FolderChanges;
import com.mailreactor.domain.FolderCursor;
import com.mailreactor.domain.MessageSummary;
import com.mailreactor.error.GatewayException;
import com.mailreactor.event.MessageReceivedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Polls every registered account for new messages and publishes a {@link MessageReceivedEvent} per arrival.
 * The first poll of an account only records its position; messages already present are not reported.
 * Positions are bound to the folder's UIDVALIDITY: a renumbered folder is re-baselined, never compared.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "mailreactor.monitor.enabled", havingValue = "true")
public class MailboxMonitor {

    private final GatewayService gatewayService;
    private final GatewayProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    /** Folder position per account */
    private final Map<String, FolderCursor> cursors = new ConcurrentHashMap<>();

    @Scheduled(fixedDelayString = "${mailreactor.monitor.interval-ms:60000}",
            initialDelayString = "${mailreactor.monitor.interval-ms:60000}")
    public void poll() {
        List<AccountCredentials> accounts = gatewayService.listAccounts();
        Set<String> registered = accounts.stream().map(AccountCredentials::getEmail).collect(Collectors.toSet());
        cursors.keySet().retainAll(registered);

        for (String email : registered) {
            try {
                pollAccount(email);
            } catch (GatewayException e) {
                log.warn("Monitor poll of {} failed: [{}] {}", email, e.getKind(), e.getMessage());
            }
        }
    }

    /**
     * @return number of new messages published
     */
    int pollAccount(String email) {
        String folder = properties.getMonitor().getFolder();
        FolderCursor cursor = cursors.get(email);
        if (cursor == null || !cursor.getFolder().equals(folder)) {
            FolderCursor baseline = gatewayService.folderCursor(email, folder);
            cursors.put(email, baseline);
            log.info("Monitoring {} of {} from UID {}", folder, email, baseline.getUid());
            return 0;
        }

        FolderChanges changes = gatewayService.newMessages(email, cursor);
        cursors.put(email, changes.getCursor());
        if (changes.isRenumbered()) {
            log.warn("{} of {} was renumbered; monitoring again from UID {}",
                    folder, email, changes.getCursor().getUid());
            return 0;
        }

        List<MessageSummary> arrived = changes.getMessages();
        for (MessageSummary message : arrived) {
            eventPublisher.publishEvent(new MessageReceivedEvent(email, message));
        }
        if (!arrived.isEmpty()) {
            log.info("{} new message(s) in {} of {}", arrived.size(), folder, email);
        }
        return arrived.size();
    }
}
