package com.mailreactor.service;

import com.mailreactor.domain.ComposedMessage;
import com.mailreactor.domain.FolderChanges;
import com.mailreactor.domain.FolderCursor;
import com.mailreactor.domain.MessageBody;
import com.mailreactor.domain.MessageQuery;
import com.mailreactor.domain.MessageSummary;
import com.mailreactor.error.GatewayErrorKind;
import com.mailreactor.error.GatewayException;
import com.mailreactor.imap.ImapConnection;
import com.mailreactor.session.OutboundHandle;
import com.mailreactor.session.SessionHandle;
import com.mailreactor.util.MimeComposer;
import com.mailreactor.util.MimeContentParser;
import jakarta.mail.Address;
import jakarta.mail.Flags;
import jakarta.mail.Message;
import jakarta.mail.MessageRemovedException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.FlagTerm;
import jakarta.mail.search.FromStringTerm;
import jakarta.mail.search.ReceivedDateTerm;
import jakarta.mail.search.SearchTerm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

/**
 * Translates gateway operations into IMAP/SMTP command sequences and protocol data back into the API model.
 * Holds no connection state; every call works on the handle it is given.
 */
@Slf4j
@Component
public class CommandTranslator {

    /**
     * SELECT folder, SEARCH with the query's filters ANDed, FETCH envelopes of the newest maxResults hits.
     * Summaries keep the order the server returned the identifiers in.
     */
    public List<MessageSummary> listMessages(SessionHandle handle, MessageQuery query) throws MessagingException {
        ImapConnection connection = handle.getConnection();
        connection.selectFolder(query.getFolder());

        long[] uids = connection.search(buildSearchTerm(query));
        long[] selected = cap(uids, query.getMaxResults());
        log.debug("SEARCH {} in {} for {}: {} hit(s), fetching {}",
                describe(query), query.getFolder(), handle.getEmail(), uids.length, selected.length);
        if (selected.length == 0) {
            return List.of();
        }

        List<Message> messages = connection.fetchSummaries(selected);
        List<MessageSummary> summaries = new ArrayList<>(selected.length);
        for (int i = 0; i < selected.length; i++) {
            Message message = messages.get(i);
            if (message == null || message.isExpunged()) {
                log.debug("Message {} expunged between SEARCH and FETCH", selected[i]);
                continue;
            }
            try {
                summaries.add(toSummary(selected[i], query.getFolder(), message));
            } catch (MessageRemovedException e) {
                log.debug("Message {} removed while reading its envelope", selected[i]);
            }
        }
        return summaries;
    }

    /**
     * Full content of one message; NOT_FOUND when the UID no longer exists in the folder
     */
    public MessageBody fetchBody(SessionHandle handle, String folder, long uid) throws MessagingException, IOException {
        ImapConnection connection = handle.getConnection();
        connection.selectFolder(folder);
        Message message = connection.fetchMessage(uid);
        if (message == null || message.isExpunged()) {
            throw new GatewayException(GatewayErrorKind.NOT_FOUND, handle.getEmail(),
                    "Message " + uid + " not found in " + folder);
        }
        MimeContentParser.MimeContent content = MimeContentParser.parse(message);
        return MessageBody.builder()
                .summary(toSummary(uid, folder, message))
                .textBody(content.getText())
                .htmlBody(content.getHtml())
                .attachments(content.getAttachments())
                .build();
    }

    /**
     * Summaries of messages that arrived after the cursor, ascending.
     * A changed UIDVALIDITY restarts the cursor instead of comparing UIDs of different epochs.
     */
    public FolderChanges newMessages(SessionHandle handle, FolderCursor since) throws MessagingException {
        ImapConnection connection = handle.getConnection();
        String folder = since.getFolder();
        connection.selectFolder(folder);
        long uidValidity = connection.uidValidity();
        if (uidValidity != since.getUidValidity()) {
            log.info("UIDVALIDITY of {} changed ({} -> {})", folder, since.getUidValidity(), uidValidity);
            return FolderChanges.renumbered(new FolderCursor(folder, uidValidity, connection.highestUid()));
        }

        long[] uids = connection.uidsAfter(since.getUid());
        if (uids.length == 0) {
            return new FolderChanges(since, List.of(), false);
        }
        List<Message> messages = connection.fetchSummaries(uids);
        List<MessageSummary> summaries = new ArrayList<>(uids.length);
        FolderCursor next = since;
        for (int i = 0; i < uids.length; i++) {
            next = next.advanceTo(uids[i]);
            Message message = messages.get(i);
            if (message != null && !message.isExpunged()) {
                summaries.add(toSummary(uids[i], folder, message));
            }
        }
        return new FolderChanges(next, summaries, false);
    }

    /**
     * Current position of a folder: its UIDVALIDITY and highest UID
     */
    public FolderCursor cursor(SessionHandle handle, String folder) throws MessagingException {
        ImapConnection connection = handle.getConnection();
        connection.selectFolder(folder);
        return new FolderCursor(folder, connection.uidValidity(), connection.highestUid());
    }

    public List<String> listFolders(SessionHandle handle) throws MessagingException {
        return handle.getConnection().listFolders();
    }

    /**
     * Compose (or parse a raw payload) and submit. Acceptance by the server counts as success.
     *
     * @return the Message-ID of the submitted message
     */
    public String sendMessage(OutboundHandle handle, ComposedMessage composed) throws MessagingException {
        MimeMessage message = composed.isRaw()
                ? MimeComposer.parse(composed.getRawMessage())
                : MimeComposer.compose(composed, handle.getEmail());
        Address[] recipients = MimeComposer.envelopeRecipients(composed, message);
        if (recipients.length == 0) {
            throw GatewayException.configuration(handle.getEmail(), "Message has no recipients");
        }
        if (message.getFrom() == null) {
            message.setFrom(new InternetAddress(handle.getEmail()));
        }
        String messageId = MimeComposer.ensureMessageId(message, handle.getEmail());

        handle.getConnection().send(message, recipients);
        log.info("Message {} accepted for {} recipient(s) from {}", messageId, recipients.length, handle.getEmail());
        return messageId;
    }

    static SearchTerm buildSearchTerm(MessageQuery query) {
        List<SearchTerm> terms = new ArrayList<>();
        if (query.isUnseenOnly()) {
            terms.add(new FlagTerm(new Flags(Flags.Flag.SEEN), false));
        }
        if (query.getFrom() != null && !query.getFrom().isBlank()) {
            terms.add(new FromStringTerm(query.getFrom().trim()));
        }
        if (query.getSince() != null) {
            Date since = Date.from(query.getSince().atStartOfDay(ZoneId.systemDefault()).toInstant());
            terms.add(new ReceivedDateTerm(ComparisonTerm.GE, since));
        }
        if (terms.isEmpty()) {
            return null;
        }
        return terms.size() == 1 ? terms.get(0) : new AndTerm(terms.toArray(new SearchTerm[0]));
    }

    /**
     * Keep the last {@code max} identifiers; servers return ascending UIDs, so these are the newest
     */
    static long[] cap(long[] uids, int max) {
        if (uids.length <= max) {
            return uids;
        }
        return Arrays.copyOfRange(uids, uids.length - max, uids.length);
    }

    static MessageSummary toSummary(long uid, String folder, Message message) throws MessagingException {
        Flags flags = message.getFlags();
        MessageSummary.MessageSummaryBuilder builder = MessageSummary.builder()
                .uid(uid)
                .folder(folder)
                .messageId(message instanceof MimeMessage mime ? mime.getMessageID() : null)
                .subject(message.getSubject())
                .from(firstAddress(message.getFrom()))
                .to(addresses(message.getRecipients(Message.RecipientType.TO)))
                .cc(addresses(message.getRecipients(Message.RecipientType.CC)))
                .sentDate(message.getSentDate() != null ? message.getSentDate().toInstant() : null)
                .receivedDate(message.getReceivedDate() != null ? message.getReceivedDate().toInstant() : null)
                .seen(flags.contains(Flags.Flag.SEEN))
                .size(Math.max(message.getSize(), 0));
        for (Flags.Flag flag : flags.getSystemFlags()) {
            builder.flag(flagName(flag));
        }
        for (String userFlag : flags.getUserFlags()) {
            builder.flag(userFlag);
        }
        return builder.build();
    }

    private static String flagName(Flags.Flag flag) {
        if (flag == Flags.Flag.SEEN) return "\\Seen";
        if (flag == Flags.Flag.ANSWERED) return "\\Answered";
        if (flag == Flags.Flag.FLAGGED) return "\\Flagged";
        if (flag == Flags.Flag.DELETED) return "\\Deleted";
        if (flag == Flags.Flag.DRAFT) return "\\Draft";
        if (flag == Flags.Flag.RECENT) return "\\Recent";
        return "\\User";
    }

    private static String firstAddress(Address[] addresses) {
        List<String> all = addresses(addresses);
        return all.isEmpty() ? null : all.get(0);
    }

    private static List<String> addresses(Address[] addresses) {
        if (addresses == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>(addresses.length);
        for (Address address : addresses) {
            result.add(address instanceof InternetAddress internet ? internet.toUnicodeString() : address.toString());
        }
        return result;
    }

    private static String describe(MessageQuery query) {
        return "unseen=" + query.isUnseenOnly() + " from=" + query.getFrom() + " since=" + query.getSince();
    }
}
