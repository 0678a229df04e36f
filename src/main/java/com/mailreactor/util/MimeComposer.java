package com.mailreactor.util;

import com.mailreactor.domain.ComposedMessage;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;

/**
 * Builds outgoing MIME messages with Jakarta Mail
 */
public final class MimeComposer {

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        SESSION = Session.getInstance(props);
    }

    private MimeComposer() {}

    /**
     * Build a MimeMessage from structured fields.
     * Bcc is left out of the headers; see {@link #envelopeRecipients}.
     */
    public static MimeMessage compose(ComposedMessage composed, String accountEmail) throws MessagingException {
        MimeMessage message = new MimeMessage(SESSION);
        String from = composed.getFrom() != null && !composed.getFrom().isBlank() ? composed.getFrom() : accountEmail;
        message.setFrom(new InternetAddress(from, true));
        message.setRecipients(Message.RecipientType.TO, toAddresses(composed.getTo()));
        if (composed.getCc() != null && !composed.getCc().isEmpty()) {
            message.setRecipients(Message.RecipientType.CC, toAddresses(composed.getCc()));
        }
        message.setSubject(composed.getSubject() != null ? composed.getSubject() : "", "UTF-8");
        message.setSentDate(new Date());

        String text = composed.getTextBody() != null ? composed.getTextBody() : "";
        if (composed.getHtmlBody() != null && !composed.getHtmlBody().isBlank()) {
            MimeMultipart alternative = new MimeMultipart("alternative");
            MimeBodyPart textPart = new MimeBodyPart();
            textPart.setText(text, "UTF-8");
            MimeBodyPart htmlPart = new MimeBodyPart();
            htmlPart.setText(composed.getHtmlBody(), "UTF-8", "html");
            alternative.addBodyPart(textPart);
            alternative.addBodyPart(htmlPart);
            message.setContent(alternative);
        } else {
            message.setText(text, "UTF-8");
        }
        // generates Message-ID
        message.saveChanges();
        return message;
    }

    /**
     * Parse a raw RFC 822 message
     */
    public static MimeMessage parse(String rawMessage) throws MessagingException {
        return new MimeMessage(SESSION, new ByteArrayInputStream(rawMessage.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Envelope recipients: explicit to/cc/bcc of the request, plus the header recipients of a raw message
     */
    public static Address[] envelopeRecipients(ComposedMessage composed, MimeMessage message)
            throws MessagingException {
        Set<Address> recipients = new LinkedHashSet<>(List.of(toAddresses(composed.allRecipients())));
        if (composed.isRaw() && message.getAllRecipients() != null) {
            recipients.addAll(List.of(message.getAllRecipients()));
        }
        return recipients.toArray(new Address[0]);
    }

    /**
     * Return the Message-ID header, assigning one first when the message has none
     */
    public static String ensureMessageId(MimeMessage message, String accountEmail) throws MessagingException {
        String messageId = message.getMessageID();
        if (messageId == null || messageId.isBlank()) {
            String domain = MailAddressUtil.extractDomain(accountEmail);
            messageId = "<" + UUID.randomUUID() + "@" + (domain != null ? domain : "mailreactor") + ">";
            message.setHeader("Message-ID", messageId);
        }
        return messageId;
    }

    /**
     * Return the shared mail Session used for composing and parsing
     */
    public static Session getSession() {
        return SESSION;
    }

    private static Address[] toAddresses(List<String> values) throws AddressException {
        List<Address> addresses = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                addresses.add(new InternetAddress(value, true));
            }
        }
        return addresses.toArray(new Address[0]);
    }
}
