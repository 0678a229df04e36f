package com.mailreactor.util;

import com.mailreactor.domain.Attachment;
import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.MimeUtility;
import jakarta.mail.internet.ParseException;
import lombok.Value;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Walks a MIME tree and extracts text, HTML and attachment metadata.
 * The first text/plain and the first text/html part win.
 */
public final class MimeContentParser {

    private MimeContentParser() {}

    @Value
    public static class MimeContent {
        String text;
        String html;
        List<Attachment> attachments;
    }

    public static MimeContent parse(Part root) throws MessagingException, IOException {
        Collector collector = new Collector();
        collector.visit(root);
        return new MimeContent(collector.text, collector.html, List.copyOf(collector.attachments));
    }

    private static final class Collector {
        private String text;
        private String html;
        private final List<Attachment> attachments = new ArrayList<>();

        void visit(Part part) throws MessagingException, IOException {
            if (isAttachment(part)) {
                attachments.add(new Attachment(filename(part), baseType(part), part.getSize()));
            } else if (part.isMimeType("multipart/*")) {
                Multipart multipart = (Multipart) part.getContent();
                for (int i = 0; i < multipart.getCount(); i++) {
                    BodyPart child = multipart.getBodyPart(i);
                    visit(child);
                }
            } else if (part.isMimeType("text/plain") && text == null) {
                text = String.valueOf(part.getContent());
            } else if (part.isMimeType("text/html") && html == null) {
                html = String.valueOf(part.getContent());
            }
        }

        private static boolean isAttachment(Part part) throws MessagingException {
            if (Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())) {
                return true;
            }
            if (part.isMimeType("multipart/*")) {
                return false;
            }
            return part.getFileName() != null || part.isMimeType("message/rfc822");
        }

        private static String filename(Part part) throws MessagingException {
            String name = part.getFileName();
            if (name == null) {
                return "unnamed";
            }
            try {
                return MimeUtility.decodeText(name);
            } catch (UnsupportedEncodingException e) {
                return name;
            }
        }

        private static String baseType(Part part) throws MessagingException {
            String raw = part.getContentType();
            if (raw == null) {
                return "application/octet-stream";
            }
            try {
                return new ContentType(raw).getBaseType().toLowerCase(Locale.ROOT);
            } catch (ParseException e) {
                return raw.toLowerCase(Locale.ROOT);
            }
        }
    }
}
