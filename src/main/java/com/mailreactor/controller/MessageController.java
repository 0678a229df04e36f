package com.mailreactor.controller;

import com.mailreactor.config.GatewayProperties;
import com.mailreactor.domain.ComposedMessage;
import com.mailreactor.domain.MessageBody;
import com.mailreactor.domain.MessageQuery;
import com.mailreactor.domain.MessageSummary;
import com.mailreactor.service.GatewayService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mailbox REST API
 * - List/search messages (GET /api/accounts/{email}/messages)
 * - Get message (GET /api/accounts/{email}/messages/{uid})
 * - Send message (POST /api/accounts/{email}/messages)
 */
@Slf4j
@RestController
@RequestMapping("/api/accounts/{email}/messages")
@RequiredArgsConstructor
public class MessageController {

    private final GatewayService gatewayService;
    private final GatewayProperties properties;

    /**
     * List messages
     * GET /api/accounts/{email}/messages?folder=INBOX&unseen=true&from=alice&since=2024-01-31&limit=20
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listMessages(
            @PathVariable String email,
            @RequestParam(value = "folder", required = false) String folder,
            @RequestParam(value = "unseen", defaultValue = "false") boolean unseen,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "since", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate since,
            @RequestParam(value = "limit", required = false) Integer limit) {
        MessageQuery query = MessageQuery.builder()
                .folder(folder != null ? folder : MessageQuery.INBOX)
                .unseenOnly(unseen)
                .from(from)
                .since(since)
                .maxResults(limit != null ? limit : properties.getQuery().getDefaultMaxResults())
                .build();
        List<MessageSummary> messages = gatewayService.listMessages(email, query);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("folder", query.getFolder());
        response.put("count", messages.size());
        response.put("messages", messages);
        return ResponseEntity.ok(response);
    }

    /**
     * Get message
     * GET /api/accounts/{email}/messages/{uid}?folder=INBOX
     */
    @GetMapping("/{uid}")
    public ResponseEntity<Map<String, Object>> getMessage(
            @PathVariable String email,
            @PathVariable long uid,
            @RequestParam(value = "folder", required = false) String folder) {
        MessageBody body = gatewayService.getMessage(email, folder, uid);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", body);
        return ResponseEntity.ok(response);
    }

    /**
     * Send message
     * POST /api/accounts/{email}/messages
     * Body: { "to": ["bob@example.com"], "cc": [], "bcc": [], "subject": "Hi", "text": "...", "html": "..." }
     *   or: { "raw": "From: ...\r\n...", "to": [...optional extra envelope recipients] }
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> sendMessage(@PathVariable String email,
                                                           @RequestBody Map<String, Object> request) {
        ComposedMessage message = ComposedMessage.builder()
                .from(RequestValues.string(request, "from"))
                .to(RequestValues.addresses(request, "to"))
                .cc(RequestValues.addresses(request, "cc"))
                .bcc(RequestValues.addresses(request, "bcc"))
                .subject(RequestValues.string(request, "subject"))
                .textBody(RequestValues.content(request, "text"))
                .htmlBody(RequestValues.content(request, "html"))
                .rawMessage(RequestValues.content(request, "raw"))
                .build();
        String messageId = gatewayService.sendMessage(email, message);
        log.info("Message sent via API for {}: {}", email, messageId);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Message accepted for delivery.");
        response.put("messageId", messageId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}
