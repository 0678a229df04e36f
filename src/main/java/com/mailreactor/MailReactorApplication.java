package com.mailreactor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Mail Reactor gateway
 *
 * Exposes IMAP/SMTP mail accounts through a REST API
 * - One persistent IMAP session per account, serialized access
 * - Per-send SMTP submission
 * - Known provider profiles (Gmail, Outlook, Yahoo, ...)
 * - Jakarta Mail protocol client
 * - Reactor (Reactive) timeouts
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@EnableScheduling
public class MailReactorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailReactorApplication.class, args);
    }
}
