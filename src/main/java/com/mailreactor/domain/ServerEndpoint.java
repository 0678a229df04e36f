package com.mailreactor.domain;

import lombok.Value;

/**
 * Host, port and transport security of one protocol endpoint
 */
@Value(staticConstructor = "of")
public class ServerEndpoint {

    String host;
    int port;
    TlsMode tls;
}
