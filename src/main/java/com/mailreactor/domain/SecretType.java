package com.mailreactor.domain;

/**
 * Kind of secret used to authenticate an account
 */
public enum SecretType {
    /** Password or app-specific password (LOGIN / PLAIN) */
    PASSWORD,
    /** OAuth 2.0 access token (SASL XOAUTH2) */
    OAUTH2_TOKEN
}
