package com.mailreactor.controller;

import com.mailreactor.domain.AccountCredentials;
import com.mailreactor.domain.ProviderProfile;
import com.mailreactor.domain.SecretType;
import com.mailreactor.error.GatewayErrorKind;
import com.mailreactor.error.GatewayException;
import com.mailreactor.provider.KnownProviders;
import com.mailreactor.service.GatewayService;
import com.mailreactor.session.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Account REST API tests
 */
@ExtendWith(MockitoExtension.class)
class AccountControllerTest {

    @Mock
    private GatewayService gatewayService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AccountController(gatewayService))
                .setControllerAdvice(new GatewayExceptionHandler())
                .build();
    }

    private static AccountCredentials gmailAccount() {
        ProviderProfile gmail = KnownProviders.byId("gmail").orElseThrow();
        return AccountCredentials.builder().email("user@gmail.com").secret("app-password").profile(gmail).build();
    }

    @Test
    @DisplayName("POST /api/accounts: 201 with provider settings, never the secret")
    void testAddAccount_Created() throws Exception {
        when(gatewayService.addAccount(any())).thenReturn(gmailAccount());

        mockMvc.perform(post("/api/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"user@gmail.com\",\"secret\":\"app-password\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.email").value("user@gmail.com"))
                .andExpect(jsonPath("$.provider").value("gmail"))
                .andExpect(jsonPath("$.imap.host").value("imap.gmail.com"))
                .andExpect(content().string(not(containsString("app-password"))));

        ArgumentCaptor<AccountCredentials> captor = ArgumentCaptor.forClass(AccountCredentials.class);
        verify(gatewayService).addAccount(captor.capture());
        assertThat(captor.getValue().getSecretType()).isEqualTo(SecretType.PASSWORD);
        assertThat(captor.getValue().getProfile()).isNull();
    }

    @Test
    @DisplayName("POST /api/accounts with explicit server settings passes them on")
    void testAddAccount_ExplicitSettings() throws Exception {
        when(gatewayService.addAccount(any())).thenReturn(gmailAccount());

        mockMvc.perform(post("/api/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"me@corp.test\",\"secret\":\"x\",\"imapHost\":\"mail.corp.test\","
                                + "\"imapPort\":143,\"imapTls\":\"starttls\",\"smtpHost\":\"mail.corp.test\"}"))
                .andExpect(status().isCreated());

        ArgumentCaptor<AccountCredentials> captor = ArgumentCaptor.forClass(AccountCredentials.class);
        verify(gatewayService).addAccount(captor.capture());
        ProviderProfile profile = captor.getValue().getProfile();
        assertThat(profile.getImap().getPort()).isEqualTo(143);
        assertThat(profile.getImap().getTls().name()).isEqualTo("STARTTLS");
        assertThat(profile.getSmtp().getPort()).isEqualTo(587);
    }

    @Test
    @DisplayName("POST /api/accounts without secret: 400")
    void testAddAccount_MissingSecret() throws Exception {
        mockMvc.perform(post("/api/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"user@gmail.com\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("secret is required."));
    }

    @Test
    @DisplayName("Rejected credentials: 401 AUTHENTICATION")
    void testAddAccount_AuthFailed() throws Exception {
        when(gatewayService.addAccount(any())).thenThrow(new GatewayException(
                GatewayErrorKind.AUTHENTICATION, "user@gmail.com", "Authentication failed: invalid credentials"));

        mockMvc.perform(post("/api/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"user@gmail.com\",\"secret\":\"wrong\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("AUTHENTICATION"));
    }

    @Test
    @DisplayName("DELETE /api/accounts/{email}: 200 even when unknown")
    void testRemoveAccount() throws Exception {
        mockMvc.perform(delete("/api/accounts/user@gmail.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

        verify(gatewayService).removeAccount("user@gmail.com");
    }

    @Test
    @DisplayName("GET /api/accounts lists accounts without secrets")
    void testListAccounts() throws Exception {
        when(gatewayService.listAccounts()).thenReturn(List.of(gmailAccount()));

        mockMvc.perform(get("/api/accounts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.accounts[0].email").value("user@gmail.com"))
                .andExpect(content().string(not(containsString("app-password"))));
    }

    @Test
    @DisplayName("GET /api/accounts/{email}/status of an unknown account: 404")
    void testStatus_Unknown() throws Exception {
        when(gatewayService.sessionState("nobody@gmail.com"))
                .thenThrow(GatewayException.noSuchAccount("nobody@gmail.com"));

        mockMvc.perform(get("/api/accounts/nobody@gmail.com/status"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /api/accounts/{email}/status reports the session state")
    void testStatus() throws Exception {
        when(gatewayService.sessionState("user@gmail.com")).thenReturn(SessionState.READY);

        mockMvc.perform(get("/api/accounts/user@gmail.com/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session").value("READY"));
    }
}
