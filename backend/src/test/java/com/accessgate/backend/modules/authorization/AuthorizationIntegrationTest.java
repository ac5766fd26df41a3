package com.accessgate.backend.modules.authorization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.accessgate.backend.modules.role.domain.Role;
import com.accessgate.backend.support.AbstractPostgresIntegrationTest;
import com.accessgate.backend.support.TestAccounts;
import com.accessgate.backend.support.TestAccounts.Account;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AuthorizationIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestAccounts testAccounts;

    @Test
    void grantedRoleCanListUsers() throws Exception {
        Account account = testAccounts.register();
        Role role = testAccounts.createRole("DIRECTORY");
        testAccounts.grant(role, "GET", "/users", "users:list");
        testAccounts.assign(account, role);

        String accessToken = login(account).path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/api/v1/users").param("search", account.email())
                        .header(HttpHeaders.AUTHORIZATION, bearer(accessToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(1))
                .andExpect(jsonPath("$.items[0].email").value(account.email()));
    }

    @Test
    void roleWithoutGrantIsForbidden() throws Exception {
        Account account = testAccounts.register();
        Role role = testAccounts.createRole("VIEWER");
        testAccounts.assign(account, role);

        String accessToken = login(account).path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/api/v1/users").header(HttpHeaders.AUTHORIZATION, bearer(accessToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/v1/users"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    void malformedTokenIsUnauthorizedNotForbidden() throws Exception {
        mockMvc.perform(get("/api/v1/users").header(HttpHeaders.AUTHORIZATION, bearer("not.a.token")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_TOKEN"));
    }

    @Test
    void profileNeedsAuthenticationOnly() throws Exception {
        Account account = testAccounts.register();
        String accessToken = login(account).path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/api/v1/users/profile").header(HttpHeaders.AUTHORIZATION, bearer(accessToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(account.id().toString()))
                .andExpect(jsonPath("$.roles").isEmpty());
    }

    @Test
    void removingRoleInvalidatesIssuedAccessToken() throws Exception {
        Account account = testAccounts.register();
        Role role = testAccounts.createRole("DIRECTORY");
        testAccounts.grant(role, "GET", "/users", "users:list");
        testAccounts.assign(account, role);
        String accessToken = login(account).path("tokens").path("accessToken").asText();

        testAccounts.unassign(account, role);

        mockMvc.perform(get("/api/v1/users/profile").header(HttpHeaders.AUTHORIZATION, bearer(accessToken)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("ROLES_CHANGED"));
    }

    @Test
    void logoutRevokesBothTokens() throws Exception {
        Account account = testAccounts.register();
        JsonNode tokens = login(account).path("tokens");
        String accessToken = tokens.path("accessToken").asText();
        String refreshToken = tokens.path("refreshToken").asText();

        mockMvc.perform(post("/api/v1/auth/logout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "accessToken": "%s",
                                  "refreshToken": "%s"
                                }
                                """.formatted(accessToken, refreshToken)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/users/profile").header(HttpHeaders.AUTHORIZATION, bearer(accessToken)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TOKEN_REVOKED"));

        mockMvc.perform(post("/api/v1/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\": \"%s\"}".formatted(refreshToken)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void refreshIssuesNewPair() throws Exception {
        Account account = testAccounts.register();
        JsonNode tokens = login(account).path("tokens");
        String refreshToken = tokens.path("refreshToken").asText();

        MvcResult result = mockMvc.perform(post("/api/v1/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\": \"%s\"}".formatted(refreshToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokenType").value("Bearer"))
                .andReturn();

        JsonNode refreshed = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(refreshed.path("accessToken").asText()).isNotEqualTo(tokens.path("accessToken").asText());
    }

    @Test
    @DisplayName("the presented refresh token keeps working after a refresh")
    void refreshRotationIsAdditive() throws Exception {
        Account account = testAccounts.register();
        String refreshToken = login(account).path("tokens").path("refreshToken").asText();

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/v1/auth/refresh")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"refreshToken\": \"%s\"}".formatted(refreshToken)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.refreshToken").isNotEmpty());
        }
    }

    @Test
    void accessTokenCannotBeUsedToRefresh() throws Exception {
        Account account = testAccounts.register();
        String accessToken = login(account).path("tokens").path("accessToken").asText();

        mockMvc.perform(post("/api/v1/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\": \"%s\"}".formatted(accessToken)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_TOKEN_TYPE"));
    }

    private JsonNode login(Account account) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "%s",
                                  "password": "%s"
                                }
                                """.formatted(account.email(), TestAccounts.PASSWORD)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens.accessToken").isNotEmpty())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }
}
