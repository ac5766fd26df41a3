package com.accessgate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.auth.application.JwtTokenService.DecodedToken;
import com.accessgate.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.accessgate.backend.modules.auth.application.JwtTokenService.TokenPair;
import com.accessgate.backend.modules.auth.application.JwtTokenService.VerifiedToken;
import com.accessgate.backend.modules.auth.domain.PasswordResetToken;
import com.accessgate.backend.modules.auth.domain.RegistrationMode;
import com.accessgate.backend.modules.auth.domain.TokenType;
import com.accessgate.backend.modules.auth.infrastructure.persistence.PasswordResetTokenRepository;
import com.accessgate.backend.modules.auth.presentation.dto.LoginRequest;
import com.accessgate.backend.modules.auth.presentation.dto.LoginResponse;
import com.accessgate.backend.modules.auth.presentation.dto.LogoutRequest;
import com.accessgate.backend.modules.auth.presentation.dto.RegisterRequest;
import com.accessgate.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.accessgate.backend.modules.principal.domain.Principal;
import com.accessgate.backend.modules.principal.infrastructure.persistence.PrincipalRepository;
import com.accessgate.backend.modules.principal.presentation.dto.PrincipalProfileResponse;
import com.accessgate.backend.support.TestPrincipals;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private PrincipalRepository principalRepository;

    @Mock
    private PasswordResetTokenRepository passwordResetTokenRepository;

    @Mock
    private JwtTokenService jwtTokenService;

    @Mock
    private TokenRevocationService revocationService;

    @Mock
    private InvitationTokenGateway invitationTokenGateway;

    @Mock
    private EmailSender emailSender;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Test
    void loginIssuesTokenPair() {
        Principal principal = TestPrincipals.principal("admin@example.com", "ADMIN");
        when(principalRepository.findWithRolesByEmailIgnoreCase("admin@example.com")).thenReturn(Optional.of(principal));
        when(passwordEncoder.matches("secret-pass", principal.getPasswordHash())).thenReturn(true);
        when(jwtTokenService.issueTokenPair(principal)).thenReturn(new TokenPair(
                new IssuedToken("access", OffsetDateTime.now(CLOCK).plusMinutes(15), 900),
                new IssuedToken("refresh", OffsetDateTime.now(CLOCK).plusDays(7), 604800)));

        LoginResponse response = service(RegistrationMode.PUBLIC, "")
                .login(new LoginRequest("admin@example.com", "secret-pass"));

        assertThat(response.tokens().accessToken()).isEqualTo("access");
        assertThat(response.tokens().tokenType()).isEqualTo("Bearer");
        assertThat(response.tokens().refreshToken()).isEqualTo("refresh");
        assertThat(response.user().roles()).containsExactly("ADMIN");
    }

    @Test
    void refreshIssuesNewPairWithoutRevokingPresentedToken() {
        Principal principal = TestPrincipals.principal("admin@example.com", "ADMIN");
        when(jwtTokenService.verify("old-refresh", TokenType.REFRESH)).thenReturn(new VerifiedToken(
                principal.getExternalId(), TokenType.REFRESH, null, List.of(), OffsetDateTime.now(CLOCK).plusDays(7)));
        when(principalRepository.findWithRolesByExternalId(principal.getExternalId())).thenReturn(Optional.of(principal));
        when(jwtTokenService.issueTokenPair(principal)).thenReturn(new TokenPair(
                new IssuedToken("new-access", OffsetDateTime.now(CLOCK).plusMinutes(15), 900),
                new IssuedToken("new-refresh", OffsetDateTime.now(CLOCK).plusDays(7), 604800)));

        TokenPairResponse response = service(RegistrationMode.PUBLIC, "").refresh("old-refresh");

        assertThat(response.refreshToken()).isEqualTo("new-refresh");
        verifyNoInteractions(revocationService);
    }

    @Test
    void loginDoesNotRevealWhichCheckFailed() {
        Principal principal = TestPrincipals.principal("admin@example.com");
        when(principalRepository.findWithRolesByEmailIgnoreCase("admin@example.com")).thenReturn(Optional.of(principal));
        when(principalRepository.findWithRolesByEmailIgnoreCase("nobody@example.com")).thenReturn(Optional.empty());
        when(passwordEncoder.matches("wrong", principal.getPasswordHash())).thenReturn(false);
        AuthService authService = service(RegistrationMode.PUBLIC, "");

        assertInvalidCredentials(authService, new LoginRequest("admin@example.com", "wrong"));
        assertInvalidCredentials(authService, new LoginRequest("nobody@example.com", "wrong"));
        verify(jwtTokenService, never()).issueTokenPair(any());
    }

    @Test
    void inactivePrincipalCannotLogIn() {
        Principal principal = TestPrincipals.principal("old@example.com");
        principal.setActive(false);
        when(principalRepository.findWithRolesByEmailIgnoreCase("old@example.com")).thenReturn(Optional.of(principal));

        assertInvalidCredentials(service(RegistrationMode.PUBLIC, ""), new LoginRequest("old@example.com", "pw"));
        verify(passwordEncoder, never()).matches(anyString(), anyString());
    }

    @Test
    void publicRegistrationStoresNormalizedEmail() {
        when(passwordEncoder.encode("password1")).thenReturn("hashed");
        when(principalRepository.save(any(Principal.class))).thenAnswer(invocation -> invocation.getArgument(0));

        PrincipalProfileResponse profile = service(RegistrationMode.PUBLIC, "")
                .register(new RegisterRequest(" New.User@Example.com ", "password1", "New", "User", null));

        assertThat(profile.email()).isEqualTo("new.user@example.com");
        assertThat(profile.roles()).isEmpty();
        ArgumentCaptor<Principal> captor = ArgumentCaptor.forClass(Principal.class);
        verify(principalRepository).save(captor.capture());
        assertThat(captor.getValue().getPasswordHash()).isEqualTo("hashed");
    }

    @Test
    void duplicateEmailIsConflict() {
        when(principalRepository.existsByEmailIgnoreCase("taken@example.com")).thenReturn(true);

        assertThatThrownBy(() -> service(RegistrationMode.PUBLIC, "")
                .register(new RegisterRequest("taken@example.com", "password1", "A", "B", null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("EMAIL_ALREADY_REGISTERED");
                });
    }

    @Test
    void closedRegistrationIsForbidden() {
        assertThatThrownBy(() -> service(RegistrationMode.CLOSED, "")
                .register(new RegisterRequest("a@example.com", "password1", "A", "B", null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));
    }

    @Test
    void invitationModeRequiresValidInvitation() {
        AuthService authService = service(RegistrationMode.INVITATION, "");
        when(invitationTokenGateway.validate("expired")).thenReturn(false);

        assertThatThrownBy(() -> authService.register(new RegisterRequest("a@example.com", "password1", "A", "B", " ")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVITATION_REQUIRED"));
        assertThatThrownBy(() -> authService.register(new RegisterRequest("a@example.com", "password1", "A", "B", "expired")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVALID_INVITATION"));
    }

    @Test
    void invitationIsConsumedByNewPrincipal() {
        when(invitationTokenGateway.validate("invite")).thenReturn(true);
        when(passwordEncoder.encode("password1")).thenReturn("hashed");
        when(principalRepository.save(any(Principal.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(invitationTokenGateway.consume(eq("invite"), any(Principal.class))).thenReturn(true);

        service(RegistrationMode.INVITATION, "")
                .register(new RegisterRequest("a@example.com", "password1", "A", "B", "invite"));

        verify(invitationTokenGateway).consume(eq("invite"), any(Principal.class));
    }

    @Test
    void domainWhitelistRejectsOtherDomains() {
        AuthService authService = service(RegistrationMode.DOMAIN_WHITELIST, "example.com, corp.example.org");

        assertThatThrownBy(() -> authService.register(new RegisterRequest("a@gmail.com", "password1", "A", "B", null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("EMAIL_DOMAIN_NOT_ALLOWED"));
    }

    @Test
    void domainWhitelistAcceptsListedDomain() {
        when(passwordEncoder.encode("password1")).thenReturn("hashed");
        when(principalRepository.save(any(Principal.class))).thenAnswer(invocation -> invocation.getArgument(0));

        PrincipalProfileResponse profile = service(RegistrationMode.DOMAIN_WHITELIST, "example.com, corp.example.org")
                .register(new RegisterRequest("a@Corp.Example.org", "password1", "A", "B", null));

        assertThat(profile.email()).isEqualTo("a@corp.example.org");
    }

    @Test
    void logoutRevokesBothTokens() {
        OffsetDateTime accessExpiry = OffsetDateTime.now(CLOCK).plusMinutes(15);
        OffsetDateTime refreshExpiry = OffsetDateTime.now(CLOCK).plusDays(7);
        when(jwtTokenService.decode("access")).thenReturn(new DecodedToken("subject-1", accessExpiry));
        when(jwtTokenService.tryDecode("refresh")).thenReturn(Optional.of(new DecodedToken("subject-1", refreshExpiry)));

        service(RegistrationMode.PUBLIC, "").logout(new LogoutRequest("access", "refresh"));

        verify(revocationService).revoke("access", "subject-1", accessExpiry, "logout");
        verify(revocationService).revoke("refresh", "subject-1", refreshExpiry, "logout");
    }

    @Test
    void logoutSkipsUndecodableRefreshToken() {
        OffsetDateTime accessExpiry = OffsetDateTime.now(CLOCK).plusMinutes(15);
        when(jwtTokenService.decode("access")).thenReturn(new DecodedToken("subject-1", accessExpiry));
        when(jwtTokenService.tryDecode("junk")).thenReturn(Optional.empty());

        service(RegistrationMode.PUBLIC, "").logout(new LogoutRequest("access", "junk"));

        verify(revocationService).revoke("access", "subject-1", accessExpiry, "logout");
        verify(revocationService, never()).revoke(eq("junk"), anyString(), any(), anyString());
    }

    @Test
    void concurrentRevocationIsTolerated() {
        OffsetDateTime accessExpiry = OffsetDateTime.now(CLOCK).plusMinutes(15);
        when(jwtTokenService.decode("access")).thenReturn(new DecodedToken("subject-1", accessExpiry));
        doThrow(new DataIntegrityViolationException("duplicate"))
                .when(revocationService).revoke("access", "subject-1", accessExpiry, "logout");

        assertThatCode(() -> service(RegistrationMode.PUBLIC, "").logout(new LogoutRequest("access", null)))
                .doesNotThrowAnyException();
    }

    @Test
    void forgotPasswordSendsResetLink() {
        Principal principal = TestPrincipals.principal("user@example.com");
        when(principalRepository.findByEmailIgnoreCase("user@example.com")).thenReturn(Optional.of(principal));

        service(RegistrationMode.PUBLIC, "").forgotPassword(" user@example.com ");

        ArgumentCaptor<PasswordResetToken> token = ArgumentCaptor.forClass(PasswordResetToken.class);
        verify(passwordResetTokenRepository).save(token.capture());
        assertThat(token.getValue().getToken()).hasSize(64);
        assertThat(token.getValue().getExpiresAt()).isEqualTo(OffsetDateTime.now(CLOCK).plusMinutes(30));

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(emailSender).send(eq("user@example.com"), anyString(), anyString(), text.capture());
        assertThat(text.getValue()).contains("https://app.example.com/reset-password?token=" + token.getValue().getToken());
    }

    @Test
    void forgotPasswordIsSilentForUnknownEmailAndMailFailures() {
        Principal principal = TestPrincipals.principal("user@example.com");
        when(principalRepository.findByEmailIgnoreCase("user@example.com")).thenReturn(Optional.of(principal));
        when(principalRepository.findByEmailIgnoreCase("nobody@example.com")).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("smtp down"))
                .when(emailSender).send(anyString(), anyString(), anyString(), anyString());
        AuthService authService = service(RegistrationMode.PUBLIC, "");

        assertThatCode(() -> authService.forgotPassword("nobody@example.com")).doesNotThrowAnyException();
        assertThatCode(() -> authService.forgotPassword("user@example.com")).doesNotThrowAnyException();
    }

    @Test
    void resetPasswordConsumesToken() {
        Principal principal = TestPrincipals.principal("user@example.com");
        PasswordResetToken token = new PasswordResetToken("abc", principal, OffsetDateTime.now(CLOCK).plusMinutes(5));
        when(passwordResetTokenRepository.findWithPrincipalByToken("abc")).thenReturn(Optional.of(token));
        when(passwordEncoder.encode("new-password")).thenReturn("new-hash");
        AuthService authService = service(RegistrationMode.PUBLIC, "");

        assertThat(authService.resetPassword("abc", "new-password")).isTrue();
        assertThat(principal.getPasswordHash()).isEqualTo("new-hash");
        assertThat(token.isUsed()).isTrue();

        assertThat(authService.resetPassword("abc", "another-password")).isFalse();
    }

    @Test
    void expiredResetTokenIsRejected() {
        Principal principal = TestPrincipals.principal("user@example.com");
        PasswordResetToken token = new PasswordResetToken("abc", principal, OffsetDateTime.now(CLOCK).minusSeconds(1));
        when(passwordResetTokenRepository.findWithPrincipalByToken("abc")).thenReturn(Optional.of(token));

        assertThat(service(RegistrationMode.PUBLIC, "").resetPassword("abc", "new-password")).isFalse();
        verify(passwordEncoder, never()).encode(anyString());
    }

    private AuthService service(RegistrationMode mode, String allowedDomains) {
        return new AuthService(principalRepository, passwordResetTokenRepository, jwtTokenService, revocationService,
                invitationTokenGateway, emailSender, passwordEncoder, CLOCK, mode, allowedDomains,
                Duration.ofMinutes(30), "https://app.example.com");
    }

    private static void assertInvalidCredentials(AuthService authService, LoginRequest request) {
        assertThatThrownBy(() -> authService.login(request))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
                    assertThat(ex.getCode()).isEqualTo("INVALID_CREDENTIALS");
                });
    }
}
