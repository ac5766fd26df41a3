package com.accessgate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.auth.application.JwtTokenService.DecodedToken;
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String REASON_LOGOUT = "logout";
    private static final int RESET_TOKEN_BYTES = 32;
    private static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";

    private final PrincipalRepository principalRepository;
    private final PasswordResetTokenRepository passwordResetTokenRepository;
    private final JwtTokenService jwtTokenService;
    private final TokenRevocationService revocationService;
    private final InvitationTokenGateway invitationTokenGateway;
    private final EmailSender emailSender;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final RegistrationMode registrationMode;
    private final Set<String> allowedDomains;
    private final Duration passwordResetTtl;
    private final String frontendUrl;

    public AuthService(
            PrincipalRepository principalRepository,
            PasswordResetTokenRepository passwordResetTokenRepository,
            JwtTokenService jwtTokenService,
            TokenRevocationService revocationService,
            InvitationTokenGateway invitationTokenGateway,
            EmailSender emailSender,
            PasswordEncoder passwordEncoder,
            Clock clock,
            @Value("${app.registration.mode:PUBLIC}") RegistrationMode registrationMode,
            @Value("${app.registration.allowed-domains:}") String allowedDomains,
            @Value("${app.password-reset.ttl:30m}") Duration passwordResetTtl,
            @Value("${app.frontend-url:http://localhost:3000}") String frontendUrl
    ) {
        this.principalRepository = principalRepository;
        this.passwordResetTokenRepository = passwordResetTokenRepository;
        this.jwtTokenService = jwtTokenService;
        this.revocationService = revocationService;
        this.invitationTokenGateway = invitationTokenGateway;
        this.emailSender = emailSender;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.registrationMode = registrationMode;
        this.allowedDomains = Arrays.stream(allowedDomains.split(","))
                .map(String::trim)
                .filter(domain -> !domain.isEmpty())
                .map(domain -> domain.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.passwordResetTtl = passwordResetTtl;
        this.frontendUrl = frontendUrl;
    }

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        Principal principal = principalRepository.findWithRolesByEmailIgnoreCase(request.email())
                .filter(Principal::isActive)
                .orElseThrow(() -> ProblemException.unauthorized(INVALID_CREDENTIALS, "Invalid credentials"));

        if (!passwordEncoder.matches(request.password(), principal.getPasswordHash())) {
            throw ProblemException.unauthorized(INVALID_CREDENTIALS, "Invalid credentials");
        }

        TokenPairResponse tokens = TokenPairResponse.from(jwtTokenService.issueTokenPair(principal));
        log.info("Principal {} logged in", principal.getExternalId());
        return new LoginResponse(tokens, PrincipalProfileResponse.from(principal));
    }

    public PrincipalProfileResponse register(RegisterRequest request) {
        if (registrationMode == RegistrationMode.CLOSED) {
            throw ProblemException.forbidden("REGISTRATION_CLOSED", "Registration is closed");
        }
        if (registrationMode == RegistrationMode.INVITATION) {
            if (request.invitationToken() == null || request.invitationToken().isBlank()) {
                throw ProblemException.badRequest("INVITATION_REQUIRED", "Invitation token required");
            }
            if (!invitationTokenGateway.validate(request.invitationToken())) {
                throw ProblemException.badRequest("INVALID_INVITATION", "Invalid or expired invitation token");
            }
        }
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        if (registrationMode == RegistrationMode.DOMAIN_WHITELIST && !allowedDomains.contains(domainOf(email))) {
            throw ProblemException.badRequest("EMAIL_DOMAIN_NOT_ALLOWED", "Email domain not allowed");
        }
        if (principalRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "Email is already registered");
        }

        Principal principal = new Principal();
        principal.setEmail(email);
        principal.setFirstName(request.firstName().trim());
        principal.setLastName(request.lastName().trim());
        principal.setPasswordHash(passwordEncoder.encode(request.password()));
        Principal saved = principalRepository.save(principal);

        if (registrationMode == RegistrationMode.INVITATION
                && !invitationTokenGateway.consume(request.invitationToken(), saved)) {
            throw ProblemException.badRequest("INVALID_INVITATION", "Failed to use invitation token");
        }

        log.info("Registered principal {} (mode={})", saved.getExternalId(), registrationMode);
        return PrincipalProfileResponse.from(saved);
    }

    /**
     * Issues a fresh pair. The presented refresh token stays valid until it expires or is logged out.
     */
    @Transactional(readOnly = true)
    public TokenPairResponse refresh(String refreshToken) {
        VerifiedToken verified = jwtTokenService.verify(refreshToken, TokenType.REFRESH);
        Principal principal = principalRepository.findWithRolesByExternalId(verified.principalId())
                .filter(Principal::isActive)
                .orElseThrow(() -> ProblemException.unauthorized("INVALID_REFRESH_TOKEN", "Invalid refresh token"));
        return TokenPairResponse.from(jwtTokenService.issueTokenPair(principal));
    }

    /**
     * Blacklists the access token and, when it can be decoded, the refresh token. Signatures are not checked.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public void logout(LogoutRequest request) {
        DecodedToken access = jwtTokenService.decode(request.accessToken());
        revokeQuietly(request.accessToken(), access);

        if (request.refreshToken() != null && !request.refreshToken().isBlank()) {
            jwtTokenService.tryDecode(request.refreshToken())
                    .ifPresent(refresh -> revokeQuietly(request.refreshToken(), refresh));
        }
    }

    /**
     * Always completes normally so callers cannot tell whether the address is registered.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public void forgotPassword(String email) {
        try {
            principalRepository.findByEmailIgnoreCase(email.trim())
                    .filter(Principal::isActive)
                    .ifPresent(this::sendResetLink);
        } catch (RuntimeException ex) {
            log.warn("Password reset request could not be completed", ex);
        }
    }

    public boolean resetPassword(String token, String newPassword) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return passwordResetTokenRepository.findWithPrincipalByToken(token)
                .filter(resetToken -> resetToken.isUsable(now))
                .map(resetToken -> {
                    Principal principal = resetToken.getPrincipal();
                    principal.setPasswordHash(passwordEncoder.encode(newPassword));
                    resetToken.markUsed(now);
                    log.info("Password reset for principal {}", principal.getExternalId());
                    return true;
                })
                .orElse(false);
    }

    private void sendResetLink(Principal principal) {
        String token = TokenDigests.randomHex(RESET_TOKEN_BYTES);
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plus(passwordResetTtl);
        passwordResetTokenRepository.save(new PasswordResetToken(token, principal, expiresAt));

        String link = frontendUrl + "/reset-password?token=" + token;
        String text = "Hello " + principal.getFirstName() + ",\n\n"
                + "Use the link below to reset your password. It expires in "
                + passwordResetTtl.toMinutes() + " minutes.\n\n" + link + "\n";
        String html = "<p>Hello " + principal.getFirstName() + ",</p>"
                + "<p>Use the link below to reset your password. It expires in "
                + passwordResetTtl.toMinutes() + " minutes.</p>"
                + "<p><a href=\"" + link + "\">Reset password</a></p>";
        emailSender.send(principal.getEmail(), "Reset your password", html, text);
        log.info("Password reset link issued for principal {}", principal.getExternalId());
    }

    private void revokeQuietly(String token, DecodedToken decoded) {
        try {
            revocationService.revoke(token, decoded.subject(), decoded.expiresAt(), REASON_LOGOUT);
        } catch (DataIntegrityViolationException ex) {
            log.debug("Token for subject {} was revoked concurrently", decoded.subject());
        }
    }

    private static String domainOf(String email) {
        int at = email.lastIndexOf('@');
        return at < 0 ? "" : email.substring(at + 1);
    }
}
