package com.facilitydesk.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.facilitydesk.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.SecurityException;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Mints and verifies signed tokens. Verification never consults the session registry.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_ID = "id";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TYPE = "typ";
    private static final String TYPE_ACCESS = "access";
    private static final String TYPE_REFRESH = "refresh";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final long rememberMeTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:86400000}") long accessTokenTtlMillis,
            @Value("${jwt.remember-me-expiration:604800000}") long rememberMeTtlMillis,
            @Value("${jwt.refresh-expiration:2592000000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.rememberMeTtlMillis = rememberMeTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
    }

    public TokenPairResponse issueTokenPair(FacilityUser user, boolean rememberMe) {
        Instant now = clock.instant();
        long accessTtl = rememberMe ? rememberMeTtlMillis : accessTokenTtlMillis;

        String accessToken = issue(user, TYPE_ACCESS, now, accessTtl, tokenProvider.getSecretKey());
        String refreshToken = issue(user, TYPE_REFRESH, now, refreshTokenTtlMillis, tokenProvider.getRefreshKey());

        return TokenPairResponse.bearer(
                accessToken,
                Duration.ofMillis(accessTtl),
                refreshToken,
                Duration.ofMillis(refreshTokenTtlMillis),
                OffsetDateTime.ofInstant(now, clock.getZone()),
                rememberMe
        );
    }

    public ParsedToken parseAccessToken(String token) {
        return parse(token, tokenProvider.getSecretKey(), TYPE_ACCESS);
    }

    public ParsedToken parseRefreshToken(String token) {
        return parse(token, tokenProvider.getRefreshKey(), TYPE_REFRESH);
    }

    private String issue(FacilityUser user, String type, Instant now, long ttlMillis, SecretKey key) {
        return Jwts.builder()
                .subject(user.getId().toString())
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(ttlMillis)))
                .claim(CLAIM_ID, user.getId().toString())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLE, user.getRole().name())
                .claim(CLAIM_TYPE, type)
                .signWith(key, SIG.HS256)
                .compact();
    }

    private ParsedToken parse(String token, SecretKey key, String expectedType) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenVerificationException(TokenVerificationException.Reason.EXPIRED, "Token has expired", e);
        } catch (MalformedJwtException | SecurityException | UnsupportedJwtException | IllegalArgumentException e) {
            throw new TokenVerificationException(TokenVerificationException.Reason.INVALID, "Token is invalid", e);
        } catch (JwtException e) {
            throw new TokenVerificationException(TokenVerificationException.Reason.VERIFICATION_FAILED, "Token verification failed", e);
        }

        if (!expectedType.equals(claims.get(CLAIM_TYPE, String.class))) {
            throw new TokenVerificationException(TokenVerificationException.Reason.INVALID, "Unexpected token type", null);
        }
        if (claims.getSubject() == null) {
            throw new TokenVerificationException(TokenVerificationException.Reason.INVALID, "Token subject is missing", null);
        }
        try {
            UUID userId = UUID.fromString(claims.getSubject());
            UserRole role = UserRole.from(claims.get(CLAIM_ROLE, String.class));
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;
            return new ParsedToken(
                    userId,
                    claims.get(CLAIM_EMAIL, String.class),
                    role,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (IllegalArgumentException e) {
            throw new TokenVerificationException(TokenVerificationException.Reason.INVALID, "Token claims are invalid", e);
        }
    }

    public record ParsedToken(UUID userId, String email, UserRole role, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }
}
