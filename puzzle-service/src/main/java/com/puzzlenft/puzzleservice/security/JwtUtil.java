package com.puzzlenft.puzzleservice.security;

import com.puzzlenft.puzzleservice.model.Identity;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Reads the caller's identity out of a signed bearer token
 */
@Component
public class JwtUtil {

    public static final String IDENTITY_CLAIM = "identity";

    private final SecretKey secretKey;

    public JwtUtil(@Value("${jwt.secret}") String secret) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Extract the identity from a token
     *
     * @throws JwtException if the token is not valid or carries no usable identity
     */
    public Identity extractIdentity(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();

        Object identity = claims.get(IDENTITY_CLAIM);
        if (!(identity instanceof String)) {
            throw new JwtException("Missing " + IDENTITY_CLAIM + " claim in token");
        }
        try {
            return Identity.fromHex((String) identity);
        } catch (IllegalArgumentException e) {
            throw new JwtException("Invalid " + IDENTITY_CLAIM + " claim in token", e);
        }
    }

    /**
     * Identity from an {@code Authorization: Bearer <token>} header value
     */
    public Identity extractIdentityFromHeader(String authHeader) {
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            throw new JwtException("Invalid authorization header");
        }
        return extractIdentity(authHeader.substring(7));
    }

    /**
     * Issue a token for an identity. Used by operators and tests; the service itself only reads tokens.
     */
    public String issueToken(Identity identity) {
        return Jwts.builder()
                .claim(IDENTITY_CLAIM, identity.toHex())
                .signWith(secretKey)
                .compact();
    }
}
