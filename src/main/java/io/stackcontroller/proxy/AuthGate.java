package io.stackcontroller.proxy;

import com.google.common.hash.Hashing;
import lombok.extern.slf4j.Slf4j;

import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * HTTP Basic check in front of introspection paths (API docs, schema). The password is
 * configured as a SHA-256 hex digest and compared in constant time.
 */
@Slf4j
public class AuthGate {

    public static final String REALM = "stack-controller";

    private final List<String> protectedPrefixes;
    private final String username;
    private final byte[] passwordSha256;

    public AuthGate(List<String> protectedPrefixes, String username, String passwordSha256Hex) {
        this.protectedPrefixes = protectedPrefixes != null ? List.copyOf(protectedPrefixes) : List.of();
        this.username = username;
        this.passwordSha256 = passwordSha256Hex != null && !passwordSha256Hex.isBlank()
                ? HexFormat.of().parseHex(passwordSha256Hex.trim().toLowerCase())
                : null;
        if (!this.protectedPrefixes.isEmpty() && (username == null || this.passwordSha256 == null)) {
            log.warn("Protected prefixes {} configured without credentials, every request to them will be refused",
                    this.protectedPrefixes);
        }
    }

    public boolean requiresAuth(String path) {
        for (String prefix : protectedPrefixes) {
            if (path.equals(prefix) || path.startsWith(prefix.endsWith("/") ? prefix : prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    public boolean isAuthorized(String authorizationHeader) {
        if (username == null || passwordSha256 == null || authorizationHeader == null) {
            return false;
        }
        if (!authorizationHeader.regionMatches(true, 0, "Basic ", 0, 6)) {
            return false;
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(authorizationHeader.substring(6).trim()), UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Malformed basic credentials: {}", e.getMessage());
            return false;
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return false;
        }
        boolean userMatches = MessageDigest.isEqual(username.getBytes(UTF_8), decoded.substring(0, colon).getBytes(UTF_8));
        byte[] offered = Hashing.sha256().hashString(decoded.substring(colon + 1), UTF_8).asBytes();
        boolean passwordMatches = MessageDigest.isEqual(passwordSha256, offered);
        return userMatches && passwordMatches;
    }

    public String challenge() {
        return "Basic realm=\"" + REALM + "\"";
    }
}
