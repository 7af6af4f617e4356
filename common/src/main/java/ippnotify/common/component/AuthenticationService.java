package ippnotify.common.component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.stereotype.Component;

import ippnotify.api.model.IppStatus;
import ippnotify.api.request.IppRequest;
import ippnotify.api.response.IppException;
import ippnotify.auth.AuthCache;
import ippnotify.common.configuration.SecurityProperties;

/**
 * Establishes who sent a request. HTTP Basic credentials are verified against the configured users; requests without credentials
 * proceed anonymously when configuration allows it.
 */
@Component
public class AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);
    public static final String AUTH_HEADER = "Authorization";
    private static final String BASIC_PREFIX = "Basic ";

    private final AuthenticationManager authenticationManager;
    private final SecurityProperties securityProperties;
    protected final AuthCache authCache;

    public AuthenticationService(SecurityProperties securityProperties, IppAuthenticationManager authenticationManager) {
        this.securityProperties = securityProperties;
        this.authenticationManager = authenticationManager;
        this.authCache = new AuthCache(securityProperties);
    }

    /**
     * Verifies the request's credentials and records the authenticated user on it.
     *
     * @throws IppException
     *             with client-error-not-authenticated when credentials are missing and required, malformed or wrong
     */
    public void enforceAccess(IppRequest request) throws IppException {
        String authHeader = request.getRequestHeader(AUTH_HEADER);
        if (StringUtils.isBlank(authHeader)) {
            if (!securityProperties.isAllowAnonymousAccess()) {
                throw new IppException(IppStatus.CLIENT_ERROR_NOT_AUTHENTICATED, "User must authenticate",
                                "Anonymous access is disabled, supply HTTP Basic credentials");
            }
            return;
        }
        String username = authCache.get(authHeader);
        if (username == null) {
            username = authenticate(authHeader);
            authCache.put(authHeader, username);
            log.debug("Authenticated user {} for {}", username, request.getOperation());
        } else {
            log.trace("Got user {} from AuthCache", username);
        }
        request.setAuthenticatedUser(username);
    }

    private String authenticate(String authHeader) throws IppException {
        if (!authHeader.startsWith(BASIC_PREFIX)) {
            throw new IppException(IppStatus.CLIENT_ERROR_NOT_AUTHENTICATED, "Unsupported authorization scheme");
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(authHeader.substring(BASIC_PREFIX.length()).trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IppException(IppStatus.CLIENT_ERROR_NOT_AUTHENTICATED, "Malformed credentials", e.getMessage(), e);
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            throw new IppException(IppStatus.CLIENT_ERROR_NOT_AUTHENTICATED, "Malformed credentials");
        }
        try {
            Authentication result = authenticationManager
                            .authenticate(new UsernamePasswordAuthenticationToken(decoded.substring(0, colon), decoded.substring(colon + 1)));
            return result.getName();
        } catch (AuthenticationException e) {
            log.info("Authentication failed: {}", e.getMessage());
            throw new IppException(IppStatus.CLIENT_ERROR_NOT_AUTHENTICATED, "Access denied", e.getMessage(), e);
        }
    }
}
