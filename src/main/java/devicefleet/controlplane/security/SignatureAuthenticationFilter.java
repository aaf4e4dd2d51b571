package devicefleet.controlplane.security;

import devicefleet.controlplane.auth.CanonicalRequest;
import devicefleet.controlplane.auth.SignatureAuthenticator;
import devicefleet.controlplane.config.AuthProperties;
import devicefleet.controlplane.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Requires a valid request signature on every /api call except the exempt endpoints.
 * Signature fields come from the X-XXT-* headers, or from the ts/nonce/sign query
 * parameters when any header is missing (used by links opened outside the console).
 */
@Slf4j
public class SignatureAuthenticationFilter extends OncePerRequestFilter {

    public static final String TS_HEADER = "X-XXT-TS";
    public static final String NONCE_HEADER = "X-XXT-Nonce";
    public static final String SIGN_HEADER = "X-XXT-Sign";

    private static final String API_PREFIX = "/api/";

    private final SignatureAuthenticator authenticator;
    private final List<String> exemptPaths;
    private final List<String> exemptPrefixes;

    public SignatureAuthenticationFilter(SignatureAuthenticator authenticator, AuthProperties properties) {
        this.authenticator = authenticator;
        this.exemptPaths = List.copyOf(properties.getExemptPaths());
        this.exemptPrefixes = List.copyOf(properties.getExemptPrefixes());
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path == null || !path.startsWith(API_PREFIX)) {
            return true;
        }
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        if (exemptPaths.contains(path)) {
            return true;
        }
        return exemptPrefixes.stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        RequestSignature signature = extractSignature(request);
        if (signature == null) {
            log.debug("Missing or malformed signature on {} {}", request.getMethod(),
                LogSanitizer.sanitize(request.getRequestURI()));
            sendUnauthorized(response);
            return;
        }

        HttpServletRequest forwarded = request;
        byte[] body = null;
        if (shouldReadBody(request)) {
            CachedBodyHttpServletRequest cached = new CachedBodyHttpServletRequest(request);
            body = cached.getBody();
            forwarded = cached;
        }

        String canonicalPath;
        try {
            canonicalPath = CanonicalRequest.canonicalPath(request.getRequestURI(), request.getQueryString());
        } catch (IllegalArgumentException ex) {
            log.debug("Undecodable request path {}: {}", LogSanitizer.sanitize(request.getRequestURI()),
                ex.getMessage());
            sendUnauthorized(response);
            return;
        }
        boolean valid = authenticator.verifyHttpRequest(
            signature.ts(), signature.nonce(), signature.sign(), request.getMethod(), canonicalPath, body);
        if (!valid) {
            log.warn("Rejected unsigned or replayed request: {} {}", request.getMethod(),
                LogSanitizer.sanitize(request.getRequestURI()));
            sendUnauthorized(response);
            return;
        }

        Authentication existing = SecurityContextHolder.getContext().getAuthentication();
        if (existing == null) {
            Authentication auth = new UsernamePasswordAuthenticationToken(
                "controller",
                null,
                List.of(new SimpleGrantedAuthority("ROLE_CONTROLLER"))
            );
            SecurityContextHolder.getContext().setAuthentication(auth);
        }

        filterChain.doFilter(forwarded, response);
    }

    static RequestSignature extractSignature(HttpServletRequest request) {
        String ts = request.getHeader(TS_HEADER);
        String nonce = request.getHeader(NONCE_HEADER);
        String sign = request.getHeader(SIGN_HEADER);
        if (isBlank(ts) || isBlank(nonce) || isBlank(sign)) {
            // query string only; getParameter would consume a form body before it is hashed
            Map<String, List<String>> query = CanonicalRequest.parseQuery(request.getQueryString());
            ts = firstValue(query, CanonicalRequest.TS_PARAM);
            nonce = firstValue(query, CanonicalRequest.NONCE_PARAM);
            sign = firstValue(query, CanonicalRequest.SIGN_PARAM);
        }
        if (isBlank(ts) || isBlank(nonce) || isBlank(sign)) {
            return null;
        }
        try {
            return new RequestSignature(Long.parseLong(ts.trim()), nonce, sign);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static boolean shouldReadBody(HttpServletRequest request) {
        String contentType = request.getContentType();
        if (contentType != null && contentType.startsWith(MediaType.MULTIPART_FORM_DATA_VALUE)) {
            return false;
        }
        if (HttpMethod.GET.matches(request.getMethod()) || HttpMethod.HEAD.matches(request.getMethod())) {
            return false;
        }
        boolean chunked = request.getHeader("Transfer-Encoding") != null;
        return request.getContentLengthLong() != 0 || chunked;
    }

    private static void sendUnauthorized(HttpServletResponse response) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"error\":\"unauthorized\"}");
    }

    private static String firstValue(Map<String, List<String>> query, String name) {
        List<String> values = query.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record RequestSignature(long ts, String nonce, String sign) {
    }
}
