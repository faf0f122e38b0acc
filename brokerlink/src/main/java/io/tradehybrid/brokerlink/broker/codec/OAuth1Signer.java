package io.tradehybrid.brokerlink.broker.codec;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * OAuth 1.0a request signer (HMAC-SHA1), as required by the E*TRADE API.
 *
 * Signature base string: {@code METHOD&enc(baseUrl)&enc(sortedParams)}, where the parameters are the
 * request's query parameters plus the oauth_* protocol parameters. The signing key is
 * {@code enc(consumerSecret)&enc(tokenSecret)}.
 */
public class OAuth1Signer {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final String consumerKey;
    private final String consumerSecret;
    private final String token;
    private final String tokenSecret;
    private final Clock clock;

    public OAuth1Signer(String consumerKey, String consumerSecret, String token, String tokenSecret) {
        this(consumerKey, consumerSecret, token, tokenSecret, Clock.systemUTC());
    }

    OAuth1Signer(String consumerKey, String consumerSecret, String token, String tokenSecret, Clock clock) {
        this.consumerKey = consumerKey;
        this.consumerSecret = consumerSecret;
        this.token = token;
        this.tokenSecret = tokenSecret;
        this.clock = clock;
    }

    /**
     * Authorization header value for a request, with a fresh nonce and timestamp.
     */
    public String authorizationHeader(String method, URI uri) {
        return authorizationHeader(method, uri, newNonce(), clock.instant().getEpochSecond());
    }

    String authorizationHeader(String method, URI uri, String nonce, long timestamp) {
        Map<String, String> oauth = new LinkedHashMap<>();
        oauth.put("oauth_consumer_key", consumerKey);
        oauth.put("oauth_nonce", nonce);
        oauth.put("oauth_signature_method", "HMAC-SHA1");
        oauth.put("oauth_timestamp", Long.toString(timestamp));
        oauth.put("oauth_token", token);
        oauth.put("oauth_version", "1.0");

        Map<String, String> params = new LinkedHashMap<>(queryParameters(uri));
        params.putAll(oauth);
        oauth.put("oauth_signature", signature(method, baseUrl(uri), params, consumerSecret, tokenSecret));

        return "OAuth realm=\"\", " + oauth.entrySet().stream()
            .map(e -> percentEncode(e.getKey()) + "=\"" + percentEncode(e.getValue()) + "\"")
            .collect(Collectors.joining(", "));
    }

    /**
     * HMAC-SHA1 signature over the OAuth 1.0a signature base string, Base64 encoded.
     */
    public static String signature(String method, String baseUrl, Map<String, String> params,
                                   String consumerSecret, String tokenSecret) {
        String baseString = method.toUpperCase() + "&" + percentEncode(baseUrl) + "&"
            + percentEncode(normalizedParameters(params));
        String key = percentEncode(nullToEmpty(consumerSecret)) + "&" + percentEncode(nullToEmpty(tokenSecret));
        return HmacSigner.sha1Base64(key, baseString);
    }

    static String normalizedParameters(Map<String, String> params) {
        TreeMap<String, String> sorted = new TreeMap<>();
        params.forEach((k, v) -> sorted.put(percentEncode(k), percentEncode(nullToEmpty(v))));
        return sorted.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining("&"));
    }

    /**
     * RFC 3986 percent-encoding: unreserved characters are kept, space becomes %20.
     */
    public static String percentEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("*", "%2A")
            .replace("%7E", "~");
    }

    static String baseUrl(URI uri) {
        String scheme = uri.getScheme().toLowerCase();
        int port = uri.getPort();
        boolean defaultPort = port == -1
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
        return scheme + "://" + uri.getHost().toLowerCase() + (defaultPort ? "" : ":" + port) + uri.getRawPath();
    }

    static Map<String, String> queryParameters(URI uri) {
        Map<String, String> params = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            String key = idx >= 0 ? pair.substring(0, idx) : pair;
            String value = idx >= 0 ? pair.substring(idx + 1) : "";
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private static String newNonce() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b & 0xff));
        }
        return sb.toString();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
