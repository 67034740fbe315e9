package in.signalbridge.infrastructure.exchange;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HMAC-SHA256 request signing for authenticated Delta Exchange calls.
 *
 * signature = hex(HMAC_SHA256(secret, method + timestamp + pathWithQuery + body))
 * where timestamp is epoch seconds. Sent as api-key / timestamp / signature headers.
 */
public final class DeltaRequestSigner {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final String apiKey;
    private final byte[] secret;
    private final Clock clock;

    public DeltaRequestSigner(String apiKey, String apiSecret) {
        this(apiKey, apiSecret, Clock.systemUTC());
    }

    public DeltaRequestSigner(String apiKey, String apiSecret, Clock clock) {
        this.apiKey = apiKey;
        this.secret = apiSecret.getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
    }

    /**
     * Headers for one request. A fresh timestamp is taken on every call.
     */
    public Map<String, String> headers(String method, String pathWithQuery, String body) {
        String timestamp = Long.toString(clock.instant().getEpochSecond());
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("api-key", apiKey);
        headers.put("timestamp", timestamp);
        headers.put("signature", sign(method + timestamp + pathWithQuery + (body == null ? "" : body)));
        return headers;
    }

    public String sign(String message) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
