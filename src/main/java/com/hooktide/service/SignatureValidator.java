package com.hooktide.service;

import com.hooktide.exception.AuthException;
import com.hooktide.model.Provider;
import com.hooktide.model.WebhookEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * First stage: proves a delivery came from the provider before anything reads the body.
 *
 *   HMAC_SHA256 → recompute HMAC-SHA256 over the raw body with the provider's secret
 *                 and compare (constant time) with the signature header, minus its prefix
 *   TOKEN       → compare (constant time) the token header with the configured secret
 *
 * No secret configured means every delivery is refused. Secret material and
 * received signatures are never logged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SignatureValidator {

    private static final String ALGORITHM = "HmacSHA256";

    private final RoutingConfigService routingConfigService;

    /**
     * @throws AuthException if the delivery cannot be authenticated
     */
    public void validate(WebhookEvent event) {
        Provider provider = event.getProvider();
        ProviderRouting routing = routingConfigService.current().forProvider(provider);

        if (!routing.enabled()) {
            throw new AuthException(AuthException.Reason.PROVIDER_DISABLED,
                    "Provider " + provider.pathSegment() + " is disabled");
        }
        if (!routing.hasSecret()) {
            throw new AuthException(AuthException.Reason.SECRET_NOT_CONFIGURED,
                    "No webhook secret configured for provider " + provider.pathSegment());
        }

        String supplied = event.header(provider.signatureHeader());
        if (supplied == null || supplied.isBlank()) {
            throw new AuthException(AuthException.Reason.MISSING_SIGNATURE,
                    "Missing " + provider.signatureHeader() + " header");
        }

        boolean valid = switch (provider.signatureScheme()) {
            case HMAC_SHA256 -> verifyHmac(event.getRawBody(), supplied.trim(), provider.signaturePrefix(), routing.secret());
            case TOKEN -> constantTimeEquals(supplied.trim(), routing.secret());
        };

        if (!valid) {
            throw new AuthException(AuthException.Reason.INVALID_SIGNATURE,
                    "Signature mismatch for provider " + provider.pathSegment());
        }
        log.debug("Signature verified: provider={}, deliveryId={}", provider, event.getDeliveryId());
    }

    private boolean verifyHmac(byte[] rawBody, String supplied, String prefix, String secret) {
        if (!prefix.isEmpty()) {
            if (!supplied.regionMatches(true, 0, prefix, 0, prefix.length())) {
                return false;
            }
            supplied = supplied.substring(prefix.length());
        }
        String expectedHex = computeHmac(rawBody, secret);
        return constantTimeEquals(supplied.toLowerCase(Locale.ROOT), expectedHex);
    }

    static String computeHmac(byte[] data, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(
                a.getBytes(StandardCharsets.UTF_8),
                b.getBytes(StandardCharsets.UTF_8));
    }
}
