package com.flagship.gift_card_ledger.giftcard;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Renders a gift card code as a QR code PNG data URI.
 *
 * The output depends only on the code, which never changes. Results are
 * cached in Redis for {@code gift-card.qr-code.cache-ttl-hours}.
 */
@Component
@Slf4j
public class GiftCardQrCodeRenderer {

    public static final String CACHE_NAME = "gift-card-qr-codes";

    static final String DATA_URI_PREFIX = "data:image/png;base64,";

    @Value("${gift-card.qr-code.size:300}")
    private int size;

    @Cacheable(cacheNames = CACHE_NAME, key = "#code")
    public String render(String code) {
        try {
            BitMatrix matrix = new QRCodeWriter().encode(code, BarcodeFormat.QR_CODE, size, size,
                Map.of(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name(),
                       EncodeHintType.MARGIN, 1));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", out);
            log.debug("Rendered QR code for {}", code);
            return DATA_URI_PREFIX + Base64.getEncoder().encodeToString(out.toByteArray());
        } catch (WriterException e) {
            throw new IllegalStateException("Failed to encode QR code for " + code, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write QR code image for " + code, e);
        }
    }
}
