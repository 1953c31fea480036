package com.voucherpay.security.totp;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Renders text as a PNG QR code, entirely in memory.
 */
public class QrCodeRenderer {

    /** Default edge length in pixels. */
    public static final int DEFAULT_SIZE = 250;

    private final int size;

    public QrCodeRenderer() {
        this(DEFAULT_SIZE);
    }

    public QrCodeRenderer(int size) {
        if (size < 21) {
            throw new IllegalArgumentException("size must be at least 21 pixels");
        }
        this.size = size;
    }

    /**
     * Encodes {@code content} as a QR code.
     *
     * @return PNG bytes
     * @throws ProvisioningException if the content cannot be encoded
     */
    public byte[] renderPng(String content) {
        Map<EncodeHintType, Object> hints = Map.of(
                EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name(),
                EncodeHintType.ERROR_CORRECTION, ErrorCorrectionLevel.M,
                EncodeHintType.MARGIN, 4);
        try {
            BitMatrix matrix = new QRCodeWriter().encode(content, BarcodeFormat.QR_CODE, size, size, hints);
            var out = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", out);
            return out.toByteArray();
        } catch (WriterException | IOException e) {
            throw new ProvisioningException("Failed to render QR code", e);
        }
    }
}
