package assetguard.label;

import assetguard.exception.EncodingException;
import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * Renders a text payload as a square QR code PNG. Instances are stateless and safe to share
 * between threads.
 */
public class QrCodeGenerator {

    private final int size;
    private final int margin;

    public QrCodeGenerator(int size, int margin) {
        if (size <= 0) {
            throw new IllegalArgumentException("QR size must be positive: " + size);
        }
        this.size = size;
        this.margin = margin;
    }

    public byte[] generatePng(String payload) throws EncodingException {
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.MARGIN, margin);
        hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
        try {
            BitMatrix matrix = new QRCodeWriter().encode(payload, BarcodeFormat.QR_CODE, size, size, hints);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", out);
            return out.toByteArray();
        } catch (WriterException | IOException | IllegalArgumentException e) {
            throw new EncodingException("Could not encode QR code for '" + abbreviate(payload) + "'", e);
        }
    }

    public int getSize() {
        return size;
    }

    private static String abbreviate(String payload) {
        if (payload == null) {
            return "null";
        }
        return payload.length() <= 40 ? payload : payload.substring(0, 40) + "...";
    }
}
