package com.faultline.core.fingerprint;

import com.faultline.core.model.ErrorSignal;
import com.faultline.core.util.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Derives a stable 16-character hex fingerprint for an error signal.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Normalize the message: hex addresses, object inspections, digit runs
 * and quoted literals are replaced by placeholders.</li>
 * <li>Take the file path of the first stack frame that is not inside a
 * library directory. Line numbers are dropped since they shift between
 * deploys.</li>
 * <li>Join type, normalized message, frame path, controller, action and
 * tenant with {@code |}, hash with SHA-256 and keep the first 64 bits.</li>
 * </ol>
 *
 * <p>
 * An optional {@link FingerprintStrategy} replaces the whole derivation; if
 * it fails or yields a blank key the default algorithm is used.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable and safe to share.
 * </p>
 *
 * @since 1.0.0
 */
public class FingerprintGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(FingerprintGenerator.class);

    static final int FINGERPRINT_LENGTH = 16;

    private static final Pattern HEX = Pattern.compile("0x[0-9a-f]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern OBJECT_INSPECTION = Pattern.compile("#<[^>]+>");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\"[^\"]*\"");
    private static final Pattern SINGLE_QUOTED = Pattern.compile("'[^']*'");
    private static final Pattern LINE_SUFFIX = Pattern.compile(":\\d+.*$");

    private final List<String> libraryPathMarkers;
    private final FingerprintStrategy override;

    public FingerprintGenerator(List<String> libraryPathMarkers) {
        this(libraryPathMarkers, null);
    }

    /**
     * @param libraryPathMarkers substrings identifying third-party frames
     * @param override           optional custom derivation, may be {@code null}
     */
    public FingerprintGenerator(List<String> libraryPathMarkers, FingerprintStrategy override) {
        this.libraryPathMarkers = List.copyOf(
                Objects.requireNonNull(libraryPathMarkers, "libraryPathMarkers must not be null"));
        this.override = override;
    }

    /**
     * Fingerprint a signal. Never throws for a validated signal.
     *
     * @param signal the captured error; must not be {@code null}
     * @return 16-character lowercase hex string, or the override's key
     */
    public String generate(ErrorSignal signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        if (override != null) {
            Outcome<String> custom = Outcome.of(() -> override.fingerprint(signal));
            String key = custom.orElseGet(e -> {
                LOG.warn("Custom fingerprint strategy failed for {}, using default: {}",
                        signal.getType(), e.toString());
                return null;
            });
            if (key != null && !key.isBlank()) {
                return key;
            }
            if (custom.isOk()) {
                LOG.debug("Custom fingerprint strategy returned blank for {}, using default", signal.getType());
            }
        }
        return defaultFingerprint(signal);
    }

    String defaultFingerprint(ErrorSignal signal) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, signal.getType());
        addIfPresent(parts, normalizeMessage(signal.getMessage()));
        addIfPresent(parts, extractAppFrame(signal.getStackFrames()));
        addIfPresent(parts, signal.getController());
        addIfPresent(parts, signal.getAction());
        parts.add(signal.getTenantId() == null ? "" : signal.getTenantId());
        return sha256Prefix(String.join("|", parts));
    }

    /**
     * Replace dynamic fragments of a message with stable placeholders.
     *
     * @param message raw message, may be {@code null}
     * @return normalized message, or {@code null} for {@code null} input
     */
    public static String normalizeMessage(String message) {
        if (message == null) {
            return null;
        }
        // Hex first, otherwise the digit pass would eat the address
        String normalized = HEX.matcher(message).replaceAll("HEX");
        normalized = OBJECT_INSPECTION.matcher(normalized).replaceAll("#<OBJ>");
        normalized = DIGITS.matcher(normalized).replaceAll("N");
        normalized = DOUBLE_QUOTED.matcher(normalized).replaceAll("\"\"");
        return SINGLE_QUOTED.matcher(normalized).replaceAll("''");
    }

    /**
     * Find the first application frame and strip its line information.
     *
     * @param frames raw stack frames, may be {@code null}
     * @return frame path without line number, or {@code null} if every frame
     *         belongs to a library
     */
    public String extractAppFrame(List<String> frames) {
        if (frames == null) {
            return null;
        }
        for (String frame : frames) {
            if (frame != null && !isLibraryFrame(frame)) {
                return LINE_SUFFIX.matcher(frame.trim()).replaceFirst("");
            }
        }
        return null;
    }

    private boolean isLibraryFrame(String frame) {
        String trimmed = frame.trim();
        for (String marker : libraryPathMarkers) {
            if (trimmed.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null) {
            parts.add(value);
        }
    }

    private static String sha256Prefix(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(FINGERPRINT_LENGTH);
            for (int i = 0; i < FINGERPRINT_LENGTH / 2; i++) {
                hex.append(String.format("%02x", hash[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
