package work.tierforge.pipeline;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Derives the 8-hex-digit template version stamped into provenance headers.
 *
 * <p>The digest covers the artifact type, the concrete template and every tier of its chain, so two
 * artifact types rendered from the same chain never share a version.
 */
public final class VersionHasher {
    public static final String ALGORITHM = "SHA256";

    private VersionHasher() {}

    public static String hash(String artifactType, String templateName, List<TierVersion> tiers) {
        var sb = new StringBuilder();
        sb.append("artifact:").append(artifactType).append('\n');
        sb.append("template:").append(templateName).append('\n');
        for (var tier : tiers) {
            sb.append(tier.tier()).append(':').append(tier.templateId()).append(':').append(tier.version()).append('\n');
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8));
            return toHex(hashed).substring(0, 8);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm unavailable", ex);
        }
    }

    private static String toHex(byte[] bytes) {
        var sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
