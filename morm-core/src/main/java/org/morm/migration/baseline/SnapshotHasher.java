package org.morm.migration.baseline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.morm.exception.MormException;
import org.morm.model.SchemaSnapshot;
import org.morm.support.ObjectMappers;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 over the canonical JSON form of a snapshot. Field declaration order does not change the hash.
 */
public class SnapshotHasher {

    private final ObjectMapper canonical = ObjectMappers.canonicalJson();

    /**
     * @return 64-character hex digest, or {@code null} for a model without snapshot
     */
    public String hash(SchemaSnapshot snapshot) {
        if (snapshot == null) {
            return null;
        }
        try {
            byte[] content = canonical.writeValueAsString(snapshot).getBytes(StandardCharsets.UTF_8);
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(content);

            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new MormException("Failed to generate snapshot hash for table '" + snapshot.getTable() + "'", e);
        }
    }
}
