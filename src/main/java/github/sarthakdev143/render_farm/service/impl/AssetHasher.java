package github.sarthakdev143.render_farm.service.impl;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

@Component
public class AssetHasher {

    private static final int CHUNK_SIZE = 4096;

    /**
     * MD5 of the whole file as lowercase hex.
     */
    public String hash(Path file) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[CHUNK_SIZE];
        try (InputStream inputStream = Files.newInputStream(file)) {
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest is not available on this JVM", e);
        }
    }
}
