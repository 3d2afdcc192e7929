package cn.bitsleep.sysdocs.auth;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * BCrypt hashing for stored credentials. Every hash carries its own random salt,
 * so hashing the same password twice gives two different strings that both verify.
 */
@Component
public class PasswordHasher {

    // bcrypt ignores everything past this many bytes of input
    public static final int MAX_PASSWORD_BYTES = 72;

    private final BCryptPasswordEncoder encoder;

    public PasswordHasher(@Value("${sysdocs.auth.bcrypt-strength:12}") int strength) {
        this.encoder = new BCryptPasswordEncoder(strength);
    }

    public static boolean fits(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8).length <= MAX_PASSWORD_BYTES;
    }

    public String hash(String plaintext) {
        return encoder.encode(plaintext);
    }

    /**
     * @return false for a wrong password as well as for a null or malformed hash
     */
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isEmpty()) return false;
        try {
            return encoder.matches(plaintext, hash);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
