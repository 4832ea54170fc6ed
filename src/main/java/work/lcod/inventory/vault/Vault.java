package work.lcod.inventory.vault;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;

/**
 * Decrypts Ansible Vault payloads ({@code $ANSIBLE_VAULT;1.1;AES256} and {@code 1.2} with a vault-id label).
 */
public final class Vault {
    public static final String HEADER_PREFIX = "$ANSIBLE_VAULT";
    private static final String CIPHER_NAME = "AES256";
    private static final int PBKDF2_ITERATIONS = 10_000;
    private static final int KEY_LENGTH = 32;
    private static final int IV_LENGTH = 16;
    private static final int BLOCK_SIZE = 16;
    private static final HexFormat HEX = HexFormat.of();

    private final char[] password;

    public Vault(String password) {
        Objects.requireNonNull(password, "password");
        this.password = password.toCharArray();
    }

    public static boolean isEncrypted(String text) {
        return text != null && text.stripLeading().startsWith(HEADER_PREFIX);
    }

    public String decrypt(String vaultText) {
        var lines = vaultText.strip().split("\\R");
        var header = lines[0].strip().split(";");
        if (header.length < 3 || !HEADER_PREFIX.equals(header[0])) {
            throw corrupt("missing vault header");
        }
        if (!"1.1".equals(header[1]) && !"1.2".equals(header[1])) {
            throw corrupt("unsupported vault format version " + header[1]);
        }
        if (!CIPHER_NAME.equals(header[2].strip())) {
            throw corrupt("unsupported vault cipher " + header[2]);
        }
        var body = new StringBuilder();
        for (int i = 1; i < lines.length; i++) {
            body.append(lines[i].strip());
        }

        byte[] salt;
        byte[] expectedHmac;
        byte[] ciphertext;
        try {
            var envelope = new String(HEX.parseHex(body), StandardCharsets.US_ASCII).split("\n");
            if (envelope.length != 3) {
                throw corrupt("vault envelope must contain salt, hmac and ciphertext");
            }
            salt = HEX.parseHex(envelope[0].strip());
            expectedHmac = HEX.parseHex(envelope[1].strip());
            ciphertext = HEX.parseHex(envelope[2].strip());
        } catch (IllegalArgumentException ex) {
            throw new InventoryException(ErrorKind.CORRUPT_BLOB, "vault payload is not valid hex", ex);
        }

        try {
            byte[] derived = deriveKeys(salt);
            byte[] cipherKey = Arrays.copyOfRange(derived, 0, KEY_LENGTH);
            byte[] hmacKey = Arrays.copyOfRange(derived, KEY_LENGTH, KEY_LENGTH * 2);
            byte[] iv = Arrays.copyOfRange(derived, KEY_LENGTH * 2, KEY_LENGTH * 2 + IV_LENGTH);

            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(hmacKey, "HmacSHA256"));
            if (!MessageDigest.isEqual(expectedHmac, mac.doFinal(ciphertext))) {
                throw new InventoryException(ErrorKind.BAD_KEY, "vault HMAC mismatch, wrong vault password?");
            }

            Cipher cipher = Cipher.getInstance("AES/CTR/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(cipherKey, "AES"), new IvParameterSpec(iv));
            byte[] padded = cipher.doFinal(ciphertext);
            return new String(unpad(padded), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException ex) {
            throw new InventoryException(ErrorKind.CORRUPT_BLOB, "unable to decrypt vault: " + ex.getMessage(), ex);
        }
    }

    private byte[] deriveKeys(byte[] salt) throws GeneralSecurityException {
        var spec = new PBEKeySpec(password, salt, PBKDF2_ITERATIONS, (KEY_LENGTH * 2 + IV_LENGTH) * 8);
        try {
            return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
        } finally {
            spec.clearPassword();
        }
    }

    private static byte[] unpad(byte[] padded) {
        if (padded.length == 0 || padded.length % BLOCK_SIZE != 0) {
            throw corrupt("decrypted payload is not block aligned");
        }
        int pad = padded[padded.length - 1] & 0xff;
        if (pad < 1 || pad > BLOCK_SIZE) {
            throw corrupt("invalid PKCS#7 padding");
        }
        for (int i = padded.length - pad; i < padded.length; i++) {
            if ((padded[i] & 0xff) != pad) {
                throw corrupt("invalid PKCS#7 padding");
            }
        }
        return Arrays.copyOf(padded, padded.length - pad);
    }

    private static InventoryException corrupt(String detail) {
        return new InventoryException(ErrorKind.CORRUPT_BLOB, detail);
    }
}
