package com.example.tokenrelay.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.tokenrelay.exception.EncryptionException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;

class AesCbcCodecTest {

  private static final byte[] MESSAGE = "session-1234".getBytes(StandardCharsets.UTF_8);

  @Test
  void generate_producesThirtyTwoByteKey() {
    assertThat(AesCbcCodec.generate().keyBytes()).hasSize(32);
  }

  @Test
  void decrypt_withSameKeyBytes_recoversPlaintext() {
    AesCbcCodec codec = AesCbcCodec.generate();
    byte[] ciphertext = codec.encrypt(MESSAGE);

    AesCbcCodec rebuilt = AesCbcCodec.withKey(codec.keyBytes());

    assertThat(rebuilt.decrypt(ciphertext)).isEqualTo(MESSAGE);
  }

  @Test
  void encrypt_prefixesIvAndPadsToBlock() {
    byte[] ciphertext = AesCbcCodec.generate().encrypt(MESSAGE);

    // 16 byte IV + one padded block
    assertThat(ciphertext).hasSize(32);
  }

  @Test
  void encrypt_samePlaintextTwice_differs() {
    AesCbcCodec codec = AesCbcCodec.generate();

    assertThat(codec.encrypt(MESSAGE)).isNotEqualTo(codec.encrypt(MESSAGE));
  }

  @Test
  void encrypt_emptyPlaintext_roundTrips() {
    AesCbcCodec codec = AesCbcCodec.generate();

    assertThat(codec.decrypt(codec.encrypt(new byte[0]))).isEmpty();
  }

  @Test
  void decrypt_wrongKey_failsOrDiffers() {
    byte[] ciphertext = AesCbcCodec.generate().encrypt(MESSAGE);
    AesCbcCodec other = AesCbcCodec.generate();

    // A wrong key usually breaks the padding; when it does not, the output is garbage.
    try {
      assertThat(other.decrypt(ciphertext)).isNotEqualTo(MESSAGE);
    } catch (EncryptionException expected) {
      assertThat(expected).hasMessage("Failed to decrypt data");
    }
  }

  @Test
  void decrypt_malformedPadding_throws() throws Exception {
    AesCbcCodec codec = AesCbcCodec.generate();
    byte[] iv = new byte[16];
    new SecureRandom().nextBytes(iv);
    // Last plaintext byte 0x00 is never a valid PKCS#5 pad length
    byte[] block = new byte[16];
    block[15] = 0x00;

    Cipher raw = Cipher.getInstance("AES/CBC/NoPadding");
    raw.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(codec.keyBytes(), "AES"), new IvParameterSpec(iv));
    byte[] encrypted = raw.doFinal(block);
    byte[] ciphertext = new byte[iv.length + encrypted.length];
    System.arraycopy(iv, 0, ciphertext, 0, iv.length);
    System.arraycopy(encrypted, 0, ciphertext, iv.length, encrypted.length);

    assertThatThrownBy(() -> AesCbcCodec.withKey(codec.keyBytes()).decrypt(ciphertext))
        .isInstanceOf(EncryptionException.class)
        .hasMessage("Failed to decrypt data")
        .hasCauseInstanceOf(BadPaddingException.class);
  }

  @Test
  void decrypt_truncatedInput_throws() {
    byte[] ciphertext = AesCbcCodec.generate().encrypt(MESSAGE);

    assertThatThrownBy(() -> AesCbcCodec.generate().decrypt(Arrays.copyOf(ciphertext, 20)))
        .isInstanceOf(EncryptionException.class);
    assertThatThrownBy(() -> AesCbcCodec.generate().decrypt(new byte[16]))
        .isInstanceOf(EncryptionException.class);
  }

  @Test
  void withKey_invalidLength_throws() {
    assertThatThrownBy(() -> AesCbcCodec.withKey(new byte[15]))
        .isInstanceOf(EncryptionException.class)
        .hasMessageContaining("15 bytes");
    assertThatThrownBy(() -> AesCbcCodec.withKey(null))
        .isInstanceOf(EncryptionException.class);
  }
}
