package com.example.tokenrelay.adapter.authserver.dto;

import com.example.tokenrelay.exception.AuthServerException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * ZIP archive returned by the authentication server.
 *
 * @param key RSA-wrapped AES key (member {@code key})
 * @param sessionData AES-encrypted session JSON (member {@code session_data})
 */
public record EncryptedEnvelope(byte[] key, byte[] sessionData) {

  public static final String KEY_MEMBER = "key";
  public static final String SESSION_DATA_MEMBER = "session_data";

  private static final int MAX_MEMBER_BYTES = 1 << 20;

  /**
   * Reads both members from a ZIP archive. Other members are ignored.
   *
   * @throws AuthServerException if the bytes are not a readable archive, or a member is missing
   *     or appears twice
   */
  public static EncryptedEnvelope fromZip(byte[] archive) {
    Map<String, byte[]> members = new HashMap<>();
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        String name = entry.getName();
        if (KEY_MEMBER.equals(name) || SESSION_DATA_MEMBER.equals(name)) {
          if (members.containsKey(name)) {
            throw new AuthServerException("Archive member duplicated: " + name);
          }
          members.put(name, readBounded(zip, name));
        }
      }
    } catch (IOException e) {
      throw new AuthServerException("Authentication server returned an unreadable archive", e);
    }

    byte[] key = members.get(KEY_MEMBER);
    byte[] sessionData = members.get(SESSION_DATA_MEMBER);
    if (key == null) {
      throw new AuthServerException("Archive member missing: " + KEY_MEMBER);
    }
    if (sessionData == null) {
      throw new AuthServerException("Archive member missing: " + SESSION_DATA_MEMBER);
    }
    return new EncryptedEnvelope(key, sessionData);
  }

  private static byte[] readBounded(InputStream in, String name) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[8192];
    int read;
    while ((read = in.read(buffer)) != -1) {
      if (out.size() + read > MAX_MEMBER_BYTES) {
        throw new AuthServerException("Archive member too large: " + name);
      }
      out.write(buffer, 0, read);
    }
    return out.toByteArray();
  }
}
