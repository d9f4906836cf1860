package com.example.tokenrelay.domain.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuthDataTest {

  @Test
  void field_jsonNull_isAbsentAndValuesStayOutOfToString() {
    Map<String, Object> fields = new HashMap<>();
    fields.put("id_token", null);
    fields.put("email", "user@example.com");

    AuthData authData = new AuthData(fields);

    assertThat(authData.idToken()).isEmpty();
    assertThat(authData.field("email")).contains("user@example.com");
    assertThat(authData.toString()).doesNotContain("user@example.com");
  }

  @Test
  void fields_areCopiedAndUnmodifiable() {
    Map<String, Object> fields = new HashMap<>();
    fields.put("email", "user@example.com");
    AuthData authData = new AuthData(fields);

    fields.put("email", "changed@example.com");

    assertThat(authData.field("email")).contains("user@example.com");
    assertThatThrownBy(() -> authData.fields().put("email", "other"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
