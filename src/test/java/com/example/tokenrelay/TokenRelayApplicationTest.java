package com.example.tokenrelay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.tokenrelay.cache.BoundedLruCache;
import com.example.tokenrelay.domain.entity.AuthLookup;
import com.example.tokenrelay.security.KeyMaterial;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Boots the full context against test key files. The authentication server is never reachable.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TokenRelayApplicationTest {

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private KeyMaterial keyMaterial;

  @Autowired
  private BoundedLruCache<String, AuthLookup> sessionCache;

  @Test
  void context_loadsKeysAndSizesCache() {
    assertThat(keyMaterial.privateKey().getAlgorithm()).isEqualTo("RSA");
    assertThat(keyMaterial.authServerPublicKey().getAlgorithm()).isEqualTo("RSA");
    assertThat(sessionCache.maxSize()).isEqualTo(4);
  }

  @Test
  void token_withoutCookie_isBadSessionId() throws Exception {
    mockMvc.perform(get("/token"))
        .andExpect(status().isOk())
        .andExpect(header().string("Cache-Control", "no-cache, no-store, must-revalidate"))
        .andExpect(content().json("{\"status\":\"BLOCKED\",\"reason\":\"BAD_SESSION_ID\"}", true));
  }

  @Test
  void token_unreachableAuthServer_isUnknownAndNotCached() throws Exception {
    mockMvc.perform(get("/token").cookie(new Cookie("session_id", "unreachable-session")))
        .andExpect(status().isInternalServerError())
        .andExpect(content().json("{\"status\":\"BLOCKED\",\"reason\":\"UNKNOWN\"}", true));

    assertThat(sessionCache.getIfPresent("unreachable-session")).isEmpty();
  }

  @Test
  void health_isPublic() throws Exception {
    mockMvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"));
  }

  @Test
  void unmappedPath_isDenied() throws Exception {
    mockMvc.perform(get("/admin"))
        .andExpect(status().isForbidden());
  }
}
