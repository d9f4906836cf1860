package com.example.tokenrelay.domain.entity;

/**
 * Result of one exchange with the authentication server, as stored in the session cache.
 * Transport and protocol failures are thrown instead, so they are never cached.
 */
public sealed interface AuthLookup permits AuthLookup.Found, AuthLookup.Rejected {

  static AuthLookup found(AuthData authData) {
    return new Found(authData);
  }

  static AuthLookup rejected(int serverStatus) {
    return new Rejected(serverStatus);
  }

  /**
   * The server recognized the session and returned its data.
   */
  record Found(AuthData authData) implements AuthLookup {}

  /**
   * The server does not know the session id.
   *
   * @param serverStatus HTTP status the authentication server answered with
   */
  record Rejected(int serverStatus) implements AuthLookup {}
}
