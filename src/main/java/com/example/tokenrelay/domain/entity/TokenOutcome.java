package com.example.tokenrelay.domain.entity;

/**
 * Terminal result of resolving one token request: either the requested value or a rejection.
 */
public sealed interface TokenOutcome permits TokenOutcome.Success, TokenOutcome.Rejection {

  int httpStatus();

  static TokenOutcome success(TokenType tokenType, String value) {
    return new Success(tokenType, value);
  }

  static TokenOutcome rejection(int httpStatus, RejectionReason reason) {
    return new Rejection(httpStatus, reason.name());
  }

  static TokenOutcome unsupportedTokenType(String requested) {
    return new Rejection(500, "Requested token_type \"" + requested + "\" not one of "
        + TokenType.ALLOWED_VALUES);
  }

  /**
   * The requested field. Always served with status 200.
   */
  record Success(TokenType tokenType, String value) implements TokenOutcome {
    @Override
    public int httpStatus() {
      return 200;
    }

    @Override
    public String toString() {
      return "Success[" + tokenType.parameterName() + "]";
    }
  }

  /**
   * @param reason a {@link RejectionReason} name or the unsupported token type message
   */
  record Rejection(int httpStatus, String reason) implements TokenOutcome {}
}
