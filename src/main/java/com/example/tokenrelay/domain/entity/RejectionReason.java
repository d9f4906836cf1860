package com.example.tokenrelay.domain.entity;

/**
 * Fixed reason codes reported in a {@code BLOCKED} response.
 */
public enum RejectionReason {
  //Cookie missing, blank, or not a well-formed session id.
  BAD_SESSION_ID,
  //The authentication server does not know the session.
  REJECTED_REQUEST,
  TOKEN_EXPIRED,
  //Identity token verified but the email is not verified.
  BAD_EMAIL,
  UNKNOWN
}
