package com.liquibot.mm.polymarket.auth;

public record ApiCreds(String key, String secret, String passphrase) {

  @Override
  public String toString() {
    return "ApiCreds[key=" + key + "]";
  }
}
