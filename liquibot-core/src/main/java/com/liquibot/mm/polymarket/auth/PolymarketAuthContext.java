package com.liquibot.mm.polymarket.auth;

import com.liquibot.mm.config.MakerProperties;
import com.liquibot.mm.polymarket.clob.PolymarketClobClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Credentials;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Signer key and API credentials of the trading account, loaded from configuration at startup.
 */
public class PolymarketAuthContext {

  private static final Logger log = LoggerFactory.getLogger(PolymarketAuthContext.class);
  private static final Pattern HEX_32_BYTES = Pattern.compile("0x[0-9a-fA-F]{64}");
  private static final Pattern HEX_20_BYTES = Pattern.compile("0x[0-9a-fA-F]{40}");

  private final MakerProperties properties;
  private final PolymarketClobClient clobClient;

  private volatile Credentials signerCredentials;
  private volatile ApiCreds apiCreds;

  public PolymarketAuthContext(MakerProperties properties, PolymarketClobClient clobClient) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.clobClient = Objects.requireNonNull(clobClient, "clobClient");
  }

  public void initFromConfig() {
    MakerProperties.Auth auth = properties.polymarket().auth();

    String privateKey = auth.privateKey();
    if (privateKey != null && !privateKey.isBlank()) {
      requireHex32("maker.polymarket.auth.private-key", privateKey);
      this.signerCredentials = Credentials.create(strip0x(privateKey));
    }

    String apiKey = auth.apiKey();
    String apiSecret = auth.apiSecret();
    String apiPassphrase = auth.apiPassphrase();
    if (apiKey != null && !apiKey.isBlank()
        && apiSecret != null && !apiSecret.isBlank()
        && apiPassphrase != null && !apiPassphrase.isBlank()) {
      this.apiCreds = new ApiCreds(apiKey, apiSecret, apiPassphrase);
    }

    if (properties.mode() == MakerProperties.TradingMode.LIVE
        && auth.autoCreateOrDeriveApiCreds()
        && this.apiCreds == null) {
      Credentials signer = requireSignerCredentials();
      ApiCreds derived = clobClient.createOrDeriveApiCreds(signer, auth.nonce());
      this.apiCreds = derived;
      log.info("Loaded Polymarket API key creds (key={})", derived.key());
    }

    String funder = auth.funderAddress();
    if (funder != null && !funder.isBlank()) {
      requireHex20("maker.polymarket.auth.funder-address", funder);
    }
  }

  public Credentials requireSignerCredentials() {
    Credentials creds = signerCredentials;
    if (creds == null) {
      throw new IllegalStateException("Polymarket signer private key is not configured (maker.polymarket.auth.private-key)");
    }
    return creds;
  }

  public ApiCreds requireApiCreds() {
    ApiCreds creds = apiCreds;
    if (creds == null) {
      throw new IllegalStateException("Polymarket API creds not configured (api-key/secret/passphrase)");
    }
    return creds;
  }

  /**
   * Address that owns orders and fills: the funder (proxy wallet) when configured, otherwise the signer.
   */
  public String tradingAddress() {
    String funder = properties.polymarket().auth().funderAddress();
    if (funder != null && !funder.isBlank()) {
      return funder.trim();
    }
    return requireSignerCredentials().getAddress();
  }

  public int signatureType() {
    return properties.polymarket().auth().signatureType();
  }

  public String funderAddress() {
    return properties.polymarket().auth().funderAddress();
  }

  private static String strip0x(String hex) {
    String trimmed = hex.trim();
    return trimmed.startsWith("0x") || trimmed.startsWith("0X") ? trimmed.substring(2) : trimmed;
  }

  private static void requireHex32(String field, String value) {
    String trimmed = value == null ? "" : value.trim();
    if (!HEX_32_BYTES.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(field + " must be 0x + 64 hex chars");
    }
  }

  private static void requireHex20(String field, String value) {
    String trimmed = value == null ? "" : value.trim();
    if (!HEX_20_BYTES.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(field + " must be 0x + 40 hex chars");
    }
  }
}
