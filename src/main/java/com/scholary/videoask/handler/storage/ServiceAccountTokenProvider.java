package com.scholary.videoask.handler.storage;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Access tokens from a Google service-account key file.
 *
 * <p>The key file is read on first use, so a missing file only fails writes and not startup.
 * Tokens are refreshed when they are about to expire.
 */
public class ServiceAccountTokenProvider implements AccessTokenProvider {

  static final List<String> SCOPES = List.of("https://www.googleapis.com/auth/spreadsheets");

  private final String credentialsFile;
  private GoogleCredentials credentials;

  public ServiceAccountTokenProvider(String credentialsFile) {
    this.credentialsFile = credentialsFile;
  }

  @Override
  public synchronized String accessToken() {
    try {
      if (credentials == null) {
        credentials = load();
      }
      credentials.refreshIfExpired();
      AccessToken token = credentials.getAccessToken();
      if (token == null) {
        throw new StoreException("Google credentials returned no access token");
      }
      return token.getTokenValue();
    } catch (IOException e) {
      throw new StoreException("Could not obtain Google Sheets access token", e);
    }
  }

  private GoogleCredentials load() throws IOException {
    if (credentialsFile == null || credentialsFile.isBlank()) {
      throw new StoreException("Google Sheets credentials file not configured");
    }
    try (InputStream stream = new FileInputStream(credentialsFile)) {
      return GoogleCredentials.fromStream(stream).createScoped(SCOPES);
    }
  }
}
