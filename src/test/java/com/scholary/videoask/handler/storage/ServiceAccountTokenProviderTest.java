package com.scholary.videoask.handler.storage;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.FileNotFoundException;
import org.junit.jupiter.api.Test;

class ServiceAccountTokenProviderTest {

  @Test
  void accessToken_shouldFailWhenCredentialsFileNotConfigured() {
    ServiceAccountTokenProvider provider = new ServiceAccountTokenProvider("");

    assertThatThrownBy(provider::accessToken)
        .isInstanceOf(StoreException.class)
        .hasMessage("Google Sheets credentials file not configured");
  }

  @Test
  void accessToken_shouldWrapMissingKeyFile() {
    ServiceAccountTokenProvider provider =
        new ServiceAccountTokenProvider("/nonexistent/service-account.json");

    assertThatThrownBy(provider::accessToken)
        .isInstanceOf(StoreException.class)
        .hasMessage("Could not obtain Google Sheets access token")
        .hasCauseInstanceOf(FileNotFoundException.class);
  }
}
