package com.scholary.videoask.handler.storage;

/** Supplies a bearer token for the Sheets API. */
@FunctionalInterface
public interface AccessTokenProvider {

  /**
   * @return a currently valid access token
   * @throws StoreException if no token can be obtained
   */
  String accessToken();
}
