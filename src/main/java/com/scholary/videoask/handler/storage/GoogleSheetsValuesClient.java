package com.scholary.videoask.handler.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Google Sheets v4 values API over the JDK HTTP client.
 *
 * <p>Only two calls are needed: {@code values.get} for a column range and {@code values.update}
 * with {@code valueInputOption=RAW} for a single cell.
 */
public class GoogleSheetsValuesClient implements SheetsValuesApi {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleSheetsValuesClient.class);

  private final HttpClient httpClient;
  private final SheetsProperties properties;
  private final ObjectMapper objectMapper;
  private final AccessTokenProvider tokenProvider;

  public GoogleSheetsValuesClient(
      SheetsProperties properties, ObjectMapper objectMapper, AccessTokenProvider tokenProvider) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.tokenProvider = tokenProvider;
    this.httpClient =
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(properties.timeout())).build();
  }

  @Override
  public List<String> readColumn(String sheetName, String column) {
    String range = sheetName + "!" + column + ":" + column;
    HttpRequest request = authorized(valuesUri(range, "")).GET().build();

    JsonNode body = readTree(send(request, "read " + range));
    List<String> cells = new ArrayList<>();
    for (JsonNode row : body.path("values")) {
      cells.add(row.size() > 0 ? row.get(0).asText() : "");
    }
    LOGGER.debug("Read {} rows from {}", cells.size(), range);
    return cells;
  }

  @Override
  public void writeCell(String sheetName, String column, int row, String value) {
    String range = sheetName + "!" + column + row;
    ObjectNode body = objectMapper.createObjectNode();
    body.putArray("values").addArray().add(value);

    HttpRequest request =
        authorized(valuesUri(range, "?valueInputOption=RAW"))
            .header("Content-Type", "application/json")
            .PUT(HttpRequest.BodyPublishers.ofString(body.toString()))
            .build();

    send(request, "update " + range);
    LOGGER.debug("Updated cell {}", range);
  }

  private URI valuesUri(String range, String query) {
    String encodedRange = URLEncoder.encode(range, StandardCharsets.UTF_8).replace("+", "%20");
    return URI.create(
        properties.baseUrl()
            + "/spreadsheets/"
            + properties.spreadsheetId()
            + "/values/"
            + encodedRange
            + query);
  }

  private HttpRequest.Builder authorized(URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(Duration.ofSeconds(properties.timeout()))
        .header("Authorization", "Bearer " + tokenProvider.accessToken());
  }

  private String send(HttpRequest request, String operation) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new StoreException("Sheets " + operation + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException("Sheets " + operation + " interrupted", e);
    }
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new StoreException(
          String.format(
              "Sheets %s returned status %d: %s",
              operation, response.statusCode(), response.body()));
    }
    return response.body();
  }

  private JsonNode readTree(String body) {
    try {
      return objectMapper.readTree(body);
    } catch (IOException e) {
      throw new StoreException("Could not parse Sheets response", e);
    }
  }
}
