package com.scholary.videoask.handler.storage;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Google Sheets result store.
 *
 * <p>Columns are A1-notation letters. Each question label that should be stored maps to a pair of
 * columns: one for the media link and one for the transcript. Questions without a mapping are not
 * stored.
 */
@ConfigurationProperties(prefix = "sheets")
@Validated
public record SheetsProperties(
    @NotBlank String baseUrl,
    String spreadsheetId,
    String sheetName,
    String credentialsFile,
    @NotBlank String emailColumn,
    @NotBlank String rowCountColumn,
    @Positive int timeout,
    Map<String, QuestionColumns> questionColumns) {

  public SheetsProperties {
    questionColumns = questionColumns == null ? Map.of() : Map.copyOf(questionColumns);
  }

  public boolean isConfigured() {
    return spreadsheetId != null
        && !spreadsheetId.isBlank()
        && sheetName != null
        && !sheetName.isBlank();
  }

  /** Link and transcript columns for one question. */
  public record QuestionColumns(String linkColumn, String transcriptColumn) {}
}
