package com.scholary.videoask.handler.storage;

import com.scholary.videoask.handler.quality.QualityReport;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stores transcripts in a Google Sheet, one row per contact email.
 *
 * <p>The row is found by a linear scan of the email column (first match, trimmed and
 * case-insensitive). When the email is absent, the row after the last used row of the row-count
 * column is taken. Finding and appending are two separate calls and nothing serialises them, so
 * two concurrent jobs for a new contact can each append a row. The Sheets API offers no
 * conditional write to prevent this; duplicates have to be merged by hand.
 */
@Component
public class SheetsResultStore implements ResultStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(SheetsResultStore.class);

  private final SheetsProperties properties;
  private final SheetsValuesApi sheets;

  public SheetsResultStore(SheetsProperties properties, SheetsValuesApi sheets) {
    this.properties = properties;
    this.sheets = sheets;
  }

  @Override
  public boolean upsert(
      String contactEmail,
      String questionLabel,
      String mediaUrl,
      String transcriptText,
      QualityReport qualityReport) {
    if (!properties.isConfigured()) {
      LOGGER.warn("Sheets store not configured; transcript for {} not stored", contactEmail);
      return false;
    }
    if (isBlank(contactEmail)) {
      LOGGER.warn("Contact email missing; transcript for question {} not stored", questionLabel);
      return false;
    }
    if (isBlank(questionLabel)) {
      LOGGER.warn("Question label missing; transcript for {} not stored", contactEmail);
      return false;
    }

    try {
      SheetsProperties.QuestionColumns columns = properties.questionColumns().get(questionLabel);
      if (columns == null) {
        LOGGER.warn("No column mapping found for question: {}", questionLabel);
        return false;
      }
      String linkColumn = ColumnLetters.normalize(columns.linkColumn());
      String transcriptColumn = ColumnLetters.normalize(columns.transcriptColumn());
      String sheetName = properties.sheetName();

      int row = findOrAllocateRow(sheetName, contactEmail);
      sheets.writeCell(sheetName, linkColumn, row, mediaUrl);
      sheets.writeCell(
          sheetName, transcriptColumn, row, withQualityNotes(transcriptText, qualityReport));

      LOGGER.info(
          "Stored transcript: email={}, question={}, row={}", contactEmail, questionLabel, row);
      return true;
    } catch (StoreException | IllegalArgumentException e) {
      LOGGER.error(
          "Error updating transcript in sheets: email={}, question={}, error={}",
          contactEmail,
          questionLabel,
          e.getMessage(),
          e);
      return false;
    }
  }

  private int findOrAllocateRow(String sheetName, String email) {
    String wanted = email.trim();
    List<String> emails =
        sheets.readColumn(sheetName, ColumnLetters.normalize(properties.emailColumn()));
    for (int i = 0; i < emails.size(); i++) {
      if (emails.get(i).trim().equalsIgnoreCase(wanted)) {
        return i + 1;
      }
    }
    List<String> used =
        sheets.readColumn(sheetName, ColumnLetters.normalize(properties.rowCountColumn()));
    return used.size() + 1;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /**
   * Append a quality-notes footer when the report carries warnings.
   *
   * <pre>
   * transcript text
   *
   * Quality Notes:
   * - Confidence: 85.00%
   * - High number of uncertain words
   * </pre>
   */
  static String withQualityNotes(String transcript, QualityReport report) {
    String text = transcript == null ? "" : transcript;
    if (report == null || report.warnings() == null || report.warnings().isEmpty()) {
      return text.strip();
    }
    double confidence = report.overallConfidence() == null ? 0.0 : report.overallConfidence();
    StringBuilder notes = new StringBuilder();
    notes.append("\n\nQuality Notes:\n");
    notes.append(String.format(Locale.ROOT, "- Confidence: %.2f%%", confidence * 100));
    for (String warning : report.warnings()) {
      notes.append("\n- ").append(warning);
    }
    return (text + "\n" + notes).strip();
  }
}
