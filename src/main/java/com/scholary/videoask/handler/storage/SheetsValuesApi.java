package com.scholary.videoask.handler.storage;

import java.util.List;

/**
 * Range reads and single-cell writes against one spreadsheet.
 *
 * <p>Ranges are addressed by sheet name, column letter and row number.
 */
public interface SheetsValuesApi {

  /**
   * Read a whole column.
   *
   * @return the first cell of each returned row, in order; empty rows become empty strings
   * @throws StoreException on transport or HTTP failure
   */
  List<String> readColumn(String sheetName, String column);

  /**
   * Write one raw value into a single cell.
   *
   * @throws StoreException on transport or HTTP failure
   */
  void writeCell(String sheetName, String column, int row, String value);
}
