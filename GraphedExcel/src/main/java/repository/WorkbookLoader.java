package repository;

import java.io.File;

import model.WorkbookContents;

/**
 * Source of workbook cells: sheets in workbook order, cells row by row.
 */
public interface WorkbookLoader {

    WorkbookContents load(File file) throws WorkbookLoadException;
}
