package model;

/**
 * A node of the dependency graph: a single cell or a rectangular range.
 * <p>
 * A reference without a sheet ({@link #getSheet()} == null) inherits the sheet of
 * the formula it was read from; {@link #qualify(String)} resolves it.
 */
public interface Reference {

    String getSheet();

    /** Returns this reference if already qualified, otherwise a copy on the given sheet. */
    Reference qualify(String sheet);

    /** Canonical text, e.g. {@code Sheet1!A1} or {@code 'My Sheet'!A1:B2}. */
    @Override
    String toString();
}
