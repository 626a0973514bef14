package service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import model.CellAddress;
import model.RangeAddress;
import model.Reference;

/**
 * Tokenizer for cell and range references inside formula text.
 * <p>
 * Grammar:
 * <pre>
 *   cell      := COL ROW          COL = A..XFD, ROW = 1..1048576
 *   range     := cell ':' cell
 *   sheet     := bare | quoted    bare = [A-Za-z0-9_.\[\]]+, quoted = '...' with '' as escape
 *   reference := [sheet '!'] (range | cell)
 * </pre>
 * At every position the scanner tries, in order: qualified range, qualified cell,
 * bare range, bare cell. A match consumes its text, so a range is never reported as two cells.
 * {@code $} markers are removed before scanning. Unrecognised text is skipped, never rejected.
 * <p>
 * A cell token must start after something that is not a letter, digit, {@code _}, {@code .}
 * or {@code !}, and must not be followed by a letter, digit, {@code _}, {@code .} or
 * {@code (}: this keeps function names such as {@code LOG10(} out.
 */
public class ReferenceScanner {

    /** A reference together with where it was found in the ($-stripped) text. */
    static final class Token {
        private final Reference reference;
        private final int start;
        private final int end;

        Token(Reference reference, int start, int end) {
            this.reference = reference;
            this.start = start;
            this.end = end;
        }

        Reference getReference() { return reference; }
        int getStart() { return start; }
        int getEnd() { return end; }

        @Override
        public String toString() {
            return reference + "@" + start;
        }
    }

    private static final class SheetPrefix {
        final String sheet;
        final int end;   // first char after '!'

        SheetPrefix(String sheet, int end) {
            this.sheet = sheet;
            this.end = end;
        }
    }

    private static final class CellMatch {
        final CellAddress cell;
        final int end;

        CellMatch(CellAddress cell, int end) {
            this.cell = cell;
            this.end = end;
        }
    }

    public static String stripAbsoluteMarkers(String formula) {
        return formula.replace("$", "");
    }

    public List<Reference> scan(String formula) {
        List<Reference> out = new ArrayList<>();
        for (Token t : tokenize(formula)) {
            out.add(t.getReference());
        }
        return out;
    }

    List<Token> tokenize(String formula) {
        List<Token> out = new ArrayList<>();
        if (formula == null || formula.isEmpty()) return out;

        String s = stripAbsoluteMarkers(formula);
        int i = 0;
        while (i < s.length()) {
            int next = matchAt(s, i, out);
            i = next > i ? next : i + 1;
        }
        return out;
    }

    /** Returns the position after whatever was consumed at {@code i}, or {@code i} if nothing. */
    private int matchAt(String s, int i, List<Token> out) {
        SheetPrefix prefix = sheetPrefixAt(s, i);
        if (prefix != null) {
            Token t = referenceAt(s, prefix.end, prefix.sheet, i);
            if (t != null) {
                out.add(t);
                return t.getEnd();
            }
            // prefix without a valid reference: skip the whole prefix
            return prefix.end;
        }

        if (!isCellStart(s, i)) return i;

        Token t = referenceAt(s, i, null, i);
        if (t == null) return i;
        out.add(t);
        return t.getEnd();
    }

    // ===========================
    // Sheet prefix
    // ===========================

    private SheetPrefix sheetPrefixAt(String s, int i) {
        char ch = s.charAt(i);
        if (ch == '\'') return quotedSheetAt(s, i);
        if (!isBareSheetChar(ch)) return null;
        if (i > 0 && isBareSheetChar(s.charAt(i - 1))) return null;

        int j = i;
        while (j < s.length() && isBareSheetChar(s.charAt(j))) j++;
        if (j >= s.length() || s.charAt(j) != '!') return null;

        return new SheetPrefix(s.substring(i, j), j + 1);
    }

    private SheetPrefix quotedSheetAt(String s, int i) {
        StringBuilder name = new StringBuilder();
        int j = i + 1;
        while (j < s.length()) {
            char ch = s.charAt(j);
            if (ch == '\'') {
                if (j + 1 < s.length() && s.charAt(j + 1) == '\'') {
                    name.append('\'');
                    j += 2;
                    continue;
                }
                break;
            }
            name.append(ch);
            j++;
        }
        if (j + 1 >= s.length() || s.charAt(j) != '\'' || s.charAt(j + 1) != '!') return null;

        String sheet = name.toString().trim();
        if (sheet.isEmpty()) return null;
        return new SheetPrefix(sheet, j + 2);
    }

    private static boolean isBareSheetChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '.' || ch == '[' || ch == ']';
    }

    // ===========================
    // Cell / range
    // ===========================

    private Token referenceAt(String s, int pos, String sheet, int tokenStart) {
        CellMatch first = cellAt(s, pos);
        if (first == null) return null;

        if (first.end < s.length() && s.charAt(first.end) == ':') {
            Token range = rangeTail(s, first, sheet, tokenStart);
            if (range != null) return range;
        }

        if (!isCellEnd(s, first.end)) return null;
        return new Token(first.cell.qualify(sheet), tokenStart, first.end);
    }

    private Token rangeTail(String s, CellMatch first, String sheet, int tokenStart) {
        int pos = first.end + 1;

        // "Sheet1!A1:Sheet1!B2" only when both sides name the same sheet
        SheetPrefix second = pos < s.length() ? sheetPrefixAt(s, pos) : null;
        if (second != null) {
            if (sheet == null || !sameSheet(sheet, second.sheet)) return null;
            pos = second.end;
        }

        CellMatch last = cellAt(s, pos);
        if (last == null || !isCellEnd(s, last.end)) return null;

        return new Token(new RangeAddress(sheet, first.cell, last.cell), tokenStart, last.end);
    }

    private static boolean sameSheet(String a, String b) {
        return a.toUpperCase(Locale.ROOT).equals(b.toUpperCase(Locale.ROOT));
    }

    /** Column letters then row digits inside the sheet grid, no token boundary checks. */
    private CellMatch cellAt(String s, int pos) {
        int j = pos;
        while (j < s.length() && isUpper(s.charAt(j))) j++;
        int letters = j - pos;
        if (letters < 1 || letters > CellAddress.MAX_COLUMN_LETTERS) return null;

        int digitsStart = j;
        while (j < s.length() && Character.isDigit(s.charAt(j))) j++;
        if (j == digitsStart) return null;

        String digits = s.substring(digitsStart, j);
        if (digits.length() > 9) return null; // beyond the sheet grid
        int row = Integer.parseInt(digits);
        if (!CellAddress.isRowInGrid(row)) return null;

        String column = s.substring(pos, digitsStart);
        if (!CellAddress.isColumnInGrid(CellAddress.columnNumber(column))) return null;

        return new CellMatch(new CellAddress(null, column, row), j);
    }

    private static boolean isUpper(char ch) {
        return ch >= 'A' && ch <= 'Z';
    }

    private static boolean isCellStart(String s, int i) {
        if (!isUpper(s.charAt(i))) return false;
        if (i == 0) return true;
        char prev = s.charAt(i - 1);
        return !(Character.isLetterOrDigit(prev) || prev == '_' || prev == '.' || prev == '!');
    }

    private static boolean isCellEnd(String s, int end) {
        if (end >= s.length()) return true;
        char next = s.charAt(end);
        return !(Character.isLetterOrDigit(next) || next == '_' || next == '.' || next == '(');
    }
}
