package service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import model.FunctionUsageTable;

/**
 * Counts function calls in a formula: every run of uppercase letters directly followed by {@code (}.
 */
public class FunctionUsageCounter {

    private static final Pattern FUNCTION_CALL = Pattern.compile("([A-Z]+)\\(");

    /** Calls found in {@code formula}; one count per occurrence. */
    public FunctionUsageTable count(String formula) {
        FunctionUsageTable table = new FunctionUsageTable();
        if (formula == null) return table;

        Matcher m = FUNCTION_CALL.matcher(formula);
        while (m.find()) {
            table.increment(m.group(1));
        }
        return table;
    }
}
