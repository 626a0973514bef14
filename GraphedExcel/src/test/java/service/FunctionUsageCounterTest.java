package service;

import model.FunctionUsageTable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FunctionUsageCounterTest {

    private final FunctionUsageCounter counter = new FunctionUsageCounter();

    @Test
    void testSameFunctionTwiceCountsTwo() {
        FunctionUsageTable t = counter.count("=SUM(A1:A3)+SUM(B1:B3)");

        assertEquals(2, t.count("SUM"));
        assertEquals(1, t.size());
    }

    @Test
    void testNestedCalls() {
        FunctionUsageTable t = counter.count("=IF(ISBLANK(A1),0,VLOOKUP(A1,B1:C9,2,FALSE))");

        assertEquals(1, t.count("IF"));
        assertEquals(1, t.count("ISBLANK"));
        assertEquals(1, t.count("VLOOKUP"));
        assertEquals(0, t.count("FALSE"));
    }

    @Test
    void testPrefixedFunctionNameCountedWithoutPrefix() {
        assertEquals(1, counter.count("=_xlfn.XLOOKUP(A1,B1:B3,C1:C3)").count("XLOOKUP"));
    }

    @Test
    void testNoFunctions() {
        assertTrue(counter.count("=A1+1").isEmpty());
        assertTrue(counter.count(null).isEmpty());
    }

    @Test
    void testPerFormulaTablesMergeIntoRunTable() {
        FunctionUsageTable run = new FunctionUsageTable();
        run.merge(counter.count("=SUM(A1:A2)"));
        run.merge(counter.count("=MAX(A1,SUM(B1:B2))"));

        assertEquals(2, run.count("SUM"));
        assertEquals(1, run.count("MAX"));
    }
}
