package model;

/** Output of one workbook scan: the dependency graph and the function usage counts. */
public class AnalysisResult {

    private final DependencyGraph graph;
    private final FunctionUsageTable functionUsage;
    private final int formulaCount;

    public AnalysisResult(DependencyGraph graph, FunctionUsageTable functionUsage, int formulaCount) {
        this.graph = graph;
        this.functionUsage = functionUsage;
        this.formulaCount = formulaCount;
    }

    public DependencyGraph getGraph() { return graph; }
    public FunctionUsageTable getFunctionUsage() { return functionUsage; }
    public int getFormulaCount() { return formulaCount; }
}
