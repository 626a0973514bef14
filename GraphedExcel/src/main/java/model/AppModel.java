package model;

import java.io.File;

/**
 * The state of one analysis run.
 * Options from the command line, then the graph and function table once built.
 */
public class AppModel {

    private File workbookFile;
    private boolean verbose;
    private boolean visualize = true;
    private boolean keepDirection;

    private DependencyGraph graph;
    private FunctionUsageTable functionUsage;

    public File getWorkbookFile() { return workbookFile; }
    public void setWorkbookFile(File workbookFile) { this.workbookFile = workbookFile; }

    public boolean isVerbose() { return verbose; }
    public void setVerbose(boolean verbose) { this.verbose = verbose; }

    public boolean isVisualize() { return visualize; }
    public void setVisualize(boolean visualize) { this.visualize = visualize; }

    public boolean isKeepDirection() { return keepDirection; }
    public void setKeepDirection(boolean keepDirection) { this.keepDirection = keepDirection; }

    public DependencyGraph getGraph() { return graph; }
    public void setGraph(DependencyGraph graph) { this.graph = graph; }

    public FunctionUsageTable getFunctionUsage() { return functionUsage; }
    public void setFunctionUsage(FunctionUsageTable functionUsage) { this.functionUsage = functionUsage; }
}
