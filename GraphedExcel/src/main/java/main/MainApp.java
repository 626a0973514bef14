package main;

import controller.AnalysisController;
import model.AppConfig;
import model.AppModel;
import repository.WorkbookLoadException;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.File;
import java.io.PrintStream;
import java.io.PrintWriter;

public class MainApp {

    private static final Logger log = LogManager.getLogger(MainApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_LOAD_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "graphedexcel [options] [workbook.xlsx]";

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        System.exit(run(args, AppConfig.load(), System.out));
    }

    static int run(String[] args, AppConfig config, PrintStream out) {
        AppModel model;
        try {
            model = parseArgs(args, config);
        } catch (ParseException ex) {
            out.println(ex.getMessage());
            printHelp(out);
            return EXIT_USAGE;
        }
        if (model == null) {
            printHelp(out);
            return EXIT_OK;
        }

        if (model.isVerbose()) {
            Configurator.setRootLevel(Level.DEBUG);
        }
        log.info("Starting analysis: {}", model.getWorkbookFile());

        try {
            AnalysisController.create(model, config, out).run();
            return EXIT_OK;
        } catch (WorkbookLoadException ex) {
            log.error("Workbook load failed", ex);
            out.println("Error: " + ex.getMessage());
            return EXIT_LOAD_ERROR;
        }
    }

    static Options options() {
        Options options = new Options();
        options.addOption("v", "verbose", false, "Per-cell trace logging");
        options.addOption(Option.builder().longOpt("no-visualize").desc("Do not render the graph image").build());
        options.addOption(Option.builder().longOpt("keep-direction")
                .desc("Render the directed graph instead of the undirected view").build());
        options.addOption("h", "help", false, "Show this help");
        return options;
    }

    /**
     * @return the run options, or null when help was requested
     */
    static AppModel parseArgs(String[] args, AppConfig config) throws ParseException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (cmd.hasOption("help")) return null;

        String[] positional = cmd.getArgs();
        if (positional.length > 1) {
            throw new ParseException("Only one workbook path expected, got " + positional.length);
        }

        AppModel model = new AppModel();
        model.setWorkbookFile(new File(positional.length == 1 ? positional[0] : config.getDefaultWorkbook()));
        model.setVerbose(cmd.hasOption("verbose"));
        model.setVisualize(!cmd.hasOption("no-visualize"));
        model.setKeepDirection(cmd.hasOption("keep-direction"));
        return model;
    }

    private static void printHelp(PrintStream out) {
        PrintWriter pw = new PrintWriter(out);
        new HelpFormatter().printHelp(pw, HelpFormatter.DEFAULT_WIDTH, USAGE, null, options(),
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        pw.flush();
    }
}
