package main;

import core.AbstractRunner;
import data.SequenceDataset;
import java.io.File;
import org.apache.commons.cli.BasicParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import sampler.HPYPModel;
import sampler.HPYPParameters;
import sampling.restaurant.RestaurantFactory;
import sampling.restaurant.RestaurantType;
import sampling.util.NodeManager;
import util.CLIUtils;
import util.ConfigurationException;
import util.MiscUtils;

/**
 * Train an HPYP sequence model on a file and report its loss.
 */
public class RunHPYP extends AbstractRunner {

    public static void main(String[] args) {
        try {
            run(args);
        } catch (Exception e) {
            e.printStackTrace();
            if (options != null) {
                CLIUtils.printHelp(getHelpString(RunHPYP.class.getName()), options);
            }
            System.exit(1);
        }
    }

    public static void addOptions() {
        options = new Options();

        // data
        addOption("input", "Input sequence file");
        addOption("format", "Input format: int (whitespace-separated ids) or char");
        addOption("numTypes", "Number of symbol types (default: from the data)");
        addOption("output", "File to save the trained model to");

        // sampling configurations
        addOption("burnIn", "Burn-in");
        addOption("maxIter", "Maximum number of iterations");
        addOption("sampleLag", "Sample lag");
        addOption("report", "Report interval");
        addOption("seed", "Random seed");

        // model
        addOption("restaurant", "Restaurant representation: FULL, FRACTIONAL, HISTOGRAM, "
                + "KNESER_NEY, REINSTANTIATING_COMPACT or STIRLING_COMPACT");
        addOption("depth", "Maximum context length");
        addOption("discounts", "Comma-separated discounts, one per depth");
        addOption("concentrations", "Comma-separated concentrations, one per depth");

        options.addOption("paramOpt", false, "Whether hyperparameter "
                + "optimization using slice sampling is performed");
        options.addOption("log", false, "Write a log file next to the output");
        options.addOption("v", false, "verbose");
        options.addOption("d", false, "debug");
        options.addOption("help", false, "Help");
    }

    /**
     * Parse the arguments and train. Returns the trained model, or null if
     * only help was requested.
     */
    public static HPYPModel run(String[] args) throws Exception {
        parser = new BasicParser();
        addOptions();
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            throw new ConfigurationException("Invalid arguments. " + e.getMessage(), e);
        }
        if (cmd.hasOption("help")) {
            CLIUtils.printHelp(getHelpString(RunHPYP.class.getName()), options);
            return null;
        }
        verbose = cmd.hasOption("v");
        debug = cmd.hasOption("d");
        return runModel();
    }

    public static HPYPModel runModel() throws Exception {
        String inputFile = CLIUtils.getStringArgument(cmd, "input", null);
        if (inputFile == null) {
            throw new ConfigurationException("Missing input file");
        }
        SequenceDataset.Format format = SequenceDataset.parseFormat(
                CLIUtils.getStringArgument(cmd, "format", "int"));
        String outputFile = CLIUtils.getStringArgument(cmd, "output", null);

        int burnIn = CLIUtils.getIntegerArgument(cmd, "burnIn", 10);
        int maxIters = CLIUtils.getIntegerArgument(cmd, "maxIter", 50);
        int sampleLag = CLIUtils.getIntegerArgument(cmd, "sampleLag", 1);
        int repInterval = CLIUtils.getIntegerArgument(cmd, "report", 10);
        boolean paramOpt = cmd.hasOption("paramOpt");

        RestaurantType type;
        String typeName = CLIUtils.getStringArgument(cmd, "restaurant", "STIRLING_COMPACT");
        try {
            type = RestaurantType.valueOf(typeName.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown restaurant " + typeName, e);
        }
        int depth = CLIUtils.getIntegerArgument(cmd, "depth", 5);
        double[] discounts = CLIUtils.getDoubleArrayArgument(cmd, "discounts",
                HPYPParameters.DEFAULT_DISCOUNTS);
        double[] concentrations = CLIUtils.getDoubleArrayArgument(cmd, "concentrations",
                HPYPParameters.DEFAULT_CONCENTRATIONS);

        if (verbose) {
            logln("Loading data ...");
        }
        SequenceDataset dataset = new SequenceDataset(
                new File(inputFile).getName());
        dataset.load(new File(inputFile), format);
        int numTypes = CLIUtils.getIntegerArgument(cmd, "numTypes",
                Math.max(1, dataset.getNumTypes()));

        if (cmd.hasOption("seed")) {
            HPYPModel.setRandomSeed(Long.parseLong(cmd.getOptionValue("seed")));
        }

        RestaurantFactory factory = new RestaurantFactory(type);
        NodeManager nodeManager = new NodeManager(factory, depth);
        HPYPParameters params = new HPYPParameters(discounts, concentrations);
        HPYPModel model = new HPYPModel(dataset.getSequence(), nodeManager, factory,
                params, numTypes);
        model.setVerbose(verbose);
        model.setDebug(debug);
        File outFile = outputFile == null ? null : new File(outputFile);
        model.configure(outFile == null ? null : outFile.getAbsoluteFile().getParent(),
                paramOpt, burnIn, maxIters, sampleLag, repInterval);
        model.setLog(cmd.hasOption("log"));

        model.sample();
        model.finishTraining();

        double loss = model.computeLosses(0, dataset.size());
        double bitsPerSymbol = dataset.size() == 0 ? 0.0
                : loss / dataset.size() / Math.log(2);
        logln("Loss: " + MiscUtils.formatDouble(loss) + " nats. "
                + MiscUtils.formatDouble(bitsPerSymbol) + " bits per symbol. "
                + "# nodes: " + nodeManager.getNumNodes());
        if (paramOpt) {
            logln("Parameters: " + params);
        }

        if (outFile != null) {
            model.outputState(outFile);
            logln("Model saved to " + outFile);

            File outFolder = outFile.getAbsoluteFile().getParentFile();
            model.outputLogLikelihoods(new File(outFolder, HPYPModel.LikelihoodFile));
            if (paramOpt) {
                model.outputSampledHyperparameters(
                        new File(outFolder, HPYPModel.HyperparameterFile),
                        params.getSampledHistory());
            }
        }
        return model;
    }
}
