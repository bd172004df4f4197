package util;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;

/**
 *
 * Typed access to command line arguments with defaults.
 */
public class CLIUtils {

    public static void printHelp(String helpString, Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(helpString, options);
    }

    public static String getStringArgument(CommandLine cmd, String option, String defaultVal) {
        if (cmd.hasOption(option)) {
            return cmd.getOptionValue(option);
        }
        return defaultVal;
    }

    public static int getIntegerArgument(CommandLine cmd, String option, int defaultVal) {
        if (cmd.hasOption(option)) {
            return Integer.parseInt(cmd.getOptionValue(option));
        }
        return defaultVal;
    }

    /**
     * Comma-separated list of doubles, e.g. "0.5,0.7,0.9".
     */
    public static double[] getDoubleArrayArgument(CommandLine cmd, String option,
            double[] defaultVal) {
        if (!cmd.hasOption(option)) {
            return defaultVal;
        }
        String[] sval = cmd.getOptionValue(option).split(",");
        double[] vals = new double[sval.length];
        for (int i = 0; i < sval.length; i++) {
            vals[i] = Double.parseDouble(sval[i].trim());
        }
        return vals;
    }
}
