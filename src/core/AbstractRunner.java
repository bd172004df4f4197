package core;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;

/**
 *
 * Shared command line state and console logging.
 */
public class AbstractRunner {

    protected static CommandLineParser parser;
    protected static Options options;
    protected static CommandLine cmd;
    protected static boolean verbose = true;
    protected static boolean debug = false;

    protected static void addOption(String optName, String optDesc) {
        options.addOption(OptionBuilder.withLongOpt(optName)
                .withDescription(optDesc)
                .hasArg()
                .withArgName(optName)
                .create());
    }

    public static void setVerbose(boolean v) {
        verbose = v;
    }

    public static void setDebug(boolean d) {
        debug = d;
    }

    public static void log(String msg) {
        System.out.print("[LOG] " + msg);
    }

    public static void logln(String msg) {
        System.out.println("[LOG] " + msg);
    }

    public static String getHelpString(String className) {
        return "java -cp 'target/hpyp-sampler-1.0.0.jar:lib/*' "
                + className + " -help";
    }
}
