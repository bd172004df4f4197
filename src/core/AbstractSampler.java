package core;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Random;
import util.ConfigurationException;
import util.IOUtils;

/**
 * Base class of the Gibbs samplers: sampling configuration, the run loop and
 * logging.
 */
public abstract class AbstractSampler {

    public static final String LikelihoodFile = "likelihoods.txt";
    public static final String HyperparameterFile = "hyperparameters.txt";
    protected static final long RAND_SEED = 1123581321;
    protected static Random rand = new Random(RAND_SEED);
    protected static long startTime;
    // sampling configurations
    protected int BURN_IN = 5;          // burn-in
    protected int MAX_ITER = 100;       // maximum number of iterations
    protected int LAG = 1;              // for outputing log-likelihood
    protected int REP_INTERVAL = 10;    // report interval
    protected String folder;
    protected String name;
    protected boolean paramOptimized = false;
    protected ArrayList<Double> logLikelihoods;
    protected int iter;
    protected boolean debug = false;
    protected boolean verbose = true;
    protected boolean log = false;
    protected BufferedWriter logger;

    public static void setSeed(long seed) {
        rand = new Random(seed);
    }

    public void setSamplerConfiguration(int burn_in, int max_iter, int lag, int repInt) {
        if (burn_in < 0 || max_iter < 0 || lag < 1 || repInt < 1) {
            throw new ConfigurationException("Invalid sampler configuration. burn-in = "
                    + burn_in + ", max iter = " + max_iter + ", lag = " + lag
                    + ", report = " + repInt);
        }
        BURN_IN = burn_in;
        MAX_ITER = max_iter;
        LAG = lag;
        REP_INTERVAL = repInt;
    }

    public boolean isReporting() {
        return verbose && iter % REP_INTERVAL == 0;
    }

    public int getBurnIn() {
        return this.BURN_IN;
    }

    public int getMaxIters() {
        return this.MAX_ITER;
    }

    public int getSampleLag() {
        return this.LAG;
    }

    public int getReportInterval() {
        return this.REP_INTERVAL;
    }

    public int getIteration() {
        return this.iter;
    }

    public abstract void initialize();

    public abstract void iterate();

    public abstract double getLogLikelihood();

    public abstract void validate(String msg);

    public abstract void outputState(String filepath) throws IOException;

    public abstract void inputState(String filepath) throws IOException;

    public String getCurrentState() {
        return "Iter " + iter;
    }

    public void outputState(File file) throws IOException {
        this.outputState(file.getAbsolutePath());
    }

    public void inputState(File file) throws IOException {
        this.inputState(file.getAbsolutePath());
    }

    public ArrayList<Double> getLogLikelihoods() {
        return this.logLikelihoods;
    }

    public String getSamplerName() {
        return this.name;
    }

    public String getSamplerFolderPath() {
        return new File(folder, name).getAbsolutePath();
    }

    public void sample() {
        if (log && folder != null) {
            openLogger();
        }

        logln(getClass().getSimpleName() + "\t" + getSamplerName());
        startTime = System.currentTimeMillis();

        initialize();

        iterate();

        float ellapsedSeconds = (System.currentTimeMillis() - startTime) / (1000);
        logln("Total runtime: " + ellapsedSeconds + " seconds");

        if (isLogging()) {
            closeLogger();
        }
    }

    public void openLogger() {
        try {
            IOUtils.createFolder(getSamplerFolderPath());
            this.logger = IOUtils.getBufferedWriter(new File(getSamplerFolderPath(), "log.txt"));
        } catch (FileNotFoundException e) {
            throw new RuntimeException("Cannot open log file in " + getSamplerFolderPath(), e);
        }
    }

    public void closeLogger() {
        try {
            this.logger.close();
        } catch (IOException e) {
            throw new RuntimeException("Cannot close log file", e);
        } finally {
            this.logger = null;
        }
    }

    public void setLog(boolean l) {
        this.log = l;
    }

    public void setDebug(boolean d) {
        this.debug = d;
    }

    public void setVerbose(boolean v) {
        this.verbose = v;
    }

    protected void logln(String msg) {
        System.out.println("[LOG] " + msg);
        try {
            if (logger != null) {
                this.logger.write(msg + "\n");
            }
        } catch (IOException e) {
            throw new RuntimeException("Cannot write to log file", e);
        }
    }

    public boolean isLogging() {
        return this.logger != null;
    }

    public boolean areParamsOptimized() {
        return this.paramOptimized;
    }

    /**
     * One line per recorded log likelihood, which is taken every report
     * interval, with the iteration it was taken at.
     */
    public void outputLogLikelihoods(File file) throws IOException {
        BufferedWriter writer = IOUtils.getBufferedWriter(file);
        try {
            for (int i = 0; i < logLikelihoods.size(); i++) {
                writer.write((i * REP_INTERVAL) + "\t" + logLikelihoods.get(i) + "\n");
            }
        } finally {
            writer.close();
        }
    }

    /**
     * Write one line per recorded hyperparameter sample.
     */
    public void outputSampledHyperparameters(File file, ArrayList<ArrayList<Double>> sampledParams)
            throws IOException {
        logln("Outputing sampled hyperparameters to file " + file);
        BufferedWriter writer = IOUtils.getBufferedWriter(file);
        try {
            for (int i = 0; i < sampledParams.size(); i++) {
                writer.write(Integer.toString(i));
                for (double p : sampledParams.get(i)) {
                    writer.write("\t" + p);
                }
                writer.write("\n");
            }
        } finally {
            writer.close();
        }
    }
}
