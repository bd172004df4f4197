package main;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sampler.HPYPModel;
import sampling.restaurant.RestaurantType;
import util.ConfigurationException;

import static org.junit.jupiter.api.Assertions.*;

public class RunHPYPTest {

    @TempDir
    File tempDir;

    private File writeInput(String content) throws IOException {
        File file = new File(tempDir, "input.txt");
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testTrainAndSave() throws Exception {
        File input = writeInput("0 1 2 1 2 0 1 2 1 2\n");
        File output = new File(tempDir, "model.zip");
        HPYPModel model = RunHPYP.run(new String[]{
            "--input", input.getPath(),
            "--output", output.getPath(),
            "--restaurant", "histogram",
            "--depth", "2",
            "--burnIn", "1",
            "--maxIter", "4",
            "--report", "2",
            "--seed", "7",
            "--discounts", "0.5,0.6",
            "--concentrations", "1.0",
            "-paramOpt",
            "-log"
        });
        assertNotNull(model);
        assertEquals(RestaurantType.HISTOGRAM, model.getFactory().getType());
        assertEquals(3, model.getNumTypes());
        assertEquals(2, model.getNodeManager().getMaxDepth());
        assertEquals(HPYPModel.ModelState.READY, model.getState());
        assertTrue(output.exists());
        model.checkConsistency();

        // recorded at iterations 0 and 2 only
        List<String> llhs = Files.readAllLines(new File(tempDir, HPYPModel.LikelihoodFile).toPath());
        assertEquals(2, llhs.size());
        assertTrue(llhs.get(0).startsWith("0\t"));
        assertTrue(llhs.get(1).startsWith("2\t"));
        // resampled after iterations 1, 2 and 3
        assertEquals(3, Files.readAllLines(
                new File(tempDir, HPYPModel.HyperparameterFile).toPath()).size());
        assertTrue(new File(model.getSamplerFolderPath(), "log.txt").exists());
    }

    @Test
    public void testCharacterInput() throws Exception {
        File input = writeInput("abracadabra");
        HPYPModel model = RunHPYP.run(new String[]{
            "--input", input.getPath(),
            "--format", "char",
            "--maxIter", "2",
            "--burnIn", "0"
        });
        assertNotNull(model);
        assertEquals(5, model.getNumTypes());
        assertEquals(RestaurantType.STIRLING_COMPACT, model.getFactory().getType());
        assertEquals(11, model.getNumSeated());
    }

    @Test
    public void testHelp() throws Exception {
        assertNull(RunHPYP.run(new String[]{"-help"}));
    }

    @Test
    public void testInvalidArguments() throws Exception {
        File input = writeInput("0 1 0");
        assertThrows(ConfigurationException.class, () -> RunHPYP.run(new String[]{}));
        assertThrows(ConfigurationException.class, () -> RunHPYP.run(new String[]{
            "--input", input.getPath(), "--restaurant", "chinese"}));
        assertThrows(ConfigurationException.class, () -> RunHPYP.run(new String[]{
            "--input", input.getPath(), "--discounts", "1.5"}));
        assertThrows(ConfigurationException.class, () -> RunHPYP.run(new String[]{
            "--input", input.getPath(), "--numTypes", "1"}));
    }
}
