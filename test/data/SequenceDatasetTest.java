package data;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import util.ConfigurationException;

import static org.junit.jupiter.api.Assertions.*;

public class SequenceDatasetTest {

    @TempDir
    File tempDir;

    private File write(String name, String content) throws IOException {
        File file = new File(tempDir, name);
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testIntegerSequence() throws IOException {
        File file = write("seq.txt", "0 1 2\n\n1   2\t4\n");
        SequenceDataset dataset = new SequenceDataset("seq");
        dataset.load(file, SequenceDataset.Format.INT);
        assertArrayEquals(new int[]{0, 1, 2, 1, 2, 4}, dataset.getSequence());
        assertEquals(6, dataset.size());
        assertEquals(5, dataset.getNumTypes());
        assertNull(dataset.getVocab());
        assertEquals("4", dataset.getSymbol(4));
        assertEquals("seq", dataset.getName());
    }

    @Test
    public void testInvalidIntegers() throws IOException {
        SequenceDataset dataset = new SequenceDataset("bad");
        File negative = write("negative.txt", "0 -3 1");
        assertThrows(ConfigurationException.class,
                () -> dataset.load(negative, SequenceDataset.Format.INT));
        File text = write("text.txt", "0 one 1");
        assertThrows(ConfigurationException.class,
                () -> dataset.load(text, SequenceDataset.Format.INT));
    }

    @Test
    public void testCharacterSequence() throws IOException {
        File file = write("chars.txt", "abcab");
        SequenceDataset dataset = new SequenceDataset("chars");
        dataset.load(file, SequenceDataset.Format.CHAR);
        assertArrayEquals(new int[]{0, 1, 2, 0, 1}, dataset.getSequence());
        assertEquals(3, dataset.getNumTypes());
        List<String> vocab = dataset.getVocab();
        assertEquals("a", vocab.get(0));
        assertEquals("c", dataset.getSymbol(2));
    }

    @Test
    public void testSupplementaryCharactersAreSingleSymbols() throws IOException {
        File file = write("emoji.txt", "x😀x");
        SequenceDataset dataset = new SequenceDataset("emoji");
        dataset.load(file, SequenceDataset.Format.CHAR);
        assertArrayEquals(new int[]{0, 1, 0}, dataset.getSequence());
        assertEquals("😀", dataset.getSymbol(1));
    }

    @Test
    public void testUnpairedSurrogatesRejected() throws IOException {
        SequenceDataset dataset = new SequenceDataset("surrogates");
        assertThrows(ConfigurationException.class,
                () -> dataset.loadCharacterSequence(new StringReader("ab\uD83D"), "text"));
        assertThrows(ConfigurationException.class,
                () -> dataset.loadCharacterSequence(new StringReader("a\uD83Db"), "text"));
        assertThrows(ConfigurationException.class,
                () -> dataset.loadCharacterSequence(new StringReader("a\uDE00"), "text"));

        dataset.loadCharacterSequence(new StringReader("a\uD83D\uDE00a"), "text");
        assertArrayEquals(new int[]{0, 1, 0}, dataset.getSequence());
        assertEquals("\uD83D\uDE00", dataset.getSymbol(1));
    }

    @Test
    public void testVocabOutput() throws IOException {
        File file = write("lines.txt", "a\nb");
        SequenceDataset dataset = new SequenceDataset("lines");
        dataset.load(file, SequenceDataset.Format.CHAR);
        File vocabFile = new File(tempDir, "lines" + SequenceDataset.vocabExt);
        dataset.outputVocab(vocabFile);
        List<String> lines = Files.readAllLines(vocabFile.toPath(), StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertEquals("a", lines.get(0));
        assertEquals("\\n", lines.get(1));
        assertEquals("b", lines.get(2));

        SequenceDataset ints = new SequenceDataset("ints");
        ints.load(write("ints.txt", "1 2"), SequenceDataset.Format.INT);
        assertThrows(ConfigurationException.class,
                () -> ints.outputVocab(new File(tempDir, "ints.voc")));
    }

    @Test
    public void testFormats() {
        assertEquals(SequenceDataset.Format.INT, SequenceDataset.parseFormat("int"));
        assertEquals(SequenceDataset.Format.CHAR, SequenceDataset.parseFormat(" CHAR "));
        assertThrows(ConfigurationException.class, () -> SequenceDataset.parseFormat("bytes"));
    }
}
