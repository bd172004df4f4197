package data;

import core.AbstractDataset;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TObjectIntHashMap;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import util.ConfigurationException;
import util.IOUtils;

/**
 * A single sequence of symbols, read either as whitespace-separated integer
 * ids or as the characters of a text file. Characters are mapped to dense ids
 * in order of first appearance, and the mapping is kept as the vocabulary.
 *
 * @see sampler.HPYPModel
 */
public class SequenceDataset extends AbstractDataset {

    public static enum Format {

        INT, CHAR
    }
    public static final String vocabExt = ".voc";
    private int[] sequence;
    private ArrayList<String> vocab;
    private int numTypes;

    public SequenceDataset(String name) {
        super(name);
        this.sequence = new int[0];
        this.numTypes = 0;
    }

    public int[] getSequence() {
        return this.sequence;
    }

    @Override
    public int size() {
        return this.sequence.length;
    }

    /**
     * Number of distinct symbols: the largest id plus one for integer input,
     * the vocabulary size for character input.
     */
    public int getNumTypes() {
        return this.numTypes;
    }

    /**
     * Symbols of the character vocabulary indexed by id, or null for integer
     * input.
     */
    public ArrayList<String> getVocab() {
        return this.vocab;
    }

    public String getSymbol(int id) {
        if (vocab == null) {
            return Integer.toString(id);
        }
        return vocab.get(id);
    }

    public static Format parseFormat(String format) {
        try {
            return Format.valueOf(format.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown sequence format " + format
                    + ". Expected int or char", e);
        }
    }

    public void load(File file, Format format) throws IOException {
        switch (format) {
            case INT:
                loadIntegerSequence(file);
                break;
            case CHAR:
                loadCharacterSequence(file);
                break;
            default:
                throw new ConfigurationException("Unsupported format " + format);
        }
    }

    public void loadIntegerSequence(File file) throws IOException {
        if (verbose) {
            logln("--- Loading integer sequence from " + file);
        }
        TIntArrayList symbols = new TIntArrayList();
        BufferedReader reader = IOUtils.getBufferedReader(file);
        try {
            String line;
            int lineNum = 0;
            while ((line = reader.readLine()) != null) {
                lineNum++;
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                for (String token : line.split("\\s+")) {
                    int symbol;
                    try {
                        symbol = Integer.parseInt(token);
                    } catch (NumberFormatException e) {
                        throw new ConfigurationException("Invalid symbol \"" + token
                                + "\" on line " + lineNum + " of " + file, e);
                    }
                    if (symbol < 0) {
                        throw new ConfigurationException("Negative symbol " + symbol
                                + " on line " + lineNum + " of " + file);
                    }
                    symbols.add(symbol);
                }
            }
        } finally {
            reader.close();
        }
        this.sequence = symbols.toArray();
        this.vocab = null;
        this.numTypes = symbols.isEmpty() ? 0 : symbols.max() + 1;

        if (verbose) {
            logln("--- --- # symbols: " + sequence.length + ". # types: " + numTypes);
        }
    }

    public void loadCharacterSequence(File file) throws IOException {
        if (verbose) {
            logln("--- Loading character sequence from " + file);
        }
        BufferedReader reader = IOUtils.getBufferedReader(file);
        try {
            loadCharacterSequence(reader, file.toString());
        } finally {
            reader.close();
        }
    }

    /**
     * Read characters until the end of the reader, one symbol per code point.
     * A surrogate that is not part of a pair is rejected.
     *
     * @param reader Source of the characters. It is not closed.
     * @param source Name of the source, for error messages
     */
    public void loadCharacterSequence(Reader reader, String source) throws IOException {
        TIntArrayList symbols = new TIntArrayList();
        TObjectIntHashMap<String> index = new TObjectIntHashMap<String>();
        ArrayList<String> charVocab = new ArrayList<String>();
        int c;
        long offset = 0;
        while ((c = reader.read()) != -1) {
            String ch;
            if (Character.isHighSurrogate((char) c)) {
                int low = reader.read();
                if (low == -1 || !Character.isLowSurrogate((char) low)) {
                    throw new ConfigurationException("Unpaired high surrogate at character "
                            + offset + " of " + source);
                }
                ch = new String(new char[]{(char) c, (char) low});
                offset++;
            } else if (Character.isLowSurrogate((char) c)) {
                throw new ConfigurationException("Unpaired low surrogate at character "
                        + offset + " of " + source);
            } else {
                ch = String.valueOf((char) c);
            }
            offset++;
            if (!index.containsKey(ch)) {
                index.put(ch, charVocab.size());
                charVocab.add(ch);
            }
            symbols.add(index.get(ch));
        }
        this.sequence = symbols.toArray();
        this.vocab = charVocab;
        this.numTypes = charVocab.size();

        if (verbose) {
            logln("--- --- # characters: " + sequence.length + ". # types: " + numTypes);
        }
    }

    /**
     * Write the character vocabulary, one symbol per line in id order.
     * Newlines and tabs are escaped.
     */
    public void outputVocab(File file) throws IOException {
        if (vocab == null) {
            throw new ConfigurationException("Integer sequences have no vocabulary");
        }
        BufferedWriter writer = IOUtils.getBufferedWriter(file);
        try {
            for (String symbol : vocab) {
                writer.write(symbol.replace("\\", "\\\\").replace("\n", "\\n")
                        .replace("\r", "\\r").replace("\t", "\\t"));
                writer.write("\n");
            }
        } finally {
            writer.close();
        }
    }
}
