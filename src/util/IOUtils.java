package util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipOutputStream;

/**
 *
 * File helpers.
 */
public class IOUtils {

    public static void createFolder(String folder) {
        createFolder(new File(folder));
    }

    public static void createFolder(File folder) {
        if (!folder.exists() && !folder.mkdirs()) {
            throw new RuntimeException("Could not create folder " + folder);
        }
    }

    public static BufferedReader getBufferedReader(File file) throws FileNotFoundException {
        return new BufferedReader(new InputStreamReader(
                new FileInputStream(file), StandardCharsets.UTF_8));
    }

    public static BufferedReader getBufferedReader(String filepath) throws FileNotFoundException {
        return getBufferedReader(new File(filepath));
    }

    public static BufferedWriter getBufferedWriter(File file) throws FileNotFoundException {
        return new BufferedWriter(new OutputStreamWriter(
                new FileOutputStream(file), StandardCharsets.UTF_8));
    }

    public static BufferedWriter getBufferedWriter(String filepath) throws FileNotFoundException {
        return getBufferedWriter(new File(filepath));
    }

    public static ZipOutputStream getZipOutputStream(String filepath) throws IOException {
        File parent = new File(filepath).getAbsoluteFile().getParentFile();
        if (parent != null) {
            createFolder(parent);
        }
        return new ZipOutputStream(new FileOutputStream(filepath));
    }
}
