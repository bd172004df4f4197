package util;

import java.text.DecimalFormat;
import java.text.NumberFormat;

/**
 *
 * Formatting helpers used for logging and model dumps.
 */
public class MiscUtils {

    protected static final NumberFormat formatter = new DecimalFormat("###.###");

    public static String arrayToString(double[] array) {
        if (array.length == 0) {
            return "[]";
        }
        StringBuilder str = new StringBuilder();
        str.append("[").append(formatDouble(array[0]));
        for (int i = 1; i < array.length; i++) {
            str.append(", ").append(formatDouble(array[i]));
        }
        str.append("]");
        return str.toString();
    }

    public static String arrayToString(int[] array) {
        if (array.length == 0) {
            return "[]";
        }
        StringBuilder str = new StringBuilder();
        str.append("[").append(array[0]);
        for (int i = 1; i < array.length; i++) {
            str.append(", ").append(array[i]);
        }
        str.append("]");
        return str.toString();
    }

    public static String formatDouble(double value) {
        return formatter.format(value);
    }
}
