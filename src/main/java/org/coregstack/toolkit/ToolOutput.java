package org.coregstack.toolkit;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts numbers from labelled lines of captured toolkit output.
 * <p>
 * The line formats are owned by the toolkit. Parsing never guesses: a missing label or an
 * unexpected number of values raises {@link ToolOutputFormatException}.
 */
public final class ToolOutput {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?");

    private ToolOutput() {
    }

    /**
     * Finds the first line containing {@code label}.
     *
     * @throws ToolOutputFormatException if no line contains the label
     */
    public static String lineWith(String output, String label) {
        for (String line : output.split("\\R")) {
            if (line.contains(label)) {
                return line;
            }
        }
        throw new ToolOutputFormatException("No line labelled '" + label + "' in toolkit output");
    }

    /**
     * Parses the numbers that follow {@code label} on its line, in order.
     *
     * @param expected number of values the line must carry
     * @throws ToolOutputFormatException if the line is missing or carries a different number of values
     */
    public static double[] numbersAfter(String output, String label, int expected) {
        String line = lineWith(output, label);
        String tail = line.substring(line.indexOf(label) + label.length());
        List<Double> values = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(tail);
        while (matcher.find()) {
            values.add(Double.parseDouble(matcher.group()));
        }
        if (values.size() != expected) {
            throw new ToolOutputFormatException("Expected " + expected + " values after '" + label
                    + "' but found " + values.size() + ": '" + line.trim() + "'");
        }
        double[] result = new double[expected];
        for (int i = 0; i < expected; i++) {
            result[i] = values.get(i);
        }
        return result;
    }
}
