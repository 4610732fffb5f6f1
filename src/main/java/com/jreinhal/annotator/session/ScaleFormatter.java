package com.jreinhal.annotator.session;

import com.jreinhal.annotator.schema.FieldDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a dimension string such as {@code 0.78*0.41*0.54} multiplied by a scale factor.
 * The separator of the input is kept ({@code *}, {@code x} or {@code ×}, padded with spaces);
 * input without one is treated as space separated.
 */
public final class ScaleFormatter {
    private static final String[] SEPARATORS = {"*", "x", "×"};

    private ScaleFormatter() {
    }

    public static String apply(Object base, Object multiplier) {
        String text = base == null ? "" : String.valueOf(base).trim();
        if (text.isEmpty()) {
            return "";
        }
        String normalized = text;
        for (String separator : SEPARATORS) {
            normalized = normalized.replace(separator, " ");
        }
        List<Double> numbers = new ArrayList<>();
        for (String part : normalized.trim().split("\\s+")) {
            try {
                numbers.add(Double.parseDouble(part));
            } catch (NumberFormatException e) {
                return text;
            }
        }
        double factor = parseScale(multiplier);
        String separator = separatorOf(text);
        String joiner = separator.isEmpty() ? " " : " " + separator + " ";
        List<String> scaled = new ArrayList<>(numbers.size());
        for (Double number : numbers) {
            scaled.add(format(number * factor));
        }
        return String.join(joiner, scaled);
    }

    /**
     * Multiplier value with blank or unparseable input read as {@link FieldDescriptor#DEFAULT_SCALE}.
     */
    public static double parseScale(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value == null) {
            return FieldDescriptor.DEFAULT_SCALE;
        }
        String text = String.valueOf(value).trim();
        if (text.isEmpty()) {
            return FieldDescriptor.DEFAULT_SCALE;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return FieldDescriptor.DEFAULT_SCALE;
        }
    }

    static String format(double value) {
        return value >= 0.01
            ? String.format(Locale.ROOT, "%.2f", value)
            : String.format(Locale.ROOT, "%.4f", value);
    }

    private static String separatorOf(String text) {
        for (String separator : SEPARATORS) {
            if (text.contains(separator)) {
                return separator;
            }
        }
        return "";
    }
}
