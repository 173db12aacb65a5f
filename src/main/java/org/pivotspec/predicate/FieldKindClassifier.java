package org.pivotspec.predicate;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import org.pivotspec.dates.DerivedDateField;
import org.pivotspec.dates.FlexibleDateParser;

import com.typesafe.config.Config;

/**
 * Best-effort classifier deciding whether a field filters as a string, number or date.
 * <p>
 * Classification is a majority vote over the first few sample values (default 12): a kind wins
 * when at least {@code max(1, ceil(n / 2))} samples look like it. Numbers are tested before
 * dates, so year-only or epoch-like columns classify as numbers. Sparse or bimodal columns
 * can be misclassified; the result is a hint, not a schema.
 */
public class FieldKindClassifier {

    /** Default number of samples that take part in the vote. */
    public static final int DEFAULT_SAMPLE_SIZE = 12;

    private static final Pattern NUMERIC = Pattern.compile("^[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?$");
    private static final Pattern DATE_NAME = Pattern.compile("(date|time|timestamp|_at$|_on$)");

    private final int sampleSize;

    public FieldKindClassifier() {
        this(DEFAULT_SAMPLE_SIZE);
    }

    /**
     * @param sampleSize maximum number of non-null samples considered
     */
    public FieldKindClassifier(int sampleSize) {
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be positive: " + sampleSize);
        }
        this.sampleSize = sampleSize;
    }

    /**
     * Creates a classifier from configuration, reading the optional {@code sample-size}.
     *
     * @param options classifier configuration
     * @return the classifier
     */
    public static FieldKindClassifier fromConfig(Config options) {
        return new FieldKindClassifier(options.hasPath("sample-size")
            ? options.getInt("sample-size")
            : DEFAULT_SAMPLE_SIZE);
    }

    /**
     * Classifies a field.
     *
     * @param fieldName field name, consulted for derived date parts and when no samples exist
     * @param samples   sample values, may contain nulls or be empty
     * @return the inferred kind
     */
    public FieldKind classify(String fieldName, List<?> samples) {
        Optional<DerivedDateField> derived = DerivedDateField.parse(fieldName);
        if (derived.isPresent()) {
            return derived.get().part().isNumeric() ? FieldKind.NUMBER : FieldKind.STRING;
        }

        List<Object> considered = new ArrayList<>();
        if (samples != null) {
            for (Object sample : samples) {
                if (sample != null && !sample.toString().isBlank()) {
                    considered.add(sample);
                    if (considered.size() == sampleSize) {
                        break;
                    }
                }
            }
        }
        if (considered.isEmpty()) {
            return classifyByName(fieldName);
        }

        int threshold = Math.max(1, (considered.size() + 1) / 2);
        int numbers = 0;
        int dates = 0;
        for (Object sample : considered) {
            if (looksNumeric(sample)) {
                numbers++;
            }
            if (looksLikeDate(sample)) {
                dates++;
            }
        }
        if (numbers >= threshold) {
            return FieldKind.NUMBER;
        }
        if (dates >= threshold) {
            return FieldKind.DATE;
        }
        return FieldKind.STRING;
    }

    private static FieldKind classifyByName(String fieldName) {
        if (fieldName != null && DATE_NAME.matcher(fieldName.toLowerCase(Locale.ROOT)).find()) {
            return FieldKind.DATE;
        }
        return FieldKind.STRING;
    }

    static boolean looksNumeric(Object sample) {
        if (sample instanceof Number) {
            return true;
        }
        return sample instanceof CharSequence && NUMERIC.matcher(sample.toString().trim()).matches();
    }

    static boolean looksLikeDate(Object sample) {
        if (sample instanceof Temporal || sample instanceof Date) {
            return true;
        }
        return sample instanceof CharSequence && FlexibleDateParser.parse(sample) != null;
    }
}
