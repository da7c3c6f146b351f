package com.finmod.drg.formula;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses formula text into a {@link ParsedFormula}.
 *
 * <p>
 * Reference extraction is delegated to {@link ReferenceExtractor}; everything
 * else (functions, constants, operators) is read from the scanner's masked
 * text, so nothing inside a string literal or a reference token is counted
 * twice.
 *
 * <p>
 * Pure function of its input; one instance can be shared across threads.
 */
public final class FormulaParser {

    private static final Pattern NUMBER = Pattern.compile(
            "(?<![A-Za-z0-9_.])\\d+(?:\\.\\d*)?(?:[eE][+-]?\\d+)?(?![A-Za-z0-9_.])");
    private static final Pattern BOOLEAN = Pattern.compile(
            "(?i)(?<![A-Za-z0-9_.])(TRUE|FALSE)(?![A-Za-z0-9_.(])");
    private static final Pattern OPERATOR = Pattern.compile("[+\\-*/^&<>=]+");

    // Longest digit run that always fits in a long
    private static final int MAX_LONG_DIGITS = 18;

    private final ReferenceExtractor extractor;
    private final FormulaClassifier classifier;

    public FormulaParser() {
        this(new ReferenceExtractor(), new FormulaClassifier());
    }

    public FormulaParser(ReferenceExtractor extractor, FormulaClassifier classifier) {
        this.extractor = extractor;
        this.classifier = classifier;
    }

    public ReferenceExtractor extractor() {
        return extractor;
    }

    public FormulaClassifier classifier() {
        return classifier;
    }

    /**
     * Parses a formula, with or without its leading {@code =}. Malformed input
     * is not an error: it simply yields fewer components.
     */
    public ParsedFormula parse(String formula) {
        return parse(extractor.scan(formula));
    }

    /** Builds a {@link ParsedFormula} from an existing scan. */
    public ParsedFormula parse(ReferenceScan scan) {
        String masked = scan.maskedText();

        List<String> functions = new ArrayList<>();
        Matcher fm = ReferenceExtractor.FUNCTION_CALL.matcher(masked);
        while (fm.find())
            functions.add(fm.group(1).toUpperCase(Locale.ROOT));

        List<Object> constants = new ArrayList<>();
        StringBuilder withoutNumbers = new StringBuilder(masked);
        Matcher nm = NUMBER.matcher(masked);
        while (nm.find()) {
            constants.add(number(nm.group()));
            ReferenceExtractor.blank(withoutNumbers, nm.start(), nm.end());
        }
        Matcher sm = ReferenceExtractor.STRING_LITERAL.matcher(scan.body());
        while (sm.find())
            constants.add(sm.group(1).replace("\"\"", "\""));
        Matcher bm = BOOLEAN.matcher(masked);
        while (bm.find())
            constants.add(Boolean.valueOf(bm.group(1).toUpperCase(Locale.ROOT).equals("TRUE")));

        Set<String> operators = new LinkedHashSet<>();
        Matcher om = OPERATOR.matcher(withoutNumbers);
        while (om.find())
            operators.add(om.group());

        Set<String> cellRefs = scan.cellReferences();
        Set<String> rangeRefs = scan.rangeReferences();
        return new ParsedFormula(
                scan.body(),
                classifier.classify(functions),
                functions,
                cellRefs,
                rangeRefs,
                scan.namedRanges(),
                constants,
                operators,
                classifier.score(functions, cellRefs, rangeRefs, operators));
    }

    /** Convenience for {@link FormulaClassifier#recommendStrategy}. */
    public ImplementationStrategy recommendStrategy(String formula) {
        return classifier.recommendStrategy(parse(formula));
    }

    private static Number number(String text) {
        boolean integral = text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0;
        if (integral && text.length() <= MAX_LONG_DIGITS)
            return Long.valueOf(text);
        return Double.valueOf(text);
    }
}
