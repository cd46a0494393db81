package com.shoryokuka.infrastructure.generation.repair;

import com.shoryokuka.domain.plan.model.FactModel;
import com.shoryokuka.infrastructure.generation.synthesis.FactFormatter;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rejects rewrites that lose or invent numbers.
 * <p>
 * A rewrite is accepted when every number of the old text is still present and every
 * number of the new text was either already there or is a rendered fact value.
 * </p>
 */
public class FactGuard {

    static final Pattern NUMBER = Pattern.compile("\\d+(?:,\\d{3})*(?:\\.\\d+)?");

    private final Set<String> factTokens;

    public FactGuard(FactModel fact) {
        this.factTokens = FactFormatter.numericTokens(fact);
    }

    public boolean accepts(String before, String after) {
        Set<String> previous = numbers(before);
        Set<String> next = numbers(after);
        if (!next.containsAll(previous)) {
            return false;
        }
        for (String number : next) {
            if (!previous.contains(number) && !factTokens.contains(number)) {
                return false;
            }
        }
        return true;
    }

    public static Set<String> numbers(String text) {
        Set<String> numbers = new LinkedHashSet<>();
        Matcher m = NUMBER.matcher(text);
        while (m.find()) {
            numbers.add(m.group());
        }
        return numbers;
    }

    public static boolean containsNumber(String text) {
        return NUMBER.matcher(text).find();
    }
}
