package com.example.reconcile.field;

import com.example.reconcile.model.CalendarDate;
import com.example.reconcile.model.DateGranularity;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.NormalizedField;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dates in the patterns found in Italian case files: {@code DD/MM/YY}, {@code DD-MM-YYYY},
 * {@code MM/YYYY}, ISO, and textual months ({@code 13 gennaio 2024}, {@code 20 gen 2024},
 * {@code gennaio 2024}). The granularity of the written form is kept.
 */
@Component
public class DateFieldHandler implements FieldHandler {

    private static final Pattern DAY_MONTH_YEAR = Pattern.compile("(\\d{1,2})[/.\\-](\\d{1,2})[/.\\-](\\d{4}|\\d{2})");
    private static final Pattern ISO_DAY = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern MONTH_YEAR = Pattern.compile("(\\d{1,2})[/.\\-](\\d{4})");
    private static final Pattern ISO_MONTH = Pattern.compile("(\\d{4})-(\\d{2})");
    private static final Pattern TEXTUAL_DAY = Pattern.compile("(\\d{1,2})\\s+(\\p{L}+)\\.?\\s+(\\d{4}|\\d{2})");
    private static final Pattern TEXTUAL_MONTH = Pattern.compile("(\\p{L}+)\\.?\\s+(\\d{4})");
    private static final Pattern YEAR = Pattern.compile("\\d{4}");

    private static final Map<String, Integer> MONTHS = new HashMap<>();

    static {
        String[][] names = {
                {"gennaio", "gen", "january", "jan"},
                {"febbraio", "feb", "february"},
                {"marzo", "mar", "march"},
                {"aprile", "apr", "april"},
                {"maggio", "mag", "may"},
                {"giugno", "giu", "june", "jun"},
                {"luglio", "lug", "july", "jul"},
                {"agosto", "ago", "august", "aug"},
                {"settembre", "set", "september", "sep", "sept"},
                {"ottobre", "ott", "october", "oct"},
                {"novembre", "nov", "november"},
                {"dicembre", "dic", "december", "dec"}
        };
        for (int i = 0; i < names.length; i++) {
            for (String name : names[i]) {
                MONTHS.put(name, i + 1);
            }
        }
    }

    @Override
    public FieldType type() {
        return FieldType.DATE;
    }

    @Override
    public NormalizationOutcome normalize(String raw) {
        String text = raw.strip().toLowerCase(Locale.ROOT);
        try {
            Matcher m;
            if ((m = ISO_DAY.matcher(text)).matches()) {
                return day(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                        Integer.parseInt(m.group(3)), "date.iso");
            }
            if ((m = DAY_MONTH_YEAR.matcher(text)).matches()) {
                return day(year(m.group(3)), Integer.parseInt(m.group(2)),
                        Integer.parseInt(m.group(1)), "date.dmy");
            }
            if ((m = ISO_MONTH.matcher(text)).matches()) {
                return month(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), "date.iso-month");
            }
            if ((m = MONTH_YEAR.matcher(text)).matches()) {
                return month(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1)), "date.my");
            }
            if ((m = TEXTUAL_DAY.matcher(text)).matches()) {
                Integer month = MONTHS.get(m.group(2));
                if (month == null) return unknownMonth(m.group(2));
                return day(year(m.group(3)), month, Integer.parseInt(m.group(1)), "date.textual");
            }
            if ((m = TEXTUAL_MONTH.matcher(text)).matches()) {
                Integer month = MONTHS.get(m.group(1));
                if (month == null) return unknownMonth(m.group(1));
                return month(Integer.parseInt(m.group(2)), month, "date.textual-month");
            }
            if (YEAR.matcher(text).matches()) {
                return NormalizationOutcome.strict(
                        new CalendarDate(LocalDate.of(Integer.parseInt(text), 1, 1), DateGranularity.YEAR),
                        "date.year");
            }
        } catch (DateTimeException e) {
            return NormalizationOutcome.failed("invalid calendar date: " + e.getMessage(), "date.calendar");
        }
        return NormalizationOutcome.failed("no recognized date pattern", "date.pattern");
    }

    @Override
    public double baseScore(NormalizedField field) {
        CalendarDate date = (CalendarDate) field.value();
        return switch (date.granularity()) {
            case DAY -> STRICT_SCORE;
            case MONTH -> 0.92;
            case YEAR -> 0.90;
        };
    }

    /** Date representations vary legitimately; reformatting is not a fix. */
    @Override
    public Optional<FixProposal> proposeFix(NormalizedField field) {
        return Optional.empty();
    }

    private static NormalizationOutcome day(int year, int month, int day, String rule) {
        return NormalizationOutcome.strict(new CalendarDate(LocalDate.of(year, month, day), DateGranularity.DAY), rule);
    }

    private static NormalizationOutcome month(int year, int month, String rule) {
        return NormalizationOutcome.strict(new CalendarDate(LocalDate.of(year, month, 1), DateGranularity.MONTH), rule);
    }

    private static NormalizationOutcome unknownMonth(String name) {
        return NormalizationOutcome.failed("unknown month name '" + name + "'", "date.month-name");
    }

    private static int year(String digits) {
        int year = Integer.parseInt(digits);
        return digits.length() == 2 ? 2000 + year : year;
    }
}
