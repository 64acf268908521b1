package com.acme.finops.ottl.functions;

import com.acme.finops.ottl.ConfigException;
import com.acme.finops.ottl.EvaluationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Locale;
import java.util.Map;

/**
 * Duration strings such as {@code 1h30m} and strptime-style time layouts such as
 * {@code %Y-%m-%dT%H:%M:%S}.
 */
final class TimeFormats {
    private static final Map<String, BigDecimal> UNIT_NANOS = Map.of(
        "ns", BigDecimal.ONE,
        "us", BigDecimal.valueOf(1_000L),
        "µs", BigDecimal.valueOf(1_000L),
        "μs", BigDecimal.valueOf(1_000L),
        "ms", BigDecimal.valueOf(1_000_000L),
        "s", BigDecimal.valueOf(1_000_000_000L),
        "m", BigDecimal.valueOf(60_000_000_000L),
        "h", BigDecimal.valueOf(3_600_000_000_000L));

    private static final BigInteger MAX_NANOS = BigInteger.valueOf(Long.MAX_VALUE);

    private TimeFormats() {
    }

    /**
     * Parses a signed sequence of decimal numbers, each with a unit: {@code 300ms},
     * {@code -1.5h}, {@code 2h45m}. Valid units are ns, us (or µs), ms, s, m, h.
     */
    static Duration parseDuration(String raw) throws EvaluationException {
        String s = raw;
        boolean negative = false;
        if (!s.isEmpty() && (s.charAt(0) == '-' || s.charAt(0) == '+')) {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }
        if ("0".equals(s)) {
            return Duration.ZERO;
        }
        if (s.isEmpty()) {
            throw invalidDuration(raw);
        }
        BigDecimal total = BigDecimal.ZERO;
        int i = 0;
        while (i < s.length()) {
            int start = i;
            while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) {
                i++;
            }
            String number = s.substring(start, i);
            if (number.isEmpty() || ".".equals(number) || number.indexOf('.') != number.lastIndexOf('.')) {
                throw invalidDuration(raw);
            }
            int unitStart = i;
            while (i < s.length() && !Character.isDigit(s.charAt(i)) && s.charAt(i) != '.') {
                i++;
            }
            BigDecimal unit = UNIT_NANOS.get(s.substring(unitStart, i));
            if (unit == null) {
                throw new EvaluationException("unknown unit \"" + s.substring(unitStart, i) + "\" in duration \"" + raw + "\"");
            }
            total = total.add(new BigDecimal(number).multiply(unit));
        }
        BigInteger nanos = total.toBigInteger();
        if (nanos.compareTo(MAX_NANOS) > 0) {
            throw new EvaluationException("invalid duration \"" + raw + "\": out of range");
        }
        long value = nanos.longValueExact();
        return Duration.ofNanos(negative ? -value : value);
    }

    private static EvaluationException invalidDuration(String raw) {
        return new EvaluationException("invalid duration \"" + raw + "\"");
    }

    /**
     * Builds a parser for a strptime layout. Fields missing from the layout default to zero,
     * or one for month and day.
     */
    static DateTimeFormatter strptime(String layout) throws ConfigException {
        DateTimeFormatterBuilder b = new DateTimeFormatterBuilder().parseCaseInsensitive();
        StringBuilder literal = new StringBuilder();
        boolean hour = false;
        boolean minute = false;
        boolean second = false;
        boolean year = false;
        boolean month = false;
        boolean day = false;
        for (int i = 0; i < layout.length(); i++) {
            char c = layout.charAt(i);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            if (i + 1 >= layout.length()) {
                throw new ConfigException("time layout \"" + layout + "\" ends with a lone %");
            }
            char d = layout.charAt(++i);
            if (d == '%') {
                literal.append('%');
                continue;
            }
            if (literal.length() > 0) {
                b.appendLiteral(literal.toString());
                literal.setLength(0);
            }
            switch (d) {
                case 'Y' -> {
                    b.appendValue(ChronoField.YEAR, 4);
                    year = true;
                }
                case 'y' -> {
                    b.appendValueReduced(ChronoField.YEAR, 2, 2, 2000);
                    year = true;
                }
                case 'm' -> {
                    b.appendValue(ChronoField.MONTH_OF_YEAR, 2);
                    month = true;
                }
                case 'b', 'h' -> {
                    b.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT);
                    month = true;
                }
                case 'B' -> {
                    b.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.FULL);
                    month = true;
                }
                case 'd' -> {
                    b.appendValue(ChronoField.DAY_OF_MONTH, 2);
                    day = true;
                }
                case 'j' -> {
                    b.appendValue(ChronoField.DAY_OF_YEAR, 3);
                    month = true;
                    day = true;
                }
                case 'a' -> b.appendText(ChronoField.DAY_OF_WEEK, TextStyle.SHORT);
                case 'A' -> b.appendText(ChronoField.DAY_OF_WEEK, TextStyle.FULL);
                case 'H' -> {
                    b.appendValue(ChronoField.HOUR_OF_DAY, 2);
                    hour = true;
                }
                case 'I' -> {
                    b.appendValue(ChronoField.CLOCK_HOUR_OF_AMPM, 2);
                    hour = true;
                }
                case 'p' -> b.appendText(ChronoField.AMPM_OF_DAY, TextStyle.SHORT);
                case 'M' -> {
                    b.appendValue(ChronoField.MINUTE_OF_HOUR, 2);
                    minute = true;
                }
                case 'S' -> {
                    b.appendValue(ChronoField.SECOND_OF_MINUTE, 2);
                    second = true;
                }
                case 'L' -> b.appendFraction(ChronoField.NANO_OF_SECOND, 3, 3, false);
                case 'f' -> b.appendFraction(ChronoField.NANO_OF_SECOND, 6, 6, false);
                case 'z' -> b.appendOffset("+HHMM", "Z");
                case 'Z' -> b.appendZoneText(TextStyle.SHORT);
                default -> throw new ConfigException("unsupported directive %" + d + " in time layout \"" + layout + "\"");
            }
        }
        if (literal.length() > 0) {
            b.appendLiteral(literal.toString());
        }
        if (!year) {
            b.parseDefaulting(ChronoField.YEAR, 0);
        }
        if (!month) {
            b.parseDefaulting(ChronoField.MONTH_OF_YEAR, 1);
        }
        if (!day) {
            b.parseDefaulting(ChronoField.DAY_OF_MONTH, 1);
        }
        if (!hour) {
            b.parseDefaulting(ChronoField.HOUR_OF_DAY, 0);
        }
        if (!minute) {
            b.parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0);
        }
        if (!second) {
            b.parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0);
        }
        return b.toFormatter(Locale.US);
    }

    /**
     * Parses {@code text}; a zone or offset in the text wins over {@code defaultZone}.
     */
    static Instant parseTime(DateTimeFormatter formatter, String text, ZoneId defaultZone) throws EvaluationException {
        try {
            TemporalAccessor parsed = formatter.parse(text);
            ZoneId zone = parsed.query(TemporalQueries.zone());
            return LocalDateTime.from(parsed).atZone(zone == null ? defaultZone : zone).toInstant();
        } catch (DateTimeException e) {
            throw new EvaluationException("unable to parse time \"" + text + "\": " + e.getMessage(), e);
        }
    }
}
