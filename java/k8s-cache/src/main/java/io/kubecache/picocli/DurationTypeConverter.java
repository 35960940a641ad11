package io.kubecache.picocli;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;
import com.google.common.primitives.Longs;
import picocli.CommandLine;

/**
 * Converts {@code <value><unit>} or {@code <value> <unit>} to a {@link Duration}, e.g. {@code 10s}, {@code 5 min}, {@code 250ms}.
 * The unit is any unambiguous prefix of a {@link TimeUnit} name; {@code ms} and a bare number of seconds are accepted too.
 */
public class DurationTypeConverter implements CommandLine.ITypeConverter<Duration> {
    private static final Pattern MEASURE_PATTERN = Pattern.compile("(?<value>\\d+)(?<unit>\\D.*)");

    @Override
    public Duration convert(final String value) {
        final List<String> tokens = Splitter.on(' ').trimResults().omitEmptyStrings().splitToList(value);

        final String rawValue, rawUnit;

        if (tokens.size() == 1) {
            final String token = tokens.get(0);

            final Long seconds = Longs.tryParse(token);
            if (seconds != null) {
                return checkNotNegative(Duration.ofSeconds(seconds), value);
            }

            final Matcher matcher = MEASURE_PATTERN.matcher(token);
            if (!matcher.matches())
                throw new CommandLine.TypeConversionException(String.format("\"%s\" is not a valid duration", value));

            rawValue = matcher.group("value");
            rawUnit = matcher.group("unit");

        } else if (tokens.size() == 2) {
            rawValue = tokens.get(0);
            rawUnit = tokens.get(1);

        } else {
            throw new CommandLine.TypeConversionException(String.format("\"%s\" is not a valid duration", value));
        }

        final Long amount = Longs.tryParse(rawValue);
        if (amount == null)
            throw new CommandLine.TypeConversionException(String.format("%s is not a valid number", rawValue));

        final TimeUnit unit;

        try {
            unit = rawUnit.equalsIgnoreCase("ms") ? TimeUnit.MILLISECONDS : Iterables.getOnlyElement(unitsStartingWith(rawUnit));

        } catch (final IllegalArgumentException | NoSuchElementException e) {
            throw new CommandLine.TypeConversionException(String.format("%s is not a valid time unit", rawUnit));
        }

        return checkNotNegative(Duration.ofNanos(unit.toNanos(amount)), value);
    }

    private static Duration checkNotNegative(final Duration duration, final String value) {
        if (duration.isNegative())
            throw new CommandLine.TypeConversionException(String.format("\"%s\" is negative", value));

        return duration;
    }

    private static Set<TimeUnit> unitsStartingWith(final String token) {
        final EnumSet<TimeUnit> set = EnumSet.noneOf(TimeUnit.class);

        for (final TimeUnit unit : TimeUnit.values()) {
            if (unit.name().toLowerCase().startsWith(token.toLowerCase()))
                set.add(unit);
        }

        return set;
    }
}
