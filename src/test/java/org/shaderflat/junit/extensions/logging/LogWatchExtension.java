package org.shaderflat.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at WARN or above without a matching {@link AllowLog} or
 * {@link ExpectLog}, and when an {@link ExpectLog} is not met.
 * <p>
 * Events are captured by a Logback turbo filter installed for the duration of each test.
 * Allowed and expected events are swallowed so they do not clutter the build output.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        Rules rules = filter.rules;
        List<Event> events = new ArrayList<>(filter.events);
        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled) {
            for (Event e : events) {
                if (!rules.isAllowedOrExpected(e)) {
                    unexpected.add(e.toString());
                }
            }
        }
        List<String> missing = new ArrayList<>();
        for (ExpectLog expect : rules.expects) {
            long count = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                missing.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }

        if (!unexpected.isEmpty() || !missing.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            if (!unexpected.isEmpty()) {
                sb.append("Unexpected logs:\n");
                unexpected.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            if (!missing.isEmpty()) {
                sb.append("Missing expected logs:\n");
                missing.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            throw new AssertionError(sb.toString());
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        List<AnnotatedElement> elements = new ArrayList<>();
        context.getTestClass().ifPresent(elements::add);
        context.getTestMethod().ifPresent(elements::add);

        FailOnLog fail = null;
        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        for (AnnotatedElement element : elements) {
            FailOnLog f = element.getAnnotation(FailOnLog.class);
            if (f != null) {
                fail = f;
            }
            allows.addAll(List.of(element.getAnnotationsByType(AllowLog.class)));
            expects.addAll(List.of(element.getAnnotationsByType(ExpectLog.class)));
        }
        LogLevel minLevel = fail != null ? fail.level() : LogLevel.WARN;
        return new Rules(minLevel, fail != null && fail.disabled(), allows, expects);
    }

    private static boolean matches(Event e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(level.toLogback())
                && Pattern.matches(loggerPattern, e.loggerName)
                && Pattern.matches(messagePattern, e.message);
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
        boolean isAllowedOrExpected(Event e) {
            return allows.stream().anyMatch(a -> matches(e, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(x -> matches(e, x.level(), x.loggerPattern(), x.messagePattern()));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private final Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(rules.minLevel.toLogback())) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.isAllowedOrExpected(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
