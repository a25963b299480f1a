package org.frugal.ls.junit.extensions.logging;

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
 * Fails a test that logs at WARN or above unless the event is declared with
 * {@link ExpectLog} or {@link AllowLog}, and fails it when an expected event is missing.
 * Events are captured with a Logback turbo filter, so they are seen regardless of logger levels.
 */
public class LogWatchExtension implements BeforeEachCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeEach(ExtensionContext context) {
        Rules rules = resolveRules(context);
        CapturingFilter filter = new CapturingFilter(rules);
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(CapturingFilter.class, filter);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(CapturingFilter.class, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        loggerContext().getTurboFilterList().remove(filter);
        filter.stop();

        Rules rules = filter.rules;
        List<Event> events = filter.events;
        List<String> problems = new ArrayList<>();

        if (!rules.disabled) {
            for (Event event : events) {
                if (event.level.isGreaterOrEqual(rules.failLevel.toLogback()) && !rules.tolerates(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects) {
            long found = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (found < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), found));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        AnnotatedElement method = context.getRequiredTestMethod();
        Class<?> testClass = context.getRequiredTestClass();

        FailOnLog fail = method.getAnnotation(FailOnLog.class);
        if (fail == null) {
            fail = testClass.getAnnotation(FailOnLog.class);
        }
        List<AllowLog> allows = new ArrayList<>(List.of(testClass.getAnnotationsByType(AllowLog.class)));
        allows.addAll(List.of(method.getAnnotationsByType(AllowLog.class)));
        List<ExpectLog> expects = new ArrayList<>(List.of(testClass.getAnnotationsByType(ExpectLog.class)));
        expects.addAll(List.of(method.getAnnotationsByType(ExpectLog.class)));

        return new Rules(fail != null ? fail.level() : LogLevel.WARN, fail != null && fail.disabled(), allows, expects);
    }

    private static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(level.toLogback())
                && Pattern.matches(loggerPattern, event.loggerName)
                && Pattern.matches(messagePattern, event.message);
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + loggerName + " - " + message;
        }
    }

    private record Rules(LogLevel failLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
        boolean tolerates(Event event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> matches(event, e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final Rules rules;
        private final List<Event> events = new CopyOnWriteArrayList<>();

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Logback also calls turbo filters for isXxxEnabled() checks, which pass a null format.
            if (format == null || level == null) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            // Declared events stay out of the test output.
            return rules.tolerates(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
