package org.symforge.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
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
 * Fails a test when it logs at WARN or above without announcing it through {@link AllowLog} or
 * {@link ExpectLog}, and when an {@link ExpectLog} is not satisfied. Announced events are kept out of
 * the console output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        ((LoggerContext) LoggerFactory.getILoggerFactory()).addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filterOf(context);
        if (filter != null) {
            filter.clear();
            filter.rules = Rules.resolve(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filterOf(context);
        if (filter == null) {
            return;
        }
        Rules rules = Rules.resolve(context);
        List<Event> events = filter.events();
        filter.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : events) {
                if (event.level.isGreaterOrEqual(rules.failLevel) && !rules.announces(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects) {
            long count = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing log: expected %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            ((LoggerContext) LoggerFactory.getILoggerFactory()).getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filterOf(ExtensionContext context) {
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.loggerName)
                && Pattern.matches(messagePattern, event.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class Rules {
        final Level failLevel;
        final boolean disabled;
        final List<AllowLog> allows = new ArrayList<>();
        final List<ExpectLog> expects = new ArrayList<>();

        private Rules(Level failLevel, boolean disabled) {
            this.failLevel = failLevel;
            this.disabled = disabled;
        }

        static Rules resolve(ExtensionContext context) {
            AnnotatedElement type = context.getTestClass().orElse(null);
            AnnotatedElement element = context.getElement().orElse(null);

            FailOnLog fail = element != null ? element.getAnnotation(FailOnLog.class) : null;
            if (fail == null && type != null) {
                fail = type.getAnnotation(FailOnLog.class);
            }
            Rules rules = fail == null
                    ? new Rules(Level.WARN, false)
                    : new Rules(toLogback(fail.level()), fail.disabled());

            List<AnnotatedElement> sources = new ArrayList<>();
            if (type != null) {
                sources.add(type);
            }
            if (element != null && element != type) {
                sources.add(element);
            }
            for (AnnotatedElement source : sources) {
                rules.allows.addAll(List.of(source.getAnnotationsByType(AllowLog.class)));
                rules.expects.addAll(List.of(source.getAnnotationsByType(ExpectLog.class)));
            }
            return rules;
        }

        boolean announces(Event event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> matches(event, e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format,
                                  Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.announces(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Event> events() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }

    private static final class Event {
        final String loggerName;
        final Level level;
        final String message;

        Event(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message == null ? "" : message;
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}
