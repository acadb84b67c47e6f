package org.empiresim.junit.extensions.logging;

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

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fails a test on WARN or ERROR log events that are neither allowed ({@link AllowLog}) nor expected
 * ({@link ExpectLog}), and on expected events that never occurred. Events from all threads count.
 * Allowed and expected events are suppressed from the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            filter.clearEvents();
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = filter.drainEvents();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled()) {
            for (Event event : events) {
                if (event.level().isGreaterOrEqual(rules.minLevel()) && !rules.permits(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects()) {
            long count = events.stream().filter(event -> matches(event, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
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
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        AnnotatedElement testClass = context.getTestClass().orElse(null);
        AnnotatedElement element = context.getElement().orElse(null);

        FailOnLog failOnLog = element != null ? element.getAnnotation(FailOnLog.class) : null;
        if (failOnLog == null && testClass != null) {
            failOnLog = testClass.getAnnotation(FailOnLog.class);
        }
        Level minLevel = toLogback(failOnLog != null ? failOnLog.level() : LogLevel.WARN);
        boolean disabled = failOnLog != null && failOnLog.disabled();

        AllowLog[] allows = collect(testClass, element, AllowLog.class).toArray(AllowLog[]::new);
        ExpectLog[] expects = element == testClass
            ? new ExpectLog[0]
            : collect(testClass, element, ExpectLog.class).toArray(ExpectLog[]::new);
        return new Rules(minLevel, disabled, allows, expects);
    }

    private static <A extends Annotation> Stream<A> collect(
        AnnotatedElement testClass, AnnotatedElement element, Class<A> type) {
        Stream<A> fromClass = testClass == null ? Stream.empty() : Arrays.stream(testClass.getAnnotationsByType(type));
        Stream<A> fromElement = element == null || element == testClass
            ? Stream.empty()
            : Arrays.stream(element.getAnnotationsByType(type));
        return Stream.concat(fromClass, fromElement);
    }

    private static boolean matches(Event event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level().isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, event.loggerName())
            && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(event.message()).matches();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + loggerName + " - " + message;
        }
    }

    private record Rules(Level minLevel, boolean disabled, AllowLog[] allows, ExpectLog[] expects) {

        boolean permits(Event event) {
            for (AllowLog allow : allows) {
                if (matches(event, allow.level(), allow.loggerPattern(), allow.messagePattern())) {
                    return true;
                }
            }
            for (ExpectLog expect : expects) {
                if (matches(event, expect.level(), expect.loggerPattern(), expect.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class CapturingFilter extends TurboFilter {

        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            if (level == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            Rules current = rules;
            String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
            Event event = new Event(logger.getName(), level, message);
            events.add(event);
            return current.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Event> drainEvents() {
            List<Event> drained = new ArrayList<>(events);
            events.clear();
            return drained;
        }

        void clearEvents() {
            events.clear();
        }
    }
}
