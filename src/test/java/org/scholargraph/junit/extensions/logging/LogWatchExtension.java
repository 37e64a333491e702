package org.scholargraph.junit.extensions.logging;

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
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is permitted by {@link AllowLog}
 * or required by {@link ExpectLog}; also fails if an {@link ExpectLog} is not met.
 * Class-level annotations apply to every test and are merged with method-level ones.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.clear();
            filter.rules = Rules.resolve(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<CapturedEvent> events = filter.events();
        filter.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (CapturedEvent event : events) {
                if (!rules.permits(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expected : rules.expected) {
            Matcher matcher = Matcher.of(expected);
            long found = events.stream().filter(matcher::matches).count();
            if (found < expected.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                    expected.occurrences(), expected.level(), expected.loggerPattern(), expected.messagePattern(), found));
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

    private static CapturingFilter filter(ExtensionContext context) {
        // Method contexts see the class-level store through their parent.
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            Rules current = rules;
            if (!level.isGreaterOrEqual(current.minLevel)) {
                return FilterReply.NEUTRAL;
            }
            String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
            CapturedEvent event = new CapturedEvent(logger.getName(), level, message == null ? "" : message);
            events.add(event);
            // Permitted events are kept off the console.
            return current.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<CapturedEvent> events() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return "[" + level + "] " + loggerName + " - " + message;
        }
    }

    private record Matcher(Level level, Pattern logger, Pattern message) {
        static Matcher of(AllowLog allow) {
            return new Matcher(allow.level().toLogback(), Pattern.compile(allow.loggerPattern()), Pattern.compile(allow.messagePattern()));
        }

        static Matcher of(ExpectLog expect) {
            return new Matcher(expect.level().toLogback(), Pattern.compile(expect.loggerPattern()), Pattern.compile(expect.messagePattern()));
        }

        boolean matches(CapturedEvent event) {
            return event.level().isGreaterOrEqual(level)
                && logger.matcher(event.loggerName()).matches()
                && message.matcher(event.message()).matches();
        }
    }

    private static final class Rules {
        final Level minLevel;
        final boolean disabled;
        final List<Matcher> permitted = new ArrayList<>();
        final List<ExpectLog> expected = new ArrayList<>();

        private Rules(Level minLevel, boolean disabled) {
            this.minLevel = minLevel;
            this.disabled = disabled;
        }

        static Rules resolve(ExtensionContext context) {
            Optional<Method> method = context.getTestMethod();
            Optional<Class<?>> testClass = context.getTestClass();
            FailOnLog fail = method.map(m -> m.getAnnotation(FailOnLog.class))
                .orElse(testClass.map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
            Rules rules = new Rules(fail != null ? fail.level().toLogback() : Level.WARN, fail != null && fail.disabled());

            List<AnnotatedElement> sources = new ArrayList<>();
            testClass.ifPresent(sources::add);
            method.ifPresent(sources::add);
            for (AnnotatedElement source : sources) {
                for (AllowLog allow : source.getAnnotationsByType(AllowLog.class)) {
                    rules.permitted.add(Matcher.of(allow));
                }
                for (ExpectLog expect : source.getAnnotationsByType(ExpectLog.class)) {
                    rules.expected.add(expect);
                    rules.permitted.add(Matcher.of(expect));
                }
            }
            return rules;
        }

        boolean permits(CapturedEvent event) {
            for (Matcher matcher : permitted) {
                if (matcher.matches(event)) {
                    return true;
                }
            }
            return false;
        }
    }
}
