package org.cachegrid.junit.extensions.logging;

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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is announced with {@link AllowLog} or
 * {@link ExpectLog}; also fails it when an {@link ExpectLog} event never appears.
 * <p>
 * One Logback turbo filter is installed per test class and re-armed with the method's rules before
 * each test. Allowed and expected events are denied so they do not clutter the build output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
        ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
        WatchFilter filter = new WatchFilter(resolveRules(context));
        filter.start();
        lc.addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, WatchFilter.class);
        if (filter != null) {
            filter.clearEvents();
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, WatchFilter.class);
        if (filter == null) {
            return;
        }
        ValidationRules rules = filter.rules;
        List<CapturedEvent> events = filter.capturedEvents();
        filter.clearEvents();

        List<String> unexpected = findUnexpected(events, rules);
        List<String> missing = findMissingExpected(events, rules);
        if (unexpected.isEmpty() && missing.isEmpty()) {
            return;
        }
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

    @Override
    public void afterAll(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, WatchFilter.class);
        if (filter != null) {
            LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
            lc.getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static ValidationRules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
            .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        LogLevel minLevel = fail != null ? fail.level() : LogLevel.WARN;
        boolean disabled = fail != null && fail.disabled();

        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        context.getTestClass().ifPresent(c -> collect(c, allows, expects));
        context.getTestMethod().ifPresent(m -> collect(m, allows, expects));
        return new ValidationRules(minLevel, disabled, allows.toArray(new AllowLog[0]), expects.toArray(new ExpectLog[0]));
    }

    private static void collect(AnnotatedElement element, List<AllowLog> allows, List<ExpectLog> expects) {
        allows.addAll(List.of(element.getAnnotationsByType(AllowLog.class)));
        expects.addAll(List.of(element.getAnnotationsByType(ExpectLog.class)));
    }

    private static List<String> findUnexpected(List<CapturedEvent> events, ValidationRules rules) {
        if (rules.disabled) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        Map<AllowLog, Integer> allowedSoFar = new HashMap<>();
        for (CapturedEvent e : events) {
            if (!e.level.isGreaterOrEqual(toLogback(rules.minLevel))) {
                continue;
            }
            if (isExpected(e, rules.expects) || consumeAllowance(e, rules.allows, allowedSoFar)) {
                continue;
            }
            result.add(String.format("[%s] %s - %s", e.level, e.loggerName, e.message));
        }
        return result;
    }

    private static List<String> findMissingExpected(List<CapturedEvent> events, ValidationRules rules) {
        List<String> result = new ArrayList<>();
        for (ExpectLog exp : rules.expects) {
            long count = events.stream()
                .filter(e -> matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern()))
                .count();
            if (count < exp.occurrences()) {
                result.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                    exp.occurrences(), exp.level(), exp.loggerPattern(), exp.messagePattern(), count));
            }
        }
        return result;
    }

    private static boolean consumeAllowance(CapturedEvent e, AllowLog[] allows, Map<AllowLog, Integer> used) {
        for (AllowLog a : allows) {
            if (matches(e, a.level(), a.loggerPattern(), a.messagePattern())) {
                int count = used.merge(a, 1, Integer::sum);
                if (count <= a.occurrences()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isExpected(CapturedEvent e, ExpectLog[] expects) {
        for (ExpectLog exp : expects) {
            if (matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern())) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(CapturedEvent e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, e.loggerName)
            && Pattern.matches(messagePattern, e.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class WatchFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile ValidationRules rules;

        WatchFilter(ValidationRules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            // Logback consults turbo filters before the level check; format is null for isXxxEnabled() probes.
            if (format == null || !level.isGreaterOrEqual(toLogback(rules.minLevel))) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level,
                MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            ValidationRules current = rules;
            if (isExpected(event, current.expects)) {
                return FilterReply.DENY;
            }
            for (AllowLog a : current.allows) {
                if (matches(event, a.level(), a.loggerPattern(), a.messagePattern())) {
                    return FilterReply.DENY;
                }
            }
            return FilterReply.NEUTRAL;
        }

        List<CapturedEvent> capturedEvents() {
            return new ArrayList<>(events);
        }

        void clearEvents() {
            events.clear();
        }
    }

    private static final class CapturedEvent {
        final String loggerName;
        final Level level;
        final String message;

        CapturedEvent(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message != null ? message : "";
        }
    }
}
