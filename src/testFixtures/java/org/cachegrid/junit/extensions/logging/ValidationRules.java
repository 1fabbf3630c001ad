package org.cachegrid.junit.extensions.logging;

/**
 * The log rules in effect for one test: the failing level and the allowed and expected events.
 */
final class ValidationRules {

    final LogLevel minLevel;
    final boolean disabled;
    final AllowLog[] allows;
    final ExpectLog[] expects;

    ValidationRules(LogLevel minLevel, boolean disabled, AllowLog[] allows, ExpectLog[] expects) {
        this.minLevel = minLevel;
        this.disabled = disabled;
        this.allows = allows;
        this.expects = expects;
    }
}
