package org.proclient.operation;

/**
 * Every user-facing message the client emits, keyed by its stable message code.
 * <p>
 * Templates use {@link String#format} placeholders. Control flow branches on the constant,
 * never on the rendered text, so the wording can change without touching the callers.
 */
public enum Message {

    // Batch classification (see MessageComposer)
    INVALID_SERVICE_OR_FAILURE("invalid-service-or-failure",
        "Cannot %s unknown service '%s'.\nSee https://ubuntu.com/pro"),
    VALID_SERVICE_FAILURE_UNATTACHED("valid-service-failure-unattached",
        "To use '%s' you need an Ubuntu Pro subscription\n"
            + "Personal and community subscriptions are available at no charge\n"
            + "See https://ubuntu.com/pro"),
    MIXED_SERVICES_FAILURE_UNATTACHED("mixed-services-failure-unattached",
        "%s\n\n%s"),

    // Per-service execution
    SUBSCRIPTION_NOT_ENTITLED_TO_SERVICE("subscription-not-entitled-to-service",
        "This subscription is not entitled to %s\nFor more information see: https://ubuntu.com/pro"),
    INAPPLICABLE_RELEASE_SERIES("inapplicable-release-series",
        "%s is not available for Ubuntu %s."),
    SERVICE_ALREADY_ENABLED("service-already-enabled",
        "%s is already enabled.\nSee: sudo pro status"),
    SERVICE_ALREADY_DISABLED("service-already-disabled",
        "%s is not currently enabled\nSee: sudo pro status"),
    INCOMPATIBLE_SERVICE_STOPPED_ENABLE("incompatible-service-stopped-enable",
        "Cannot enable %s when %s is enabled."),
    REQUIRED_SERVICE_STOPPED_ENABLE("required-service-stopped-enable",
        "Cannot enable %s when %s is disabled."),
    DEPENDENT_SERVICE_STOPPED_DISABLE("dependent-service-stopped-disable",
        "Cannot disable %s when %s is enabled."),
    DISABLING_INCOMPATIBLE_SERVICE("disabling-incompatible-service",
        "Disabling incompatible service: %s"),
    ENABLING_REQUIRED_SERVICE("enabling-required-service",
        "Enabling required service: %s"),
    DISABLING_DEPENDENT_SERVICE("disabling-dependent-service",
        "Disabling dependent service: %s"),

    // Attach, detach and refresh
    ALREADY_ATTACHED("already-attached",
        "This machine is already attached to '%s'\nTo use a different subscription first run: sudo pro detach."),
    UNATTACHED("unattached",
        "This machine is not attached to an Ubuntu Pro subscription.\nSee https://ubuntu.com/pro"),
    ATTACH_INVALID_TOKEN("attach-invalid-token",
        "Invalid token. See https://ubuntu.com/pro"),
    ATTACH_FAILURE("attach-failure",
        "Failed to attach machine. See https://ubuntu.com/pro"),
    REFRESH_CONTRACT_FAILURE("refresh-contract-failure",
        "Unable to refresh your subscription"),
    CONNECTIVITY_ERROR("connectivity-error",
        "Failed to connect to %s\n%s"),
    SERVICE_NO_LONGER_ENTITLED("service-no-longer-entitled",
        "%s is enabled but no longer entitled by your subscription"),
    ENTITLEMENT_NOT_IN_CATALOG("entitlement-not-in-catalog",
        "Ignoring unsupported entitlement '%s' from the contract"),

    // Request validation
    MISSING_SERVICE_NAME("missing-service-name",
        "At least one service name is required to %s."),
    JSON_FORMAT_REQUIRE_ASSUME_YES("json-format-require-assume-yes",
        "json formatted response requires --assume-yes flag."),
    NONROOT_USER("nonroot-user",
        "This command must be run as root (try using sudo)."),
    NO_HELP_CONTENT("no-help-content",
        "No help available for '%s'");

    private final String code;
    private final String template;

    Message(final String code, final String template) {
        this.code = code;
        this.template = template;
    }

    public String code() {
        return code;
    }

    /**
     * Fills the template with the given arguments.
     *
     * @param args Values for the template placeholders, in order.
     * @return The rendered message.
     */
    public String format(final Object... args) {
        return String.format(template, args);
    }

    public ErrorEntry asSystemError(final Object... args) {
        return ErrorEntry.system(code, format(args));
    }

    public ErrorEntry asServiceError(final String service, final Object... args) {
        return ErrorEntry.service(service, code, format(args));
    }
}
