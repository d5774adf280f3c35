package com.auditsentinel.core.normalize;

import com.auditsentinel.core.model.AuditRecord;
import com.auditsentinel.core.model.Identity;
import com.auditsentinel.core.model.IdentityStrategy;
import com.auditsentinel.core.model.NormalizedEvent;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps heterogeneous audit record shapes onto one {@link NormalizedEvent}.
 *
 * <h3>Supported shapes</h3>
 * <ul>
 * <li>Directory audit API records ({@code activityDisplayName},
 * {@code initiatedBy.user.userPrincipalName}, {@code activityDateTime},
 * ...)</li>
 * <li>Unified audit log exports ({@code Operation}, {@code UserId},
 * {@code ClientIP}, {@code CreationTime}, ...)</li>
 * </ul>
 * <p>
 * Each canonical attribute is read from an ordered list of alternative
 * source fields; the first non-blank one wins.
 * </p>
 *
 * <h3>User identity</h3>
 * <p>
 * Explicit user fields first, then a synthetic identity from the session id,
 * the client IP, the application, and finally the timestamp plus a hash of
 * the record content.
 * </p>
 *
 * <h3>Purity</h3>
 * <p>
 * Stateless and thread-safe. Synthesized ids and identity seeds are derived
 * from the record content only, so normalizing the same record twice yields
 * equal events.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventNormalizer {

    static final List<String> ID_FIELDS = List.of("id", "Id");
    static final List<String> TIMESTAMP_FIELDS = List.of(
            "activityDateTime", "CreationTime", "TimeGenerated", "Timestamp");
    static final List<String> USER_FIELDS = List.of(
            "initiatedBy.user.userPrincipalName",
            "initiatedBy.user.displayName",
            "UserId",
            "UserPrincipalName",
            "UserDisplayName");
    static final List<String> SESSION_FIELDS = List.of(
            "SessionId", "sessionId", "AppAccessContext.AADSessionId", "AppAccessContext.UniqueTokenId");
    static final List<String> OPERATION_FIELDS = List.of(
            "activityDisplayName", "Operation", "ActivityDisplayName");
    static final List<String> RESULT_FIELDS = List.of("result", "ResultStatus", "Status");
    static final List<String> IP_FIELDS = List.of(
            "initiatedBy.user.ipAddress", "ClientIP", "IPAddress", "ClientIPAddress");
    static final List<String> USER_AGENT_FIELDS = List.of(
            "initiatedBy.user.userAgent", "UserAgent", "ClientAppUsed");
    static final List<String> APPLICATION_FIELDS = List.of(
            "initiatedBy.app.displayName",
            "initiatedBy.app.appId",
            "AppDisplayName",
            "ApplicationId",
            "ClientAppUsed");
    static final List<String> LOCATION_FIELDS = List.of(
            "location.countryOrRegion", "location.city", "Country", "Location");
    static final List<String> CATEGORY_FIELDS = List.of("category", "LogName", "RecordType");

    /**
     * Normalize one record.
     *
     * @param record raw audit record; must not be {@code null}
     * @return the canonical event
     */
    public NormalizedEvent normalize(AuditRecord record) {
        Objects.requireNonNull(record, "AuditRecord must not be null");

        Instant timestamp = firstValue(record, TIMESTAMP_FIELDS)
                .flatMap(EventNormalizer::parseTimestamp)
                .orElse(null);
        String contentHash = String.format("%08x", record.getFields().hashCode());
        String ipAddress = firstString(record, IP_FIELDS).orElse(NormalizedEvent.UNKNOWN);
        String application = firstString(record, APPLICATION_FIELDS).orElse(NormalizedEvent.UNKNOWN);

        return NormalizedEvent.builder()
                .id(firstString(record, ID_FIELDS)
                        .orElseGet(() -> "event_" + epochMillis(timestamp) + "_" + contentHash))
                .timestamp(timestamp)
                .identity(resolveIdentity(record, ipAddress, application, timestamp, contentHash))
                .operation(firstString(record, OPERATION_FIELDS).orElse(null))
                .result(firstString(record, RESULT_FIELDS).orElse(null))
                .ipAddress(ipAddress)
                .userAgent(firstString(record, USER_AGENT_FIELDS).orElse(null))
                .application(application)
                .location(firstString(record, LOCATION_FIELDS).orElse(null))
                .category(firstString(record, CATEGORY_FIELDS).orElse(null))
                .targetResources(record.getListField("targetResources").orElse(List.of()))
                .additionalDetails(record.getListField("additionalDetails").orElse(List.of()))
                .rawEvent(record)
                .build();
    }

    // ---------------------------------------------------------------
    // Identity fallback chain
    // ---------------------------------------------------------------

    private static Identity resolveIdentity(AuditRecord record,
            String ipAddress,
            String application,
            Instant timestamp,
            String contentHash) {
        Optional<String> user = firstString(record, USER_FIELDS);
        if (user.isPresent()) {
            return Identity.real(user.get());
        }
        Optional<String> session = firstString(record, SESSION_FIELDS);
        if (session.isPresent()) {
            return Identity.synthetic(IdentityStrategy.SESSION, session.get());
        }
        if (!NormalizedEvent.isUnknown(ipAddress)) {
            return Identity.synthetic(IdentityStrategy.IP_ADDRESS, ipAddress);
        }
        if (!NormalizedEvent.isUnknown(application)) {
            return Identity.synthetic(IdentityStrategy.APPLICATION, application);
        }
        return Identity.synthetic(IdentityStrategy.TIMESTAMP, epochMillis(timestamp) + "_" + contentHash);
    }

    // ---------------------------------------------------------------
    // Field helpers
    // ---------------------------------------------------------------

    private static Optional<String> firstString(AuditRecord record, List<String> paths) {
        for (String path : paths) {
            Optional<String> value = record.getStringField(path);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static Optional<Object> firstValue(AuditRecord record, List<String> paths) {
        for (String path : paths) {
            Optional<Object> value = record.getField(path);
            if (value.isPresent() && !value.get().toString().isBlank()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static long epochMillis(Instant timestamp) {
        return timestamp != null ? timestamp.toEpochMilli() : 0L;
    }

    /**
     * Parse a timestamp value.
     *
     * <p>
     * Accepts ISO-8601 instants and offset date-times, zone-less local
     * date-times (read as UTC), and epoch milliseconds as a number or a
     * numeric string.
     * </p>
     *
     * @param raw field value
     * @return the instant, or empty if the value cannot be parsed
     */
    static Optional<Instant> parseTimestamp(Object raw) {
        if (raw instanceof Number n) {
            return Optional.of(Instant.ofEpochMilli(n.longValue()));
        }
        String text = raw.toString().trim();
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        if (text.chars().allMatch(Character::isDigit)) {
            try {
                return Optional.of(Instant.ofEpochMilli(Long.parseLong(text)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
