package com.auditsentinel.core.detection;

import com.auditsentinel.core.model.MitreMapping;

import java.util.List;
import java.util.Map;

/**
 * Static MITRE ATT&amp;CK mapping and remediation advice per detection type.
 *
 * <p>
 * Types without an entry fall back to {@link #GENERIC_MAPPING} and
 * {@link #GENERIC_RECOMMENDATIONS}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MitreCatalog {

    public static final MitreMapping GENERIC_MAPPING = mapping(
            List.of("Defense Evasion"), List.of("T1562"), List.of("T1562.001"));

    public static final List<String> GENERIC_RECOMMENDATIONS = List.of(
            "Investigate the activity",
            "Verify authorization",
            "Monitor for additional suspicious behavior");

    private static final Map<String, MitreMapping> MAPPINGS = Map.ofEntries(
            Map.entry("password_reset", mapping(
                    List.of("Credential Access", "Defense Evasion"),
                    List.of("T1110", "T1556"),
                    List.of("T1110.001", "T1556.001"))),
            Map.entry("role_assignment", mapping(
                    List.of("Privilege Escalation", "Persistence"),
                    List.of("T1134", "T1078"),
                    List.of("T1134.001", "T1078.004"))),
            Map.entry("permission_grant", mapping(
                    List.of("Privilege Escalation", "Persistence"),
                    List.of("T1134", "T1078"),
                    List.of("T1134.001", "T1078.004"))),
            Map.entry("user_deletion", mapping(
                    List.of("Impact", "Defense Evasion"),
                    List.of("T1531", "T1070"),
                    List.of("T1531.001", "T1070.004"))),
            Map.entry("admin_consent", mapping(
                    List.of("Privilege Escalation", "Persistence"),
                    List.of("T1134", "T1098"),
                    List.of("T1134.001", "T1098.001"))),
            Map.entry("mfa_disable", mapping(
                    List.of("Defense Evasion", "Credential Access"),
                    List.of("T1556", "T1110"),
                    List.of("T1556.006", "T1110.001"))),
            Map.entry("blacklisted_application", mapping(
                    List.of("Initial Access", "Persistence"),
                    List.of("T1078", "T1199"),
                    List.of("T1078.004"))),
            Map.entry("blacklisted_country", mapping(
                    List.of("Initial Access", "Defense Evasion"),
                    List.of("T1078", "T1090"),
                    List.of("T1078.004", "T1090.003"))),
            Map.entry("blacklisted_user_agent", mapping(
                    List.of("Defense Evasion", "Command and Control"),
                    List.of("T1071", "T1090"),
                    List.of("T1071.001"))),
            Map.entry("after_hours_activity", mapping(
                    List.of("Defense Evasion", "Persistence"),
                    List.of("T1070", "T1562"),
                    List.of("T1070.004"))),
            Map.entry("weekend_activity", mapping(
                    List.of("Defense Evasion"),
                    List.of("T1070"),
                    List.of("T1070.004"))),
            Map.entry("permission_change", mapping(
                    List.of("Privilege Escalation", "Persistence"),
                    List.of("T1134", "T1078"),
                    List.of("T1134.001", "T1078.004"))),
            Map.entry("brute_force", mapping(
                    List.of("Credential Access", "Initial Access"),
                    List.of("T1110", "T1078"),
                    List.of("T1110.001", "T1110.003"))),
            Map.entry("high_activity_user", mapping(
                    List.of("Collection", "Exfiltration"),
                    List.of("T1005", "T1041"),
                    List.of("T1005.001"))),
            Map.entry("shared_ip_access", mapping(
                    List.of("Initial Access", "Lateral Movement"),
                    List.of("T1078", "T1021"),
                    List.of("T1078.004"))));

    private static final Map<String, List<String>> RECOMMENDATIONS = Map.ofEntries(
            Map.entry("password_reset", List.of(
                    "Verify the legitimacy of password reset requests",
                    "Implement strong password policies",
                    "Monitor for subsequent suspicious activity")),
            Map.entry("role_assignment", List.of(
                    "Review the necessity of role assignments",
                    "Implement approval workflows for role changes",
                    "Monitor for abuse of assigned roles")),
            Map.entry("permission_grant", List.of(
                    "Verify authorization for permission grants",
                    "Implement least privilege principles",
                    "Regular review of granted permissions")),
            Map.entry("user_deletion", List.of(
                    "Verify authorization for user deletion",
                    "Ensure proper data retention policies",
                    "Monitor for unauthorized deletions")),
            Map.entry("admin_consent", List.of(
                    "Review admin consent grants carefully",
                    "Implement approval workflows",
                    "Monitor application permissions")),
            Map.entry("mfa_disable", List.of(
                    "Immediate investigation required",
                    "Re-enable MFA if unauthorized",
                    "Review MFA bypass policies")),
            Map.entry("blacklisted_application", List.of(
                    "Investigate the use of this blacklisted application",
                    "Review user access permissions",
                    "Consider blocking this application organization-wide")),
            Map.entry("blacklisted_country", List.of(
                    "Investigate the legitimacy of access from this location",
                    "Verify user identity and authorization",
                    "Consider implementing geo-blocking")),
            Map.entry("blacklisted_user_agent", List.of(
                    "Investigate the use of this user agent",
                    "Check for potential automated tools or bots",
                    "Monitor for additional suspicious activity")),
            Map.entry("after_hours_activity", List.of(
                    "Verify if this activity was authorized",
                    "Consider implementing time-based access controls",
                    "Monitor for additional suspicious activity")),
            Map.entry("weekend_activity", List.of(
                    "Verify if weekend access was necessary",
                    "Review business justification for weekend activity")),
            Map.entry("permission_change", List.of(
                    "Review the necessity of this permission change",
                    "Verify authorization for this change",
                    "Monitor for abuse of new permissions")),
            Map.entry("brute_force", List.of(
                    "Implement account lockout policies",
                    "Monitor for additional suspicious activity",
                    "Consider blocking IP address if pattern continues",
                    "Review MFA implementation")),
            Map.entry("high_activity_user", List.of(
                    "Investigate the nature of high activity",
                    "Verify if user behavior is legitimate",
                    "Monitor for data exfiltration attempts")),
            Map.entry("shared_ip_access", List.of(
                    "Investigate the legitimacy of shared IP usage",
                    "Verify if this is a corporate network or VPN",
                    "Monitor for potential account compromise")));

    private MitreCatalog() {
        // static tables
    }

    /**
     * @param type detection type, e.g. {@code mfa_disable}
     * @return the mapping for the type, or the generic fallback
     */
    public static MitreMapping mappingFor(String type) {
        return MAPPINGS.getOrDefault(type, GENERIC_MAPPING);
    }

    /**
     * @param type detection type
     * @return ordered remediation strings, or the generic fallback
     */
    public static List<String> recommendationsFor(String type) {
        return RECOMMENDATIONS.getOrDefault(type, GENERIC_RECOMMENDATIONS);
    }

    private static MitreMapping mapping(List<String> tactics, List<String> techniques, List<String> subTechniques) {
        return new MitreMapping(tactics, techniques, subTechniques);
    }
}
