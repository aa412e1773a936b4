package com.microsoft.workspacereport.adapters.directory;

import com.microsoft.workspacereport.adapters.DirectoryLookup;
import com.microsoft.workspacereport.config.ReportProperties;
import com.microsoft.workspacereport.domain.model.DirectoryComputerInfo;
import com.microsoft.workspacereport.domain.model.DirectoryUserInfo;
import com.microsoft.workspacereport.exception.DirectoryQueryFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.ldap.NameNotFoundException;
import org.springframework.ldap.NamingException;
import org.springframework.ldap.core.AttributesMapper;
import org.springframework.ldap.core.LdapTemplate;
import org.springframework.ldap.query.LdapQuery;
import org.springframework.ldap.support.LdapUtils;
import org.springframework.stereotype.Component;

import javax.naming.Name;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;

import static org.springframework.ldap.query.LdapQueryBuilder.query;

/**
 * Active Directory lookup over LDAP.
 *
 * ATTRIBUTES:
 * Users: sAMAccountName, displayName, department, userAccountControl (enabled
 * is the inverse of the ACCOUNTDISABLE bit), mail, manager (a DN, resolved to
 * the manager's displayName), mobile.
 * Computers: cn, whenCreated (generalized time), operatingSystem.
 *
 * An empty search result means "not found" and is returned as an empty Optional.
 * A manager DN that no longer resolves leaves the manager blank.
 */
@Component
@Slf4j
public class LdapDirectoryLookup implements DirectoryLookup {

    static final int ACCOUNT_DISABLE = 0x2;

    private static final String[] USER_ATTRIBUTES = {
            "sAMAccountName", "displayName", "department", "userAccountControl", "mail", "manager", "mobile"
    };

    private static final String[] COMPUTER_ATTRIBUTES = {"cn", "whenCreated", "operatingSystem"};

    private static final DateTimeFormatter GENERALIZED_TIME = new DateTimeFormatterBuilder()
            .appendPattern("uuuuMMddHHmmss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .appendOffset("+HHMM", "Z")
            .toFormatter();

    private static final AttributesMapper<Attributes> IDENTITY = attributes -> attributes;

    private final LdapTemplate ldapTemplate;
    private final ReportProperties.Directory settings;
    private final Name baseDn;

    public LdapDirectoryLookup(LdapTemplate ldapTemplate,
                               ReportProperties properties,
                               @Value("${spring.ldap.base:}") String base) {
        this.ldapTemplate = ldapTemplate;
        this.settings = properties.getDirectory();
        this.baseDn = LdapUtils.newLdapName(base);
    }

    @Override
    public Optional<DirectoryUserInfo> resolveUser(String samAccountName) {
        if (samAccountName == null || samAccountName.isBlank()) {
            return Optional.empty();
        }
        log.debug("Resolving directory user: {}", samAccountName);

        LdapQuery userQuery = query()
                .base(settings.getUserSearchBase())
                .attributes(USER_ATTRIBUTES)
                .where("objectClass").is("user")
                .and("sAMAccountName").is(samAccountName);

        Optional<Attributes> entry = searchSingle(userQuery, samAccountName);
        if (entry.isEmpty()) {
            log.debug("Directory user not found: {}", samAccountName);
            return Optional.empty();
        }

        Attributes attributes = entry.get();
        String managerDn = stringValue(attributes, "manager");
        return Optional.of(new DirectoryUserInfo(
                samAccountName,
                stringValue(attributes, "displayName"),
                stringValue(attributes, "department"),
                enabled(attributes),
                stringValue(attributes, "mail"),
                managerDn != null ? resolveManagerName(managerDn) : null,
                stringValue(attributes, "mobile")
        ));
    }

    @Override
    public Optional<DirectoryComputerInfo> resolveComputer(String computerName) {
        if (computerName == null || computerName.isBlank()) {
            return Optional.empty();
        }
        log.debug("Resolving directory computer: {}", computerName);

        LdapQuery computerQuery = query()
                .base(settings.getComputerSearchBase())
                .attributes(COMPUTER_ATTRIBUTES)
                .where("objectClass").is("computer")
                .and("cn").is(computerName);

        return searchSingle(computerQuery, computerName)
                .map(attributes -> new DirectoryComputerInfo(
                        computerName,
                        generalizedTime(stringValue(attributes, "whenCreated")),
                        stringValue(attributes, "operatingSystem")
                ));
    }

    private Optional<Attributes> searchSingle(LdapQuery ldapQuery, String item) {
        List<Attributes> results;
        try {
            results = ldapTemplate.search(ldapQuery, IDENTITY);
        } catch (NamingException e) {
            throw new DirectoryQueryFailedException(item, e);
        }
        if (results.size() > 1) {
            log.warn("Directory returned {} entries for {}, using the first", results.size(), item);
        }
        return results.stream().findFirst();
    }

    private String resolveManagerName(String managerDn) {
        try {
            Attributes manager = ldapTemplate.lookup(relativeToBase(managerDn), IDENTITY);
            return stringValue(manager, "displayName");
        } catch (NameNotFoundException e) {
            log.debug("Manager entry no longer exists: {}", managerDn);
            return null;
        } catch (NamingException e) {
            throw new DirectoryQueryFailedException(managerDn, e);
        }
    }

    // DNs stored in attributes are absolute, lookups are relative to the context base
    private Name relativeToBase(String dn) {
        Name name = LdapUtils.newLdapName(dn);
        if (!baseDn.isEmpty() && name.startsWith(baseDn)) {
            return LdapUtils.removeFirst(name, baseDn);
        }
        return name;
    }

    static Boolean enabled(Attributes attributes) {
        String control = stringValue(attributes, "userAccountControl");
        if (control == null) {
            return null;
        }
        try {
            return (Integer.parseInt(control.trim()) & ACCOUNT_DISABLE) == 0;
        } catch (NumberFormatException e) {
            log.warn("Unparseable userAccountControl value: {}", control);
            return null;
        }
    }

    static Instant generalizedTime(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value, GENERALIZED_TIME).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Unparseable generalized time value: {}", value);
            return null;
        }
    }

    static String stringValue(Attributes attributes, String id) {
        Attribute attribute = attributes.get(id);
        if (attribute == null) {
            return null;
        }
        try {
            Object value = attribute.get();
            return value != null ? value.toString() : null;
        } catch (javax.naming.NamingException e) {
            throw new DirectoryQueryFailedException(id, e);
        }
    }
}
