package com.ai.assistant.service;

import com.ai.assistant.conversation.EmailValidationResult;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Syntax checks plus typo suggestions for the domain part of an address.
 */
@Service
public class DefaultEmailAddressValidator implements EmailAddressValidator {

    private static final Pattern LOCAL_PART = Pattern.compile("[a-zA-Z0-9._%+-]+");
    private static final Pattern DOMAIN = Pattern.compile("[a-zA-Z0-9-]+(?:\\.[a-zA-Z0-9-]+)*");
    private static final Pattern TLD = Pattern.compile("[a-zA-Z]{2,}");

    private static final List<String> POPULAR_DOMAINS = List.of(
            "gmail.com", "yahoo.com", "hotmail.com", "outlook.com", "icloud.com",
            "protonmail.com", "mail.com", "ymail.com"
    );

    private static final Map<String, String> TLD_TYPOS = Map.of(
            "con", "com",
            "cmo", "com",
            "comm", "com",
            "cm", "com",
            "ogr", "org",
            "nte", "net"
    );

    private static final int MAX_DOMAIN_DISTANCE = 2;
    // shorter domains are too close to each other for edit distance to mean a typo
    private static final int MIN_TYPO_CHECK_LENGTH = 7;

    private final LevenshteinDistance distance = new LevenshteinDistance(MAX_DOMAIN_DISTANCE);

    @Override
    public EmailValidationResult validate(String address) {
        if (StringUtils.isBlank(address)) {
            return EmailValidationResult.invalid("The email address is empty.", null);
        }
        String candidate = address.trim();
        if (StringUtils.containsWhitespace(candidate)) {
            String compact = StringUtils.deleteWhitespace(candidate);
            return EmailValidationResult.invalid("An email address cannot contain spaces.",
                    validate(compact).valid() ? compact : null);
        }
        if (StringUtils.countMatches(candidate, '@') != 1) {
            return EmailValidationResult.invalid("An email address needs exactly one '@'.", null);
        }

        String local = StringUtils.substringBefore(candidate, "@");
        String domain = StringUtils.substringAfter(candidate, "@").toLowerCase(Locale.ROOT);
        if (local.isEmpty() || !LOCAL_PART.matcher(local).matches()
                || local.startsWith(".") || local.endsWith(".") || local.contains("..")) {
            return EmailValidationResult.invalid("The part before '@' is not valid.", null);
        }
        if (domain.isEmpty() || !DOMAIN.matcher(domain).matches()) {
            return EmailValidationResult.invalid("The domain '" + domain + "' is not valid.", null);
        }
        if (!domain.contains(".")) {
            return EmailValidationResult.invalid("The domain '" + domain + "' has no top-level part.",
                    local + "@" + domain + ".com");
        }

        String tld = StringUtils.substringAfterLast(domain, ".");
        String tldFix = TLD_TYPOS.get(tld);
        if (tldFix != null) {
            return EmailValidationResult.invalid("The domain '" + domain + "' looks misspelled.",
                    local + "@" + StringUtils.removeEnd(domain, tld) + tldFix);
        }
        if (!TLD.matcher(tld).matches()) {
            return EmailValidationResult.invalid("The domain '" + domain + "' has an invalid ending.", null);
        }

        String closest = closestPopularDomain(domain);
        if (closest != null) {
            return EmailValidationResult.invalid("The domain '" + domain + "' looks misspelled.", local + "@" + closest);
        }
        return EmailValidationResult.ok();
    }

    /** A popular domain within the allowed edit distance, unless the domain is that domain. */
    private String closestPopularDomain(String domain) {
        if (domain.length() < MIN_TYPO_CHECK_LENGTH || POPULAR_DOMAINS.contains(domain)) return null;
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String popular : POPULAR_DOMAINS) {
            int d = distance.apply(domain, popular);
            if (d >= 0 && d < bestDistance) {
                best = popular;
                bestDistance = d;
            }
        }
        return best;
    }
}
