package com.example.resumeparser.application.service.parsing;

import com.example.resumeparser.domain.model.Certification;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One {@link Certification} per line of the certifications section.
 * A line reads {@code Name - Issuer}, {@code Name | Issuer} or {@code Name, Issuer}, optionally
 * with a date, a credential id and a verification link.
 */
@Component
public class CertificationExtractor {

    static final int MIN_LINE_LENGTH = 11;
    private static final Pattern URL = Pattern.compile("(?:https?://|www\\.)[^\\s,;|]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CREDENTIAL_ID = Pattern.compile(
            "\\(?\\b(?:Credential\\s*ID|Cert(?:ificate)?\\s*ID|ID)\\b\\s*[:#]?\\s*([A-Za-z0-9-]*\\d[A-Za-z0-9-]*)\\)?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ISSUER_DELIMITER = Pattern.compile("\\s+[-–—]\\s+|\\s*\\|\\s*|\\s*,\\s*");
    private static final Pattern MONTH_OR_YEAR = Pattern.compile(
            "\\(?(?:(?:Issued|Obtained|Earned)\\s*:?\\s*)?"
                    + "(?:\\b(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\.?\\s+)?(?<![/\\d])(?:19|20)\\d{2}\\b\\)?",
            Pattern.CASE_INSENSITIVE);

    public List<Certification> extract(String section) {
        List<Certification> certifications = new ArrayList<>();
        for (String rawLine : ResumeText.lines(section)) {
            String line = ResumeText.stripBullet(rawLine);
            if (line.length() < MIN_LINE_LENGTH) {
                continue;
            }
            certifications.add(parseLine(line));
        }
        return List.copyOf(certifications);
    }

    private Certification parseLine(String line) {
        String remaining = line;

        String url = "";
        Matcher urlMatcher = URL.matcher(remaining);
        if (urlMatcher.find()) {
            url = urlMatcher.group();
            remaining = cut(remaining, urlMatcher.start(), urlMatcher.end());
        }

        String credentialId = "";
        Matcher idMatcher = CREDENTIAL_ID.matcher(remaining);
        if (idMatcher.find()) {
            credentialId = idMatcher.group(1);
            remaining = cut(remaining, idMatcher.start(), idMatcher.end());
        }

        String dateIssued = "";
        Optional<String> date = DateRange.findSingleDate(remaining);
        if (date.isPresent()) {
            dateIssued = date.get();
            Matcher dateMatcher = MONTH_OR_YEAR.matcher(remaining);
            if (dateMatcher.find()) {
                remaining = cut(remaining, dateMatcher.start(), dateMatcher.end());
            }
        }

        remaining = DateRange.tidy(remaining);
        String name = remaining;
        String issuer = "";
        Matcher delimiter = ISSUER_DELIMITER.matcher(remaining);
        if (delimiter.find() && delimiter.start() > 0) {
            name = remaining.substring(0, delimiter.start());
            issuer = remaining.substring(delimiter.end());
        }
        return new Certification(DateRange.tidy(name), DateRange.tidy(issuer), dateIssued, credentialId, url);
    }

    private static String cut(String text, int start, int end) {
        return text.substring(0, start) + " " + text.substring(end);
    }
}
