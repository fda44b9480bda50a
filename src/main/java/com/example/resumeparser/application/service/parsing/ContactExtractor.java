package com.example.resumeparser.application.service.parsing;

import com.example.resumeparser.domain.model.ContactInfo;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pulls contact details out of the contact section and the unlabelled header of a résumé,
 * falling back to the whole document. The first plausible match wins for every field.
 */
@Component
public class ContactExtractor {

    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final List<Pattern> PHONE_PATTERNS = List.of(
            Pattern.compile("\\+?1?[-.\\s]?\\(?(\\d{3})\\)?[-.\\s]?(\\d{3})[-.\\s]?(\\d{4})"),
            Pattern.compile("\\+?(\\d{1,4})[-.\\s]?(\\d{3,4})[-.\\s]?(\\d{3,4})[-.\\s]?(\\d{3,4})"),
            Pattern.compile("\\b\\d{3}[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b")
    );
    private static final Pattern LINKEDIN = Pattern.compile(
            "(?:https?://)?(?:www\\.)?linkedin\\.com/in/[A-Za-z0-9_-]+/?", Pattern.CASE_INSENSITIVE);
    private static final Pattern GITHUB = Pattern.compile(
            "(?:https?://)?(?:www\\.)?github\\.com/[A-Za-z0-9_-]+/?", Pattern.CASE_INSENSITIVE);
    private static final Pattern URL = Pattern.compile("(?:https?://|www\\.)[^\\s,;|<>]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CITY_STATE = Pattern.compile(
            "([A-Za-z][A-Za-z .]+),\\s*([A-Z]{2})\\b(?:\\s*(\\d{5}(?:-\\d{4})?))?");
    private static final Pattern SEGMENT_DELIMITER = Pattern.compile("\\s*[|•]\\s*");
    private static final Set<String> REGION_CODES = Set.of(
            "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "DC", "FL", "GA", "HI", "ID", "IL", "IN", "IA",
            "KS", "KY", "LA", "ME", "MD", "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ", "NM",
            "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC", "SD", "TN", "TX", "UT", "VT", "VA", "WA",
            "WV", "WI", "WY", "AB", "BC", "MB", "NB", "NL", "NS", "ON", "PE", "QC", "SK");
    private static final List<String> COUNTRIES = List.of(
            "United States", "USA", "Canada", "United Kingdom", "UK", "Germany", "France", "India",
            "Australia", "Ireland", "Netherlands", "Spain");
    // In COUNTRIES order; the first listed country found wins.
    private static final Map<String, Pattern> COUNTRY_PATTERNS = COUNTRIES.stream()
            .collect(Collectors.toMap(Function.identity(),
                    country -> Pattern.compile("\\b" + Pattern.quote(country) + "\\b"),
                    (first, second) -> first, LinkedHashMap::new));
    private static final int NAME_SEARCH_LINES = 5;
    private static final int HEADER_FALLBACK_LINES = 10;
    private static final int MIN_PHONE_DIGITS = 7;
    private static final int MAX_PHONE_DIGITS = 15;

    private final SectionSegmenter segmenter;

    public ContactExtractor(SectionSegmenter segmenter) {
        this.segmenter = segmenter;
    }

    /**
     * @param contactSection content of the contact section, may be empty
     * @param preamble       text before the first heading
     * @param fullText       whole normalized document
     */
    public ContactInfo extract(String contactSection, String preamble, String fullText) {
        String header = join(contactSection, preamble);
        String document = fullText == null ? "" : fullText;
        if (header.isEmpty()) {
            header = ResumeText.lines(document).stream().limit(HEADER_FALLBACK_LINES)
                    .reduce((a, b) -> a + "\n" + b).orElse("");
        }

        String email = firstMatch(EMAIL, header).or(() -> firstMatch(EMAIL, document)).orElse("");
        String phone = findPhone(header).or(() -> findPhone(document)).orElse("");
        String linkedin = firstMatch(LINKEDIN, header).or(() -> firstMatch(LINKEDIN, document)).orElse("");
        String github = firstMatch(GITHUB, header).or(() -> firstMatch(GITHUB, document)).orElse("");
        String website = findWebsite(header).orElse("");
        String name = findName(preamble).or(() -> findName(contactSection)).orElse("");

        String address = "";
        String city = "";
        String state = "";
        String postalCode = "";
        Optional<AddressMatch> location = findAddress(header);
        if (location.isPresent()) {
            address = location.get().segment();
            city = location.get().city();
            state = location.get().state();
            postalCode = location.get().postalCode();
        }
        String country = findCountry(header).orElse("");

        return new ContactInfo(name, email, phone, linkedin, github, website, address, city, state, postalCode, country);
    }

    private Optional<String> findPhone(String text) {
        for (Pattern pattern : PHONE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String candidate = matcher.group().strip();
                String digits = candidate.replaceAll("\\D", "");
                if (digits.length() < MIN_PHONE_DIGITS || digits.length() > MAX_PHONE_DIGITS) {
                    continue;
                }
                if (candidate.equals(digits) && digits.length() == 10) {
                    return Optional.of("+1" + digits);
                }
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Optional<String> findWebsite(String text) {
        Matcher matcher = URL.matcher(text);
        while (matcher.find()) {
            String url = matcher.group().replaceAll("[.)]+$", "");
            String lower = url.toLowerCase(Locale.ROOT);
            if (!lower.contains("linkedin.com") && !lower.contains("github.com")) {
                return Optional.of(url);
            }
        }
        return Optional.empty();
    }

    /**
     * A name is a short line of at least two words with no digits, no address or link markers,
     * that is not itself a heading.
     */
    private Optional<String> findName(String text) {
        return ResumeText.lines(text).stream()
                .limit(NAME_SEARCH_LINES)
                .filter(line -> line.split("\\s+").length >= 2)
                .filter(line -> line.chars().noneMatch(Character::isDigit))
                .filter(line -> !line.contains("@") && !line.contains("/") && !line.contains(",") && !line.contains("|"))
                .filter(line -> !ResumeText.isBulleted(line))
                .filter(line -> segmenter.headingOf(line).isEmpty())
                .findFirst();
    }

    private Optional<AddressMatch> findAddress(String text) {
        for (String line : ResumeText.lines(text)) {
            for (String segment : SEGMENT_DELIMITER.split(line)) {
                Matcher matcher = CITY_STATE.matcher(segment);
                while (matcher.find()) {
                    if (!REGION_CODES.contains(matcher.group(2))) {
                        continue;
                    }
                    String postal = matcher.group(3) != null ? matcher.group(3) : "";
                    return Optional.of(new AddressMatch(segment.strip(), matcher.group(1).strip(), matcher.group(2), postal));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> findCountry(String text) {
        for (Map.Entry<String, Pattern> country : COUNTRY_PATTERNS.entrySet()) {
            if (country.getValue().matcher(text).find()) {
                return Optional.of(country.getKey());
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.group().strip()) : Optional.empty();
    }

    private static String join(String first, String second) {
        String a = first == null ? "" : first.strip();
        String b = second == null ? "" : second.strip();
        if (a.isEmpty()) {
            return b;
        }
        return b.isEmpty() ? a : a + "\n" + b;
    }

    private record AddressMatch(String segment, String city, String state, String postalCode) {
    }
}
