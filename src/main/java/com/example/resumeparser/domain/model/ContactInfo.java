package com.example.resumeparser.domain.model;

/**
 * Contact details of the candidate. Every field is optional and represented as an empty string
 * when absent.
 */
public record ContactInfo(
        String name,
        String email,
        String phone,
        String linkedin,
        String github,
        String website,
        String address,
        String city,
        String state,
        String postalCode,
        String country
) {

    public ContactInfo {
        name = blankToEmpty(name);
        email = blankToEmpty(email);
        phone = blankToEmpty(phone);
        linkedin = blankToEmpty(linkedin);
        github = blankToEmpty(github);
        website = blankToEmpty(website);
        address = blankToEmpty(address);
        city = blankToEmpty(city);
        state = blankToEmpty(state);
        postalCode = blankToEmpty(postalCode);
        country = blankToEmpty(country);
    }

    public static ContactInfo empty() {
        return new ContactInfo(null, null, null, null, null, null, null, null, null, null, null);
    }

    public boolean hasName() {
        return !name.isEmpty();
    }

    public boolean hasEmail() {
        return !email.isEmpty();
    }

    public boolean hasPhone() {
        return !phone.isEmpty();
    }

    /**
     * Fraction of the core identity fields (name, email, phone) that are present.
     */
    public double coreCompleteness() {
        int present = (hasName() ? 1 : 0) + (hasEmail() ? 1 : 0) + (hasPhone() ? 1 : 0);
        return present / 3.0;
    }

    private static String blankToEmpty(String value) {
        return value == null ? "" : value.strip();
    }
}
