package com.example.resumeparser.domain.model;

/**
 * A certification or license line.
 */
public record Certification(
        String name,
        String issuer,
        String dateIssued,
        String credentialId,
        String url
) {

    public Certification {
        name = name == null ? "" : name;
        issuer = issuer == null ? "" : issuer;
        dateIssued = dateIssued == null ? "" : dateIssued;
        credentialId = credentialId == null ? "" : credentialId;
        url = url == null ? "" : url;
    }
}
