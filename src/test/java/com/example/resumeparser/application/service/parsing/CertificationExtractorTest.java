package com.example.resumeparser.application.service.parsing;

import com.example.resumeparser.domain.model.Certification;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CertificationExtractor}.
 */
class CertificationExtractorTest {

    private final CertificationExtractor extractor = new CertificationExtractor();

    @Test
    void extractReadsNameIssuerAndDate() {
        Certification certification = extractor
                .extract("AWS Certified Solutions Architect - Amazon Web Services (2021)").get(0);

        assertThat(certification.name()).isEqualTo("AWS Certified Solutions Architect");
        assertThat(certification.issuer()).isEqualTo("Amazon Web Services");
        assertThat(certification.dateIssued()).isEqualTo("2021");
    }

    @Test
    void extractReadsCredentialIdAndLink() {
        Certification certification = extractor.extract(
                "• Certified Kubernetes Administrator | CNCF | Credential ID: CKA-1234 | https://cncf.io/verify/1234").get(0);

        assertThat(certification.name()).isEqualTo("Certified Kubernetes Administrator");
        assertThat(certification.issuer()).isEqualTo("CNCF");
        assertThat(certification.credentialId()).isEqualTo("CKA-1234");
        assertThat(certification.url()).isEqualTo("https://cncf.io/verify/1234");
    }

    @Test
    void extractCreatesOneEntryPerLine() {
        List<Certification> certifications = extractor.extract(
                "Oracle Certified Professional Java SE 17\nScrum Master, Scrum Alliance\nCPR");

        assertThat(certifications).extracting(Certification::name)
                .containsExactly("Oracle Certified Professional Java SE 17", "Scrum Master");
        assertThat(certifications.get(1).issuer()).isEqualTo("Scrum Alliance");
    }
}
