package com.example.FundScout.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FieldPresenceTest {

    @Test
    void sentinelsAndBlanksAreMissing() {
        assertThat(FieldPresence.isMissing(null)).isTrue();
        assertThat(FieldPresence.isMissing("   ")).isTrue();
        assertThat(FieldPresence.isMissing("N/A")).isTrue();
        assertThat(FieldPresence.isMissing("NaN")).isTrue();
        assertThat(FieldPresence.isMissing("Not specified")).isTrue();
    }

    @Test
    void missingMarkersInsideLongerText() {
        assertThat(FieldPresence.isMissing("Deadline information not found")).isTrue();
        assertThat(FieldPresence.isMissing("TBD")).isTrue();
        assertThat(FieldPresence.isMissing("Amount unknown")).isTrue();
    }

    @Test
    void realValuesArePresentAndTrimmed() {
        assertThat(FieldPresence.isPresent("31.12.2026")).isTrue();
        assertThat(FieldPresence.present("  info@isb.rlp.de ")).contains("info@isb.rlp.de");
        assertThat(FieldPresence.firstPresent("n/a", null, "Germany")).contains("Germany");
        assertThat(FieldPresence.orDefault("none", "Not specified")).isEqualTo("Not specified");
    }
}
