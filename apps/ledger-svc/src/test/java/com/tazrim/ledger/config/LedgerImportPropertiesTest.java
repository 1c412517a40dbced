package com.tazrim.ledger.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class LedgerImportPropertiesTest {

    @Test
    void appliesDefaults() {
        LedgerImportProperties props = LedgerImportProperties.defaults();

        assertThat(props.homeCurrency()).isEqualTo("ILS");
        assertThat(props.unknownCounterparty()).isEqualTo("UNKNOWN");
        assertThat(props.draftPageMaxSize()).isEqualTo(LedgerImportProperties.DEFAULT_DRAFT_PAGE_MAX_SIZE);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> new LedgerImportProperties("shekel", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("homeCurrency");
        assertThatThrownBy(() -> new LedgerImportProperties("USD", null, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("draftPageMaxSize");
    }
}
