package com.socdash.reconciler.catalog;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StepCatalogTest {

    @Test
    void keys_areInChainOrder() {
        assertThat(StepCatalog.keys()).containsExactly(
                "lookup_ip", "quarantine_host", "block_ip",
                "enrich_threat_intel", "escalate", "finalize");
    }

    @Test
    void ordinals_matchListPosition() {
        for (int i = 0; i < StepCatalog.definitions().size(); i++) {
            assertThat(StepCatalog.definitions().get(i).ordinal()).isEqualTo(i);
        }
    }

    @Test
    void get_unknownKey_isEmpty() {
        assertThat(StepCatalog.get("collect_memory_dump")).isEmpty();
        assertThat(StepCatalog.contains("collect_memory_dump")).isFalse();
    }

    @Test
    void displayName_unknownKey_fallsBackToKey() {
        assertThat(StepCatalog.displayName("block_ip")).isEqualTo("Block IP at Firewall");
        assertThat(StepCatalog.displayName("collect_memory_dump")).isEqualTo("collect_memory_dump");
    }

    @Test
    void first_isIpLookup() {
        assertThat(StepCatalog.first().key()).isEqualTo("lookup_ip");
    }
}
