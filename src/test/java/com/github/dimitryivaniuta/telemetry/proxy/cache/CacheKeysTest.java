package com.github.dimitryivaniuta.telemetry.proxy.cache;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    @Test
    void queryKeyShouldBePrefixedMd5OfQueryText() {
        assertThat(CacheKeys.forQuery("DevInfo | limit 2"))
                .isEqualTo("adx:6fec9ba85b40acb59ced1827f8100ad4");
    }

    @Test
    void identicalQueriesShouldShareKeyAndDifferentQueriesShouldNot() {
        String q = "Telemetry | where comms_serial contains 'ABC' | limit 10";
        assertThat(CacheKeys.forQuery(q)).isEqualTo(CacheKeys.forQuery(new String(q.toCharArray())));
        assertThat(CacheKeys.forQuery(q)).isNotEqualTo(CacheKeys.forQuery(q + " "));
    }

    @Test
    void batchKeyShouldNotDependOnNameOrder() {
        String k1 = CacheKeys.forBatch("batch_telemetry", "SN1", List.of("B", "A"));
        String k2 = CacheKeys.forBatch("batch_telemetry", "SN1", List.of("A", "B"));

        assertThat(k1).isEqualTo(k2);
        assertThat(k1).isEqualTo("batch_telemetry:SN1:0a85c030b916b0c44d958c53335acc7a");
    }

    @Test
    void batchKeyShouldHashSortedNamesJoinedByColon() {
        String key = CacheKeys.forBatch("batch_alarms", "2234-ABC",
                List.of("/INV/DCPORT/STAT/PV1/V", "/BMS/MODULE1/STAT/V"));

        assertThat(key).isEqualTo("batch_alarms:2234-ABC:7f15f51d3beabcfd61cf31ad0d080b58");
    }

    @Test
    void shortFormShouldKeepLastEightCharacters() {
        assertThat(CacheKeys.shortForm("adx:6fec9ba85b40acb59ced1827f8100ad4")).isEqualTo("f8100ad4");
        assertThat(CacheKeys.shortForm("abc")).isEqualTo("abc");
    }
}
