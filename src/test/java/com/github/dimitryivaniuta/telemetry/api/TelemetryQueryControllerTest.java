package com.github.dimitryivaniuta.telemetry.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.telemetry.proxy.client.QueryEngineFactory;
import com.github.dimitryivaniuta.telemetry.support.FakeQueryEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
@TestPropertySource(properties = {
        "telemetry-proxy.adx.cluster-uri=https://test.kusto.windows.net",
        "telemetry-proxy.adx.database=telemetry",
        "telemetry-proxy.adx.client-id=app-id",
        "telemetry-proxy.adx.client-secret=secret",
        "telemetry-proxy.adx.tenant-id=tenant",
        "telemetry-proxy.rate-limit.max-requests=3",
        "management.prometheus.metrics.export.enabled=true"
})
class TelemetryQueryControllerTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;

    @MockBean QueryEngineFactory queryEngineFactory;

    private final FakeQueryEngine engine = new FakeQueryEngine();

    @BeforeEach
    void wireEngine() throws Exception {
        when(queryEngineFactory.create(any())).thenReturn(engine);
    }

    private static Map<String, Object> row(String name, Object value) {
        Map<String, Object> r = new LinkedHashMap<>();
        r.put("name", name);
        r.put("localtime", "2024-05-01T10:00:00Z");
        r.put("value_double", value);
        return r;
    }

    @Test
    void query_shouldReturnRowsAndServeRepeatFromCache() throws Exception {
        engine.returning(List.of(Map.of("comms_serial", "SN-001")));

        for (int i = 0; i < 2; i++) {
            mvc.perform(post("/api/telemetry/query")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"kql":"DevInfo | limit 2"}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].comms_serial").value("SN-001"));
        }

        assertThat(engine.calls()).isEqualTo(1);
    }

    @Test
    void query_shouldReturn400WhenKqlMissing() throws Exception {
        mvc.perform(post("/api/telemetry/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(header().exists("X-Correlation-Id"));
    }

    @Test
    void query_shouldReturn429WithRetryAfterWhenLimitReached() throws Exception {
        for (int i = 0; i < 3; i++) {
            mvc.perform(post("/api/telemetry/query")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"kql\":\"Telemetry | limit " + i + "\",\"useCache\":false}"))
                    .andExpect(status().isOk());
        }

        MvcResult res = mvc.perform(post("/api/telemetry/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Correlation-Id", "corr-42")
                        .content("{\"kql\":\"Telemetry | limit 99\"}"))
                .andExpect(status().isTooManyRequests())
                .andReturn();

        String retryAfter = res.getResponse().getHeader("Retry-After");
        assertThat(retryAfter).isNotBlank();
        assertThat(Integer.parseInt(retryAfter)).isGreaterThanOrEqualTo(1);

        JsonNode body = om.readTree(res.getResponse().getContentAsString());
        assertThat(body.get("status").asInt()).isEqualTo(429);
        assertThat(body.get("correlationId").asText()).isEqualTo("corr-42");
    }

    @Test
    void batch_shouldResolveTelemetryAndAlarmsWithOneQueryEach() throws Exception {
        engine.returning(List.of(row("/INV/DCPORT/STAT/PV1/V", 231.5), row("/BMS/MODULE1/STAT/V", 52.1)));

        MvcResult res = mvc.perform(post("/api/telemetry/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"serial":"SN-001",
                                 "telemetryNames":["/INV/DCPORT/STAT/PV1/V","STAT/V","/NOT/THERE"],
                                 "alarmNames":["/BMS/CLUSTER/EVENT/ALARM/MAIN_RELAY_ERROR"]}
                                """))
                .andExpect(status().isOk())
                .andReturn();

        JsonNode json = om.readTree(res.getResponse().getContentAsString());
        assertThat(json.at("/telemetry/~1INV~1DCPORT~1STAT~1PV1~1V/value").asDouble()).isEqualTo(231.5);
        assertThat(json.get("telemetry").has("STAT/V")).isTrue();
        assertThat(json.get("telemetry").has("/NOT/THERE")).isFalse();
        assertThat(json.at("/meta/queryCount").asInt()).isEqualTo(2);
        assertThat(json.at("/meta/rateLimitMax").asInt()).isEqualTo(3);
        assertThat(engine.calls()).isEqualTo(2);
    }

    @Test
    void batch_shouldAcceptSnakeCaseNameLists() throws Exception {
        engine.returning(List.of(row("/INV/DCPORT/STAT/PV1/V", 231.5)));

        mvc.perform(post("/api/telemetry/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"serial":"SN-001","telemetry_names":["/INV/DCPORT/STAT/PV1/V"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.telemetry['/INV/DCPORT/STAT/PV1/V'].value").value(231.5))
                .andExpect(jsonPath("$.meta.queryCount").value(1));

        assertThat(engine.calls()).isEqualTo(1);
    }

    @Test
    void batch_shouldReturn400WithoutAnyNames() throws Exception {
        mvc.perform(post("/api/telemetry/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"serial":"SN-001","telemetryNames":[],"alarmNames":[]}
                                """))
                .andExpect(status().isBadRequest());

        assertThat(engine.calls()).isZero();
    }

    @Test
    void deviceSearch_shouldReturn404WhenNoRow() throws Exception {
        engine.returning(List.of());

        mvc.perform(post("/api/telemetry/devices/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"serial":"UNKNOWN"}
                                """))
                .andExpect(status().isNotFound());

        assertThat(engine.executed()).containsExactly("DevInfo | where comms_serial contains 'UNKNOWN' | limit 1");
    }

    @Test
    void stats_shouldReflectWindowOccupancy() throws Exception {
        mvc.perform(get("/api/telemetry/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queriesInWindow").value(0))
                .andExpect(jsonPath("$.maxPerWindow").value(3))
                .andExpect(jsonPath("$.defaultTtlSeconds").value(30))
                .andExpect(jsonPath("$.clientAvailable").value(false));
    }

    @Test
    void actuator_shouldReportAdxDetails() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.adx.details.configured").value(true));

        mvc.perform(get("/actuator/prometheus"))
                .andExpect(status().isOk());
    }
}
