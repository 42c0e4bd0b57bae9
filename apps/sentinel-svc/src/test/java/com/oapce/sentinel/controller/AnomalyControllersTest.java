package com.oapce.sentinel.controller;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.StringJoiner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AnomalyControllersTest {

    @Autowired
    MockMvc mockMvc;

    @Test
    void detectsSpikeAndManagesItsAlert() throws Exception {
        LocalDate first = LocalDate.now(ZoneOffset.UTC).minusDays(35);
        LocalDate spikeDay = first.plusDays(19);
        recordSeries("web_sales", first, 19);

        String body = mockMvc.perform(post("/anomalies/detect").param("metric", "web_sales"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.dataPoints").value(35))
                .andExpect(jsonPath("$.methodsUsed", hasItem("seasonal_residual")))
                .andExpect(jsonPath("$.anomalies[?(@.timestamp == '" + spikeDay + "')].severity").value(hasItem("critical")))
                .andExpect(jsonPath("$.traceId").isNotEmpty())
                .andReturn().getResponse().getContentAsString();
        long alertId = ((Number) JsonPath.read(body, "$.anomalies[0].alertId")).longValue();

        mockMvc.perform(get("/anomalies/alerts").param("metric", "web_sales"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.anomalies[0].severity").value("critical"))
                .andExpect(jsonPath("$.anomalies[0].status").value("open"));

        mockMvc.perform(post("/anomalies/alerts/{id}/acknowledge", alertId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assignedTo\":\"finance-ops\",\"notes\":\"checking invoices\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(post("/anomalies/alerts/{id}/resolve", alertId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolution\":\"bulk invoice confirmed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Alert " + alertId + " resolved"));

        mockMvc.perform(get("/anomalies/alerts/{id}", alertId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("resolved"))
                .andExpect(jsonPath("$.assignedTo").value("finance-ops"));

        mockMvc.perform(get("/anomalies/dashboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAnomalies").value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.severitySummary.critical.resolved").value(greaterThanOrEqualTo(1)));

        mockMvc.perform(get("/anomalies/model-runs").param("model", "seasonal_residual"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].modelName").value("seasonal_residual"));
    }

    @Test
    void unknownMetricReportsInsufficientData() throws Exception {
        mockMvc.perform(post("/anomalies/detect").param("metric", "no_such_metric"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.reason").value("insufficient data"))
                .andExpect(jsonPath("$.dataPoints").value(0));
    }

    @Test
    void missingAlertIsNotFound() throws Exception {
        mockMvc.perform(post("/anomalies/alerts/{id}/acknowledge", 987654L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Alert 987654 not found"));

        mockMvc.perform(get("/anomalies/alerts/{id}", 987654L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ALERT_NOT_FOUND"));
    }

    @Test
    void invalidArgumentsAreBadRequests() throws Exception {
        mockMvc.perform(post("/anomalies/detect").param("metric", "web_sales").param("lookbackDays", "0")
                        .header("X-Sentinel-Trace", "dash-err-1"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("X-Sentinel-Trace", "dash-err-1"))
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.traceId").value("dash-err-1"))
                .andExpect(jsonPath("$.details").isMap());

        mockMvc.perform(get("/anomalies/alerts").param("status", "snoozed"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        mockMvc.perform(post("/anomalies/alerts/{id}/resolve", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolution\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void observationsAreListedPerMetric() throws Exception {
        LocalDate day = LocalDate.now(ZoneOffset.UTC).minusDays(3);
        mockMvc.perform(post("/anomalies/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"metricName\":\"refunds_total\",\"date\":\"" + day + "\",\"amount\":12.5}]"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.recorded").value(1));

        mockMvc.perform(get("/anomalies/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasItem("refunds_total")));

        mockMvc.perform(get("/anomalies/metrics/series").param("metric", "refunds_total"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].date").value(day.toString()));

        mockMvc.perform(get("/anomalies/metrics/series").param("metric", "refunds_total").param("lookbackDays", "4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
        mockMvc.perform(get("/anomalies/metrics/series").param("metric", "refunds_total").param("lookbackDays", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    private void recordSeries(String metric, LocalDate first, int spikeIndex) throws Exception {
        StringJoiner rows = new StringJoiner(",", "[", "]");
        for (int day = 0; day < 35; day++) {
            int amount = day == spikeIndex ? 15_000 : 1_000 + ((day * 37) % 11 - 5) * 10;
            rows.add("{\"metricName\":\"" + metric + "\",\"date\":\"" + first.plusDays(day) + "\",\"amount\":" + amount + "}");
        }
        mockMvc.perform(post("/anomalies/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(rows.toString()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.recorded").value(35));
    }
}
