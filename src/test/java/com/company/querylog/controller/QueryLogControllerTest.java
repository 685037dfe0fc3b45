package com.company.querylog.controller;

import com.company.querylog.dto.request.QueryLogParams;
import com.company.querylog.dto.response.QueryLogEntryResponse;
import com.company.querylog.dto.response.QueryLogResponse;
import com.company.querylog.exception.InvalidFilterException;
import com.company.querylog.service.QueryLogQueryService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = QueryLogController.class)
@Import(ControllerTestConfig.class)
class QueryLogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MeterRegistry meterRegistry;

    @MockBean
    private QueryLogQueryService queryService;

    @Test
    void bindsQueryParametersAndReturnsPage() throws Exception {
        QueryLogEntryResponse entry = QueryLogEntryResponse.builder()
                .id(42)
                .question(new QueryLogEntryResponse.Question("example.com", "A"))
                .client("192.168.1.10")
                .status("OK")
                .reason("OK")
                .time("2024-01-01T10:00:00Z")
                .elapsedMs("12.500")
                .build();
        when(queryService.getQueryLog(any())).thenReturn(QueryLogResponse.builder()
                .data(List.of(entry))
                .total(17)
                .snapshotId(99)
                .oldest("2024-01-01T10:00:00Z")
                .build());

        mockMvc.perform(get("/api/v1/querylog")
                        .param("status", "Blocked")
                        .param("search", "example")
                        .param("minElapsedMs", "5.5")
                        .param("offset", "20")
                        .param("limit", "10")
                        .param("sort", "elapsedMs")
                        .param("order", "asc")
                        .param("snapshotId", "99"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(17))
                .andExpect(jsonPath("$.snapshot_id").value(99))
                .andExpect(jsonPath("$.oldest").value("2024-01-01T10:00:00Z"))
                .andExpect(jsonPath("$.data[0].question.name").value("example.com"))
                .andExpect(jsonPath("$.data[0].elapsedMs").value("12.500"))
                .andExpect(jsonPath("$.data[0].upstream").doesNotExist());

        ArgumentCaptor<QueryLogParams> captor = ArgumentCaptor.forClass(QueryLogParams.class);
        verify(queryService).getQueryLog(captor.capture());
        QueryLogParams params = captor.getValue();
        assertThat(params.getStatus()).isEqualTo("Blocked");
        assertThat(params.getSearch()).isEqualTo("example");
        assertThat(params.getMinElapsedMs()).isEqualTo(5.5);
        assertThat(params.getOffset()).isEqualTo(20);
        assertThat(params.getLimit()).isEqualTo(10);
        assertThat(params.getSort()).isEqualTo("elapsedMs");
        assertThat(params.getOrder()).isEqualTo("asc");
        assertThat(params.getSnapshotId()).isEqualTo(99L);
    }

    @Test
    void invalidFilterIsBadRequest() throws Exception {
        when(queryService.getQueryLog(any())).thenThrow(new InvalidFilterException("offset must not be negative: -1"));

        mockMvc.perform(get("/api/v1/querylog").param("offset", "-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("offset must not be negative: -1"));
    }

    @Test
    void unknownSortsShareOneRequestCounter() throws Exception {
        when(queryService.getQueryLog(any())).thenThrow(new InvalidFilterException("Unknown sort field"));
        double before = invalidSortCount();

        for (int i = 0; i < 50; i++) {
            mockMvc.perform(get("/api/v1/querylog").param("sort", "junk-" + i))
                    .andExpect(status().isBadRequest());
        }

        assertThat(invalidSortCount() - before).isEqualTo(50.0);
        assertThat(meterRegistry.find("api.querylog.requests").counters())
                .extracting(counter -> counter.getId().getTag("sort"))
                .allMatch(tag -> !tag.startsWith("junk-"));
    }

    private double invalidSortCount() {
        Counter counter = meterRegistry.find("api.querylog.requests")
                .tags("endpoint", "list", "sort", "invalid")
                .counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    void sortTagUsesResolvedFieldName() {
        assertThat(QueryLogController.sortTag(null)).isEqualTo("time");
        assertThat(QueryLogController.sortTag("ELAPSED_MS")).isEqualTo("elapsedMs");
        assertThat(QueryLogController.sortTag("question/name")).isEqualTo("domain");
        assertThat(QueryLogController.sortTag("bogus")).isEqualTo("invalid");
    }

    @Test
    void nonNumericParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/querylog").param("limit", "lots"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void exportsCsv() throws Exception {
        when(queryService.exportCsv(any())).thenReturn("Time,Client,Domain,Type,Status,Elapsed(ms),Reason\nrow");

        mockMvc.perform(get("/api/v1/querylog/export").param("status", "Blocked"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", startsWith("text/csv")))
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"querylog.csv\""))
                .andExpect(content().string(startsWith("Time,Client,Domain")));
    }
}
