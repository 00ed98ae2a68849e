package dev.chi.tui.controller.watchdog;

import dev.chi.tui.common.GlobalExceptionHandler;
import dev.chi.tui.entity.response.WatchdogCommandLogView;
import dev.chi.tui.entity.response.WatchdogJobStatusResponse;
import dev.chi.tui.entity.response.WatchdogLogResponse;
import dev.chi.tui.service.WatchdogJobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WatchdogJobControllerTest {

    private WatchdogJobService jobService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        jobService = mock(WatchdogJobService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new WatchdogJobController(jobService), new WatchdogOutputController(jobService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static WatchdogJobStatusResponse statusOf(String jobId, String outcome) {
        WatchdogJobStatusResponse r = new WatchdogJobStatusResponse();
        r.setJobId(jobId);
        r.setMode("PARALLEL");
        r.setStarted(true);
        r.setOutcome(outcome);
        return r;
    }

    @Test
    void testRestartPassesClearFlag() throws Exception {
        when(jobService.restart("web", true)).thenReturn(statusOf("web", "RESTARTED"));

        mockMvc.perform(post("/api/chi/watchdog/jobs/web/restart").param("clear", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.outcome").value("RESTARTED"));
    }

    @Test
    void testIllegalArgumentBecomesErrorResult() throws Exception {
        when(jobService.stop("nope")).thenThrow(new IllegalArgumentException("watchdog job 'nope' is not running; open it first"));

        mockMvc.perform(post("/api/chi/watchdog/jobs/nope/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(500))
                .andExpect(jsonPath("$.message").value("watchdog job 'nope' is not running; open it first"));
    }

    @Test
    void testUnexpectedErrorIsWrapped() throws Exception {
        when(jobService.kill("ext")).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/chi/watchdog/jobs/ext/kill"))
                .andExpect(jsonPath("$.code").value(500))
                .andExpect(jsonPath("$.message").value("kill watchdog failed: boom"));
    }

    @Test
    void testLogsDefaultTail() throws Exception {
        WatchdogCommandLogView v = new WatchdogCommandLogView();
        v.setIndex(0);
        v.setCmdline("echo hi");
        v.setLines(List.of("[start] echo hi", "hi"));
        v.setTotalLines(2);
        WatchdogLogResponse resp = new WatchdogLogResponse();
        resp.setJobId("web");
        resp.setCommands(List.of(v));
        when(jobService.getLogs("web", 200)).thenReturn(resp);

        mockMvc.perform(get("/api/chi/watchdog/jobs/web/logs"))
                .andExpect(jsonPath("$.data.commands[0].lines[1]").value("hi"))
                .andExpect(jsonPath("$.data.commands[0].totalLines").value(2));
    }

    @Test
    void testCreateRequiresJobId() throws Exception {
        mockMvc.perform(post("/api/chi/watchdog/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"commands\":[\"echo hi\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(500));
        verify(jobService, never()).create(any());
    }

    @Test
    void testRemove() throws Exception {
        mockMvc.perform(delete("/api/chi/watchdog/jobs/web"))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data").value("web"));
        verify(jobService).remove("web");
    }
}
