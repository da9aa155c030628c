package com.epinet.controller.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.epinet.service.core.config.EpinetProperties;
import com.epinet.service.core.load.EpinetLoadOrchestrator;
import com.epinet.service.core.load.LoadPlan;
import com.epinet.service.core.load.LoadStatus;
import com.epinet.service.core.load.RefreshOutcome;
import com.epinet.service.core.view.EpinetViewResult;
import com.epinet.service.core.view.HourWindow;
import com.epinet.service.core.view.SankeyDiagram;
import com.epinet.service.core.view.SankeyViewService;
import com.epinet.service.core.view.VisitorQueryService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class EpinetControllerTest {

    @Mock
    private EpinetLoadOrchestrator orchestrator;

    @Mock
    private SankeyViewService sankeyViewService;

    @Mock
    private VisitorQueryService visitorQueryService;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        EpinetController controller =
                new EpinetController(orchestrator, sankeyViewService, visitorQueryService, new EpinetProperties());
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new RestErrorHandler())
                .build();
        when(orchestrator.getLoadStatus("t1")).thenReturn(LoadStatus.idle());
    }

    @Test
    void autoRefreshLetsPlannerDecide() throws Exception {
        when(orchestrator.requestRefresh(eq("t1"), isNull())).thenReturn(RefreshOutcome.STARTED);

        mvc.perform(post("/api/epinets/t1/refresh"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.outcome").value("STARTED"))
                .andExpect(jsonPath("$.status.loading").value(false));
    }

    @Test
    void fullRefreshHonoursHours() throws Exception {
        when(orchestrator.requestRefresh("t1", LoadPlan.fullRange(48))).thenReturn(RefreshOutcome.THROTTLED);

        mvc.perform(post("/api/epinets/t1/refresh").param("mode", "full").param("hours", "48"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("THROTTLED"));

        verify(orchestrator).requestRefresh("t1", LoadPlan.fullRange(48));
    }

    @Test
    void invalidRefreshModeIsBadRequest() throws Exception {
        mvc.perform(post("/api/epinets/t1/refresh").param("mode", "sometimes"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.path").value("/api/epinets/t1/refresh"));
    }

    @Test
    void statusReturnsLoadStatus() throws Exception {
        when(orchestrator.getLoadStatus("t1"))
                .thenReturn(new LoadStatus(true, null, null, LoadStatus.Progress.of(4, 1, "journey")));

        mvc.perform(get("/api/epinets/t1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loading").value(true))
                .andExpect(jsonPath("$.progress.currentFunnelId").value("journey"))
                .andExpect(jsonPath("$.progress.percentComplete").value(25));
    }

    @Test
    void sankeyReturnsDiagram() throws Exception {
        SankeyDiagram diagram = new SankeyDiagram(
                "journey",
                SankeyDiagram.DEFAULT_TITLE,
                List.of(new SankeyDiagram.Node("a", "A"), new SankeyDiagram.Node("b", "B")),
                List.of(new SankeyDiagram.Link(0, 1, 7)));
        when(sankeyViewService.computeSankey("t1", "journey", HourWindow.lastHours(24), null))
                .thenReturn(EpinetViewResult.ready(diagram, LoadStatus.idle()));

        mvc.perform(get("/api/epinets/t1/journey/sankey").param("duration", "daily"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("READY"))
                .andExpect(jsonPath("$.diagram.title").value("User Journey Flow"))
                .andExpect(jsonPath("$.diagram.links[0].value").value(7));
    }

    @Test
    void sankeyWhileLoadingIsAccepted() throws Exception {
        when(sankeyViewService.computeSankey(eq("t1"), eq("journey"), any(HourWindow.class), eq("V1")))
                .thenReturn(EpinetViewResult.loading(LoadStatus.idle()));

        mvc.perform(get("/api/epinets/t1/journey/sankey").param("hours", "6").param("visitorId", "V1"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("LOADING"));
    }

    @Test
    void unknownDurationIsBadRequest() throws Exception {
        mvc.perform(get("/api/epinets/t1/journey/sankey").param("duration", "yearly"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void sankeyHoursBeyondRetentionAreBadRequest() throws Exception {
        mvc.perform(get("/api/epinets/t1/journey/sankey").param("hours", "2147483647"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.message").value("hours must be between 1 and 672"))
                .andExpect(jsonPath("$.path").value("/api/epinets/t1/journey/sankey"));
        mvc.perform(get("/api/epinets/t1/journey/visitors").param("startHour", "5000000").param("endHour", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void visitorsListsIds() throws Exception {
        when(visitorQueryService.visitorIds("t1", "journey", HourWindow.offsets(48, 0)))
                .thenReturn(List.of("V1", "V2"));

        mvc.perform(get("/api/epinets/t1/journey/visitors").param("startHour", "48").param("endHour", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.visitorIds[1]").value("V2"));
    }
}
