package com.epinet.controller.rest;

import com.epinet.service.core.config.EpinetProperties;
import com.epinet.service.core.load.EpinetLoadOrchestrator;
import com.epinet.service.core.load.LoadPlan;
import com.epinet.service.core.load.LoadStatus;
import com.epinet.service.core.load.RefreshOutcome;
import com.epinet.service.core.view.EpinetViewResult;
import com.epinet.service.core.view.HourWindow;
import com.epinet.service.core.view.SankeyViewService;
import com.epinet.service.core.view.VisitorQueryService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(EpinetController.PATH)
@Slf4j
public class EpinetController {

    public static final String PATH = "/api/epinets";

    private final EpinetLoadOrchestrator orchestrator;
    private final SankeyViewService sankeyViewService;
    private final VisitorQueryService visitorQueryService;
    private final EpinetProperties properties;

    public EpinetController(
            EpinetLoadOrchestrator orchestrator,
            SankeyViewService sankeyViewService,
            VisitorQueryService visitorQueryService,
            EpinetProperties properties) {
        this.orchestrator = orchestrator;
        this.sankeyViewService = sankeyViewService;
        this.visitorQueryService = visitorQueryService;
        this.properties = properties;
    }

    @PostMapping(value = "/{tenantId}/refresh", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> refresh(
            @PathVariable("tenantId") String tenantId,
            @RequestParam(value = "mode", required = false, defaultValue = "auto") String mode,
            @RequestParam(value = "hours", required = false) Integer hours) {
        LoadPlan plan = resolvePlan(mode, hours);
        RefreshOutcome outcome = orchestrator.requestRefresh(tenantId, plan);
        log.info("POST epinet refresh tenant={} mode={} outcome={}", tenantId, mode, outcome);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tenantId", tenantId);
        out.put("outcome", outcome);
        out.put("status", orchestrator.getLoadStatus(tenantId));
        HttpStatus status = outcome == RefreshOutcome.STARTED ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(out);
    }

    @GetMapping(value = "/{tenantId}/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public LoadStatus status(@PathVariable("tenantId") String tenantId) {
        return orchestrator.getLoadStatus(tenantId);
    }

    @GetMapping(value = "/{tenantId}/{funnelId}/sankey", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EpinetViewResult> sankey(
            @PathVariable("tenantId") String tenantId,
            @PathVariable("funnelId") String funnelId,
            @RequestParam(value = "duration", required = false) String duration,
            @RequestParam(value = "hours", required = false) Integer hours,
            @RequestParam(value = "startHour", required = false) Integer startHour,
            @RequestParam(value = "endHour", required = false) Integer endHour,
            @RequestParam(value = "visitorId", required = false) String visitorId) {
        HourWindow window = HourWindowResolver.resolve(duration, hours, startHour, endHour, maxHours());
        String visitor = visitorId == null || visitorId.isBlank() ? null : visitorId;
        EpinetViewResult result = sankeyViewService.computeSankey(tenantId, funnelId, window, visitor);
        HttpStatus status =
                switch (result.status()) {
                    case READY -> HttpStatus.OK;
                    case LOADING -> HttpStatus.ACCEPTED;
                    case NOT_FOUND -> HttpStatus.NOT_FOUND;
                };
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping(value = "/{tenantId}/{funnelId}/visitors", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> visitors(
            @PathVariable("tenantId") String tenantId,
            @PathVariable("funnelId") String funnelId,
            @RequestParam(value = "duration", required = false) String duration,
            @RequestParam(value = "hours", required = false) Integer hours,
            @RequestParam(value = "startHour", required = false) Integer startHour,
            @RequestParam(value = "endHour", required = false) Integer endHour) {
        HourWindow window = HourWindowResolver.resolveOptional(duration, hours, startHour, endHour, maxHours());
        List<String> visitorIds = visitorQueryService.visitorIds(tenantId, funnelId, window);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("funnelId", funnelId);
        out.put("count", visitorIds.size());
        out.put("visitorIds", visitorIds);
        return out;
    }

    private LoadPlan resolvePlan(String mode, Integer hours) {
        String normalized = mode == null ? "auto" : mode.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "auto" -> null;
            case "current-hour" -> LoadPlan.currentHour();
            case "full" -> {
                int max = maxHours();
                int requested = hours == null ? max : hours;
                if (requested < 1 || requested > max) {
                    throw new IllegalArgumentException("hours must be between 1 and " + max);
                }
                yield LoadPlan.fullRange(requested);
            }
            default -> throw new IllegalArgumentException(
                    "Unknown refresh mode '" + mode + "' (expected auto, current-hour or full)");
        };
    }

    private int maxHours() {
        return properties.getLoad().getMaxAnalyticsHours();
    }
}
