package com.epinet.service.core.view;

import static com.epinet.service.core.aggregation.HourlyEpinetDataFixtures.hour;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.epinet.service.core.config.EpinetProperties;
import com.epinet.service.core.load.EpinetLoadOrchestrator;
import com.epinet.service.core.load.LoadStatus;
import com.epinet.service.core.load.RefreshOutcome;
import com.epinet.service.core.store.InMemoryEpinetStore;
import com.epinet.service.core.time.HourBucketer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class SankeyViewServiceTest {

    private static final String BELIEF = "belief-Yes-none";
    private static final String CLICK_P1 = "commitmentAction-Pane-CLICKED-P1";
    private static final String CLICK_P2 = "commitmentAction-Pane-CLICKED-P2";

    @Mock
    private EpinetLoadOrchestrator orchestrator;

    private InMemoryEpinetStore store;
    private EpinetProperties properties;
    private SankeyViewService service;
    private final LoadStatus idle = LoadStatus.idle();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        store = new InMemoryEpinetStore();
        properties = new EpinetProperties();
        HourBucketer bucketer =
                new HourBucketer(Clock.fixed(Instant.parse("2024-01-01T10:35:00Z"), ZoneOffset.UTC));
        service = new SankeyViewService(store, orchestrator, bucketer, properties);
        when(orchestrator.getLoadStatus("t1")).thenReturn(idle);
    }

    private void seedTwoHours() {
        store.put(
                "t1",
                "journey",
                "2024-01-01-10",
                hour().node(BELIEF, "Believes: Yes", 1, "V1", "V2")
                        .node(CLICK_P1, "CLICKED: Pricing", 2, "V1")
                        .inferred());
        store.put(
                "t1",
                "journey",
                "2024-01-01-09",
                hour().node(BELIEF, "Believes: Yes", 1, "V3")
                        .node(CLICK_P2, "CLICKED: Unknown Content", 2, "V3")
                        .inferred());
    }

    @Test
    void emptyStoreTriggersLoadAndReportsLoading() {
        when(orchestrator.requestRefresh("t1")).thenReturn(RefreshOutcome.STARTED);

        EpinetViewResult result = service.computeSankey("t1", "journey", EpinetDuration.WEEKLY.toWindow());

        assertThat(result.status()).isEqualTo(EpinetViewResult.Status.LOADING);
        assertThat(result.diagram()).isNull();
        assertThat(result.loadStatus()).isSameAs(idle);
        verify(orchestrator).requestRefresh("t1");
    }

    @Test
    void unknownFunnelIsNotFoundWhenNoRunStarts() {
        seedTwoHours();
        when(orchestrator.requestRefresh("t1")).thenReturn(RefreshOutcome.THROTTLED);

        EpinetViewResult result = service.computeSankey("t1", "other", HourWindow.lastHours(24));

        assertThat(result.status()).isEqualTo(EpinetViewResult.Status.NOT_FOUND);
    }

    @Test
    void unionsVisitorsAcrossWindowAndOrdersNodesByCount() {
        seedTwoHours();

        EpinetViewResult result = service.computeSankey("t1", "journey", HourWindow.lastHours(2));

        assertThat(result.status()).isEqualTo(EpinetViewResult.Status.READY);
        SankeyDiagram diagram = result.diagram();
        assertThat(diagram.id()).isEqualTo("journey");
        assertThat(diagram.title()).isEqualTo("User Journey Flow");
        assertThat(diagram.nodes())
                .containsExactly(
                        new SankeyDiagram.Node(BELIEF, "Believes: Yes"),
                        new SankeyDiagram.Node(CLICK_P1, "CLICKED: Pricing"),
                        new SankeyDiagram.Node(CLICK_P2, "CLICKED: Unknown Content"));
        assertThat(diagram.links()).containsExactly(new SankeyDiagram.Link(0, 1, 1), new SankeyDiagram.Link(0, 2, 1));
        verify(orchestrator, never()).requestRefresh("t1");
    }

    @Test
    void windowLimitsHours() {
        seedTwoHours();

        SankeyDiagram diagram =
                service.computeSankey("t1", "journey", HourWindow.lastHours(1)).diagram();

        assertThat(diagram.nodes()).extracting(SankeyDiagram.Node::id).containsExactly(BELIEF, CLICK_P1);
        assertThat(diagram.links()).containsExactly(new SankeyDiagram.Link(0, 1, 1));
    }

    @Test
    void nodesAreCappedAndLinksFollowRetainedNodes() {
        seedTwoHours();
        properties.getView().setMaxSankeyNodes(2);

        SankeyDiagram diagram =
                service.computeSankey("t1", "journey", HourWindow.lastHours(2)).diagram();

        assertThat(diagram.nodes()).extracting(SankeyDiagram.Node::id).containsExactly(BELIEF, CLICK_P1);
        assertThat(diagram.links()).containsExactly(new SankeyDiagram.Link(0, 1, 1));
    }

    @Test
    void visitorFilterRestrictsNodesAndLinks() {
        seedTwoHours();

        SankeyDiagram diagram = service.computeSankey("t1", "journey", HourWindow.lastHours(2), "V3")
                .diagram();

        assertThat(diagram.nodes()).extracting(SankeyDiagram.Node::id).containsExactly(BELIEF, CLICK_P2);
        assertThat(diagram.links()).containsExactly(new SankeyDiagram.Link(0, 1, 1));
    }

    @Test
    void readsWhileLoadingCarryTheLoadingFlag() {
        seedTwoHours();
        LoadStatus loading = new LoadStatus(true, Instant.parse("2024-01-01T10:30:00Z"), null,
                LoadStatus.Progress.of(4, 1, "journey"));
        when(orchestrator.getLoadStatus("t1")).thenReturn(loading);

        EpinetViewResult result = service.computeSankey("t1", "journey", HourWindow.lastHours(2));

        assertThat(result.status()).isEqualTo(EpinetViewResult.Status.READY);
        assertThat(result.loadStatus().loading()).isTrue();
        assertThat(result.loadStatus().progress().percentComplete()).isEqualTo(25);
    }

    @Test
    void windowIsRequired() {
        assertThatThrownBy(() -> service.computeSankey("t1", "journey", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
