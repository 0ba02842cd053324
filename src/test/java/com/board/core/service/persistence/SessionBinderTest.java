package com.board.core.service.persistence;

import com.board.core.service.config.BoardConfig;
import com.board.core.service.config.MetricsConfig;
import com.board.core.service.document.DocumentLifecycle;
import com.board.core.service.document.InMemoryBoardDocument;
import com.board.core.service.document.SharedArray;
import com.board.core.service.document.SharedMap;
import com.board.core.service.graph.CypherStatements;
import com.board.core.service.graph.GraphClient;
import com.board.core.service.graph.GraphConnectivityException;
import com.board.core.service.graph.GraphQueryException;
import com.board.core.service.graph.GraphSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionBinderTest {

    private static final String BOARD_ID = "board-1";

    @Mock
    private GraphClient graphClient;

    @Mock
    private GraphSession session;

    private MetricsConfig metricsConfig;
    private SessionBinder binder;
    private InMemoryBoardDocument document;

    @BeforeEach
    void setUp() {
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        binder = new SessionBinder(graphClient, new PropertySanitizer(new ObjectMapper()),
                new BoardConfig(), metricsConfig);
        document = new InMemoryBoardDocument(BOARD_ID);
    }

    @Test
    @DisplayName("An unknown board is created with the default type and the document stays empty")
    void createsNewBoard() {
        when(graphClient.openSession()).thenReturn(session);

        binder.bind(BOARD_ID, document);

        verify(session).run(eq(CypherStatements.CREATE_BOARD),
                argThat(params -> BOARD_ID.equals(params.get("id")) && "Eventstorming".equals(params.get("type"))));
        verify(session, never()).run(eq(CypherStatements.BOARD_ITEMS), anyMap());
        verify(session).close();
        assertThat(document.getItems().length()).isZero();
        assertThat(document.getConnections().length()).isZero();
        assertThat(document.getLifecycle()).isEqualTo(DocumentLifecycle.LOADED);
    }

    @Test
    @DisplayName("Items, connections and derived fields are reconstructed from the graph")
    void reconstructsBoard() {
        when(graphClient.openSession()).thenReturn(session);
        stubExistingBoard();

        binder.bind(BOARD_ID, document);

        var snapshot = document.snapshot();
        assertThat(snapshot.boardType()).isEqualTo("Eventstorming");
        assertThat(snapshot.items()).hasSize(2);

        var command = snapshot.items().get(0);
        assertThat(command)
                .containsEntry("id", "cmd-1")
                .containsEntry("type", "Command")
                .containsEntry("tags", List.of("ordering", "core"))
                .containsEntry("position", Map.of("x", 10, "y", 20))
                .containsEntry("note", "[draft]")
                .containsEntry("producesEventId", "sticky-1")
                .doesNotContainKey("boardId");

        var sticky = snapshot.items().get(1);
        assertThat(sticky)
                .containsEntry("type", "Sticky Note")
                .containsEntry("parent", "cmd-1");

        assertThat(snapshot.connections()).containsExactly(Map.of(
                "id", "conn-1",
                "weight", 2L,
                "from", "cmd-1",
                "to", "sticky-1",
                "type", "FLOWS_TO"
        ));
        assertThat(metricsConfig.getBindsCompleted().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Nested values become nested document containers")
    void buildsNestedContainers() {
        when(graphClient.openSession()).thenReturn(session);
        stubExistingBoard();

        binder.bind(BOARD_ID, document);

        var command = (SharedMap) document.getItems().get(0);
        assertThat(command.get("position")).isInstanceOf(SharedMap.class);
        assertThat(command.get("tags")).isInstanceOf(SharedArray.class);
    }

    @Test
    @DisplayName("A document that already has content is never overwritten")
    void keepsPopulatedDocument() {
        when(graphClient.openSession()).thenReturn(session);
        stubExistingBoard();
        document.transact(() -> {
            var item = document.createMap();
            item.set("id", "local-1");
            document.getItems().push(item);
        });

        binder.bind(BOARD_ID, document);

        assertThat(document.snapshot().items())
                .containsExactly(Map.of("id", "local-1"));
        assertThat(document.getLifecycle()).isEqualTo(DocumentLifecycle.DIVERGED);
    }

    @Test
    @DisplayName("A failed query is logged and leaves the document untouched")
    void swallowsQueryFailure() {
        when(graphClient.openSession()).thenReturn(session);
        when(session.run(eq(CypherStatements.FIND_BOARD), anyMap()))
                .thenReturn(List.of(row("board", Map.of("id", BOARD_ID))));
        when(session.run(eq(CypherStatements.BOARD_ITEMS), anyMap()))
                .thenThrow(new GraphQueryException("Graph store rejected statement", null));

        binder.bind(BOARD_ID, document);

        verify(session).close();
        assertThat(document.getLifecycle()).isEqualTo(DocumentLifecycle.UNINITIALIZED);
        assertThat(document.getItems().length()).isZero();
        assertThat(metricsConfig.getBindFailures().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("An unreachable store is logged, not thrown")
    void swallowsConnectivityFailure() {
        when(graphClient.openSession()).thenThrow(new GraphConnectivityException("unavailable", null));

        binder.bind(BOARD_ID, document);

        assertThat(document.getLifecycle()).isEqualTo(DocumentLifecycle.UNINITIALIZED);
        assertThat(metricsConfig.getBindFailures().count()).isEqualTo(1.0);
    }

    // ==================== Fixtures ====================

    private void stubExistingBoard() {
        when(session.run(eq(CypherStatements.FIND_BOARD), anyMap()))
                .thenReturn(List.of(row("board", Map.of("id", BOARD_ID, "name", BOARD_ID))));
        when(session.run(eq(CypherStatements.BOARD_ITEMS), anyMap())).thenReturn(List.of(
                row("props", Map.of(
                                "id", "cmd-1",
                                "boardId", BOARD_ID,
                                "type", "Command",
                                "tags", List.of("ordering", "core"),
                                "position", "{\"x\":10,\"y\":20}",
                                "note", "[draft]"),
                        "labels", List.of("Command")),
                row("props", Map.of("id", "sticky-1", "boardId", BOARD_ID, "type", "Sticky Note"),
                        "labels", List.of("Unknown"))
        ));
        when(session.run(eq(CypherStatements.BOARD_CONNECTIONS), anyMap())).thenReturn(List.of(
                row("props", Map.of("id", "conn-1", "weight", 2L),
                        "from", "cmd-1", "to", "sticky-1", "type", "FLOWS_TO"),
                row("props", Map.of(),
                        "from", "cmd-1", "to", "sticky-1", "type", "TRIGGERS")
        ));
        when(session.run(eq(CypherStatements.BOARD_ITEM_PARENTS), anyMap()))
                .thenReturn(List.of(row("childId", "sticky-1", "parentId", "cmd-1")));
    }

    private static Map<String, Object> row(Object... keysAndValues) {
        var row = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            row.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return row;
    }
}
