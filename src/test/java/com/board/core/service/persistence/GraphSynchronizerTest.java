package com.board.core.service.persistence;

import com.board.core.service.config.BoardConfig;
import com.board.core.service.config.MetricsConfig;
import com.board.core.service.document.DocumentSnapshot;
import com.board.core.service.graph.CypherStatements;
import com.board.core.service.graph.GraphClient;
import com.board.core.service.graph.GraphQueryException;
import com.board.core.service.graph.GraphSession;
import com.board.core.service.graph.GraphTransaction;
import com.board.core.service.graph.NodeLabel;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GraphSynchronizerTest {

    private static final String BOARD_ID = "board-1";

    @Mock
    private GraphClient graphClient;

    @Mock
    private GraphSession session;

    @Mock
    private GraphTransaction transaction;

    private BoardConfig boardConfig;
    private MetricsConfig metricsConfig;
    private GraphSynchronizer synchronizer;

    @BeforeEach
    void setUp() {
        boardConfig = new BoardConfig();
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        synchronizer = new GraphSynchronizer(graphClient, new PropertySanitizer(new ObjectMapper()),
                boardConfig, metricsConfig);
        when(graphClient.openSession()).thenReturn(session);
    }

    @Test
    @DisplayName("A write cycle runs all steps in order inside one transaction")
    void writesCycleInTransaction() {
        when(session.beginTransaction()).thenReturn(transaction);
        var snapshot = new DocumentSnapshot(
                List.of(Map.of("id", "cmd-1", "type", "Command", "instanceName", "Place Order")),
                List.of(Map.of("id", "conn-1", "from", "cmd-1", "to", "evt-1", "type", "triggers event")),
                "Eventstorming");

        synchronizer.write(BOARD_ID, snapshot);

        InOrder order = inOrder(transaction, session);
        order.verify(transaction).run(eq(CypherStatements.UPSERT_BOARD),
                argThat(params -> "Eventstorming".equals(params.get("type"))));
        order.verify(transaction).run(eq(CypherStatements.BOARD_ITEM_IDS), anyMap());
        order.verify(transaction).run(eq(CypherStatements.mergeItem(NodeLabel.COMMAND)),
                argThat(params -> "cmd-1".equals(params.get("id")) && BOARD_ID.equals(params.get("boardId"))));
        order.verify(transaction).run(eq(CypherStatements.BOARD_CONNECTION_IDS), anyMap());
        order.verify(transaction).run(eq(CypherStatements.mergeConnection("TRIGGERS_EVENT")),
                argThat(params -> "conn-1".equals(params.get("id")) && "evt-1".equals(params.get("to"))));
        order.verify(transaction).commit();
        order.verify(transaction).close();
        order.verify(session).close();
        assertThat(metricsConfig.getWritesCompleted().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Items and connections missing from the snapshot are deleted")
    void deletesStaleRecords() {
        when(session.beginTransaction()).thenReturn(transaction);
        when(transaction.run(eq(CypherStatements.BOARD_ITEM_IDS), anyMap()))
                .thenReturn(List.of(Map.of("id", "cmd-1"), Map.of("id", "gone-1")));
        when(transaction.run(eq(CypherStatements.BOARD_CONNECTION_IDS), anyMap()))
                .thenReturn(List.of(Map.of("id", "conn-gone"), new HashMap<>()));
        var snapshot = new DocumentSnapshot(
                List.of(Map.of("id", "cmd-1", "type", "Command")), List.of(), "Eventstorming");

        synchronizer.write(BOARD_ID, snapshot);

        verify(transaction).run(eq(CypherStatements.DELETE_BOARD_ITEMS),
                argThat(params -> List.of("gone-1").equals(params.get("ids"))));
        verify(transaction).run(eq(CypherStatements.DELETE_BOARD_CONNECTIONS),
                argThat(params -> List.of("conn-gone").equals(params.get("ids"))));
        assertThat(metricsConfig.getItemsDeleted().count()).isEqualTo(1.0);
        assertThat(metricsConfig.getConnectionsDeleted().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Structural fields become edges instead of node properties")
    void projectsStructuralFields() {
        when(session.beginTransaction()).thenReturn(transaction);
        var item = Map.<String, Object>of(
                "id", "cmd-1",
                "type", "Command",
                "parent", "ctx-1",
                "producesEventId", "evt-1",
                "children", List.of("a"),
                "attributes", List.of(Map.of("name", "orderId")));

        synchronizer.write(BOARD_ID, new DocumentSnapshot(List.of(item), List.of(), "Eventstorming"));

        verify(transaction).run(eq(CypherStatements.mergeItem(NodeLabel.COMMAND)), argThat(params -> {
            var props = (Map<?, ?>) params.get("props");
            return !props.containsKey("parent") && !props.containsKey("producesEventId")
                    && !props.containsKey("children")
                    && "[{\"name\":\"orderId\"}]".equals(props.get("attributes"));
        }));
        verify(transaction).run(eq(CypherStatements.MERGE_PARENT),
                argThat(params -> "ctx-1".equals(params.get("parentId"))));
        verify(transaction).run(eq(CypherStatements.MERGE_TRIGGERS),
                argThat(params -> "evt-1".equals(params.get("targetId"))));
    }

    @Test
    @DisplayName("Stale derived edges are pruned when the field is cleared")
    void prunesClearedStructuralFields() {
        when(session.beginTransaction()).thenReturn(transaction);

        synchronizer.write(BOARD_ID, new DocumentSnapshot(
                List.of(Map.of("id", "cmd-1", "type", "Command")), List.of(), "Eventstorming"));

        verify(transaction).run(eq(CypherStatements.PRUNE_PARENTS),
                argThat(params -> params.containsKey("parentId") && params.get("parentId") == null));
        verify(transaction).run(eq(CypherStatements.PRUNE_TRIGGERS),
                argThat(params -> params.get("targetId") == null));
        verify(transaction, never()).run(eq(CypherStatements.MERGE_PARENT), anyMap());
        verify(transaction, never()).run(eq(CypherStatements.MERGE_TRIGGERS), anyMap());
    }

    @Test
    @DisplayName("Duplicate ids collapse to the last record; records without id are skipped")
    void deduplicatesById() {
        when(session.beginTransaction()).thenReturn(transaction);
        when(transaction.run(eq(CypherStatements.BOARD_ITEM_IDS), anyMap()))
                .thenReturn(List.of(Map.of("id", 7L)));
        var snapshot = new DocumentSnapshot(
                List.of(
                        Map.of("id", 7, "type", "Event", "name", "first"),
                        Map.of("id", 7, "type", "Event", "name", "second"),
                        Map.of("type", "Event", "name", "orphan")),
                List.of(
                        Map.of("id", "conn-1", "from", "a"),
                        Map.of("from", "a", "to", "b")),
                "Eventstorming");

        synchronizer.write(BOARD_ID, snapshot);

        verify(transaction, times(1)).run(eq(CypherStatements.mergeItem(NodeLabel.EVENT)), anyMap());
        verify(transaction).run(eq(CypherStatements.mergeItem(NodeLabel.EVENT)),
                argThat(params -> "second".equals(((Map<?, ?>) params.get("props")).get("name"))));
        verify(transaction, never()).run(eq(CypherStatements.DELETE_BOARD_ITEMS), anyMap());
        verify(transaction, never()).run(eq(CypherStatements.mergeConnection("RELATED_TO")), anyMap());
    }

    @Test
    @DisplayName("Unknown item types and blank board types fall back to defaults")
    void appliesDefaults() {
        when(session.beginTransaction()).thenReturn(transaction);

        synchronizer.write(BOARD_ID, new DocumentSnapshot(
                List.of(Map.of("id", "n-1", "type", "Sticky Note")),
                List.of(Map.of("id", "conn-1", "from", "n-1", "to", "n-2")),
                " "));

        verify(transaction).run(eq(CypherStatements.UPSERT_BOARD),
                argThat(params -> "Eventstorming".equals(params.get("type"))));
        verify(transaction).run(eq(CypherStatements.mergeItem(NodeLabel.UNKNOWN)),
                argThat(params -> "Sticky Note".equals(((Map<?, ?>) params.get("props")).get("type"))));
        verify(transaction).run(eq(CypherStatements.mergeConnection("RELATED_TO")), anyMap());
    }

    @Test
    @DisplayName("A failing step aborts the cycle and rolls back the transaction")
    void abortsOnFailure() {
        when(session.beginTransaction()).thenReturn(transaction);
        when(transaction.run(eq(CypherStatements.BOARD_ITEM_IDS), anyMap()))
                .thenThrow(new GraphQueryException("Graph store rejected statement", null));

        synchronizer.write(BOARD_ID, new DocumentSnapshot(
                List.of(Map.of("id", "cmd-1", "type", "Command")), List.of(), "Eventstorming"));

        verify(transaction, never()).run(eq(CypherStatements.mergeItem(NodeLabel.COMMAND)), anyMap());
        verify(transaction, never()).commit();
        verify(transaction).close();
        verify(session).close();
        assertThat(metricsConfig.getWriteFailures().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("The failing variant rethrows the store error after counting it")
    void writeOrFailPropagatesFailure() {
        when(session.beginTransaction()).thenReturn(transaction);
        when(transaction.run(eq(CypherStatements.UPSERT_BOARD), anyMap()))
                .thenThrow(new GraphQueryException("Graph store rejected statement", null));
        var snapshot = new DocumentSnapshot(List.of(Map.of("id", "cmd-1", "type", "Command")), List.of(), "Eventstorming");

        assertThatThrownBy(() -> synchronizer.writeOrFail(BOARD_ID, snapshot))
                .isInstanceOf(GraphQueryException.class);

        verify(transaction, never()).commit();
        assertThat(metricsConfig.getWriteFailures().count()).isEqualTo(1.0);
        assertThat(metricsConfig.getWritesCompleted().count()).isZero();
    }

    @Test
    @DisplayName("With transactional writes disabled every statement auto-commits")
    void writesWithoutTransaction() {
        boardConfig.getFeatures().setTransactionalWrites(false);

        synchronizer.write(BOARD_ID, new DocumentSnapshot(
                List.of(Map.of("id", "cmd-1", "type", "Command")), List.of(), "Eventstorming"));

        verify(session, never()).beginTransaction();
        verify(session).run(eq(CypherStatements.UPSERT_BOARD), anyMap());
        verify(session).run(eq(CypherStatements.mergeItem(NodeLabel.COMMAND)), anyMap());
        verify(session).close();
    }
}
