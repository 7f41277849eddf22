package dao.da.node.service;

import dao.da.node.BatchFixtures;
import dao.da.node.config.AssignmentProperties;
import dao.da.node.model.AssignmentSnapshot;
import dao.da.node.model.ChunkAssignment;
import dao.da.node.model.OperatorAssignment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentSnapshotHolderTest {

    @Test
    @DisplayName("Only strictly newer snapshots replace the current one")
    void refreshIgnoresStaleVersions() {
        AssignmentSnapshotHolder holder = new AssignmentSnapshotHolder(() -> BatchFixtures.snapshot(5));
        assertEquals(5, holder.current().getVersion());

        assertFalse(holder.refresh(BatchFixtures.snapshot(5)));
        assertFalse(holder.refresh(BatchFixtures.snapshot(4)));
        assertTrue(holder.refresh(BatchFixtures.snapshot(6)));
        assertEquals(6, holder.current().getVersion());
    }

    @Test
    @DisplayName("A call keeps the snapshot it captured across a refresh")
    void capturedSnapshotIsStable() {
        AssignmentSnapshotHolder holder = new AssignmentSnapshotHolder(() -> BatchFixtures.snapshot(1));
        AssignmentSnapshot captured = holder.current();

        holder.refresh(new AssignmentSnapshot(2, List.of()));

        assertTrue(captured.assignmentAt(100).isPresent());
        assertTrue(holder.current().assignmentAt(100).isEmpty());
    }

    @Test
    @DisplayName("Assignment in force is the latest entry at or before the block")
    void assignmentAtUsesFloorEntry() {
        AssignmentSnapshot snapshot = new AssignmentSnapshot(1, List.of(
                new OperatorAssignment(100, Map.of(0, new ChunkAssignment(0, 0, 1, 8))),
                new OperatorAssignment(200, Map.of(0, new ChunkAssignment(0, 4, 0, 8)))));
        AssignmentResolver resolver = new AssignmentResolver();

        assertTrue(resolver.resolve(snapshot, 99).isEmpty());
        assertEquals(100, resolver.resolve(snapshot, 199).orElseThrow().effectiveBlock());
        assertTrue(resolver.resolve(snapshot, 150, 0).isPresent());
        assertFalse(resolver.resolve(snapshot, 150, 1).isPresent());
        // zero chunks at 200 means no longer responsible
        assertFalse(resolver.resolve(snapshot, 250, 0).isPresent());
    }

    @Test
    void configuredSourceBuildsSnapshot() {
        AssignmentProperties props = new AssignmentProperties();
        props.setVersion(3);
        AssignmentProperties.Entry entry = new AssignmentProperties.Entry();
        entry.setEffectiveBlock(10);
        AssignmentProperties.Quorum quorum = new AssignmentProperties.Quorum();
        quorum.setQuorumId(1);
        quorum.setStartIndex(2);
        quorum.setNumChunks(3);
        quorum.setTotalChunks(16);
        entry.getQuorums().add(quorum);
        props.getEntries().add(entry);

        AssignmentSnapshot snapshot = new ConfiguredAssignmentSource(props).fetch();

        assertEquals(3, snapshot.getVersion());
        assertEquals(new ChunkAssignment(1, 2, 3, 16),
                snapshot.assignmentAt(10).orElseThrow().forQuorum(1).orElseThrow());
    }
}
