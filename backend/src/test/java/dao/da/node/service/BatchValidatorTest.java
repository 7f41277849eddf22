package dao.da.node.service;

import dao.da.node.BatchFixtures;
import dao.da.node.config.DispersalProperties;
import dao.da.node.exception.AssignmentException;
import dao.da.node.exception.ValidationException;
import dao.da.node.model.AssignmentPolicy;
import dao.da.node.model.AssignmentSnapshot;
import dao.da.node.model.BatchHeader;
import dao.da.node.model.Blob;
import dao.da.node.model.BlobHeader;
import dao.da.node.model.OperatorAssignment;
import dao.da.node.model.Bundle;
import dao.da.node.model.ValidatedBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static dao.da.node.BatchFixtures.assignedBlob;
import static dao.da.node.BatchFixtures.unassignedBlob;
import static org.junit.jupiter.api.Assertions.*;

class BatchValidatorTest {

    private static final long CURRENT = 500;
    private static final byte[] HASH = new byte[32];

    private DispersalProperties props;
    private BatchValidator validator;
    private AssignmentSnapshot snapshot;

    @BeforeEach
    void setUp() {
        props = new DispersalProperties();
        validator = new BatchValidator(new AssignmentResolver(), props);
        snapshot = BatchFixtures.snapshot(1);
    }

    @Test
    void acceptsWellFormedBatch() {
        ValidatedBatch batch = validate(CURRENT, List.of(assignedBlob(1), assignedBlob(2)));

        assertEquals(2, batch.blobs().size());
        assertEquals(2, batch.custodied().size());
        assertEquals(2, batch.blobs().get(0).assignments().get(0).numChunks());
    }

    @Test
    void emptyBatchRejected() {
        assertThrows(ValidationException.class, () -> validate(CURRENT, List.of()));
    }

    @Test
    @DisplayName("Reference block must be within the drift window of the chain view")
    void referenceBlockDrift() {
        assertDoesNotThrow(() -> validate(CURRENT + props.getMaxReferenceBlockLead(), List.of(assignedBlob(1))));
        assertThrows(ValidationException.class,
                () -> validate(CURRENT + props.getMaxReferenceBlockLead() + 1, List.of(assignedBlob(1))));
        assertThrows(ValidationException.class,
                () -> validate(CURRENT - props.getMaxReferenceBlockAge() - 1, List.of(assignedBlob(1))));
    }

    @Test
    @DisplayName("No assignment in force at the reference block is an assignment failure")
    void noOperatorAssignment() {
        snapshot = new AssignmentSnapshot(2, List.of(
                new OperatorAssignment(CURRENT + 1, Map.of())));

        assertThrows(AssignmentException.class, () -> validate(CURRENT, List.of(assignedBlob(1))));
    }

    @Test
    void malformedHeadersRejected() {
        assertShapeRejected(h -> h.setCommitment(new byte[63]));
        assertShapeRejected(h -> h.setLengthProof(new byte[127]));
        assertShapeRejected(h -> h.setLength(0));
        assertShapeRejected(h -> h.getQuorumHeaders().get(0).setQuorumId(256));
        assertShapeRejected(h -> h.getQuorumHeaders().get(0).setAdversaryThreshold(100));
        assertShapeRejected(h -> h.getQuorumHeaders().get(0).setQuorumThreshold(101));
        assertShapeRejected(h -> h.getQuorumHeaders().get(0).setQuantizationFactor(0));
        assertShapeRejected(h -> h.getQuorumHeaders().get(0).setEncodedBlobLength(0));
        assertShapeRejected(h -> h.getQuorumHeaders().get(0).setRatelimit(-1));
    }

    @Test
    void duplicateQuorumRejected() {
        BlobHeader header = BatchFixtures.blobHeader(1, 0, 0);
        Blob blob = new Blob(header, new ArrayList<>(List.of(BatchFixtures.bundle(1, 2), BatchFixtures.bundle(1, 2))));

        assertThrows(ValidationException.class, () -> validate(CURRENT, List.of(blob)));
    }

    @Test
    void bundleCountMustMatchQuorums() {
        Blob blob = new Blob(BatchFixtures.blobHeader(1, 0, 1), new ArrayList<>(List.of(BatchFixtures.bundle(1, 2))));

        assertThrows(ValidationException.class, () -> validate(CURRENT, List.of(blob)));
    }

    @Test
    void unequalChunksRejected() {
        Bundle bundle = BatchFixtures.bundle(1, 2);
        bundle.getChunks().set(1, new byte[BatchFixtures.CHUNK_BYTES + 1]);
        Blob blob = new Blob(BatchFixtures.blobHeader(1, 0), new ArrayList<>(List.of(bundle)));

        assertThrows(ValidationException.class, () -> validate(CURRENT, List.of(blob)));
    }

    @Test
    @DisplayName("Assigned quorum without chunks is malformed")
    void missingChunksForAssignedQuorum() {
        Blob blob = new Blob(BatchFixtures.blobHeader(1, 0), new ArrayList<>(List.of(BatchFixtures.emptyBundle())));

        assertThrows(ValidationException.class, () -> validate(CURRENT, List.of(blob)));
    }

    @Test
    @DisplayName("Chunks for a quorum this node does not serve are an assignment failure")
    void chunksForUnassignedQuorum() {
        Blob blob = new Blob(BatchFixtures.blobHeader(1, 1), new ArrayList<>(List.of(BatchFixtures.bundle(1, 2))));

        assertThrows(AssignmentException.class, () -> validate(CURRENT, List.of(assignedBlob(2), blob)));
    }

    @Test
    void unassignedBlobPolicy() {
        List<Blob> blobs = List.of(assignedBlob(1), unassignedBlob(2));

        assertThrows(AssignmentException.class, () -> validate(CURRENT, blobs));

        props.setAssignmentPolicy(AssignmentPolicy.SKIP_BLOB);
        ValidatedBatch batch = validate(CURRENT, blobs);
        assertEquals(2, batch.blobs().size());
        assertEquals(1, batch.custodied().size());
        assertFalse(batch.blobs().get(1).custodied());
    }

    private void assertShapeRejected(Consumer<BlobHeader> mutation) {
        Blob blob = assignedBlob(1);
        mutation.accept(blob.getHeader());
        assertThrows(ValidationException.class, () -> validate(CURRENT, List.of(blob)));
    }

    private ValidatedBatch validate(long ref, List<Blob> blobs) {
        return validator.validate(new BatchHeader(new byte[32], ref), HASH, blobs, snapshot, CURRENT);
    }
}
