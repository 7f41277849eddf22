package dao.da.node.model;

import java.util.List;

public record ValidatedBatch(
        BatchHeader header,
        byte[] batchHeaderHash,
        List<ValidatedBlob> blobs
) {
    public ValidatedBatch {
        blobs = List.copyOf(blobs);
    }

    public List<BlobHeader> blobHeaders() {
        return blobs.stream().map(ValidatedBlob::header).toList();
    }

    public List<ValidatedBlob> custodied() {
        return blobs.stream().filter(ValidatedBlob::custodied).toList();
    }
}
