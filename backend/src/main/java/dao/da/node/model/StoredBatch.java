package dao.da.node.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoredBatch {

    private String batchHeaderHash; // 0x-hex
    private byte[] batchRoot;
    private long referenceBlockNumber;
    private int blobCount;
    private int bundleCount;
    private long storedAt; // unix seconds
}
