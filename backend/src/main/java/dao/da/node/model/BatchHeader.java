package dao.da.node.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchHeader {

    /** Merkle root over blob header hashes, 32 bytes. */
    @NotNull
    private byte[] batchRoot;

    /** Chain height the batch was dispersed at (uint32); basis for assignment and custody. */
    @PositiveOrZero
    private long referenceBlockNumber;
}
