package dao.da.node.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BlobQuorumInfo {

    private int quorumId;            // [0, 255]
    private int adversaryThreshold;  // percent
    private int quantizationFactor;
    private long encodedBlobLength;  // symbols
    private int quorumThreshold;     // percent
    private long ratelimit;
}
