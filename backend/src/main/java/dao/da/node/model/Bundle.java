package dao.da.node.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * All chunks one node holds for one blob in one quorum. Chunks are opaque and equal-length.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Bundle {

    private List<byte[]> chunks = new ArrayList<>();

    @JsonIgnore
    public boolean isEmpty() {
        return chunks == null || chunks.isEmpty();
    }
}
