package dao.da.node.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoreChunksRequest {

    @NotNull
    @Valid
    private BatchHeader batchHeader;

    @NotEmpty
    private List<@Valid Blob> blobs;
}
