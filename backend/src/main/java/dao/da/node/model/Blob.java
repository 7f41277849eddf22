package dao.da.node.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Blob {

    @NotNull
    @Valid
    private BlobHeader header;

    /** Parallel to header.quorumHeaders, same order. */
    @NotNull
    private List<Bundle> bundles;
}
