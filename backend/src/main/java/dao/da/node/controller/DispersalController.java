package dao.da.node.controller;

import dao.da.node.model.StoreChunksReply;
import dao.da.node.model.StoreChunksRequest;
import dao.da.node.service.DispersalService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/dispersal")
public class DispersalController {

    private final DispersalService dispersalService;

    public DispersalController(DispersalService dispersalService) {
        this.dispersalService = dispersalService;
    }

    /**
     * POST /api/dispersal/chunks
     * Validate, verify and persist this node's share of a batch, then return the attestation.
     */
    @PostMapping("/chunks")
    public ResponseEntity<StoreChunksReply> storeChunks(@Valid @RequestBody StoreChunksRequest req) {
        byte[] signature = dispersalService.storeChunks(req.getBatchHeader(), req.getBlobs());
        return ResponseEntity.ok(new StoreChunksReply(signature));
    }
}
