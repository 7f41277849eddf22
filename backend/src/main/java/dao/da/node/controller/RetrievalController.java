package dao.da.node.controller;

import dao.da.node.exception.ValidationException;
import dao.da.node.model.BlobHeaderProof;
import dao.da.node.model.RetrieveChunksReply;
import dao.da.node.service.RetrievalService;
import dao.da.node.util.CryptoUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/retrieval")
public class RetrievalController {

    private final RetrievalService retrievalService;

    public RetrievalController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    /**
     * GET /api/retrieval/chunks?batchHeaderHash=0x..&blobIndex=0&quorumId=0
     */
    @GetMapping("/chunks")
    public ResponseEntity<RetrieveChunksReply> retrieveChunks(@RequestParam String batchHeaderHash,
                                                              @RequestParam int blobIndex,
                                                              @RequestParam int quorumId) {
        byte[] hash = parseHash(batchHeaderHash);
        return ResponseEntity.ok(new RetrieveChunksReply(retrievalService.retrieveChunks(hash, blobIndex, quorumId)));
    }

    /**
     * GET /api/retrieval/blob-header?batchHeaderHash=0x..&blobIndex=0&quorumId=0
     * Blob header plus its inclusion proof against the batch root.
     */
    @GetMapping("/blob-header")
    public ResponseEntity<BlobHeaderProof> getBlobHeader(@RequestParam String batchHeaderHash,
                                                         @RequestParam int blobIndex,
                                                         @RequestParam int quorumId) {
        byte[] hash = parseHash(batchHeaderHash);
        return ResponseEntity.ok(retrievalService.getBlobHeader(hash, blobIndex, quorumId));
    }

    private static byte[] parseHash(String hex) {
        try {
            return CryptoUtil.fromHex(hex);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Batch header hash is not valid hex: " + hex, e);
        }
    }
}
