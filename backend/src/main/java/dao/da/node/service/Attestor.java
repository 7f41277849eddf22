package dao.da.node.service;

import dao.da.node.crypto.AttestationSigner;
import dao.da.node.model.BatchHeader;
import dao.da.node.repository.DurableCommit;
import dao.da.node.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Custody attestation. Signs the batch header hash, and only against a {@link DurableCommit},
 * which the chunk store hands out after the batch is durably written.
 */
@Slf4j
@Service
public class Attestor {

    private final HeaderHasher headerHasher;
    private final AttestationSigner signer;

    public Attestor(HeaderHasher headerHasher, AttestationSigner signer) {
        this.headerHasher = headerHasher;
        this.signer = signer;
    }

    public byte[] batchHeaderHash(BatchHeader header) {
        return headerHasher.batchHeaderHash(header);
    }

    public byte[] attest(DurableCommit commit) {
        byte[] hash = commit.getBatchHeaderHash();
        byte[] signature = signer.sign(hash);
        log.debug("Attested batch {} (newlyWritten={})", CryptoUtil.toHex0x(hash), commit.isNewlyWritten());
        return signature;
    }

    public String signerAddress() {
        return signer.signerAddress();
    }
}
