package dao.da.node.service;

import dao.da.node.exception.ValidationException;
import dao.da.node.model.BatchHeader;
import dao.da.node.model.BlobHeader;
import dao.da.node.model.BlobQuorumInfo;
import dao.da.node.util.CryptoUtil;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * ABI-encoded keccak256 digests of batch and blob headers.
 *
 * IMPORTANT: both encodings MUST match the service manager contract:
 * - ReducedBatchHeader = abi.encode(bytes32 blobHeadersRoot, uint32 referenceBlockNumber)
 * - BlobHeader = abi.encode(bytes commitment, bytes lengthProof, uint32 length,
 *   (uint8,uint32,uint32,uint32,uint32,uint32)[] quorums, string accountId)
 */
@Component
public class HeaderHasher {

    static final long UINT32_MAX = 0xFFFFFFFFL;

    public byte[] batchHeaderHash(BatchHeader header) {
        if (header == null) {
            throw new ValidationException("Missing batch header");
        }
        byte[] root = header.getBatchRoot();
        if (root == null || root.length != CryptoUtil.HASH_LENGTH) {
            throw new ValidationException("Batch root must be 32 bytes");
        }
        long ref = header.getReferenceBlockNumber();
        if (ref < 0 || ref > UINT32_MAX) {
            throw new ValidationException("Reference block number out of uint32 range: " + ref);
        }
        String encoded = TypeEncoder.encode(new Bytes32(root))
                + TypeEncoder.encode(new Uint32(BigInteger.valueOf(ref)));
        return CryptoUtil.keccak256(Numeric.hexStringToByteArray(encoded));
    }

    public byte[] blobHeaderHash(BlobHeader header) {
        List<StaticStruct> quorums = new ArrayList<>();
        for (BlobQuorumInfo q : header.getQuorumHeaders()) {
            quorums.add(new StaticStruct(
                    new Uint8(BigInteger.valueOf(q.getQuorumId())),
                    new Uint32(BigInteger.valueOf(q.getAdversaryThreshold())),
                    new Uint32(BigInteger.valueOf(q.getQuantizationFactor())),
                    new Uint32(BigInteger.valueOf(q.getEncodedBlobLength())),
                    new Uint32(BigInteger.valueOf(q.getQuorumThreshold())),
                    new Uint32(BigInteger.valueOf(q.getRatelimit()))
            ));
        }
        List<Type> params = Arrays.<Type>asList(
                new DynamicBytes(header.getCommitment()),
                new DynamicBytes(header.getLengthProof()),
                new Uint32(BigInteger.valueOf(header.getLength())),
                new DynamicArray<>(StaticStruct.class, quorums),
                new Utf8String(header.getAccountId() == null ? "" : header.getAccountId())
        );
        return CryptoUtil.keccak256(Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(params)));
    }
}
