package dao.da.node.exception;

public class BlobIndexOutOfRangeException extends NotFoundException {

    public BlobIndexOutOfRangeException(int index, int blobCount) {
        super(Reason.UNKNOWN, "Blob index " + index + " out of range, batch has " + blobCount + " blobs");
    }
}
