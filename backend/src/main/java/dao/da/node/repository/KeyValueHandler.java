package dao.da.node.repository;

@FunctionalInterface
public interface KeyValueHandler {
    // return false to stop the scan
    boolean handle(byte[] key, byte[] value);
}
