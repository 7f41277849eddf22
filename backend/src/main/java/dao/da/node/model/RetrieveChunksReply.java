package dao.da.node.model;

import java.util.List;

public record RetrieveChunksReply(List<byte[]> chunks) {
}
