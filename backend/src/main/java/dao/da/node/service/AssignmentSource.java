package dao.da.node.service;

import dao.da.node.model.AssignmentSnapshot;

/**
 * Supplier of operator assignment snapshots (the registry indexer in production).
 */
public interface AssignmentSource {

    AssignmentSnapshot fetch();
}
