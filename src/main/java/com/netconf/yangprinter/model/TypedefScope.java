package com.netconf.yangprinter.model;

import java.util.List;

/**
 * Nodes that may declare typedefs local to their subtree.
 */
public interface TypedefScope {

    List<Typedef> getTypedefs();
}
