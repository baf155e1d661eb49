package com.cliffc.dce.opt;

import com.cliffc.dce.node.Node;

// A per-node graph rewrite, driven to a fixpoint by a GraphReducer.
public interface Reducer {
  // Name for tracing
  String name();

  // Try to reduce 'n'.  Must return NoChange for a node already at its
  // fixpoint, else the driver never terminates.
  Reduction reduce( Node n );
}
