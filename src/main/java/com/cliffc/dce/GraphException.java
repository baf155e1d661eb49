package com.cliffc.dce;

import com.cliffc.dce.node.Node;

/** A broken graph invariant.  Never recovered from: the compilation unit is
 *  abandoned rather than emitted in a malformed state. */
public class GraphException extends RuntimeException {
  public final Node _node;      // Offending node, or null
  public GraphException( String msg ) { this(null,msg); }
  public GraphException( Node n, String msg ) {
    super(n==null ? msg : msg+": "+n);
    _node = n;
  }
}
