package com.cliffc.dce.opt;

import com.cliffc.dce.node.Node;

/** A reducer's verdict on one node: no change, replace the node with another,
 *  or the node was changed in place.  Consumed at once by the driver. */
public final class Reduction {
  public enum Kind { NO_CHANGE, REPLACE, CHANGED }

  private static final Reduction NO_CHANGE = new Reduction(Kind.NO_CHANGE,null);

  public final Kind _kind;
  public final Node _node;      // Replacement, or the changed node itself
  private Reduction( Kind kind, Node node ) { _kind=kind; _node=node; }

  public static Reduction noChange() { return NO_CHANGE; }
  public static Reduction replace( Node n ) { assert n!=null; return new Reduction(Kind.REPLACE,n); }
  public static Reduction changed( Node n ) { assert n!=null; return new Reduction(Kind.CHANGED,n); }

  public boolean isChanged() { return _kind != Kind.NO_CHANGE; }
  public Node replacement() { return _node; }

  @Override public String toString() {
    return switch( _kind ) {
    case NO_CHANGE -> "NoChange";
    case REPLACE   -> "Replace("+_node+")";
    case CHANGED   -> "Changed("+_node+")";
    };
  }
}
