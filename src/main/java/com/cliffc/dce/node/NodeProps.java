package com.cliffc.dce.node;

import com.cliffc.dce.GraphException;

// Structural queries over nodes.
public abstract class NodeProps {

  // The control projections of a fork, in canonical order:
  //   Branch: IfTrue, IfFalse
  //   Switch: IfValue by comparison order, then IfDefault
  //   Call  : IfSuccess, IfException
  // Every slot must be filled.
  public static Node[] collectControlProjections( Node fork ) {
    int cnt = fork.op()._cout;
    Node[] projs = new Node[cnt];
    for( Node use : fork.uses() ) {
      int idx = switch( use.opcode() ) {
      case IF_TRUE, IF_SUCCESS -> 0;
      case IF_FALSE, IF_EXCEPTION -> 1;
      case IF_VALUE -> use.op()._aux;
      case IF_DEFAULT -> cnt-1;
      default -> -1;
      };
      if( idx == -1 ) continue;    // Not a control projection, e.g. a value use of a Call
      if( use.controlInput() != fork ) continue; // e.g. IfException on the effect edge
      if( idx >= cnt || projs[idx] != null )
        throw new GraphException(use,"Duplicate or out of range projection of "+fork);
      projs[idx] = use;
    }
    for( int i=0; i<cnt; i++ )
      if( projs[i]==null )
        throw new GraphException(fork,"Missing control projection "+i);
    return projs;
  }
}
