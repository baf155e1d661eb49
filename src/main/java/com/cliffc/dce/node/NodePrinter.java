package com.cliffc.dce.node;

import com.cliffc.dce.util.Ary;
import com.cliffc.dce.util.SB;

// Sea-of-Nodes
public abstract class NodePrinter {

  // Bulk printer: every reachable node, inputs before users, one per line.
  public static String prettyPrint( Graph g ) {
    return _pp(g.reachable(), new SB()).toString();
  }

  // Just the one node and its direct inputs
  public static String prettyPrint( Node n ) {
    SB sb = new SB();
    for( Node def : n.defs() )
      if( def!=null ) def._printLine(sb);
    return n._printLine(sb).toString();
  }

  static SB _pp( Ary<Node> rpo, SB sb ) {
    boolean gap=false;
    for( Node n : rpo ) {
      boolean head = n.opcode().isMerge() || n.opcode()==Op.START;
      if( head && !gap ) sb.nl(); // Blank before a block head
      n._printLine(sb);
      gap = head;
    }
    return sb;
  }
}
