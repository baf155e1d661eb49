package com.cliffc.dce.node;

import com.cliffc.dce.GraphException;
import com.cliffc.dce.util.Ary;
import com.cliffc.dce.util.VBitSet;
import org.jetbrains.annotations.NotNull;

/** Owns every node of one compilation unit.  Nodes live in an arena indexed
 *  by their dense id; an id is never reused, even after the node dies. */
public class Graph {
  private final Ary<Node> _nodes = new Ary<>(Node.class);
  public final Ops _ops;
  private Node _start, _end;

  public Graph( @NotNull Ops ops ) { _ops = ops; }

  public @NotNull Node newNode( @NotNull Operator op, Node... defs ) {
    if( defs.length != op.inputCount() )
      throw new GraphException("Operator "+op+" wants "+op.inputCount()+" inputs, given "+defs.length);
    for( Node def : defs )
      if( def != null && def.isDead() )
        throw new GraphException(def,"Input is dead");
    return _nodes.push(new Node(_nodes._len,op,defs));
  }

  public Node node( int uid ) { return _nodes.atX(uid); }
  // Count of nodes ever made, including dead ones
  public int nodeCount() { return _nodes._len; }

  public Node start() { return _start; }
  public Node end  () { return _end;   }
  public Graph setStart( Node start ) { _start = start; return this; }
  public Graph setEnd  ( Node end   ) { _end   = end;   return this; }

  // All nodes reachable from End by walking inputs.  Nodes not reachable are
  // garbage, no matter what they point at.  Order is a post-order from End:
  // inputs before users.
  public Ary<Node> reachable() {
    Ary<Node> rpo = new Ary<>(Node.class);
    if( _end != null ) _walk(_end,new VBitSet(),rpo);
    return rpo;
  }
  // Iterative post-order walk over inputs
  private static void _walk( Node root, VBitSet visit, Ary<Node> rpo ) {
    Ary<Node> stack = new Ary<>(Node.class);
    Ary<Integer> idxs = new Ary<>(Integer.class);
    visit.set(root._uid);
    stack.push(root);  idxs.push(0);
    while( !stack.isEmpty() ) {
      Node n = stack.last();
      int i = idxs.last();
      if( i < n.len() ) {
        idxs.set(idxs._len-1,i+1);
        Node def = n.in(i);
        if( def != null && !visit.tset(def._uid) ) {
          stack.push(def);  idxs.push(0);
        }
      } else {
        rpo.push(stack.pop());
        idxs.pop();
      }
    }
  }
}
