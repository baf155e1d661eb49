package com.cliffc.dce.opt;

import com.cliffc.dce.GraphException;
import com.cliffc.dce.node.Graph;
import com.cliffc.dce.node.Node;
import com.cliffc.dce.node.Op;
import org.jetbrains.annotations.NotNull;

// Structural graph checks, run around a reduce when DCE.VERIFY is set.
// Throws GraphException naming the first broken node.
public abstract class GraphVerifier {

  // Every reachable node has its operator's input count, def and use edges
  // agree, sentinels have no inputs, and every Phi or EffectPhi has one
  // input per path of its Merge or Loop.
  public static void verify( @NotNull Graph g ) {
    for( Node n : g.reachable() ) {
      if( n.len() != n.op().inputCount() )
        throw new GraphException(n,"Has "+n.len()+" inputs, operator wants "+n.op().inputCount());
      for( int i=0; i<n.len(); i++ ) {
        Node def = n.in(i);
        if( def == null ) throw new GraphException(n,"Missing input "+i);
        if( def.isDead() ) throw new GraphException(n,"Input "+i+" is killed");
        int edges = 0;
        for( int j=0; j<n.len(); j++ ) if( n.in(j)==def ) edges++;
        if( def.countUse(n) != edges )
          throw new GraphException(n,"Def/use mismatch with "+def);
      }
      for( Node use : n.uses() )
        if( use.findDef(n) == -1 )
          throw new GraphException(n,"Use "+use+" has no edge back");
      Op op = n.opcode();
      if( (op == Op.DEAD || op == Op.DEAD_VALUE) && n.len() != 0 )
        throw new GraphException(n,"Sentinel with inputs");
      if( op.isPhi() ) {
        Node merge = n.controlInput();
        if( merge.opcode() == Op.DEAD ) continue; // Pending removal
        if( !merge.opcode().isMerge() )
          throw new GraphException(n,"Control is not a Merge or Loop: "+merge);
        if( n.len() != merge.len()+1 )
          throw new GraphException(n,"Phi arity does not match "+merge);
      }
    }
  }

  // A reduced graph additionally has no reachable node with a Dead control
  // input; such nodes should have been folded away.
  public static void verifyFixpoint( @NotNull Graph g ) {
    verify(g);
    for( Node n : g.reachable() ) {
      if( n.opcode() == Op.DEAD ) continue;
      for( int i=0; i<n.op()._cin; i++ )
        if( n.controlInput(i).opcode() == Op.DEAD )
          throw new GraphException(n,"Dead control input survived reduction");
    }
  }
}
