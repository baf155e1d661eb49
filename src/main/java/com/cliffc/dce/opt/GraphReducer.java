package com.cliffc.dce.opt;

import com.cliffc.dce.DCE;
import com.cliffc.dce.GraphException;
import com.cliffc.dce.node.Graph;
import com.cliffc.dce.node.Node;
import com.cliffc.dce.node.Op;
import com.cliffc.dce.util.Ary;
import com.cliffc.dce.util.SB;
import com.cliffc.dce.util.Work;
import org.jetbrains.annotations.NotNull;

/** Drives a set of Reducers to a fixpoint over a Graph.
 *
 *  Nodes sit on a worklist which filters duplicates and pops in a
 *  pseudo-random but seeded order, see {@link DCE#RSEED}.  Whenever a node
 *  is replaced or changed in place, its users go back on the worklist.  The
 *  fixpoint is reached when the worklist empties.
 */
public class GraphReducer implements Editor {
  private final Graph _graph;
  private final Ary<Reducer> _reducers = new Ary<>(Reducer.class);
  private final Work<Node> _work = new Work<>("reduce",DCE.RSEED);
  // Target for control users that must die, e.g. IfException of a dead call
  private Node _dead;

  // Reduce profiling
  int _iters, _noops;
  public int iters() { return _iters; }
  public int noops() { return _noops; }

  public GraphReducer( @NotNull Graph graph ) { _graph = graph; }

  public GraphReducer addReducer( @NotNull Reducer r ) { _reducers.push(r); return this; }
  // Dead control sentinel used by replaceWithValue
  public GraphReducer setDead( Node dead ) { _dead = dead; return this; }

  // Reduce everything reachable from End, to a fixpoint.
  public void reduceGraph() {
    if( DCE.VERIFY ) GraphVerifier.verify(_graph);
    _work.addAll(_graph.reachable());
    iter();
    if( DCE.VERIFY ) GraphVerifier.verifyFixpoint(_graph);
  }

  // Reduce starting from one node, to a fixpoint.
  public void reduceNode( @NotNull Node n ) {
    _work.add(n);
    iter();
  }

  // Empty the worklist.
  private void iter() {
    int cnt = 0;
    Node n;
    while( (n=_work.pop()) != null ) {
      if( n.isDead() ) continue;
      if( ++cnt > DCE.MAX_ITERS )
        throw new GraphException(n,"No fixpoint after "+DCE.MAX_ITERS+" reductions");
      Reduction r = reduce(n);
      if( !r.isChanged() ) { _noops++; continue; }
      Node x = r.replacement();
      if( x == n ) {
        if( n.isDead() ) continue;
        trace("In-place update of",n,null);
        // Revisit the node and its users; pick up any freshly made inputs
        _work.add(n);
        for( Node def : n.defs() ) if( def != null ) _work.add(def);
        for( Node use : n.uses() ) if( use != n ) _work.add(use);
      } else {
        trace("Replacement of",n,x);
        replace(n,x);
        _work.add(x);
      }
    }
    _iters += cnt;
  }

  // Run all reducers in order.  An in-place change keeps going with the
  // rest; a replacement ends the round.
  private Reduction reduce( Node n ) {
    boolean changed = false;
    for( Reducer red : _reducers ) {
      Reduction r = red.reduce(n);
      if( !r.isChanged() ) continue;
      _who = red;
      if( r.replacement() != n ) return r;
      changed = true;
    }
    return changed ? Reduction.changed(n) : Reduction.noChange();
  }
  private Reducer _who;         // Last reducer to make progress, for tracing

  // --------------------------------------------------------------------------
  // Editor

  @Override public void replace( Node node, Node replacement ) {
    if( node == replacement || node.isDead() ) return;
    for( Node use : node.uses() ) if( use != node ) _work.add(use);
    node.replaceUses(replacement);
    if( _graph.start() == node ) _graph.setStart(replacement);
    if( _graph.end  () == node ) _graph.setEnd  (replacement);
    node.kill();
  }

  @Override public void revisit( Node node ) { _work.add(node); }

  @Override public void replaceWithValue( Node node, Node value, Node effect, Node control ) {
    if( effect  == null && node.op()._ein > 0 ) effect  = node.effectInput ();
    if( control == null && node.op()._cin > 0 ) control = node.controlInput();
    for( Node user : node.uses() ) {
      if( user.isDead() ) continue;   // Killed by an earlier IfSuccess replace
      for( int i=0; i<user.len(); i++ ) {
        if( user.in(i) != node ) continue;
        if( user.isControlEdge(i) ) {
          if( user.opcode() == Op.IF_SUCCESS ) {
            replace(user,control);
            break;
          } else if( user.opcode() == Op.IF_EXCEPTION ) {
            if( _dead == null ) throw new GraphException(user,"No Dead sentinel to kill the exception path");
            user.setDef(i,_dead);
          } else {
            if( control == null ) throw new GraphException(user,"No control to rewire to");
            user.setDef(i,control);
          }
        } else if( user.isEffectEdge(i) ) {
          if( effect == null ) throw new GraphException(user,"No effect to rewire to");
          user.setDef(i,effect);
        } else {
          user.setDef(i,value);
        }
        _work.add(user);
      }
    }
  }

  // --------------------------------------------------------------------------
  private void trace( String what, Node n, Node x ) {
    if( !DCE.TRACE ) return;
    SB sb = new SB().p("- ").p(what).p(' ').p(n.toString());
    if( x != null ) sb.p(" by ").p(x.toString());
    sb.p(" (").p(_who.name()).p(')');
    System.err.println(sb);
  }
}
