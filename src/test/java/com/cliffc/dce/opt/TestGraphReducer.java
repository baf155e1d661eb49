package com.cliffc.dce.opt;

import com.cliffc.dce.DCE;
import com.cliffc.dce.GraphException;
import com.cliffc.dce.node.*;
import com.cliffc.dce.type.Type;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.contrib.java.lang.system.SystemErrRule;

import static org.junit.Assert.*;

// Whole-graph runs to a fixpoint.
public class TestGraphReducer {
  @Rule public final SystemErrRule sysErr = new SystemErrRule().enableLog().muteForSuccessfulTests();
  @After public void reset() { DCE.reset(); }

  private Ops _ops;
  private Graph _g;
  private Node _start, _p0, _p1, _cond, _ret;

  // A diamond on a condition that can never be computed:
  //   cond = p0 < NONE
  //   if( cond ) ... else ...
  //   return phi(p0,p1)
  private Graph diamond() {
    _ops = new Ops();
    _g = new Graph(_ops);
    _start = _g.newNode(_ops.start(2));
    _g.setStart(_start);
    _p0 = _g.newNode(_ops.parameter(0),_start);
    _p1 = _g.newNode(_ops.parameter(1),_start);
    Node never = _g.newNode(_ops.int32Constant(1)).setType(Type.NONE);
    _cond = _g.newNode(_ops.int32LessThan(),_p0,never);
    Node br = _g.newNode(_ops.branch(),_cond,_start);
    Node t = _g.newNode(_ops.ifTrue (),br);
    Node f = _g.newNode(_ops.ifFalse(),br);
    Node merge = _g.newNode(_ops.merge(2),t,f);
    Node phi = _g.newNode(_ops.phi(Rep.WORD32,2),_p0,_p1,merge);
    _ret = _g.newNode(_ops.ret(1),phi,_start,merge);
    _g.setEnd(_g.newNode(_ops.end(1),_ret));
    return _g;
  }

  private static void assertNoDeadReachable( Graph g ) {
    for( Node n : g.reachable() ) {
      assertFalse(n.isDead());
      assertNotEquals(Op.DEAD,n.opcode());
      assertNotEquals(Op.DEAD_VALUE,n.opcode());
    }
  }

  @Test public void testDiamond() {
    diamond();
    DeadCodeElimination.run(_g);
    // The true arm is taken, the merge and phi are gone
    assertSame(_ret,_g.end().in(0));
    assertEquals(Op.RETURN,_ret.opcode());
    assertSame(_p0,_ret.in(0));
    assertSame(_start,_ret.effectInput());
    assertSame(_start,_ret.controlInput());
    assertEquals(4,_g.reachable().len()); // Start, Parameter, Return, End
    assertNoDeadReachable(_g);
  }

  // Worklist order does not change the result
  @Test public void testSeeds() {
    for( int seed : new int[]{0,1,7,123457} ) {
      DCE.RSEED = seed;
      diamond();
      DeadCodeElimination.run(_g);
      assertSame(_p0,_ret.in(0));
      assertSame(_start,_ret.controlInput());
      assertEquals(4,_g.reachable().len());
    }
  }

  @Test public void testIdempotent() {
    diamond();
    DeadCodeElimination dce = DeadCodeElimination.run(_g);
    for( Node n : _g.reachable() )
      assertFalse(n.toString(),dce.reduce(n).isChanged());
    String before = DCE.p(_g);
    GraphReducer gr = new GraphReducer(_g);
    DeadCodeElimination dce2 = new DeadCodeElimination(gr,_g,_ops);
    gr.addReducer(dce2).setDead(dce2.dead());
    gr.reduceGraph();
    assertEquals(gr.iters(),gr.noops());
    assertEquals(before,DCE.p(_g));
  }

  // A call on a dead target: normal exit survives as a Throw, exceptional
  // exit drops off End.
  @Test public void testCall() {
    Ops ops = new Ops();
    Graph g = new Graph(ops);
    Node start = g.newNode(ops.start(0));
    g.setStart(start);
    Node never = g.newNode(ops.int32Constant(0)).setType(Type.NONE);
    Node target = g.newNode(ops.int32Add(),never,never);
    Node call = g.newNode(ops.call(0),target,start,start);
    Node ifs = g.newNode(ops.ifSuccess(),call);
    Node ife = g.newNode(ops.ifException(),call,call);
    Node ret1 = g.newNode(ops.ret(1),call,call,ifs);
    Node ret2 = g.newNode(ops.ret(1),ife,ife,ife);
    Node end = g.newNode(ops.end(2),ret1,ret2);
    g.setEnd(end);
    DeadCodeElimination.run(g);

    assertSame(end,g.end());
    assertEquals(1,end.len());
    assertSame(ret1,end.in(0));
    assertEquals(Op.THROW,ret1.opcode());
    Node unr = ret1.in(0);
    assertEquals(Op.UNREACHABLE,unr.opcode());
    assertSame(start,unr.effectInput());
    assertSame(start,unr.controlInput());
    assertSame(start,ret1.controlInput());
    assertTrue(call.isDead());
    assertTrue(ifs .isDead());
    assertTrue(ife .isDead());
    assertTrue(ret2.isDead());
  }

  @Test public void testEndDies() {
    Ops ops = new Ops();
    Graph g = new Graph(ops);
    g.setStart(g.newNode(ops.start(0)));
    GraphReducer gr = new GraphReducer(g);
    DeadCodeElimination dce = new DeadCodeElimination(gr,g,ops);
    gr.addReducer(dce).setDead(dce.dead());
    Node end = g.newNode(ops.end(2),dce.dead(),dce.dead());
    g.setEnd(end);
    gr.reduceGraph();
    assertSame(dce.dead(),g.end());
    assertTrue(end.isDead());
  }

  @Test public void testReduceNode() {
    diamond();
    GraphReducer gr = new GraphReducer(_g);
    DeadCodeElimination dce = new DeadCodeElimination(gr,_g,_ops);
    gr.addReducer(dce).setDead(dce.dead());
    gr.reduceNode(_cond);
    assertTrue(_cond.isDead());
    // Users of the replaced node were revisited, all the way down
    assertSame(_p0,_ret.in(0));
    assertSame(_start,_ret.controlInput());
  }

  @Test public void testTrace() {
    DCE.TRACE = true;
    diamond();
    String cond = _cond.toString();
    DeadCodeElimination.run(_g);
    String log = sysErr.getLog();
    assertTrue(log, log.contains("- Replacement of "+cond+" by "));
    assertTrue(log, log.contains("(DeadCodeElimination)"));
  }

  @Test public void testQuiet() {
    diamond();
    DeadCodeElimination.run(_g);
    assertTrue(sysErr.getLog().isEmpty());
  }

  @Test public void testMaxIters() {
    DCE.MAX_ITERS = 1;
    diamond();
    try {
      DeadCodeElimination.run(_g);
      fail();
    } catch( GraphException e ) {
      assertTrue(e.getMessage().startsWith("No fixpoint after 1 reductions"));
    }
  }

  // Reducers run in order; one that never fires costs nothing
  @Test public void testReducerChain() {
    diamond();
    GraphReducer gr = new GraphReducer(_g);
    Reducer idle = new Reducer() {
        @Override public String name() { return "Idle"; }
        @Override public Reduction reduce( Node n ) { return Reduction.noChange(); }
      };
    DeadCodeElimination dce = new DeadCodeElimination(gr,_g,_ops);
    gr.addReducer(idle).addReducer(dce).setDead(dce.dead());
    gr.reduceGraph();
    assertSame(_p0,_ret.in(0));
    assertTrue(gr.iters() > gr.noops());
  }
}
