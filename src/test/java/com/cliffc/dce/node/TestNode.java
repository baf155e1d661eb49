package com.cliffc.dce.node;

import com.cliffc.dce.GraphException;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestNode {
  private final Ops _ops = new Ops();
  private final Graph _g = new Graph(_ops);
  private final Node _start = _g.newNode(_ops.start(2));
  private final Node _p0 = _g.newNode(_ops.parameter(0),_start);
  private final Node _p1 = _g.newNode(_ops.parameter(1),_start);

  @Test public void testEdges() {
    Node add = _g.newNode(_ops.int32Add(),_p0,_p0);
    assertEquals(2,_p0.countUse(add));
    add.setDef(1,_p1);
    assertEquals(1,_p0.countUse(add));
    assertEquals(1,_p1.countUse(add));
    assertSame(_p1,add.in(1));
    assertEquals(1,add.findDef(_p1));
    assertEquals(-1,add.findDef(_start));
    // Setting the same def is a no-op
    add.setDef(1,_p1);
    assertEquals(1,_p1.countUse(add));
  }

  // Loops are built open and closed later
  @Test public void testAddDef() {
    Node loop = _g.newNode(_ops.loop(1),_start);
    loop.addDef(null);
    assertEquals(2,loop.len());
    assertNull(loop.in(1));
    loop.setDef(1,loop);
    assertSame(loop,loop.last());
    assertEquals(1,loop.countUse(loop));
    assertEquals(1,loop.nUses());
    loop.setOp(_ops.loop(2));
    assertEquals(2,loop.op()._cin);
    assertTrue(NodePrinter.prettyPrint(loop).contains("Loop[2]"));
  }

  @Test public void testSegments() {
    Node ret = _g.newNode(_ops.ret(2),_p0,_p1,_start,_start);
    assertSame(_p1,ret.valueInput(1));
    assertSame(_start,ret.effectInput());
    assertSame(_start,ret.controlInput());
    assertTrue (ret.isValueEdge(1));
    assertTrue (ret.isEffectEdge(2));
    assertTrue (ret.isControlEdge(3));
    assertFalse(ret.isControlEdge(2));
  }

  @Test public void testReplaceUses() {
    Node add = _g.newNode(_ops.int32Add(),_p0,_p0);
    Node lt  = _g.newNode(_ops.int32LessThan(),_p0,_p1);
    _p0.replaceUses(_p1);
    assertEquals(0,_p0.nUses());
    assertSame(_p1,add.in(0));
    assertSame(_p1,add.in(1));
    assertSame(_p1,lt .in(0));
    assertEquals(2,_p1.countUse(add));
    assertEquals(2,_p1.countUse(lt));
  }

  @Test public void testKill() {
    Node add = _g.newNode(_ops.int32Add(),_p0,_p1);
    add.kill();
    assertTrue(add.isDead());
    assertEquals(-1,_p0.findUse(add));
    assertEquals(-1,_p1.findUse(add));
    assertFalse(_p0.isDead());
    try {
      _g.newNode(_ops.int32Add(),add,_p0);
      fail();
    } catch( GraphException e ) {
      assertSame(add,e._node);
    }
  }

  @Test public void testTrimAndSetOp() {
    Node merge = _g.newNode(_ops.merge(3),_start,_start,_start);
    assertEquals(3,_start.countUse(merge));
    merge.trimInputCount(2);
    assertEquals(2,_start.countUse(merge));
    try {
      merge.setOp(_ops.merge(3));
      fail();
    } catch( GraphException e ) {
      assertSame(merge,e._node);
    }
    merge.setOp(_ops.merge(2));
    assertSame(_ops.merge(2),merge.op());
    assertEquals("#"+merge._uid+":Merge[2]",merge.toString());
  }

  @Test public void testControlProjections() {
    Node br = _g.newNode(_ops.branch(),_p0,_start);
    Node f = _g.newNode(_ops.ifFalse(),br);
    Node t = _g.newNode(_ops.ifTrue (),br);
    Node[] projs = NodeProps.collectControlProjections(br);
    assertSame(t,projs[0]);
    assertSame(f,projs[1]);
    _g.newNode(_ops.ifTrue(),br);
    try {
      NodeProps.collectControlProjections(br);
      fail();
    } catch( GraphException e ) {
      assertEquals(Op.IF_TRUE,e._node.opcode());
    }
  }

  @Test public void testNewNodeArity() {
    try {
      _g.newNode(_ops.int32Add(),_p0);
      fail();
    } catch( GraphException e ) {
      assertNull(e._node);
    }
    assertSame(_p1,_g.node(_p1._uid));
    assertEquals(3,_g.nodeCount());
  }
}
